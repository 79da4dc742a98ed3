// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.qtree.catalog;

import com.google.common.base.Preconditions;

/**
 * Nullable(T): the values of T plus NULL. Nullable cannot nest another
 * Nullable or a LowCardinality type.
 */
public class NullableType extends DataType {
  private final DataType nested_;

  public NullableType(DataType nested) {
    Preconditions.checkNotNull(nested);
    Preconditions.checkArgument(!nested.isNullable(),
        "Nested type %s cannot be inside Nullable type", nested);
    Preconditions.checkArgument(!nested.isLowCardinality(),
        "Nested type %s cannot be inside Nullable type", nested);
    nested_ = nested;
  }

  public DataType getNestedType() { return nested_; }

  @Override
  public boolean isNullable() { return true; }

  @Override
  public String getName() { return "Nullable(" + nested_.getName() + ")"; }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof NullableType)) return false;
    return nested_.equals(((NullableType) obj).nested_);
  }

  @Override
  public int hashCode() { return 31 * nested_.hashCode() + 1; }
}

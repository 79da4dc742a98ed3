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

package org.qtree.planner;

import org.qtree.catalog.DataType;

import com.google.common.base.Preconditions;

/**
 * Named, typed column of a {@link Block} header.
 */
public class ColumnWithTypeAndName {
  private final String name_;
  private final DataType type_;

  public ColumnWithTypeAndName(String name, DataType type) {
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(type);
    name_ = name;
    type_ = type;
  }

  public String getName() { return name_; }
  public DataType getType() { return type_; }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof ColumnWithTypeAndName)) return false;
    ColumnWithTypeAndName other = (ColumnWithTypeAndName) obj;
    return name_.equals(other.name_) && type_.equals(other.type_);
  }

  @Override
  public int hashCode() { return 31 * name_.hashCode() + type_.hashCode(); }

  @Override
  public String toString() { return name_ + " " + type_.getName(); }
}

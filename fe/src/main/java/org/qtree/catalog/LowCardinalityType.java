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
 * LowCardinality(T): dictionary-encoded storage of T. The logical values
 * are those of T, so the wrapper can be removed when comparing types.
 */
public class LowCardinalityType extends DataType {
  private final DataType dictionaryType_;

  public LowCardinalityType(DataType dictionaryType) {
    Preconditions.checkNotNull(dictionaryType);
    Preconditions.checkArgument(!dictionaryType.isLowCardinality(),
        "LowCardinality cannot nest LowCardinality: %s", dictionaryType);
    dictionaryType_ = dictionaryType;
  }

  public DataType getDictionaryType() { return dictionaryType_; }

  @Override
  public boolean isLowCardinality() { return true; }

  @Override
  public boolean isNullable() { return dictionaryType_.isNullable(); }

  @Override
  public String getName() {
    return "LowCardinality(" + dictionaryType_.getName() + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof LowCardinalityType)) return false;
    return dictionaryType_.equals(((LowCardinalityType) obj).dictionaryType_);
  }

  @Override
  public int hashCode() { return 31 * dictionaryType_.hashCode() + 2; }
}

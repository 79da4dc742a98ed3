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

/**
 * Static helpers to construct and strip wrapper types.
 */
public class DataTypes {

  /**
   * Makes the type nullable. Nullable goes inside LowCardinality:
   * nullable(LowCardinality(T)) is LowCardinality(Nullable(T)).
   */
  public static DataType nullable(DataType type) {
    if (type.isNullable()) return type;
    if (type instanceof LowCardinalityType) {
      return new LowCardinalityType(
          nullable(((LowCardinalityType) type).getDictionaryType()));
    }
    return new NullableType(type);
  }

  public static DataType lowCardinality(DataType type) {
    return type.isLowCardinality() ? type : new LowCardinalityType(type);
  }

  public static DataType array(DataType type) {
    return new ArrayType(type);
  }

  /**
   * Removes a top-level Nullable wrapper, if any. LowCardinality(Nullable(T))
   * is left unchanged since the Nullable is not at the top.
   */
  public static DataType removeNullable(DataType type) {
    if (type instanceof NullableType) {
      return ((NullableType) type).getNestedType();
    }
    return type;
  }

  /**
   * Removes LowCardinality at every nesting level, including inside arrays
   * and Nullable.
   */
  public static DataType recursiveRemoveLowCardinality(DataType type) {
    if (type instanceof LowCardinalityType) {
      return recursiveRemoveLowCardinality(
          ((LowCardinalityType) type).getDictionaryType());
    }
    if (type instanceof NullableType) {
      DataType nested = ((NullableType) type).getNestedType();
      DataType stripped = recursiveRemoveLowCardinality(nested);
      return stripped == nested ? type : nullable(stripped);
    }
    if (type instanceof ArrayType) {
      DataType item = ((ArrayType) type).getItemType();
      DataType stripped = recursiveRemoveLowCardinality(item);
      return stripped == item ? type : new ArrayType(stripped);
    }
    return type;
  }

  private DataTypes() {}
}

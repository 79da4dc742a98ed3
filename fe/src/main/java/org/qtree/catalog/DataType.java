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
 * Column data type. Types are values: two instances describing the same type
 * are {@link #equals(Object)}. Wrapper types (Nullable, LowCardinality,
 * Array) nest another type.
 */
public abstract class DataType {

  /**
   * Returns the name of the type as it appears in error messages,
   * such as <code>Nullable(Int64)</code>.
   */
  public abstract String getName();

  public boolean isNullable() { return false; }
  public boolean isLowCardinality() { return false; }

  @Override
  public String toString() { return getName(); }
}

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
 * Non-composite type identified only by its name.
 */
public class PrimitiveType extends DataType {
  public static final PrimitiveType INT8 = new PrimitiveType("Int8");
  public static final PrimitiveType INT16 = new PrimitiveType("Int16");
  public static final PrimitiveType INT32 = new PrimitiveType("Int32");
  public static final PrimitiveType INT64 = new PrimitiveType("Int64");
  public static final PrimitiveType UINT8 = new PrimitiveType("UInt8");
  public static final PrimitiveType UINT16 = new PrimitiveType("UInt16");
  public static final PrimitiveType UINT32 = new PrimitiveType("UInt32");
  public static final PrimitiveType UINT64 = new PrimitiveType("UInt64");
  public static final PrimitiveType FLOAT32 = new PrimitiveType("Float32");
  public static final PrimitiveType FLOAT64 = new PrimitiveType("Float64");
  public static final PrimitiveType STRING = new PrimitiveType("String");
  public static final PrimitiveType DATE = new PrimitiveType("Date");
  public static final PrimitiveType DATE_TIME = new PrimitiveType("DateTime");
  public static final PrimitiveType UUID = new PrimitiveType("UUID");

  private final String name_;

  private PrimitiveType(String name) {
    Preconditions.checkNotNull(name);
    name_ = name;
  }

  @Override
  public String getName() { return name_; }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof PrimitiveType)) return false;
    return name_.equals(((PrimitiveType) obj).name_);
  }

  @Override
  public int hashCode() { return name_.hashCode(); }
}

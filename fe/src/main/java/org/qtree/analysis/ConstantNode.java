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

package org.qtree.analysis;

import java.util.Objects;

import org.qtree.catalog.DataType;

import com.google.common.base.Preconditions;

public class ConstantNode extends QueryTreeNode {
  private final Object value_;
  private final DataType type_;

  public ConstantNode(Object value, DataType type) {
    super(0);
    Preconditions.checkNotNull(type);
    value_ = value;
    type_ = type;
  }

  public Object getValue() { return value_; }
  public DataType getResultType() { return type_; }

  /**
   * True if this constant is the given numeric value, regardless of the
   * Java boxed type used to hold it.
   */
  public boolean isNumber(long value) {
    if (!(value_ instanceof Number)) return false;
    Number number = (Number) value_;
    return number.doubleValue() == value && number.longValue() == value;
  }

  @Override
  public QueryTreeNodeType getNodeType() { return QueryTreeNodeType.CONSTANT; }

  @Override
  public String describe() {
    return super.describe() + " " + Objects.toString(value_) + " :: " + type_.getName();
  }
}

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

import org.qtree.catalog.DataType;

import com.google.common.base.Preconditions;

/**
 * Reference to a column. The single slot optionally holds the expression
 * that computes the column (for a column of a subquery or an alias); it is
 * empty for a column read directly from a table.
 */
public class ColumnNode extends QueryTreeNode {
  public static final int EXPRESSION_CHILD_INDEX = 0;

  private final String name_;
  private final DataType type_;

  public ColumnNode(String name, DataType type, QueryTreeNode expression) {
    super(1);
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(type);
    name_ = name;
    type_ = type;
    children_.set(EXPRESSION_CHILD_INDEX, expression);
  }

  public ColumnNode(String name, DataType type) {
    this(name, type, null);
  }

  public String getColumnName() { return name_; }
  public DataType getColumnType() { return type_; }
  public QueryTreeNode getExpression() { return children_.get(EXPRESSION_CHILD_INDEX); }
  public boolean hasExpression() { return getExpression() != null; }

  @Override
  public QueryTreeNodeType getNodeType() { return QueryTreeNodeType.COLUMN; }

  @Override
  public String describe() {
    return super.describe() + " " + name_ + " :: " + type_.getName();
  }
}

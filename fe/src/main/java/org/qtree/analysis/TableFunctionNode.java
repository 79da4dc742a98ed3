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

import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Table function in the FROM clause, such as <code>numbers(10)</code>.
 * Each argument occupies one child slot.
 *
 * Some arguments cannot be resolved until the table function itself is
 * executed (for example, a structure description which only makes sense to
 * the function). The indexes of those arguments are recorded so that generic
 * passes leave their subtrees alone.
 */
public class TableFunctionNode extends QueryTreeNode {
  private final String name_;
  private final ImmutableSet<Integer> unresolvedArgumentIndexes_;

  public TableFunctionNode(String name, List<? extends QueryTreeNode> arguments,
      Set<Integer> unresolvedArgumentIndexes) {
    super(arguments);
    Preconditions.checkNotNull(name);
    for (int index : unresolvedArgumentIndexes) {
      Preconditions.checkElementIndex(index, arguments.size(),
          "unresolved argument index");
    }
    name_ = name;
    unresolvedArgumentIndexes_ = ImmutableSet.copyOf(unresolvedArgumentIndexes);
  }

  public TableFunctionNode(String name, List<? extends QueryTreeNode> arguments) {
    this(name, arguments, ImmutableSet.<Integer>of());
  }

  public String getTableFunctionName() { return name_; }

  public Set<Integer> getUnresolvedArgumentIndexes() {
    return unresolvedArgumentIndexes_;
  }

  public boolean isArgumentUnresolved(int index) {
    return unresolvedArgumentIndexes_.contains(index);
  }

  @Override
  public QueryTreeNodeType getNodeType() { return QueryTreeNodeType.TABLE_FUNCTION; }

  @Override
  public String describe() { return super.describe() + " " + name_; }
}

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

import java.util.Arrays;
import java.util.List;

import org.qtree.catalog.DataType;

import com.google.common.base.Preconditions;

/**
 * Function call. The arguments are held in a single {@link ListNode} slot.
 * The name and aggregate flag are mutable so that rewrite passes can replace
 * one function with another in place.
 */
public class FunctionNode extends QueryTreeNode {
  public static final int ARGUMENTS_CHILD_INDEX = 0;

  private String name_;
  private boolean isAggregate_;
  private DataType resultType_;

  public FunctionNode(String name, boolean isAggregate,
      List<? extends QueryTreeNode> arguments) {
    super(1);
    Preconditions.checkNotNull(name);
    name_ = name;
    isAggregate_ = isAggregate;
    children_.set(ARGUMENTS_CHILD_INDEX, new ListNode(arguments));
  }

  public static FunctionNode ordinary(String name, QueryTreeNode... arguments) {
    return new FunctionNode(name, false, Arrays.asList(arguments));
  }

  public static FunctionNode aggregate(String name, QueryTreeNode... arguments) {
    return new FunctionNode(name, true, Arrays.asList(arguments));
  }

  public String getFunctionName() { return name_; }
  public boolean isAggregateFunction() { return isAggregate_; }
  public DataType getResultType() { return resultType_; }
  public void setResultType(DataType type) { resultType_ = type; }

  public ListNode getArguments() {
    return (ListNode) children_.get(ARGUMENTS_CHILD_INDEX);
  }

  public QueryTreeNode getArgument(int index) { return getArguments().getChild(index); }

  /**
   * Renames this function in place.
   */
  public void setFunctionName(String name) {
    Preconditions.checkNotNull(name);
    name_ = name;
  }

  /**
   * Turns this node into a call of the aggregate function <code>name</code>
   * with the given arguments.
   */
  public void resolveAsAggregateFunction(String name,
      List<? extends QueryTreeNode> arguments) {
    setFunctionName(name);
    isAggregate_ = true;
    children_.set(ARGUMENTS_CHILD_INDEX, new ListNode(arguments));
  }

  @Override
  public QueryTreeNodeType getNodeType() { return QueryTreeNodeType.FUNCTION; }

  @Override
  public String describe() {
    return super.describe() + " " + name_ + (isAggregate_ ? " (aggregate)" : "");
  }
}

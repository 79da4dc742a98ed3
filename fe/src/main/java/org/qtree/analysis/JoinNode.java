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

import com.google.common.base.Preconditions;

/**
 * Join of two table expressions. The join expression slot is empty for a
 * CROSS join. Otherwise it holds one entry per key: for a USING join a
 * {@link ListNode} of the left and right {@link ColumnNode}, for an ON join an
 * <code>equals(left, right)</code> {@link FunctionNode}. The keys are
 * combined by AND.
 */
public class JoinNode extends QueryTreeNode {
  public static final int LEFT_TABLE_EXPRESSION_CHILD_INDEX = 0;
  public static final int RIGHT_TABLE_EXPRESSION_CHILD_INDEX = 1;
  public static final int JOIN_EXPRESSION_CHILD_INDEX = 2;

  public enum JoinKind {
    INNER,
    LEFT,
    RIGHT,
    FULL,
    CROSS
  }

  private final JoinKind kind_;
  private final boolean isUsing_;

  public JoinNode(QueryTreeNode left, QueryTreeNode right,
      ListNode joinExpression, JoinKind kind, boolean isUsing) {
    super(3);
    Preconditions.checkNotNull(left);
    Preconditions.checkNotNull(right);
    Preconditions.checkNotNull(kind);
    Preconditions.checkArgument((kind == JoinKind.CROSS) == (joinExpression == null),
        "join expression must be present for all but CROSS join");
    kind_ = kind;
    isUsing_ = isUsing;
    children_.set(LEFT_TABLE_EXPRESSION_CHILD_INDEX, left);
    children_.set(RIGHT_TABLE_EXPRESSION_CHILD_INDEX, right);
    children_.set(JOIN_EXPRESSION_CHILD_INDEX, joinExpression);
  }

  public QueryTreeNode getLeftTableExpression() {
    return children_.get(LEFT_TABLE_EXPRESSION_CHILD_INDEX);
  }

  public QueryTreeNode getRightTableExpression() {
    return children_.get(RIGHT_TABLE_EXPRESSION_CHILD_INDEX);
  }

  public ListNode getJoinExpression() {
    return (ListNode) children_.get(JOIN_EXPRESSION_CHILD_INDEX);
  }

  public JoinKind getKind() { return kind_; }
  public boolean isUsingJoinExpression() { return isUsing_; }

  @Override
  public QueryTreeNodeType getNodeType() { return QueryTreeNodeType.JOIN; }

  @Override
  public String describe() {
    return super.describe() + " " + kind_ + (isUsing_ ? " USING" : "");
  }
}

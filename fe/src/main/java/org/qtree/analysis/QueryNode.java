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
 * A single SELECT block. The projection and join tree are required; the
 * WHERE slot may be empty.
 */
public class QueryNode extends ScopeNode {
  public static final int PROJECTION_CHILD_INDEX = 0;
  public static final int JOIN_TREE_CHILD_INDEX = 1;
  public static final int WHERE_CHILD_INDEX = 2;
  private static final int CHILDREN_SIZE = 3;

  public QueryNode(Context context, ListNode projection, QueryTreeNode joinTree,
      QueryTreeNode where) {
    super(context, CHILDREN_SIZE);
    Preconditions.checkNotNull(projection);
    children_.set(PROJECTION_CHILD_INDEX, projection);
    children_.set(JOIN_TREE_CHILD_INDEX, joinTree);
    children_.set(WHERE_CHILD_INDEX, where);
  }

  public QueryNode(Context context, ListNode projection, QueryTreeNode joinTree) {
    this(context, projection, joinTree, null);
  }

  public ListNode getProjection() {
    return (ListNode) children_.get(PROJECTION_CHILD_INDEX);
  }

  public QueryTreeNode getJoinTree() { return children_.get(JOIN_TREE_CHILD_INDEX); }
  public QueryTreeNode getWhere() { return children_.get(WHERE_CHILD_INDEX); }
  public boolean hasWhere() { return getWhere() != null; }
  public void setWhere(QueryTreeNode where) { children_.set(WHERE_CHILD_INDEX, where); }

  @Override
  public QueryTreeNodeType getNodeType() { return QueryTreeNodeType.QUERY; }
}

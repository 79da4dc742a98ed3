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

import com.google.common.base.Preconditions;

/**
 * UNION of queries. Each member query has its own scope; the union scope
 * applies to the list that holds them.
 */
public class UnionNode extends ScopeNode {
  public static final int QUERIES_CHILD_INDEX = 0;

  public enum UnionMode {
    UNION_ALL,
    UNION_DISTINCT
  }

  private final UnionMode mode_;

  public UnionNode(Context context, UnionMode mode,
      List<? extends QueryTreeNode> queries) {
    super(context, 1);
    Preconditions.checkNotNull(mode);
    Preconditions.checkArgument(queries.size() >= 2,
        "UNION requires at least two queries");
    mode_ = mode;
    children_.set(QUERIES_CHILD_INDEX, new ListNode(queries));
  }

  public UnionMode getUnionMode() { return mode_; }

  public ListNode getQueries() { return (ListNode) children_.get(QUERIES_CHILD_INDEX); }

  @Override
  public QueryTreeNodeType getNodeType() { return QueryTreeNodeType.UNION; }

  @Override
  public String describe() { return super.describe() + " " + mode_; }
}

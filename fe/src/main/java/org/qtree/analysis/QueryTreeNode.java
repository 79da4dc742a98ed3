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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Node of the query tree: the analyzed, logical form of a query used by the
 * analysis and rewrite passes that run before planning.
 *
 * A node has an ordered list of child slots. A slot may be empty
 * (<code>null</code>), such as the WHERE slot of a query without a WHERE
 * clause. The number of slots is fixed by the node kind except for
 * {@link ListNode} and {@link TableFunctionNode}. A child may be shared by
 * several parents; the tree does not track parent links.
 */
public abstract class QueryTreeNode {
  protected final List<QueryTreeNode> children_;

  protected QueryTreeNode(int childrenSize) {
    children_ = new ArrayList<>(Collections.nCopies(childrenSize, null));
  }

  protected QueryTreeNode(List<? extends QueryTreeNode> children) {
    Preconditions.checkNotNull(children);
    children_ = new ArrayList<>(children);
  }

  public abstract QueryTreeNodeType getNodeType();

  /**
   * Returns the live list of child slots. Passes may replace a slot through
   * {@link #setChild(int, QueryTreeNode)} while walking the tree, but must not
   * change the number of slots.
   */
  public List<QueryTreeNode> getChildren() { return children_; }

  public QueryTreeNode getChild(int index) {
    Preconditions.checkElementIndex(index, children_.size());
    return children_.get(index);
  }

  public void setChild(int index, QueryTreeNode child) {
    Preconditions.checkElementIndex(index, children_.size());
    children_.set(index, child);
  }

  /**
   * Returns this node as an instance of the given node class, or null if the
   * node is of some other kind.
   */
  public <T extends QueryTreeNode> T as(Class<T> nodeClass) {
    return nodeClass.isInstance(this) ? nodeClass.cast(this) : null;
  }

  public boolean isA(Class<? extends QueryTreeNode> nodeClass) {
    return nodeClass.isInstance(this);
  }

  /**
   * One-line description of this node without its children, used by the
   * tree dump.
   */
  public String describe() { return getNodeType().name(); }

  @Override
  public String toString() { return describe(); }
}

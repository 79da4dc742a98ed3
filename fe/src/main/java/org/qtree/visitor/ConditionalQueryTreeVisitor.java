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

package org.qtree.visitor;

import org.qtree.analysis.QueryTreeNode;
import org.qtree.common.AnalysisException;

import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;

/**
 * Visitor that uses another visitor to visit a subtree only if a condition
 * holds for the subtree's root. For example, a transformation written for a
 * whole tree can be limited to the arguments of aggregate functions.
 *
 * The walk goes down the tree looking for nodes that satisfy the condition.
 * Each such node is handed, with its whole subtree, to the inner visitor, and
 * this visitor does not descend into it any further. The condition is checked
 * once per node, when the walk reaches it and before any of its children, so
 * changes the inner visitor makes to the tree never cause a subtree to be
 * delegated twice or walked after delegation.
 *
 * The traversal order is that of the inner visitor.
 */
public class ConditionalQueryTreeVisitor extends InDepthQueryTreeVisitor {
  private final QueryTreeVisitor visitor_;
  private final Predicate<QueryTreeNode> condition_;

  public ConditionalQueryTreeVisitor(QueryTreeVisitor visitor,
      Predicate<QueryTreeNode> condition) {
    Preconditions.checkNotNull(visitor);
    Preconditions.checkNotNull(condition);
    visitor_ = visitor;
    condition_ = condition;
  }

  @Override
  public TraversalOrder traversalOrder() { return visitor_.traversalOrder(); }

  @Override
  public void visit(QueryTreeNode node) throws AnalysisException {
    Preconditions.checkNotNull(node);
    if (condition_.apply(node)) {
      visitor_.visit(node);
      return;
    }
    super.visit(node);
  }

  // Nodes that reach here do not satisfy the condition.
  @Override
  protected void visitImpl(QueryTreeNode node) {}
}

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

import java.util.List;

import org.qtree.analysis.QueryTreeNode;
import org.qtree.common.AnalysisException;

import com.google.common.base.Preconditions;

/**
 * Visitor that traverses the query tree in depth. Subclasses implement
 * {@link #visitImpl(QueryTreeNode)}. A subclass can control whether a child
 * is visited by overriding {@link #needChildVisit(QueryTreeNode, QueryTreeNode)};
 * by default all children are visited. The default order is top-down; a
 * subclass that must see the children first overrides
 * {@link #traversalOrder()}.
 *
 * Children are visited left to right. Empty child slots are skipped without
 * consulting <code>needChildVisit</code>. The visitor keeps no state of its
 * own, so independent instances can walk the same read-only tree at the same
 * time.
 *
 * Example:
 * <pre>
 * class FunctionsVisitor extends InDepthQueryTreeVisitor {
 *   protected void visitImpl(QueryTreeNode node) {
 *     if (node.getNodeType() == QueryTreeNodeType.FUNCTION) {
 *       processFunctionNode(node.as(FunctionNode.class));
 *     }
 *   }
 * }
 * </pre>
 */
public abstract class InDepthQueryTreeVisitor implements QueryTreeVisitor {

  @Override
  public TraversalOrder traversalOrder() { return TraversalOrder.TOP_DOWN; }

  /**
   * Returns true if the visitor should descend from <code>parent</code> into
   * <code>child</code>. Called once for each non-empty child slot.
   */
  public boolean needChildVisit(QueryTreeNode parent, QueryTreeNode child) {
    return true;
  }

  /**
   * Handles a single node. Called before the children for a top-down visitor,
   * after them for a bottom-up visitor.
   */
  protected abstract void visitImpl(QueryTreeNode node) throws AnalysisException;

  @Override
  public void visit(QueryTreeNode node) throws AnalysisException {
    Preconditions.checkNotNull(node);
    boolean topDown = traversalOrder() == TraversalOrder.TOP_DOWN;
    if (!topDown) visitChildren(node);

    visitImpl(node);

    if (topDown) visitChildren(node);
  }

  /**
   * Framework-level exclusion of a child slot, applied before
   * <code>needChildVisit</code>. Passes customize
   * <code>needChildVisit</code> instead.
   */
  protected boolean isSkippedSubtree(QueryTreeNode parent, int childIndex) {
    return false;
  }

  private void visitChildren(QueryTreeNode node) throws AnalysisException {
    // Index based: a top-down visitor may replace the slots of the node it
    // just handled, and the replacements are the ones to visit.
    List<QueryTreeNode> children = node.getChildren();
    for (int i = 0; i < children.size(); i++) {
      QueryTreeNode child = children.get(i);
      if (child == null) continue;
      if (isSkippedSubtree(node, i)) continue;
      if (needChildVisit(node, child)) visit(child);
    }
  }
}

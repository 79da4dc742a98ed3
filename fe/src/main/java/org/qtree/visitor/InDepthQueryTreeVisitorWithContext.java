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

import org.qtree.analysis.Context;
import org.qtree.analysis.QueryTreeNode;
import org.qtree.analysis.ScopeNode;
import org.qtree.analysis.Settings;
import org.qtree.common.AnalysisException;

import com.google.common.base.Preconditions;

/**
 * Same as {@link InDepthQueryTreeVisitor}, and additionally keeps track of the
 * context of the current scope and of the recursion depth. Useful for a
 * visitor whose logic depends on the settings in effect where a node
 * appears.
 *
 * On entry to a {@link ScopeNode} the scope's context becomes current. Every
 * node, scope or not, increments the depth by one. Both are restored when
 * the node's visit ends, whether normally or by an exception, so a nested
 * scope never leaks its context to its parent.
 *
 * {@link #leaveImpl(QueryTreeNode)} runs after the node and its children are
 * handled, while the node's own scope context is still current.
 *
 * An instance holds mutable traversal state and must not be used by two
 * walks at the same time.
 */
public abstract class InDepthQueryTreeVisitorWithContext extends InDepthQueryTreeVisitor {
  private Context currentContext_;
  private int subqueryDepth_;

  protected InDepthQueryTreeVisitorWithContext(Context context, int initialSubqueryDepth) {
    Preconditions.checkNotNull(context);
    Preconditions.checkArgument(initialSubqueryDepth >= 0);
    currentContext_ = context;
    subqueryDepth_ = initialSubqueryDepth;
  }

  protected InDepthQueryTreeVisitorWithContext(Context context) {
    this(context, 0);
  }

  public Context getContext() { return currentContext_; }
  public Settings getSettings() { return currentContext_.getSettingsRef(); }
  public int getSubqueryDepth() { return subqueryDepth_; }

  @Override
  public final void visit(QueryTreeNode node) throws AnalysisException {
    Preconditions.checkNotNull(node);
    Context scopeContext = currentContext_;
    int scopeDepth = subqueryDepth_;
    try {
      ScopeNode scopeNode = node.as(ScopeNode.class);
      if (scopeNode != null) currentContext_ = scopeNode.getContext();
      ++subqueryDepth_;

      super.visit(node);

      leaveImpl(node);
    } finally {
      currentContext_ = scopeContext;
      subqueryDepth_ = scopeDepth;
    }
  }

  /**
   * Called once the node and its subtree have been handled. The node's own
   * context is still current.
   */
  protected void leaveImpl(QueryTreeNode node) throws AnalysisException {}
}

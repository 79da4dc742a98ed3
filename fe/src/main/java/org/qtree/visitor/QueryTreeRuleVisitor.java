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
import org.qtree.analysis.TableFunctionNode;
import org.qtree.common.AnalysisException;

import com.google.common.base.Preconditions;

/**
 * Shape of a rule-based pass: every node that the rule applies to is
 * changed by {@link #apply(QueryTreeNode)}. The traversal order belongs to the
 * pass: each subclass passes its fixed order to the constructor.
 *
 * Arguments of a table function that are still unresolved are never
 * visited, nor is anything below them. Such arguments are placeholders that
 * only the table function itself can interpret, so no rule may look at them.
 *
 * Context and depth are tracked as in {@link InDepthQueryTreeVisitorWithContext},
 * so a rule can consult the settings of the current scope.
 */
public abstract class QueryTreeRuleVisitor extends InDepthQueryTreeVisitorWithContext {
  private final TraversalOrder order_;

  protected QueryTreeRuleVisitor(Context context, TraversalOrder order) {
    super(context);
    Preconditions.checkNotNull(order);
    order_ = order;
  }

  /**
   * Returns true if the rule should be applied to the node.
   */
  protected abstract boolean isApplicable(QueryTreeNode node) throws AnalysisException;

  /**
   * Applies the rule. Called only for nodes where
   * {@link #isApplicable(QueryTreeNode)} returned true.
   */
  protected abstract void apply(QueryTreeNode node) throws AnalysisException;

  @Override
  public final TraversalOrder traversalOrder() { return order_; }

  @Override
  public final boolean needChildVisit(QueryTreeNode parent, QueryTreeNode child) {
    return true;
  }

  @Override
  protected final void visitImpl(QueryTreeNode node) throws AnalysisException {
    if (isApplicable(node)) apply(node);
  }

  @Override
  protected final boolean isSkippedSubtree(QueryTreeNode parent, int childIndex) {
    return shouldSkipSubtree(parent, childIndex);
  }

  /**
   * True if the child at <code>childIndex</code> of <code>parent</code> is an
   * unresolved table function argument.
   */
  public static boolean shouldSkipSubtree(QueryTreeNode parent, int childIndex) {
    TableFunctionNode tableFunction = parent.as(TableFunctionNode.class);
    return tableFunction != null && tableFunction.isArgumentUnresolved(childIndex);
  }
}

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

package org.qtree.rewrite;

import org.qtree.analysis.Context;
import org.qtree.analysis.QueryTreeNode;
import org.qtree.common.AnalysisException;
import org.qtree.visitor.InDepthQueryTreeVisitorWithContext;

/**
 * Rejects a query tree deeper than the <code>max_ast_depth</code> setting.
 * The depth counts every node on the path from the root, not just scopes;
 * the root is at depth 1. The limit in effect is the one of the scope where
 * the deep node appears, so a subquery may lower or raise it.
 */
public class CheckQueryTreeDepthPass implements QueryTreePass {

  @Override
  public String getName() { return "CheckQueryTreeDepth"; }

  @Override
  public String getDescription() {
    return "Reject query trees deeper than max_ast_depth";
  }

  @Override
  public void run(QueryTreeNode root, Context context) throws AnalysisException {
    new CheckDepthVisitor(context).visit(root);
  }

  private static class CheckDepthVisitor extends InDepthQueryTreeVisitorWithContext {
    public CheckDepthVisitor(Context context) {
      super(context);
    }

    @Override
    protected void visitImpl(QueryTreeNode node) throws AnalysisException {
      int maxDepth = getSettings().maxAstDepth();
      if (maxDepth > 0 && getSubqueryDepth() > maxDepth) {
        throw AnalysisException.tooDeep(maxDepth);
      }
    }
  }
}

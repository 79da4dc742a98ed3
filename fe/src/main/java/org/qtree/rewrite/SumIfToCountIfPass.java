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

import org.qtree.analysis.ConstantNode;
import org.qtree.analysis.Context;
import org.qtree.analysis.FunctionNode;
import org.qtree.analysis.ListNode;
import org.qtree.analysis.QueryTreeNode;
import org.qtree.catalog.PrimitiveType;
import org.qtree.common.AnalysisException;
import org.qtree.visitor.InDepthQueryTreeVisitorWithContext;

import com.google.common.collect.ImmutableList;

/**
 * Rewrites sums of a 0/1 condition into conditional counts, which are
 * cheaper to compute. Controlled by the
 * <code>optimize_rewrite_sum_if_to_count_if</code> setting of the scope in
 * which the function appears.
 *
 * Examples:
 * sumIf(1, cond) --> countIf(cond)
 * sum(if(cond, 1, 0)) --> countIf(cond)
 * sum(if(cond, 0, 1)) --> countIf(not(cond))
 *
 * Relies on {@link NormalizeFunctionNamesPass} having run first.
 */
public class SumIfToCountIfPass implements QueryTreePass {

  @Override
  public String getName() { return "SumIfToCountIf"; }

  @Override
  public String getDescription() {
    return "Rewrite sum(if()) and sumIf() into countIf() when logically equivalent";
  }

  @Override
  public void run(QueryTreeNode root, Context context) throws AnalysisException {
    new SumIfToCountIfVisitor(context).visit(root);
  }

  private static class SumIfToCountIfVisitor extends InDepthQueryTreeVisitorWithContext {
    public SumIfToCountIfVisitor(Context context) {
      super(context);
    }

    @Override
    protected void visitImpl(QueryTreeNode node) {
      if (!getSettings().optimizeRewriteSumIfToCountIf()) return;
      FunctionNode function = node.as(FunctionNode.class);
      if (function == null || !function.isAggregateFunction()) return;

      ListNode arguments = function.getArguments();
      if (function.getFunctionName().equals("sumIf")) {
        if (arguments.size() != 2) return;
        if (!isConstant(arguments.getChild(0), 1)) return;
        toCountIf(function, arguments.getChild(1));
        return;
      }

      if (!function.getFunctionName().equals("sum") || arguments.size() != 1) return;
      FunctionNode nested = asFunction(arguments.getChild(0), "if");
      if (nested == null) return;
      ListNode ifArguments = nested.getArguments();
      if (ifArguments.size() != 3) return;
      QueryTreeNode condition = ifArguments.getChild(0);
      QueryTreeNode thenArg = ifArguments.getChild(1);
      QueryTreeNode elseArg = ifArguments.getChild(2);
      if (isConstant(thenArg, 1) && isConstant(elseArg, 0)) {
        toCountIf(function, condition);
      } else if (isConstant(thenArg, 0) && isConstant(elseArg, 1)) {
        FunctionNode not = FunctionNode.ordinary("not", condition);
        not.setResultType(PrimitiveType.UINT8);
        toCountIf(function, not);
      }
    }

    private static void toCountIf(FunctionNode function, QueryTreeNode condition) {
      function.resolveAsAggregateFunction("countIf", ImmutableList.of(condition));
      function.setResultType(PrimitiveType.UINT64);
    }

    private static boolean isConstant(QueryTreeNode node, long value) {
      ConstantNode constant = node == null ? null : node.as(ConstantNode.class);
      return constant != null && constant.isNumber(value);
    }

    private static FunctionNode asFunction(QueryTreeNode node, String name) {
      FunctionNode function = node == null ? null : node.as(FunctionNode.class);
      if (function == null || !function.getFunctionName().equals(name)) return null;
      return function;
    }
  }
}

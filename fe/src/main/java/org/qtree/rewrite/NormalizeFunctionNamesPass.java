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

import java.util.Locale;
import java.util.Map;

import org.qtree.analysis.Context;
import org.qtree.analysis.FunctionNode;
import org.qtree.analysis.QueryTreeNode;
import org.qtree.common.AnalysisException;
import org.qtree.visitor.QueryTreeRuleVisitor;
import org.qtree.visitor.TraversalOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

/**
 * Rewrites the names of case-insensitive functions to their canonical
 * spelling so that later passes can match on exact names.
 *
 * Examples:
 * SUM(x) --> sum(x)
 * countif(x > 1) --> countIf(x > 1)
 *
 * Unresolved arguments of table functions are left as written.
 */
public class NormalizeFunctionNamesPass implements QueryTreePass {
  private final static Logger LOG =
      LoggerFactory.getLogger(NormalizeFunctionNamesPass.class);

  // Lower case name to canonical name.
  private static final Map<String, String> CANONICAL_NAMES =
      ImmutableMap.<String, String>builder()
        .put("sum", "sum")
        .put("sumif", "sumIf")
        .put("count", "count")
        .put("countif", "countIf")
        .put("avg", "avg")
        .put("min", "min")
        .put("max", "max")
        .put("if", "if")
        .put("not", "not")
        .put("and", "and")
        .put("or", "or")
        .put("equals", "equals")
        .put("coalesce", "coalesce")
        .put("lower", "lower")
        .put("upper", "upper")
        .put("length", "length")
        .build();

  @Override
  public String getName() { return "NormalizeFunctionNames"; }

  @Override
  public String getDescription() {
    return "Rewrite case-insensitive function names to their canonical form";
  }

  @Override
  public void run(QueryTreeNode root, Context context) throws AnalysisException {
    new NormalizeFunctionNamesVisitor(context).visit(root);
  }

  /**
   * Returns the canonical name of the function, or null if the name is
   * case sensitive.
   */
  public static String canonicalName(String name) {
    return CANONICAL_NAMES.get(name.toLowerCase(Locale.ROOT));
  }

  private static class NormalizeFunctionNamesVisitor extends QueryTreeRuleVisitor {
    public NormalizeFunctionNamesVisitor(Context context) {
      super(context, TraversalOrder.TOP_DOWN);
    }

    @Override
    protected boolean isApplicable(QueryTreeNode node) {
      if (!getSettings().normalizeFunctionNames()) return false;
      FunctionNode function = node.as(FunctionNode.class);
      if (function == null) return false;
      String canonical = canonicalName(function.getFunctionName());
      return canonical != null && !canonical.equals(function.getFunctionName());
    }

    @Override
    protected void apply(QueryTreeNode node) {
      FunctionNode function = (FunctionNode) node;
      String canonical = canonicalName(function.getFunctionName());
      LOG.trace("Normalizing function name {} to {}",
          function.getFunctionName(), canonical);
      function.setFunctionName(canonical);
    }
  }
}

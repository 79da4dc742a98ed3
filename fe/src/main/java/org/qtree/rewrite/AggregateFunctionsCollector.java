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

import java.util.ArrayList;
import java.util.List;

import org.qtree.analysis.FunctionNode;
import org.qtree.analysis.QueryTreeNode;
import org.qtree.analysis.ScopeNode;
import org.qtree.common.AnalysisException;
import org.qtree.visitor.ConditionalQueryTreeVisitor;
import org.qtree.visitor.InDepthQueryTreeVisitor;

import com.google.common.base.Predicate;

/**
 * Finds the aggregate functions of an expression. The search stops at
 * nested scopes: the aggregates of a subquery belong to the subquery.
 *
 * Each aggregate function found is handed, with its arguments, to a
 * visitor that rejects an aggregate nested inside another one, such as
 * <code>sum(count(x))</code>.
 */
public class AggregateFunctionsCollector {
  public static final String NESTED_AGGREGATE_MSG =
      "Aggregate function %s is found inside another aggregate function %s";

  public static final Predicate<QueryTreeNode> IS_AGGREGATE_FUNCTION =
      new Predicate<QueryTreeNode>() {
        @Override
        public boolean apply(QueryTreeNode node) {
          FunctionNode function = node.as(FunctionNode.class);
          return function != null && function.isAggregateFunction();
        }
      };

  /**
   * Visits one aggregate function and its arguments. The root of each
   * delegated subtree is the aggregate being collected; any other aggregate
   * below it is an error.
   */
  private class AggregateArgumentsVisitor extends InDepthQueryTreeVisitor {
    private FunctionNode aggregate_;

    @Override
    public void visit(QueryTreeNode node) throws AnalysisException {
      if (aggregate_ != null) {
        super.visit(node);
        return;
      }
      aggregate_ = node.as(FunctionNode.class);
      aggregates_.add(aggregate_);
      try {
        super.visit(node);
      } finally {
        aggregate_ = null;
      }
    }

    @Override
    public boolean needChildVisit(QueryTreeNode parent, QueryTreeNode child) {
      return !child.isA(ScopeNode.class);
    }

    @Override
    protected void visitImpl(QueryTreeNode node) throws AnalysisException {
      if (node == aggregate_ || !IS_AGGREGATE_FUNCTION.apply(node)) return;
      throw new AnalysisException(String.format(NESTED_AGGREGATE_MSG,
          node.as(FunctionNode.class).getFunctionName(),
          aggregate_.getFunctionName()));
    }
  }

  private final List<FunctionNode> aggregates_ = new ArrayList<>();

  private AggregateFunctionsCollector() {}

  /**
   * Returns the aggregate functions of the given expression, left to right.
   */
  public static List<FunctionNode> collect(QueryTreeNode node)
      throws AnalysisException {
    AggregateFunctionsCollector collector = new AggregateFunctionsCollector();
    new ConditionalQueryTreeVisitor(
        collector.new AggregateArgumentsVisitor(), IS_AGGREGATE_FUNCTION) {
      @Override
      public boolean needChildVisit(QueryTreeNode parent, QueryTreeNode child) {
        return !child.isA(ScopeNode.class);
      }
    }.visit(node);
    return collector.aggregates_;
  }

  /**
   * Fails if the expression of the given clause contains an aggregate
   * function.
   */
  public static void assertNoAggregates(QueryTreeNode node, String clause)
      throws AnalysisException {
    List<FunctionNode> aggregates = collect(node);
    if (aggregates.isEmpty()) return;
    throw new AnalysisException(String.format(
        "Aggregate function %s is found in %s", aggregates.get(0).getFunctionName(),
        clause));
  }
}

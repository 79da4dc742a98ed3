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
import org.qtree.analysis.QueryNode;
import org.qtree.analysis.QueryTreeNode;
import org.qtree.common.AnalysisException;
import org.qtree.visitor.InDepthQueryTreeVisitor;

/**
 * Validates the use of aggregate functions in every query of the tree:
 * aggregates must not be nested and must not appear in the WHERE clause.
 */
public class ValidateAggregateFunctionsPass implements QueryTreePass {

  @Override
  public String getName() { return "ValidateAggregateFunctions"; }

  @Override
  public String getDescription() {
    return "Reject nested aggregate functions and aggregates in WHERE";
  }

  @Override
  public void run(QueryTreeNode root, Context context) throws AnalysisException {
    new InDepthQueryTreeVisitor() {
      @Override
      protected void visitImpl(QueryTreeNode node) throws AnalysisException {
        QueryNode query = node.as(QueryNode.class);
        if (query == null) return;
        AggregateFunctionsCollector.collect(query.getProjection());
        if (query.hasWhere()) {
          AggregateFunctionsCollector.assertNoAggregates(query.getWhere(), "WHERE");
        }
      }
    }.visit(root);
  }
}

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
import org.qtree.common.AnalysisException;

import com.google.common.base.Strings;

/**
 * Renders a query tree as text, one node per line, indented by depth. Scope
 * nodes also show the query id of their context. Empty child slots are not
 * shown.
 *
 * <pre>
 * QUERY [q1]
 *   LIST
 *     FUNCTION sum (aggregate)
 *       LIST
 *         COLUMN x :: Int64
 *   TABLE t
 * </pre>
 */
public class QueryTreeDumper extends InDepthQueryTreeVisitorWithContext {
  private static final int INDENT = 2;

  private final StringBuilder buf_ = new StringBuilder();

  private QueryTreeDumper(Context context) {
    super(context);
  }

  public static String dump(QueryTreeNode root, Context context) {
    QueryTreeDumper dumper = new QueryTreeDumper(context);
    try {
      dumper.visit(root);
    } catch (AnalysisException e) {
      // visitImpl() never throws
      throw new IllegalStateException(e);
    }
    return dumper.buf_.toString();
  }

  @Override
  protected void visitImpl(QueryTreeNode node) {
    buf_.append(Strings.repeat(" ", (getSubqueryDepth() - 1) * INDENT))
        .append(node.describe());
    if (node.isA(ScopeNode.class)) {
      buf_.append(" [").append(getContext().getQueryId()).append("]");
    }
    buf_.append("\n");
  }
}

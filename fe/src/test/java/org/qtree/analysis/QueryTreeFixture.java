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

package org.qtree.analysis;

import java.util.Arrays;
import java.util.List;

import org.qtree.analysis.JoinNode.JoinKind;
import org.qtree.catalog.DataType;
import org.qtree.catalog.PrimitiveType;

import com.google.common.collect.ImmutableSet;

/**
 * Shorthand for building query trees in tests. A test typically builds
 * a tree, runs a visitor or pass over it, then checks the visitor's record
 * or the {@link org.qtree.visitor.QueryTreeDumper} output.
 */
public class QueryTreeFixture {

  public static Context context(String queryId) {
    return Context.create(queryId);
  }

  public static Context context(String queryId, Settings settings) {
    return new Context(queryId, settings);
  }

  public static TableNode table(String name) {
    return new TableNode(name);
  }

  public static ColumnNode column(String name, DataType type) {
    return new ColumnNode(name, type);
  }

  public static ColumnNode column(String name) {
    return new ColumnNode(name, PrimitiveType.INT64);
  }

  public static ConstantNode constant(long value) {
    return new ConstantNode(value, PrimitiveType.UINT8);
  }

  public static FunctionNode func(String name, QueryTreeNode... args) {
    return FunctionNode.ordinary(name, args);
  }

  public static FunctionNode agg(String name, QueryTreeNode... args) {
    return FunctionNode.aggregate(name, args);
  }

  public static ListNode list(QueryTreeNode... nodes) {
    return new ListNode(nodes);
  }

  public static QueryNode query(Context context, QueryTreeNode from,
      QueryTreeNode... projection) {
    return new QueryNode(context, list(projection), from);
  }

  public static QueryNode query(Context context, QueryTreeNode from,
      QueryTreeNode where, List<QueryTreeNode> projection) {
    return new QueryNode(context, new ListNode(projection), from, where);
  }

  public static TableFunctionNode tableFunction(String name,
      List<QueryTreeNode> args, Integer... unresolved) {
    return new TableFunctionNode(name, args, ImmutableSet.copyOf(unresolved));
  }

  public static UnionNode unionAll(Context context, QueryNode... queries) {
    return new UnionNode(context, UnionNode.UnionMode.UNION_ALL, Arrays.asList(queries));
  }

  /**
   * Join ON the equality of each pair of left and right columns, given
   * alternately.
   */
  public static JoinNode joinOn(QueryTreeNode left, QueryTreeNode right,
      ColumnNode... keyPairs) {
    ListNode expr = new ListNode();
    for (int i = 0; i + 1 < keyPairs.length; i += 2) {
      expr.add(func("equals", keyPairs[i], keyPairs[i + 1]));
    }
    return new JoinNode(left, right, expr, JoinKind.INNER, false);
  }
}

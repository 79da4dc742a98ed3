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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.qtree.analysis.QueryTreeFixture.*;

import java.util.List;

import org.junit.Test;
import org.qtree.analysis.JoinNode.JoinKind;
import org.qtree.analysis.UnionNode.UnionMode;
import org.qtree.catalog.PrimitiveType;

import com.google.common.collect.ImmutableSet;

public class QueryTreeNodeTest {

  @Test
  public void testQuerySlots() {
    Context ctx = context("q");
    TableNode t = table("t");
    QueryNode query = query(ctx, t, column("x"));
    assertSame(ctx, query.getContext());
    assertSame(t, query.getJoinTree());
    assertEquals("t", t.getTableName());
    assertFalse(query.hasWhere());
    assertEquals(3, query.getChildren().size());

    FunctionNode where = func("equals", column("x"), constant(1));
    query.setWhere(where);
    assertTrue(query.hasWhere());
    assertSame(where, query.getChild(QueryNode.WHERE_CHILD_INDEX));
  }

  @Test
  public void testUnion() {
    QueryNode a = query(context("a"), table("t"), column("x"));
    QueryNode b = query(context("b"), table("u"), column("y"));
    UnionNode union = unionAll(context("u"), a, b);
    assertEquals(UnionMode.UNION_ALL, union.getUnionMode());
    assertEquals(List.of(a, b), union.getQueries().getChildren());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnionOfOneQuery() {
    new UnionNode(context("u"), UnionMode.UNION_DISTINCT,
        List.of(query(context("a"), table("t"))));
  }

  @Test
  public void testTableFunction() {
    TableFunctionNode tf = tableFunction("numbers",
        List.<QueryTreeNode>of(constant(1), column("x"), constant(10)), 1, 2);
    assertEquals("numbers", tf.getTableFunctionName());
    assertEquals(ImmutableSet.of(1, 2), tf.getUnresolvedArgumentIndexes());
    assertFalse(tf.isArgumentUnresolved(0));
    assertTrue(tf.isArgumentUnresolved(2));
    assertEquals("TABLE_FUNCTION numbers", tf.describe());
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testUnresolvedIndexOutOfRange() {
    tableFunction("numbers", List.<QueryTreeNode>of(constant(1)), 1);
  }

  @Test
  public void testColumnExpression() {
    ColumnNode plain = column("x");
    assertFalse(plain.hasExpression());
    assertEquals(1, plain.getChildren().size());
    assertNull(plain.getChild(ColumnNode.EXPRESSION_CHILD_INDEX));

    FunctionNode expr = func("plus", column("a"), constant(1));
    ColumnNode alias = new ColumnNode("y", PrimitiveType.INT64, expr);
    assertTrue(alias.hasExpression());
    assertSame(expr, alias.getExpression());
  }

  @Test
  public void testJoin() {
    JoinNode using = new JoinNode(table("l"), table("r"),
        list(list(column("l.k"), column("r.k"))), JoinKind.LEFT, true);
    assertTrue(using.isUsingJoinExpression());
    assertEquals(JoinKind.LEFT, using.getKind());
    assertEquals("JOIN LEFT USING", using.describe());

    JoinNode on = joinOn(table("l"), table("r"), column("l.k"), column("r.k"));
    assertFalse(on.isUsingJoinExpression());
    assertEquals(1, on.getJoinExpression().size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCrossJoinWithExpression() {
    new JoinNode(table("l"), table("r"), list(), JoinKind.CROSS, false);
  }

  @Test
  public void testTypedLookup() {
    QueryTreeNode node = column("x");
    assertSame(node, node.as(ColumnNode.class));
    assertNull(node.as(FunctionNode.class));
    assertTrue(node.isA(ColumnNode.class));
    assertFalse(table("t").isA(ScopeNode.class));
    assertTrue(query(context("q"), table("t")).isA(ScopeNode.class));
  }
}

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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.qtree.analysis.QueryTreeFixture.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import org.qtree.analysis.ColumnNode;
import org.qtree.analysis.FunctionNode;
import org.qtree.analysis.ListNode;
import org.qtree.analysis.QueryTreeNode;
import org.qtree.analysis.QueryTreeNodeType;
import org.qtree.common.AnalysisException;

public class InDepthQueryTreeVisitorTest {

  /**
   * Records the description of each node handled.
   */
  private static class RecordingVisitor extends InDepthQueryTreeVisitor {
    final List<String> visited_ = new ArrayList<>();
    private final TraversalOrder order_;

    RecordingVisitor(TraversalOrder order) { order_ = order; }

    @Override
    public TraversalOrder traversalOrder() { return order_; }

    @Override
    protected void visitImpl(QueryTreeNode node) {
      visited_.add(node.describe());
    }
  }

  // f(g(a), b)
  private static FunctionNode sampleTree() {
    return func("f", func("g", column("a")), column("b"));
  }

  @Test
  public void testTopDownOrder() throws AnalysisException {
    RecordingVisitor visitor = new RecordingVisitor(TraversalOrder.TOP_DOWN);
    visitor.visit(sampleTree());
    assertEquals(List.of(
        "FUNCTION f", "LIST",
        "FUNCTION g", "LIST", "COLUMN a :: Int64",
        "COLUMN b :: Int64"), visitor.visited_);
  }

  @Test
  public void testBottomUpOrder() throws AnalysisException {
    RecordingVisitor visitor = new RecordingVisitor(TraversalOrder.BOTTOM_UP);
    visitor.visit(sampleTree());
    assertEquals(List.of(
        "COLUMN a :: Int64", "LIST", "FUNCTION g",
        "COLUMN b :: Int64", "LIST", "FUNCTION f"), visitor.visited_);
  }

  @Test
  public void testLeaf() throws AnalysisException {
    RecordingVisitor visitor = new RecordingVisitor(TraversalOrder.BOTTOM_UP);
    visitor.visit(column("x"));
    assertEquals(List.of("COLUMN x :: Int64"), visitor.visited_);
  }

  @Test
  public void testEmptySlotsSkipped() throws AnalysisException {
    final List<QueryTreeNode> asked = new ArrayList<>();
    RecordingVisitor visitor = new RecordingVisitor(TraversalOrder.TOP_DOWN) {
      @Override
      public boolean needChildVisit(QueryTreeNode parent, QueryTreeNode child) {
        asked.add(child);
        return true;
      }
    };
    // Column with no expression, and a list with a hole in the middle
    visitor.visit(list(column("a"), null, constant(1)));
    assertEquals(List.of("LIST", "COLUMN a :: Int64", "CONSTANT 1 :: UInt8"),
        visitor.visited_);
    assertEquals(2, asked.size());
    for (QueryTreeNode child : asked) assertTrue(child != null);
  }

  @Test
  public void testNeedChildVisit() throws AnalysisException {
    // Do not descend into arguments of functions
    RecordingVisitor visitor = new RecordingVisitor(TraversalOrder.TOP_DOWN) {
      @Override
      public boolean needChildVisit(QueryTreeNode parent, QueryTreeNode child) {
        return parent.getNodeType() != QueryTreeNodeType.FUNCTION;
      }
    };
    visitor.visit(list(sampleTree(), column("c")));
    assertEquals(List.of("LIST", "FUNCTION f", "COLUMN c :: Int64"),
        visitor.visited_);
  }

  @Test
  public void testTopDownSeesReplacedChildren() throws AnalysisException {
    // Replaces each column "a" in a list by column "z" before descending
    RecordingVisitor visitor = new RecordingVisitor(TraversalOrder.TOP_DOWN) {
      @Override
      protected void visitImpl(QueryTreeNode node) {
        super.visitImpl(node);
        ListNode list = node.as(ListNode.class);
        if (list == null) return;
        for (int i = 0; i < list.size(); i++) {
          ColumnNode col = list.getChild(i).as(ColumnNode.class);
          if (col != null && col.getColumnName().equals("a")) {
            list.setChild(i, column("z"));
          }
        }
      }
    };
    ListNode root = list(column("a"), column("b"));
    visitor.visit(root);
    assertEquals(List.of("LIST", "COLUMN z :: Int64", "COLUMN b :: Int64"),
        visitor.visited_);
  }

  @Test
  public void testErrorPropagates() {
    InDepthQueryTreeVisitor visitor = new InDepthQueryTreeVisitor() {
      @Override
      protected void visitImpl(QueryTreeNode node) throws AnalysisException {
        if (node.isA(ColumnNode.class)) {
          throw new AnalysisException("bad column " + node.describe());
        }
      }
    };
    try {
      visitor.visit(sampleTree());
      fail();
    } catch (AnalysisException e) {
      assertEquals("bad column COLUMN a :: Int64", e.getMessage());
    }
  }

  @Test(expected = NullPointerException.class)
  public void testNullRoot() throws AnalysisException {
    new RecordingVisitor(TraversalOrder.TOP_DOWN).visit(null);
  }
}

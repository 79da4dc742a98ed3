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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.qtree.analysis.QueryTreeFixture.*;

import org.junit.Test;
import org.qtree.analysis.ColumnNode;
import org.qtree.analysis.Context;
import org.qtree.analysis.FunctionNode;
import org.qtree.analysis.QueryNode;
import org.qtree.analysis.Settings;
import org.qtree.catalog.PrimitiveType;
import org.qtree.common.AnalysisException;
import org.qtree.visitor.QueryTreeDumper;

public class SumIfToCountIfPassTest {
  private final Context ctx_ = context("q");

  private static ColumnNode cond() {
    return column("c", PrimitiveType.UINT8);
  }

  /**
   * Runs the pass over SELECT <fn> FROM t and returns the dump of the
   * projected expression.
   */
  private String rewrite(Context ctx, FunctionNode fn) throws AnalysisException {
    QueryNode query = query(ctx, table("t"), fn);
    new SumIfToCountIfPass().run(query, ctx);
    return QueryTreeDumper.dump(query.getProjection().getChild(0), ctx);
  }

  @Test
  public void testSumIfOfOne() throws AnalysisException {
    FunctionNode fn = agg("sumIf", constant(1), cond());
    assertEquals(
        "FUNCTION countIf (aggregate)\n" +
        "  LIST\n" +
        "    COLUMN c :: UInt8\n", rewrite(ctx_, fn));
    assertSame(PrimitiveType.UINT64, fn.getResultType());
  }

  @Test
  public void testSumOfIfOneZero() throws AnalysisException {
    assertEquals(
        "FUNCTION countIf (aggregate)\n" +
        "  LIST\n" +
        "    COLUMN c :: UInt8\n",
        rewrite(ctx_, agg("sum", func("if", cond(), constant(1), constant(0)))));
  }

  @Test
  public void testSumOfIfZeroOne() throws AnalysisException {
    assertEquals(
        "FUNCTION countIf (aggregate)\n" +
        "  LIST\n" +
        "    FUNCTION not\n" +
        "      LIST\n" +
        "        COLUMN c :: UInt8\n",
        rewrite(ctx_, agg("sum", func("if", cond(), constant(0), constant(1)))));
  }

  @Test
  public void testNotRewritten() throws AnalysisException {
    // sumIf(2, c) counts twice
    assertEquals(
        "FUNCTION sumIf (aggregate)\n" +
        "  LIST\n" +
        "    CONSTANT 2 :: UInt8\n" +
        "    COLUMN c :: UInt8\n",
        rewrite(ctx_, agg("sumIf", constant(2), cond())));
    // sum(if(c, 1, 1)) is a count of all rows, not a conditional one
    assertEquals(
        "FUNCTION sum (aggregate)\n" +
        "  LIST\n" +
        "    FUNCTION if\n" +
        "      LIST\n" +
        "        COLUMN c :: UInt8\n" +
        "        CONSTANT 1 :: UInt8\n" +
        "        CONSTANT 1 :: UInt8\n",
        rewrite(ctx_, agg("sum", func("if", cond(), constant(1), constant(1)))));
    // Not an aggregate function
    assertEquals(
        "FUNCTION sumIf\n" +
        "  LIST\n" +
        "    CONSTANT 1 :: UInt8\n" +
        "    COLUMN c :: UInt8\n",
        rewrite(ctx_, func("sumIf", constant(1), cond())));
  }

  @Test
  public void testNested() throws AnalysisException {
    // The argument of the outer function is rewritten too
    assertEquals(
        "FUNCTION plus\n" +
        "  LIST\n" +
        "    FUNCTION countIf (aggregate)\n" +
        "      LIST\n" +
        "        COLUMN c :: UInt8\n" +
        "    CONSTANT 1 :: UInt8\n",
        rewrite(ctx_, func("plus", agg("sumIf", constant(1), cond()), constant(1))));
  }

  @Test
  public void testDisabledPerScope() throws AnalysisException {
    Context disabled = context("inner", Settings.builder()
        .optimizeRewriteSumIfToCountIf(false).build());
    FunctionNode innerFn = agg("sumIf", constant(1), cond());
    FunctionNode outerFn = agg("sumIf", constant(1), cond());
    QueryNode inner = query(disabled, table("t"), innerFn);
    QueryNode outer = query(ctx_, inner, outerFn);
    new SumIfToCountIfPass().run(outer, ctx_);
    assertEquals("countIf", outerFn.getFunctionName());
    assertEquals("sumIf", innerFn.getFunctionName());
  }
}

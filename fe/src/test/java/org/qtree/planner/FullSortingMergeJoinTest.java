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

package org.qtree.planner;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;
import org.qtree.analysis.JoinNode.JoinKind;
import org.qtree.catalog.DataType;
import org.qtree.catalog.DataTypes;
import org.qtree.catalog.PrimitiveType;
import org.qtree.common.AnalysisException;
import org.qtree.common.NotImplementedException;
import org.qtree.common.TypeMismatchException;

public class FullSortingMergeJoinTest {

  private static FullSortingMergeJoin joinOnKey(DataType rightType) {
    TableJoin tableJoin = new TableJoin(JoinKind.INNER,
        List.of(new JoinOnClause(List.of("l.k"), List.of("r.k"))));
    Block right = new Block().insert("r.k", rightType).insert("r.v", PrimitiveType.STRING);
    return new FullSortingMergeJoin(tableJoin, right);
  }

  private static Block leftBlock(DataType keyType) {
    return new Block().insert("l.k", keyType);
  }

  @Test
  public void testSameTypes() throws AnalysisException {
    joinOnKey(PrimitiveType.INT64).checkTypesOfKeys(leftBlock(PrimitiveType.INT64));
  }

  @Test
  public void testNullabilityIgnored() throws AnalysisException {
    joinOnKey(DataTypes.nullable(PrimitiveType.INT64))
        .checkTypesOfKeys(leftBlock(PrimitiveType.INT64));
    joinOnKey(PrimitiveType.INT64)
        .checkTypesOfKeys(leftBlock(DataTypes.nullable(PrimitiveType.INT64)));
  }

  @Test
  public void testTypeMismatch() throws AnalysisException {
    try {
      joinOnKey(DataTypes.lowCardinality(PrimitiveType.STRING))
          .checkTypesOfKeys(leftBlock(PrimitiveType.INT64));
      fail();
    } catch (TypeMismatchException e) {
      assertEquals("Type mismatch of columns to JOIN by: " +
          "l.k :: Int64 at left, r.k :: LowCardinality(String) at right",
          e.getMessage());
    }
  }

  @Test
  public void testLowCardinalityNotImplemented() throws AnalysisException {
    try {
      joinOnKey(DataTypes.lowCardinality(PrimitiveType.INT64))
          .checkTypesOfKeys(leftBlock(PrimitiveType.INT64));
      fail();
    } catch (TypeMismatchException e) {
      fail("Types agree without LowCardinality: " + e.getMessage());
    } catch (NotImplementedException e) {
      assertEquals("Type mismatch of columns to JOIN by: " +
          "l.k :: Int64 at left, r.k :: LowCardinality(Int64) at right",
          e.getMessage());
    }
  }

  @Test(expected = NotImplementedException.class)
  public void testLowCardinalityNullable() throws AnalysisException {
    joinOnKey(DataTypes.lowCardinality(DataTypes.nullable(PrimitiveType.INT64)))
        .checkTypesOfKeys(leftBlock(PrimitiveType.INT64));
  }

  @Test
  public void testSeveralClauses() throws AnalysisException {
    TableJoin tableJoin = new TableJoin(JoinKind.INNER, List.of(
        new JoinOnClause(List.of("l.a"), List.of("r.a")),
        new JoinOnClause(List.of("l.b"), List.of("r.b"))));
    FullSortingMergeJoin join = new FullSortingMergeJoin(tableJoin, new Block());
    try {
      join.checkTypesOfKeys(new Block());
      fail();
    } catch (NotImplementedException e) {
      assertEquals("FullSortingMergeJoin supports only one join key", e.getMessage());
    }
  }

  @Test
  public void testMissingKeyColumn() {
    try {
      joinOnKey(PrimitiveType.INT64).checkTypesOfKeys(
          new Block().insert("l.x", PrimitiveType.INT64));
      fail();
    } catch (AnalysisException e) {
      assertEquals("Not found column l.k in block. There are only columns: l.x",
          e.getMessage());
    }
  }

  @Test
  public void testJoinBlockHeader() {
    FullSortingMergeJoin join = joinOnKey(PrimitiveType.INT64);
    Block left = leftBlock(PrimitiveType.INT64);
    Block result = join.joinBlock(left);
    assertEquals("l.k, r.k, r.v", result.dumpNames());
    // The input block is left as it was
    assertEquals(1, left.columns());
  }

  @Test
  public void testTotals() {
    FullSortingMergeJoin join = joinOnKey(PrimitiveType.INT64);
    assertTrue(join.getTotals().isEmpty());
    Block totals = new Block().insert("t", PrimitiveType.UINT64);
    join.setTotals(totals);
    assertSame(totals, join.getTotals());
    assertEquals(JoinPipelineType.Y_SHAPED, join.pipelineType());
  }

  @Test
  public void testExecutionMethodsUnreachable() {
    FullSortingMergeJoin join = joinOnKey(PrimitiveType.INT64);
    try {
      join.addJoinedBlock(new Block(), true);
      fail();
    } catch (IllegalStateException e) {
      assertEquals("FullSortingMergeJoin.addJoinedBlock must not be called " +
          "at planning time", e.getMessage());
    }
    try {
      join.getTotalRowCount();
      fail();
    } catch (IllegalStateException e) {
      // expected
    }
    try {
      join.getTotalByteCount();
      fail();
    } catch (IllegalStateException e) {
      // expected
    }
    try {
      join.alwaysReturnsEmptySet();
      fail();
    } catch (IllegalStateException e) {
      // expected
    }
    try {
      join.getNonJoinedBlocks(new Block(), new Block(), 1024);
      fail();
    } catch (IllegalStateException e) {
      // expected
    }
  }
}

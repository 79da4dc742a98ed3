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

import java.util.List;

import org.qtree.catalog.DataType;
import org.qtree.catalog.DataTypes;
import org.qtree.common.AnalysisException;
import org.qtree.common.NotImplementedException;
import org.qtree.common.TypeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Placeholder join used at planning time for the full sorting merge
 * algorithm. The actual joining is done later by a merging step of the
 * pipeline, so this class only validates the keys and describes the result
 * header. The execution methods must never be called on it.
 */
public class FullSortingMergeJoin implements Join {
  private final static Logger LOG = LoggerFactory.getLogger(FullSortingMergeJoin.class);

  public static final String TYPE_MISMATCH_MSG =
      "Type mismatch of columns to JOIN by: %s :: %s at left, %s :: %s at right";

  private final TableJoin tableJoin_;
  private final Block rightSampleBlock_;
  private Block totals_ = new Block();

  public FullSortingMergeJoin(TableJoin tableJoin, Block rightSampleBlock) {
    Preconditions.checkNotNull(tableJoin);
    Preconditions.checkNotNull(rightSampleBlock);
    tableJoin_ = tableJoin;
    rightSampleBlock_ = rightSampleBlock;
    LOG.trace("Will use full sorting merge join");
  }

  @Override
  public TableJoin getTableJoin() { return tableJoin_; }

  /**
   * Nullability alone is not a mismatch: Int64 joins with Nullable(Int64).
   * Types which become equal only once LowCardinality is removed could be
   * supported, but are not yet, and are reported as not implemented. Any
   * other difference is a type mismatch.
   */
  @Override
  public void checkTypesOfKeys(Block leftBlock) throws AnalysisException {
    if (tableJoin_.getClauses().size() != 1) {
      throw new NotImplementedException(
          "FullSortingMergeJoin supports only one join key");
    }

    JoinOnClause onExpr = tableJoin_.getOnlyClause();
    List<String> keyNamesLeft = onExpr.getKeyNamesLeft();
    List<String> keyNamesRight = onExpr.getKeyNamesRight();
    for (int i = 0; i < keyNamesLeft.size(); i++) {
      DataType leftType = leftBlock.getByName(keyNamesLeft.get(i)).getType();
      DataType rightType = rightSampleBlock_.getByName(keyNamesRight.get(i)).getType();

      if (DataTypes.removeNullable(leftType).equals(
          DataTypes.removeNullable(rightType))) {
        continue;
      }
      DataType leftTypeNoLc =
          DataTypes.removeNullable(DataTypes.recursiveRemoveLowCardinality(leftType));
      DataType rightTypeNoLc =
          DataTypes.removeNullable(DataTypes.recursiveRemoveLowCardinality(rightType));
      String msg = String.format(TYPE_MISMATCH_MSG,
          keyNamesLeft.get(i), leftType.getName(),
          keyNamesRight.get(i), rightType.getName());
      if (leftTypeNoLc.equals(rightTypeNoLc)) {
        throw new NotImplementedException(msg);
      }
      throw new TypeMismatchException(msg);
    }
  }

  /**
   * Used just to get the result header: the left columns followed by the
   * right ones.
   */
  @Override
  public Block joinBlock(Block block) {
    Block result = block.cloneEmpty();
    for (ColumnWithTypeAndName column : rightSampleBlock_.getColumns()) {
      result.insert(column);
    }
    return result;
  }

  @Override
  public void setTotals(Block block) {
    Preconditions.checkNotNull(block);
    totals_ = block;
  }

  @Override
  public Block getTotals() { return totals_; }

  @Override
  public JoinPipelineType pipelineType() { return JoinPipelineType.Y_SHAPED; }

  @Override
  public boolean addJoinedBlock(Block block, boolean checkLimits) {
    throw unreachable("addJoinedBlock");
  }

  @Override
  public long getTotalRowCount() { throw unreachable("getTotalRowCount"); }

  @Override
  public long getTotalByteCount() { throw unreachable("getTotalByteCount"); }

  @Override
  public boolean alwaysReturnsEmptySet() { throw unreachable("alwaysReturnsEmptySet"); }

  @Override
  public NotJoinedBlocks getNonJoinedBlocks(Block leftSampleBlock,
      Block resultSampleBlock, long maxBlockSize) {
    throw unreachable("getNonJoinedBlocks");
  }

  private static IllegalStateException unreachable(String method) {
    return new IllegalStateException(
        "FullSortingMergeJoin." + method + " must not be called at planning time");
  }
}

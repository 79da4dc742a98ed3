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

import org.qtree.common.AnalysisException;

/**
 * A join algorithm as seen by the planner. The planning methods describe
 * the join; the execution methods consume and produce data and are only
 * meaningful for implementations that do the joining themselves.
 */
public interface Join {
  TableJoin getTableJoin();

  /**
   * Checks that the key columns of the left block can be joined with the
   * key columns of the right side.
   */
  void checkTypesOfKeys(Block leftBlock) throws AnalysisException;

  /**
   * Adds a block of the right side. Returns false if the join is over its
   * limits.
   */
  boolean addJoinedBlock(Block block, boolean checkLimits);

  /**
   * Joins a left block with the right side. Returns the joined block.
   */
  Block joinBlock(Block block) throws AnalysisException;

  void setTotals(Block block);
  Block getTotals();

  long getTotalRowCount();
  long getTotalByteCount();
  boolean alwaysReturnsEmptySet();

  NotJoinedBlocks getNonJoinedBlocks(Block leftSampleBlock,
      Block resultSampleBlock, long maxBlockSize);

  JoinPipelineType pipelineType();
}

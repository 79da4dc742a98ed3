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

import org.qtree.analysis.ColumnNode;
import org.qtree.analysis.Context;
import org.qtree.analysis.FunctionNode;
import org.qtree.analysis.JoinNode;
import org.qtree.analysis.JoinNode.JoinKind;
import org.qtree.analysis.ListNode;
import org.qtree.analysis.QueryTreeNode;
import org.qtree.analysis.Settings.JoinAlgorithm;
import org.qtree.common.AnalysisException;
import org.qtree.planner.Block;
import org.qtree.planner.FullSortingMergeJoin;
import org.qtree.planner.JoinOnClause;
import org.qtree.planner.TableJoin;
import org.qtree.visitor.InDepthQueryTreeVisitorWithContext;
import org.qtree.visitor.TraversalOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * Checks, for each join in a scope where <code>join_algorithm</code> is
 * <code>full_sorting_merge</code>, that the key types are supported by the
 * full sorting merge join. Fails the query early, before planning, rather
 * than when the pipeline is built.
 *
 * Joins are checked bottom up so that the innermost join of a chain is
 * reported first.
 */
public class FullSortingMergeJoinValidationPass implements QueryTreePass {
  private final static Logger LOG =
      LoggerFactory.getLogger(FullSortingMergeJoinValidationPass.class);

  @Override
  public String getName() { return "FullSortingMergeJoinValidation"; }

  @Override
  public String getDescription() {
    return "Check join key types for joins that use the full sorting merge algorithm";
  }

  @Override
  public void run(QueryTreeNode root, Context context) throws AnalysisException {
    new JoinValidationVisitor(context).visit(root);
  }

  /**
   * Key columns of a join, as the planner sees them: each key of the join
   * expression contributes one left and one right key name to a single ON
   * clause, and the key columns form the left and right sample blocks.
   */
  public static class JoinKeys {
    private final List<String> leftKeys_ = new ArrayList<>();
    private final List<String> rightKeys_ = new ArrayList<>();
    private final Block leftBlock_ = new Block();
    private final Block rightBlock_ = new Block();

    public JoinKeys(JoinNode join) throws AnalysisException {
      for (QueryTreeNode key : join.getJoinExpression().getChildren()) {
        ColumnNode[] pair = keyColumns(key);
        add(pair[0], leftKeys_, leftBlock_);
        add(pair[1], rightKeys_, rightBlock_);
      }
    }

    private static void add(ColumnNode column, List<String> keys, Block block) {
      keys.add(column.getColumnName());
      if (!block.has(column.getColumnName())) {
        block.insert(column.getColumnName(), column.getColumnType());
      }
    }

    public Block leftBlock() { return leftBlock_; }
    public Block rightBlock() { return rightBlock_; }

    public TableJoin toTableJoin(JoinKind kind) {
      return new TableJoin(kind,
          ImmutableList.of(new JoinOnClause(leftKeys_, rightKeys_)));
    }
  }

  private static ColumnNode[] keyColumns(QueryTreeNode key) throws AnalysisException {
    ListNode arguments = null;
    if (key instanceof ListNode) {
      arguments = (ListNode) key;
    } else if (key instanceof FunctionNode
        && ((FunctionNode) key).getFunctionName().equals("equals")) {
      arguments = ((FunctionNode) key).getArguments();
    }
    if (arguments == null || arguments.size() != 2
        || !(arguments.getChild(0) instanceof ColumnNode)
        || !(arguments.getChild(1) instanceof ColumnNode)) {
      throw new AnalysisException(
          "JOIN key must compare a left and a right column: " + key.describe());
    }
    return new ColumnNode[] {
        (ColumnNode) arguments.getChild(0), (ColumnNode) arguments.getChild(1)};
  }

  private static class JoinValidationVisitor extends InDepthQueryTreeVisitorWithContext {
    public JoinValidationVisitor(Context context) {
      super(context);
    }

    @Override
    public TraversalOrder traversalOrder() { return TraversalOrder.BOTTOM_UP; }

    @Override
    protected void visitImpl(QueryTreeNode node) throws AnalysisException {
      JoinNode join = node.as(JoinNode.class);
      if (join == null || join.getKind() == JoinKind.CROSS) return;
      if (getSettings().joinAlgorithm() != JoinAlgorithm.FULL_SORTING_MERGE) return;

      JoinKeys keys = new JoinKeys(join);
      FullSortingMergeJoin mergeJoin = new FullSortingMergeJoin(
          keys.toTableJoin(join.getKind()), keys.rightBlock());
      LOG.debug("Checking {} join keys of query {}",
          mergeJoin.getTableJoin().getOnlyClause(), getContext().getQueryId());
      mergeJoin.checkTypesOfKeys(keys.leftBlock());
    }
  }
}

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

import org.qtree.analysis.Context;
import org.qtree.analysis.QueryTreeNode;
import org.qtree.common.AnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

/**
 * Runs a sequence of passes over a query tree, in the order they were
 * added.
 */
public class QueryTreePassManager {
  private final static Logger LOG = LoggerFactory.getLogger(QueryTreePassManager.class);

  private final Context context_;
  private final List<QueryTreePass> passes_ = new ArrayList<>();

  public QueryTreePassManager(Context context) {
    Preconditions.checkNotNull(context);
    context_ = context;
  }

  /**
   * Manager with the standard passes. Validation of the tree depth comes
   * first so that later passes never recurse into an overly deep tree;
   * names are normalized before the passes that match on them.
   */
  public static QueryTreePassManager createDefault(Context context) {
    return new QueryTreePassManager(context)
        .addPass(new CheckQueryTreeDepthPass())
        .addPass(new NormalizeFunctionNamesPass())
        .addPass(new SumIfToCountIfPass())
        .addPass(new ValidateAggregateFunctionsPass())
        .addPass(new FullSortingMergeJoinValidationPass());
  }

  public QueryTreePassManager addPass(QueryTreePass pass) {
    Preconditions.checkNotNull(pass);
    passes_.add(pass);
    return this;
  }

  public List<QueryTreePass> getPasses() { return ImmutableList.copyOf(passes_); }
  public Context getContext() { return context_; }

  public void run(QueryTreeNode root) throws AnalysisException {
    run(root, passes_.size());
  }

  /**
   * Runs the first <code>upToPassIndex</code> passes.
   */
  public void run(QueryTreeNode root, int upToPassIndex) throws AnalysisException {
    Preconditions.checkNotNull(root);
    Preconditions.checkArgument(upToPassIndex >= 0 && upToPassIndex <= passes_.size(),
        "Requested to run passes up to %s pass. There are only %s passes",
        upToPassIndex, passes_.size());
    for (int i = 0; i < upToPassIndex; i++) {
      QueryTreePass pass = passes_.get(i);
      Stopwatch sw = Stopwatch.createStarted();
      pass.run(root, context_);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Pass {} ({}) of query {} done in {}", i + 1, pass.getName(),
            context_.getQueryId(), sw);
      }
    }
  }

  /**
   * Numbered list of the passes with their descriptions, one per line.
   */
  public String dump() {
    StringBuilder buf = new StringBuilder();
    for (int i = 0; i < passes_.size(); i++) {
      QueryTreePass pass = passes_.get(i);
      buf.append(i + 1).append(". ").append(pass.getName())
          .append(": ").append(pass.getDescription()).append("\n");
    }
    return buf.toString();
  }
}

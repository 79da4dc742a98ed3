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

import org.qtree.analysis.Context;
import org.qtree.analysis.QueryTreeNode;
import org.qtree.common.AnalysisException;

/**
 * A single analysis or rewrite step over a query tree. Passes are run in a
 * fixed order by {@link QueryTreePassManager}. A pass may change the tree in
 * place; it may not assume that another pass has or has not run unless the
 * manager's order guarantees it.
 */
public interface QueryTreePass {
  String getName();
  String getDescription();

  /**
   * Runs the pass over the tree rooted at <code>root</code>. The context
   * applies to nodes outside any scope node.
   */
  void run(QueryTreeNode root, Context context) throws AnalysisException;
}

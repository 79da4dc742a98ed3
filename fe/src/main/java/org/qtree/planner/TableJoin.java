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

import org.qtree.analysis.JoinNode.JoinKind;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Planner's description of a join: the kind and the ON clauses, combined
 * by OR.
 */
public class TableJoin {
  private final JoinKind kind_;
  private final List<JoinOnClause> clauses_;

  public TableJoin(JoinKind kind, List<JoinOnClause> clauses) {
    Preconditions.checkNotNull(kind);
    kind_ = kind;
    clauses_ = ImmutableList.copyOf(clauses);
  }

  public JoinKind kind() { return kind_; }
  public List<JoinOnClause> getClauses() { return clauses_; }

  public JoinOnClause getOnlyClause() {
    Preconditions.checkState(clauses_.size() == 1,
        "Expected exactly one join clause, got %s", clauses_.size());
    return clauses_.get(0);
  }
}

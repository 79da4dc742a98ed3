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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * One disjunct of a join condition: key columns compared pairwise, the
 * i-th left key with the i-th right key.
 */
public class JoinOnClause {
  private final List<String> keyNamesLeft_;
  private final List<String> keyNamesRight_;

  public JoinOnClause(List<String> keyNamesLeft, List<String> keyNamesRight) {
    Preconditions.checkArgument(keyNamesLeft.size() == keyNamesRight.size(),
        "Join keys mismatch: %s left, %s right",
        keyNamesLeft.size(), keyNamesRight.size());
    keyNamesLeft_ = ImmutableList.copyOf(keyNamesLeft);
    keyNamesRight_ = ImmutableList.copyOf(keyNamesRight);
  }

  public List<String> getKeyNamesLeft() { return keyNamesLeft_; }
  public List<String> getKeyNamesRight() { return keyNamesRight_; }
  public int size() { return keyNamesLeft_.size(); }

  @Override
  public String toString() { return keyNamesLeft_ + " = " + keyNamesRight_; }
}

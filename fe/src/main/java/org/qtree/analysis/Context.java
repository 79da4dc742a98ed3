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

package org.qtree.analysis;

import com.google.common.base.Preconditions;

/**
 * Analysis environment of a query or subquery. A context is immutable and is
 * shared by reference: many nodes may point to the same context, and the
 * visitors rebind the "current" context while walking the tree without ever
 * copying it.
 */
public class Context {
  private final String queryId_;
  private final Settings settings_;

  public Context(String queryId, Settings settings) {
    Preconditions.checkNotNull(queryId);
    Preconditions.checkNotNull(settings);
    queryId_ = queryId;
    settings_ = settings;
  }

  public static Context create(String queryId) {
    return new Context(queryId, Settings.DEFAULT);
  }

  /**
   * Returns a context for the same query with different settings, as
   * created for a subquery with a SETTINGS clause.
   */
  public Context withSettings(Settings settings) {
    return new Context(queryId_, settings);
  }

  public String getQueryId() { return queryId_; }
  public Settings getSettingsRef() { return settings_; }

  @Override
  public String toString() { return "Context(" + queryId_ + ")"; }
}

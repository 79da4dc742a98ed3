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

package org.qtree.common;

/**
 * Thrown for errors encountered during analysis of a query tree: a malformed
 * tree shape, a missing column, an invalid setting and so on.
 */
@SuppressWarnings("serial")
public class AnalysisException extends QueryTreeException {

  public static final String NOT_FOUND_COLUMN_MSG =
      "Not found column %s in block. There are only columns: %s";
  public static final String TOO_DEEP_MSG =
      "Query tree is too deep. Maximum: %d";
  public static final String UNKNOWN_SETTING_MSG =
      "Unknown setting %s";

  public AnalysisException(String msg, Throwable cause) {
    super(msg, cause);
  }

  public AnalysisException(String msg) {
    super(msg);
  }

  public static AnalysisException notFoundColumn(String name,
      String available) {
    return new AnalysisException(
        String.format(NOT_FOUND_COLUMN_MSG, name, available));
  }

  public static AnalysisException tooDeep(int maxDepth) {
    return new AnalysisException(String.format(TOO_DEEP_MSG, maxDepth));
  }

  public static AnalysisException unknownSetting(String name) {
    return new AnalysisException(String.format(UNKNOWN_SETTING_MSG, name));
  }
}

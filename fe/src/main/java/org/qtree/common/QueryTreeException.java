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
 * Root of the checked exceptions raised while analyzing or rewriting a
 * query tree. Errors that indicate a bug in the caller rather than a
 * problem with the query are unchecked and raised via
 * {@link com.google.common.base.Preconditions}.
 */
@SuppressWarnings("serial")
public abstract class QueryTreeException extends Exception {
  protected QueryTreeException(String msg, Throwable cause) {
    super(msg, cause);
  }

  protected QueryTreeException(String msg) {
    super(msg);
  }
}

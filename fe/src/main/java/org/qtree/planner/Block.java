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

import java.util.ArrayList;
import java.util.List;

import org.qtree.catalog.DataType;
import org.qtree.common.AnalysisException;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Header of a block of rows: the ordered list of columns with their names
 * and types. The planner works with headers only; no row data is held.
 */
public class Block {
  private final List<ColumnWithTypeAndName> columns_ = new ArrayList<>();

  public Block() {}

  public Block(List<ColumnWithTypeAndName> columns) {
    columns_.addAll(columns);
  }

  public Block insert(ColumnWithTypeAndName column) {
    columns_.add(column);
    return this;
  }

  public Block insert(String name, DataType type) {
    return insert(new ColumnWithTypeAndName(name, type));
  }

  public int columns() { return columns_.size(); }
  public boolean isEmpty() { return columns_.isEmpty(); }

  public List<ColumnWithTypeAndName> getColumns() {
    return ImmutableList.copyOf(columns_);
  }

  public boolean has(String name) {
    return findByName(name) != null;
  }

  public ColumnWithTypeAndName getByName(String name) throws AnalysisException {
    ColumnWithTypeAndName column = findByName(name);
    if (column == null) {
      throw AnalysisException.notFoundColumn(name, dumpNames());
    }
    return column;
  }

  /**
   * Returns a block with the same structure. Since a block carries no data,
   * this is a copy of the header.
   */
  public Block cloneEmpty() {
    return new Block(columns_);
  }

  public String dumpNames() {
    List<String> names = new ArrayList<>();
    for (ColumnWithTypeAndName column : columns_) names.add(column.getName());
    return Joiner.on(", ").join(names);
  }

  @Override
  public String toString() { return Joiner.on(", ").join(columns_); }

  private ColumnWithTypeAndName findByName(String name) {
    for (ColumnWithTypeAndName column : columns_) {
      if (column.getName().equals(name)) return column;
    }
    return null;
  }
}

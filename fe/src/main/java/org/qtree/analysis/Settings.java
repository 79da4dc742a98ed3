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

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.qtree.common.AnalysisException;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Read-only view of the settings which influence analysis. Each setting has a
 * name (as used in a SETTINGS clause or a properties file) and a default.
 * Instances are immutable; use {@link #builder()} or
 * {@link #toBuilder()} to derive modified settings.
 */
public class Settings {
  public static final String JOIN_ALGORITHM = "join_algorithm";
  public static final String OPTIMIZE_REWRITE_SUM_IF_TO_COUNT_IF =
      "optimize_rewrite_sum_if_to_count_if";
  public static final String NORMALIZE_FUNCTION_NAMES = "normalize_function_names";
  public static final String MAX_AST_DEPTH = "max_ast_depth";

  public enum JoinAlgorithm {
    DEFAULT("default"),
    HASH("hash"),
    PARTIAL_MERGE("partial_merge"),
    FULL_SORTING_MERGE("full_sorting_merge");

    private final String name_;

    private JoinAlgorithm(String name) {
      name_ = name;
    }

    @Override
    public String toString() { return name_; }

    public static JoinAlgorithm fromName(String name) throws AnalysisException {
      for (JoinAlgorithm algorithm : values()) {
        if (algorithm.name_.equalsIgnoreCase(name)) return algorithm;
      }
      throw new AnalysisException(String.format(
          "Unknown value '%s' for setting %s", name, JOIN_ALGORITHM));
    }
  }

  public static final Settings DEFAULT = new Builder().build();

  public static class Builder {
    private JoinAlgorithm joinAlgorithm_ = JoinAlgorithm.DEFAULT;
    private boolean optimizeRewriteSumIfToCountIf_ = true;
    private boolean normalizeFunctionNames_ = true;
    private int maxAstDepth_ = 1000;

    private Builder() {}

    private Builder(Settings from) {
      joinAlgorithm_ = from.joinAlgorithm_;
      optimizeRewriteSumIfToCountIf_ = from.optimizeRewriteSumIfToCountIf_;
      normalizeFunctionNames_ = from.normalizeFunctionNames_;
      maxAstDepth_ = from.maxAstDepth_;
    }

    public Builder joinAlgorithm(JoinAlgorithm algorithm) {
      Preconditions.checkNotNull(algorithm);
      joinAlgorithm_ = algorithm;
      return this;
    }

    public Builder optimizeRewriteSumIfToCountIf(boolean flag) {
      optimizeRewriteSumIfToCountIf_ = flag;
      return this;
    }

    public Builder normalizeFunctionNames(boolean flag) {
      normalizeFunctionNames_ = flag;
      return this;
    }

    public Builder maxAstDepth(int depth) {
      Preconditions.checkArgument(depth >= 0);
      maxAstDepth_ = depth;
      return this;
    }

    /**
     * Sets a value given by name, as it appears in a SETTINGS clause.
     */
    public Builder set(String name, String value) throws AnalysisException {
      Preconditions.checkNotNull(name);
      Preconditions.checkNotNull(value);
      String trimmed = value.trim();
      switch (name.trim().toLowerCase(Locale.ROOT)) {
      case JOIN_ALGORITHM:
        return joinAlgorithm(JoinAlgorithm.fromName(trimmed));
      case OPTIMIZE_REWRITE_SUM_IF_TO_COUNT_IF:
        return optimizeRewriteSumIfToCountIf(parseBoolean(name, trimmed));
      case NORMALIZE_FUNCTION_NAMES:
        return normalizeFunctionNames(parseBoolean(name, trimmed));
      case MAX_AST_DEPTH:
        return maxAstDepth(parseDepth(name, trimmed));
      default:
        throw AnalysisException.unknownSetting(name);
      }
    }

    public Builder setAll(Map<String, String> values) throws AnalysisException {
      for (Map.Entry<String, String> entry : values.entrySet()) {
        set(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public Settings build() { return new Settings(this); }
  }

  private final JoinAlgorithm joinAlgorithm_;
  private final boolean optimizeRewriteSumIfToCountIf_;
  private final boolean normalizeFunctionNames_;
  private final int maxAstDepth_;

  private Settings(Builder builder) {
    joinAlgorithm_ = builder.joinAlgorithm_;
    optimizeRewriteSumIfToCountIf_ = builder.optimizeRewriteSumIfToCountIf_;
    normalizeFunctionNames_ = builder.normalizeFunctionNames_;
    maxAstDepth_ = builder.maxAstDepth_;
  }

  public static Builder builder() { return new Builder(); }
  public Builder toBuilder() { return new Builder(this); }

  /**
   * Default settings overridden by the entries of a properties set.
   */
  public static Settings fromProperties(Properties props) throws AnalysisException {
    Builder builder = builder();
    for (String name : props.stringPropertyNames()) {
      builder.set(name, props.getProperty(name));
    }
    return builder.build();
  }

  /**
   * Loads settings from a properties file on the class path.
   */
  public static Settings fromResource(String resourcePath) throws AnalysisException {
    try (InputStream in =
        Settings.class.getClassLoader().getResourceAsStream(resourcePath)) {
      if (in == null) {
        throw new AnalysisException("Settings resource not found: " + resourcePath);
      }
      Properties props = new Properties();
      props.load(in);
      return fromProperties(props);
    } catch (IOException e) {
      throw new AnalysisException("Failed to read settings from " + resourcePath, e);
    }
  }

  public JoinAlgorithm joinAlgorithm() { return joinAlgorithm_; }
  public boolean optimizeRewriteSumIfToCountIf() { return optimizeRewriteSumIfToCountIf_; }
  public boolean normalizeFunctionNames() { return normalizeFunctionNames_; }

  /**
   * Maximum depth of the query tree. Zero means unlimited.
   */
  public int maxAstDepth() { return maxAstDepth_; }

  /**
   * Returns all settings by name, in declaration order.
   */
  public Map<String, String> toMap() {
    return ImmutableMap.of(
        JOIN_ALGORITHM, joinAlgorithm_.toString(),
        OPTIMIZE_REWRITE_SUM_IF_TO_COUNT_IF,
          Boolean.toString(optimizeRewriteSumIfToCountIf_),
        NORMALIZE_FUNCTION_NAMES, Boolean.toString(normalizeFunctionNames_),
        MAX_AST_DEPTH, Integer.toString(maxAstDepth_));
  }

  @Override
  public String toString() { return toMap().toString(); }

  private static boolean parseBoolean(String name, String value)
      throws AnalysisException {
    switch (value.toLowerCase(Locale.ROOT)) {
    case "1":
    case "true":
      return true;
    case "0":
    case "false":
      return false;
    default:
      throw new AnalysisException(String.format(
          "Cannot parse '%s' as boolean for setting %s", value, name));
    }
  }

  private static int parseDepth(String name, String value) throws AnalysisException {
    try {
      int depth = Integer.parseInt(value);
      if (depth >= 0) return depth;
    } catch (NumberFormatException e) {
      throw new AnalysisException(String.format(
          "Cannot parse '%s' as a number for setting %s", value, name), e);
    }
    throw new AnalysisException(String.format(
        "Setting %s must not be negative: %s", name, value));
  }
}

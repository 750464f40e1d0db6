/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.vista.models.context;

import java.util.HashMap;
import java.util.Map;

/** Comparison operators of context conditions. */
public enum Operator {
  EXACT("exact", false),
  NOT_EXACT("-exact", true),
  GT("gt", false),
  GTE("gte", false),
  LT("lt", false),
  LTE("lte", false),
  IN("in", false),
  NOT_IN("-in", true),
  RANGE("range", false),
  NOT_RANGE("-range", true),
  ISNULL("isnull", false),
  ICONTAINS("icontains", false),
  NOT_ICONTAINS("-icontains", true);

  private static final Map<String, Operator> keywords = new HashMap<>();

  static {
    for (var operator : values()) {
      keywords.put(operator.keyword, operator);
    }
  }

  private final String keyword;
  private final boolean negated;

  private Operator(String keyword, boolean negated) {
    this.keyword = keyword;
    this.negated = negated;
  }

  public String getKeyword() {
    return keyword;
  }

  public boolean isNegated() {
    return negated;
  }

  /**
   * Finds an operator by its keyword.
   *
   * @param keyword operator keyword such as "gte" or "-in"
   * @return the operator or null if the keyword is unknown
   */
  public static Operator forKeyword(String keyword) {
    return keyword != null ? keywords.get(keyword) : null;
  }
}

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
package io.isima.vista.models;

import com.fasterxml.jackson.annotation.JsonValue;

/** Sort direction. */
public enum Direction {
  ASC,
  DESC;

  @JsonValue
  public String toValue() {
    return name().toLowerCase();
  }

  /**
   * Parses a direction keyword.
   *
   * @param src "asc" or "desc", case insensitive
   * @return the direction
   * @throws IllegalArgumentException thrown when the keyword is unknown
   */
  public static Direction fromValue(String src) {
    return Direction.valueOf(src.trim().toUpperCase());
  }
}

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
package io.isima.vista.query;

import io.isima.vista.models.Direction;
import io.isima.vista.tree.TreeRow;
import java.util.Comparator;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** An ordering key: query path and direction. */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class OrderKey {
  private final String path;
  private final Direction direction;

  public static OrderKey asc(String path) {
    return new OrderKey(path, Direction.ASC);
  }

  public static OrderKey desc(String path) {
    return new OrderKey(path, Direction.DESC);
  }

  static Comparator<TreeRow> comparator(List<OrderKey> keys) {
    Comparator<TreeRow> comparator = (a, b) -> 0;
    for (var key : keys) {
      final Comparator<TreeRow> byKey =
          (a, b) -> Values.compare(a.get(key.getPath()), b.get(key.getPath()));
      comparator =
          comparator.thenComparing(key.getDirection() == Direction.DESC ? byKey.reversed() : byKey);
    }
    return comparator;
  }
}

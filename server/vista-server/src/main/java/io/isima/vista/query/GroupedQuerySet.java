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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Count aggregation of a query set grouped by one or more query paths. */
public class GroupedQuerySet {

  public enum Ordering {
    NONE,
    VALUES,
    COUNT_DESCENDING
  }

  private static final Comparator<GroupCount> BY_VALUES =
      (a, b) -> {
        for (int i = 0; i < a.getValues().size(); ++i) {
          final int result = Values.compare(a.getValues().get(i), b.getValues().get(i));
          if (result != 0) {
            return result;
          }
        }
        return 0;
      };

  private static final Comparator<GroupCount> BY_COUNT_DESCENDING =
      Comparator.comparingLong(GroupCount::getCount).reversed();

  private final QuerySet source;
  private final ImmutableList<String> paths;
  private final Ordering ordering;

  GroupedQuerySet(QuerySet source, List<String> paths) {
    this(source, ImmutableList.copyOf(paths), Ordering.NONE);
  }

  private GroupedQuerySet(QuerySet source, ImmutableList<String> paths, Ordering ordering) {
    if (paths.isEmpty()) {
      throw new IllegalArgumentException("At least one group path is required");
    }
    this.source = source;
    this.paths = paths;
    this.ordering = ordering;
  }

  public List<String> getPaths() {
    return paths;
  }

  /** Orders groups by their key values, first path first. */
  public GroupedQuerySet orderByValues() {
    return new GroupedQuerySet(source, paths, Ordering.VALUES);
  }

  /** Orders groups by descending count; groups of equal count are ordered by their values. */
  public GroupedQuerySet orderByCountDescending() {
    return new GroupedQuerySet(source, paths, Ordering.COUNT_DESCENDING);
  }

  /**
   * Evaluates the aggregation.
   *
   * @return one entry per distinct combination of group key values
   */
  public List<GroupCount> fetch() {
    // normalized key -> group; a group reports the values of its first row
    final Map<List<Object>, Group> counters = new LinkedHashMap<>();
    for (var row : source) {
      final var values = new Object[paths.size()];
      final var key = new Object[paths.size()];
      for (int i = 0; i < values.length; ++i) {
        values[i] = row.get(paths.get(i));
        key[i] = Values.groupKey(values[i]);
      }
      counters.computeIfAbsent(Arrays.asList(key), (k) -> new Group(values)).count++;
    }
    final List<GroupCount> groups = new ArrayList<>(counters.size());
    counters.forEach(
        (key, group) ->
            groups.add(
                new GroupCount(
                    Collections.unmodifiableList(Arrays.asList(group.values)), group.count)));
    switch (ordering) {
      case VALUES:
        groups.sort(BY_VALUES);
        break;
      case COUNT_DESCENDING:
        groups.sort(BY_COUNT_DESCENDING.thenComparing(BY_VALUES));
        break;
      default:
        break;
    }
    return groups;
  }

  private static class Group {
    private final Object[] values;
    private long count;

    Group(Object[] values) {
      this.values = values;
    }
  }
}

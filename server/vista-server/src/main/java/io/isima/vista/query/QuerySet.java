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
import com.google.common.collect.Iterators;
import io.isima.vista.models.ModelDesc;
import io.isima.vista.tree.DataTree;
import io.isima.vista.tree.TreeRow;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Immutable, lazily evaluated set of root rows of a data tree.
 *
 * <p>Every refinement returns a new query set. Rows are read from the record source only when the
 * set is iterated or counted; counting streams over the rows without holding them.
 */
public class QuerySet implements Iterable<TreeRow> {

  private final DataTree tree;
  private final ImmutableList<Predicate<TreeRow>> filters;
  private final ImmutableList<OrderKey> ordering;

  private QuerySet(
      DataTree tree, ImmutableList<Predicate<TreeRow>> filters, ImmutableList<OrderKey> ordering) {
    this.tree = tree;
    this.filters = filters;
    this.ordering = ordering;
  }

  public static QuerySet all(DataTree tree) {
    return new QuerySet(tree, ImmutableList.of(), ImmutableList.of());
  }

  public DataTree getTree() {
    return tree;
  }

  public ModelDesc getModel() {
    return tree.getRootModel();
  }

  public List<OrderKey> getOrdering() {
    return ordering;
  }

  public QuerySet filter(Predicate<TreeRow> predicate) {
    return new QuerySet(
        tree,
        ImmutableList.<Predicate<TreeRow>>builder().addAll(filters).add(predicate).build(),
        ordering);
  }

  public QuerySet exclude(Predicate<TreeRow> predicate) {
    return filter(predicate.negate());
  }

  /** Replaces the ordering of the set. */
  public QuerySet orderBy(List<OrderKey> keys) {
    return new QuerySet(tree, filters, ImmutableList.copyOf(keys));
  }

  public QuerySet unordered() {
    return ordering.isEmpty() ? this : new QuerySet(tree, filters, ImmutableList.of());
  }

  /**
   * Counts matching rows.
   *
   * @return number of rows
   */
  public long count() {
    long count = 0;
    final var iterator = filtered();
    while (iterator.hasNext()) {
      iterator.next();
      ++count;
    }
    return count;
  }

  public boolean exists() {
    return filtered().hasNext();
  }

  @Override
  public Iterator<TreeRow> iterator() {
    if (ordering.isEmpty()) {
      return filtered();
    }
    final List<TreeRow> rows = new ArrayList<>();
    filtered().forEachRemaining(rows::add);
    rows.sort(OrderKey.comparator(ordering));
    return rows.iterator();
  }

  public GroupedQuerySet groupCount(List<String> paths) {
    return new GroupedQuerySet(unordered(), paths);
  }

  private Iterator<TreeRow> filtered() {
    final var rows = tree.scanRoot().iterator();
    if (filters.isEmpty()) {
      return rows;
    }
    return Iterators.filter(rows, this::matches);
  }

  private boolean matches(TreeRow row) {
    for (var filter : filters) {
      if (!filter.test(row)) {
        return false;
      }
    }
    return true;
  }
}

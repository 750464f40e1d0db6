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

import com.google.common.collect.Iterators;
import io.isima.vista.export.ExportFormat;
import io.isima.vista.export.Exporter;
import io.isima.vista.models.context.DataContext;
import io.isima.vista.tree.DataTree;
import io.isima.vista.tree.TreeRow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Executable binding of a context, a view and a data tree.
 *
 * <p>A plan is immutable. The query set and row iterable it hands out are fresh lazy values, so a
 * plan may be consumed by a paginator, an exporter and a distribution at the same time.
 */
@ToString(of = {"tree", "context"})
public class QueryPlan {
  @Getter private final DataTree tree;
  @Getter private final DataContext context;
  @Getter private final ViewNode view;
  @Getter private final RowLayout layout;
  private final QuerySet queryset;

  public QueryPlan(
      DataTree tree, DataContext context, ViewNode view, RowLayout layout, QuerySet queryset) {
    this.tree = tree;
    this.context = context;
    this.view = view;
    this.layout = layout;
    this.queryset = queryset;
  }

  /**
   * The filtered and ordered query set of the plan.
   *
   * @return the query set
   */
  public QuerySet getQueryset() {
    return queryset;
  }

  /**
   * Rows of the plan, projected to the layout columns.
   *
   * @return lazily evaluated rows, restartable
   */
  public Iterable<Row> getIterable() {
    return () -> Iterators.transform(queryset.iterator(), this::toRow);
  }

  public Exporter<?> getExporter(ExportFormat format) {
    return format.create(layout);
  }

  private Row toRow(TreeRow source) {
    final var fields = layout.getFields();
    final List<Object> values = new ArrayList<>(fields.size());
    for (var field : fields) {
      values.add(source.get(field.getPath()));
    }
    return new Row(source.getPk(), Collections.unmodifiableList(values));
  }
}

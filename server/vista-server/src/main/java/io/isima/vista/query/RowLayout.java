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
import io.isima.vista.field.FieldReference;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;

/** Shape of the rows a query plan produces. */
public class RowLayout {
  @Getter private final boolean includePk;
  @Getter private final String pkColumn;
  @Getter private final List<SelectColumn> columns;
  private final ImmutableList<FieldReference> fields;
  private final List<String> labels;

  public RowLayout(boolean includePk, String pkColumn, List<SelectColumn> columns) {
    this.includePk = includePk;
    this.pkColumn = pkColumn;
    this.columns = List.copyOf(columns);
    final var builder = ImmutableList.<FieldReference>builder();
    columns.forEach((column) -> builder.addAll(column.getFields()));
    this.fields = builder.build();
    this.labels = buildLabels(includePk, pkColumn, this.columns);
  }

  /** Projected fields, flattened over the selected concepts. */
  public List<FieldReference> getFields() {
    return fields;
  }

  /**
   * Output labels, one per exported column. The primary key comes first when it is included.
   * A label already taken by an earlier column gets the suffix {@code _2}, {@code _3} and so on.
   *
   * @return labels, unique within the layout
   */
  public List<String> getLabels() {
    return labels;
  }

  private static List<String> buildLabels(
      boolean includePk, String pkColumn, List<SelectColumn> columns) {
    final Set<String> taken = new LinkedHashSet<>();
    if (includePk) {
      taken.add(pkColumn);
    }
    for (var column : columns) {
      final var concept = column.getConcept();
      if (column.getFields().size() == 1) {
        taken.add(unique(concept.getName(), taken));
      } else {
        for (var field : column.getFields()) {
          taken.add(unique(concept.getName() + " " + field.getField().getName(), taken));
        }
      }
    }
    return ImmutableList.copyOf(taken);
  }

  private static String unique(String label, Set<String> taken) {
    if (!taken.contains(label)) {
      return label;
    }
    int suffix = 2;
    while (taken.contains(label + "_" + suffix)) {
      ++suffix;
    }
    return label + "_" + suffix;
  }
}

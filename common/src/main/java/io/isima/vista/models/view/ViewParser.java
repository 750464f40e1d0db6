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
package io.isima.vista.models.view;

import com.fasterxml.jackson.databind.JsonNode;
import io.isima.vista.errors.exception.InvalidViewException;
import io.isima.vista.models.Direction;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses data view documents.
 *
 * <p>Two shapes are accepted. The facet list
 *
 * <pre>
 * [{"concept": 1, "visible": true, "sort": "asc", "sort_index": 0}, {"concept": 2}]
 * </pre>
 *
 * <p>and the older column/ordering object
 *
 * <pre>
 * {"columns": [1, 2], "ordering": [[1, "desc"]]}
 * </pre>
 */
public class ViewParser {

  public static DataView parse(JsonNode src) throws InvalidViewException {
    if (src == null || src.isNull() || src.isMissingNode() || src.size() == 0) {
      return DataView.empty();
    }
    if (src.isArray()) {
      return parseFacets(src);
    }
    if (src.isObject()) {
      return parseColumns(src);
    }
    throw new InvalidViewException("view must be an array or an object");
  }

  private static DataView parseFacets(JsonNode src) throws InvalidViewException {
    final List<ViewFacet> facets = new ArrayList<>();
    for (int i = 0; i < src.size(); ++i) {
      final var node = src.get(i);
      final var concept = node.get("concept");
      if (concept == null || !concept.canConvertToLong()) {
        throw new InvalidViewException("facet %d: concept id is missing", i);
      }
      final var visible = node.path("visible").asBoolean(true);
      final var sort = node.get("sort");
      Direction direction = null;
      if (sort != null && !sort.isNull()) {
        direction = parseDirection(sort.asText(), i);
      }
      final var sortIndex = node.get("sort_index");
      facets.add(
          new ViewFacet(
              concept.asLong(),
              visible,
              direction,
              sortIndex != null && sortIndex.canConvertToInt() ? sortIndex.asInt() : null));
    }
    return new DataView(facets);
  }

  private static DataView parseColumns(JsonNode src) throws InvalidViewException {
    final var columns = src.path("columns");
    final Map<Long, Direction> directions = new LinkedHashMap<>();
    final Map<Long, Integer> sortIndexes = new LinkedHashMap<>();
    final var ordering = src.path("ordering");
    for (int i = 0; i < ordering.size(); ++i) {
      final var pair = ordering.get(i);
      if (!pair.isArray() || pair.size() != 2 || !pair.get(0).canConvertToLong()) {
        throw new InvalidViewException("ordering %d: must be a [concept, direction] pair", i);
      }
      directions.put(pair.get(0).asLong(), parseDirection(pair.get(1).asText(), i));
      sortIndexes.put(pair.get(0).asLong(), i);
    }
    final List<ViewFacet> facets = new ArrayList<>();
    for (int i = 0; i < columns.size(); ++i) {
      final var column = columns.get(i);
      if (!column.canConvertToLong()) {
        throw new InvalidViewException("column %d: concept id is missing", i);
      }
      final long id = column.asLong();
      facets.add(new ViewFacet(id, true, directions.get(id), sortIndexes.get(id)));
    }
    // ordering may name concepts that are not displayed
    for (var entry : directions.entrySet()) {
      if (facets.stream().noneMatch((facet) -> facet.getConceptId() == entry.getKey())) {
        final long id = entry.getKey();
        facets.add(new ViewFacet(id, false, entry.getValue(), sortIndexes.get(id)));
      }
    }
    return new DataView(facets);
  }

  private static Direction parseDirection(String src, int position) throws InvalidViewException {
    try {
      return Direction.fromValue(src);
    } catch (IllegalArgumentException e) {
      throw new InvalidViewException("facet %d: unknown sort direction '%s'", position, src);
    }
  }
}

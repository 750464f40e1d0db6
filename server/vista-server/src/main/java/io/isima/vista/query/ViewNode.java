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
import com.google.common.collect.ImmutableMap;
import io.isima.vista.field.FieldReference;
import io.isima.vista.field.FieldResolver;
import io.isima.vista.models.ConceptDesc;
import io.isima.vista.models.Direction;
import io.isima.vista.models.view.DataView;
import io.isima.vista.models.view.ViewFacet;
import io.isima.vista.tree.DataTree;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A data view bound to a tree.
 *
 * <p>Concepts or fields that cannot be resolved are left out with a warning.
 */
public class ViewNode {
  private static final Logger logger = LoggerFactory.getLogger(ViewNode.class);

  private final ImmutableList<SelectColumn> columns;
  private final ImmutableMap<Long, Direction> ordering;
  private final ImmutableList<OrderKey> orderKeys;
  private final int requestedColumns;

  private ViewNode(
      ImmutableList<SelectColumn> columns,
      ImmutableMap<Long, Direction> ordering,
      ImmutableList<OrderKey> orderKeys,
      int requestedColumns) {
    this.columns = columns;
    this.ordering = ordering;
    this.orderKeys = orderKeys;
    this.requestedColumns = requestedColumns;
  }

  public static ViewNode parse(DataView view, DataTree tree, FieldResolver resolver) {
    final var source = view != null ? view : DataView.empty();
    final var columns = ImmutableList.<SelectColumn>builder();
    int requested = 0;
    for (var facet : source.getFacets()) {
      if (!facet.isVisible()) {
        continue;
      }
      ++requested;
      final var column = resolve(facet.getConceptId(), tree, resolver);
      if (column != null && !column.getFields().isEmpty()) {
        columns.add(column);
      }
    }

    final List<ViewFacet> sorted = new ArrayList<>();
    for (var facet : source.getFacets()) {
      if (facet.getDirection() != null) {
        sorted.add(facet);
      }
    }
    // stable, so facets without sort index keep their relative order after indexed ones
    sorted.sort(
        Comparator.comparing(
            ViewFacet::getSortIndex, Comparator.nullsLast(Comparator.naturalOrder())));
    final var ordering = ImmutableMap.<Long, Direction>builder();
    final var orderKeys = ImmutableList.<OrderKey>builder();
    for (var facet : sorted) {
      final var column = resolve(facet.getConceptId(), tree, resolver);
      if (column == null) {
        continue;
      }
      ordering.put(facet.getConceptId(), facet.getDirection());
      for (var field : column.getFields()) {
        orderKeys.add(new OrderKey(field.getPath(), facet.getDirection()));
      }
    }
    return new ViewNode(
        columns.build(), ordering.buildKeepingLast(), orderKeys.build(), requested);
  }

  private static SelectColumn resolve(long conceptId, DataTree tree, FieldResolver resolver) {
    final ConceptDesc concept = tree.getSchema().getConcept(conceptId);
    if (concept == null) {
      logger.warn("Concept {} is not defined in tree {}; skipped", conceptId, tree.getAlias());
      return null;
    }
    final List<FieldReference> fields = new ArrayList<>();
    for (var fieldId : concept.getFieldIds()) {
      final var reference = resolver.resolve(fieldId, tree);
      if (reference.isPresent()) {
        fields.add(reference.get());
      } else {
        logger.warn(
            "Field {} of concept {} does not resolve in tree {}; skipped",
            fieldId,
            conceptId,
            tree.getAlias());
      }
    }
    return new SelectColumn(concept, fields);
  }

  /**
   * Concepts selected for output, in view order.
   *
   * @return the concepts
   */
  public List<ConceptDesc> getConceptsForSelect() {
    final var concepts = ImmutableList.<ConceptDesc>builder();
    columns.forEach((column) -> concepts.add(column.getConcept()));
    return concepts.build();
  }

  public List<SelectColumn> getColumns() {
    return columns;
  }

  /** Concept id to sort direction, in ordering precedence. */
  public Map<Long, Direction> getOrdering() {
    return ordering;
  }

  public List<OrderKey> getOrderKeys() {
    return orderKeys;
  }

  /** Number of visible concepts the view asked for, resolvable or not. */
  public int getRequestedColumns() {
    return requestedColumns;
  }
}

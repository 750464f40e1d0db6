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
package io.isima.vista.tree;

import io.isima.vista.models.FieldDesc;
import io.isima.vista.models.ModelDesc;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * A data tree rooted at one model.
 *
 * <p>Every model reachable from the root through forward relations is part of the tree. A column
 * of such a model is addressed by a query path: the relation names from the root joined by dots,
 * followed by the column name, e.g. {@code office.region.name}. Columns of the root model have no
 * prefix.
 */
@ToString(of = {"alias", "rootModel"})
public class DataTree {

  public static final String PATH_SEPARATOR = ".";

  @Getter private final String alias;
  @Getter private final DataSchema schema;
  @Getter private final RecordSource source;
  private final ModelDesc rootModel;

  // model name -> relation chain from the root
  private final Map<String, List<String>> relationChains;

  public DataTree(String alias, String rootModel, DataSchema schema, RecordSource source) {
    this.alias = Objects.requireNonNull(alias, "'alias' must not be null");
    this.schema = Objects.requireNonNull(schema, "'schema' must not be null");
    this.source = Objects.requireNonNull(source, "'source' must not be null");
    this.rootModel = schema.getModel(rootModel);
    if (this.rootModel == null) {
      throw new IllegalArgumentException("Unknown root model: " + rootModel);
    }
    this.relationChains = Collections.unmodifiableMap(buildRelationChains());
  }

  private Map<String, List<String>> buildRelationChains() {
    final Map<String, List<String>> chains = new HashMap<>();
    chains.put(rootModel.getName(), List.of());
    final var queue = new ArrayDeque<ModelDesc>();
    queue.add(rootModel);
    // breadth first, so each model is reached through its shortest chain
    while (!queue.isEmpty()) {
      final var model = queue.poll();
      final var chain = chains.get(model.getName());
      for (var relation : model.getRelations().values()) {
        final var target = schema.getModel(relation.getTargetModel());
        if (target == null || chains.containsKey(target.getName())) {
          continue;
        }
        final var next = new ArrayList<>(chain);
        next.add(relation.getName());
        chains.put(target.getName(), List.copyOf(next));
        queue.add(target);
      }
    }
    return chains;
  }

  public ModelDesc getRootModel() {
    return rootModel;
  }

  public boolean isInTree(String model) {
    return relationChains.containsKey(model);
  }

  /**
   * Builds the query path of a field relative to the root model.
   *
   * @param field the field
   * @return the path or empty if the field's model is not reachable from the root
   */
  public Optional<String> queryStringForField(FieldDesc field) {
    final var chain = relationChains.get(field.getModel());
    if (chain == null) {
      return Optional.empty();
    }
    final var model = schema.getModel(field.getModel());
    if (model == null || !model.hasColumn(field.getColumn())) {
      return Optional.empty();
    }
    if (chain.isEmpty()) {
      return Optional.of(field.getColumn());
    }
    return Optional.of(String.join(PATH_SEPARATOR, chain) + PATH_SEPARATOR + field.getColumn());
  }

  /**
   * Scans root rows of the tree.
   *
   * @return lazily evaluated root rows
   */
  public Iterable<TreeRow> scanRoot() {
    final var records = source.scan(rootModel.getName());
    return () -> {
      final var iterator = records.iterator();
      return new Iterator<>() {
        @Override
        public boolean hasNext() {
          return iterator.hasNext();
        }

        @Override
        public TreeRow next() {
          return new TreeRow(DataTree.this, iterator.next());
        }
      };
    };
  }
}

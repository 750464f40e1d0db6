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

import io.isima.vista.models.ModelDesc;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Record source that keeps records of each model in memory.
 *
 * <p>The source is populated before it is handed to a tree and is only read afterwards.
 */
public class InMemoryRecordSource implements RecordSource {

  private final Map<String, ModelDesc> models = new HashMap<>();
  private final Map<String, List<Map<String, Object>>> records = new HashMap<>();
  private final Map<String, Map<Object, Map<String, Object>>> primaryIndexes = new HashMap<>();

  public InMemoryRecordSource addModel(ModelDesc model) {
    models.put(model.getName(), model);
    records.putIfAbsent(model.getName(), new ArrayList<>());
    primaryIndexes.putIfAbsent(model.getName(), new HashMap<>());
    return this;
  }

  /**
   * Adds a record to a model.
   *
   * @param model model name, must have been added by {@link #addModel}
   * @param record column values; columns the model does not declare are rejected
   * @return this source
   */
  public InMemoryRecordSource addRecord(String model, Map<String, Object> record) {
    final var desc = models.get(model);
    if (desc == null) {
      throw new IllegalArgumentException("Unknown model: " + model);
    }
    for (var column : record.keySet()) {
      if (!desc.hasColumn(column)) {
        throw new IllegalArgumentException(
            String.format("Model %s has no column %s", model, column));
      }
    }
    final var pk = record.get(desc.getPkColumn());
    Objects.requireNonNull(pk, "primary key of a record must not be null");
    final var copy = Collections.unmodifiableMap(new LinkedHashMap<>(record));
    records.get(model).add(copy);
    primaryIndexes.get(model).put(pk, copy);
    return this;
  }

  @Override
  public Iterable<Map<String, Object>> scan(String model) {
    final var entries = records.get(model);
    if (entries == null) {
      return List.of();
    }
    return Collections.unmodifiableList(entries);
  }

  @Override
  public Map<String, Object> find(String model, Object pk) {
    final var index = primaryIndexes.get(model);
    if (index == null || pk == null) {
      return null;
    }
    return index.get(pk);
  }
}

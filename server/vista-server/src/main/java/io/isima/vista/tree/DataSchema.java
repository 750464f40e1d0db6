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

import io.isima.vista.models.ConceptDesc;
import io.isima.vista.models.FieldDesc;
import io.isima.vista.models.ModelDesc;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Explicit description of the models, fields and concepts a tree is built from. */
public class DataSchema {

  private final Map<String, ModelDesc> models = new LinkedHashMap<>();
  private final Map<Long, FieldDesc> fields = new LinkedHashMap<>();
  private final Map<String, FieldDesc> fieldsByNaturalKey = new LinkedHashMap<>();
  private final Map<Long, ConceptDesc> concepts = new LinkedHashMap<>();

  public DataSchema addModel(ModelDesc model) {
    models.put(model.getName(), model);
    return this;
  }

  public DataSchema addField(FieldDesc field) {
    final var model = models.get(field.getModel());
    if (model == null) {
      throw new IllegalArgumentException("Unknown model of field " + field.getNaturalKey());
    }
    model.addColumn(field.getColumn());
    fields.put(field.getId(), field);
    fieldsByNaturalKey.put(field.getNaturalKey(), field);
    return this;
  }

  public DataSchema addConcept(ConceptDesc concept) {
    concepts.put(concept.getId(), concept);
    return this;
  }

  public ModelDesc getModel(String name) {
    return models.get(name);
  }

  public Collection<ModelDesc> getModels() {
    return Collections.unmodifiableCollection(models.values());
  }

  public FieldDesc getField(long id) {
    return fields.get(id);
  }

  public FieldDesc getField(String naturalKey) {
    return fieldsByNaturalKey.get(naturalKey);
  }

  public ConceptDesc getConcept(long id) {
    return concepts.get(id);
  }
}

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
package io.isima.vista.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Description of a data model (table).
 *
 * <p>Relations are forward references: the named relation follows the foreign key column of this
 * model to the primary key of the target model.
 */
@ToString
public class ModelDesc {
  @Getter private final String name;
  @Getter private final String verboseName;
  @Getter private final String verboseNamePlural;
  @Getter private final String pkColumn;

  private final List<String> columns = new ArrayList<>();
  private final Map<String, Relation> relations = new LinkedHashMap<>();

  public ModelDesc(String name, String verboseName, String verboseNamePlural, String pkColumn) {
    this.name = name;
    this.verboseName = verboseName;
    this.verboseNamePlural = verboseNamePlural;
    this.pkColumn = pkColumn;
    columns.add(pkColumn);
  }

  public ModelDesc addColumn(String column) {
    if (!columns.contains(column)) {
      columns.add(column);
    }
    return this;
  }

  public ModelDesc addRelation(String relationName, String foreignKeyColumn, String targetModel) {
    addColumn(foreignKeyColumn);
    relations.put(relationName, new Relation(relationName, foreignKeyColumn, targetModel));
    return this;
  }

  public List<String> getColumns() {
    return Collections.unmodifiableList(columns);
  }

  public Map<String, Relation> getRelations() {
    return Collections.unmodifiableMap(relations);
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  @Getter
  @ToString
  @AllArgsConstructor
  public static class Relation {
    private final String name;
    private final String foreignKeyColumn;
    private final String targetModel;
  }
}

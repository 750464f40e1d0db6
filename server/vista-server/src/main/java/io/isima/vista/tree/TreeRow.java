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

import java.util.HashMap;
import java.util.Map;

/**
 * One root record of a tree, with lazy access to the records it references.
 *
 * <p>Joined records are looked up on first access of a path through them and kept for the life
 * of the row.
 */
public class TreeRow {
  private final DataTree tree;
  private final Map<String, Object> record;

  // relation chain prefix -> joined record
  private Map<String, Map<String, Object>> joined;

  TreeRow(DataTree tree, Map<String, Object> record) {
    this.tree = tree;
    this.record = record;
  }

  public Object getPk() {
    return record.get(tree.getRootModel().getPkColumn());
  }

  /**
   * Gets the value at a query path.
   *
   * @param path query path relative to the root model
   * @return the value, or null if the value or any record on the way is missing
   */
  public Object get(String path) {
    final int lastSeparator = path.lastIndexOf(DataTree.PATH_SEPARATOR);
    if (lastSeparator < 0) {
      return record.get(path);
    }
    final var target = join(path.substring(0, lastSeparator));
    return target != null ? target.get(path.substring(lastSeparator + 1)) : null;
  }

  private Map<String, Object> join(String chain) {
    if (joined == null) {
      joined = new HashMap<>();
    } else if (joined.containsKey(chain)) {
      return joined.get(chain);
    }
    final var schema = tree.getSchema();
    var model = tree.getRootModel();
    Map<String, Object> current = record;
    for (var relationName : chain.split("\\.")) {
      final var relation = model.getRelations().get(relationName);
      if (relation == null) {
        throw new IllegalArgumentException("Unknown relation in path: " + chain);
      }
      final var key = current.get(relation.getForeignKeyColumn());
      model = schema.getModel(relation.getTargetModel());
      current = key != null ? tree.getSource().find(model.getName(), key) : null;
      if (current == null) {
        break;
      }
    }
    joined.put(chain, current);
    return current;
  }
}

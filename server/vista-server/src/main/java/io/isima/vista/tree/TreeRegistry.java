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

import com.google.common.collect.ImmutableMap;
import io.isima.vista.common.VistaConfig;
import io.isima.vista.errors.exception.InvalidConfigurationException;
import java.util.Collection;

/** Registry of data trees by alias. Built at startup and read-only afterwards. */
public class TreeRegistry {

  private final ImmutableMap<String, DataTree> trees;
  private final String defaultAlias;

  public TreeRegistry(Collection<DataTree> trees) {
    this(trees, VistaConfig.defaultTreeAlias());
  }

  public TreeRegistry(Collection<DataTree> trees, String defaultAlias) {
    final var builder = ImmutableMap.<String, DataTree>builder();
    trees.forEach((tree) -> builder.put(tree.getAlias(), tree));
    this.trees = builder.build();
    this.defaultAlias = defaultAlias;
  }

  public String getDefaultAlias() {
    return defaultAlias;
  }

  /**
   * Gets a tree by alias.
   *
   * @param alias tree alias, null for the default tree
   * @return the tree
   * @throws InvalidConfigurationException thrown when no tree is registered with the alias
   */
  public DataTree get(String alias) throws InvalidConfigurationException {
    final var name = alias != null ? alias : defaultAlias;
    final var tree = trees.get(name);
    if (tree == null) {
      throw new InvalidConfigurationException("Unknown tree: %s", name);
    }
    return tree;
  }

  public Collection<String> getAliases() {
    return trees.keySet();
  }
}

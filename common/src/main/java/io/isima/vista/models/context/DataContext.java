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
package io.isima.vista.models.context;

import lombok.Getter;
import lombok.ToString;

/**
 * A data context: a stored filter over the data tree.
 *
 * <p>A context without a root node applies no restriction.
 */
@Getter
@ToString
public class DataContext {
  private static final DataContext EMPTY = new DataContext(null);

  private final ContextNode root;

  public DataContext(ContextNode root) {
    this.root = root;
  }

  public static DataContext empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return root == null;
  }
}

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

import java.util.Map;

/**
 * Source of model records behind a data tree.
 *
 * <p>A record is a column name to value map. Implementations must allow repeated scans and must
 * not require the caller to hold all records of a model at once.
 */
public interface RecordSource {

  /**
   * Scans all records of a model.
   *
   * @param model model name
   * @return records, evaluated lazily on iteration
   */
  Iterable<Map<String, Object>> scan(String model);

  /**
   * Looks up a record by primary key.
   *
   * @param model model name
   * @param pk primary key value
   * @return the record or null if there is none
   */
  Map<String, Object> find(String model, Object pk);
}

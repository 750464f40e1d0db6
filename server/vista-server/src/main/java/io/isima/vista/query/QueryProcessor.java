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

import io.isima.vista.errors.exception.VistaException;
import io.isima.vista.models.context.DataContext;
import io.isima.vista.models.view.DataView;
import io.isima.vista.tree.DataTree;

/** Strategy that compiles a context and a view into a query plan. */
public interface QueryProcessor {

  /**
   * Name the processor is registered by.
   *
   * @return processor name
   */
  String getName();

  /**
   * Builds a query plan.
   *
   * @param context filter to apply, null or empty for no restriction
   * @param view columns and ordering, null or empty for none
   * @param tree data tree to query
   * @param includePk whether rows start with the root primary key
   * @return the plan
   * @throws VistaException thrown when the context is invalid or the view projects nothing
   */
  QueryPlan build(DataContext context, DataView view, DataTree tree, boolean includePk)
      throws VistaException;

  /**
   * Builds the query set of a context alone, for counting and aggregation.
   *
   * @param context filter to apply, null or empty for no restriction
   * @param tree data tree to query
   * @return the filtered query set
   * @throws VistaException thrown when the context is invalid
   */
  QuerySet getQueryset(DataContext context, DataTree tree) throws VistaException;
}

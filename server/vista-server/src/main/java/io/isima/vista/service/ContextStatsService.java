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
package io.isima.vista.service;

import io.isima.vista.models.ContextStats;
import io.isima.vista.query.QueryProcessorRegistry;
import io.isima.vista.tree.TreeRegistry;

/** Counts the root rows a context matches. */
public class ContextStatsService extends VistaService {

  public ContextStatsService(TreeRegistry trees, QueryProcessorRegistry processors) {
    super(trees, processors);
  }

  public ServiceResponse get(ServiceRequest request) {
    return execute(
        "ContextStats",
        request,
        () -> {
          final var tree = getTree(request);
          final var queryset = getProcessor(request).getQueryset(request.getContext(), tree);
          return ServiceResponse.ok(new ContextStats(queryset.count()));
        });
  }
}

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

import io.isima.vista.errors.QueryError;
import io.isima.vista.errors.exception.NoSuchEntityException;
import io.isima.vista.errors.exception.VistaException;
import io.isima.vista.field.FieldResolver;
import io.isima.vista.models.FieldStats;
import io.isima.vista.query.QueryProcessorRegistry;
import io.isima.vista.query.QuerySet;
import io.isima.vista.query.Values;
import io.isima.vista.tree.TreeRegistry;
import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Summary statistics of a field over the root rows, optionally restricted by the request context.
 *
 * <p>Null values are not counted. Numeric fields also get min, max, avg and sum.
 */
public class FieldStatsService extends VistaService {
  public static final String PARAM_AWARE = "aware";

  private final FieldResolver resolver;

  public FieldStatsService(
      TreeRegistry trees, QueryProcessorRegistry processors, FieldResolver resolver) {
    super(trees, processors);
    this.resolver = resolver;
  }

  public ServiceResponse get(ServiceRequest request, String fieldId) {
    return execute("FieldStats", request, () -> ServiceResponse.ok(stats(request, fieldId)));
  }

  private FieldStats stats(ServiceRequest request, String fieldId) throws VistaException {
    final var tree = getTree(request);
    final var field =
        resolver
            .resolve(fieldId, tree)
            .orElseThrow(
                () -> new NoSuchEntityException(QueryError.NO_SUCH_FIELD, "field", fieldId));
    final boolean aware = RequestParams.getBoolean(request, PARAM_AWARE, false);
    final QuerySet queryset =
        getProcessor(request).getQueryset(aware ? request.getContext() : null, tree);

    final var stats = new FieldStats();
    long count = 0;
    BigDecimal min = null;
    BigDecimal max = null;
    BigDecimal sum = BigDecimal.ZERO;
    for (var row : queryset) {
      final Object value = row.get(field.getPath());
      if (value == null) {
        continue;
      }
      ++count;
      // NaN and infinities are counted but left out of the aggregates
      if (field.isNumeric() && value instanceof Number && Values.isFinite((Number) value)) {
        final var number = Values.toBigDecimal((Number) value);
        min = min == null || number.compareTo(min) < 0 ? number : min;
        max = max == null || number.compareTo(max) > 0 ? number : max;
        sum = sum.add(number);
      }
    }
    stats.setCount(count);
    if (field.isNumeric() && count > 0) {
      stats
          .setMin(min)
          .setMax(max)
          .setSum(sum)
          .setAvg(sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64));
    }
    return stats;
  }
}

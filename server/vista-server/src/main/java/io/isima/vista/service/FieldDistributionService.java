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

import io.isima.vista.audit.UsageOperation;
import io.isima.vista.audit.UsageRecorder;
import io.isima.vista.distribution.DistributionEngine;
import io.isima.vista.distribution.DistributionOptions;
import io.isima.vista.distribution.DistributionResult;
import io.isima.vista.errors.GenericError;
import io.isima.vista.errors.QueryError;
import io.isima.vista.errors.exception.InvalidRequestException;
import io.isima.vista.errors.exception.NoSuchEntityException;
import io.isima.vista.errors.exception.VistaException;
import io.isima.vista.field.FieldReference;
import io.isima.vista.field.FieldResolver;
import io.isima.vista.query.QueryProcessorRegistry;
import io.isima.vista.tree.DataTree;
import io.isima.vista.tree.TreeRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Distribution of a field's values, or of the combinations of several fields' values.
 *
 * <p>Parameters: {@code dimensions} (repeatable field ids), {@code nulls}, {@code cluster}, {@code
 * n}, {@code sort}, {@code aware}, {@code tree} and {@code processor}.
 */
public class FieldDistributionService extends VistaService {
  private static final Logger logger = LoggerFactory.getLogger(FieldDistributionService.class);

  public static final String PARAM_DIMENSIONS = "dimensions";
  public static final String PARAM_NULLS = "nulls";
  public static final String PARAM_CLUSTER = "cluster";
  public static final String PARAM_N = "n";
  public static final String PARAM_SORT = "sort";
  public static final String PARAM_AWARE = "aware";

  private final FieldResolver resolver;
  private final DistributionEngine engine;
  private final UsageRecorder usage;

  public FieldDistributionService(
      TreeRegistry trees,
      QueryProcessorRegistry processors,
      FieldResolver resolver,
      DistributionEngine engine,
      UsageRecorder usage) {
    super(trees, processors);
    this.resolver = resolver;
    this.engine = engine;
    this.usage = usage;
  }

  public ServiceResponse get(ServiceRequest request, String fieldId) {
    return execute(
        "FieldDistribution", request, () -> ServiceResponse.ok(distribution(request, fieldId)));
  }

  private DistributionResult distribution(ServiceRequest request, String fieldId)
      throws VistaException {
    final var tree = getTree(request);
    final var instance =
        resolver
            .resolve(fieldId, tree)
            .orElseThrow(
                () -> new NoSuchEntityException(QueryError.NO_SUCH_FIELD, "field", fieldId));

    final var options =
        new DistributionOptions()
            .setNulls(RequestParams.getBoolean(request, PARAM_NULLS, false))
            .setCluster(RequestParams.getBoolean(request, PARAM_CLUSTER, true))
            .setN(RequestParams.getInt(request, PARAM_N, null))
            .setSort(RequestParams.getString(request, PARAM_SORT, null))
            .setAware(RequestParams.getBoolean(request, PARAM_AWARE, false));
    if (options.getN() != null && options.getN() < 1) {
      throw new InvalidRequestException(
          GenericError.INVALID_VALUE_SYNTAX,
          "Parameter 'n' must be positive: " + options.getN());
    }

    final var dimensions = resolveDimensions(request, tree, instance);
    final var processor = getProcessor(request);
    final var queryset =
        processor.getQueryset(options.isAware() ? request.getContext() : null, tree);
    final var result = engine.distribution(dimensions, queryset, options);

    final var data = new LinkedHashMap<String, Object>();
    data.put("size", result.getSize());
    data.put("clustered", result.isClustered());
    data.put("aware", options.isAware());
    usage.log(UsageOperation.DISTRIBUTION, instance.getField().getNaturalKey(), request, data);
    return result;
  }

  private List<FieldReference> resolveDimensions(
      ServiceRequest request, DataTree tree, FieldReference instance)
      throws InvalidRequestException {
    final List<String> requested = new ArrayList<>();
    for (var value : request.getParamValues(PARAM_DIMENSIONS)) {
      if (value != null && !value.isBlank()) {
        requested.add(value.trim());
      }
    }
    if (requested.isEmpty()) {
      return List.of(instance);
    }
    final List<FieldReference> dimensions = new ArrayList<>();
    for (var identifier : requested) {
      final var reference = resolver.resolve(identifier, tree);
      if (reference.isPresent()) {
        dimensions.add(reference.get());
      } else {
        logger.warn(
            "Dimension {} does not resolve in tree {}; dropped", identifier, tree.getAlias());
      }
    }
    if (dimensions.isEmpty()) {
      throw new InvalidRequestException(
          QueryError.NO_DIMENSIONS, "none of the dimensions resolve: " + requested);
    }
    return dimensions;
  }
}

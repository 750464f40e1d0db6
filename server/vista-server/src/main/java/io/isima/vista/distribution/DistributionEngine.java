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
package io.isima.vista.distribution;

import com.google.common.base.Preconditions;
import io.isima.vista.common.VistaConfig;
import io.isima.vista.errors.exception.DataTooLargeException;
import io.isima.vista.field.FieldReference;
import io.isima.vista.query.GroupCount;
import io.isima.vista.query.QuerySet;
import io.isima.vista.stats.KMeans;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes grouped counts of a query set over one or more dimensions.
 *
 * <p>Numeric distributions of at least {@link #MINIMUM_OBSERVATIONS} groups are down-sampled by
 * weighted k-means; smaller ones, or ones with clustering turned off, only have their outliers
 * moved aside. Numeric distributions that keep null groups are returned as they are.
 * Distributions of more than {@link #MAXIMUM_OBSERVATIONS} groups are refused.
 */
public class DistributionEngine {
  private static final Logger logger = LoggerFactory.getLogger(DistributionEngine.class);

  public static final int MINIMUM_OBSERVATIONS = 500;
  public static final int MAXIMUM_OBSERVATIONS = 50000;

  /**
   * Computes a distribution.
   *
   * @param dimensions resolved dimensions, at least one
   * @param queryset rows to aggregate
   * @param options request options
   * @return the distribution
   * @throws DataTooLargeException thrown when there are more groups than allowed
   */
  public DistributionResult distribution(
      List<FieldReference> dimensions, QuerySet queryset, DistributionOptions options)
      throws DataTooLargeException {
    Preconditions.checkArgument(!dimensions.isEmpty(), "at least one dimension is required");
    final List<String> paths =
        dimensions.stream().map(FieldReference::getPath).collect(Collectors.toList());

    QuerySet source = queryset;
    if (!options.isNulls()) {
      source =
          source.exclude(
              (row) -> {
                for (var path : paths) {
                  if (row.get(path) == null) {
                    return true;
                  }
                }
                return false;
              });
    }

    var grouped = source.groupCount(paths);
    final boolean anyEnumerable = dimensions.stream().anyMatch(FieldReference::isEnumerable);
    if (anyEnumerable && !DistributionOptions.SORT_COUNT.equals(options.getSort())) {
      grouped = grouped.orderByValues();
    } else {
      grouped = grouped.orderByCountDescending();
    }
    final List<GroupCount> groups = grouped.fetch();
    final int size = groups.size();

    if (size == 0) {
      return DistributionResult.empty();
    }
    if (size > MAXIMUM_OBSERVATIONS) {
      throw new DataTooLargeException(size, MAXIMUM_OBSERVATIONS);
    }

    final List<DistributionPoint> points = new ArrayList<>(size);
    groups.forEach((g) -> points.add(new DistributionPoint(g.getValues(), g.getCount())));

    final boolean allNumeric = dimensions.stream().allMatch(FieldReference::isNumeric);
    if (!allNumeric || (options.isNulls() && hasNullValue(points))) {
      return new DistributionResult(points, List.of(), false, size);
    }

    final double[][] observations = new double[size][];
    final long[] counts = new long[size];
    for (int i = 0; i < size; ++i) {
      final var values = points.get(i).getValues();
      observations[i] = new double[values.size()];
      final List<Object> converted = new ArrayList<>(values.size());
      for (int d = 0; d < values.size(); ++d) {
        final double value = ((Number) values.get(d)).doubleValue();
        observations[i][d] = value;
        converted.add(values.get(d) instanceof BigDecimal ? (Object) value : values.get(d));
      }
      counts[i] = points.get(i).getCount();
      points.set(
          i, new DistributionPoint(Collections.unmodifiableList(converted), counts[i]));
    }

    if (options.isCluster() && size >= MINIMUM_OBSERVATIONS) {
      final int k = options.getN() != null ? options.getN() : defaultClusterCount();
      final var clusters = KMeans.weightedCounts(observations, counts, k);
      final List<DistributionPoint> centroids = new ArrayList<>(clusters.getCentroids().size());
      for (int c = 0; c < clusters.getCentroids().size(); ++c) {
        centroids.add(
            new DistributionPoint(
                toValues(clusters.getCentroids().get(c)), clusters.getCounts().get(c)));
      }
      final List<DistributionPoint> outliers = new ArrayList<>();
      clusters.getOutliers().forEach((index) -> outliers.add(points.get(index)));
      logger.debug(
          "Clustered distribution; size={}, k={}, centroids={}, outliers={}",
          size,
          k,
          centroids.size(),
          outliers.size());
      return new DistributionResult(centroids, outliers, true, size);
    }

    final var outlierIndexes = new HashSet<>(KMeans.findOutliers(observations, false));
    final List<DistributionPoint> data = new ArrayList<>(size - outlierIndexes.size());
    final List<DistributionPoint> outliers = new ArrayList<>(outlierIndexes.size());
    for (int i = 0; i < size; ++i) {
      (outlierIndexes.contains(i) ? outliers : data).add(points.get(i));
    }
    return new DistributionResult(data, outliers, false, size);
  }

  protected int defaultClusterCount() {
    return VistaConfig.distributionDefaultClusterCount();
  }

  private static boolean hasNullValue(List<DistributionPoint> points) {
    return points.stream().anyMatch((p) -> p.getValues().contains(null));
  }

  private static List<Object> toValues(double[] centroid) {
    final List<Object> values = new ArrayList<>(centroid.length);
    for (double value : centroid) {
      values.add(value);
    }
    return Collections.unmodifiableList(values);
  }
}

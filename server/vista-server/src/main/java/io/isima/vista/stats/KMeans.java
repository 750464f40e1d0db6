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
package io.isima.vista.stats;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * K-means clustering of weighted observations and outlier detection.
 *
 * <p>Observations are rows of a {@code double[][]}, one column per dimension. Results are
 * deterministic for equal input.
 */
public final class KMeans {
  public static final int MAX_ITERATIONS = 100;
  public static final double TOLERANCE = 1e-5;
  public static final double OUTLIER_THRESHOLD = 3.0;
  public static final int MIN_OUTLIER_OBSERVATIONS = 3;

  private static final long SEED = 1839L;
  private static final EuclideanDistance DISTANCE = new EuclideanDistance();

  private KMeans() {}

  /**
   * Population standard deviation of each dimension. Dimensions without variance report 1.
   *
   * @param observations observations
   * @return per-dimension scale
   */
  public static double[] scales(double[][] observations) {
    final int dims = dimensions(observations);
    final double[] scales = new double[dims];
    final var stddev = new StandardDeviation(false);
    for (int d = 0; d < dims; ++d) {
      final double value = stddev.evaluate(column(observations, d));
      scales[d] = value > 0 && !Double.isNaN(value) ? value : 1.0;
    }
    return scales;
  }

  /**
   * Divides each dimension by its population standard deviation.
   *
   * @param observations observations, not modified
   * @return whitened copy
   */
  public static double[][] whiten(double[][] observations) {
    return scale(observations, scales(observations), true);
  }

  /**
   * Finds the observations far from the mean.
   *
   * <p>An observation is an outlier when its distance to the mean exceeds the mean of all
   * distances by more than three standard deviations of them.
   *
   * @param observations observations
   * @param normalized whether the observations are already whitened
   * @return indexes of the outliers in ascending order
   */
  public static List<Integer> findOutliers(double[][] observations, boolean normalized) {
    final List<Integer> outliers = new ArrayList<>();
    if (observations.length < MIN_OUTLIER_OBSERVATIONS) {
      return outliers;
    }
    final double[][] points = normalized ? observations : whiten(observations);
    final int dims = dimensions(points);
    final double[] center = new double[dims];
    final var mean = new Mean();
    for (int d = 0; d < dims; ++d) {
      center[d] = mean.evaluate(column(points, d));
    }
    final double[] distances = new double[points.length];
    for (int i = 0; i < points.length; ++i) {
      distances[i] = DISTANCE.compute(points[i], center);
    }
    final double threshold =
        mean.evaluate(distances)
            + OUTLIER_THRESHOLD * new StandardDeviation(false).evaluate(distances);
    for (int i = 0; i < distances.length; ++i) {
      if (distances[i] > threshold) {
        outliers.add(i);
      }
    }
    return outliers;
  }

  /**
   * Clusters weighted observations.
   *
   * <p>Outliers are removed first. The remaining observations are whitened and clustered into
   * {@code k} groups with k-means++ seeding and count-weighted centroid updates. Centroids are
   * returned in the original units with the summed counts of their members; empty clusters are
   * dropped. When {@code k} is not below the number of remaining observations they are returned
   * as they are.
   *
   * @param observations observations
   * @param counts weight of each observation
   * @param k number of clusters
   * @return centroids, counts and outlier indexes
   */
  public static WeightedCounts weightedCounts(double[][] observations, long[] counts, int k) {
    Preconditions.checkArgument(
        observations.length == counts.length, "observations and counts differ in length");
    Preconditions.checkArgument(k > 0, "k must be positive: %s", k);

    final List<Integer> outliers = findOutliers(observations, false);
    final List<double[]> points = new ArrayList<>();
    final List<Long> weights = new ArrayList<>();
    int next = 0;
    for (int i = 0; i < observations.length; ++i) {
      if (next < outliers.size() && outliers.get(next) == i) {
        ++next;
        continue;
      }
      points.add(observations[i]);
      weights.add(counts[i]);
    }
    if (k >= points.size()) {
      final List<double[]> copies = new ArrayList<>(points.size());
      points.forEach((p) -> copies.add(p.clone()));
      return new WeightedCounts(copies, weights, outliers);
    }

    final double[][] data = points.toArray(new double[0][]);
    final double[] scales = scales(data);
    final double[][] whitened = scale(data, scales, true);
    final double[] w = new double[weights.size()];
    for (int i = 0; i < w.length; ++i) {
      w[i] = weights.get(i);
    }

    double[][] centroids = seed(whitened, w, k, new MersenneTwister(SEED));
    int[] assignment = assign(whitened, centroids);
    for (int iteration = 0; iteration < MAX_ITERATIONS; ++iteration) {
      final double[][] updated = update(whitened, w, assignment, centroids);
      double movement = 0;
      for (int c = 0; c < k; ++c) {
        movement = Math.max(movement, DISTANCE.compute(centroids[c], updated[c]));
      }
      centroids = updated;
      assignment = assign(whitened, centroids);
      if (movement < TOLERANCE) {
        break;
      }
    }

    final long[] sums = new long[k];
    for (int i = 0; i < assignment.length; ++i) {
      sums[assignment[i]] += weights.get(i);
    }
    final double[][] restored = scale(centroids, scales, false);
    final List<double[]> resultCentroids = new ArrayList<>(k);
    final List<Long> resultCounts = new ArrayList<>(k);
    for (int c = 0; c < k; ++c) {
      if (sums[c] > 0) {
        resultCentroids.add(restored[c]);
        resultCounts.add(sums[c]);
      }
    }
    return new WeightedCounts(resultCentroids, resultCounts, outliers);
  }

  // k-means++: each further seed is drawn with probability proportional to weight * D^2
  private static double[][] seed(double[][] points, double[] weights, int k, RandomGenerator rng) {
    final double[][] centroids = new double[k][];
    final boolean[] taken = new boolean[points.length];
    int first = rng.nextInt(points.length);
    centroids[0] = points[first].clone();
    taken[first] = true;
    final double[] nearest = new double[points.length];
    Arrays.fill(nearest, Double.MAX_VALUE);
    for (int c = 1; c < k; ++c) {
      double total = 0;
      for (int i = 0; i < points.length; ++i) {
        final double d = DISTANCE.compute(points[i], centroids[c - 1]);
        nearest[i] = Math.min(nearest[i], d * d);
        if (!taken[i]) {
          total += weights[i] * nearest[i];
        }
      }
      int chosen = -1;
      if (total > 0) {
        double target = rng.nextDouble() * total;
        for (int i = 0; i < points.length; ++i) {
          if (taken[i]) {
            continue;
          }
          target -= weights[i] * nearest[i];
          if (target <= 0) {
            chosen = i;
            break;
          }
        }
      }
      if (chosen < 0) {
        for (int i = 0; i < points.length && chosen < 0; ++i) {
          if (!taken[i]) {
            chosen = i;
          }
        }
      }
      centroids[c] = points[chosen].clone();
      taken[chosen] = true;
    }
    return centroids;
  }

  private static int[] assign(double[][] points, double[][] centroids) {
    final int[] assignment = new int[points.length];
    for (int i = 0; i < points.length; ++i) {
      double best = Double.MAX_VALUE;
      for (int c = 0; c < centroids.length; ++c) {
        final double d = DISTANCE.compute(points[i], centroids[c]);
        if (d < best) {
          best = d;
          assignment[i] = c;
        }
      }
    }
    return assignment;
  }

  private static double[][] update(
      double[][] points, double[] weights, int[] assignment, double[][] previous) {
    final int dims = previous[0].length;
    final double[][] sums = new double[previous.length][dims];
    final double[] totals = new double[previous.length];
    for (int i = 0; i < points.length; ++i) {
      final int c = assignment[i];
      totals[c] += weights[i];
      for (int d = 0; d < dims; ++d) {
        sums[c][d] += weights[i] * points[i][d];
      }
    }
    final double[][] updated = new double[previous.length][];
    for (int c = 0; c < previous.length; ++c) {
      if (totals[c] > 0) {
        updated[c] = new double[dims];
        for (int d = 0; d < dims; ++d) {
          updated[c][d] = sums[c][d] / totals[c];
        }
      } else {
        // empty cluster keeps its centroid
        updated[c] = previous[c].clone();
      }
    }
    return updated;
  }

  private static double[][] scale(double[][] points, double[] scales, boolean divide) {
    final double[][] result = new double[points.length][];
    for (int i = 0; i < points.length; ++i) {
      result[i] = new double[points[i].length];
      for (int d = 0; d < points[i].length; ++d) {
        result[i][d] = divide ? points[i][d] / scales[d] : points[i][d] * scales[d];
      }
    }
    return result;
  }

  private static double[] column(double[][] points, int dimension) {
    final double[] column = new double[points.length];
    for (int i = 0; i < points.length; ++i) {
      column[i] = points[i][dimension];
    }
    return column;
  }

  private static int dimensions(double[][] observations) {
    return observations.length == 0 ? 0 : observations[0].length;
  }
}

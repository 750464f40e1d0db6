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

import java.util.List;
import lombok.Getter;
import lombok.ToString;

/** Output of a weighted clustering: centroids with their counts, and the removed outliers. */
@Getter
@ToString
public class WeightedCounts {
  private final List<double[]> centroids;
  private final List<Long> counts;
  /** Indexes of the input observations that were removed as outliers. */
  private final List<Integer> outliers;

  public WeightedCounts(List<double[]> centroids, List<Long> counts, List<Integer> outliers) {
    this.centroids = centroids;
    this.counts = counts;
    this.outliers = outliers;
  }
}

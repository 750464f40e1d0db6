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

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public class DistributionResult {
  private final List<DistributionPoint> data;
  private final List<DistributionPoint> outliers;
  private final boolean clustered;
  private final long size;

  public DistributionResult(
      List<DistributionPoint> data,
      List<DistributionPoint> outliers,
      boolean clustered,
      long size) {
    this.data = data;
    this.outliers = outliers;
    this.clustered = clustered;
    this.size = size;
  }

  public static DistributionResult empty() {
    return new DistributionResult(List.of(), List.of(), false, 0);
  }
}

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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/** Options of a distribution request. */
@Getter
@Setter
@Accessors(chain = true)
@ToString
@EqualsAndHashCode
public class DistributionOptions {
  public static final String SORT_COUNT = "count";

  /** Whether groups with a null dimension value are kept. */
  private boolean nulls = false;

  /** Whether large numeric distributions are down-sampled by clustering. */
  private boolean cluster = true;

  /** Number of clusters; null for the configured default. */
  private Integer n;

  /** {@code count} forces count ordering even when a dimension is enumerable. */
  private String sort;

  /** Whether the request's context restricts the rows. */
  private boolean aware = false;
}

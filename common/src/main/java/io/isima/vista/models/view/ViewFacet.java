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
package io.isima.vista.models.view;

import io.isima.vista.models.Direction;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** One concept selection of a data view. */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ViewFacet {
  private final long conceptId;
  private final boolean visible;

  /** Sort direction, null when the concept does not take part in ordering. */
  private final Direction direction;

  /** Position among the ordering keys, null to keep the facet order. */
  private final Integer sortIndex;

  public static ViewFacet of(long conceptId) {
    return new ViewFacet(conceptId, true, null, null);
  }

  public static ViewFacet sorted(long conceptId, Direction direction, int sortIndex) {
    return new ViewFacet(conceptId, true, direction, sortIndex);
  }
}

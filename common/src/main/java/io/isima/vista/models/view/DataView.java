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

import java.util.List;
import lombok.Getter;
import lombok.ToString;

/** A data view: ordered concept selections with their sort settings. */
@Getter
@ToString
public class DataView {
  private static final DataView EMPTY = new DataView(List.of());

  private final List<ViewFacet> facets;

  public DataView(List<ViewFacet> facets) {
    this.facets = List.copyOf(facets);
  }

  public static DataView empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return facets.isEmpty();
  }
}

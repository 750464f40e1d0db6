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
package io.isima.vista.models;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A named group of fields that a view selects as one output unit. */
@Getter
@ToString
@EqualsAndHashCode
public class ConceptDesc {
  private final long id;
  private final String name;
  private final List<Long> fieldIds;

  public ConceptDesc(long id, String name, List<Long> fieldIds) {
    this.id = id;
    this.name = name;
    this.fieldIds = List.copyOf(fieldIds);
  }
}

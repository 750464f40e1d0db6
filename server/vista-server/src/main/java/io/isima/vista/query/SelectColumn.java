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
package io.isima.vista.query;

import io.isima.vista.field.FieldReference;
import io.isima.vista.models.ConceptDesc;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/** A selected concept with the fields of it that resolved against the tree. */
@Getter
@ToString
public class SelectColumn {
  private final ConceptDesc concept;
  private final List<FieldReference> fields;

  public SelectColumn(ConceptDesc concept, List<FieldReference> fields) {
    this.concept = concept;
    this.fields = List.copyOf(fields);
  }
}

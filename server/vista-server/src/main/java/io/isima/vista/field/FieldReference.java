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
package io.isima.vista.field;

import io.isima.vista.models.FieldDesc;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A field resolved against a data tree, with its query path. */
@Getter
@ToString
@EqualsAndHashCode
public class FieldReference {
  private final FieldDesc field;
  private final String path;

  public FieldReference(FieldDesc field, String path) {
    this.field = field;
    this.path = path;
  }

  public boolean isEnumerable() {
    return field.isEnumerable();
  }

  public boolean isNumeric() {
    return field.getType().isNumeric();
  }
}

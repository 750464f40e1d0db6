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

import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Description of a single data field.
 *
 * <p>A field lives in a model and maps to one of its columns. The natural key of a field is
 * {@code model.column}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FieldDesc {
  private final long id;
  private final String model;
  private final String column;
  private final String name;
  private final FieldType type;

  /** Whether the field has a bounded, discrete domain. */
  private final boolean enumerable;

  private final boolean published;

  public FieldDesc(
      long id,
      String model,
      String column,
      String name,
      FieldType type,
      boolean enumerable,
      boolean published) {
    this.id = id;
    this.model = Objects.requireNonNull(model, "'model' must not be null");
    this.column = Objects.requireNonNull(column, "'column' must not be null");
    this.name = name != null ? name : column;
    this.type = Objects.requireNonNull(type, "'type' must not be null");
    this.enumerable = enumerable;
    this.published = published;
  }

  public static FieldDesc of(long id, String model, String column, FieldType type) {
    return new FieldDesc(id, model, column, column, type, false, true);
  }

  public static FieldDesc enumerable(long id, String model, String column, FieldType type) {
    return new FieldDesc(id, model, column, column, type, true, true);
  }

  public String getNaturalKey() {
    return model + "." + column;
  }
}

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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;

/** Value types of data fields. */
public enum FieldType {
  STRING("string", String.class),
  NUMBER("number", Number.class),
  DATE("date", LocalDate.class),
  TIME("time", LocalTime.class),
  DATETIME("datetime", LocalDateTime.class),
  BOOLEAN("boolean", Boolean.class),
  KEY("key", Long.class);

  private final String simpleType;
  private final Class<?> javaClass;

  private FieldType(String simpleType, Class<?> javaClass) {
    this.simpleType = simpleType;
    this.javaClass = javaClass;
  }

  /**
   * Coarse type name of the field.
   *
   * @return "number" for numeric fields, otherwise the lower case type name
   */
  public String simpleType() {
    return simpleType;
  }

  public boolean isNumeric() {
    return this == NUMBER;
  }

  /**
   * Converts a raw filter operand into the Java type stored for this field type.
   *
   * @param value operand taken from a parsed context document
   * @return converted value
   * @throws IllegalArgumentException thrown when the value cannot be converted
   */
  public Object convert(Object value) {
    if (value == null || javaClass.isInstance(value)) {
      return value;
    }
    final String src = value.toString();
    switch (this) {
      case STRING:
        return src;
      case NUMBER:
        return new BigDecimal(src);
      case KEY:
        return Long.valueOf(src);
      case BOOLEAN:
        if (!"true".equalsIgnoreCase(src) && !"false".equalsIgnoreCase(src)) {
          throw new IllegalArgumentException("Not a boolean: " + src);
        }
        return Boolean.valueOf(src);
      case DATE:
      case TIME:
      case DATETIME:
        return parseTemporal(src);
      default:
        throw new UnsupportedOperationException("Type " + this + " unsupported");
    }
  }

  private Object parseTemporal(String src) {
    try {
      switch (this) {
        case DATE:
          return LocalDate.parse(src);
        case TIME:
          return LocalTime.parse(src);
        default:
          return LocalDateTime.parse(src);
      }
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Not a " + simpleType + ": " + src, e);
    }
  }
}

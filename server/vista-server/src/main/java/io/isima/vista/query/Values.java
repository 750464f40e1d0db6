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

import java.math.BigDecimal;
import java.math.BigInteger;

/** Comparison helpers for field values of mixed Java types. */
public class Values {

  /**
   * Compares two field values. Nulls sort first, numbers compare by numeric value regardless of
   * their Java type, values of unrelated types compare by their string forms.
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static int compare(Object left, Object right) {
    if (left == right) {
      return 0;
    }
    if (left == null) {
      return -1;
    }
    if (right == null) {
      return 1;
    }
    if (left instanceof Number && right instanceof Number) {
      final var l = (Number) left;
      final var r = (Number) right;
      if (!isFinite(l) || !isFinite(r)) {
        return Double.compare(l.doubleValue(), r.doubleValue());
      }
      return toBigDecimal(l).compareTo(toBigDecimal(r));
    }
    if (left instanceof Comparable && left.getClass().isInstance(right)) {
      return ((Comparable) left).compareTo(right);
    }
    return left.toString().compareTo(right.toString());
  }

  public static boolean matches(Object value, Object reference) {
    if (value == null || reference == null) {
      return value == reference;
    }
    return compare(value, reference) == 0;
  }

  /**
   * Normalizes a value for use in a grouping key. Finite numbers of any Java type or decimal
   * scale that are numerically equal map to equal keys; other values are returned as they are.
   */
  public static Object groupKey(Object value) {
    if (value instanceof Number && isFinite((Number) value)) {
      return toBigDecimal((Number) value).stripTrailingZeros();
    }
    return value;
  }

  /** NaN and infinite doubles and floats are not finite; every other number is. */
  public static boolean isFinite(Number number) {
    if (number instanceof Double || number instanceof Float) {
      return Double.isFinite(number.doubleValue());
    }
    return true;
  }

  /**
   * Converts a finite number to a decimal.
   *
   * @throws NumberFormatException thrown for NaN and infinite values
   */
  public static BigDecimal toBigDecimal(Number number) {
    if (number instanceof BigDecimal) {
      return (BigDecimal) number;
    }
    if (number instanceof BigInteger) {
      return new BigDecimal((BigInteger) number);
    }
    if (number instanceof Double || number instanceof Float) {
      return BigDecimal.valueOf(number.doubleValue());
    }
    return BigDecimal.valueOf(number.longValue());
  }
}

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
package io.isima.vista.service;

import io.isima.vista.errors.GenericError;
import io.isima.vista.errors.exception.InvalidRequestException;

/** Typed access to query parameters. A blank parameter counts as absent. */
public class RequestParams {

  private RequestParams() {}

  public static String getString(ServiceRequest request, String name, String defaultValue) {
    final var value = request.getParam(name);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  public static Integer getInt(ServiceRequest request, String name, Integer defaultValue)
      throws InvalidRequestException {
    final var value = request.getParam(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      throw new InvalidRequestException(
          GenericError.INVALID_VALUE_SYNTAX,
          String.format("Parameter '%s' must be an integer: %s", name, value));
    }
  }

  /**
   * Parses a non-negative integer parameter.
   *
   * @throws InvalidRequestException thrown when the value is not an integer or is negative
   */
  public static int getNonNegativeInt(ServiceRequest request, String name, int defaultValue)
      throws InvalidRequestException {
    final int value = getInt(request, name, defaultValue);
    if (value < 0) {
      throw new InvalidRequestException(
          GenericError.INVALID_VALUE_SYNTAX,
          String.format("Parameter '%s' must not be negative: %d", name, value));
    }
    return value;
  }

  /**
   * Parses a boolean parameter. Accepts {@code true/false}, {@code 1/0}, {@code yes/no} and
   * {@code on/off}, case-insensitively.
   */
  public static boolean getBoolean(ServiceRequest request, String name, boolean defaultValue)
      throws InvalidRequestException {
    final var value = request.getParam(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    switch (value.trim().toLowerCase()) {
      case "true":
      case "1":
      case "yes":
      case "on":
        return true;
      case "false":
      case "0":
      case "no":
      case "off":
        return false;
      default:
        throw new InvalidRequestException(
            GenericError.INVALID_VALUE_SYNTAX,
            String.format("Parameter '%s' must be a boolean: %s", name, value));
    }
  }
}

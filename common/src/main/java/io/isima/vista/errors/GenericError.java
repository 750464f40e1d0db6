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
package io.isima.vista.errors;

import io.netty.handler.codec.http.HttpResponseStatus;

public enum GenericError implements VistaError {
  APPLICATION_ERROR("GENERIC00", HttpResponseStatus.INTERNAL_SERVER_ERROR, "Generic server error"),
  INVALID_VALUE_SYNTAX("GENERIC02", HttpResponseStatus.BAD_REQUEST, "Invalid value syntax"),
  INVALID_ENUM_ENTRY("GENERIC03", HttpResponseStatus.BAD_REQUEST, "Invalid enum"),
  NOT_IMPLEMENTED("GENERIC06", HttpResponseStatus.NOT_IMPLEMENTED, "Not implemented"),
  INVALID_ID("GENERIC08", HttpResponseStatus.NOT_FOUND, "Specified ID is invalid"),
  INVALID_REQUEST("GENERIC09", HttpResponseStatus.BAD_REQUEST, "Invalid request"),
  INVALID_CONFIGURATION(
      "GENERIC0d",
      HttpResponseStatus.INTERNAL_SERVER_ERROR,
      "Unable to complete operation due to invalid server configuration"),
  ;

  private final String errorCode;
  private final HttpResponseStatus status;
  private final String message;

  private GenericError(String errorCode, HttpResponseStatus status, String message) {
    this.errorCode = errorCode;
    this.status = status;
    this.message = message;
  }

  @Override
  public String getErrorCode() {
    return errorCode;
  }

  @Override
  public HttpResponseStatus getStatus() {
    return status;
  }

  @Override
  public String getErrorMessage() {
    return message;
  }
}

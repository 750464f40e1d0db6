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

/** Errors raised while building, paging, exporting or aggregating a query. */
public enum QueryError implements VistaError {
  NO_SUCH_FIELD("QUERY01", HttpResponseStatus.NOT_FOUND, "No such field"),
  NO_SUCH_EXPORT_TYPE("QUERY02", HttpResponseStatus.NOT_FOUND, "No such export type"),
  PAGE_NOT_FOUND("QUERY03", HttpResponseStatus.NOT_FOUND, "Page not found"),
  INVALID_FILTER("QUERY04", HttpResponseStatus.BAD_REQUEST, "Invalid filter"),
  INVALID_VIEW("QUERY05", HttpResponseStatus.BAD_REQUEST, "Invalid view"),
  EMPTY_PROJECTION("QUERY06", HttpResponseStatus.BAD_REQUEST, "Empty projection"),
  NO_DIMENSIONS("QUERY07", HttpResponseStatus.BAD_REQUEST, "No valid dimensions"),
  DATA_TOO_LARGE("QUERY08", HttpResponseStatus.UNPROCESSABLE_ENTITY, "Data too large"),
  ;

  private final String errorCode;
  private final HttpResponseStatus status;
  private final String message;

  private QueryError(String errorCode, HttpResponseStatus status, String message) {
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

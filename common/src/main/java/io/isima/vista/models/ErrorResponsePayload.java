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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import io.isima.vista.errors.VistaError;
import io.netty.handler.codec.http.HttpResponseStatus;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(Include.NON_NULL)
public class ErrorResponsePayload {
  private String errorCode;
  private HttpResponseStatus status;
  private String message;

  public ErrorResponsePayload() {}

  public ErrorResponsePayload(String errorCode, HttpResponseStatus status, String message) {
    this.errorCode = errorCode;
    this.status = status;
    this.message = message;
  }

  public static ErrorResponsePayload of(VistaError error) {
    return new ErrorResponsePayload(
        error.getErrorCode(), error.getStatus(), error.getErrorMessage());
  }

  /**
   * Method to get errorCode.
   *
   * @return the errorCode
   */
  public String getErrorCode() {
    return errorCode;
  }

  public void setErrorCode(String errorCode) {
    this.errorCode = errorCode;
  }

  @JsonIgnore
  public HttpResponseStatus getStatus() {
    return status;
  }

  public int getStatusCode() {
    return status != null ? status.code() : 0;
  }

  public void setStatus(HttpResponseStatus status) {
    this.status = status;
  }

  /**
   * Method to get message.
   *
   * @return the message
   */
  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  @Override
  public String toString() {
    StringBuilder sb =
        new StringBuilder("errorCode=")
            .append(errorCode)
            .append(", status=")
            .append(status)
            .append(", message=")
            .append(message);
    return sb.toString();
  }
}

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

import io.isima.vista.errors.VistaError;
import io.isima.vista.errors.exception.VistaException;
import io.isima.vista.models.ErrorResponsePayload;
import io.netty.handler.codec.http.HttpResponseStatus;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/** Outcome of a service call: status, entity, headers and cookies. */
@Getter
@ToString
public class ServiceResponse {
  private final HttpResponseStatus status;
  private final Object entity;
  private final Map<String, String> headers = new LinkedHashMap<>();
  private final Map<String, String> cookies = new LinkedHashMap<>();

  public ServiceResponse(HttpResponseStatus status, Object entity) {
    this.status = status;
    this.entity = entity;
  }

  public static ServiceResponse ok(Object entity) {
    return new ServiceResponse(HttpResponseStatus.OK, entity);
  }

  public static ServiceResponse error(VistaException e) {
    final var payload = new ErrorResponsePayload(e.getErrorCode(), e.getStatus(), e.getMessage());
    return new ServiceResponse(e.getStatus(), payload);
  }

  public static ServiceResponse error(VistaError error) {
    return new ServiceResponse(error.getStatus(), ErrorResponsePayload.of(error));
  }

  public ServiceResponse header(String name, String value) {
    headers.put(name, value);
    return this;
  }

  public ServiceResponse cookie(String name, String value) {
    cookies.put(name, value);
    return this;
  }

  public boolean isSuccess() {
    return status.code() < 400;
  }

  /** The entity cast to the expected type. */
  @SuppressWarnings("unchecked")
  public <T> T getEntityAs(Class<T> clazz) {
    return (T) entity;
  }
}

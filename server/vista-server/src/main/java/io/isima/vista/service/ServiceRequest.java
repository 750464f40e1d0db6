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

import io.isima.vista.models.context.DataContext;
import io.isima.vista.models.view.DataView;
import io.netty.handler.codec.http.QueryStringDecoder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * A request as seen by the services: path, query parameters, the parsed data context and view the
 * request applies to, and the requesting user.
 */
@Getter
@Setter
@Accessors(chain = true)
@ToString
public class ServiceRequest {
  private final String path;
  private final Map<String, List<String>> params;
  private DataContext context = DataContext.empty();
  private DataView view = DataView.empty();
  private String user;

  public ServiceRequest(String path, Map<String, List<String>> params) {
    this.path = path;
    this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  /**
   * Builds a request from a request URI.
   *
   * @param uri path with an optional query string
   * @return the request
   */
  public static ServiceRequest of(String uri) {
    final var decoder = new QueryStringDecoder(uri);
    return new ServiceRequest(decoder.path(), decoder.parameters());
  }

  /** First value of a parameter, or null. */
  public String getParam(String name) {
    final var values = params.get(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  /** All values of a parameter, empty when absent. */
  public List<String> getParamValues(String name) {
    return params.getOrDefault(name, List.of());
  }
}

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

import io.isima.vista.export.ExporterRegistry;
import io.isima.vista.models.ExporterRootResponse;
import io.isima.vista.models.Link;
import java.util.LinkedHashMap;

/** Lists the export endpoints. */
public class ExporterRootService {
  public static final String TITLE = "Vista Exporter Endpoints";

  private final ExporterRegistry exporters;

  public ExporterRootService(ExporterRegistry exporters) {
    this.exporters = exporters;
  }

  public ServiceResponse get(ServiceRequest request) {
    final var links = new LinkedHashMap<String, Link>();
    links.put("self", new Link(ServicePaths.PATH_EXPORTER));
    for (var format : exporters.getFormats()) {
      links.put(
          format.getName(),
          new Link(
              ServicePaths.exporterPath(format.getName()),
              format.getShortName(),
              format.getLongName()));
    }
    return ServiceResponse.ok(new ExporterRootResponse(TITLE, ServicePaths.API_VERSION, links));
  }
}

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

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/** Index of the export endpoints, one link per registered format. */
@Getter
@ToString
public class ExporterRootResponse {
  private final String title;
  private final String version;

  @JsonProperty("_links")
  private final Map<String, Link> links;

  public ExporterRootResponse(String title, String version, Map<String, Link> links) {
    this.title = title;
    this.version = version;
    this.links = links;
  }
}

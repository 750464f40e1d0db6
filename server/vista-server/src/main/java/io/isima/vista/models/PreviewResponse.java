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
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import io.isima.vista.pagination.PageResponse;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

@Getter
@Setter
@Accessors(chain = true)
@ToString
@JsonPropertyOrder({
  "num_pages",
  "page_num",
  "limit",
  "keys",
  "objects",
  "object_name",
  "object_name_plural",
  "object_count",
  "_links"
})
public class PreviewResponse {
  @JsonUnwrapped private PageResponse page;

  @JsonProperty("keys")
  private List<PreviewKey> keys;

  @JsonProperty("objects")
  private List<PreviewObject> objects;

  @JsonProperty("object_name")
  private String objectName;

  @JsonProperty("object_name_plural")
  private String objectNamePlural;

  @JsonProperty("object_count")
  private long objectCount;

  @JsonProperty("_links")
  private Map<String, Link> links;
}

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A hypermedia link entry in a response's {@code _links} section. */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(Include.NON_NULL)
public class Link {
  private final String href;
  private final String title;
  private final String description;

  public Link(String href) {
    this(href, null, null);
  }

  public Link(String href, String title, String description) {
    this.href = href;
    this.title = title;
    this.description = description;
  }
}

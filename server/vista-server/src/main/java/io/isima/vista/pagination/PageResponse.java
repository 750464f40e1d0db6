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
package io.isima.vista.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.ToString;

/** Paging properties reported with a paginated response. */
@Getter
@ToString
public class PageResponse {
  @JsonProperty("num_pages")
  private final int numPages;

  @JsonProperty("page_num")
  private final int pageNum;

  @JsonProperty("limit")
  private final int limit;

  public PageResponse(int numPages, int pageNum, int limit) {
    this.numPages = numPages;
    this.pageNum = pageNum;
    this.limit = limit;
  }

  public static PageResponse of(Paginator paginator, Page page) {
    return new PageResponse(paginator.getNumPages(), page.getNumber(), paginator.getLimit());
  }
}

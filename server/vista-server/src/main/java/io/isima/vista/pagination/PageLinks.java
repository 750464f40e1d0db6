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

import io.isima.vista.models.Link;
import io.netty.handler.codec.http.QueryStringEncoder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the hypermedia links of a page.
 *
 * <p>{@code self} and {@code base} are always present; {@code next} and {@code previous} only when
 * such pages exist. Query parameters other than the paging ones are carried over to every link.
 */
public class PageLinks {
  public static final String PARAM_PAGE = "page";
  public static final String PARAM_LIMIT = "limit";

  public static final String SELF = "self";
  public static final String BASE = "base";
  public static final String NEXT = "next";
  public static final String PREVIOUS = "previous";

  private PageLinks() {}

  /**
   * Builds the links.
   *
   * @param path request path the links point to
   * @param params caller-supplied query parameters, in request order
   * @param page the current page
   * @return links keyed by relation, in the order self, base, next, previous
   */
  public static Map<String, Link> build(String path, Map<String, List<String>> params, Page page) {
    final var links = new LinkedHashMap<String, Link>();
    links.put(SELF, new Link(uri(path, params, page.getNumber(), page.getLimit())));
    links.put(BASE, new Link(uri(path, params, null, null)));
    if (page.hasNext()) {
      links.put(NEXT, new Link(uri(path, params, page.getNextPageNumber(), page.getLimit())));
    }
    if (page.hasPrevious()) {
      links.put(
          PREVIOUS, new Link(uri(path, params, page.getPreviousPageNumber(), page.getLimit())));
    }
    return links;
  }

  private static String uri(
      String path, Map<String, List<String>> params, Integer pageNumber, Integer limit) {
    final var encoder = new QueryStringEncoder(path);
    if (params != null) {
      params.forEach(
          (name, values) -> {
            if (!PARAM_PAGE.equals(name) && !PARAM_LIMIT.equals(name)) {
              values.forEach((value) -> encoder.addParam(name, value));
            }
          });
    }
    if (pageNumber != null) {
      encoder.addParam(PARAM_PAGE, pageNumber.toString());
    }
    if (limit != null) {
      encoder.addParam(PARAM_LIMIT, limit.toString());
    }
    return encoder.toString();
  }
}

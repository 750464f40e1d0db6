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

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import io.isima.vista.errors.exception.PageNotFoundException;
import io.isima.vista.query.QuerySet;

/**
 * Splits a query set into pages of a fixed size.
 *
 * <p>A limit of zero puts the whole set on a single page. The row count is taken once, on first
 * use, by a streaming count over the query set.
 */
public class Paginator {
  private final QuerySet queryset;
  private final int limit;
  private final Supplier<Long> count;

  private Paginator(QuerySet queryset, int limit) {
    this.queryset = queryset;
    this.limit = limit;
    this.count = Suppliers.memoize(queryset::count);
  }

  public static Paginator of(QuerySet queryset, int limit) {
    Preconditions.checkNotNull(queryset, "'queryset' must not be null");
    Preconditions.checkArgument(limit >= 0, "limit must not be negative: %s", limit);
    return new Paginator(queryset, limit);
  }

  public QuerySet getQueryset() {
    return queryset;
  }

  public int getLimit() {
    return limit;
  }

  public long getCount() {
    return count.get();
  }

  public int getNumPages() {
    if (limit == 0) {
      return 1;
    }
    final long total = getCount();
    return (int) ((total + limit - 1) / limit);
  }

  /**
   * Gets a page.
   *
   * @param number 1-based page number
   * @return the page
   * @throws PageNotFoundException thrown when the page is out of range. Page 1 of an empty set is
   *     always valid.
   */
  public Page page(int number) throws PageNotFoundException {
    final int numPages = getNumPages();
    if (number < 1) {
      throw new PageNotFoundException("Page number %d is less than 1", number);
    }
    if (number > numPages && !(number == 1 && numPages == 0)) {
      throw new PageNotFoundException(
          "Page number %d is out of range; numPages=%d", number, numPages);
    }
    return new Page(number, limit, getCount(), numPages);
  }
}

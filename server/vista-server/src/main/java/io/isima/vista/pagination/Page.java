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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** One page of a paginated query set. Page numbers are 1-based. */
@Getter
@ToString
@EqualsAndHashCode
public class Page {
  private final int number;
  private final int limit;
  private final long count;
  private final int numPages;

  Page(int number, int limit, long count, int numPages) {
    this.number = number;
    this.limit = limit;
    this.count = count;
    this.numPages = numPages;
  }

  /**
   * 1-based index of the first row on this page. Reported also when the page is empty.
   *
   * @return the start index
   */
  public long getStartIndex() {
    return limit == 0 ? 1 : (long) (number - 1) * limit + 1;
  }

  /**
   * 1-based index of the last row on this page, or {@code startIndex - 1} when it is empty.
   *
   * @return the end index
   */
  public long getEndIndex() {
    if (limit == 0) {
      return count;
    }
    return Math.min((long) number * limit, count);
  }

  /** Number of rows to skip before this page. */
  public long getOffset() {
    return getStartIndex() - 1;
  }

  public boolean hasNext() {
    return number < numPages;
  }

  public boolean hasPrevious() {
    return number > 1;
  }

  public int getNextPageNumber() {
    return number + 1;
  }

  public int getPreviousPageNumber() {
    return number - 1;
  }
}

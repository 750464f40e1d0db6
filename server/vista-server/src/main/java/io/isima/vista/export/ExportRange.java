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
package io.isima.vista.export;

import io.isima.vista.errors.exception.PageNotFoundException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Rows selected by an export request: everything, one page, or an inclusive page range.
 *
 * <p>A range {@code 4...5} covers pages 4 and 5; {@code 4...4} is the same as page 4.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ExportRange {
  public static final String TAG_ALL = "all";

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd-HHmmss");

  private final Long offset;
  private final Long limit;
  private final String fileTag;
  private final boolean partial;

  private ExportRange(Long offset, Long limit, String fileTag, boolean partial) {
    this.offset = offset;
    this.limit = limit;
    this.fileTag = fileTag;
    this.partial = partial;
  }

  /**
   * Computes the range.
   *
   * @param page first page, 1-based; null exports everything and ignores the limit
   * @param stopPage last page of the range, inclusive, may be null
   * @param limit page size
   * @return the range
   * @throws PageNotFoundException thrown when page is below 1 or stopPage precedes page
   */
  public static ExportRange of(Integer page, Integer stopPage, int limit)
      throws PageNotFoundException {
    if (page == null) {
      return new ExportRange(null, null, TAG_ALL, false);
    }
    if (page < 1) {
      throw new PageNotFoundException("Page number %d is less than 1", page);
    }
    final long offset = (long) limit * (page - 1);
    if (stopPage != null) {
      if (stopPage < page) {
        throw new PageNotFoundException("Stop page %d precedes page %d", stopPage, page);
      }
      if (stopPage > page) {
        return new ExportRange(
            offset,
            (long) limit * (stopPage - page + 1),
            String.format("p%d-%d", page, stopPage),
            true);
      }
    }
    return new ExportRange(offset, (long) limit, String.format("p%d", page), true);
  }

  public String fileName(String extension, LocalDateTime timestamp) {
    return String.format(
        "%s-%s-data.%s", fileTag, TIMESTAMP_FORMAT.format(timestamp), extension);
  }
}

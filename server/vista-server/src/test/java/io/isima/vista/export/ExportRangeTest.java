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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import io.isima.vista.errors.exception.PageNotFoundException;
import java.time.LocalDateTime;
import org.junit.Test;

public class ExportRangeTest {

  @Test
  public void testAll() throws Exception {
    final var range = ExportRange.of(null, null, 50);
    assertNull(range.getOffset());
    assertNull(range.getLimit());
    assertEquals("all", range.getFileTag());
    assertFalse(range.isPartial());
  }

  @Test
  public void testSinglePage() throws Exception {
    final var range = ExportRange.of(3, null, 50);
    assertEquals(Long.valueOf(100), range.getOffset());
    assertEquals(Long.valueOf(50), range.getLimit());
    assertEquals("p3", range.getFileTag());
    assertTrue(range.isPartial());
    assertEquals(range, ExportRange.of(3, 3, 50));
  }

  @Test
  public void testPageRange() throws Exception {
    final var range = ExportRange.of(2, 3, 50);
    assertEquals(Long.valueOf(50), range.getOffset());
    assertEquals(Long.valueOf(100), range.getLimit());
    assertEquals("p2-3", range.getFileTag());
    assertEquals(
        "p2-3-2024-03-01-093005-data.csv",
        range.fileName("csv", LocalDateTime.of(2024, 3, 1, 9, 30, 5)));
  }

  @Test(expected = PageNotFoundException.class)
  public void testPageZero() throws Exception {
    ExportRange.of(0, null, 50);
  }

  @Test(expected = PageNotFoundException.class)
  public void testStopBeforePage() throws Exception {
    ExportRange.of(4, 3, 50);
  }
}

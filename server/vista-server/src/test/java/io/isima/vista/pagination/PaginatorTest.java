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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import io.isima.vista.TestTrees;
import io.isima.vista.errors.QueryError;
import io.isima.vista.errors.exception.PageNotFoundException;
import io.isima.vista.query.QuerySet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.BeforeClass;
import org.junit.Test;

public class PaginatorTest {
  private static QuerySet hundred;
  private static QuerySet empty;

  @BeforeClass
  public static void setUpBeforeClass() {
    final List<Integer> xs = new ArrayList<>(Collections.nCopies(100, 1));
    hundred = QuerySet.all(TestTrees.points(xs));
    empty = hundred.filter((row) -> false);
  }

  @Test
  public void testNumPages() {
    for (int limit : new int[] {1, 3, 7, 20, 50, 99, 100, 101, 1000}) {
      final var paginator = Paginator.of(hundred, limit);
      assertEquals(100, paginator.getCount());
      assertEquals("limit=" + limit, (100 + limit - 1) / limit, paginator.getNumPages());
    }
  }

  @Test
  public void testPages() throws Exception {
    final var paginator = Paginator.of(hundred, 30);
    final var first = paginator.page(1);
    assertEquals(1, first.getStartIndex());
    assertEquals(30, first.getEndIndex());
    assertEquals(0, first.getOffset());
    assertTrue(first.hasNext());
    assertFalse(first.hasPrevious());

    final var last = paginator.page(4);
    assertEquals(91, last.getStartIndex());
    assertEquals(100, last.getEndIndex());
    assertEquals(90, last.getOffset());
    assertFalse(last.hasNext());
    assertTrue(last.hasPrevious());
  }

  @Test
  public void testZeroLimitIsSinglePage() throws Exception {
    final var paginator = Paginator.of(hundred, 0);
    assertEquals(1, paginator.getNumPages());
    final var page = paginator.page(1);
    assertEquals(1, page.getStartIndex());
    assertEquals(100, page.getEndIndex());
    assertFalse(page.hasNext());
    assertPageNotFound(paginator, 2);
  }

  @Test
  public void testEmptySet() throws Exception {
    final var paginator = Paginator.of(empty, 20);
    assertEquals(0, paginator.getNumPages());
    final var page = paginator.page(1);
    assertEquals(1, page.getStartIndex());
    assertEquals(0, page.getEndIndex());
    assertEquals(0, page.getOffset());
    assertFalse(page.hasNext());
    assertPageNotFound(paginator, 2);
  }

  @Test
  public void testOutOfRange() {
    final var paginator = Paginator.of(hundred, 30);
    assertPageNotFound(paginator, 0);
    assertPageNotFound(paginator, -1);
    assertPageNotFound(paginator, 5);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeLimit() {
    Paginator.of(hundred, -1);
  }

  private static void assertPageNotFound(Paginator paginator, int number) {
    try {
      paginator.page(number);
      fail("page " + number + " must not exist");
    } catch (PageNotFoundException e) {
      assertEquals(QueryError.PAGE_NOT_FOUND, e.getInfo());
      assertEquals(404, e.getStatus().code());
    }
  }
}

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
package io.isima.vista.distribution;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import io.isima.vista.TestTrees;
import io.isima.vista.errors.exception.DataTooLargeException;
import io.isima.vista.field.FieldReference;
import io.isima.vista.field.FieldResolver;
import io.isima.vista.query.QuerySet;
import io.isima.vista.tree.DataTree;
import io.netty.handler.codec.http.HttpResponseStatus;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Test;

public class DistributionEngineTest {

  private final FieldResolver resolver = new FieldResolver();
  private DistributionEngine engine;
  private DataTree employees;

  @Before
  public void setUp() {
    engine = new DistributionEngine();
    employees = TestTrees.employees();
  }

  @Test
  public void testEmpty() throws Exception {
    final var tree = TestTrees.points(List.of(1, 2, 3));
    final var queryset = QuerySet.all(tree).filter((row) -> false);
    final var result =
        engine.distribution(
            dimensions(tree, TestTrees.FIELD_POINT_X), queryset, new DistributionOptions());
    assertEquals(DistributionResult.empty(), result);
    assertFalse(result.isClustered());
  }

  @Test
  public void testTooLarge() {
    final var tree = TestTrees.points(range(DistributionEngine.MAXIMUM_OBSERVATIONS + 1));
    try {
      engine.distribution(
          dimensions(tree, TestTrees.FIELD_POINT_X),
          QuerySet.all(tree),
          new DistributionOptions());
      fail("exception is expected");
    } catch (DataTooLargeException e) {
      assertEquals(HttpResponseStatus.UNPROCESSABLE_ENTITY, e.getStatus());
    }
  }

  @Test
  public void testClustered() throws Exception {
    final var tree = TestTrees.points(range(DistributionEngine.MINIMUM_OBSERVATIONS));
    final var result =
        engine.distribution(
            dimensions(tree, TestTrees.FIELD_POINT_X, TestTrees.FIELD_POINT_Y),
            QuerySet.all(tree),
            new DistributionOptions());
    assertTrue(result.isClustered());
    assertEquals(DistributionEngine.MINIMUM_OBSERVATIONS, result.getSize());
    assertTrue(result.getData().size() <= 20);
    assertEquals(DistributionEngine.MINIMUM_OBSERVATIONS, totalCount(result));
    for (var point : result.getData()) {
      assertEquals(2, point.getValues().size());
      assertTrue(point.getValues().get(0) instanceof Double);
    }
  }

  @Test
  public void testClusterCount() throws Exception {
    final var tree = TestTrees.points(range(600));
    final var dimensions = dimensions(tree, TestTrees.FIELD_POINT_X);
    final var result =
        engine.distribution(dimensions, QuerySet.all(tree), new DistributionOptions().setN(5));
    assertTrue(result.isClustered());
    assertTrue(result.getData().size() <= 5);

    final var configured =
        new DistributionEngine() {
          @Override
          protected int defaultClusterCount() {
            return 3;
          }
        };
    final var fewer =
        configured.distribution(dimensions, QuerySet.all(tree), new DistributionOptions());
    assertTrue(fewer.getData().size() <= 3);
    assertEquals(600, totalCount(fewer));
  }

  @Test
  public void testBelowClusterThreshold() throws Exception {
    final int size = DistributionEngine.MINIMUM_OBSERVATIONS - 1;
    final var tree = TestTrees.points(range(size));
    final var result =
        engine.distribution(
            dimensions(tree, TestTrees.FIELD_POINT_X),
            QuerySet.all(tree),
            new DistributionOptions());
    assertFalse(result.isClustered());
    assertEquals(size, result.getSize());
    assertEquals(size, result.getData().size() + result.getOutliers().size());
  }

  @Test
  public void testClusteringDisabled() throws Exception {
    final var tree = TestTrees.points(range(600));
    final var result =
        engine.distribution(
            dimensions(tree, TestTrees.FIELD_POINT_X),
            QuerySet.all(tree),
            new DistributionOptions().setCluster(false));
    assertFalse(result.isClustered());
    assertEquals(600, result.getData().size() + result.getOutliers().size());
  }

  @Test
  public void testOutliers() throws Exception {
    final List<Integer> xs = new ArrayList<>(range(49));
    xs.add(1000);
    final var tree = TestTrees.points(xs);
    final var result =
        engine.distribution(
            dimensions(tree, TestTrees.FIELD_POINT_X),
            QuerySet.all(tree),
            new DistributionOptions());
    assertFalse(result.isClustered());
    assertEquals(50, result.getSize());
    assertEquals(List.of(new DistributionPoint(List.of(1000.0), 1)), result.getOutliers());
    assertEquals(49, result.getData().size());
    assertEquals(List.of(0.0), result.getData().get(0).getValues());
    assertEquals(List.of(48.0), result.getData().get(48).getValues());
  }

  @Test
  public void testEqualNumbersOfDifferentScaleShareAGroup() throws Exception {
    final var tree =
        TestTrees.points(
            List.of(new BigDecimal("1.0"), new BigDecimal("1.00"), new BigDecimal("2")));
    final var result =
        engine.distribution(
            dimensions(tree, TestTrees.FIELD_POINT_X),
            QuerySet.all(tree),
            new DistributionOptions());
    assertEquals(2, result.getSize());
    assertEquals(
        List.of(
            new DistributionPoint(List.of(1.0), 2), new DistributionPoint(List.of(2.0), 1)),
        result.getData());
  }

  @Test
  public void testNullsExcludedOnAnyDimension() throws Exception {
    final var result =
        engine.distribution(
            dimensions(employees, TestTrees.FIELD_AGE, TestTrees.FIELD_TITLE_SALARY),
            QuerySet.all(employees),
            new DistributionOptions());
    assertEquals(5, result.getSize());
    for (var point : result.getData()) {
      assertFalse(point.getValues().contains(null));
    }
  }

  @Test
  public void testNumericWithNullsIsNotProcessed() throws Exception {
    final var result =
        engine.distribution(
            dimensions(employees, TestTrees.FIELD_AGE),
            QuerySet.all(employees),
            new DistributionOptions().setNulls(true));
    assertEquals(6, result.getSize());
    assertEquals(6, result.getData().size());
    assertTrue(result.getOutliers().isEmpty());
    assertFalse(result.isClustered());
    assertEquals(Arrays.asList((Object) null), result.getData().get(0).getValues());
  }

  @Test
  public void testEnumerableOrdering() throws Exception {
    final var dimensions =
        dimensions(employees, TestTrees.FIELD_OFFICE_LOCATION, TestTrees.FIELD_TITLE_NAME);
    final var result =
        engine.distribution(dimensions, QuerySet.all(employees), new DistributionOptions());
    assertEquals(5, result.getSize());
    assertEquals(
        List.of(
            List.of("Chicago", "Analyst"),
            List.of("Chicago", "CEO"),
            List.of("Chicago", "Programmer"),
            List.of("New York", "Programmer"),
            List.of("New York", "QA")),
        values(result));
    assertFalse(result.isClustered());
    assertTrue(result.getOutliers().isEmpty());

    final var withNulls =
        engine.distribution(
            dimensions, QuerySet.all(employees), new DistributionOptions().setNulls(true));
    assertEquals(6, withNulls.getSize());
    assertEquals(Arrays.asList(null, "Analyst"), withNulls.getData().get(0).getValues());
  }

  @Test
  public void testSortByCount() throws Exception {
    final var dimensions = dimensions(employees, TestTrees.FIELD_TITLE_NAME);
    final var byValue =
        engine.distribution(dimensions, QuerySet.all(employees), new DistributionOptions());
    assertEquals(
        List.of(List.of("Analyst"), List.of("CEO"), List.of("Programmer"), List.of("QA")),
        values(byValue));

    final var byCount =
        engine.distribution(
            dimensions,
            QuerySet.all(employees),
            new DistributionOptions().setSort(DistributionOptions.SORT_COUNT));
    assertEquals(
        List.of(List.of("Analyst"), List.of("Programmer"), List.of("CEO"), List.of("QA")),
        values(byCount));
    assertEquals(2, byCount.getData().get(0).getCount());
  }

  @Test
  public void testRepeatable() throws Exception {
    final var tree = TestTrees.points(range(700));
    final var dimensions = dimensions(tree, TestTrees.FIELD_POINT_X, TestTrees.FIELD_POINT_Y);
    final var first =
        engine.distribution(dimensions, QuerySet.all(tree), new DistributionOptions());
    final var second =
        engine.distribution(dimensions, QuerySet.all(tree), new DistributionOptions());
    assertEquals(first, second);
  }

  private List<FieldReference> dimensions(DataTree tree, long... ids) {
    final List<FieldReference> dimensions = new ArrayList<>();
    for (long id : ids) {
      dimensions.add(resolver.resolve(id, tree).orElseThrow());
    }
    return dimensions;
  }

  private static List<Integer> range(int size) {
    final List<Integer> values = new ArrayList<>(size);
    for (int i = 0; i < size; ++i) {
      values.add(i);
    }
    return values;
  }

  private static long totalCount(DistributionResult result) {
    long total = 0;
    for (var point : result.getData()) {
      total += point.getCount();
    }
    for (var point : result.getOutliers()) {
      total += point.getCount();
    }
    return total;
  }

  private static List<List<Object>> values(DistributionResult result) {
    return result.getData().stream()
        .map(DistributionPoint::getValues)
        .collect(Collectors.toList());
  }
}

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
package io.isima.vista.service;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import io.isima.vista.TestTrees;
import io.isima.vista.field.FieldResolver;
import io.isima.vista.models.ContextStats;
import io.isima.vista.models.ErrorResponsePayload;
import io.isima.vista.models.FieldStats;
import io.isima.vista.models.context.ContextParser;
import io.isima.vista.query.QueryProcessorRegistry;
import io.isima.vista.tree.InMemoryRecordSource;
import io.isima.vista.tree.TreeRegistry;
import io.isima.vista.utils.VistaObjectMapperProvider;
import io.netty.handler.codec.http.HttpResponseStatus;
import java.math.BigDecimal;
import org.junit.Before;
import org.junit.Test;

public class StatsServicesTest {
  private TreeRegistry trees;
  private QueryProcessorRegistry processors;
  private FieldResolver resolver;

  @Before
  public void setUp() {
    trees = TestTrees.registry(TestTrees.employees());
    resolver = new FieldResolver();
    processors = QueryProcessorRegistry.withDefaults(resolver);
  }

  @Test
  public void testContextStats() throws Exception {
    final var service = new ContextStatsService(trees, processors);
    final var all = service.get(ServiceRequest.of(ServicePaths.PATH_CONTEXT_STATS));
    assertEquals(new ContextStats(6), all.getEntity());

    final var context =
        ContextParser.parse(
            VistaObjectMapperProvider.get()
                .readTree(
                    "{\"field\": \"office.location\", \"operator\": \"exact\","
                        + " \"value\": \"Chicago\"}"));
    final var filtered =
        service.get(ServiceRequest.of(ServicePaths.PATH_CONTEXT_STATS).setContext(context));
    assertEquals(new ContextStats(3), filtered.getEntity());
  }

  @Test
  public void testNumericFieldStats() {
    final var service = new FieldStatsService(trees, processors, resolver);
    final var request = ServiceRequest.of(ServicePaths.fieldStatsPath("employee.age"));
    final var response = service.get(request, "employee.age");
    final var stats = response.getEntityAs(FieldStats.class);
    assertEquals(5, stats.getCount());
    assertEquals(0, new BigDecimal(24).compareTo(stats.getMin()));
    assertEquals(0, new BigDecimal(40).compareTo(stats.getMax()));
    assertEquals(0, new BigDecimal(156).compareTo(stats.getSum()));
    assertEquals(0, new BigDecimal("31.2").compareTo(stats.getAvg()));
  }

  @Test
  public void testNonFiniteValuesAreCountedOnly() {
    final var tree = TestTrees.employees();
    ((InMemoryRecordSource) tree.getSource())
        .addRecord("employee", TestTrees.record("id", 7, "first_name", "Nan", "age", Double.NaN));
    final var service = new FieldStatsService(TestTrees.registry(tree), processors, resolver);
    final var response = service.get(ServiceRequest.of(ServicePaths.fieldStatsPath("6")), "6");
    assertEquals(HttpResponseStatus.OK, response.getStatus());
    final var stats = response.getEntityAs(FieldStats.class);
    assertEquals(6, stats.getCount());
    assertEquals(0, new BigDecimal(40).compareTo(stats.getMax()));
    assertEquals(0, new BigDecimal(156).compareTo(stats.getSum()));
  }

  @Test
  public void testTextFieldStats() {
    final var service = new FieldStatsService(trees, processors, resolver);
    final var stats =
        service
            .get(ServiceRequest.of(ServicePaths.fieldStatsPath("3")), "3")
            .getEntityAs(FieldStats.class);
    assertEquals(5, stats.getCount());
    assertNull(stats.getMin());
    assertNull(stats.getAvg());
  }

  @Test
  public void testUnknownField() {
    final var service = new FieldStatsService(trees, processors, resolver);
    final var response = service.get(ServiceRequest.of(ServicePaths.fieldStatsPath("x")), "x");
    assertEquals(HttpResponseStatus.NOT_FOUND, response.getStatus());
    assertEquals("QUERY01", response.getEntityAs(ErrorResponsePayload.class).getErrorCode());
  }
}

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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import io.isima.vista.TestTrees;
import io.isima.vista.audit.RecordingUsageLog;
import io.isima.vista.audit.UsageRecorder;
import io.isima.vista.distribution.DistributionEngine;
import io.isima.vista.distribution.DistributionPoint;
import io.isima.vista.distribution.DistributionResult;
import io.isima.vista.field.FieldResolver;
import io.isima.vista.models.ErrorResponsePayload;
import io.isima.vista.models.context.ContextParser;
import io.isima.vista.models.context.DataContext;
import io.isima.vista.query.QueryProcessorRegistry;
import io.isima.vista.utils.VistaObjectMapperProvider;
import io.netty.handler.codec.http.HttpResponseStatus;
import java.util.List;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

public class FieldDistributionServiceTest {
  private static DataContext olderThanThirty;

  private RecordingUsageLog usageLog;
  private FieldDistributionService service;

  @BeforeClass
  public static void setUpBeforeClass() throws Exception {
    olderThanThirty =
        ContextParser.parse(
            VistaObjectMapperProvider.get()
                .readTree("{\"field\": \"employee.age\", \"operator\": \"gt\", \"value\": 30}"));
  }

  @Before
  public void setUp() {
    usageLog = new RecordingUsageLog();
    final var resolver = new FieldResolver();
    service =
        new FieldDistributionService(
            TestTrees.registry(TestTrees.employees()),
            QueryProcessorRegistry.withDefaults(resolver),
            resolver,
            new DistributionEngine(),
            new UsageRecorder(usageLog));
  }

  @Test
  public void testInstanceIsTheDefaultDimension() {
    final var response = get("");
    assertEquals(HttpResponseStatus.OK, response.getStatus());
    final var result = response.getEntityAs(DistributionResult.class);
    assertEquals(4, result.getSize());
    assertEquals(new DistributionPoint(List.of("Analyst"), 2), result.getData().get(0));

    assertEquals(1, usageLog.getEvents().size());
    final var event = usageLog.getEvents().get(0);
    assertEquals("dist", event.getEvent());
    assertEquals("title.name", event.getInstance());
    assertEquals(ServicePaths.fieldDistPath("1"), event.getPath());
    assertEquals(4L, event.getData().get("size"));
    assertEquals(false, event.getData().get("clustered"));
    assertEquals(false, event.getData().get("aware"));
  }

  @Test
  public void testUnresolvedDimensionsAreDropped() {
    final var result =
        get("?dimensions=999&dimensions=office.location").getEntityAs(DistributionResult.class);
    assertEquals(
        List.of(
            new DistributionPoint(List.of("Chicago"), 3),
            new DistributionPoint(List.of("New York"), 2)),
        result.getData());
  }

  @Test
  public void testNoDimensions() {
    final var response = get("?dimensions=999&dimensions=project.name");
    assertEquals(HttpResponseStatus.BAD_REQUEST, response.getStatus());
    assertEquals("QUERY07", response.getEntityAs(ErrorResponsePayload.class).getErrorCode());
    assertTrue(usageLog.getEvents().isEmpty());
  }

  @Test
  public void testUnknownField() {
    final var request = ServiceRequest.of(ServicePaths.fieldDistPath("999"));
    final var response = service.get(request, "999");
    assertEquals(HttpResponseStatus.NOT_FOUND, response.getStatus());
    assertEquals("QUERY01", response.getEntityAs(ErrorResponsePayload.class).getErrorCode());
  }

  @Test
  public void testInvalidParameters() {
    assertEquals(HttpResponseStatus.BAD_REQUEST, get("?n=0").getStatus());
    assertEquals(HttpResponseStatus.BAD_REQUEST, get("?n=many").getStatus());
    assertEquals(HttpResponseStatus.BAD_REQUEST, get("?nulls=maybe").getStatus());
  }

  @Test
  public void testNulls() {
    final var result =
        get("?dimensions=office.location&nulls=true").getEntityAs(DistributionResult.class);
    assertEquals(3, result.getSize());
    assertEquals(List.of(), List.copyOf(result.getOutliers()));
    assertFalse(result.isClustered());
  }

  @Test
  public void testContextAware() {
    final var path = ServicePaths.fieldDistPath(String.valueOf(TestTrees.FIELD_AGE));
    final var unaware =
        service
            .get(ServiceRequest.of(path).setContext(olderThanThirty), "6")
            .getEntityAs(DistributionResult.class);
    assertEquals(5, unaware.getSize());

    final var aware =
        service
            .get(ServiceRequest.of(path + "?aware=1").setContext(olderThanThirty), "6")
            .getEntityAs(DistributionResult.class);
    assertEquals(3, aware.getSize());
    assertEquals(List.of(31), aware.getData().get(0).getValues());
    assertEquals(true, usageLog.getEvents().get(1).getData().get("aware"));
    assertEquals("employee.age", usageLog.getEvents().get(1).getInstance());
  }

  private ServiceResponse get(String query) {
    final var fieldId = String.valueOf(TestTrees.FIELD_TITLE_NAME);
    return service.get(ServiceRequest.of(ServicePaths.fieldDistPath(fieldId) + query), fieldId);
  }
}

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
import static org.junit.Assert.assertTrue;

import io.isima.vista.TestTrees;
import io.isima.vista.audit.RecordingUsageLog;
import io.isima.vista.audit.UsageRecorder;
import io.isima.vista.export.ExporterRegistry;
import io.isima.vista.field.FieldResolver;
import io.isima.vista.models.Direction;
import io.isima.vista.models.ErrorResponsePayload;
import io.isima.vista.models.ExporterRootResponse;
import io.isima.vista.models.Link;
import io.isima.vista.models.view.DataView;
import io.isima.vista.models.view.ViewFacet;
import io.isima.vista.query.QueryProcessorRegistry;
import io.isima.vista.utils.VistaObjectMapperProvider;
import io.netty.handler.codec.http.HttpResponseStatus;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

public class ExportServiceTest {
  private static final DataView VIEW =
      new DataView(List.of(ViewFacet.sorted(TestTrees.CONCEPT_FIRST_NAME, Direction.ASC, 0)));

  private RecordingUsageLog usageLog;
  private ExportService service;
  private ExporterRegistry exporters;

  @Before
  public void setUp() {
    usageLog = new RecordingUsageLog();
    exporters = ExporterRegistry.withDefaults();
    service =
        new ExportService(
            TestTrees.registry(TestTrees.employees()),
            QueryProcessorRegistry.withDefaults(new FieldResolver()),
            exporters,
            new UsageRecorder(usageLog));
  }

  @Test
  public void testCompleteCsv() {
    final var out = new ByteArrayOutputStream();
    final var request = ServiceRequest.of(ServicePaths.exporterPath("csv")).setView(VIEW);
    final var response = service.export(request, "csv", null, null, out);

    assertEquals(HttpResponseStatus.OK, response.getStatus());
    assertEquals("text/csv", response.getHeaders().get(ExportService.HEADER_CONTENT_TYPE));
    final var disposition = response.getHeaders().get(ExportService.HEADER_CONTENT_DISPOSITION);
    assertTrue(
        disposition, disposition.matches("attachment; filename=\"all-[0-9-]+-data\\.csv\""));
    assertEquals("complete", response.getCookies().get("export-type-csv"));

    final String[] lines = out.toString(StandardCharsets.UTF_8).split("\r\n");
    assertEquals(
        List.of("First name", "Aaron", "Eric", "Erick", "Harold", "Mel", "Zac"),
        List.of(lines));

    assertEquals(1, usageLog.getEvents().size());
    final var event = usageLog.getEvents().get(0);
    assertEquals("export", event.getEvent());
    assertEquals("csv", event.getData().get("type"));
    assertEquals(false, event.getData().get("partial"));
  }

  @Test
  public void testPageRange() {
    final var out = new ByteArrayOutputStream();
    final var request =
        ServiceRequest.of(ServicePaths.exporterPath("csv") + "?limit=2").setView(VIEW);
    final var response = service.export(request, "csv", 2, 3, out);

    assertEquals(HttpResponseStatus.OK, response.getStatus());
    assertTrue(
        response
            .getHeaders()
            .get(ExportService.HEADER_CONTENT_DISPOSITION)
            .startsWith("attachment; filename=\"p2-3-"));
    final String[] lines = out.toString(StandardCharsets.UTF_8).split("\r\n");
    assertEquals(List.of("First name", "Erick", "Harold", "Mel", "Zac"), List.of(lines));
    assertEquals(true, usageLog.getEvents().get(0).getData().get("partial"));
  }

  @Test
  public void testSinglePageJson() throws Exception {
    final var out = new ByteArrayOutputStream();
    final var request =
        ServiceRequest.of(ServicePaths.exporterPath("json") + "?limit=2").setView(VIEW);
    final var response = service.export(request, "json", 3, null, out);

    assertEquals(
        "application/json", response.getHeaders().get(ExportService.HEADER_CONTENT_TYPE));
    assertTrue(
        response
            .getHeaders()
            .get(ExportService.HEADER_CONTENT_DISPOSITION)
            .matches("attachment; filename=\"p3-[0-9-]+-data\\.json\""));
    assertEquals("complete", response.getCookies().get("export-type-json"));
    final var json = VistaObjectMapperProvider.get().readTree(out.toByteArray());
    assertEquals(2, json.size());
    assertEquals("Mel", json.get(0).get("First name").asText());
    assertEquals("Zac", json.get(1).get("First name").asText());
  }

  @Test
  public void testUnknownType() {
    final var out = new ByteArrayOutputStream();
    final var response =
        service.export(
            ServiceRequest.of(ServicePaths.exporterPath("xml")), "xml", null, null, out);
    assertEquals(HttpResponseStatus.NOT_FOUND, response.getStatus());
    assertEquals("QUERY02", response.getEntityAs(ErrorResponsePayload.class).getErrorCode());
    assertEquals(0, out.size());
    assertTrue(usageLog.getEvents().isEmpty());
  }

  @Test
  public void testInvalidPages() {
    final var request = ServiceRequest.of(ServicePaths.exporterPath("csv"));
    final var zero = service.export(request, "csv", 0, null, new ByteArrayOutputStream());
    assertEquals(HttpResponseStatus.NOT_FOUND, zero.getStatus());
    final var backwards = service.export(request, "csv", 3, 2, new ByteArrayOutputStream());
    assertEquals(HttpResponseStatus.NOT_FOUND, backwards.getStatus());
    assertEquals(
        "QUERY03", backwards.getEntityAs(ErrorResponsePayload.class).getErrorCode());
  }

  @Test
  public void testExporterRoot() {
    final var root =
        new ExporterRootService(exporters)
            .get(ServiceRequest.of(ServicePaths.PATH_EXPORTER))
            .getEntityAs(ExporterRootResponse.class);
    assertEquals("Vista Exporter Endpoints", root.getTitle());
    assertEquals("1", root.getVersion());
    assertEquals(List.of("self", "csv", "json", "html"), List.copyOf(root.getLinks().keySet()));
    assertEquals(new Link(ServicePaths.PATH_EXPORTER), root.getLinks().get("self"));
    assertEquals(
        new Link("/vista/v1/data/export/csv/", "CSV", "Comma-Separated Values (CSV)"),
        root.getLinks().get("csv"));
  }
}

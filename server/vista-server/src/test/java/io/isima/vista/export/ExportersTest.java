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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.isima.vista.TestTrees;
import io.isima.vista.errors.QueryError;
import io.isima.vista.errors.exception.NoSuchEntityException;
import io.isima.vista.field.FieldResolver;
import io.isima.vista.models.Direction;
import io.isima.vista.models.view.DataView;
import io.isima.vista.models.view.ViewFacet;
import io.isima.vista.query.DefaultQueryProcessor;
import io.isima.vista.query.QueryPlan;
import io.isima.vista.tree.InMemoryRecordSource;
import io.isima.vista.utils.VistaObjectMapperProvider;
import java.io.ByteArrayOutputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.junit.BeforeClass;
import org.junit.Test;

public class ExportersTest {
  private static ObjectMapper mapper;
  private static QueryPlan plan;
  private static QueryPlan planWithPk;

  @BeforeClass
  public static void setUpBeforeClass() throws Exception {
    mapper = VistaObjectMapperProvider.get();
    final var tree = TestTrees.employees();
    final var processor = new DefaultQueryProcessor(new FieldResolver(false));
    final var view =
        new DataView(
            List.of(
                ViewFacet.of(TestTrees.CONCEPT_FULL_NAME),
                ViewFacet.of(TestTrees.CONCEPT_LOCATION),
                ViewFacet.sorted(TestTrees.CONCEPT_AGE, Direction.DESC, 0)));
    plan = processor.build(null, view, tree, false);
    planWithPk = processor.build(null, view, tree, true);
  }

  @Test
  public void testCsvRoundTrip() throws Exception {
    final var out = new ByteArrayOutputStream();
    plan.getExporter(ExportFormat.CSV).write(plan.getIterable(), out, null, null);
    final List<CSVRecord> records =
        CSVFormat.RFC4180
            .builder()
            .setHeader()
            .build()
            .parse(new StringReader(out.toString(StandardCharsets.UTF_8)))
            .getRecords();
    assertEquals(6, records.size());
    assertEquals("Mel", records.get(0).get("Name first_name"));
    assertEquals("Brooks", records.get(0).get("Name last_name"));
    assertEquals("Chicago", records.get(0).get("Location"));
    assertEquals("40", records.get(0).get("Age"));
    // null age sorts last in descending order and exports empty
    assertEquals("Harold", records.get(5).get("Name first_name"));
    assertEquals("", records.get(5).get("Location"));
    assertEquals("", records.get(5).get("Age"));
  }

  @Test
  public void testJsonWithOffsetAndLimit() throws Exception {
    final var out = new ByteArrayOutputStream();
    planWithPk.getExporter(ExportFormat.JSON).write(planWithPk.getIterable(), out, 1L, 2L);
    final var rows = mapper.readTree(out.toByteArray());
    assertEquals(2, rows.size());
    assertEquals(3, rows.get(0).get("id").asInt());
    assertEquals("Aaron", rows.get(0).get("Name first_name").asText());
    assertEquals("New York", rows.get(0).get("Location").asText());
    assertEquals(35, rows.get(0).get("Age").asInt());
    assertEquals(4, rows.get(1).get("id").asInt());
  }

  @Test
  public void testJsonNullsAndEmptySlice() throws Exception {
    final var out = new ByteArrayOutputStream();
    plan.getExporter(ExportFormat.JSON).write(plan.getIterable(), out, 5L, null);
    final var rows = mapper.readTree(out.toByteArray());
    assertEquals(1, rows.size());
    assertEquals("Harold", rows.get(0).get("Name first_name").asText());
    assertTrue(rows.get(0).get("Age").isNull());

    final var beyond = new ByteArrayOutputStream();
    plan.getExporter(ExportFormat.JSON).write(plan.getIterable(), beyond, 100L, 10L);
    assertEquals("[]", beyond.toString(StandardCharsets.UTF_8));
  }

  @Test
  public void testHtmlRead() throws Exception {
    final var exporter = (HtmlExporter) planWithPk.getExporter(ExportFormat.HTML);
    final var rows = exporter.read(planWithPk.getIterable(), 0L, 1L);
    final List<Map<String, Object>> first = rows.next();
    assertFalse(rows.hasNext());
    assertEquals(4, first.size());
    assertEquals(5, first.get(0).get("id"));
    assertEquals("Mel Brooks", first.get(1).get(HtmlExporter.HTML));
    assertEquals(List.of("Mel", "Brooks"), first.get(1).get(HtmlExporter.RAW));
    assertEquals("Chicago", first.get(2).get(HtmlExporter.HTML));
    assertEquals("40", first.get(3).get(HtmlExporter.HTML));
  }

  @Test
  public void testHtmlEscapes() throws Exception {
    final var tree = TestTrees.employees();
    final var source = (InMemoryRecordSource) tree.getSource();
    source.addRecord(
        "employee", TestTrees.record("id", 7, "first_name", "<b>Tom</b>", "last_name", "O&K"));
    final var view = new DataView(List.of(ViewFacet.of(TestTrees.CONCEPT_FULL_NAME)));
    final var local =
        new DefaultQueryProcessor(new FieldResolver(false)).build(null, view, tree, false);
    final var exporter = (HtmlExporter) local.getExporter(ExportFormat.HTML);
    final var rows = new ArrayList<List<Map<String, Object>>>();
    exporter.read(local.getIterable(), 6L, null).forEachRemaining(rows::add);
    assertEquals(1, rows.size());
    assertEquals("&lt;b&gt;Tom&lt;/b&gt; O&amp;K", rows.get(0).get(0).get(HtmlExporter.HTML));
  }

  @Test
  public void testRepeatedConceptKeepsEveryColumn() throws Exception {
    final var tree = TestTrees.employees();
    final var view =
        new DataView(
            List.of(
                ViewFacet.of(TestTrees.CONCEPT_FIRST_NAME),
                ViewFacet.of(TestTrees.CONCEPT_FIRST_NAME)));
    final var repeated =
        new DefaultQueryProcessor(new FieldResolver(false)).build(null, view, tree, false);
    assertEquals(List.of("First name", "First name_2"), repeated.getLayout().getLabels());

    final var json = new ByteArrayOutputStream();
    repeated.getExporter(ExportFormat.JSON).write(repeated.getIterable(), json, null, 1L);
    final var row = mapper.readTree(json.toByteArray()).get(0);
    assertEquals(2, row.size());
    assertEquals("Eric", row.get("First name").asText());
    assertEquals("Eric", row.get("First name_2").asText());

    final var csv = new ByteArrayOutputStream();
    repeated.getExporter(ExportFormat.CSV).write(repeated.getIterable(), csv, null, 1L);
    assertEquals(
        "First name,First name_2\r\nEric,Eric\r\n", csv.toString(StandardCharsets.UTF_8));
  }

  @Test
  public void testRegistry() throws Exception {
    final var registry = ExporterRegistry.withDefaults();
    assertEquals(ExportFormat.CSV, registry.get("csv"));
    assertEquals("text/csv", registry.get("csv").getContentType());
    assertEquals("json", registry.get("json").getFileExtension());
    final List<String> names = new ArrayList<>();
    registry.getFormats().forEach((format) -> names.add(format.getName()));
    assertEquals(List.of("csv", "json", "html"), names);
    try {
      registry.get("xlsx");
      fail("exception must be thrown");
    } catch (NoSuchEntityException e) {
      assertEquals(QueryError.NO_SUCH_EXPORT_TYPE, e.getInfo());
      assertEquals(404, e.getStatus().code());
    }
  }
}

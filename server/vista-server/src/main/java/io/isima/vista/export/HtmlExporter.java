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

import com.fasterxml.jackson.core.JsonGenerator;
import io.isima.vista.query.Row;
import io.isima.vista.query.RowLayout;
import io.isima.vista.query.SelectColumn;
import io.isima.vista.utils.VistaObjectMapperProvider;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.apache.commons.text.StringEscapeUtils;

/**
 * Hybrid JSON and HTML format for previews.
 *
 * <p>A row becomes one entry per selected concept, each an ordered map holding the raw field
 * values under {@code raw} and an HTML-escaped rendering of the concept under {@code html}. When
 * the layout includes the primary key the first entry is {@code {pkColumn: pk}}.
 */
public class HtmlExporter extends Exporter<List<Map<String, Object>>> {
  public static final String RAW = "raw";
  public static final String HTML = "html";

  public HtmlExporter(ExportFormat format, RowLayout layout) {
    super(format, layout);
  }

  @Override
  protected List<Map<String, Object>> format(Row row) {
    final List<Map<String, Object>> outputs = new ArrayList<>(layout.getColumns().size() + 1);
    if (layout.isIncludePk()) {
      final var pk = new LinkedHashMap<String, Object>();
      pk.put(layout.getPkColumn(), row.getPk());
      outputs.add(pk);
    }
    final Iterator<Object> values = row.getValues().iterator();
    for (SelectColumn column : layout.getColumns()) {
      final List<Object> raw = new ArrayList<>(column.getFields().size());
      final var html = new StringJoiner(" ");
      for (int i = 0; i < column.getFields().size(); ++i) {
        final Object value = values.next();
        raw.add(value);
        if (value != null) {
          html.add(StringEscapeUtils.escapeHtml4(toText(value)));
        }
      }
      final var output = new LinkedHashMap<String, Object>();
      output.put(RAW, raw);
      output.put(HTML, html.toString());
      outputs.add(output);
    }
    return outputs;
  }

  @Override
  protected void writeRows(Iterator<List<Map<String, Object>>> formatted, OutputStream out)
      throws IOException {
    try (JsonGenerator generator =
        VistaObjectMapperProvider.get().getFactory().createGenerator(out)) {
      generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      generator.writeStartArray();
      while (formatted.hasNext()) {
        generator.writeObject(formatted.next());
      }
      generator.writeEndArray();
    }
  }
}

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
import io.isima.vista.utils.VistaObjectMapperProvider;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Writes rows as a JSON array of objects keyed by column label. */
public class JsonExporter extends Exporter<Map<String, Object>> {

  public JsonExporter(ExportFormat format, RowLayout layout) {
    super(format, layout);
  }

  @Override
  protected Map<String, Object> format(Row row) {
    final List<String> labels = layout.getLabels();
    final var object = new LinkedHashMap<String, Object>();
    int index = 0;
    if (layout.isIncludePk()) {
      object.put(labels.get(index++), row.getPk());
    }
    for (var value : row.getValues()) {
      object.put(labels.get(index++), value);
    }
    return object;
  }

  @Override
  protected void writeRows(Iterator<Map<String, Object>> formatted, OutputStream out)
      throws IOException {
    final var mapper = VistaObjectMapperProvider.get();
    try (JsonGenerator generator = mapper.getFactory().createGenerator(out)) {
      generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      generator.writeStartArray();
      while (formatted.hasNext()) {
        generator.writeObject(formatted.next());
      }
      generator.writeEndArray();
    }
  }
}

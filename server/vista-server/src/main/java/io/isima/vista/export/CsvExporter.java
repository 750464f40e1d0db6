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

import io.isima.vista.query.Row;
import io.isima.vista.query.RowLayout;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/** Writes rows as RFC 4180 CSV with a header row of column labels. */
public class CsvExporter extends Exporter<List<String>> {

  public CsvExporter(ExportFormat format, RowLayout layout) {
    super(format, layout);
  }

  @Override
  protected List<String> format(Row row) {
    final List<String> record = new ArrayList<>(row.getValues().size() + 1);
    if (layout.isIncludePk()) {
      record.add(toText(row.getPk()));
    }
    row.getValues().forEach((value) -> record.add(toText(value)));
    return record;
  }

  @Override
  protected void writeRows(Iterator<List<String>> formatted, OutputStream out)
      throws IOException {
    final var csvFormat =
        CSVFormat.RFC4180.builder().setHeader(layout.getLabels().toArray(new String[0])).build();
    final var writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
    final var printer = new CSVPrinter(writer, csvFormat);
    while (formatted.hasNext()) {
      printer.printRecord(formatted.next());
    }
    printer.flush();
  }
}

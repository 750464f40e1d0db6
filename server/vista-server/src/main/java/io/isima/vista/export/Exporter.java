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

import com.google.common.collect.Iterators;
import com.google.common.primitives.Ints;
import io.isima.vista.query.Row;
import io.isima.vista.query.RowLayout;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.util.Iterator;

/**
 * Base of the row exporters.
 *
 * <p>An exporter formats each row of a plan into an output value of type {@code T} and writes the
 * formatted rows to a byte stream. An optional offset skips rows and an optional limit caps the
 * number of rows; a null limit exports all remaining rows.
 *
 * @param <T> type of a formatted row
 */
public abstract class Exporter<T> {
  protected final ExportFormat format;
  protected final RowLayout layout;

  protected Exporter(ExportFormat format, RowLayout layout) {
    this.format = format;
    this.layout = layout;
  }

  public ExportFormat getFormat() {
    return format;
  }

  public RowLayout getLayout() {
    return layout;
  }

  public String getContentType() {
    return format.getContentType();
  }

  public String getFileExtension() {
    return format.getFileExtension();
  }

  /**
   * Reads formatted rows.
   *
   * @param rows rows to export
   * @param offset number of rows to skip, may be null
   * @param limit maximum number of rows, null for all
   * @return lazily formatted rows
   */
  public Iterator<T> read(Iterable<Row> rows, Long offset, Long limit) {
    return Iterators.transform(slice(rows, offset, limit), this::format);
  }

  /**
   * Writes formatted rows to a stream. The stream is flushed but not closed.
   *
   * @param rows rows to export
   * @param out destination
   * @param offset number of rows to skip, may be null
   * @param limit maximum number of rows, null for all
   * @throws IOException thrown when the stream fails
   */
  public void write(Iterable<Row> rows, OutputStream out, Long offset, Long limit)
      throws IOException {
    writeRows(read(rows, offset, limit), out);
    out.flush();
  }

  protected abstract T format(Row row);

  protected abstract void writeRows(Iterator<T> formatted, OutputStream out) throws IOException;

  protected static Iterator<Row> slice(Iterable<Row> rows, Long offset, Long limit) {
    final Iterator<Row> iterator = rows.iterator();
    if (offset != null && offset > 0) {
      Iterators.advance(iterator, Ints.saturatedCast(offset));
    }
    if (limit != null) {
      return Iterators.limit(iterator, Ints.saturatedCast(Math.max(0, limit)));
    }
    return iterator;
  }

  /** Plain text rendering of a value; null renders empty. */
  protected static String toText(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    }
    return value.toString();
  }
}

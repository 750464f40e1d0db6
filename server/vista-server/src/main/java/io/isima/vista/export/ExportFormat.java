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

import io.isima.vista.query.RowLayout;
import java.util.function.BiFunction;
import lombok.Getter;
import lombok.ToString;

/** A registered export format. */
@Getter
@ToString(exclude = "factory")
public class ExportFormat {
  public static final ExportFormat CSV =
      new ExportFormat(
          "csv", "CSV", "Comma-Separated Values (CSV)", "text/csv", "csv", CsvExporter::new);

  public static final ExportFormat JSON =
      new ExportFormat(
          "json",
          "JSON",
          "JavaScript Object Notation (JSON)",
          "application/json",
          "json",
          JsonExporter::new);

  public static final ExportFormat HTML =
      new ExportFormat(
          "html",
          "HTML",
          "HyperText Markup Language (HTML)",
          "text/html",
          "html",
          HtmlExporter::new);

  private final String name;
  private final String shortName;
  private final String longName;
  private final String contentType;
  private final String fileExtension;
  private final BiFunction<ExportFormat, RowLayout, Exporter<?>> factory;

  public ExportFormat(
      String name,
      String shortName,
      String longName,
      String contentType,
      String fileExtension,
      BiFunction<ExportFormat, RowLayout, Exporter<?>> factory) {
    this.name = name;
    this.shortName = shortName;
    this.longName = longName;
    this.contentType = contentType;
    this.fileExtension = fileExtension;
    this.factory = factory;
  }

  public Exporter<?> create(RowLayout layout) {
    return factory.apply(this, layout);
  }
}

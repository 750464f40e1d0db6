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

import com.google.common.collect.ImmutableMap;
import io.isima.vista.errors.QueryError;
import io.isima.vista.errors.exception.NoSuchEntityException;
import java.util.Collection;
import java.util.List;

/** Registry of export formats by name, in registration order. */
public class ExporterRegistry {
  private final ImmutableMap<String, ExportFormat> formats;

  public ExporterRegistry(Collection<ExportFormat> formats) {
    final var builder = ImmutableMap.<String, ExportFormat>builder();
    formats.forEach((format) -> builder.put(format.getName(), format));
    this.formats = builder.build();
  }

  public static ExporterRegistry withDefaults() {
    return new ExporterRegistry(List.of(ExportFormat.CSV, ExportFormat.JSON, ExportFormat.HTML));
  }

  /**
   * Gets a format by name.
   *
   * @param name format name, e.g. {@code csv}
   * @return the format
   * @throws NoSuchEntityException thrown when no format has the name
   */
  public ExportFormat get(String name) throws NoSuchEntityException {
    final var format = name != null ? formats.get(name) : null;
    if (format == null) {
      throw new NoSuchEntityException(QueryError.NO_SUCH_EXPORT_TYPE, "exportType", name);
    }
    return format;
  }

  public boolean contains(String name) {
    return name != null && formats.containsKey(name);
  }

  public Collection<ExportFormat> getFormats() {
    return formats.values();
  }
}

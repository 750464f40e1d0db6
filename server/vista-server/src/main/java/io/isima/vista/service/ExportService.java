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

import io.isima.vista.audit.UsageOperation;
import io.isima.vista.audit.UsageRecorder;
import io.isima.vista.common.VistaConfig;
import io.isima.vista.errors.exception.VistaException;
import io.isima.vista.export.ExportRange;
import io.isima.vista.export.ExporterRegistry;
import io.isima.vista.query.QueryProcessorRegistry;
import io.isima.vista.tree.TreeRegistry;
import java.io.IOException;
import java.io.OutputStream;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Exports the rows a context and view select, all of them or a page range, as a file. */
public class ExportService extends VistaService {
  private static final Logger logger = LoggerFactory.getLogger(ExportService.class);

  public static final String PARAM_LIMIT = "limit";

  public static final String HEADER_CONTENT_TYPE = "Content-Type";
  public static final String HEADER_CONTENT_DISPOSITION = "Content-Disposition";

  private final ExporterRegistry exporters;
  private final UsageRecorder usage;

  public ExportService(
      TreeRegistry trees,
      QueryProcessorRegistry processors,
      ExporterRegistry exporters,
      UsageRecorder usage) {
    super(trees, processors);
    this.exporters = exporters;
    this.usage = usage;
  }

  /**
   * Writes an export.
   *
   * @param request the request
   * @param exportType registered format name
   * @param page first page, null to export everything
   * @param stopPage last page of an inclusive range, may be null
   * @param out destination of the file content
   * @return response carrying the file headers and the export cookie
   */
  public ServiceResponse export(
      ServiceRequest request, String exportType, Integer page, Integer stopPage, OutputStream out) {
    return execute(
        "Export", request, () -> doExport(request, exportType, page, stopPage, out));
  }

  private ServiceResponse doExport(
      ServiceRequest request, String exportType, Integer page, Integer stopPage, OutputStream out)
      throws VistaException, IOException {
    final var format = exporters.get(exportType);
    final int limit =
        RequestParams.getNonNegativeInt(request, PARAM_LIMIT, VistaConfig.exportDefaultLimit());
    final var range = ExportRange.of(page, stopPage, limit);
    final var tree = getTree(request);
    final var processor = getProcessor(request);

    final var plan = processor.build(request.getContext(), request.getView(), tree, false);
    final var exporter = plan.getExporter(format);
    exporter.write(plan.getIterable(), out, range.getOffset(), range.getLimit());

    final var filename = range.fileName(exporter.getFileExtension(), LocalDateTime.now());
    logger.debug("Exported {}; tree={}, range={}", filename, tree.getAlias(), range);

    final var data = new LinkedHashMap<String, Object>();
    data.put("type", format.getName());
    data.put("partial", range.isPartial());
    usage.log(UsageOperation.EXPORT, null, request, data);

    return ServiceResponse.ok(null)
        .header(HEADER_CONTENT_TYPE, exporter.getContentType())
        .header(HEADER_CONTENT_DISPOSITION, String.format("attachment; filename=\"%s\"", filename))
        .cookie(
            String.format(VistaConfig.exportCookieNameTemplate(), format.getName()),
            VistaConfig.exportCookieData());
  }
}

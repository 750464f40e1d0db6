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

import io.isima.vista.common.VistaConfig;
import io.isima.vista.errors.exception.VistaException;
import io.isima.vista.export.ExportFormat;
import io.isima.vista.export.HtmlExporter;
import io.isima.vista.models.PreviewKey;
import io.isima.vista.models.PreviewObject;
import io.isima.vista.models.PreviewResponse;
import io.isima.vista.pagination.PageLinks;
import io.isima.vista.pagination.PageResponse;
import io.isima.vista.pagination.Paginator;
import io.isima.vista.query.QueryProcessorRegistry;
import io.isima.vista.tree.TreeRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Previews one page of the rows a context and view select, formatted for display.
 *
 * <p>Each row carries the primary key and one HTML-escaped rendering per selected concept, so the
 * entries of {@code objects[].values} line up with {@code keys}.
 */
public class PreviewService extends VistaService {

  public static final String PARAM_PAGE = PageLinks.PARAM_PAGE;
  public static final String PARAM_LIMIT = PageLinks.PARAM_LIMIT;

  public PreviewService(TreeRegistry trees, QueryProcessorRegistry processors) {
    super(trees, processors);
  }

  public ServiceResponse get(ServiceRequest request) {
    return execute("Preview", request, () -> ServiceResponse.ok(preview(request)));
  }

  private PreviewResponse preview(ServiceRequest request) throws VistaException {
    final int pageNumber = RequestParams.getInt(request, PARAM_PAGE, 1);
    final int limit =
        RequestParams.getNonNegativeInt(request, PARAM_LIMIT, VistaConfig.previewDefaultLimit());
    final var tree = getTree(request);
    final var processor = getProcessor(request);

    final var plan = processor.build(request.getContext(), request.getView(), tree, true);
    final var paginator = Paginator.of(plan.getQueryset(), limit);
    final var page = paginator.page(pageNumber);

    final List<PreviewKey> keys = new ArrayList<>();
    final var ordering = plan.getView().getOrdering();
    for (var concept : plan.getView().getConceptsForSelect()) {
      keys.add(new PreviewKey(concept.getId(), concept.getName(), ordering.get(concept.getId())));
    }

    final var exporter = (HtmlExporter) plan.getExporter(ExportFormat.HTML);
    final var pkColumn = plan.getLayout().getPkColumn();
    final Long readLimit = limit == 0 ? null : (long) limit;
    final List<PreviewObject> objects = new ArrayList<>();
    final var rows = exporter.read(plan.getIterable(), page.getOffset(), readLimit);
    while (rows.hasNext()) {
      final List<Map<String, Object>> outputs = rows.next();
      final Object pk = outputs.get(0).get(pkColumn);
      final List<Object> values = new ArrayList<>(outputs.size() - 1);
      for (int i = 1; i < outputs.size(); ++i) {
        values.add(outputs.get(i).get(HtmlExporter.HTML));
      }
      objects.add(new PreviewObject(pk, values));
    }

    final var model = tree.getRootModel();
    return new PreviewResponse()
        .setPage(PageResponse.of(paginator, page))
        .setKeys(keys)
        .setObjects(objects)
        .setObjectName(model.getVerboseName())
        .setObjectNamePlural(model.getVerboseNamePlural())
        .setObjectCount(paginator.getCount())
        .setLinks(PageLinks.build(ServicePaths.PATH_PREVIEW, request.getParams(), page));
  }
}

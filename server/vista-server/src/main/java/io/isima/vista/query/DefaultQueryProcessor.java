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
package io.isima.vista.query;

import com.google.common.collect.ImmutableList;
import io.isima.vista.common.VistaConfig;
import io.isima.vista.errors.exception.EmptyProjectionException;
import io.isima.vista.errors.exception.InvalidFilterException;
import io.isima.vista.errors.exception.VistaException;
import io.isima.vista.field.FieldResolver;
import io.isima.vista.models.context.DataContext;
import io.isima.vista.models.view.DataView;
import io.isima.vista.tree.DataTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default query processor.
 *
 * <p>Rows are filtered by the context and ordered by the view ordering, with the root primary key
 * as the last ordering key so the row order is total.
 */
public class DefaultQueryProcessor implements QueryProcessor {
  private static final Logger logger = LoggerFactory.getLogger(DefaultQueryProcessor.class);

  protected final FieldResolver resolver;

  public DefaultQueryProcessor(FieldResolver resolver) {
    this.resolver = resolver;
  }

  @Override
  public String getName() {
    return VistaConfig.PROCESSOR_NAME_DEFAULT;
  }

  @Override
  public QuerySet getQueryset(DataContext context, DataTree tree) throws InvalidFilterException {
    final var queryset = QuerySet.all(tree);
    final var predicate = new ContextFilterCompiler(tree, resolver).compile(context);
    return predicate != null ? queryset.filter(predicate) : queryset;
  }

  @Override
  public QueryPlan build(DataContext context, DataView view, DataTree tree, boolean includePk)
      throws VistaException {
    final var viewNode = ViewNode.parse(view, tree, resolver);
    if (viewNode.getRequestedColumns() > 0 && viewNode.getColumns().isEmpty()) {
      throw new EmptyProjectionException(
          String.format(
              "none of the %d selected concepts resolve in tree %s",
              viewNode.getRequestedColumns(), tree.getAlias()));
    }

    final var pkColumn = tree.getRootModel().getPkColumn();
    final var orderKeys =
        ImmutableList.<OrderKey>builder()
            .addAll(viewNode.getOrderKeys())
            .add(OrderKey.asc(pkColumn))
            .build();
    final var queryset = getQueryset(context, tree).orderBy(orderKeys);
    final var layout = new RowLayout(includePk, pkColumn, viewNode.getColumns());
    logger.debug(
        "Built query plan; processor={}, tree={}, columns={}, orderKeys={}",
        getName(),
        tree.getAlias(),
        layout.getLabels(),
        orderKeys);
    return new QueryPlan(tree, context, viewNode, layout, queryset);
  }
}

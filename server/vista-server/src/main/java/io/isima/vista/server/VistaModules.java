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
package io.isima.vista.server;

import io.isima.vista.audit.LoggingUsageLog;
import io.isima.vista.audit.UsageLog;
import io.isima.vista.audit.UsageRecorder;
import io.isima.vista.distribution.DistributionEngine;
import io.isima.vista.export.ExporterRegistry;
import io.isima.vista.field.FieldResolver;
import io.isima.vista.query.QueryProcessorRegistry;
import io.isima.vista.service.ContextStatsService;
import io.isima.vista.service.ExportService;
import io.isima.vista.service.ExporterRootService;
import io.isima.vista.service.FieldDistributionService;
import io.isima.vista.service.FieldStatsService;
import io.isima.vista.service.PreviewService;
import io.isima.vista.tree.TreeRegistry;
import java.util.Objects;
import lombok.Getter;
import lombok.ToString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Components of the application, wired once at startup. */
@Getter
@ToString
public class VistaModules {
  private static final Logger logger = LoggerFactory.getLogger(VistaModules.class);

  private static VistaModules instance;

  private final TreeRegistry trees;
  private final FieldResolver fieldResolver;
  private final QueryProcessorRegistry processors;
  private final ExporterRegistry exporters;
  private final DistributionEngine distributionEngine;
  private final UsageRecorder usageRecorder;

  private final PreviewService previewService;
  private final ExportService exportService;
  private final ExporterRootService exporterRootService;
  private final FieldDistributionService fieldDistributionService;
  private final ContextStatsService contextStatsService;
  private final FieldStatsService fieldStatsService;

  public VistaModules(TreeRegistry trees, UsageLog usageLog) {
    this.trees = Objects.requireNonNull(trees, "'trees' must not be null");
    fieldResolver = new FieldResolver();
    processors = QueryProcessorRegistry.withDefaults(fieldResolver);
    exporters = ExporterRegistry.withDefaults();
    distributionEngine = new DistributionEngine();
    usageRecorder = new UsageRecorder(usageLog != null ? usageLog : new LoggingUsageLog());

    previewService = new PreviewService(trees, processors);
    exportService = new ExportService(trees, processors, exporters, usageRecorder);
    exporterRootService = new ExporterRootService(exporters);
    fieldDistributionService =
        new FieldDistributionService(
            trees, processors, fieldResolver, distributionEngine, usageRecorder);
    contextStatsService = new ContextStatsService(trees, processors);
    fieldStatsService = new FieldStatsService(trees, processors, fieldResolver);
  }

  /**
   * Starts the modules. Calling it again replaces the running instance.
   *
   * @param trees data trees to serve
   * @param usageLog usage sink; null to log usage events
   * @return the modules
   */
  public static synchronized VistaModules start(TreeRegistry trees, UsageLog usageLog) {
    instance = new VistaModules(trees, usageLog);
    logger.info(
        "Vista modules started; trees={}, processors={}, exporters={}",
        trees.getAliases(),
        instance.processors.getNames(),
        instance.exporters.getFormats().size());
    return instance;
  }

  public static synchronized VistaModules getInstance() {
    if (instance == null) {
      throw new IllegalStateException("Vista modules are not started");
    }
    return instance;
  }

  public static synchronized void shutdown() {
    instance = null;
  }
}

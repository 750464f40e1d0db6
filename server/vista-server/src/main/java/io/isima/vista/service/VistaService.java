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
import io.isima.vista.errors.GenericError;
import io.isima.vista.errors.exception.VistaException;
import io.isima.vista.query.QueryProcessor;
import io.isima.vista.query.QueryProcessorRegistry;
import io.isima.vista.tree.DataTree;
import io.isima.vista.tree.TreeRegistry;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base of the request-level services.
 *
 * <p>Subclasses implement the request inside {@link #execute}, which turns every failure into an
 * error response.
 */
public abstract class VistaService {
  private static final Logger logger = LoggerFactory.getLogger(VistaService.class);

  public static final String PARAM_TREE = "tree";
  public static final String PARAM_PROCESSOR = "processor";

  protected final TreeRegistry trees;
  protected final QueryProcessorRegistry processors;

  protected VistaService(TreeRegistry trees, QueryProcessorRegistry processors) {
    this.trees = trees;
    this.processors = processors;
  }

  @FunctionalInterface
  protected interface ServiceAction {
    ServiceResponse handle() throws VistaException, IOException;
  }

  protected ServiceResponse execute(
      String operation, ServiceRequest request, ServiceAction action) {
    try {
      return action.handle();
    } catch (VistaException e) {
      logger.debug("{} failed; path={}, error={}", operation, request.getPath(), e.toString());
      return ServiceResponse.error(e);
    } catch (IOException | RuntimeException e) {
      logger.error("{} failed unexpectedly; path={}", operation, request.getPath(), e);
      return ServiceResponse.error(GenericError.APPLICATION_ERROR);
    }
  }

  protected DataTree getTree(ServiceRequest request) throws VistaException {
    return trees.get(RequestParams.getString(request, PARAM_TREE, trees.getDefaultAlias()));
  }

  protected QueryProcessor getProcessor(ServiceRequest request) throws VistaException {
    return processors.get(
        RequestParams.getString(request, PARAM_PROCESSOR, VistaConfig.defaultProcessor()));
  }
}

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
package io.isima.vista.common;

import java.util.Properties;

/** Vista configuration value provider. */
public class VistaConfig {

  public static final String DEFAULT_PROCESSOR = "io.isima.vista.query.defaultProcessor";
  public static final String DEFAULT_TREE_ALIAS = "io.isima.vista.tree.defaultAlias";

  public static final String EXPORT_DEFAULT_LIMIT = "io.isima.vista.export.defaultLimit";
  public static final String EXPORT_COOKIE_NAME_TEMPLATE =
      "io.isima.vista.export.cookieNameTemplate";
  public static final String EXPORT_COOKIE_DATA = "io.isima.vista.export.cookieData";

  public static final String PREVIEW_DEFAULT_LIMIT = "io.isima.vista.preview.defaultLimit";

  /** Number of centroids computed when a distribution request does not specify one. */
  public static final String DISTRIBUTION_DEFAULT_CLUSTER_COUNT =
      "io.isima.vista.distribution.defaultClusterCount";

  public static final String FIELD_INCLUDE_UNPUBLISHED = "io.isima.vista.field.includeUnpublished";

  public static final String PROCESSOR_NAME_DEFAULT = "default";
  public static final String TREE_ALIAS_DEFAULT = "default";

  //
  // Utilities ///////////////////////////////////////////////////////////////////////
  //
  protected static VistaConfigBase getInstance() {
    return VistaConfigBase.getInstance();
  }

  public static void setProperties(Properties properties) {
    VistaConfigBase.setProperties(properties);
  }

  //
  // End utilities ///////////////////////////////////////////////////////////////////////

  public static String defaultProcessor() {
    return getInstance().getString(DEFAULT_PROCESSOR, PROCESSOR_NAME_DEFAULT);
  }

  public static String defaultTreeAlias() {
    return getInstance().getString(DEFAULT_TREE_ALIAS, TREE_ALIAS_DEFAULT);
  }

  public static int exportDefaultLimit() {
    return getInstance().getInt(EXPORT_DEFAULT_LIMIT, 50, 0, Integer.MAX_VALUE);
  }

  public static String exportCookieNameTemplate() {
    return getInstance().getString(EXPORT_COOKIE_NAME_TEMPLATE, "export-type-%s");
  }

  public static String exportCookieData() {
    return getInstance().getString(EXPORT_COOKIE_DATA, "complete");
  }

  public static int previewDefaultLimit() {
    return getInstance().getInt(PREVIEW_DEFAULT_LIMIT, 20, 0, Integer.MAX_VALUE);
  }

  public static int distributionDefaultClusterCount() {
    return getInstance().getInt(DISTRIBUTION_DEFAULT_CLUSTER_COUNT, 20, 1, 10000);
  }

  public static boolean fieldIncludeUnpublished() {
    return getInstance().getBoolean(FIELD_INCLUDE_UNPUBLISHED, false);
  }
}

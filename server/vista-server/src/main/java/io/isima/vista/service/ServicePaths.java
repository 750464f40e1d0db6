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

public class ServicePaths {

  public static final String ROOT = "/vista/v1";

  public static final String API_VERSION = "1";

  // data
  public static final String PATH_DATA = ROOT + "/data";
  public static final String PATH_PREVIEW = PATH_DATA + "/preview/";
  public static final String PATH_EXPORTER = PATH_DATA + "/export/";

  // fields
  public static final String PATH_FIELDS = ROOT + "/fields/";
  public static final String PATH_FIELD_DIST = "/dist/";
  public static final String PATH_FIELD_STATS = "/stats/";

  // contexts
  public static final String PATH_CONTEXT_STATS = ROOT + "/contexts/stats/";

  public static String exporterPath(String exportType) {
    return PATH_EXPORTER + exportType + "/";
  }

  public static String fieldDistPath(String fieldId) {
    return PATH_FIELDS + fieldId + PATH_FIELD_DIST;
  }

  public static String fieldStatsPath(String fieldId) {
    return PATH_FIELDS + fieldId + PATH_FIELD_STATS;
  }
}

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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Properties;
import org.junit.After;
import org.junit.Test;

public class VistaConfigTest {

  @After
  public void tearDown() {
    VistaConfig.setProperties(new Properties());
  }

  @Test
  public void testDefaults() {
    VistaConfig.setProperties(new Properties());
    assertEquals("default", VistaConfig.defaultProcessor());
    assertEquals("default", VistaConfig.defaultTreeAlias());
    assertEquals(50, VistaConfig.exportDefaultLimit());
    assertEquals(20, VistaConfig.previewDefaultLimit());
    assertEquals(20, VistaConfig.distributionDefaultClusterCount());
    assertEquals("export-type-%s", VistaConfig.exportCookieNameTemplate());
    assertEquals("complete", VistaConfig.exportCookieData());
    assertFalse(VistaConfig.fieldIncludeUnpublished());
  }

  @Test
  public void testOverrides() {
    final var properties = new Properties();
    properties.setProperty(VistaConfig.DISTRIBUTION_DEFAULT_CLUSTER_COUNT, " 8 ");
    properties.setProperty(VistaConfig.EXPORT_DEFAULT_LIMIT, "100");
    properties.setProperty(VistaConfig.FIELD_INCLUDE_UNPUBLISHED, "true");
    properties.setProperty(VistaConfig.DEFAULT_TREE_ALIAS, "employees");
    VistaConfig.setProperties(properties);
    assertEquals(8, VistaConfig.distributionDefaultClusterCount());
    assertEquals(100, VistaConfig.exportDefaultLimit());
    assertTrue(VistaConfig.fieldIncludeUnpublished());
    assertEquals("employees", VistaConfig.defaultTreeAlias());
  }

  @Test(expected = RuntimeException.class)
  public void testClusterCountOutOfRange() {
    final var properties = new Properties();
    properties.setProperty(VistaConfig.DISTRIBUTION_DEFAULT_CLUSTER_COUNT, "0");
    VistaConfig.setProperties(properties);
    VistaConfig.distributionDefaultClusterCount();
  }
}

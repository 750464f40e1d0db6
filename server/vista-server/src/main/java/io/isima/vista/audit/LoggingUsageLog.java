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
package io.isima.vista.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.isima.vista.utils.VistaObjectMapperProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes usage events as JSON lines to the {@code io.isima.vista.audit} logger. */
public class LoggingUsageLog implements UsageLog {
  private static final Logger auditLogger = LoggerFactory.getLogger("io.isima.vista.audit");
  private static final ObjectMapper mapper = VistaObjectMapperProvider.get();

  @Override
  public void log(UsageEvent event) throws JsonProcessingException {
    auditLogger.info(mapper.writeValueAsString(event));
  }
}

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

import io.isima.vista.service.ServiceRequest;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front of the usage log used by the services. A failure to record never fails the request; it is
 * logged and dropped.
 */
public class UsageRecorder {
  private static final Logger logger = LoggerFactory.getLogger(UsageRecorder.class);

  private final UsageLog usageLog;

  public UsageRecorder(UsageLog usageLog) {
    this.usageLog = usageLog;
  }

  public void log(
      UsageOperation operation, Object instance, ServiceRequest request, Map<String, Object> data) {
    final var event =
        new UsageEvent(
            operation.getName(),
            instance != null ? instance.toString() : null,
            request != null ? request.getPath() : null,
            request != null ? request.getUser() : null,
            data,
            System.currentTimeMillis());
    try {
      usageLog.log(event);
    } catch (Exception e) {
      logger.warn("Failed to record usage event {}: {}", operation.getName(), e.toString());
    }
  }
}

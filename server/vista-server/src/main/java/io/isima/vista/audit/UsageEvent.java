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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/** A usage record: what happened, to which object, on whose request. */
@Getter
@ToString
@JsonInclude(Include.NON_NULL)
public class UsageEvent {
  private final String event;
  private final String instance;
  private final String path;
  private final String user;
  private final Map<String, Object> data;
  private final long timestamp;

  public UsageEvent(
      String event,
      String instance,
      String path,
      String user,
      Map<String, Object> data,
      long timestamp) {
    this.event = event;
    this.instance = instance;
    this.path = path;
    this.user = user;
    this.data = data;
    this.timestamp = timestamp;
  }
}

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

import com.google.common.collect.ImmutableMap;
import io.isima.vista.errors.exception.InvalidConfigurationException;
import io.isima.vista.field.FieldResolver;
import java.util.Collection;
import java.util.List;

/** Registry of query processors by name. Built at startup and read-only afterwards. */
public class QueryProcessorRegistry {

  private final ImmutableMap<String, QueryProcessor> processors;

  public QueryProcessorRegistry(Collection<QueryProcessor> processors) {
    final var builder = ImmutableMap.<String, QueryProcessor>builder();
    processors.forEach((processor) -> builder.put(processor.getName(), processor));
    this.processors = builder.build();
  }

  public static QueryProcessorRegistry withDefaults(FieldResolver resolver) {
    return new QueryProcessorRegistry(List.of(new DefaultQueryProcessor(resolver)));
  }

  /**
   * Gets a processor by name.
   *
   * @param name processor name
   * @return the processor
   * @throws InvalidConfigurationException thrown when no processor has the name
   */
  public QueryProcessor get(String name) throws InvalidConfigurationException {
    final var processor = name != null ? processors.get(name) : null;
    if (processor == null) {
      throw new InvalidConfigurationException("Unknown query processor: %s", name);
    }
    return processor;
  }

  public Collection<String> getNames() {
    return processors.keySet();
  }
}

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
package io.isima.vista.field;

import io.isima.vista.common.VistaConfig;
import io.isima.vista.models.FieldDesc;
import io.isima.vista.tree.DataTree;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves field identifiers against a data tree.
 *
 * <p>An identifier is either the numeric field id or the natural key {@code model.column}.
 * Resolution never throws for a bad identifier; callers decide whether an empty result is fatal.
 */
public class FieldResolver {
  private static final Logger logger = LoggerFactory.getLogger(FieldResolver.class);

  private final boolean includeUnpublished;

  public FieldResolver() {
    this(VistaConfig.fieldIncludeUnpublished());
  }

  public FieldResolver(boolean includeUnpublished) {
    this.includeUnpublished = includeUnpublished;
  }

  public Optional<FieldReference> resolve(String identifier, DataTree tree) {
    if (StringUtils.isBlank(identifier)) {
      return Optional.empty();
    }
    final var src = identifier.trim();
    final FieldDesc field;
    if (StringUtils.isNumeric(src)) {
      try {
        field = tree.getSchema().getField(Long.parseLong(src));
      } catch (NumberFormatException e) {
        logger.debug("Field id out of range: {}", src);
        return Optional.empty();
      }
    } else {
      field = tree.getSchema().getField(src);
    }
    return toReference(field, tree);
  }

  public Optional<FieldReference> resolve(long id, DataTree tree) {
    return toReference(tree.getSchema().getField(id), tree);
  }

  private Optional<FieldReference> toReference(FieldDesc field, DataTree tree) {
    if (field == null || (!field.isPublished() && !includeUnpublished)) {
      return Optional.empty();
    }
    return tree.queryStringForField(field).map((path) -> new FieldReference(field, path));
  }
}

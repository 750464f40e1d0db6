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
package io.isima.vista.models.context;

import com.fasterxml.jackson.databind.JsonNode;
import io.isima.vista.errors.exception.InvalidFilterException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses data context documents.
 *
 * <p>A document is either a condition {@code {"field": 3, "operator": "gt", "value": 30}} or a
 * branch {@code {"type": "and", "children": [...]}}. A null, missing or empty document yields an
 * empty context.
 */
public class ContextParser {

  private static final String FIELD = "field";
  private static final String OPERATOR = "operator";
  private static final String VALUE = "value";
  private static final String TYPE = "type";
  private static final String CHILDREN = "children";

  public static DataContext parse(JsonNode src) throws InvalidFilterException {
    if (src == null || src.isNull() || src.isMissingNode() || src.size() == 0) {
      return DataContext.empty();
    }
    return new DataContext(parseNode(src, "$"));
  }

  private static ContextNode parseNode(JsonNode src, String location)
      throws InvalidFilterException {
    if (!src.isObject()) {
      throw new InvalidFilterException("%s: node must be an object", location);
    }
    if (src.has(CHILDREN)) {
      return parseBranch(src, location);
    }
    return parseCondition(src, location);
  }

  private static BranchNode parseBranch(JsonNode src, String location)
      throws InvalidFilterException {
    final var typeNode = src.get(TYPE);
    final BranchNode.Type type;
    if (typeNode == null) {
      type = BranchNode.Type.AND;
    } else {
      try {
        type = BranchNode.Type.valueOf(typeNode.asText().toUpperCase());
      } catch (IllegalArgumentException e) {
        throw new InvalidFilterException(
            "%s: unknown branch type '%s'", location, typeNode.asText());
      }
    }
    final var childrenNode = src.get(CHILDREN);
    if (!childrenNode.isArray() || childrenNode.size() == 0) {
      throw new InvalidFilterException("%s: children must be a non-empty array", location);
    }
    final List<ContextNode> children = new ArrayList<>();
    for (int i = 0; i < childrenNode.size(); ++i) {
      children.add(parseNode(childrenNode.get(i), location + ".children[" + i + "]"));
    }
    return new BranchNode(type, children);
  }

  private static ConditionNode parseCondition(JsonNode src, String location)
      throws InvalidFilterException {
    final var fieldNode = src.get(FIELD);
    if (fieldNode == null || !(fieldNode.isTextual() || fieldNode.isIntegralNumber())) {
      throw new InvalidFilterException("%s: field identifier is missing", location);
    }
    final var operatorNode = src.get(OPERATOR);
    final var operator = Operator.forKeyword(operatorNode != null ? operatorNode.asText() : null);
    if (operator == null) {
      throw new InvalidFilterException(
          "%s: unknown operator '%s'", location, operatorNode != null ? operatorNode : "");
    }
    final var valueNode = src.get(VALUE);
    final Object value = toValue(valueNode);
    switch (operator) {
      case IN:
      case NOT_IN:
        if (!(value instanceof List)) {
          throw new InvalidFilterException("%s: operator %s requires a list", location, operator);
        }
        break;
      case RANGE:
      case NOT_RANGE:
        if (!(value instanceof List) || ((List<?>) value).size() != 2) {
          throw new InvalidFilterException(
              "%s: operator %s requires a pair of bounds", location, operator);
        }
        break;
      case ISNULL:
        if (!(value instanceof Boolean)) {
          throw new InvalidFilterException("%s: operator isnull requires a boolean", location);
        }
        break;
      default:
        if (value == null || value instanceof List) {
          throw new InvalidFilterException(
              "%s: operator %s requires a single value", location, operator);
        }
    }
    return new ConditionNode(fieldNode.asText(), operator, value);
  }

  private static Object toValue(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isArray()) {
      final List<Object> values = new ArrayList<>();
      node.forEach((element) -> values.add(toValue(element)));
      return values;
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isNumber()) {
      return node.decimalValue();
    }
    return node.asText();
  }
}

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

import io.isima.vista.errors.exception.InvalidFilterException;
import io.isima.vista.field.FieldResolver;
import io.isima.vista.models.FieldType;
import io.isima.vista.models.context.BranchNode;
import io.isima.vista.models.context.ConditionNode;
import io.isima.vista.models.context.ContextVisitor;
import io.isima.vista.models.context.DataContext;
import io.isima.vista.models.context.Operator;
import io.isima.vista.tree.DataTree;
import io.isima.vista.tree.TreeRow;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Compiles a data context into a row predicate.
 *
 * <p>Comparisons against a null value are false, as in SQL. Negated operators are the logical
 * negation of their positive form, so a row with a null value matches {@code -exact}.
 */
public class ContextFilterCompiler
    implements ContextVisitor<Predicate<TreeRow>, InvalidFilterException> {

  private final DataTree tree;
  private final FieldResolver resolver;

  public ContextFilterCompiler(DataTree tree, FieldResolver resolver) {
    this.tree = tree;
    this.resolver = resolver;
  }

  /**
   * Compiles a context.
   *
   * @param context the context, may be null
   * @return the predicate, or null when the context applies no restriction
   * @throws InvalidFilterException thrown when a condition refers to an unknown field or carries
   *     an operand that does not fit the field type
   */
  public Predicate<TreeRow> compile(DataContext context) throws InvalidFilterException {
    if (context == null || context.isEmpty()) {
      return null;
    }
    return context.getRoot().accept(this);
  }

  @Override
  public Predicate<TreeRow> visitBranch(BranchNode node) throws InvalidFilterException {
    final List<Predicate<TreeRow>> children = new ArrayList<>();
    for (var child : node.getChildren()) {
      children.add(child.accept(this));
    }
    if (node.getType() == BranchNode.Type.AND) {
      return (row) -> children.stream().allMatch((child) -> child.test(row));
    }
    return (row) -> children.stream().anyMatch((child) -> child.test(row));
  }

  @Override
  public Predicate<TreeRow> visitCondition(ConditionNode node) throws InvalidFilterException {
    final var reference =
        resolver
            .resolve(node.getField(), tree)
            .orElseThrow(() -> new InvalidFilterException("Unknown field '%s'", node.getField()));
    final var type = reference.getField().getType();
    final var path = reference.getPath();
    final var operator = node.getOperator();

    final Predicate<Object> test;
    switch (operator) {
      case EXACT:
      case NOT_EXACT:
        {
          final var operand = convert(type, node.getValue(), node);
          test = (value) -> Values.matches(value, operand);
          break;
        }
      case GT:
      case GTE:
      case LT:
      case LTE:
        {
          final var operand = convert(type, node.getValue(), node);
          test = (value) -> value != null && decide(operator, Values.compare(value, operand));
          break;
        }
      case IN:
      case NOT_IN:
        {
          final List<Object> operands = new ArrayList<>();
          for (var element : (List<?>) node.getValue()) {
            operands.add(convert(type, element, node));
          }
          test = (value) -> operands.stream().anyMatch((operand) -> Values.matches(value, operand));
          break;
        }
      case RANGE:
      case NOT_RANGE:
        {
          final var bounds = (List<?>) node.getValue();
          final var lower = convert(type, bounds.get(0), node);
          final var upper = convert(type, bounds.get(1), node);
          test =
              (value) ->
                  value != null
                      && Values.compare(value, lower) >= 0
                      && Values.compare(value, upper) <= 0;
          break;
        }
      case ISNULL:
        {
          final boolean expectsNull = (Boolean) node.getValue();
          test = (value) -> (value == null) == expectsNull;
          break;
        }
      case ICONTAINS:
      case NOT_ICONTAINS:
        {
          final var operand = node.getValue().toString().toLowerCase();
          test = (value) -> value != null && value.toString().toLowerCase().contains(operand);
          break;
        }
      default:
        throw new InvalidFilterException("Unsupported operator %s", operator);
    }
    final Predicate<Object> effective = operator.isNegated() ? test.negate() : test;
    return (row) -> effective.test(row.get(path));
  }

  private static boolean decide(Operator operator, int comparison) {
    switch (operator) {
      case GT:
        return comparison > 0;
      case GTE:
        return comparison >= 0;
      case LT:
        return comparison < 0;
      case LTE:
        return comparison <= 0;
      default:
        return false;
    }
  }

  private static Object convert(FieldType type, Object operand, ConditionNode node)
      throws InvalidFilterException {
    if (operand == null) {
      throw new InvalidFilterException("Null operand for field '%s'", node.getField());
    }
    try {
      return type.convert(operand);
    } catch (RuntimeException e) {
      throw new InvalidFilterException(
          "Operand '%s' does not fit field '%s' of type %s", operand, node.getField(), type);
    }
  }
}

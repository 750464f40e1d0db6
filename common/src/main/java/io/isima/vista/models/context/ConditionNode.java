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

import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Leaf condition that compares a field against an operand.
 *
 * <p>The operand is a scalar for comparison operators, a list for {@link Operator#IN} and {@link
 * Operator#RANGE} variants, and a boolean for {@link Operator#ISNULL}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ConditionNode implements ContextNode {
  private final String field;
  private final Operator operator;
  private final Object value;

  public ConditionNode(String field, Operator operator, Object value) {
    this.field = Objects.requireNonNull(field, "'field' must not be null");
    this.operator = Objects.requireNonNull(operator, "'operator' must not be null");
    this.value = value;
  }

  @Override
  public <T, E extends Exception> T accept(ContextVisitor<T, E> visitor) throws E {
    return visitor.visitCondition(this);
  }
}

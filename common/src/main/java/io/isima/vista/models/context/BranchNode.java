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

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Conjunction or disjunction of child nodes. */
@Getter
@ToString
@EqualsAndHashCode
public class BranchNode implements ContextNode {
  private final Type type;
  private final List<ContextNode> children;

  public BranchNode(Type type, List<ContextNode> children) {
    this.type = type;
    this.children = List.copyOf(children);
  }

  @Override
  public <T, E extends Exception> T accept(ContextVisitor<T, E> visitor) throws E {
    return visitor.visitBranch(this);
  }

  public enum Type {
    AND,
    OR
  }
}

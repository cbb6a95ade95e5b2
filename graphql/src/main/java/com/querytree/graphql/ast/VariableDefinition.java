/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.querytree.graphql.ast;

import java.util.List;
import java.util.Objects;

/**
 * Variable declared by an operation: <code>$name: Type = defaultValue</code>.
 */
public class VariableDefinition extends AstNode implements WithComments {
  private final String        name;
  private final Type          type;
  private final Value         defaultValue;
  private final List<Comment> comments;

  public VariableDefinition(final String name, final Type type, final Value defaultValue) {
    this(name, type, defaultValue, null, null);
  }

  public VariableDefinition(final String name, final Type type, final Value defaultValue, final List<Comment> comments,
      final Position position) {
    super(position);
    this.name = name;
    this.type = Objects.requireNonNull(type, "type");
    this.defaultValue = defaultValue;
    this.comments = listOf(comments);
  }

  public String getName() {
    return name;
  }

  public Type getType() {
    return type;
  }

  /**
   * @return the default value or null if not declared
   */
  public Value getDefaultValue() {
    return defaultValue;
  }

  @Override
  public List<Comment> getComments() {
    return comments;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.VARIABLE_DEFINITION;
  }

  @Override
  public VariableDefinition withPosition(final Position position) {
    return new VariableDefinition(name, type, defaultValue, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final VariableDefinition that = (VariableDefinition) o;
    return Objects.equals(name, that.name) && type.equals(that.type) && Objects.equals(defaultValue, that.defaultValue) && comments.equals(
        that.comments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, defaultValue, comments, position);
  }

  @Override
  public String toString() {
    return "$" + name + ": " + type;
  }
}

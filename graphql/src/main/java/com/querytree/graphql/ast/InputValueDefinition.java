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
 * Argument of a field or directive definition, or field of an input object type.
 */
public class InputValueDefinition extends AstNode implements WithDirectives, WithComments {
  private final String          name;
  private final Type            valueType;
  private final Value           defaultValue;
  private final List<Directive> directives;
  private final List<Comment>   comments;

  public InputValueDefinition(final String name, final Type valueType, final Value defaultValue) {
    this(name, valueType, defaultValue, null, null, null);
  }

  public InputValueDefinition(final String name, final Type valueType, final Value defaultValue, final List<Directive> directives,
      final List<Comment> comments, final Position position) {
    super(position);
    this.name = name;
    this.valueType = Objects.requireNonNull(valueType, "valueType");
    this.defaultValue = defaultValue;
    this.directives = listOf(directives);
    this.comments = listOf(comments);
  }

  public String getName() {
    return name;
  }

  public Type getValueType() {
    return valueType;
  }

  public Value getDefaultValue() {
    return defaultValue;
  }

  @Override
  public List<Directive> getDirectives() {
    return directives;
  }

  @Override
  public List<Comment> getComments() {
    return comments;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.INPUT_VALUE_DEFINITION;
  }

  @Override
  public InputValueDefinition withPosition(final Position position) {
    return new InputValueDefinition(name, valueType, defaultValue, directives, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final InputValueDefinition that = (InputValueDefinition) o;
    return Objects.equals(name, that.name) && valueType.equals(that.valueType) && Objects.equals(defaultValue, that.defaultValue)
        && directives.equals(that.directives) && comments.equals(that.comments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, valueType, defaultValue, directives, comments, position);
  }

  @Override
  public String toString() {
    return name + ": " + valueType;
  }
}

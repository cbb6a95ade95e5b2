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
 * Field declared by an object or interface type: <code>name(arguments): Type @directives</code>.
 */
public class FieldDefinition extends AstNode implements WithDirectives, WithComments {
  private final String                     name;
  private final Type                       fieldType;
  private final List<InputValueDefinition> arguments;
  private final List<Directive>            directives;
  private final List<Comment>              comments;

  public FieldDefinition(final String name, final Type fieldType, final List<InputValueDefinition> arguments) {
    this(name, fieldType, arguments, null, null, null);
  }

  public FieldDefinition(final String name, final Type fieldType, final List<InputValueDefinition> arguments,
      final List<Directive> directives, final List<Comment> comments, final Position position) {
    super(position);
    this.name = name;
    this.fieldType = Objects.requireNonNull(fieldType, "fieldType");
    this.arguments = listOf(arguments);
    this.directives = listOf(directives);
    this.comments = listOf(comments);
  }

  public String getName() {
    return name;
  }

  public Type getFieldType() {
    return fieldType;
  }

  public List<InputValueDefinition> getArguments() {
    return arguments;
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
    return AstNodeKind.FIELD_DEFINITION;
  }

  @Override
  public FieldDefinition withPosition(final Position position) {
    return new FieldDefinition(name, fieldType, arguments, directives, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final FieldDefinition that = (FieldDefinition) o;
    return Objects.equals(name, that.name) && fieldType.equals(that.fieldType) && arguments.equals(that.arguments) && directives.equals(
        that.directives) && comments.equals(that.comments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, fieldType, arguments, directives, comments, position);
  }

  @Override
  public String toString() {
    return name + ": " + fieldType;
  }
}

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
 * Field selection: <code>alias: name(arguments) @directives { selections }</code>.
 */
public class Field extends Selection implements SelectionContainer {
  private final String          alias;
  private final String          name;
  private final List<Argument>  arguments;
  private final List<Selection> selections;
  private final List<Comment>   trailingComments;

  public Field(final String alias, final String name, final List<Argument> arguments, final List<Directive> directives,
      final List<Selection> selections) {
    this(alias, name, arguments, directives, selections, null, null, null);
  }

  public Field(final String alias, final String name, final List<Argument> arguments, final List<Directive> directives,
      final List<Selection> selections, final List<Comment> comments, final List<Comment> trailingComments, final Position position) {
    super(directives, comments, position);
    this.alias = alias;
    this.name = name;
    this.arguments = listOf(arguments);
    this.selections = listOf(selections);
    this.trailingComments = listOf(trailingComments);
  }

  /**
   * @return the alias or null if the field is not aliased
   */
  public String getAlias() {
    return alias;
  }

  public String getName() {
    return name;
  }

  /**
   * Returns the key of the field in the response: the alias if present, otherwise the name.
   */
  public String getOutputName() {
    return alias != null ? alias : name;
  }

  public List<Argument> getArguments() {
    return arguments;
  }

  @Override
  public List<Selection> getSelections() {
    return selections;
  }

  @Override
  public List<Comment> getTrailingComments() {
    return trailingComments;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.FIELD;
  }

  @Override
  public Field withPosition(final Position position) {
    return new Field(alias, name, arguments, directives, selections, comments, trailingComments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final Field that = (Field) o;
    return Objects.equals(alias, that.alias) && Objects.equals(name, that.name) && arguments.equals(that.arguments) && directives.equals(
        that.directives) && selections.equals(that.selections) && comments.equals(that.comments) && trailingComments.equals(
        that.trailingComments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(alias, name, arguments, directives, selections, comments, trailingComments, position);
  }

  @Override
  public String toString() {
    return "Field{" + (alias != null ? alias + ": " : "") + name + "}";
  }
}

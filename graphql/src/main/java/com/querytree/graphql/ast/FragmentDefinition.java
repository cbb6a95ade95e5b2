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
 * Named fragment: <code>fragment name on Type @directives { selections }</code>.
 */
public class FragmentDefinition extends Definition implements ConditionalFragment, WithDirectives, SelectionContainer {
  private final String          name;
  private final NamedType       typeCondition;
  private final List<Directive> directives;
  private final List<Selection> selections;
  private final List<Comment>   comments;
  private final List<Comment>   trailingComments;

  public FragmentDefinition(final String name, final NamedType typeCondition, final List<Directive> directives,
      final List<Selection> selections) {
    this(name, typeCondition, directives, selections, null, null, null);
  }

  public FragmentDefinition(final String name, final NamedType typeCondition, final List<Directive> directives,
      final List<Selection> selections, final List<Comment> comments, final List<Comment> trailingComments, final Position position) {
    super(position);
    this.name = name;
    this.typeCondition = Objects.requireNonNull(typeCondition, "typeCondition");
    this.directives = listOf(directives);
    this.selections = listOf(selections);
    this.comments = listOf(comments);
    this.trailingComments = listOf(trailingComments);
  }

  public String getName() {
    return name;
  }

  public NamedType getTypeCondition() {
    return typeCondition;
  }

  /**
   * Always present for a named fragment.
   */
  @Override
  public NamedType getTypeConditionOpt() {
    return typeCondition;
  }

  @Override
  public List<Directive> getDirectives() {
    return directives;
  }

  @Override
  public List<Selection> getSelections() {
    return selections;
  }

  @Override
  public List<Comment> getComments() {
    return comments;
  }

  @Override
  public List<Comment> getTrailingComments() {
    return trailingComments;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.FRAGMENT_DEFINITION;
  }

  @Override
  public FragmentDefinition withPosition(final Position position) {
    return new FragmentDefinition(name, typeCondition, directives, selections, comments, trailingComments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final FragmentDefinition that = (FragmentDefinition) o;
    return Objects.equals(name, that.name) && typeCondition.equals(that.typeCondition) && directives.equals(that.directives)
        && selections.equals(that.selections) && comments.equals(that.comments) && trailingComments.equals(that.trailingComments)
        && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, typeCondition, directives, selections, comments, trailingComments, position);
  }

  @Override
  public String toString() {
    return "fragment " + name + " on " + typeCondition;
  }
}

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
 * Anonymous fragment: <code>... on Type @directives { selections }</code>. The type condition is optional.
 */
public class InlineFragment extends Selection implements ConditionalFragment, SelectionContainer {
  private final NamedType       typeCondition;
  private final List<Selection> selections;
  private final List<Comment>   trailingComments;

  public InlineFragment(final NamedType typeCondition, final List<Directive> directives, final List<Selection> selections) {
    this(typeCondition, directives, selections, null, null, null);
  }

  public InlineFragment(final NamedType typeCondition, final List<Directive> directives, final List<Selection> selections,
      final List<Comment> comments, final List<Comment> trailingComments, final Position position) {
    super(directives, comments, position);
    this.typeCondition = typeCondition;
    this.selections = listOf(selections);
    this.trailingComments = listOf(trailingComments);
  }

  public NamedType getTypeCondition() {
    return typeCondition;
  }

  @Override
  public NamedType getTypeConditionOpt() {
    return typeCondition;
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
    return AstNodeKind.INLINE_FRAGMENT;
  }

  @Override
  public InlineFragment withPosition(final Position position) {
    return new InlineFragment(typeCondition, directives, selections, comments, trailingComments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final InlineFragment that = (InlineFragment) o;
    return Objects.equals(typeCondition, that.typeCondition) && directives.equals(that.directives) && selections.equals(that.selections)
        && comments.equals(that.comments) && trailingComments.equals(that.trailingComments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeCondition, directives, selections, comments, trailingComments, position);
  }

  @Override
  public String toString() {
    return "InlineFragment{" + (typeCondition != null ? "on " + typeCondition.getName() : "") + "}";
  }
}

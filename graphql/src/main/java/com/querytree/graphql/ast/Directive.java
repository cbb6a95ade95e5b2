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
 * Directive applied to a node: <code>@name(arguments)</code>.
 */
public class Directive extends AstNode implements WithComments {
  private final String         name;
  private final List<Argument> arguments;
  private final List<Comment>  comments;

  public Directive(final String name, final List<Argument> arguments) {
    this(name, arguments, null, null);
  }

  public Directive(final String name, final List<Argument> arguments, final List<Comment> comments, final Position position) {
    super(position);
    this.name = name;
    this.arguments = listOf(arguments);
    this.comments = listOf(comments);
  }

  public String getName() {
    return name;
  }

  public List<Argument> getArguments() {
    return arguments;
  }

  @Override
  public List<Comment> getComments() {
    return comments;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.DIRECTIVE;
  }

  @Override
  public Directive withPosition(final Position position) {
    return new Directive(name, arguments, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final Directive that = (Directive) o;
    return Objects.equals(name, that.name) && arguments.equals(that.arguments) && comments.equals(that.comments) && Objects.equals(
        position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, arguments, comments, position);
  }

  @Override
  public String toString() {
    return "@" + name + (arguments.isEmpty() ? "" : arguments.toString());
  }
}

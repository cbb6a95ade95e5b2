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
 * <code>directive @name(arguments) on LOCATION | ...</code>
 */
public class DirectiveDefinition extends TypeSystemDefinition {
  private final String                     name;
  private final List<InputValueDefinition> arguments;
  private final List<DirectiveLocation>    locations;

  public DirectiveDefinition(final String name, final List<InputValueDefinition> arguments, final List<DirectiveLocation> locations) {
    this(name, arguments, locations, null, null);
  }

  public DirectiveDefinition(final String name, final List<InputValueDefinition> arguments, final List<DirectiveLocation> locations,
      final List<Comment> comments, final Position position) {
    super(comments, position);
    this.name = name;
    this.arguments = listOf(arguments);
    this.locations = listOf(locations);
  }

  public String getName() {
    return name;
  }

  public List<InputValueDefinition> getArguments() {
    return arguments;
  }

  public List<DirectiveLocation> getLocations() {
    return locations;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.DIRECTIVE_DEFINITION;
  }

  @Override
  public DirectiveDefinition withPosition(final Position position) {
    return new DirectiveDefinition(name, arguments, locations, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final DirectiveDefinition that = (DirectiveDefinition) o;
    return Objects.equals(name, that.name) && arguments.equals(that.arguments) && locations.equals(that.locations) && comments.equals(
        that.comments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, arguments, locations, comments, position);
  }

  @Override
  public String toString() {
    return "directive @" + name;
  }
}

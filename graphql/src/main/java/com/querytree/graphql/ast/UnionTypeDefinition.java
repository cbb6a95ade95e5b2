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
 * <code>union Name @directives = A | B</code>
 */
public class UnionTypeDefinition extends TypeDefinition {
  private final List<NamedType> types;

  public UnionTypeDefinition(final String name, final List<NamedType> types) {
    this(name, types, null, null, null);
  }

  public UnionTypeDefinition(final String name, final List<NamedType> types, final List<Directive> directives, final List<Comment> comments,
      final Position position) {
    super(name, directives, comments, position);
    this.types = listOf(types);
  }

  public List<NamedType> getTypes() {
    return types;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.UNION_TYPE_DEFINITION;
  }

  @Override
  public UnionTypeDefinition withPosition(final Position position) {
    return new UnionTypeDefinition(name, types, directives, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final UnionTypeDefinition that = (UnionTypeDefinition) o;
    return Objects.equals(name, that.name) && types.equals(that.types) && directives.equals(that.directives) && comments.equals(
        that.comments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, types, directives, comments, position);
  }
}

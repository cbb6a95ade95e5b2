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

public class InputObjectTypeDefinition extends TypeDefinition implements WithTrailingComments {
  private final List<InputValueDefinition> fields;
  private final List<Comment>              trailingComments;

  public InputObjectTypeDefinition(final String name, final List<InputValueDefinition> fields) {
    this(name, fields, null, null, null, null);
  }

  public InputObjectTypeDefinition(final String name, final List<InputValueDefinition> fields, final List<Directive> directives,
      final List<Comment> comments, final List<Comment> trailingComments, final Position position) {
    super(name, directives, comments, position);
    this.fields = listOf(fields);
    this.trailingComments = listOf(trailingComments);
  }

  public List<InputValueDefinition> getFields() {
    return fields;
  }

  @Override
  public List<Comment> getTrailingComments() {
    return trailingComments;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.INPUT_OBJECT_TYPE_DEFINITION;
  }

  @Override
  public InputObjectTypeDefinition withPosition(final Position position) {
    return new InputObjectTypeDefinition(name, fields, directives, comments, trailingComments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final InputObjectTypeDefinition that = (InputObjectTypeDefinition) o;
    return Objects.equals(name, that.name) && fields.equals(that.fields) && directives.equals(that.directives) && comments.equals(
        that.comments) && trailingComments.equals(that.trailingComments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, fields, directives, comments, trailingComments, position);
  }
}

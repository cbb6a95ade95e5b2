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
 * <code>extend type Name { ... }</code>: adds interfaces, fields and directives to an existing object type.
 */
public class TypeExtensionDefinition extends TypeSystemDefinition {
  private final ObjectTypeDefinition definition;

  public TypeExtensionDefinition(final ObjectTypeDefinition definition) {
    this(definition, null, null);
  }

  public TypeExtensionDefinition(final ObjectTypeDefinition definition, final List<Comment> comments, final Position position) {
    super(comments, position);
    this.definition = Objects.requireNonNull(definition, "definition");
  }

  public ObjectTypeDefinition getDefinition() {
    return definition;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.TYPE_EXTENSION_DEFINITION;
  }

  @Override
  public TypeExtensionDefinition withPosition(final Position position) {
    return new TypeExtensionDefinition(definition, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final TypeExtensionDefinition that = (TypeExtensionDefinition) o;
    return definition.equals(that.definition) && comments.equals(that.comments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(definition, comments, position);
  }

  @Override
  public String toString() {
    return "extend " + definition;
  }
}

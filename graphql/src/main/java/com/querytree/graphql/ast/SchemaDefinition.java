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
 * <code>schema @directives { query: Query mutation: Mutation }</code>
 */
public class SchemaDefinition extends TypeSystemDefinition implements WithDirectives, WithTrailingComments {
  private final List<OperationTypeDefinition> operationTypes;
  private final List<Directive>               directives;
  private final List<Comment>                 trailingComments;

  public SchemaDefinition(final List<OperationTypeDefinition> operationTypes) {
    this(operationTypes, null, null, null, null);
  }

  public SchemaDefinition(final List<OperationTypeDefinition> operationTypes, final List<Directive> directives,
      final List<Comment> comments, final List<Comment> trailingComments, final Position position) {
    super(comments, position);
    this.operationTypes = listOf(operationTypes);
    this.directives = listOf(directives);
    this.trailingComments = listOf(trailingComments);
  }

  public List<OperationTypeDefinition> getOperationTypes() {
    return operationTypes;
  }

  @Override
  public List<Directive> getDirectives() {
    return directives;
  }

  @Override
  public List<Comment> getTrailingComments() {
    return trailingComments;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.SCHEMA_DEFINITION;
  }

  @Override
  public SchemaDefinition withPosition(final Position position) {
    return new SchemaDefinition(operationTypes, directives, comments, trailingComments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final SchemaDefinition that = (SchemaDefinition) o;
    return operationTypes.equals(that.operationTypes) && directives.equals(that.directives) && comments.equals(that.comments)
        && trailingComments.equals(that.trailingComments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operationTypes, directives, comments, trailingComments, position);
  }
}

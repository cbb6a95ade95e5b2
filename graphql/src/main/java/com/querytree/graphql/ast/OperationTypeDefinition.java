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
 * Root type of an operation kind inside a {@link SchemaDefinition}: <code>query: Query</code>.
 */
public class OperationTypeDefinition extends AstNode implements WithComments {
  private final OperationType operation;
  private final NamedType     type;
  private final List<Comment> comments;

  public OperationTypeDefinition(final OperationType operation, final NamedType type) {
    this(operation, type, null, null);
  }

  public OperationTypeDefinition(final OperationType operation, final NamedType type, final List<Comment> comments, final Position position) {
    super(position);
    this.operation = Objects.requireNonNull(operation, "operation");
    this.type = Objects.requireNonNull(type, "type");
    this.comments = listOf(comments);
  }

  public OperationType getOperation() {
    return operation;
  }

  public NamedType getType() {
    return type;
  }

  @Override
  public List<Comment> getComments() {
    return comments;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.OPERATION_TYPE_DEFINITION;
  }

  @Override
  public OperationTypeDefinition withPosition(final Position position) {
    return new OperationTypeDefinition(operation, type, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final OperationTypeDefinition that = (OperationTypeDefinition) o;
    return operation == that.operation && type.equals(that.type) && comments.equals(that.comments) && Objects.equals(position,
        that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operation, type, comments, position);
  }

  @Override
  public String toString() {
    return operation + ": " + type;
  }
}

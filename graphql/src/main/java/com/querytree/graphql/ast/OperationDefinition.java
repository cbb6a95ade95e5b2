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
import java.util.Locale;
import java.util.Objects;

/**
 * Query, mutation or subscription. The name is optional: a document with a single operation may leave it
 * anonymous.
 */
public class OperationDefinition extends Definition implements WithDirectives, SelectionContainer {
  private final OperationType            operationType;
  private final String                   name;
  private final List<VariableDefinition> variables;
  private final List<Directive>          directives;
  private final List<Selection>          selections;
  private final List<Comment>            comments;
  private final List<Comment>            trailingComments;

  public OperationDefinition(final List<Selection> selections) {
    this(OperationType.QUERY, null, null, null, selections, null, null, null);
  }

  public OperationDefinition(final OperationType operationType, final String name, final List<VariableDefinition> variables,
      final List<Directive> directives, final List<Selection> selections) {
    this(operationType, name, variables, directives, selections, null, null, null);
  }

  public OperationDefinition(final OperationType operationType, final String name, final List<VariableDefinition> variables,
      final List<Directive> directives, final List<Selection> selections, final List<Comment> comments, final List<Comment> trailingComments,
      final Position position) {
    super(position);
    this.operationType = operationType != null ? operationType : OperationType.QUERY;
    this.name = name;
    this.variables = listOf(variables);
    this.directives = listOf(directives);
    this.selections = listOf(selections);
    this.comments = listOf(comments);
    this.trailingComments = listOf(trailingComments);
  }

  public OperationType getOperationType() {
    return operationType;
  }

  /**
   * @return the name or null for an anonymous operation
   */
  public String getName() {
    return name;
  }

  public List<VariableDefinition> getVariables() {
    return variables;
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
    return AstNodeKind.OPERATION_DEFINITION;
  }

  @Override
  public OperationDefinition withPosition(final Position position) {
    return new OperationDefinition(operationType, name, variables, directives, selections, comments, trailingComments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final OperationDefinition that = (OperationDefinition) o;
    return operationType == that.operationType && Objects.equals(name, that.name) && variables.equals(that.variables) && directives.equals(
        that.directives) && selections.equals(that.selections) && comments.equals(that.comments) && trailingComments.equals(
        that.trailingComments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operationType, name, variables, directives, selections, comments, trailingComments, position);
  }

  @Override
  public String toString() {
    return operationType.name().toLowerCase(Locale.ENGLISH) + (name != null ? " " + name : "");
  }
}

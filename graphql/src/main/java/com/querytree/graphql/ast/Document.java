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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of a parsed query or type system document.
 * <p>
 * The lookup maps of operations and fragments are computed once at construction. When two definitions share the
 * same name the last one wins in the maps; duplicated names are reported by validation, not here.
 * <p>
 * Equality and hash code only consider the definitions and the position: the {@link SourceMapper} is ignored, so
 * two documents parsed from different text with the same definitions at the same positions are equal.
 */
public class Document extends AstNode implements WithTrailingComments {
  private final List<Definition>                 definitions;
  private final List<Comment>                    trailingComments;
  private final SourceMapper                     sourceMapper;
  private final Map<String, OperationDefinition> operations;
  private final Map<String, FragmentDefinition>  fragments;
  private final int                              operationCount;

  public Document(final List<Definition> definitions) {
    this(definitions, null, null, null);
  }

  public Document(final List<Definition> definitions, final List<Comment> trailingComments, final Position position,
      final SourceMapper sourceMapper) {
    super(position);
    this.definitions = listOf(definitions);
    this.trailingComments = listOf(trailingComments);
    this.sourceMapper = sourceMapper;

    final Map<String, OperationDefinition> ops = new LinkedHashMap<>();
    final Map<String, FragmentDefinition> frags = new LinkedHashMap<>();
    int opCount = 0;
    for (Definition definition : this.definitions) {
      if (definition instanceof OperationDefinition) {
        final OperationDefinition op = (OperationDefinition) definition;
        ops.put(op.getName(), op);
        ++opCount;
      } else if (definition instanceof FragmentDefinition) {
        final FragmentDefinition fragment = (FragmentDefinition) definition;
        frags.put(fragment.getName(), fragment);
      }
    }
    this.operations = Collections.unmodifiableMap(ops);
    this.fragments = Collections.unmodifiableMap(frags);
    this.operationCount = opCount;
  }

  /**
   * Concatenates the definitions of the documents, in order, into a new document. The result has no position and no
   * source mapper because it does not come from a single source.
   */
  public static Document merge(final Collection<Document> documents) {
    final List<Definition> definitions = new ArrayList<>();
    for (Document document : documents)
      definitions.addAll(document.getDefinitions());
    return new Document(definitions);
  }

  /**
   * Merges this document with another one. The {@link SourceMapper} is lost along the way.
   *
   * @see #merge(Collection)
   */
  public Document merge(final Document other) {
    return merge(List.of(this, other));
  }

  public List<Definition> getDefinitions() {
    return definitions;
  }

  @Override
  public List<Comment> getTrailingComments() {
    return trailingComments;
  }

  /**
   * @return the source mapper set by the parser, or null
   */
  public SourceMapper getSourceMapper() {
    return sourceMapper;
  }

  /**
   * @return the text the document was parsed from, if known
   */
  public String getSource() {
    return sourceMapper != null ? sourceMapper.getSource() : null;
  }

  /**
   * Returns the operations by name. The anonymous operation, if any, is under the null key.
   */
  public Map<String, OperationDefinition> getOperations() {
    return operations;
  }

  public Map<String, FragmentDefinition> getFragments() {
    return fragments;
  }

  /**
   * Returns the only operation of the document.
   *
   * @return the operation or null if the document contains zero or more than one operation
   */
  public OperationDefinition getOperation() {
    return getOperation(null);
  }

  /**
   * Resolves the operation to execute.
   *
   * @param operationName name of the operation. If null, the document must contain exactly one operation
   *
   * @return the matching operation, or null if the name does not match any named operation or if no name is passed
   * and the choice is ambiguous
   */
  public OperationDefinition getOperation(final String operationName) {
    if (operationName != null)
      return operations.get(operationName);

    if (operationCount != 1)
      return null;

    return operations.values().iterator().next();
  }

  /**
   * @return the type of the operation resolved by {@link #getOperation(String)}, or null
   */
  public OperationType getOperationType(final String operationName) {
    final OperationDefinition operation = getOperation(operationName);
    return operation != null ? operation.getOperationType() : null;
  }

  public Document withoutSourceMapper() {
    return sourceMapper == null ? this : new Document(definitions, trailingComments, position, null);
  }

  @Override
  public Document withPosition(final Position position) {
    return new Document(definitions, trailingComments, position, sourceMapper);
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.DOCUMENT;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final Document that = (Document) o;
    return definitions.equals(that.definitions) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return 31 * definitions.hashCode() + Objects.hashCode(position);
  }

  @Override
  public String toString() {
    return "Document" + definitions;
  }
}

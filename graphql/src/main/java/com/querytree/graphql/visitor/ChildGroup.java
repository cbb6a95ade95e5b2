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
package com.querytree.graphql.visitor;

import com.querytree.graphql.ast.AstNode;

import java.util.Collections;
import java.util.List;

/**
 * One field of a node holding child nodes, with the children it currently contains. A group is either a required
 * single child, an optional single child or an ordered sequence.
 */
public final class ChildGroup {
  public enum Arity {REQUIRED, OPTIONAL, MANY}

  private final String                   name;
  private final Arity                    arity;
  private final Class<? extends AstNode> elementType;
  private final List<? extends AstNode>  nodes;

  private ChildGroup(final String name, final Arity arity, final Class<? extends AstNode> elementType, final List<? extends AstNode> nodes) {
    this.name = name;
    this.arity = arity;
    this.elementType = elementType;
    this.nodes = nodes;
  }

  public static ChildGroup required(final String name, final Class<? extends AstNode> elementType, final AstNode node) {
    return new ChildGroup(name, Arity.REQUIRED, elementType, Collections.singletonList(node));
  }

  public static ChildGroup optional(final String name, final Class<? extends AstNode> elementType, final AstNode node) {
    return new ChildGroup(name, Arity.OPTIONAL, elementType, node != null ? Collections.singletonList(node) : Collections.emptyList());
  }

  public static ChildGroup many(final String name, final Class<? extends AstNode> elementType, final List<? extends AstNode> nodes) {
    return new ChildGroup(name, Arity.MANY, elementType, nodes);
  }

  /**
   * Name of the field in the parent node, for diagnostics.
   */
  public String getName() {
    return name;
  }

  public Arity getArity() {
    return arity;
  }

  /**
   * Type every node in this group must be an instance of, including replacements.
   */
  public Class<? extends AstNode> getElementType() {
    return elementType;
  }

  public List<? extends AstNode> getNodes() {
    return nodes;
  }

  public int size() {
    return nodes.size();
  }

  @Override
  public String toString() {
    return name + "(" + arity + ")=" + nodes;
  }
}

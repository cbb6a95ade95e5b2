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

import java.util.Collections;
import java.util.List;

/**
 * Base class of all the nodes of a query or type system document. Nodes are immutable: a rewrite produces new
 * instances and shares the untouched subtrees with the original tree.
 */
public abstract class AstNode {
  protected final Position position;

  protected AstNode(final Position position) {
    this.position = position;
  }

  /**
   * Returns the location of the node in the source text, or null if unknown (for example after normalization).
   */
  public Position getPosition() {
    return position;
  }

  public abstract AstNodeKind getKind();

  /**
   * Returns a copy of this node located at the given position. Children are shared.
   */
  public abstract AstNode withPosition(Position position);

  /**
   * Hash suitable as a process local memoization key. It is based on the identity of the instance, so two equal
   * nodes built separately usually have different keys. Normalize the tree and use {@link #hashCode()} for content
   * based caching.
   */
  public int cacheKeyHash() {
    return System.identityHashCode(this);
  }

  public String renderPretty() {
    return AstRendererManager.instance().render(this, RenderFormat.PRETTY);
  }

  public String renderCompact() {
    return AstRendererManager.instance().render(this, RenderFormat.COMPACT);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + (position != null ? position.toString() : "");
  }

  protected static <T> List<T> listOf(final List<? extends T> list) {
    return list == null || list.isEmpty() ? Collections.emptyList() : List.copyOf(list);
  }
}

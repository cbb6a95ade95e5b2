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

import java.util.Objects;

/**
 * Decision returned by an {@link AstVisitor} when a node is entered or left.
 * <ul>
 *   <li>{@link #CONTINUE}: go on, descending into the children when returned on enter</li>
 *   <li>{@link #SKIP}: on enter, do not visit the children. The leave callback of the node is still invoked</li>
 *   <li>{@link #BREAK}: stop the whole traversal now</li>
 *   <li>{@link #DELETE}: remove the node from its parent. On enter, the node is not left</li>
 *   <li>{@link #replace(AstNode)}: use another node in place of the current one</li>
 * </ul>
 * Only {@link AstTraversal} applies DELETE and REPLACE; the read-only {@link AstWalker} does not.
 */
public final class VisitorCommand {
  public enum Type {CONTINUE, SKIP, BREAK, DELETE, REPLACE}

  public static final VisitorCommand CONTINUE = new VisitorCommand(Type.CONTINUE, null);
  public static final VisitorCommand SKIP     = new VisitorCommand(Type.SKIP, null);
  public static final VisitorCommand BREAK    = new VisitorCommand(Type.BREAK, null);
  public static final VisitorCommand DELETE   = new VisitorCommand(Type.DELETE, null);

  private final Type    type;
  private final AstNode replacement;

  private VisitorCommand(final Type type, final AstNode replacement) {
    this.type = type;
    this.replacement = replacement;
  }

  public static VisitorCommand replace(final AstNode replacement) {
    return new VisitorCommand(Type.REPLACE, Objects.requireNonNull(replacement, "replacement"));
  }

  public Type getType() {
    return type;
  }

  /**
   * @return the new node for a REPLACE command, otherwise null
   */
  public AstNode getReplacement() {
    return replacement;
  }

  @Override
  public String toString() {
    return type == Type.REPLACE ? "REPLACE(" + replacement + ")" : type.name();
  }
}

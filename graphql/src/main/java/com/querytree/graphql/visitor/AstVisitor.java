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

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Callbacks invoked by {@link AstTraversal} and {@link AstWalker} when a node is first reached (enter) and after all
 * its children have been processed (leave). Both default to {@link VisitorCommand#CONTINUE}.
 */
public interface AstVisitor {
  default VisitorCommand onEnter(final AstNode node) {
    return VisitorCommand.CONTINUE;
  }

  default VisitorCommand onLeave(final AstNode node) {
    return VisitorCommand.CONTINUE;
  }

  static AstVisitor of(final Function<AstNode, VisitorCommand> onEnter, final Function<AstNode, VisitorCommand> onLeave) {
    return new AstVisitor() {
      @Override
      public VisitorCommand onEnter(final AstNode node) {
        return onEnter != null ? onEnter.apply(node) : VisitorCommand.CONTINUE;
      }

      @Override
      public VisitorCommand onLeave(final AstNode node) {
        return onLeave != null ? onLeave.apply(node) : VisitorCommand.CONTINUE;
      }
    };
  }

  /**
   * Visitor that decides only when the nodes are entered.
   */
  static AstVisitor entering(final Function<AstNode, VisitorCommand> onEnter) {
    return of(onEnter, null);
  }

  /**
   * Visitor that only observes the nodes and always continues.
   */
  static AstVisitor simple(final Consumer<AstNode> onEnter, final Consumer<AstNode> onLeave) {
    return new AstVisitor() {
      @Override
      public VisitorCommand onEnter(final AstNode node) {
        if (onEnter != null)
          onEnter.accept(node);
        return VisitorCommand.CONTINUE;
      }

      @Override
      public VisitorCommand onLeave(final AstNode node) {
        if (onLeave != null)
          onLeave.accept(node);
        return VisitorCommand.CONTINUE;
      }
    };
  }
}

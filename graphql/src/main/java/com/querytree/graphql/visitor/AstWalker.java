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

import com.querytree.GlobalConfiguration;
import com.querytree.exception.ErrorCode;
import com.querytree.exception.QueryTreeException;
import com.querytree.graphql.ast.AstNode;
import com.querytree.log.LogManager;

import java.util.Map;
import java.util.logging.Level;

/**
 * Read-only depth-first walk with the same visiting order as {@link AstTraversal}, for visitors that only collect
 * information. It does not build any node. REPLACE and DELETE commands are ignored and the walk continues as with
 * CONTINUE, unless {@link GlobalConfiguration#WALKER_STRICT_COMMANDS} is set.
 */
public final class AstWalker {
  private final AstVisitor visitor;
  private final boolean    strict;
  private       boolean    interrupted;

  private AstWalker(final AstVisitor visitor, final boolean strict) {
    this.visitor = visitor;
    this.strict = strict;
  }

  /**
   * @return true if the whole tree has been walked, false if the visitor returned BREAK
   */
  public static boolean walk(final AstNode root, final AstVisitor visitor) {
    return walk(root, visitor, GlobalConfiguration.WALKER_STRICT_COMMANDS.getValueAsBoolean());
  }

  public static boolean walk(final AstNode root, final AstVisitor visitor, final boolean strictCommands) {
    final AstWalker walker = new AstWalker(visitor, strictCommands);
    walker.walkNode(root);
    return !walker.interrupted;
  }

  private void walkNode(final AstNode node) {
    final VisitorCommand.Type onEnter = check(visitor.onEnter(node), node);
    if (onEnter == VisitorCommand.Type.BREAK) {
      interrupted = true;
      return;
    }

    if (onEnter != VisitorCommand.Type.SKIP)
      for (final ChildGroup group : AstChildren.childGroups(node)) {
        for (final AstNode child : group.getNodes()) {
          walkNode(child);
          if (interrupted)
            return;
        }
      }

    if (check(visitor.onLeave(node), node) == VisitorCommand.Type.BREAK)
      interrupted = true;
  }

  private VisitorCommand.Type check(final VisitorCommand command, final AstNode node) {
    final VisitorCommand.Type type = command.getType();
    if (type != VisitorCommand.Type.REPLACE && type != VisitorCommand.Type.DELETE)
      return type;

    if (strict)
      throw new QueryTreeException(ErrorCode.UNSUPPORTED_VISITOR_COMMAND,
          String.format("Command %s is not supported by a read-only walk (node %s)", type, node.getKind()),
          Map.of("command", type.name(), "node", node.getKind().name()));

    LogManager.instance().log(this, Level.FINE, "Ignored command %s on %s during a read-only walk", type, node.getKind());
    return VisitorCommand.Type.CONTINUE;
  }
}

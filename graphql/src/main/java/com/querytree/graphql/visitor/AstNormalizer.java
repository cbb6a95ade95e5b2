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
import com.querytree.graphql.ast.AstNode;
import com.querytree.graphql.ast.Comment;
import com.querytree.graphql.ast.Document;

/**
 * Produces a structural copy of a tree without source information, so that trees parsed from different texts can be
 * compared with {@code equals()}. Applying it twice gives the same result as applying it once.
 */
public final class AstNormalizer {
  private AstNormalizer() {
  }

  /**
   * Removes positions and the document source mapper. Comments are removed too if
   * {@link GlobalConfiguration#NORMALIZE_STRIP_COMMENTS} is set.
   */
  public static <T extends AstNode> T withoutPosition(final T node) {
    return withoutPosition(node, GlobalConfiguration.NORMALIZE_STRIP_COMMENTS.getValueAsBoolean());
  }

  public static <T extends AstNode> T withoutPosition(final T node, final boolean stripComments) {
    return AstTraversal.visit(node, new AstVisitor() {
      @Override
      public VisitorCommand onEnter(final AstNode n) {
        if (n instanceof Comment)
          return stripComments ? VisitorCommand.DELETE : VisitorCommand.SKIP;
        return VisitorCommand.CONTINUE;
      }

      @Override
      public VisitorCommand onLeave(final AstNode n) {
        if (n instanceof Document) {
          final Document document = (Document) n;
          if (document.getSourceMapper() != null)
            return VisitorCommand.replace(document.withoutSourceMapper().withPosition(null));
        }
        return n.getPosition() != null ? VisitorCommand.replace(n.withPosition(null)) : VisitorCommand.CONTINUE;
      }
    });
  }
}

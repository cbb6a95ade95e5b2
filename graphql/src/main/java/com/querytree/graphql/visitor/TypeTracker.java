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

/**
 * Keeps schema related state (current type, field, input type, ...) in step with a traversal. It is notified of
 * every node entered and left, before the visitor of the caller and regardless of the command the visitor returns.
 *
 * @see AstTraversal#visitWithTypeInfo(AstNode, TypeTracker, java.util.function.Function)
 */
public interface TypeTracker {
  void enter(AstNode node);

  void leave(AstNode node);
}

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

/**
 * Reference to a type: {@link NamedType}, optionally wrapped by any number of {@link ListType} and
 * {@link NotNullType} layers.
 */
public abstract class Type extends AstNode {
  protected Type(final Position position) {
    super(position);
  }

  /**
   * Removes all the list and not-null wrappers.
   *
   * @return the innermost named type
   */
  public NamedType getNamedType() {
    Type current = this;
    while (!(current instanceof NamedType)) {
      if (current instanceof ListType)
        current = ((ListType) current).getOfType();
      else
        current = ((NotNullType) current).getOfType();
    }
    return (NamedType) current;
  }
}

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

/**
 * Named type of the type system: scalar, object, interface, union, enum or input object.
 */
public abstract class TypeDefinition extends TypeSystemDefinition implements WithDirectives {
  protected final String          name;
  protected final List<Directive> directives;

  protected TypeDefinition(final String name, final List<Directive> directives, final List<Comment> comments, final Position position) {
    super(comments, position);
    this.name = name;
    this.directives = listOf(directives);
  }

  public String getName() {
    return name;
  }

  @Override
  public List<Directive> getDirectives() {
    return directives;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + name + "}";
  }
}

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
import java.util.Objects;

/**
 * Reference to an operation variable: <code>$name</code>. The name is stored without the dollar sign.
 */
public class VariableValue extends Value {
  private final String name;

  public VariableValue(final String name) {
    this(name, null, null);
  }

  public VariableValue(final String name, final List<Comment> comments, final Position position) {
    super(comments, position);
    this.name = Objects.requireNonNull(name, "name");
  }

  public String getName() {
    return name;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.VARIABLE_VALUE;
  }

  @Override
  public VariableValue withPosition(final Position position) {
    return new VariableValue(name, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final VariableValue that = (VariableValue) o;
    return name.equals(that.name) && comments.equals(that.comments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, comments, position);
  }

  @Override
  public String toString() {
    return "$" + name;
  }
}

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

public class ObjectField extends AstNode implements NameValue {
  private final String        name;
  private final Value         value;
  private final List<Comment> comments;

  public ObjectField(final String name, final Value value) {
    this(name, value, null, null);
  }

  public ObjectField(final String name, final Value value, final List<Comment> comments, final Position position) {
    super(position);
    this.name = name;
    this.value = Objects.requireNonNull(value, "value");
    this.comments = listOf(comments);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public Value getValue() {
    return value;
  }

  @Override
  public List<Comment> getComments() {
    return comments;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.OBJECT_FIELD;
  }

  @Override
  public ObjectField withPosition(final Position position) {
    return new ObjectField(name, value, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final ObjectField that = (ObjectField) o;
    return Objects.equals(name, that.name) && value.equals(that.value) && comments.equals(that.comments) && Objects.equals(position,
        that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value, comments, position);
  }

  @Override
  public String toString() {
    return name + ": " + value;
  }
}

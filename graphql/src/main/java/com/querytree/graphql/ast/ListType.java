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

import java.util.Objects;

/**
 * List wrapper: <code>[ofType]</code>.
 */
public class ListType extends Type {
  private final Type ofType;

  public ListType(final Type ofType) {
    this(ofType, null);
  }

  public ListType(final Type ofType, final Position position) {
    super(position);
    this.ofType = Objects.requireNonNull(ofType, "ofType");
  }

  public Type getOfType() {
    return ofType;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.LIST_TYPE;
  }

  @Override
  public ListType withPosition(final Position position) {
    return new ListType(ofType, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final ListType that = (ListType) o;
    return ofType.equals(that.ofType) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ofType, position);
  }

  @Override
  public String toString() {
    return "[" + ofType + "]";
  }
}

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

public class IntValue extends ScalarValue {
  private final int value;

  public IntValue(final int value) {
    this(value, null, null);
  }

  public IntValue(final int value, final List<Comment> comments, final Position position) {
    super(comments, position);
    this.value = value;
  }

  public int getValue() {
    return value;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.INT_VALUE;
  }

  @Override
  public IntValue withPosition(final Position position) {
    return new IntValue(value, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final IntValue that = (IntValue) o;
    return value == that.value && comments.equals(that.comments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, comments, position);
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}

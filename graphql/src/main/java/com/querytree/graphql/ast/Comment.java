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
 * One line of comment, without the leading <code>#</code>.
 */
public class Comment extends AstNode {
  private final String text;

  public Comment(final String text) {
    this(text, null);
  }

  public Comment(final String text, final Position position) {
    super(position);
    this.text = text;
  }

  public String getText() {
    return text;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.COMMENT;
  }

  @Override
  public Comment withPosition(final Position position) {
    return new Comment(text, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final Comment that = (Comment) o;
    return Objects.equals(text, that.text) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, position);
  }

  @Override
  public String toString() {
    return "Comment{" + text + "}";
  }
}

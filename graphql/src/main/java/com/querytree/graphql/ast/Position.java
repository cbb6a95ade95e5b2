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
 * Location of a node in the source text it was parsed from. Only meaningful together with the {@link SourceMapper}
 * of the owning {@link Document}.
 */
public final class Position {
  private final int index;
  private final int line;
  private final int column;

  /**
   * @param index  zero-based character offset
   * @param line   one-based line number
   * @param column one-based column number
   */
  public Position(final int index, final int line, final int column) {
    this.index = index;
    this.line = line;
    this.column = column;
  }

  public int getIndex() {
    return index;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final Position that = (Position) o;
    return index == that.index && line == that.line && column == that.column;
  }

  @Override
  public int hashCode() {
    int result = index;
    result = 31 * result + line;
    result = 31 * result + column;
    return result;
  }

  @Override
  public String toString() {
    return "(" + line + ":" + column + ")";
  }
}

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

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Float literal kept with its full precision. Equality follows {@link BigDecimal#equals(Object)}, so
 * <code>1.0</code> and <code>1.00</code> are different values.
 */
public class BigDecimalValue extends ScalarValue {
  private final BigDecimal value;

  public BigDecimalValue(final BigDecimal value) {
    this(value, null, null);
  }

  public BigDecimalValue(final BigDecimal value, final List<Comment> comments, final Position position) {
    super(comments, position);
    this.value = Objects.requireNonNull(value, "value");
  }

  public BigDecimal getValue() {
    return value;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.BIG_DECIMAL_VALUE;
  }

  @Override
  public BigDecimalValue withPosition(final Position position) {
    return new BigDecimalValue(value, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final BigDecimalValue that = (BigDecimalValue) o;
    return value.equals(that.value) && comments.equals(that.comments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, comments, position);
  }

  @Override
  public String toString() {
    return value.toPlainString();
  }
}

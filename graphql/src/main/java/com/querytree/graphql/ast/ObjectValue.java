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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input object literal: <code>{name: value, ...}</code>.
 */
public class ObjectValue extends Value {
  private final List<ObjectField> fields;
  private final Map<String, Value> fieldsByName;

  public ObjectValue(final List<ObjectField> fields) {
    this(fields, null, null);
  }

  public ObjectValue(final List<ObjectField> fields, final List<Comment> comments, final Position position) {
    super(comments, position);
    this.fields = listOf(fields);

    final Map<String, Value> byName = new LinkedHashMap<>();
    for (ObjectField field : this.fields)
      // A REPEATED NAME KEEPS ITS FIRST POSITION BUT TAKES THE LAST VALUE
      byName.put(field.getName(), field.getValue());
    this.fieldsByName = Collections.unmodifiableMap(byName);
  }

  public List<ObjectField> getFields() {
    return fields;
  }

  /**
   * Returns the field values by name in the order the names first appear. When a name is repeated the last value
   * wins.
   */
  public Map<String, Value> getFieldsByName() {
    return fieldsByName;
  }

  @Override
  public AstNodeKind getKind() {
    return AstNodeKind.OBJECT_VALUE;
  }

  @Override
  public ObjectValue withPosition(final Position position) {
    return new ObjectValue(fields, comments, position);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final ObjectValue that = (ObjectValue) o;
    return fields.equals(that.fields) && comments.equals(that.comments) && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fields, comments, position);
  }

  @Override
  public String toString() {
    return "ObjectValue" + fields;
  }
}

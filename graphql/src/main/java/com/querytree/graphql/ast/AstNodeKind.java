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
 * Discriminant of the closed set of node classes. Dispatching with a <code>switch</code> expression over this enum
 * is checked for exhaustiveness by the compiler.
 */
public enum AstNodeKind {
  DOCUMENT,
  OPERATION_DEFINITION,
  FRAGMENT_DEFINITION,
  VARIABLE_DEFINITION,

  // TYPE REFERENCES
  NAMED_TYPE,
  LIST_TYPE,
  NOT_NULL_TYPE,

  // SELECTIONS
  FIELD,
  FRAGMENT_SPREAD,
  INLINE_FRAGMENT,

  DIRECTIVE,
  ARGUMENT,
  OBJECT_FIELD,

  // VALUES
  INT_VALUE,
  BIG_INT_VALUE,
  FLOAT_VALUE,
  BIG_DECIMAL_VALUE,
  STRING_VALUE,
  BOOLEAN_VALUE,
  ENUM_VALUE,
  LIST_VALUE,
  VARIABLE_VALUE,
  NULL_VALUE,
  OBJECT_VALUE,

  COMMENT,

  // TYPE SYSTEM
  SCALAR_TYPE_DEFINITION,
  FIELD_DEFINITION,
  INPUT_VALUE_DEFINITION,
  OBJECT_TYPE_DEFINITION,
  INTERFACE_TYPE_DEFINITION,
  UNION_TYPE_DEFINITION,
  ENUM_TYPE_DEFINITION,
  ENUM_VALUE_DEFINITION,
  INPUT_OBJECT_TYPE_DEFINITION,
  TYPE_EXTENSION_DEFINITION,
  DIRECTIVE_DEFINITION,
  DIRECTIVE_LOCATION,
  SCHEMA_DEFINITION,
  OPERATION_TYPE_DEFINITION
}

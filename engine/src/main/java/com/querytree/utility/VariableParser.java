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
package com.querytree.utility;

import com.querytree.log.LogManager;

import java.util.logging.*;

/**
 * Replaces variables delimited by a begin and an end pattern, for example <code>${user.home}</code>. Variables are
 * resolved from the innermost-last occurrence, so nested placeholders are expanded before the enclosing ones.
 */
public class VariableParser {
  public static Object resolveVariables(final String text, final String beginPattern, final String endPattern,
      final VariableParserListener listener) {
    return resolveVariables(text, beginPattern, endPattern, listener, null);
  }

  public static Object resolveVariables(final String text, final String beginPattern, final String endPattern,
      final VariableParserListener listener, final Object defaultValue) {
    if (listener == null)
      throw new IllegalArgumentException("Missing VariableParserListener listener");

    final int beginPos = text.lastIndexOf(beginPattern);
    if (beginPos == -1)
      return text;

    final int endPos = text.indexOf(endPattern, beginPos + 1);
    if (endPos == -1)
      return text;

    final String pre = text.substring(0, beginPos);
    final String variable = text.substring(beginPos + beginPattern.length(), endPos);
    final String post = text.substring(endPos + endPattern.length());

    Object resolved = listener.resolve(variable);

    if (resolved == null) {
      if (defaultValue == null)
        LogManager.instance().log(VariableParser.class, Level.INFO, "Cannot resolve variable '%s'", variable);
      else
        resolved = defaultValue;
    }

    if (!pre.isEmpty() || !post.isEmpty()) {
      final String expanded = pre + (resolved != null ? resolved.toString() : "") + post;
      return resolveVariables(expanded, beginPattern, endPattern, listener, defaultValue);
    }

    return resolved;
  }
}

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

import com.querytree.GlobalConfiguration;

/**
 * Resolves <code>${name}</code> placeholders against system properties, then environment variables, then
 * {@link GlobalConfiguration} keys.
 */
public class SystemVariableResolver implements VariableParserListener {
  public static final String VAR_BEGIN = "${";
  public static final String VAR_END   = "}";

  public static final SystemVariableResolver INSTANCE = new SystemVariableResolver();

  public String resolveSystemVariables(final String text) {
    return resolveSystemVariables(text, null);
  }

  public String resolveSystemVariables(final String text, final String defaultValue) {
    if (text == null)
      return defaultValue;

    final Object resolved = VariableParser.resolveVariables(text, VAR_BEGIN, VAR_END, this, defaultValue);
    return resolved != null ? resolved.toString() : null;
  }

  public static String resolveVariable(final String variable) {
    if (variable == null)
      return null;

    String resolved = System.getProperty(variable);

    if (resolved == null)
      resolved = System.getenv(variable);

    if (resolved == null) {
      final GlobalConfiguration cfg = GlobalConfiguration.findByKey(variable);
      if (cfg != null)
        resolved = cfg.getValueAsString();
    }

    return resolved;
  }

  @Override
  public String resolve(final String variable) {
    return resolveVariable(variable);
  }
}

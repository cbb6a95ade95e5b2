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
package com.querytree.exception;

import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception class for all the errors raised by this library. Carries a standardized {@link ErrorCode} and a
 * diagnostic context (for example the kind of the node being edited).
 */
public class QueryTreeException extends RuntimeException {
  private final ErrorCode           errorCode;
  private final Map<String, Object> context;

  public QueryTreeException(final String message) {
    this(ErrorCode.UNKNOWN_ERROR, message, null, null);
  }

  public QueryTreeException(final String message, final Throwable cause) {
    this(ErrorCode.UNKNOWN_ERROR, message, cause, null);
  }

  public QueryTreeException(final ErrorCode errorCode, final String message) {
    this(errorCode, message, null, null);
  }

  public QueryTreeException(final ErrorCode errorCode, final String message, final Throwable cause) {
    this(errorCode, message, cause, null);
  }

  public QueryTreeException(final ErrorCode errorCode, final String message, final Map<String, Object> context) {
    this(errorCode, message, null, context);
  }

  public QueryTreeException(final ErrorCode errorCode, final String message, final Throwable cause, final Map<String, Object> context) {
    super(message, cause);
    this.errorCode = errorCode != null ? errorCode : ErrorCode.UNKNOWN_ERROR;
    this.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * @return unmodifiable map of context information
   */
  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /**
   * Adds a context entry to this exception.
   *
   * @return this exception for method chaining
   */
  public QueryTreeException addContext(final String key, final Object value) {
    if (key != null)
      this.context.put(key, value);
    return this;
  }

  public String toJSON() {
    final JSONObject json = new JSONObject();
    json.put("errorCode", errorCode.getCode());
    json.put("errorName", errorCode.name());
    json.put("category", errorCode.getCategory().getDisplayName());
    json.put("message", getMessage() != null ? getMessage() : "");

    if (!context.isEmpty()) {
      final JSONObject ctx = new JSONObject();
      for (final Map.Entry<String, Object> entry : context.entrySet()) {
        final Object value = entry.getValue();
        ctx.put(entry.getKey(),
            value == null ? JSONObject.NULL : value instanceof Number || value instanceof Boolean ? value : value.toString());
      }
      json.put("context", ctx);
    }

    if (getCause() != null)
      json.put("cause", String.valueOf(getCause().getMessage()));

    return json.toString();
  }

  @Override
  public String toString() {
    return String.format("%s [%s-%d]: %s", getClass().getSimpleName(), errorCode.getCategory(), errorCode.getCode(), getMessage());
  }
}

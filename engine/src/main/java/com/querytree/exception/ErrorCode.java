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

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes. Error codes are organized in categories based on the first digit(s):
 * <ul>
 *   <li>1xxx - AST edit errors</li>
 *   <li>2xxx - Rendering errors</li>
 *   <li>3xxx - Configuration errors</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see QueryTreeException
 */
public enum ErrorCode {

  // ========== AST Errors (1xxx) ==========
  /** A visitor deleted a child that its parent requires */
  INVALID_AST_EDIT(1001, "Invalid AST edit"),

  /** A visitor replaced a node with one that does not fit the parent's slot */
  INVALID_REPLACEMENT(1002, "Invalid replacement node"),

  /** A rewrite command was returned to a read-only traversal */
  UNSUPPORTED_VISITOR_COMMAND(1003, "Unsupported visitor command"),

  // ========== Rendering Errors (2xxx) ==========
  /** No renderer registered nor configured */
  RENDERER_NOT_CONFIGURED(2001, "Renderer not configured"),

  /** The configured renderer could not be created or failed */
  RENDERER_ERROR(2002, "Renderer error"),

  // ========== Configuration Errors (3xxx) ==========
  /** Invalid setting value */
  CONFIGURATION_ERROR(3001, "Configuration error"),

  // ========== Internal Errors (99xxx) ==========
  /** Unexpected internal error */
  INTERNAL_ERROR(99001, "Internal error"),

  /** Unknown error (used as fallback) */
  UNKNOWN_ERROR(99999, "Unknown error");

  // Populated at class loading time to detect duplicate codes early
  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   */
  public ErrorCategory getCategory() {
    return switch (code / 1000) {
      case 1 -> ErrorCategory.AST;
      case 2 -> ErrorCategory.RENDERING;
      case 3 -> ErrorCategory.CONFIGURATION;
      default -> ErrorCategory.INTERNAL;
    };
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}

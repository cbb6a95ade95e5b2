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

import com.querytree.GlobalConfiguration;
import com.querytree.exception.ErrorCode;
import com.querytree.exception.QueryTreeException;
import com.querytree.log.LogManager;

import java.util.logging.Level;

/**
 * Holds the {@link AstRenderer} the nodes delegate {@link AstNode#renderPretty()} and {@link AstNode#renderCompact()}
 * to. If no renderer has been set, the class configured in {@link GlobalConfiguration#RENDERER_CLASS} is instantiated
 * on first use.
 */
public class AstRendererManager {
  private static final AstRendererManager instance = new AstRendererManager();
  private volatile     AstRenderer        renderer;

  protected AstRendererManager() {
  }

  public static AstRendererManager instance() {
    return instance;
  }

  public void setRenderer(final AstRenderer renderer) {
    this.renderer = renderer;
  }

  public AstRenderer getRenderer() {
    AstRenderer current = renderer;
    if (current == null) {
      synchronized (this) {
        current = renderer;
        if (current == null) {
          current = loadConfiguredRenderer();
          renderer = current;
        }
      }
    }
    return current;
  }

  public String render(final AstNode node, final RenderFormat format) {
    return getRenderer().render(node, format);
  }

  private AstRenderer loadConfiguredRenderer() {
    final String className = GlobalConfiguration.RENDERER_CLASS.getValueAsString();
    if (className == null || className.isEmpty())
      throw new QueryTreeException(ErrorCode.RENDERER_NOT_CONFIGURED,
          "No renderer registered. Set one with AstRendererManager.setRenderer() or with the setting '" + GlobalConfiguration.RENDERER_CLASS.getKey()
              + "'");

    try {
      final Class<?> cls = Class.forName(className);
      if (!AstRenderer.class.isAssignableFrom(cls))
        throw new QueryTreeException(ErrorCode.RENDERER_ERROR, "Class '" + className + "' does not implement " + AstRenderer.class.getSimpleName());

      return (AstRenderer) cls.getConstructor().newInstance();
    } catch (final QueryTreeException e) {
      throw e;
    } catch (final Exception e) {
      LogManager.instance().log(this, Level.WARNING, "Cannot create the renderer '%s'", e, className);
      throw new QueryTreeException(ErrorCode.RENDERER_ERROR, "Cannot create the renderer '" + className + "'", e).addContext("class", className);
    }
  }
}

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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.querytree.graphql.AstFixtures.field;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AstRendererManagerTest {
  public static class KindRenderer implements AstRenderer {
    @Override
    public String render(final AstNode node, final RenderFormat format) {
      return format + ":" + node.getKind();
    }
  }

  @AfterEach
  public void reset() {
    AstRendererManager.instance().setRenderer(null);
    GlobalConfiguration.RENDERER_CLASS.reset();
  }

  @Test
  public void delegatesToRegisteredRenderer() {
    AstRendererManager.instance().setRenderer(new KindRenderer());

    assertThat(field("id").renderPretty()).isEqualTo("PRETTY:FIELD");
    assertThat(field("id").renderCompact()).isEqualTo("COMPACT:FIELD");
    assertThat(new Document(List.of()).renderCompact()).isEqualTo("COMPACT:DOCUMENT");
  }

  @Test
  public void valuesRenderWithInputLayout() {
    AstRendererManager.instance().setRenderer(new KindRenderer());

    assertThat(new ListValue(List.of(new IntValue(1))).renderPretty()).isEqualTo("PRETTY_INPUT:LIST_VALUE");
    assertThat(new StringValue("x").renderCompact()).isEqualTo("COMPACT:STRING_VALUE");
  }

  @Test
  public void notConfigured() {
    assertThatThrownBy(() -> field("id").renderPretty())
        .isInstanceOf(QueryTreeException.class)
        .satisfies(e -> assertThat(((QueryTreeException) e).getErrorCode()).isEqualTo(ErrorCode.RENDERER_NOT_CONFIGURED));
  }

  @Test
  public void loadsConfiguredClass() {
    GlobalConfiguration.RENDERER_CLASS.setValue(KindRenderer.class.getName());

    assertThat(AstRendererManager.instance().getRenderer()).isInstanceOf(KindRenderer.class);
    assertThat(new NamedType("User").renderCompact()).isEqualTo("COMPACT:NAMED_TYPE");
  }

  @Test
  public void configuredClassNotFound() {
    GlobalConfiguration.RENDERER_CLASS.setValue("com.querytree.graphql.ast.NotExistentRenderer");

    assertThatThrownBy(() -> AstRendererManager.instance().getRenderer())
        .isInstanceOf(QueryTreeException.class)
        .hasCauseInstanceOf(ClassNotFoundException.class)
        .satisfies(e -> assertThat(((QueryTreeException) e).getErrorCode()).isEqualTo(ErrorCode.RENDERER_ERROR));
  }

  @Test
  public void configuredClassIsNotARenderer() {
    GlobalConfiguration.RENDERER_CLASS.setValue(String.class.getName());

    assertThatThrownBy(() -> AstRendererManager.instance().getRenderer())
        .isInstanceOf(QueryTreeException.class)
        .hasMessageContaining("does not implement AstRenderer");
  }
}

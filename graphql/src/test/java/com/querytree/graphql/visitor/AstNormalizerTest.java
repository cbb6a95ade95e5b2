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
package com.querytree.graphql.visitor;

import com.querytree.GlobalConfiguration;
import com.querytree.graphql.AstFixtures;
import com.querytree.graphql.ast.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class AstNormalizerTest {
  @AfterEach
  public void resetConfiguration() {
    GlobalConfiguration.resetAll();
  }

  private static List<AstNode> allNodes(final AstNode root) {
    final List<AstNode> nodes = new ArrayList<>();
    AstWalker.walk(root, AstVisitor.simple(nodes::add, null));
    return nodes;
  }

  @Test
  public void removesPositionsAndSourceMapper() {
    final Document located = AstFixtures.heroDocument(true);

    final Document normalized = AstNormalizer.withoutPosition(located, false);

    assertThat(normalized.getSourceMapper()).isNull();
    assertThat(allNodes(normalized)).isNotEmpty().allSatisfy(node -> assertThat(node.getPosition()).isNull());
    assertThat(normalized).isEqualTo(AstFixtures.heroDocument(false));
    assertThat(normalized.getOperation().getComments()).extracting(Comment::getText).containsExactly(" main query");
  }

  @Test
  public void idempotent() {
    final Document once = AstNormalizer.withoutPosition(AstFixtures.heroDocument(true), false);

    assertThat(AstNormalizer.withoutPosition(once, false)).isSameAs(once);

    final Document plain = AstFixtures.heroDocument(false);
    assertThat(AstNormalizer.withoutPosition(plain, false)).isSameAs(plain);
  }

  @Test
  public void stripsComments() {
    final Document normalized = AstNormalizer.withoutPosition(AstFixtures.heroDocument(true), true);

    assertThat(allNodes(normalized)).noneMatch(node -> node instanceof Comment);
    assertThat(normalized.getTrailingComments()).isEmpty();
    assertThat(normalized.getOperation().getComments()).isEmpty();
    assertThat(AstNormalizer.withoutPosition(normalized, true)).isSameAs(normalized);
  }

  @Test
  public void typeSystemDefinitions() {
    final Document located = AstFixtures.schemaDocument(true, true);
    assertThat(allNodes(located)).allSatisfy(node -> assertThat(node.getPosition()).isNotNull());

    final Document normalized = AstNormalizer.withoutPosition(located, false);
    assertThat(allNodes(normalized)).hasSameSizeAs(allNodes(located))
        .allSatisfy(node -> assertThat(node.getPosition()).isNull());
    assertThat(normalized).isEqualTo(AstFixtures.schemaDocument(false, true));
    assertThat(normalized.getTrailingComments()).extracting(Comment::getText).containsExactly(" eof");
    assertThat(AstNormalizer.withoutPosition(normalized, false)).isSameAs(normalized);

    final Document stripped = AstNormalizer.withoutPosition(located, true);
    assertThat(allNodes(stripped)).noneMatch(node -> node instanceof Comment)
        .allSatisfy(node -> assertThat(node.getPosition()).isNull());
    assertThat(stripped).isEqualTo(AstFixtures.schemaDocument(false, false));
    assertThat(stripped.getTrailingComments()).isEmpty();
  }

  @Test
  public void commentStrippingFromConfiguration() {
    assertThat(AstNormalizer.withoutPosition(AstFixtures.heroDocument(true)).getTrailingComments()).hasSize(1);

    GlobalConfiguration.NORMALIZE_STRIP_COMMENTS.setValue(true);
    assertThat(AstNormalizer.withoutPosition(AstFixtures.heroDocument(true)).getTrailingComments()).isEmpty();
  }

  @Test
  public void singleNodes() {
    final Field located = new Field("alias", "name", List.of(new Argument("id", new IntValue(1, null, new Position(12, 1, 13)))), null,
        null, null, null, new Position(0, 1, 1));

    final Field normalized = AstNormalizer.withoutPosition(located, false);

    assertThat(normalized.getPosition()).isNull();
    assertThat(normalized.getAlias()).isEqualTo("alias");
    assertThat(normalized).isEqualTo(new Field("alias", "name", List.of(new Argument("id", new IntValue(1))), null, null));

    final Document mappedOnly = new Document(List.of(), null, null, new AstFixtures.TextSourceMapper("x", ""));
    assertThat(AstNormalizer.withoutPosition(mappedOnly, false).getSourceMapper()).isNull();
  }

  @Test
  public void normalizedTreesFromDifferentSourcesAreEqual() {
    final Document first = AstFixtures.heroDocument(true);
    final Document second = first.withPosition(new Position(100, 7, 1));

    assertThat(first).isNotEqualTo(second);
    assertThat(AstNormalizer.withoutPosition(first, false)).isEqualTo(AstNormalizer.withoutPosition(second, false));
    assertThat(AstNormalizer.withoutPosition(first, false).hashCode()).isEqualTo(AstNormalizer.withoutPosition(second, false).hashCode());
  }
}

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
package com.querytree.graphql;

import com.querytree.graphql.ast.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Trees shared by the tests, built by hand as a parser would build them. The located variant carries positions and a
 * source mapper, the other one is the same tree without source information.
 */
public class AstFixtures {
  public static final String HERO_SOURCE = "# main query\n" //
      + "query Hero($episode: Episode = JEDI) {\n" //
      + "  hero(episode: $episode) { name ...HeroDetails ... on Droid { primaryFunction } }\n" //
      + "}\n" //
      + "fragment HeroDetails on Character { name friends(first: 10) { name } }\n" //
      + "# end\n";

  public static Document heroDocument(final boolean located) {
    final VariableDefinition episode = new VariableDefinition("episode", new NamedType("Episode", at(located, 34, 2, 22)),
        new EnumValue("JEDI", null, at(located, 44, 2, 32)), null, at(located, 24, 2, 12));

    final Field hero = new Field(null, "hero",
        List.of(new Argument("episode", new VariableValue("episode", null, at(located, 65, 3, 17)), null, at(located, 56, 3, 8))),
        List.of(),
        List.of(field("name", at(located, 76, 3, 28)),
            new FragmentSpread("HeroDetails", List.of(), null, at(located, 81, 3, 33)),
            new InlineFragment(new NamedType("Droid", at(located, 102, 3, 54)), List.of(),
                List.of(field("primaryFunction", at(located, 110, 3, 62))), null, null, at(located, 95, 3, 47))),
        null, null, at(located, 51, 3, 3));

    final OperationDefinition query = new OperationDefinition(OperationType.QUERY, "Hero", List.of(episode), List.of(), List.of(hero),
        List.of(new Comment(" main query", at(located, 0, 1, 1))), null, at(located, 13, 2, 1));

    final Field friends = new Field(null, "friends",
        List.of(new Argument("first", new IntValue(10, null, at(located, 176, 5, 56)), null, at(located, 169, 5, 49))), List.of(),
        List.of(field("name", at(located, 182, 5, 62))), null, null, at(located, 161, 5, 41));

    final FragmentDefinition details = new FragmentDefinition("HeroDetails", new NamedType("Character", at(located, 144, 5, 24)),
        List.of(), List.of(field("name", at(located, 156, 5, 36)), friends), null, null, at(located, 121, 5, 1));

    return new Document(List.of(query, details), List.of(new Comment(" end", at(located, 192, 6, 1))), at(located, 0, 1, 1),
        located ? new TextSourceMapper("hero.graphql", HERO_SOURCE) : null);
  }

  /**
   * Schema using every type-system node kind. Every node gets a distinct position when {@code located} is set, the
   * comments are attached only when {@code commented} is set.
   */
  public static Document schemaDocument(final boolean located, final boolean commented) {
    return new SchemaBuilder(located, commented).build();
  }

  public static Field field(final String name) {
    return new Field(null, name, null, null, null);
  }

  public static Field field(final String name, final Position position) {
    return new Field(null, name, null, null, null, null, null, position);
  }

  /**
   * Short description of a node, used to record the visiting order.
   */
  public static String label(final AstNode node) {
    if (node instanceof Field)
      return "Field:" + ((Field) node).getName();
    if (node instanceof Argument)
      return "Argument:" + ((Argument) node).getName();
    if (node instanceof Directive)
      return "Directive:" + ((Directive) node).getName();
    if (node instanceof NamedType)
      return "NamedType:" + ((NamedType) node).getName();
    if (node instanceof VariableValue)
      return "Variable:" + ((VariableValue) node).getName();
    if (node instanceof FragmentSpread)
      return "Spread:" + ((FragmentSpread) node).getName();
    if (node instanceof OperationDefinition)
      return "Operation:" + ((OperationDefinition) node).getName();
    if (node instanceof FragmentDefinition)
      return "Fragment:" + ((FragmentDefinition) node).getName();
    if (node instanceof Comment)
      return "Comment:" + ((Comment) node).getText().trim();
    if (node instanceof TypeDefinition)
      return node.getKind() + ":" + ((TypeDefinition) node).getName();
    if (node instanceof FieldDefinition)
      return node.getKind() + ":" + ((FieldDefinition) node).getName();
    if (node instanceof InputValueDefinition)
      return node.getKind() + ":" + ((InputValueDefinition) node).getName();
    if (node instanceof EnumValueDefinition)
      return node.getKind() + ":" + ((EnumValueDefinition) node).getName();
    if (node instanceof DirectiveDefinition)
      return node.getKind() + ":" + ((DirectiveDefinition) node).getName();
    if (node instanceof DirectiveLocation)
      return node.getKind() + ":" + ((DirectiveLocation) node).getName();
    if (node instanceof ObjectField)
      return node.getKind() + ":" + ((ObjectField) node).getName();
    if (node instanceof OperationTypeDefinition)
      return node.getKind() + ":" + ((OperationTypeDefinition) node).getOperation();
    return node.getKind().name();
  }

  private static Position at(final boolean located, final int index, final int line, final int column) {
    return located ? new Position(index, line, column) : null;
  }

  public static class TextSourceMapper implements SourceMapper {
    private final String id;
    private final String source;

    public TextSourceMapper(final String id, final String source) {
      this.id = id;
      this.source = source;
    }

    @Override
    public String getId() {
      return id;
    }

    @Override
    public String getSource() {
      return source;
    }

    @Override
    public String renderLocation(final Position position) {
      return "(line " + position.getLine() + ", column " + position.getColumn() + ")";
    }
  }

  private static class SchemaBuilder {
    private final boolean located;
    private final boolean commented;
    private       int     next = 0;

    private SchemaBuilder(final boolean located, final boolean commented) {
      this.located = located;
      this.commented = commented;
    }

    private Document build() {
      final SchemaDefinition schema = new SchemaDefinition(
          List.of(new OperationTypeDefinition(OperationType.QUERY, new NamedType("Query", pos()), comments("query root"), pos()),
              new OperationTypeDefinition(OperationType.MUTATION, new NamedType("Mutation", pos()), comments(), pos())),
          List.of(directive("meta", new Argument("tags",
              new ListValue(List.of(new StringValue("a", comments(), pos()), new BigIntValue(new BigInteger("12345678901234567890"), comments(), pos())),
                  comments("tags"), pos()), comments(), pos()))),
          comments("schema"), comments("end of schema"), pos());

      final ScalarTypeDefinition date = new ScalarTypeDefinition("Date",
          List.of(directive("format", new Argument("pattern", new StringValue("yyyy-MM-dd", comments("iso"), pos()), comments(), pos()))),
          comments("dates"), pos());

      final FieldDefinition hero = new FieldDefinition("hero",
          new NotNullType(new ListType(new NamedType("Character", pos()), pos()), pos()),
          List.of(new InputValueDefinition("episode", new NamedType("Episode", pos()), new EnumValue("JEDI", comments(), pos()), List.of(),
                  comments("which episode"), pos()),
              new InputValueDefinition("limit", new NotNullType(new NamedType("Int", pos()), pos()), new IntValue(10, comments(), pos()),
                  List.of(directive("range", new Argument("max", new IntValue(100, comments(), pos()), comments(), pos()))), comments(), pos())),
          List.of(directive("deprecated", new Argument("reason", new StringValue("old", comments(), pos()), comments(), pos()))),
          comments("hero field"), pos());

      final ObjectValue ttl = new ObjectValue(
          List.of(new ObjectField("max", new IntValue(60, comments(), pos()), comments("seconds"), pos()),
              new ObjectField("scale", new FloatValue(1.5, comments(), pos()), comments(), pos())), comments("ttl"), pos());

      final ObjectTypeDefinition query = new ObjectTypeDefinition("Query", List.of(new NamedType("Node", pos())), List.of(hero),
          List.of(directive("cached", new Argument("ttl", ttl, comments(), pos()))), comments("root"), comments("end of query"), pos());

      final InterfaceTypeDefinition node = new InterfaceTypeDefinition("Node",
          List.of(new FieldDefinition("id", new NotNullType(new NamedType("ID", pos()), pos()), List.of(), List.of(), comments(), pos())),
          List.of(directive("key")), comments("node"), comments("end of node"), pos());

      final UnionTypeDefinition searchResult = new UnionTypeDefinition("SearchResult",
          List.of(new NamedType("Human", pos()), new NamedType("Droid", pos())), List.of(directive("search")), comments("union"), pos());

      final EnumTypeDefinition episode = new EnumTypeDefinition("Episode",
          List.of(new EnumValueDefinition("NEWHOPE", List.of(directive("deprecated")), comments("first"), pos()),
              new EnumValueDefinition("JEDI", List.of(), comments(), pos())), List.of(), comments("episodes"), comments("end of episodes"),
          pos());

      final InputObjectTypeDefinition review = new InputObjectTypeDefinition("ReviewInput",
          List.of(new InputValueDefinition("stars", new NotNullType(new NamedType("Int", pos()), pos()), new NullValue(comments("none"), pos()),
                  List.of(), comments(), pos()),
              new InputValueDefinition("ratio", new NamedType("BigDecimal", pos()), new BigDecimalValue(new BigDecimal("0.25"), comments(), pos()),
                  List.of(), comments(), pos()),
              new InputValueDefinition("verified", new NamedType("Boolean", pos()), new BooleanValue(true, comments(), pos()), List.of(),
                  comments(), pos())), List.of(directive("input")), comments("review"), comments("end of review"), pos());

      final TypeExtensionDefinition extension = new TypeExtensionDefinition(new ObjectTypeDefinition("Query", List.of(),
          List.of(new FieldDefinition("count", new NamedType("Int", pos()), List.of(), List.of(), comments(), pos())), List.of(), comments(),
          comments(), pos()), comments("extension"), pos());

      final DirectiveDefinition cached = new DirectiveDefinition("cached",
          List.of(new InputValueDefinition("ttl", new NamedType("TtlInput", pos()), null, List.of(), comments(), pos())),
          List.of(new DirectiveLocation("FIELD_DEFINITION", comments("on fields"), pos()), new DirectiveLocation("OBJECT", comments(), pos())),
          comments("caching"), pos());

      return new Document(List.of(schema, date, query, node, searchResult, episode, review, extension, cached), comments("eof"), pos(),
          null);
    }

    private Directive directive(final String name, final Argument... arguments) {
      return new Directive(name, List.of(arguments), comments(), pos());
    }

    private List<Comment> comments(final String... texts) {
      if (!commented)
        return List.of();
      final List<Comment> comments = new ArrayList<>();
      for (String text : texts)
        comments.add(new Comment(" " + text, pos()));
      return comments;
    }

    private Position pos() {
      if (!located)
        return null;
      ++next;
      return new Position(next, 1, next + 1);
    }
  }
}

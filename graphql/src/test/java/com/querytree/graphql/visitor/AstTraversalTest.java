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
import com.querytree.exception.ErrorCode;
import com.querytree.exception.QueryTreeException;
import com.querytree.graphql.AstFixtures;
import com.querytree.graphql.ast.*;
import com.querytree.log.DefaultLogger;
import com.querytree.log.LogManager;
import com.querytree.log.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;

import static com.querytree.graphql.AstFixtures.field;
import static com.querytree.graphql.AstFixtures.label;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AstTraversalTest {
  private final List<String> events = new ArrayList<>();

  @AfterEach
  public void resetConfiguration() {
    GlobalConfiguration.resetAll();
  }

  private AstVisitor recording() {
    return AstVisitor.simple(node -> events.add("enter " + label(node)), node -> events.add("leave " + label(node)));
  }

  private static Field heroField() {
    return new Field(null, "hero", List.of(new Argument("episode", new VariableValue("ep"))),
        List.of(new Directive("include", List.of(new Argument("if", new BooleanValue(true))))), List.of(field("name")));
  }

  private static Field parent(final Selection... selections) {
    return new Field(null, "root", null, null, List.of(selections));
  }

  @Test
  public void entersAndLeavesInChildOrder() {
    AstTraversal.visit(heroField(), recording());

    assertThat(events).containsExactly(//
        "enter Field:hero", //
        "enter Argument:episode", "enter Variable:ep", "leave Variable:ep", "leave Argument:episode", //
        "enter Directive:include", "enter Argument:if", "enter BOOLEAN_VALUE", "leave BOOLEAN_VALUE", "leave Argument:if",
        "leave Directive:include", //
        "enter Field:name", "leave Field:name", //
        "leave Field:hero");
  }

  @Test
  public void documentOrder() {
    AstTraversal.visit(AstFixtures.heroDocument(false), AstVisitor.simple(node -> events.add(label(node)), null));

    assertThat(events).containsExactly("DOCUMENT", "Operation:Hero", "VARIABLE_DEFINITION", "NamedType:Episode", "ENUM_VALUE",
        "Field:hero", "Argument:episode", "Variable:episode", "Field:name", "Spread:HeroDetails", "INLINE_FRAGMENT",
        "NamedType:Droid", "Field:primaryFunction", "Comment:main query", "Fragment:HeroDetails", "NamedType:Character",
        "Field:name", "Field:friends", "Argument:first", "INT_VALUE", "Field:name", "Comment:end");
  }

  private static Document twoFieldsDocument() {
    final Field first = new Field(null, "first", null, null, List.of(field("leaf")));
    final Field second = new Field(null, "second", null, null,
        List.of(new InlineFragment(new NamedType("User"), null, List.of(field("name")))));
    return new Document(List.of(new OperationDefinition(List.of(first, second))));
  }

  @Test
  public void schemaDocumentOrder() {
    AstTraversal.visit(AstFixtures.schemaDocument(true, true), recording());

    final List<String> entered = events.stream().filter(e -> e.startsWith("enter ")).map(e -> e.substring(6)).toList();
    assertThat(entered).containsExactly(//
        "DOCUMENT", //
        "SCHEMA_DEFINITION", "OPERATION_TYPE_DEFINITION:QUERY", "NamedType:Query", "Comment:query root", "OPERATION_TYPE_DEFINITION:MUTATION",
        "NamedType:Mutation", "Directive:meta", "Argument:tags", "LIST_VALUE", "STRING_VALUE", "BIG_INT_VALUE", "Comment:tags",
        "Comment:schema", "Comment:end of schema", //
        "SCALAR_TYPE_DEFINITION:Date", "Directive:format", "Argument:pattern", "STRING_VALUE", "Comment:iso", "Comment:dates", //
        "OBJECT_TYPE_DEFINITION:Query", "NamedType:Node", "FIELD_DEFINITION:hero", "NOT_NULL_TYPE", "LIST_TYPE", "NamedType:Character",
        "INPUT_VALUE_DEFINITION:episode", "NamedType:Episode", "ENUM_VALUE", "Comment:which episode", "INPUT_VALUE_DEFINITION:limit",
        "NOT_NULL_TYPE", "NamedType:Int", "INT_VALUE", "Directive:range", "Argument:max", "INT_VALUE", "Directive:deprecated",
        "Argument:reason", "STRING_VALUE", "Comment:hero field", "Directive:cached", "Argument:ttl", "OBJECT_VALUE", "OBJECT_FIELD:max",
        "INT_VALUE", "Comment:seconds", "OBJECT_FIELD:scale", "FLOAT_VALUE", "Comment:ttl", "Comment:root", "Comment:end of query", //
        "INTERFACE_TYPE_DEFINITION:Node", "FIELD_DEFINITION:id", "NOT_NULL_TYPE", "NamedType:ID", "Directive:key", "Comment:node",
        "Comment:end of node", //
        "UNION_TYPE_DEFINITION:SearchResult", "NamedType:Human", "NamedType:Droid", "Directive:search", "Comment:union", //
        "ENUM_TYPE_DEFINITION:Episode", "ENUM_VALUE_DEFINITION:NEWHOPE", "Directive:deprecated", "Comment:first",
        "ENUM_VALUE_DEFINITION:JEDI", "Comment:episodes", "Comment:end of episodes", //
        "INPUT_OBJECT_TYPE_DEFINITION:ReviewInput", "INPUT_VALUE_DEFINITION:stars", "NOT_NULL_TYPE", "NamedType:Int", "NULL_VALUE",
        "Comment:none", "INPUT_VALUE_DEFINITION:ratio", "NamedType:BigDecimal", "BIG_DECIMAL_VALUE", "INPUT_VALUE_DEFINITION:verified",
        "NamedType:Boolean", "BOOLEAN_VALUE", "Directive:input", "Comment:review", "Comment:end of review", //
        "TYPE_EXTENSION_DEFINITION", "OBJECT_TYPE_DEFINITION:Query", "FIELD_DEFINITION:count", "NamedType:Int", "Comment:extension", //
        "DIRECTIVE_DEFINITION:cached", "INPUT_VALUE_DEFINITION:ttl", "NamedType:TtlInput", "DIRECTIVE_LOCATION:FIELD_DEFINITION",
        "Comment:on fields", "DIRECTIVE_LOCATION:OBJECT", "Comment:caching", //
        "Comment:eof");

    // EVERY LEAVE CLOSES THE LAST ENTERED NODE
    final Deque<String> open = new ArrayDeque<>();
    for (String event : events) {
      if (event.startsWith("enter "))
        open.push(event.substring(6));
      else
        assertThat(event.substring(6)).isEqualTo(open.pop());
    }
    assertThat(open).isEmpty();

    final List<String> heroEvents = events.subList(events.indexOf("enter FIELD_DEFINITION:hero"),
        events.indexOf("leave FIELD_DEFINITION:hero") + 1);
    assertThat(heroEvents).containsExactly(//
        "enter FIELD_DEFINITION:hero", //
        "enter NOT_NULL_TYPE", "enter LIST_TYPE", "enter NamedType:Character", "leave NamedType:Character", "leave LIST_TYPE",
        "leave NOT_NULL_TYPE", //
        "enter INPUT_VALUE_DEFINITION:episode", "enter NamedType:Episode", "leave NamedType:Episode", "enter ENUM_VALUE", "leave ENUM_VALUE",
        "enter Comment:which episode", "leave Comment:which episode", "leave INPUT_VALUE_DEFINITION:episode", //
        "enter INPUT_VALUE_DEFINITION:limit", "enter NOT_NULL_TYPE", "enter NamedType:Int", "leave NamedType:Int", "leave NOT_NULL_TYPE",
        "enter INT_VALUE", "leave INT_VALUE", "enter Directive:range", "enter Argument:max", "enter INT_VALUE", "leave INT_VALUE",
        "leave Argument:max", "leave Directive:range", "leave INPUT_VALUE_DEFINITION:limit", //
        "enter Directive:deprecated", "enter Argument:reason", "enter STRING_VALUE", "leave STRING_VALUE", "leave Argument:reason",
        "leave Directive:deprecated", //
        "enter Comment:hero field", "leave Comment:hero field", //
        "leave FIELD_DEFINITION:hero");
  }

  @Test
  public void replacingCommentsRebuildsEveryAncestor() {
    final Document schema = AstFixtures.schemaDocument(false, true);

    // REPLACE EVERY COMMENT WITH AN EQUAL COPY: ALL THE ANCESTORS ARE REBUILT FROM THEIR CHILDREN
    final Document rebuilt = AstTraversal.visit(schema, AstVisitor.entering(node -> node instanceof Comment ?
        VisitorCommand.replace(new Comment(((Comment) node).getText())) :
        VisitorCommand.CONTINUE));

    assertThat(rebuilt).isNotSameAs(schema).isEqualTo(schema);
    for (int i = 0; i < schema.getDefinitions().size(); i++)
      assertThat(rebuilt.getDefinitions().get(i)).isNotSameAs(schema.getDefinitions().get(i)).isEqualTo(schema.getDefinitions().get(i));
    assertThat(rebuilt.getTrailingComments()).isEqualTo(schema.getTrailingComments());
  }

  @Test
  public void everyNodeIsEnteredAndLeftOnce() {
    AstTraversal.visit(twoFieldsDocument(), recording());

    assertThat(events).containsExactly("enter DOCUMENT", "enter Operation:null", //
        "enter Field:first", "enter Field:leaf", "leave Field:leaf", "leave Field:first", //
        "enter Field:second", "enter INLINE_FRAGMENT", "enter NamedType:User", "leave NamedType:User", "enter Field:name",
        "leave Field:name", "leave INLINE_FRAGMENT", "leave Field:second", //
        "leave Operation:null", "leave DOCUMENT");
  }

  @Test
  public void breakOnSecondFieldKeepsThePreviousEvents() {
    AstTraversal.visit(twoFieldsDocument(), recording());
    final List<String> complete = new ArrayList<>(events);
    events.clear();

    AstTraversal.visit(twoFieldsDocument(), new AstVisitor() {
      @Override
      public VisitorCommand onEnter(final AstNode node) {
        events.add("enter " + label(node));
        return label(node).equals("Field:second") ? VisitorCommand.BREAK : VisitorCommand.CONTINUE;
      }

      @Override
      public VisitorCommand onLeave(final AstNode node) {
        events.add("leave " + label(node));
        return VisitorCommand.CONTINUE;
      }
    });

    final int breakAt = complete.indexOf("enter Field:second");
    assertThat(events).isEqualTo(complete.subList(0, breakAt + 1));
  }

  @Test
  public void noEditsReturnsTheSameTree() {
    final Document document = AstFixtures.heroDocument(true);

    assertThat(AstTraversal.visit(document, new AstVisitor() {
    })).isSameAs(document);
  }

  @Test
  public void replaceKeepsUntouchedSubtrees() {
    final Document document = AstFixtures.heroDocument(true);

    final Document renamed = AstTraversal.visit(document,
        AstVisitor.entering(node -> node instanceof VariableValue ? VisitorCommand.replace(new VariableValue("ep")) : VisitorCommand.CONTINUE));

    assertThat(renamed).isNotSameAs(document);
    assertThat(renamed.getSourceMapper()).isSameAs(document.getSourceMapper());
    assertThat(renamed.getPosition()).isEqualTo(document.getPosition());

    final OperationDefinition before = (OperationDefinition) document.getDefinitions().get(0);
    final OperationDefinition after = (OperationDefinition) renamed.getDefinitions().get(0);
    final Field hero = (Field) after.getSelections().get(0);

    assertThat(hero.getArguments().get(0).getValue()).isEqualTo(new VariableValue("ep"));
    assertThat(hero.getPosition()).isEqualTo(before.getSelections().get(0).getPosition());
    assertThat(hero.getSelections()).containsExactlyElementsOf(((Field) before.getSelections().get(0)).getSelections());
    assertThat(hero.getSelections().get(2)).isSameAs(((Field) before.getSelections().get(0)).getSelections().get(2));
    assertThat(after.getVariables().get(0)).isSameAs(before.getVariables().get(0));
    assertThat(after.getComments()).isEqualTo(before.getComments());
    assertThat(renamed.getDefinitions().get(1)).isSameAs(document.getDefinitions().get(1));
    assertThat(renamed.getTrailingComments()).isEqualTo(document.getTrailingComments());
  }

  @Test
  public void replaceOnEnterVisitsTheReplacementChildren() {
    final Field replacement = new Field(null, "renamed", List.of(new Argument("x", new IntValue(1))), null, null);

    final Field result = AstTraversal.visit(parent(field("name"), field("id")), new AstVisitor() {
      @Override
      public VisitorCommand onEnter(final AstNode node) {
        events.add("enter " + label(node));
        return node instanceof Field && ((Field) node).getName().equals("name") ? VisitorCommand.replace(replacement) : VisitorCommand.CONTINUE;
      }

      @Override
      public VisitorCommand onLeave(final AstNode node) {
        events.add("leave " + label(node));
        return VisitorCommand.CONTINUE;
      }
    });

    assertThat(events).containsExactly("enter Field:root", "enter Field:name", "enter Argument:x", "enter INT_VALUE", "leave INT_VALUE",
        "leave Argument:x", "leave Field:renamed", "enter Field:id", "leave Field:id", "leave Field:root");
    assertThat(result.getSelections().get(0)).isSameAs(replacement);
    assertThat(((Field) result.getSelections().get(1)).getName()).isEqualTo("id");
  }

  @Test
  public void leaveReceivesTheRewrittenChildren() {
    final List<List<String>> seen = new ArrayList<>();

    AstTraversal.visit(parent(field("a"), field("b")), new AstVisitor() {
      @Override
      public VisitorCommand onEnter(final AstNode node) {
        return node instanceof Field && ((Field) node).getName().equals("a") ? VisitorCommand.DELETE : VisitorCommand.CONTINUE;
      }

      @Override
      public VisitorCommand onLeave(final AstNode node) {
        if (node instanceof Field && ((Field) node).getName().equals("root")) {
          final List<String> names = new ArrayList<>();
          for (final Selection selection : ((Field) node).getSelections())
            names.add(((Field) selection).getName());
          seen.add(names);
        }
        return VisitorCommand.CONTINUE;
      }
    });

    assertThat(seen).containsExactly(List.of("b"));
  }

  @Test
  public void replaceOnLeave() {
    final Field result = AstTraversal.visit(parent(field("a"), field("b")), new AstVisitor() {
      @Override
      public VisitorCommand onLeave(final AstNode node) {
        if (node instanceof Field && ((Field) node).getName().equals("b"))
          return VisitorCommand.replace(new FragmentSpread("B", null));
        return VisitorCommand.CONTINUE;
      }
    });

    assertThat(result.getSelections()).hasSize(2);
    assertThat(result.getSelections().get(1)).isEqualTo(new FragmentSpread("B", null));
  }

  @Test
  public void deleteOnEnterDoesNotLeave() {
    final Field skipped = new Field(null, "a", null, List.of(new Directive("skip", List.of(new Argument("if", new BooleanValue(true))))),
        null);
    final Field kept = field("b");

    final Field result = AstTraversal.visit(parent(skipped, kept), new AstVisitor() {
      @Override
      public VisitorCommand onEnter(final AstNode node) {
        events.add("enter " + label(node));
        return node instanceof Directive ? VisitorCommand.DELETE : VisitorCommand.CONTINUE;
      }

      @Override
      public VisitorCommand onLeave(final AstNode node) {
        events.add("leave " + label(node));
        return VisitorCommand.CONTINUE;
      }
    });

    assertThat(events).containsExactly("enter Field:root", "enter Field:a", "enter Directive:skip", "leave Field:a", "enter Field:b",
        "leave Field:b", "leave Field:root");
    assertThat(result.getSelections().get(0).getDirectives()).isEmpty();
    assertThat(result.getSelections().get(1)).isSameAs(kept);
  }

  @Test
  public void deleteOptionalChild() {
    final VariableDefinition definition = new VariableDefinition("limit", new NamedType("Int"), new IntValue(10));

    final VariableDefinition result = AstTraversal.visit(definition,
        AstVisitor.entering(node -> node instanceof IntValue ? VisitorCommand.DELETE : VisitorCommand.CONTINUE));

    assertThat(result.getDefaultValue()).isNull();
    assertThat(result.getType()).isSameAs(definition.getType());
  }

  @Test
  public void deleteRequiredChildIsRejected() {
    final Argument argument = new Argument("x", new IntValue(1));

    assertThatThrownBy(() -> AstTraversal.visit(argument,
        AstVisitor.entering(node -> node instanceof IntValue ? VisitorCommand.DELETE : VisitorCommand.CONTINUE)))
        .isInstanceOf(QueryTreeException.class)
        .satisfies(e -> {
          assertThat(((QueryTreeException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_AST_EDIT);
          assertThat(((QueryTreeException) e).getContext()).containsEntry("group", "value");
        });

    final NotNullType type = new NotNullType(new NamedType("ID"));
    assertThatThrownBy(() -> AstTraversal.visit(type, AstVisitor.of(null,
        node -> node instanceof NamedType ? VisitorCommand.DELETE : VisitorCommand.CONTINUE)))
        .isInstanceOf(QueryTreeException.class)
        .satisfies(e -> assertThat(((QueryTreeException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_AST_EDIT));
  }

  @Test
  public void replacementMustFitTheSlot() {
    final Argument argument = new Argument("x", new IntValue(1));

    assertThatThrownBy(() -> AstTraversal.visit(argument,
        AstVisitor.entering(node -> node instanceof IntValue ? VisitorCommand.replace(field("x")) : VisitorCommand.CONTINUE)))
        .isInstanceOf(QueryTreeException.class)
        .satisfies(e -> assertThat(((QueryTreeException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_REPLACEMENT));

    final Argument replaced = AstTraversal.visit(argument,
        AstVisitor.entering(node -> node instanceof IntValue ? VisitorCommand.replace(new StringValue("1")) : VisitorCommand.CONTINUE));
    assertThat(replaced.getValue()).isEqualTo(new StringValue("1"));
  }

  @Test
  public void skipDoesNotVisitChildrenButLeaves() {
    final Field tree = parent(new Field(null, "a", null, null, List.of(field("inner"))), field("b"));

    final Field result = AstTraversal.visit(tree, new AstVisitor() {
      @Override
      public VisitorCommand onEnter(final AstNode node) {
        events.add("enter " + label(node));
        return label(node).equals("Field:a") ? VisitorCommand.SKIP : VisitorCommand.CONTINUE;
      }

      @Override
      public VisitorCommand onLeave(final AstNode node) {
        events.add("leave " + label(node));
        return VisitorCommand.CONTINUE;
      }
    });

    assertThat(events).containsExactly("enter Field:root", "enter Field:a", "leave Field:a", "enter Field:b", "leave Field:b",
        "leave Field:root");
    assertThat(result).isSameAs(tree);
  }

  @Test
  public void breakOnEnterKeepsTheEditsDoneSoFar() {
    final Field b = field("b");
    final Field c = new Field(null, "c", null, null, List.of(field("c1")));
    final OperationDefinition operation = new OperationDefinition(List.of(field("a"), b, c));

    final OperationDefinition result = AstTraversal.visit(operation, AstVisitor.entering(node -> {
      events.add(label(node));
      if (label(node).equals("Field:a"))
        return VisitorCommand.replace(field("a2"));
      if (label(node).equals("Field:b"))
        return VisitorCommand.BREAK;
      return VisitorCommand.CONTINUE;
    }));

    assertThat(events).containsExactly("Operation:null", "Field:a", "Field:b");
    assertThat(result.getSelections()).hasSize(3);
    assertThat(result.getSelections().get(0)).isEqualTo(field("a2"));
    assertThat(result.getSelections().get(1)).isSameAs(b);
    assertThat(result.getSelections().get(2)).isSameAs(c);
  }

  @Test
  public void breakOnLeave() {
    final Field tree = parent(field("a"), field("b"));

    final Field result = AstTraversal.visit(tree, new AstVisitor() {
      @Override
      public VisitorCommand onEnter(final AstNode node) {
        events.add("enter " + label(node));
        return VisitorCommand.CONTINUE;
      }

      @Override
      public VisitorCommand onLeave(final AstNode node) {
        events.add("leave " + label(node));
        return VisitorCommand.BREAK;
      }
    });

    assertThat(events).containsExactly("enter Field:root", "enter Field:a", "leave Field:a");
    assertThat(result).isSameAs(tree);
  }

  @Test
  public void breakOnRootEnter() {
    final Field tree = parent(field("a"));

    assertThat(AstTraversal.visit(tree, AstVisitor.entering(node -> VisitorCommand.BREAK))).isSameAs(tree);
  }

  @Test
  public void rootCommands() {
    final Field tree = parent(field("a"));

    assertThat(AstTraversal.visit(tree, AstVisitor.entering(node -> VisitorCommand.DELETE))).isNull();
    assertThat(AstTraversal.visit(tree, AstVisitor.of(null, node -> label(node).equals("Field:root") ? VisitorCommand.DELETE :
        VisitorCommand.CONTINUE))).isNull();

    final AstNode replaced = AstTraversal.visit((AstNode) tree,
        AstVisitor.of(null, node -> label(node).equals("Field:root") ? VisitorCommand.replace(new FragmentSpread("F", null)) :
            VisitorCommand.CONTINUE));
    assertThat(replaced).isEqualTo(new FragmentSpread("F", null));

    AstTraversal.visit(tree, new AstVisitor() {
      @Override
      public VisitorCommand onEnter(final AstNode node) {
        events.add("enter " + label(node));
        return VisitorCommand.SKIP;
      }

      @Override
      public VisitorCommand onLeave(final AstNode node) {
        events.add("leave " + label(node));
        return VisitorCommand.CONTINUE;
      }
    });
    assertThat(events).containsExactly("enter Field:root", "leave Field:root");
  }

  @Test
  public void deepTreeDoesNotOverflowTheStack() {
    GlobalConfiguration.TRAVERSAL_INITIAL_STACK_SIZE.setValue(4);

    final int depth = 100_000;
    Value value = new IntValue(0);
    for (int i = 0; i < depth; i++)
      value = new ListValue(List.of(value));

    final int[] entered = new int[1];
    final Value result = AstTraversal.visit(value, AstVisitor.entering(node -> {
      ++entered[0];
      return node instanceof IntValue ? VisitorCommand.replace(new IntValue(42)) : VisitorCommand.CONTINUE;
    }));

    assertThat(entered[0]).isEqualTo(depth + 1);

    Value current = result;
    int levels = 0;
    while (current instanceof ListValue) {
      current = ((ListValue) current).getValues().get(0);
      ++levels;
    }
    assertThat(levels).isEqualTo(depth);
    assertThat(((IntValue) current).getValue()).isEqualTo(42);
  }

  @Test
  public void breakInDeepTreeWithDebugLogging() {
    final List<String> messages = new ArrayList<>();
    LogManager.instance().setLogger(new Logger() {
      @Override
      public void log(final Object requester, final Level level, final String message, final Throwable exception, final String context,
          final Object... args) {
        messages.add(String.format(message, args));
      }

      @Override
      public void flush() {
      }
    });

    try {
      Value value = new IntValue(0);
      for (int i = 0; i < 100_000; i++)
        value = new ListValue(List.of(value));
      final Value root = value;

      // INTERRUPT ON THE FIRST CHILD, WHOSE SUBTREE IS ALMOST AS DEEP AS THE WHOLE TREE
      final Value result = AstTraversal.visit(root,
          AstVisitor.entering(node -> node != root ? VisitorCommand.BREAK : VisitorCommand.CONTINUE));

      assertThat(result).isSameAs(root);
      assertThat(messages).anyMatch(m -> m.startsWith("Traversal interrupted at LIST_VALUE"));
    } finally {
      LogManager.instance().setLogger(new DefaultLogger());
    }
  }
}

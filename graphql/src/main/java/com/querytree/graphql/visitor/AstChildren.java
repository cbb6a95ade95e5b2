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

import com.querytree.graphql.ast.*;

import java.util.List;

import static com.querytree.graphql.visitor.ChildGroup.many;
import static com.querytree.graphql.visitor.ChildGroup.optional;
import static com.querytree.graphql.visitor.ChildGroup.required;

/**
 * Structural knowledge of the node kinds: which children a node has, in visiting order, and how to build a copy of
 * the node with different children. Both switches are exhaustive over {@link AstNodeKind}, so adding a kind without
 * handling it here does not compile.
 * <p>
 * The order of the groups is the order of the children in the source text, with the comments last.
 */
public final class AstChildren {
  private AstChildren() {
  }

  public static List<ChildGroup> childGroups(final AstNode node) {
    return switch (node.getKind()) {
      case DOCUMENT -> {
        final Document n = (Document) node;
        yield List.of(many("definitions", Definition.class, n.getDefinitions()),
            many("trailingComments", Comment.class, n.getTrailingComments()));
      }
      case OPERATION_DEFINITION -> {
        final OperationDefinition n = (OperationDefinition) node;
        yield List.of(many("variables", VariableDefinition.class, n.getVariables()), many("directives", Directive.class, n.getDirectives()),
            many("selections", Selection.class, n.getSelections()), many("comments", Comment.class, n.getComments()),
            many("trailingComments", Comment.class, n.getTrailingComments()));
      }
      case FRAGMENT_DEFINITION -> {
        final FragmentDefinition n = (FragmentDefinition) node;
        yield List.of(required("typeCondition", NamedType.class, n.getTypeCondition()), many("directives", Directive.class, n.getDirectives()),
            many("selections", Selection.class, n.getSelections()), many("comments", Comment.class, n.getComments()),
            many("trailingComments", Comment.class, n.getTrailingComments()));
      }
      case VARIABLE_DEFINITION -> {
        final VariableDefinition n = (VariableDefinition) node;
        yield List.of(required("type", Type.class, n.getType()), optional("defaultValue", Value.class, n.getDefaultValue()),
            many("comments", Comment.class, n.getComments()));
      }
      case NAMED_TYPE, COMMENT -> List.of();
      case LIST_TYPE -> List.of(required("ofType", Type.class, ((ListType) node).getOfType()));
      case NOT_NULL_TYPE -> List.of(required("ofType", Type.class, ((NotNullType) node).getOfType()));
      case FIELD -> {
        final Field n = (Field) node;
        yield List.of(many("arguments", Argument.class, n.getArguments()), many("directives", Directive.class, n.getDirectives()),
            many("selections", Selection.class, n.getSelections()), many("comments", Comment.class, n.getComments()),
            many("trailingComments", Comment.class, n.getTrailingComments()));
      }
      case FRAGMENT_SPREAD -> {
        final FragmentSpread n = (FragmentSpread) node;
        yield List.of(many("directives", Directive.class, n.getDirectives()), many("comments", Comment.class, n.getComments()));
      }
      case INLINE_FRAGMENT -> {
        final InlineFragment n = (InlineFragment) node;
        yield List.of(optional("typeCondition", NamedType.class, n.getTypeCondition()), many("directives", Directive.class, n.getDirectives()),
            many("selections", Selection.class, n.getSelections()), many("comments", Comment.class, n.getComments()),
            many("trailingComments", Comment.class, n.getTrailingComments()));
      }
      case DIRECTIVE -> {
        final Directive n = (Directive) node;
        yield List.of(many("arguments", Argument.class, n.getArguments()), many("comments", Comment.class, n.getComments()));
      }
      case ARGUMENT -> {
        final Argument n = (Argument) node;
        yield List.of(required("value", Value.class, n.getValue()), many("comments", Comment.class, n.getComments()));
      }
      case OBJECT_FIELD -> {
        final ObjectField n = (ObjectField) node;
        yield List.of(required("value", Value.class, n.getValue()), many("comments", Comment.class, n.getComments()));
      }
      case INT_VALUE, BIG_INT_VALUE, FLOAT_VALUE, BIG_DECIMAL_VALUE, STRING_VALUE, BOOLEAN_VALUE, ENUM_VALUE, VARIABLE_VALUE, NULL_VALUE ->
          List.of(many("comments", Comment.class, ((Value) node).getComments()));
      case LIST_VALUE -> {
        final ListValue n = (ListValue) node;
        yield List.of(many("values", Value.class, n.getValues()), many("comments", Comment.class, n.getComments()));
      }
      case OBJECT_VALUE -> {
        final ObjectValue n = (ObjectValue) node;
        yield List.of(many("fields", ObjectField.class, n.getFields()), many("comments", Comment.class, n.getComments()));
      }
      case SCALAR_TYPE_DEFINITION -> {
        final ScalarTypeDefinition n = (ScalarTypeDefinition) node;
        yield List.of(many("directives", Directive.class, n.getDirectives()), many("comments", Comment.class, n.getComments()));
      }
      case FIELD_DEFINITION -> {
        final FieldDefinition n = (FieldDefinition) node;
        yield List.of(required("fieldType", Type.class, n.getFieldType()), many("arguments", InputValueDefinition.class, n.getArguments()),
            many("directives", Directive.class, n.getDirectives()), many("comments", Comment.class, n.getComments()));
      }
      case INPUT_VALUE_DEFINITION -> {
        final InputValueDefinition n = (InputValueDefinition) node;
        yield List.of(required("valueType", Type.class, n.getValueType()), optional("defaultValue", Value.class, n.getDefaultValue()),
            many("directives", Directive.class, n.getDirectives()), many("comments", Comment.class, n.getComments()));
      }
      case OBJECT_TYPE_DEFINITION -> {
        final ObjectTypeDefinition n = (ObjectTypeDefinition) node;
        yield List.of(many("interfaces", NamedType.class, n.getInterfaces()), many("fields", FieldDefinition.class, n.getFields()),
            many("directives", Directive.class, n.getDirectives()), many("comments", Comment.class, n.getComments()),
            many("trailingComments", Comment.class, n.getTrailingComments()));
      }
      case INTERFACE_TYPE_DEFINITION -> {
        final InterfaceTypeDefinition n = (InterfaceTypeDefinition) node;
        yield List.of(many("fields", FieldDefinition.class, n.getFields()), many("directives", Directive.class, n.getDirectives()),
            many("comments", Comment.class, n.getComments()), many("trailingComments", Comment.class, n.getTrailingComments()));
      }
      case UNION_TYPE_DEFINITION -> {
        final UnionTypeDefinition n = (UnionTypeDefinition) node;
        yield List.of(many("types", NamedType.class, n.getTypes()), many("directives", Directive.class, n.getDirectives()),
            many("comments", Comment.class, n.getComments()));
      }
      case ENUM_TYPE_DEFINITION -> {
        final EnumTypeDefinition n = (EnumTypeDefinition) node;
        yield List.of(many("values", EnumValueDefinition.class, n.getValues()), many("directives", Directive.class, n.getDirectives()),
            many("comments", Comment.class, n.getComments()), many("trailingComments", Comment.class, n.getTrailingComments()));
      }
      case ENUM_VALUE_DEFINITION -> {
        final EnumValueDefinition n = (EnumValueDefinition) node;
        yield List.of(many("directives", Directive.class, n.getDirectives()), many("comments", Comment.class, n.getComments()));
      }
      case INPUT_OBJECT_TYPE_DEFINITION -> {
        final InputObjectTypeDefinition n = (InputObjectTypeDefinition) node;
        yield List.of(many("fields", InputValueDefinition.class, n.getFields()), many("directives", Directive.class, n.getDirectives()),
            many("comments", Comment.class, n.getComments()), many("trailingComments", Comment.class, n.getTrailingComments()));
      }
      case TYPE_EXTENSION_DEFINITION -> {
        final TypeExtensionDefinition n = (TypeExtensionDefinition) node;
        yield List.of(required("definition", ObjectTypeDefinition.class, n.getDefinition()), many("comments", Comment.class, n.getComments()));
      }
      case DIRECTIVE_DEFINITION -> {
        final DirectiveDefinition n = (DirectiveDefinition) node;
        yield List.of(many("arguments", InputValueDefinition.class, n.getArguments()),
            many("locations", DirectiveLocation.class, n.getLocations()), many("comments", Comment.class, n.getComments()));
      }
      case DIRECTIVE_LOCATION -> List.of(many("comments", Comment.class, ((DirectiveLocation) node).getComments()));
      case SCHEMA_DEFINITION -> {
        final SchemaDefinition n = (SchemaDefinition) node;
        yield List.of(many("operationTypes", OperationTypeDefinition.class, n.getOperationTypes()),
            many("directives", Directive.class, n.getDirectives()), many("comments", Comment.class, n.getComments()),
            many("trailingComments", Comment.class, n.getTrailingComments()));
      }
      case OPERATION_TYPE_DEFINITION -> {
        final OperationTypeDefinition n = (OperationTypeDefinition) node;
        yield List.of(required("type", NamedType.class, n.getType()), many("comments", Comment.class, n.getComments()));
      }
    };
  }

  /**
   * Builds a copy of the node with the given children, one list per group returned by {@link #childGroups(AstNode)}
   * and in the same order. Scalar attributes, the position and, for documents, the source mapper are kept. Lists of
   * single valued groups must contain one node (required) or at most one node (optional).
   */
  public static AstNode rebuild(final AstNode node, final List<List<AstNode>> c) {
    return switch (node.getKind()) {
      case DOCUMENT -> {
        final Document n = (Document) node;
        yield new Document(cast(c.get(0)), cast(c.get(1)), n.getPosition(), n.getSourceMapper());
      }
      case OPERATION_DEFINITION -> {
        final OperationDefinition n = (OperationDefinition) node;
        yield new OperationDefinition(n.getOperationType(), n.getName(), cast(c.get(0)), cast(c.get(1)), cast(c.get(2)), cast(c.get(3)),
            cast(c.get(4)), n.getPosition());
      }
      case FRAGMENT_DEFINITION -> {
        final FragmentDefinition n = (FragmentDefinition) node;
        yield new FragmentDefinition(n.getName(), single(c.get(0)), cast(c.get(1)), cast(c.get(2)), cast(c.get(3)), cast(c.get(4)),
            n.getPosition());
      }
      case VARIABLE_DEFINITION -> {
        final VariableDefinition n = (VariableDefinition) node;
        yield new VariableDefinition(n.getName(), single(c.get(0)), single(c.get(1)), cast(c.get(2)), n.getPosition());
      }
      case NAMED_TYPE, COMMENT -> node;
      case LIST_TYPE -> new ListType(single(c.get(0)), node.getPosition());
      case NOT_NULL_TYPE -> new NotNullType(single(c.get(0)), node.getPosition());
      case FIELD -> {
        final Field n = (Field) node;
        yield new Field(n.getAlias(), n.getName(), cast(c.get(0)), cast(c.get(1)), cast(c.get(2)), cast(c.get(3)), cast(c.get(4)),
            n.getPosition());
      }
      case FRAGMENT_SPREAD -> new FragmentSpread(((FragmentSpread) node).getName(), cast(c.get(0)), cast(c.get(1)), node.getPosition());
      case INLINE_FRAGMENT -> new InlineFragment(single(c.get(0)), cast(c.get(1)), cast(c.get(2)), cast(c.get(3)), cast(c.get(4)),
          node.getPosition());
      case DIRECTIVE -> new Directive(((Directive) node).getName(), cast(c.get(0)), cast(c.get(1)), node.getPosition());
      case ARGUMENT -> new Argument(((Argument) node).getName(), single(c.get(0)), cast(c.get(1)), node.getPosition());
      case OBJECT_FIELD -> new ObjectField(((ObjectField) node).getName(), single(c.get(0)), cast(c.get(1)), node.getPosition());
      case INT_VALUE -> new IntValue(((IntValue) node).getValue(), cast(c.get(0)), node.getPosition());
      case BIG_INT_VALUE -> new BigIntValue(((BigIntValue) node).getValue(), cast(c.get(0)), node.getPosition());
      case FLOAT_VALUE -> new FloatValue(((FloatValue) node).getValue(), cast(c.get(0)), node.getPosition());
      case BIG_DECIMAL_VALUE -> new BigDecimalValue(((BigDecimalValue) node).getValue(), cast(c.get(0)), node.getPosition());
      case STRING_VALUE -> new StringValue(((StringValue) node).getValue(), cast(c.get(0)), node.getPosition());
      case BOOLEAN_VALUE -> new BooleanValue(((BooleanValue) node).getValue(), cast(c.get(0)), node.getPosition());
      case ENUM_VALUE -> new EnumValue(((EnumValue) node).getValue(), cast(c.get(0)), node.getPosition());
      case VARIABLE_VALUE -> new VariableValue(((VariableValue) node).getName(), cast(c.get(0)), node.getPosition());
      case NULL_VALUE -> new NullValue(cast(c.get(0)), node.getPosition());
      case LIST_VALUE -> new ListValue(cast(c.get(0)), cast(c.get(1)), node.getPosition());
      case OBJECT_VALUE -> new ObjectValue(cast(c.get(0)), cast(c.get(1)), node.getPosition());
      case SCALAR_TYPE_DEFINITION -> new ScalarTypeDefinition(((ScalarTypeDefinition) node).getName(), cast(c.get(0)), cast(c.get(1)),
          node.getPosition());
      case FIELD_DEFINITION -> new FieldDefinition(((FieldDefinition) node).getName(), single(c.get(0)), cast(c.get(1)), cast(c.get(2)),
          cast(c.get(3)), node.getPosition());
      case INPUT_VALUE_DEFINITION -> new InputValueDefinition(((InputValueDefinition) node).getName(), single(c.get(0)), single(c.get(1)),
          cast(c.get(2)), cast(c.get(3)), node.getPosition());
      case OBJECT_TYPE_DEFINITION -> new ObjectTypeDefinition(((ObjectTypeDefinition) node).getName(), cast(c.get(0)), cast(c.get(1)),
          cast(c.get(2)), cast(c.get(3)), cast(c.get(4)), node.getPosition());
      case INTERFACE_TYPE_DEFINITION -> new InterfaceTypeDefinition(((InterfaceTypeDefinition) node).getName(), cast(c.get(0)),
          cast(c.get(1)), cast(c.get(2)), cast(c.get(3)), node.getPosition());
      case UNION_TYPE_DEFINITION -> new UnionTypeDefinition(((UnionTypeDefinition) node).getName(), cast(c.get(0)), cast(c.get(1)),
          cast(c.get(2)), node.getPosition());
      case ENUM_TYPE_DEFINITION -> new EnumTypeDefinition(((EnumTypeDefinition) node).getName(), cast(c.get(0)), cast(c.get(1)),
          cast(c.get(2)), cast(c.get(3)), node.getPosition());
      case ENUM_VALUE_DEFINITION -> new EnumValueDefinition(((EnumValueDefinition) node).getName(), cast(c.get(0)), cast(c.get(1)),
          node.getPosition());
      case INPUT_OBJECT_TYPE_DEFINITION -> new InputObjectTypeDefinition(((InputObjectTypeDefinition) node).getName(), cast(c.get(0)),
          cast(c.get(1)), cast(c.get(2)), cast(c.get(3)), node.getPosition());
      case TYPE_EXTENSION_DEFINITION -> new TypeExtensionDefinition(single(c.get(0)), cast(c.get(1)), node.getPosition());
      case DIRECTIVE_DEFINITION -> new DirectiveDefinition(((DirectiveDefinition) node).getName(), cast(c.get(0)), cast(c.get(1)),
          cast(c.get(2)), node.getPosition());
      case DIRECTIVE_LOCATION -> new DirectiveLocation(((DirectiveLocation) node).getName(), cast(c.get(0)), node.getPosition());
      case SCHEMA_DEFINITION -> new SchemaDefinition(cast(c.get(0)), cast(c.get(1)), cast(c.get(2)), cast(c.get(3)), node.getPosition());
      case OPERATION_TYPE_DEFINITION -> new OperationTypeDefinition(((OperationTypeDefinition) node).getOperation(), single(c.get(0)),
          cast(c.get(1)), node.getPosition());
    };
  }

  @SuppressWarnings("unchecked")
  private static <T> List<T> cast(final List<AstNode> nodes) {
    return (List<T>) nodes;
  }

  @SuppressWarnings("unchecked")
  private static <T> T single(final List<AstNode> nodes) {
    return nodes.isEmpty() ? null : (T) nodes.get(0);
  }
}

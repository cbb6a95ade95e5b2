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
import com.querytree.graphql.ast.AstNode;
import com.querytree.log.LogManager;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * Depth-first traversal that can rewrite the tree. Every node is entered before its children and left after them,
 * children are visited in the order defined by {@link AstChildren}. The result is a new tree where the nodes touched
 * by a REPLACE or DELETE command, and their ancestors, are rebuilt; all the other subtrees are the original instances.
 * <p>
 * The pending nodes are kept in a stack on the heap, so the depth of the tree is bounded only by the memory.
 * <p>
 * Example, renaming all the variables:
 * <pre>
 * Document renamed = AstTraversal.visit(document, AstVisitor.entering(node -&gt; node instanceof VariableValue ?
 *     VisitorCommand.replace(new VariableValue("v_" + ((VariableValue) node).getName())) :
 *     VisitorCommand.CONTINUE));
 * </pre>
 */
public final class AstTraversal {
  private final AstVisitor   visitor;
  private final Deque<Frame> stack;

  private AstTraversal(final AstVisitor visitor) {
    this.visitor = visitor;
    this.stack = new ArrayDeque<>(Math.max(1, GlobalConfiguration.TRAVERSAL_INITIAL_STACK_SIZE.getValueAsInteger()));
  }

  /**
   * Visits the tree and returns the rewritten root: the same instance if nothing changed, null if the root has been
   * deleted. If the root is replaced with a node of an unrelated class the caller must receive the result as
   * {@link AstNode}.
   *
   * @throws QueryTreeException with {@link ErrorCode#INVALID_AST_EDIT} if a required child is deleted, with
   *                            {@link ErrorCode#INVALID_REPLACEMENT} if a replacement does not fit the parent
   */
  @SuppressWarnings("unchecked")
  public static <T extends AstNode> T visit(final T root, final AstVisitor visitor) {
    return (T) new AstTraversal(visitor).run(root);
  }

  /**
   * Visits the tree keeping the tracker in step: the tracker is notified before the visitor on enter and on leave. If
   * the visitor deletes a node on enter, the node is not left by the traversal, so the tracker is notified of the
   * leave right away.
   *
   * @param visitorFactory creates the visitor from the tracker, so the visitor can query it
   */
  public static <T extends AstNode, I extends TypeTracker> T visitWithTypeInfo(final T root, final I tracker,
      final Function<I, AstVisitor> visitorFactory) {
    return visit(root, new TrackingVisitor(tracker, visitorFactory.apply(tracker)));
  }

  /**
   * Like {@link #visitWithTypeInfo(AstNode, TypeTracker, Function)} for read and accumulate visitors: the rewritten
   * tree is discarded and the state object, once the traversal is completed, is returned.
   */
  public static <I extends TypeTracker, S> S visitWithState(final AstNode root, final I tracker, final S state,
      final BiFunction<I, S, AstVisitor> visitorFactory) {
    visit(root, new TrackingVisitor(tracker, visitorFactory.apply(tracker, state)));
    return state;
  }

  private AstNode run(final AstNode root) {
    final VisitorCommand rootCommand = visitor.onEnter(root);
    switch (rootCommand.getType()) {
    case BREAK:
      return root;
    case DELETE:
      return null;
    case SKIP:
      stack.push(new Frame(root, root, true));
      break;
    case REPLACE:
      stack.push(new Frame(root, rootCommand.getReplacement(), false));
      break;
    default:
      stack.push(new Frame(root, root, false));
    }

    while (true) {
      final Frame top = stack.peek();
      final AstNode child = top.nextChild();

      if (child != null) {
        final VisitorCommand command = visitor.onEnter(child);
        switch (command.getType()) {
        case CONTINUE:
          stack.push(new Frame(child, child, false));
          break;
        case SKIP:
          stack.push(new Frame(child, child, true));
          break;
        case REPLACE:
          stack.push(new Frame(child, checkReplacement(top, command.getReplacement()), false));
          break;
        case DELETE:
          checkDeletion(top);
          top.accept(child, null);
          break;
        case BREAK:
          top.accept(child, child);
          return abort(child);
        }
        continue;
      }

      // ALL THE CHILDREN ARE DONE: LEAVE THE NODE
      stack.pop();
      final AstNode built = top.build();
      final Frame parent = stack.peek();

      final VisitorCommand command = visitor.onLeave(built);
      final AstNode result = switch (command.getType()) {
        case REPLACE -> parent != null ? checkReplacement(parent, command.getReplacement()) : command.getReplacement();
        case DELETE -> {
          if (parent != null)
            checkDeletion(parent);
          yield null;
        }
        default -> built;
      };

      if (parent == null)
        return result;

      parent.accept(top.original, result);

      if (command.getType() == VisitorCommand.Type.BREAK)
        return abort(built);
    }
  }

  /**
   * Completes all the open frames without invoking the visitor. The children not visited yet are kept unchanged, the
   * edits done so far are applied.
   */
  private AstNode abort(final AstNode at) {
    if (LogManager.instance().isLoggable(this, Level.FINE))
      LogManager.instance().log(this, Level.FINE, "Traversal interrupted at %s (open frames=%d)", at.getKind(), stack.size());

    while (true) {
      final Frame frame = stack.pop();
      frame.keepRemaining();
      final AstNode built = frame.build();

      final Frame parent = stack.peek();
      if (parent == null)
        return built;
      parent.accept(frame.original, built);
    }
  }

  private static AstNode checkReplacement(final Frame parent, final AstNode replacement) {
    final ChildGroup group = parent.currentGroup();
    if (!group.getElementType().isInstance(replacement))
      throw new QueryTreeException(ErrorCode.INVALID_REPLACEMENT,
          String.format("Cannot use %s as '%s' of %s: expected %s", replacement.getKind(), group.getName(), parent.node.getKind(),
              group.getElementType().getSimpleName()),
          Map.of("parent", parent.node.getKind().name(), "group", group.getName(), "replacement", replacement.getKind().name()));
    return replacement;
  }

  private static void checkDeletion(final Frame parent) {
    final ChildGroup group = parent.currentGroup();
    if (group.getArity() == ChildGroup.Arity.REQUIRED)
      throw new QueryTreeException(ErrorCode.INVALID_AST_EDIT,
          String.format("Cannot delete '%s' of %s: the child is required", group.getName(), parent.node.getKind()),
          Map.of("parent", parent.node.getKind().name(), "group", group.getName()));
  }

  /**
   * A node whose children are being visited. {@code original} is the node as found in the parent, {@code node} is the
   * node actually visited, different when it has been replaced on enter.
   */
  private static final class Frame {
    private final AstNode             original;
    private final AstNode             node;
    private final boolean             skip;
    private final List<ChildGroup>    groups;
    private final List<List<AstNode>> results;
    private       int                 group;
    private       int                 index;
    private       boolean             changed;

    private Frame(final AstNode original, final AstNode node, final boolean skip) {
      this.original = original;
      this.node = node;
      this.skip = skip;
      if (skip) {
        this.groups = List.of();
        this.results = List.of();
      } else {
        this.groups = AstChildren.childGroups(node);
        this.results = new ArrayList<>(groups.size());
        for (final ChildGroup g : groups)
          results.add(new ArrayList<>(g.size()));
      }
    }

    /**
     * Returns the next child to visit without moving the cursor, or null if all the children have been visited.
     */
    private AstNode nextChild() {
      while (group < groups.size()) {
        final List<? extends AstNode> nodes = groups.get(group).getNodes();
        if (index < nodes.size())
          return nodes.get(index);
        ++group;
        index = 0;
      }
      return null;
    }

    private ChildGroup currentGroup() {
      return groups.get(group);
    }

    /**
     * Records the outcome for the child at the cursor and moves to the next one. A null result removes the child.
     */
    private void accept(final AstNode child, final AstNode result) {
      if (result != child)
        changed = true;
      if (result != null)
        results.get(group).add(result);
      ++index;
    }

    private void keepRemaining() {
      for (AstNode child = nextChild(); child != null; child = nextChild())
        accept(child, child);
    }

    private AstNode build() {
      if (skip || !changed)
        return node;
      return AstChildren.rebuild(node, results);
    }
  }

  private static final class TrackingVisitor implements AstVisitor {
    private final TypeTracker tracker;
    private final AstVisitor  delegate;

    private TrackingVisitor(final TypeTracker tracker, final AstVisitor delegate) {
      this.tracker = tracker;
      this.delegate = delegate;
    }

    @Override
    public VisitorCommand onEnter(final AstNode node) {
      tracker.enter(node);
      final VisitorCommand command = delegate.onEnter(node);
      if (command.getType() == VisitorCommand.Type.DELETE)
        tracker.leave(node);
      return command;
    }

    @Override
    public VisitorCommand onLeave(final AstNode node) {
      tracker.leave(node);
      return delegate.onLeave(node);
    }
  }
}

package com.aiadvent.mcp.workflowgraph.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Parser-neutral view of a concrete syntax tree node. Extraction code only talks to this
 * interface, so the tree-sitter binding can be swapped without touching the analysis.
 *
 * <p>Two instances are equal when they denote the same node of the same tree (same type and
 * byte span), regardless of which wrapper object was handed out.
 */
public interface SyntaxNode {

  String COMMENT = "comment";

  String type();

  String text();

  /** 1-based line of the first character. */
  int startLine();

  int startOffset();

  int endOffset();

  boolean isNamed();

  boolean hasError();

  Optional<SyntaxNode> parent();

  List<SyntaxNode> children();

  Optional<SyntaxNode> childForField(String fieldName);

  default List<SyntaxNode> namedChildren() {
    List<SyntaxNode> named = new ArrayList<>();
    for (SyntaxNode child : children()) {
      if (child.isNamed() && !COMMENT.equals(child.type())) {
        named.add(child);
      }
    }
    return named;
  }

  default Optional<SyntaxNode> namedChild(int index) {
    List<SyntaxNode> named = namedChildren();
    return index >= 0 && index < named.size() ? Optional.of(named.get(index)) : Optional.empty();
  }

  /** Pre-order search including this node. */
  default List<SyntaxNode> descendantsOfType(String type) {
    List<SyntaxNode> result = new ArrayList<>();
    Deque<SyntaxNode> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      SyntaxNode current = stack.pop();
      if (type.equals(current.type())) {
        result.add(current);
      }
      List<SyntaxNode> children = current.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return result;
  }

  default Optional<SyntaxNode> firstDescendantOfType(String type) {
    List<SyntaxNode> found = descendantsOfType(type);
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  default boolean contains(SyntaxNode other) {
    return other != null
        && startOffset() <= other.startOffset()
        && other.endOffset() <= endOffset();
  }

  default boolean isDescendantOf(SyntaxNode ancestor) {
    SyntaxNode current = this;
    while (current != null) {
      if (current.equals(ancestor)) {
        return true;
      }
      current = current.parent().orElse(null);
    }
    return false;
  }
}

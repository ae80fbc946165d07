package com.aiadvent.mcp.workflowgraph.ast;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.treesitter.TSNode;

/** {@link SyntaxNode} backed by a tree-sitter node. Children are materialised on first access. */
final class TreeSitterSyntaxNode implements SyntaxNode {

  private final TSNode node;
  private final byte[] source;
  private final String type;
  private final int startOffset;
  private final int endOffset;
  private TreeSitterSyntaxNode parent;
  private boolean parentResolved;
  private List<SyntaxNode> children;

  TreeSitterSyntaxNode(TSNode node, byte[] source, TreeSitterSyntaxNode parent) {
    this.node = node;
    this.source = source;
    this.type = node.getType();
    this.startOffset = node.getStartByte();
    this.endOffset = node.getEndByte();
    this.parent = parent;
    this.parentResolved = parent != null;
  }

  @Override
  public String type() {
    return type;
  }

  @Override
  public String text() {
    int start = Math.max(0, Math.min(startOffset, source.length));
    int end = Math.max(start, Math.min(endOffset, source.length));
    return new String(source, start, end - start, StandardCharsets.UTF_8);
  }

  @Override
  public int startLine() {
    return node.getStartPoint().getRow() + 1;
  }

  @Override
  public int startOffset() {
    return startOffset;
  }

  @Override
  public int endOffset() {
    return endOffset;
  }

  @Override
  public boolean isNamed() {
    return node.isNamed();
  }

  @Override
  public boolean hasError() {
    return node.hasError();
  }

  @Override
  public Optional<SyntaxNode> parent() {
    if (!parentResolved) {
      TSNode nativeParent = node.getParent();
      parent = isAbsent(nativeParent) ? null : new TreeSitterSyntaxNode(nativeParent, source, null);
      parentResolved = true;
    }
    return Optional.ofNullable(parent);
  }

  @Override
  public List<SyntaxNode> children() {
    if (children == null) {
      int count = node.getChildCount();
      List<SyntaxNode> result = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        TSNode child = node.getChild(i);
        if (!isAbsent(child)) {
          result.add(new TreeSitterSyntaxNode(child, source, this));
        }
      }
      children = List.copyOf(result);
    }
    return children;
  }

  @Override
  public Optional<SyntaxNode> childForField(String fieldName) {
    TSNode child = node.getChildByFieldName(fieldName);
    if (isAbsent(child)) {
      return Optional.empty();
    }
    return Optional.of(new TreeSitterSyntaxNode(child, source, this));
  }

  private static boolean isAbsent(TSNode candidate) {
    return candidate == null || candidate.isNull();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SyntaxNode that)) {
      return false;
    }
    return startOffset == that.startOffset()
        && endOffset == that.endOffset()
        && type.equals(that.type());
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, startOffset, endOffset);
  }

  @Override
  public String toString() {
    return type + "[" + startOffset + ".." + endOffset + "]";
  }
}

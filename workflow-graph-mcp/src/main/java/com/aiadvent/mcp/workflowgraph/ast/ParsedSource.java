package com.aiadvent.mcp.workflowgraph.ast;

import java.util.Objects;

/**
 * Result of one parse. Keeps a reference to the parser-specific tree so its native memory stays
 * reachable while the root node is in use.
 */
public final class ParsedSource {

  private final SyntaxNode root;
  private final Object tree;

  public ParsedSource(SyntaxNode root, Object tree) {
    this.root = Objects.requireNonNull(root, "root");
    this.tree = tree;
  }

  public SyntaxNode root() {
    return root;
  }

  public boolean hasError() {
    return root.hasError();
  }

  public boolean hasNativeTree() {
    return tree != null;
  }
}

package com.aiadvent.mcp.workflowgraph.ast;

import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * Parses TypeScript with tree-sitter. A native parser is not thread-safe, so every call gets its
 * own; the grammar itself is shared through {@link TreeSitterEngine}.
 */
@Component
public class TreeSitterSourceParser implements SourceParser {

  private final TreeSitterEngine engine;

  public TreeSitterSourceParser(TreeSitterEngine engine) {
    this.engine = engine;
  }

  @Override
  public ParsedSource parse(String source) {
    TSLanguage language = engine.language();
    String content = source != null ? source : "";
    TSTree tree;
    try {
      TSParser parser = new TSParser();
      parser.setLanguage(language);
      tree = parser.parseString(null, content);
    } catch (RuntimeException ex) {
      throw new SourceParseException("Tree-sitter failed to parse source: " + ex.getMessage(), ex);
    }
    if (tree == null) {
      throw new SourceParseException("Tree-sitter produced no tree");
    }
    TSNode root = tree.getRootNode();
    if (root == null || root.isNull()) {
      throw new SourceParseException("Tree-sitter produced an empty tree");
    }
    byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
    return new ParsedSource(new TreeSitterSyntaxNode(root, bytes, null), tree);
  }
}

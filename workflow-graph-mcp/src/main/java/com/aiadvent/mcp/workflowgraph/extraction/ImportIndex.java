package com.aiadvent.mcp.workflowgraph.extraction;

import com.aiadvent.mcp.workflowgraph.dag.NodeType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Locally bound identifier to the module path it was imported from. */
public final class ImportIndex {

  private static final String AGENTS_SEGMENT = "agents/";
  private static final String WORKFLOWS_SEGMENT = "workflows/";

  private final Map<String, String> sourcesByIdentifier;
  private final Set<String> engineModules;

  ImportIndex(Map<String, String> sourcesByIdentifier, List<String> engineModules) {
    this.sourcesByIdentifier = new LinkedHashMap<>(sourcesByIdentifier);
    this.engineModules = Set.copyOf(engineModules);
  }

  public Map<String, String> asMap() {
    return Map.copyOf(sourcesByIdentifier);
  }

  /**
   * Import path of a reference. {@code tools.fetch} falls back to the binding of {@code tools} when
   * the full text is not itself bound.
   */
  public Optional<String> importPath(String reference) {
    if (reference == null) {
      return Optional.empty();
    }
    String direct = sourcesByIdentifier.get(reference);
    if (direct != null) {
      return Optional.of(direct);
    }
    int dot = reference.indexOf('.');
    if (dot > 0) {
      return Optional.ofNullable(sourcesByIdentifier.get(reference.substring(0, dot)));
    }
    return Optional.empty();
  }

  public NodeType classify(String reference) {
    return importPath(reference).map(this::typeOf).orElse(NodeType.NODE);
  }

  NodeType typeOf(String importPath) {
    if (engineModules.contains(importPath)) {
      return NodeType.NODE;
    }
    if (importPath.contains(AGENTS_SEGMENT)) {
      return NodeType.AGENT;
    }
    if (importPath.contains(WORKFLOWS_SEGMENT)) {
      return NodeType.WORKFLOW;
    }
    return NodeType.NODE;
  }
}

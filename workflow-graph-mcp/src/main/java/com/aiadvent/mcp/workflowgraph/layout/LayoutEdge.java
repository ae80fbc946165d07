package com.aiadvent.mcp.workflowgraph.layout;

import com.aiadvent.mcp.workflowgraph.dag.DagEdge;

public record LayoutEdge(String source, String target) {

  public static LayoutEdge of(DagEdge edge) {
    return new LayoutEdge(edge.source(), edge.target());
  }
}

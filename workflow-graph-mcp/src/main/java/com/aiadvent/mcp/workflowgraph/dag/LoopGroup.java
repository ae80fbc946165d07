package com.aiadvent.mcp.workflowgraph.dag;

import java.util.List;

public record LoopGroup(String id, String label, List<String> nodeIds) {

  public LoopGroup {
    nodeIds = nodeIds != null ? List.copyOf(nodeIds) : List.of();
  }
}

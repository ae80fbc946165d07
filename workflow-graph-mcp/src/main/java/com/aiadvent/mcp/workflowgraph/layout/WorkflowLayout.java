package com.aiadvent.mcp.workflowgraph.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record WorkflowLayout(Map<String, Point> positions, List<GroupLayout> groups) {

  public WorkflowLayout {
    positions =
        positions != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(positions))
            : Map.of();
    groups = groups != null ? List.copyOf(groups) : List.of();
  }
}

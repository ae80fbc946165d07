package com.aiadvent.mcp.workflowgraph.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Container box of a loop group.
 *
 * @param position absolute top-left corner
 * @param childPositions member id to position relative to {@code position}
 */
public record GroupLayout(
    String id, Point position, int width, int height, Map<String, Point> childPositions) {

  public GroupLayout {
    childPositions =
        childPositions != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(childPositions))
            : Map.of();
  }
}

package com.aiadvent.mcp.workflowgraph.layout;

/** Top-left corner of a box, in layout units. */
public record Point(int x, int y) {

  public Point translate(int dx, int dy) {
    return new Point(x + dx, y + dy);
  }
}

package com.aiadvent.mcp.workflowgraph.dag;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeType {
  NODE("node"),
  AGENT("agent"),
  WORKFLOW("workflow"),
  INPUT("input"),
  OUTPUT("output"),
  CONDITION("condition");

  private final String value;

  NodeType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Executables are the units referenced from {@code ctx.run(...)}. */
  public boolean isExecutable() {
    return this == NODE || this == AGENT || this == WORKFLOW;
  }

  @JsonCreator
  public static NodeType fromValue(String raw) {
    if (raw == null) {
      return null;
    }
    for (NodeType type : values()) {
      if (type.value.equalsIgnoreCase(raw)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown node type: " + raw);
  }
}

package com.aiadvent.mcp.workflowgraph.dag;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DagEdge(String id, String source, String target, String label) {

  public static final String THEN = "then";
  public static final String ELSE = "else";
  public static final String YES = "yes";

  public DagEdge {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
  }

  public static DagEdge between(String source, String target) {
    return new DagEdge(source + "->" + target, source, target, null);
  }

  public static DagEdge labelled(String source, String target, String label) {
    return new DagEdge(source + "->" + target, source, target, label);
  }
}

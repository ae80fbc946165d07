package com.aiadvent.mcp.workflowgraph.dag;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DagNode(
    String id,
    String label,
    NodeType type,
    String executableName,
    String importPath,
    Integer lineNumber,
    List<String> fields,
    String description,
    List<String> integrations) {

  public static final String INPUT_ID = "input";
  public static final String OUTPUT_ID = "output";

  public DagNode {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    fields = fields == null || fields.isEmpty() ? null : List.copyOf(fields);
    integrations =
        integrations == null || integrations.isEmpty() ? null : List.copyOf(integrations);
  }

  public static DagNode input(List<String> fields) {
    return new DagNode(INPUT_ID, "Input", NodeType.INPUT, null, null, null, fields, null, null);
  }

  public static DagNode output(List<String> fields) {
    return new DagNode(OUTPUT_ID, "Output", NodeType.OUTPUT, null, null, null, fields, null, null);
  }

  public static DagNode condition(String id, String label, int lineNumber) {
    return new DagNode(id, label, NodeType.CONDITION, null, null, lineNumber, null, null, null);
  }

  public static DagNode step(
      String id,
      String label,
      NodeType type,
      String executableName,
      String importPath,
      int lineNumber) {
    return new DagNode(id, label, type, executableName, importPath, lineNumber, null, null, null);
  }

  public DagNode withMetadata(String description, List<String> integrations) {
    return new DagNode(
        id,
        label,
        type,
        executableName,
        importPath,
        lineNumber,
        fields,
        description != null ? description : this.description,
        integrations != null ? integrations : this.integrations);
  }
}

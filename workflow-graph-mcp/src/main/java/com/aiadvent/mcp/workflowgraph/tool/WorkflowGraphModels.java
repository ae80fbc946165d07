package com.aiadvent.mcp.workflowgraph.tool;

import com.aiadvent.mcp.workflowgraph.dag.WorkflowDag;
import com.aiadvent.mcp.workflowgraph.layout.GroupLayout;
import com.aiadvent.mcp.workflowgraph.layout.Point;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

public final class WorkflowGraphModels {

  private WorkflowGraphModels() {}

  public record ExtractRequest(String filePath, String source) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ExtractResponse(String filePath, List<WorkflowDag> workflows, String parseError) {}

  public record LayoutRequest(String filePath, String source) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record LayoutResponse(
      String filePath, List<LaidOutWorkflow> workflows, String parseError) {}

  public record LaidOutWorkflow(
      WorkflowDag workflow, Map<String, Point> positions, List<GroupLayout> groups) {}

  public record ExecutableMetadataRequest(String source) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ExecutableMetadataResponse(
      String name, String description, List<String> integrations, String parseError) {}

  public record ExtractFileRequest(String projectRoot, String filePath) {}
}

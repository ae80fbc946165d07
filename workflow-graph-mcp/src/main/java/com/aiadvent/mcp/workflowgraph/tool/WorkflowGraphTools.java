package com.aiadvent.mcp.workflowgraph.tool;

import com.aiadvent.mcp.workflowgraph.ast.SourceParseException;
import com.aiadvent.mcp.workflowgraph.extraction.ExecutableMetadataExtractor.ExecutableMetadata;
import com.aiadvent.mcp.workflowgraph.service.WorkflowGraphService;
import com.aiadvent.mcp.workflowgraph.tool.WorkflowGraphModels.ExecutableMetadataRequest;
import com.aiadvent.mcp.workflowgraph.tool.WorkflowGraphModels.ExecutableMetadataResponse;
import com.aiadvent.mcp.workflowgraph.tool.WorkflowGraphModels.ExtractFileRequest;
import com.aiadvent.mcp.workflowgraph.tool.WorkflowGraphModels.ExtractRequest;
import com.aiadvent.mcp.workflowgraph.tool.WorkflowGraphModels.ExtractResponse;
import com.aiadvent.mcp.workflowgraph.tool.WorkflowGraphModels.LaidOutWorkflow;
import com.aiadvent.mcp.workflowgraph.tool.WorkflowGraphModels.LayoutRequest;
import com.aiadvent.mcp.workflowgraph.tool.WorkflowGraphModels.LayoutResponse;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class WorkflowGraphTools {

  private final WorkflowGraphService service;

  WorkflowGraphTools(WorkflowGraphService service) {
    this.service = service;
  }

  @Tool(
      name = "workflow_graph.extract",
      description =
          "Строит граф workflow (DAG) по исходному TypeScript-файлу с вызовами Workflow.create. "
              + "Обязательные поля: `filePath`, `source`. Ответ содержит узлы, рёбра и loopGroups; "
              + "при невозможности разбора заполняется `parseError`.")
  ExtractResponse extract(ExtractRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Request must not be null");
    }
    String filePath = requireFilePath(request.filePath());
    String source = requireSource(request.source());
    try {
      return new ExtractResponse(filePath, service.extract(filePath, source), null);
    } catch (SourceParseException ex) {
      return new ExtractResponse(filePath, List.of(), ex.getMessage());
    }
  }

  @Tool(
      name = "workflow_graph.layout",
      description =
          "Извлекает графы workflow и рассчитывает раскладку слева направо: координаты узлов "
              + "(`positions`) и рамки циклов (`groups`). Обязательные поля: `filePath`, `source`.")
  LayoutResponse layout(LayoutRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Request must not be null");
    }
    String filePath = requireFilePath(request.filePath());
    String source = requireSource(request.source());
    try {
      List<LaidOutWorkflow> workflows =
          service.render(filePath, source).stream()
              .map(
                  rendered ->
                      new LaidOutWorkflow(
                          rendered.workflow(),
                          rendered.layout().positions(),
                          rendered.layout().groups()))
              .toList();
      return new LayoutResponse(filePath, workflows, null);
    } catch (SourceParseException ex) {
      return new LayoutResponse(filePath, List.of(), ex.getMessage());
    }
  }

  @Tool(
      name = "workflow_graph.executable_metadata",
      description =
          "Читает name, description и integrations из конфигурации `.create({...})` "
              + "узла, агента или workflow. Обязательное поле: `source`.")
  ExecutableMetadataResponse executableMetadata(ExecutableMetadataRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Request must not be null");
    }
    String source = requireSource(request.source());
    try {
      ExecutableMetadata metadata =
          service
              .describe(source)
              .orElse(new ExecutableMetadata(null, null, null));
      return new ExecutableMetadataResponse(
          metadata.name(), metadata.description(), metadata.integrations(), null);
    } catch (SourceParseException ex) {
      return new ExecutableMetadataResponse(null, null, null, ex.getMessage());
    }
  }

  @Tool(
      name = "workflow_graph.extract_file",
      description =
          "Читает файл workflow внутри проекта и строит его граф, подставляя description и "
              + "integrations из импортированных узлов. Обязательные поля: `projectRoot`, "
              + "`filePath` (относительно projectRoot).")
  ExtractResponse extractFile(ExtractFileRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Request must not be null");
    }
    if (!StringUtils.hasText(request.projectRoot())) {
      throw new IllegalArgumentException("projectRoot must not be blank");
    }
    String filePath = requireFilePath(request.filePath());
    Path projectRoot;
    try {
      projectRoot = Path.of(request.projectRoot().trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("Invalid projectRoot: " + request.projectRoot(), ex);
    }
    try {
      return new ExtractResponse(filePath, service.extractFile(projectRoot, filePath), null);
    } catch (SourceParseException ex) {
      return new ExtractResponse(filePath, List.of(), ex.getMessage());
    }
  }

  private static String requireFilePath(String filePath) {
    if (!StringUtils.hasText(filePath)) {
      throw new IllegalArgumentException("filePath must not be blank");
    }
    return filePath.trim();
  }

  private static String requireSource(String source) {
    if (source == null) {
      throw new IllegalArgumentException("source must not be null");
    }
    return source;
  }
}

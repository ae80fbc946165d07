package com.aiadvent.mcp.workflowgraph.service;

import com.aiadvent.mcp.workflowgraph.ast.ParsedSource;
import com.aiadvent.mcp.workflowgraph.ast.SourceParseException;
import com.aiadvent.mcp.workflowgraph.ast.SourceParser;
import com.aiadvent.mcp.workflowgraph.ast.SourceParserUnavailableException;
import com.aiadvent.mcp.workflowgraph.ast.TreeSitterAnalyzer;
import com.aiadvent.mcp.workflowgraph.dag.WorkflowDag;
import com.aiadvent.mcp.workflowgraph.extraction.ExecutableMetadataExtractor;
import com.aiadvent.mcp.workflowgraph.extraction.ExecutableMetadataExtractor.ExecutableMetadata;
import com.aiadvent.mcp.workflowgraph.extraction.WorkflowDagExtractor;
import com.aiadvent.mcp.workflowgraph.extraction.WorkflowDagExtractor.ExtractionResult;
import com.aiadvent.mcp.workflowgraph.layout.LayoutEngine;
import com.aiadvent.mcp.workflowgraph.layout.WorkflowLayout;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point of the pipeline: parse, extract, optionally enrich and lay out. Grammar failures are
 * recorded against the analyzer's health and yield no workflows; a source the parser rejects
 * outright surfaces as {@link SourceParseException}.
 */
@Service
public class WorkflowGraphService {

  private static final Logger log = LoggerFactory.getLogger(WorkflowGraphService.class);

  private final TreeSitterAnalyzer analyzer;
  private final SourceParser sourceParser;
  private final WorkflowDagExtractor extractor;
  private final ExecutableMetadataExtractor metadataExtractor;
  private final ExecutableDescriptionResolver descriptionResolver;
  private final LayoutEngine layoutEngine;
  private final Timer extractTimer;
  private final Counter extractCounter;
  private final Counter extractFailureCounter;
  private final Counter degradedCounter;

  public WorkflowGraphService(
      TreeSitterAnalyzer analyzer,
      SourceParser sourceParser,
      WorkflowDagExtractor extractor,
      ExecutableMetadataExtractor metadataExtractor,
      ExecutableDescriptionResolver descriptionResolver,
      LayoutEngine layoutEngine,
      @Nullable MeterRegistry meterRegistry) {
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    this.sourceParser = Objects.requireNonNull(sourceParser, "sourceParser");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.metadataExtractor = Objects.requireNonNull(metadataExtractor, "metadataExtractor");
    this.descriptionResolver = Objects.requireNonNull(descriptionResolver, "descriptionResolver");
    this.layoutEngine = Objects.requireNonNull(layoutEngine, "layoutEngine");
    MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.extractTimer = registry.timer("workflow_graph_extract_duration");
    this.extractCounter = registry.counter("workflow_graph_extract_total");
    this.extractFailureCounter = registry.counter("workflow_graph_extract_failure_total");
    this.degradedCounter = registry.counter("workflow_graph_degraded_total");
  }

  public record RenderedWorkflow(WorkflowDag workflow, WorkflowLayout layout) {}

  /** Workflows declared in {@code source}; empty when the grammar is unavailable. */
  public List<WorkflowDag> extract(String filePath, String source) {
    if (!StringUtils.hasText(filePath)) {
      throw new IllegalArgumentException("filePath must not be blank");
    }
    extractCounter.increment();
    return parse(source)
        .map(parsed -> extractTimer.record(() -> extractParsed(filePath, parsed)))
        .orElse(List.of());
  }

  /**
   * Reads {@code relativePath} under {@code projectRoot}, extracts its workflows and copies
   * descriptions from the imported executables onto their nodes.
   */
  public List<WorkflowDag> extractFile(Path projectRoot, String relativePath) {
    if (projectRoot == null) {
      throw new IllegalArgumentException("projectRoot must not be null");
    }
    Path root = projectRoot.toAbsolutePath().normalize();
    if (!Files.isDirectory(root)) {
      throw new IllegalArgumentException("projectRoot is not a directory: " + projectRoot);
    }
    Path file = resolveFile(root, relativePath);
    String source;
    try {
      source = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to read file: " + relativePath, ex);
    }
    String filePath = root.relativize(file).toString().replace('\\', '/');
    return extract(filePath, source).stream()
        .map(dag -> descriptionResolver.enrich(root, file, dag))
        .toList();
  }

  public List<RenderedWorkflow> render(String filePath, String source) {
    return extract(filePath, source).stream()
        .map(dag -> new RenderedWorkflow(dag, layoutEngine.layout(dag)))
        .toList();
  }

  public WorkflowLayout layout(WorkflowDag dag) {
    return layoutEngine.layout(dag);
  }

  /** Name, description and integrations declared by a node, agent or workflow source. */
  public Optional<ExecutableMetadata> describe(String source) {
    return parse(source).map(parsed -> metadataExtractor.extract(parsed.root()));
  }

  private Optional<ParsedSource> parse(String source) {
    if (!analyzer.ensureParserReady()) {
      extractFailureCounter.increment();
      log.warn("Tree-sitter parser is not available; skipping workflow extraction");
      return Optional.empty();
    }
    try {
      return Optional.of(sourceParser.parse(source));
    } catch (SourceParserUnavailableException ex) {
      extractFailureCounter.increment();
      log.warn("Tree-sitter grammar unavailable: {}", ex.getMessage());
      analyzer.handleFailure();
      return Optional.empty();
    } catch (SourceParseException ex) {
      extractFailureCounter.increment();
      throw ex;
    }
  }

  private List<WorkflowDag> extractParsed(String filePath, ParsedSource parsed) {
    ExtractionResult result = extractor.extract(filePath, parsed.root());
    if (result.degraded()) {
      degradedCounter.increment();
    }
    if (parsed.hasError()) {
      log.debug(
          "{} has syntax errors, extracted {} workflow(s)", filePath, result.workflows().size());
    }
    return result.workflows();
  }

  private Path resolveFile(Path root, String relativePath) {
    if (!StringUtils.hasText(relativePath)) {
      throw new IllegalArgumentException("filePath must not be blank");
    }
    Path target = root.resolve(relativePath.trim()).normalize();
    if (!target.startsWith(root)) {
      throw new IllegalArgumentException("filePath must be within projectRoot");
    }
    if (!Files.isRegularFile(target)) {
      throw new IllegalArgumentException("File does not exist: " + relativePath);
    }
    return target;
  }
}

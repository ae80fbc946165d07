package com.aiadvent.mcp.workflowgraph.service;

import com.aiadvent.mcp.workflowgraph.ast.ParsedSource;
import com.aiadvent.mcp.workflowgraph.ast.SourceParseException;
import com.aiadvent.mcp.workflowgraph.ast.SourceParser;
import com.aiadvent.mcp.workflowgraph.dag.DagNode;
import com.aiadvent.mcp.workflowgraph.dag.WorkflowDag;
import com.aiadvent.mcp.workflowgraph.extraction.ExecutableMetadataExtractor;
import com.aiadvent.mcp.workflowgraph.extraction.ExecutableMetadataExtractor.ExecutableMetadata;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Copies {@code description} and {@code integrations} from imported executable sources onto the
 * DAG nodes that reference them. Imports are resolved relative to the workflow file; compiled
 * {@code .js} specifiers map to their {@code .ts} source.
 */
@Component
public class ExecutableDescriptionResolver {

  private static final Logger log = LoggerFactory.getLogger(ExecutableDescriptionResolver.class);

  private final SourceParser sourceParser;
  private final ExecutableMetadataExtractor metadataExtractor;

  public ExecutableDescriptionResolver(
      SourceParser sourceParser, ExecutableMetadataExtractor metadataExtractor) {
    this.sourceParser = sourceParser;
    this.metadataExtractor = metadataExtractor;
  }

  public WorkflowDag enrich(Path projectRoot, Path workflowFile, WorkflowDag dag) {
    Path root = projectRoot.toAbsolutePath().normalize();
    Path directory = workflowFile.toAbsolutePath().normalize().getParent();
    if (directory == null) {
      return dag;
    }
    Map<Path, Optional<ExecutableMetadata>> cache = new HashMap<>();
    List<DagNode> nodes = new ArrayList<>(dag.nodes().size());
    boolean changed = false;
    for (DagNode node : dag.nodes()) {
      Optional<Path> source = resolveImport(root, directory, node.importPath());
      Optional<ExecutableMetadata> metadata =
          source.flatMap(path -> cache.computeIfAbsent(path, this::readMetadata));
      if (metadata.isPresent()) {
        nodes.add(node.withMetadata(metadata.get().description(), metadata.get().integrations()));
        changed = true;
      } else {
        nodes.add(node);
      }
    }
    return changed ? dag.withNodes(nodes) : dag;
  }

  Optional<Path> resolveImport(Path root, Path directory, String importPath) {
    if (importPath == null || !importPath.startsWith(".")) {
      return Optional.empty();
    }
    String specifier =
        importPath.endsWith(".js")
            ? importPath.substring(0, importPath.length() - ".js".length()) + ".ts"
            : importPath;
    Path candidate;
    try {
      candidate = directory.resolve(specifier).normalize();
    } catch (InvalidPathException ex) {
      log.debug("Skipping unresolvable import {}: {}", importPath, ex.getMessage());
      return Optional.empty();
    }
    if (!candidate.startsWith(root)) {
      log.debug("Skipping import {} outside project root", importPath);
      return Optional.empty();
    }
    if (!Files.isRegularFile(candidate)) {
      log.debug("Import {} does not resolve to a file ({})", importPath, candidate);
      return Optional.empty();
    }
    return Optional.of(candidate);
  }

  private Optional<ExecutableMetadata> readMetadata(Path file) {
    try {
      String content = Files.readString(file, StandardCharsets.UTF_8);
      ParsedSource parsed = sourceParser.parse(content);
      ExecutableMetadata metadata = metadataExtractor.extract(parsed.root());
      return metadata.isEmpty() ? Optional.empty() : Optional.of(metadata);
    } catch (IOException | SourceParseException ex) {
      log.debug("Unable to read executable metadata from {}: {}", file, ex.getMessage());
      return Optional.empty();
    }
  }
}

package com.aiadvent.mcp.workflowgraph.ast;

import com.aiadvent.mcp.workflowgraph.config.WorkflowGraphProperties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tracks health of the Tree-sitter grammar. Callers ask {@link #ensureParserReady()} before
 * extracting; when the grammar keeps failing the analyzer degrades and extraction is skipped
 * instead of retried on every file change.
 */
@Service
public class TreeSitterAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(TreeSitterAnalyzer.class);

  private final WorkflowGraphProperties properties;
  private final TreeSitterEngine engine;
  private final AtomicInteger consecutiveFailures = new AtomicInteger();
  private final AtomicBoolean degraded = new AtomicBoolean(false);

  public TreeSitterAnalyzer(WorkflowGraphProperties properties, TreeSitterEngine engine) {
    this.properties = properties;
    this.engine = engine;
  }

  public boolean isEnabled() {
    return properties.getParser().isEnabled() && !degraded.get();
  }

  public boolean ensureParserReady() {
    if (!isEnabled()) {
      return false;
    }
    try {
      engine.language();
      consecutiveFailures.set(0);
      return true;
    } catch (SourceParserUnavailableException ex) {
      log.warn("Tree-sitter load failure: {}", ex.getMessage());
      handleFailure();
      engine.reset();
    }
    return false;
  }

  public void handleFailure() {
    int failures = consecutiveFailures.incrementAndGet();
    int threshold = properties.getParser().getHealth().getFailureThreshold();
    log.warn(
        "Tree-sitter unavailable (failure {}/{}). Workflow graphs will not be extracted.",
        failures,
        threshold);
    if (failures >= threshold) {
      degraded.compareAndSet(false, true);
      log.error("Tree-sitter disabled after {} consecutive failures", failures);
    }
  }

  public void resetHealth() {
    consecutiveFailures.set(0);
    degraded.set(false);
    engine.reset();
  }
}

package com.aiadvent.mcp.workflowgraph.ast;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterTypescript;

/**
 * Loads the tree-sitter TypeScript grammar once. The first caller starts the load, every other
 * caller (concurrent or later) waits on the same future. A failed load stays memoised until
 * {@link #reset()} is called.
 */
@Component
public class TreeSitterEngine {

  private static final Logger log = LoggerFactory.getLogger(TreeSitterEngine.class);

  private final Supplier<TSLanguage> languageLoader;
  private final AtomicReference<CompletableFuture<TSLanguage>> ready = new AtomicReference<>();

  @Autowired
  public TreeSitterEngine() {
    this(TreeSitterEngine::loadTypescript);
  }

  public TreeSitterEngine(Supplier<TSLanguage> languageLoader) {
    this.languageLoader = Objects.requireNonNull(languageLoader, "languageLoader");
  }

  public TSLanguage language() {
    CompletableFuture<TSLanguage> future = ready.get();
    if (future == null) {
      CompletableFuture<TSLanguage> created = new CompletableFuture<>();
      if (ready.compareAndSet(null, created)) {
        load(created);
      }
      future = ready.get();
    }
    try {
      return future.join();
    } catch (CompletionException ex) {
      Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
      if (cause instanceof SourceParserUnavailableException unavailable) {
        throw unavailable;
      }
      throw new SourceParserUnavailableException(
          "Tree-sitter TypeScript grammar is unavailable: " + cause.getMessage(), cause);
    }
  }

  public boolean isLoaded() {
    CompletableFuture<TSLanguage> future = ready.get();
    return future != null && future.isDone() && !future.isCompletedExceptionally();
  }

  /** Forgets a failed load so the next call retries. A successful load is kept. */
  public void reset() {
    CompletableFuture<TSLanguage> future = ready.get();
    if (future != null && future.isCompletedExceptionally()) {
      ready.compareAndSet(future, null);
    }
  }

  private void load(CompletableFuture<TSLanguage> target) {
    try {
      TSLanguage language = languageLoader.get();
      log.info("Loaded Tree-sitter TypeScript grammar");
      target.complete(language);
    } catch (RuntimeException | LinkageError ex) {
      log.warn("Failed to load Tree-sitter TypeScript grammar: {}", ex.getMessage());
      target.completeExceptionally(ex);
    }
  }

  private static TSLanguage loadTypescript() {
    TSLanguage language = new TreeSitterTypescript();
    // binding the grammar to a parser forces the native runtime to load now, not on first parse
    new TSParser().setLanguage(language);
    return language;
  }
}

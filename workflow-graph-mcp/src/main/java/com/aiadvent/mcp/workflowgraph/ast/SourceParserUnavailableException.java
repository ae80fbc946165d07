package com.aiadvent.mcp.workflowgraph.ast;

/** The parsing engine itself could not be initialised on this host. */
public class SourceParserUnavailableException extends RuntimeException {

  public SourceParserUnavailableException(String message) {
    super(message);
  }

  public SourceParserUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}

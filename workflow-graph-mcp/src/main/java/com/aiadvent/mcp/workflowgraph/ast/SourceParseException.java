package com.aiadvent.mcp.workflowgraph.ast;

public class SourceParseException extends RuntimeException {

  public SourceParseException(String message) {
    super(message);
  }

  public SourceParseException(String message, Throwable cause) {
    super(message, cause);
  }
}

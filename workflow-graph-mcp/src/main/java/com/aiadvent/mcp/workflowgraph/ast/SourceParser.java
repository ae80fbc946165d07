package com.aiadvent.mcp.workflowgraph.ast;

/**
 * Turns source text into a syntax tree. Implementations must be safe to call from several threads
 * at once.
 *
 * @throws SourceParserUnavailableException when the underlying parsing engine cannot be loaded
 * @throws SourceParseException when no tree at all could be produced for the text
 */
public interface SourceParser {

  ParsedSource parse(String source);
}

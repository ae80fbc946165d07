package com.aiadvent.mcp.workflowgraph.extraction;

import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.IDENTIFIER;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.IMPORT_CLAUSE;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.IMPORT_SPECIFIER;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.IMPORT_STATEMENT;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.NAMESPACE_IMPORT;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.STRING;

import com.aiadvent.mcp.workflowgraph.ast.SyntaxNode;
import com.aiadvent.mcp.workflowgraph.config.WorkflowGraphProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Collects {@code import} bindings: named specifiers (by alias when present), default imports and
 * namespace imports.
 */
@Component
public class ImportResolver {

  private final WorkflowGraphProperties properties;

  public ImportResolver(WorkflowGraphProperties properties) {
    this.properties = properties;
  }

  public ImportIndex resolve(SyntaxNode root) {
    Map<String, String> bindings = new LinkedHashMap<>();
    for (SyntaxNode statement : root.descendantsOfType(IMPORT_STATEMENT)) {
      Optional<String> source = moduleSource(statement);
      if (source.isEmpty()) {
        continue;
      }
      for (SyntaxNode specifier : statement.descendantsOfType(IMPORT_SPECIFIER)) {
        Optional<SyntaxNode> local = specifier.childForField("alias");
        if (local.isEmpty()) {
          local = specifier.childForField("name");
        }
        local.ifPresent(identifier -> bindings.put(identifier.text(), source.get()));
      }
      for (SyntaxNode clause : statement.descendantsOfType(IMPORT_CLAUSE)) {
        for (SyntaxNode child : clause.namedChildren()) {
          if (IDENTIFIER.equals(child.type())) {
            bindings.put(child.text(), source.get());
          } else if (NAMESPACE_IMPORT.equals(child.type())) {
            child.firstDescendantOfType(IDENTIFIER)
                .ifPresent(identifier -> bindings.put(identifier.text(), source.get()));
          }
        }
      }
    }
    return new ImportIndex(bindings, properties.getExtraction().getEngineModules());
  }

  private Optional<String> moduleSource(SyntaxNode statement) {
    Optional<SyntaxNode> source = statement.childForField("source");
    if (source.isEmpty()) {
      source = statement.firstDescendantOfType(STRING);
    }
    return source.map(node -> TypeScriptNodes.stripQuotes(node.text()));
  }
}

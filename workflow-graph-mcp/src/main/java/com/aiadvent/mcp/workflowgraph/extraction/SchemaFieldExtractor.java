package com.aiadvent.mcp.workflowgraph.extraction;

import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.CALL_EXPRESSION;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.IDENTIFIER;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.VARIABLE_DECLARATOR;

import com.aiadvent.mcp.workflowgraph.ast.SyntaxNode;
import com.aiadvent.mcp.workflowgraph.config.WorkflowGraphProperties;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Reads the top-level field names of {@code z.object({...})} schemas. */
@Component
public class SchemaFieldExtractor {

  private static final String OBJECT_BUILDER_METHOD = "object";

  private final WorkflowGraphProperties properties;

  public SchemaFieldExtractor(WorkflowGraphProperties properties) {
    this.properties = properties;
  }

  /**
   * Fields of a schema passed as a create-config value: either a locally declared variable or an
   * inline builder call.
   */
  public List<String> fieldsOf(SyntaxNode root, SyntaxNode schemaValue) {
    if (schemaValue == null) {
      return List.of();
    }
    if (IDENTIFIER.equals(schemaValue.type())) {
      return fieldsOfVariable(root, schemaValue.text());
    }
    return objectSchemaArgument(schemaValue).map(TypeScriptNodes::propertyKeys).orElse(List.of());
  }

  public List<String> fieldsOfVariable(SyntaxNode root, String variableName) {
    for (SyntaxNode declarator : root.descendantsOfType(VARIABLE_DECLARATOR)) {
      Optional<SyntaxNode> name = declarator.childForField("name");
      if (name.isEmpty() || !variableName.equals(name.get().text())) {
        continue;
      }
      Optional<SyntaxNode> initializer = declarator.childForField("value");
      if (initializer.isEmpty()) {
        continue;
      }
      Optional<SyntaxNode> schema = objectSchemaArgument(initializer.get());
      if (schema.isPresent()) {
        return TypeScriptNodes.propertyKeys(schema.get());
      }
    }
    return List.of();
  }

  // the builder call may be wrapped, e.g. z.object({...}).strict()
  private Optional<SyntaxNode> objectSchemaArgument(SyntaxNode expression) {
    String builder = properties.getExtraction().getSchemaBuilder();
    for (SyntaxNode call : expression.descendantsOfType(CALL_EXPRESSION)) {
      boolean matches =
          TypeScriptNodes.memberCallee(call)
              .filter(callee -> builder.equals(callee.object()))
              .filter(callee -> OBJECT_BUILDER_METHOD.equals(callee.property()))
              .isPresent();
      if (matches) {
        return TypeScriptNodes.firstObjectArgument(call);
      }
    }
    return Optional.empty();
  }
}

package com.aiadvent.mcp.workflowgraph.extraction;

import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.CALL_EXPRESSION;

import com.aiadvent.mcp.workflowgraph.ast.SyntaxNode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Reads the declared name, description and integrations of a node, agent or workflow source file.
 * Any {@code <x>.create({...})} call qualifies; each attribute comes from the first config that
 * declares it.
 */
@Component
public class ExecutableMetadataExtractor {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ExecutableMetadata(String name, String description, List<String> integrations) {

    public ExecutableMetadata {
      integrations =
          integrations == null || integrations.isEmpty() ? null : List.copyOf(integrations);
    }

    @JsonIgnore
    public boolean isEmpty() {
      return name == null && description == null && integrations == null;
    }
  }

  public ExecutableMetadata extract(SyntaxNode root) {
    List<SyntaxNode> configs = createConfigs(root);
    String name = first(configs, config -> stringProperty(config, "name"));
    String description = first(configs, config -> stringProperty(config, "description"));
    List<String> integrations =
        first(
            configs,
            config ->
                TypeScriptNodes.propertyValue(config, "integrations")
                    .map(TypeScriptNodes::stringArray)
                    .filter(items -> !items.isEmpty()));
    return new ExecutableMetadata(name, description, integrations);
  }

  private static List<SyntaxNode> createConfigs(SyntaxNode root) {
    List<SyntaxNode> configs = new ArrayList<>();
    for (SyntaxNode call : root.descendantsOfType(CALL_EXPRESSION)) {
      boolean createCall =
          TypeScriptNodes.memberCallee(call)
              .filter(callee -> CreateCallInspector.CREATE_METHOD.equals(callee.property()))
              .isPresent();
      if (createCall) {
        TypeScriptNodes.firstObjectArgument(call).ifPresent(configs::add);
      }
    }
    return configs;
  }

  private static Optional<String> stringProperty(SyntaxNode config, String key) {
    return TypeScriptNodes.propertyValue(config, key)
        .flatMap(TypeScriptNodes::literalText)
        .filter(text -> !text.isEmpty());
  }

  private static <T> T first(List<SyntaxNode> configs, Function<SyntaxNode, Optional<T>> reader) {
    for (SyntaxNode config : configs) {
      Optional<T> value = reader.apply(config);
      if (value.isPresent()) {
        return value.get();
      }
    }
    return null;
  }
}

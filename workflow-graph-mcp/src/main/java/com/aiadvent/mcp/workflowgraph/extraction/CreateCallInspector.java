package com.aiadvent.mcp.workflowgraph.extraction;

import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.CALL_EXPRESSION;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.FORMAL_PARAMETERS;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.IDENTIFIER;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.METHOD_DEFINITION;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.OPTIONAL_PARAMETER;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.PAIR;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.REQUIRED_PARAMETER;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.STATEMENT_BLOCK;

import com.aiadvent.mcp.workflowgraph.ast.SyntaxNode;
import com.aiadvent.mcp.workflowgraph.config.WorkflowGraphProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Locates {@code Workflow.create({...})} calls and reads their configuration object. */
@Component
public class CreateCallInspector {

  static final String CREATE_METHOD = "create";
  static final String RUN_MEMBER = "run";

  private static final String DEFAULT_NAME = "unknown";
  private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*(\\d+)");
  private static final Set<String> RUN_FUNCTION_TYPES =
      Set.of("arrow_function", "function_expression", "function");

  private final WorkflowGraphProperties properties;

  public CreateCallInspector(WorkflowGraphProperties properties) {
    this.properties = properties;
  }

  public record RunMethod(SyntaxNode declaration, String contextName, Optional<SyntaxNode> body) {}

  public record WorkflowConfig(
      SyntaxNode createCall,
      String name,
      int version,
      String description,
      List<String> integrations,
      Optional<SyntaxNode> inputSchema,
      Optional<SyntaxNode> outputSchema,
      Optional<RunMethod> runMethod) {

    public WorkflowConfig {
      integrations = integrations != null ? List.copyOf(integrations) : List.of();
    }
  }

  /** Every {@code <factory>.create(...)} call of the file, in source order. */
  public List<SyntaxNode> findCreateCalls(SyntaxNode root) {
    String factory = properties.getExtraction().getFactoryIdentifier();
    List<SyntaxNode> result = new ArrayList<>();
    for (SyntaxNode call : root.descendantsOfType(CALL_EXPRESSION)) {
      boolean matches =
          TypeScriptNodes.memberCallee(call)
              .filter(callee -> factory.equals(callee.object()))
              .filter(callee -> CREATE_METHOD.equals(callee.property()))
              .isPresent();
      if (matches) {
        result.add(call);
      }
    }
    return result;
  }

  public WorkflowConfig inspect(SyntaxNode createCall) {
    Optional<SyntaxNode> config = TypeScriptNodes.firstObjectArgument(createCall);
    String name =
        config
            .flatMap(object -> TypeScriptNodes.propertyValue(object, "name"))
            .flatMap(TypeScriptNodes::literalText)
            .orElse(DEFAULT_NAME);
    int version =
        config
            .flatMap(object -> TypeScriptNodes.propertyValue(object, "version"))
            .map(value -> parseVersion(value.text()))
            .orElse(1);
    String description =
        config
            .flatMap(object -> TypeScriptNodes.propertyValue(object, "description"))
            .flatMap(TypeScriptNodes::literalText)
            .orElse(null);
    List<String> integrations =
        config
            .flatMap(object -> TypeScriptNodes.propertyValue(object, "integrations"))
            .map(TypeScriptNodes::stringArray)
            .orElse(List.of());
    return new WorkflowConfig(
        createCall,
        name,
        version,
        description,
        integrations,
        config.flatMap(object -> TypeScriptNodes.propertyValue(object, "inputSchema")),
        config.flatMap(object -> TypeScriptNodes.propertyValue(object, "outputSchema")),
        config.flatMap(this::findRunMethod));
  }

  Optional<RunMethod> findRunMethod(SyntaxNode config) {
    for (SyntaxNode member : config.namedChildren()) {
      if (METHOD_DEFINITION.equals(member.type())) {
        boolean named =
            member
                .childForField("name")
                .map(SyntaxNode::text)
                .filter(RUN_MEMBER::equals)
                .isPresent();
        if (named) {
          return Optional.of(toRunMethod(member));
        }
      } else if (PAIR.equals(member.type())) {
        boolean named =
            member
                .childForField("key")
                .map(key -> TypeScriptNodes.stripQuotes(key.text()))
                .filter(RUN_MEMBER::equals)
                .isPresent();
        if (!named) {
          continue;
        }
        Optional<SyntaxNode> function =
            member
                .childForField("value")
                .filter(value -> RUN_FUNCTION_TYPES.contains(value.type()));
        if (function.isPresent()) {
          return Optional.of(toRunMethod(function.get()));
        }
      }
    }
    return Optional.empty();
  }

  private RunMethod toRunMethod(SyntaxNode function) {
    Optional<SyntaxNode> body =
        function.childForField("body").filter(node -> STATEMENT_BLOCK.equals(node.type()));
    return new RunMethod(function, contextParameterName(function), body);
  }

  String contextParameterName(SyntaxNode function) {
    String fallback = properties.getExtraction().getDefaultContextName();
    Optional<SyntaxNode> single = function.childForField("parameter");
    if (single.isPresent() && IDENTIFIER.equals(single.get().type())) {
      return single.get().text();
    }
    Optional<SyntaxNode> parameters =
        function.childForField("parameters").filter(node -> FORMAL_PARAMETERS.equals(node.type()));
    Optional<SyntaxNode> first = parameters.flatMap(node -> node.namedChild(0));
    if (first.isEmpty()) {
      return fallback;
    }
    SyntaxNode parameter = first.get();
    String kind = parameter.type();
    if (REQUIRED_PARAMETER.equals(kind) || OPTIONAL_PARAMETER.equals(kind)) {
      return parameter
          .childForField("pattern")
          .filter(pattern -> IDENTIFIER.equals(pattern.type()))
          .map(SyntaxNode::text)
          .orElse(fallback);
    }
    if (IDENTIFIER.equals(kind)) {
      return parameter.text();
    }
    return fallback;
  }

  private static int parseVersion(String text) {
    Matcher matcher = LEADING_INTEGER.matcher(text);
    if (!matcher.find()) {
      return 1;
    }
    try {
      return Integer.parseInt(matcher.group(1));
    } catch (NumberFormatException ex) {
      return 1;
    }
  }
}

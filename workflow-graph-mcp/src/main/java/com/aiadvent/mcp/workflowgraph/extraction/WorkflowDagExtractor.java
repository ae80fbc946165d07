package com.aiadvent.mcp.workflowgraph.extraction;

import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.CALL_EXPRESSION;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.MEMBER_EXPRESSION;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.STRING;

import com.aiadvent.mcp.workflowgraph.ast.SyntaxNode;
import com.aiadvent.mcp.workflowgraph.config.WorkflowGraphProperties;
import com.aiadvent.mcp.workflowgraph.dag.WorkflowDag;
import com.aiadvent.mcp.workflowgraph.extraction.CreateCallInspector.RunMethod;
import com.aiadvent.mcp.workflowgraph.extraction.CreateCallInspector.WorkflowConfig;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.StepCall;
import com.aiadvent.mcp.workflowgraph.extraction.DagAssembler.WorkflowHeader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts one {@link WorkflowDag} per {@code Workflow.create(...)} declaration of a parsed file.
 * Broken files that still mention {@code Workflow.create} fall back to a linear chain over every
 * {@code x.run(ref)} call found.
 */
@Component
public class WorkflowDagExtractor {

  private static final Logger log = LoggerFactory.getLogger(WorkflowDagExtractor.class);

  static final String PARTIAL_NAME = "partial";
  private static final String NAME_KEY = "name";

  private final WorkflowGraphProperties properties;
  private final ImportResolver importResolver;
  private final CreateCallInspector createCallInspector;
  private final SchemaFieldExtractor schemaFieldExtractor;
  private final ControlFlowExtractor controlFlowExtractor;
  private final DagAssembler dagAssembler;

  public WorkflowDagExtractor(
      WorkflowGraphProperties properties,
      ImportResolver importResolver,
      CreateCallInspector createCallInspector,
      SchemaFieldExtractor schemaFieldExtractor,
      ControlFlowExtractor controlFlowExtractor,
      DagAssembler dagAssembler) {
    this.properties = properties;
    this.importResolver = importResolver;
    this.createCallInspector = createCallInspector;
    this.schemaFieldExtractor = schemaFieldExtractor;
    this.controlFlowExtractor = controlFlowExtractor;
    this.dagAssembler = dagAssembler;
  }

  public record ExtractionResult(List<WorkflowDag> workflows, boolean degraded) {

    public ExtractionResult {
      workflows = workflows != null ? List.copyOf(workflows) : List.of();
    }

    static ExtractionResult empty() {
      return new ExtractionResult(List.of(), false);
    }
  }

  public ExtractionResult extract(String filePath, SyntaxNode root) {
    ImportIndex imports = importResolver.resolve(root);
    List<SyntaxNode> createCalls = createCallInspector.findCreateCalls(root);
    if (createCalls.isEmpty()) {
      return extractDegraded(filePath, root, imports);
    }
    List<WorkflowDag> workflows = new ArrayList<>(createCalls.size());
    for (SyntaxNode createCall : createCalls) {
      workflows.add(extractWorkflow(filePath, root, createCall, imports));
    }
    return new ExtractionResult(workflows, false);
  }

  private WorkflowDag extractWorkflow(
      String filePath, SyntaxNode root, SyntaxNode createCall, ImportIndex imports) {
    WorkflowConfig config = createCallInspector.inspect(createCall);
    WorkflowHeader header =
        new WorkflowHeader(
            filePath,
            config.name(),
            config.version(),
            config
                .inputSchema()
                .map(value -> schemaFieldExtractor.fieldsOf(root, value))
                .orElse(null),
            config
                .outputSchema()
                .map(value -> schemaFieldExtractor.fieldsOf(root, value))
                .orElse(null));
    Optional<RunMethod> runMethod = config.runMethod();
    if (runMethod.isEmpty() || runMethod.get().body().isEmpty()) {
      log.debug("Workflow '{}' in {} has no run body", config.name(), filePath);
      return dagAssembler.degenerate(header);
    }
    RunMethod run = runMethod.get();
    ControlFlow flow = controlFlowExtractor.extract(run.body().get(), run.contextName());
    return dagAssembler.assemble(header, flow, imports);
  }

  private ExtractionResult extractDegraded(String filePath, SyntaxNode root, ImportIndex imports) {
    if (!mentionsFactoryCreate(root)) {
      return ExtractionResult.empty();
    }
    List<StepCall> calls = looseRunCalls(root);
    if (calls.isEmpty()) {
      return ExtractionResult.empty();
    }
    String name = firstNameLiteral(root).orElse(PARTIAL_NAME);
    log.debug("No complete workflow declaration in {}, using linear fallback '{}'", filePath, name);
    WorkflowHeader header = new WorkflowHeader(filePath, name, 1, null, null);
    return new ExtractionResult(List.of(dagAssembler.linear(header, calls, imports)), true);
  }

  private boolean mentionsFactoryCreate(SyntaxNode root) {
    String factory = properties.getExtraction().getFactoryIdentifier();
    return root.descendantsOfType(MEMBER_EXPRESSION).stream()
        .map(TypeScriptNodes::member)
        .flatMap(Optional::stream)
        .anyMatch(
            member ->
                factory.equals(member.object())
                    && CreateCallInspector.CREATE_METHOD.equals(member.property()));
  }

  private List<StepCall> looseRunCalls(SyntaxNode root) {
    String factory = properties.getExtraction().getFactoryIdentifier();
    String schemaBuilder = properties.getExtraction().getSchemaBuilder();
    List<StepCall> calls = new ArrayList<>();
    for (SyntaxNode call : root.descendantsOfType(CALL_EXPRESSION)) {
      boolean runCall =
          TypeScriptNodes.memberCallee(call)
              .filter(callee -> CreateCallInspector.RUN_MEMBER.equals(callee.property()))
              .filter(callee -> !factory.equals(callee.object()))
              .filter(callee -> !schemaBuilder.equals(callee.object()))
              .isPresent();
      if (!runCall) {
        continue;
      }
      TypeScriptNodes.firstArgument(call)
          .ifPresent(
              argument ->
                  calls.add(
                      new StepCall(
                          argument.text(),
                          call.startLine(),
                          call,
                          Optional.empty(),
                          List.of(),
                          false,
                          List.of())));
    }
    return calls;
  }

  // error recovery may leave the pair unwrapped, so only the sibling key is checked
  private static Optional<String> firstNameLiteral(SyntaxNode root) {
    for (SyntaxNode string : root.descendantsOfType(STRING)) {
      Optional<SyntaxNode> key = string.parent().flatMap(parent -> parent.namedChild(0));
      boolean nameValue =
          key.filter(node -> !node.equals(string))
              .filter(node -> NAME_KEY.equals(TypeScriptNodes.stripQuotes(node.text())))
              .isPresent();
      if (nameValue) {
        return Optional.of(TypeScriptNodes.stripQuotes(string.text()));
      }
    }
    return Optional.empty();
  }
}

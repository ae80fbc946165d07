package com.aiadvent.mcp.workflowgraph.extraction;

import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.CALL_EXPRESSION;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.DO_STATEMENT;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.FOR_IN_STATEMENT;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.IF_STATEMENT;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.LOOP_TYPES;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.RETURN_STATEMENT;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.STATEMENT_BLOCK;
import static com.aiadvent.mcp.workflowgraph.extraction.TypeScriptNodes.WHILE_STATEMENT;

import com.aiadvent.mcp.workflowgraph.ast.SyntaxNode;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.Arm;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.BranchScope;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.GuardClause;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.LoopScope;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.StepCall;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Walks a run body and classifies every {@code <ctx>.run(<ref>, ...)} call by the loop, branch and
 * guard structure around it.
 */
@Component
public class ControlFlowExtractor {

  private static final Pattern DECLARATION_KEYWORD = Pattern.compile("^(const|let|var)\\s+");
  private static final String RUN_METHOD = "run";

  public ControlFlow extract(SyntaxNode body, String contextName) {
    List<SyntaxNode> calls = trackedCalls(body, contextName);
    List<StepCall> steps = new ArrayList<>(calls.size());
    int previousEnd = body.startOffset();
    for (SyntaxNode call : calls) {
      String reference = TypeScriptNodes.firstArgument(call).map(SyntaxNode::text).orElseThrow();
      steps.add(
          new StepCall(
              reference,
              call.startLine(),
              call,
              enclosingLoop(call, body),
              branchChain(call, body),
              isFollowedByReturn(call, body),
              guardsBetween(body, calls, previousEnd, call.startOffset())));
      previousEnd = call.endOffset();
    }
    List<GuardClause> trailing = guardsBetween(body, calls, previousEnd, body.endOffset());
    return new ControlFlow(steps, trailing);
  }

  /** Calls on the context object with at least one argument, in source order. */
  List<SyntaxNode> trackedCalls(SyntaxNode body, String contextName) {
    List<SyntaxNode> result = new ArrayList<>();
    for (SyntaxNode call : body.descendantsOfType(CALL_EXPRESSION)) {
      boolean onContext =
          TypeScriptNodes.memberCallee(call)
              .filter(callee -> contextName.equals(callee.object()))
              .filter(callee -> RUN_METHOD.equals(callee.property()))
              .isPresent();
      if (onContext && TypeScriptNodes.firstArgument(call).isPresent()) {
        result.add(call);
      }
    }
    return result;
  }

  Optional<LoopScope> enclosingLoop(SyntaxNode call, SyntaxNode body) {
    Optional<SyntaxNode> current = call.parent();
    while (current.isPresent() && !current.get().equals(body)) {
      SyntaxNode node = current.get();
      if (LOOP_TYPES.contains(node.type())) {
        return Optional.of(new LoopScope(node, loopLabel(node)));
      }
      current = node.parent();
    }
    return Optional.empty();
  }

  static String loopLabel(SyntaxNode loop) {
    switch (loop.type()) {
      case FOR_IN_STATEMENT:
        return forEachLabel(loop);
      case WHILE_STATEMENT:
        return "while " + TypeScriptNodes.conditionText(loop);
      case DO_STATEMENT:
        return "do while " + TypeScriptNodes.conditionText(loop);
      default:
        return forHeaderCondition(loop).map(condition -> "for " + condition).orElse("for loop");
    }
  }

  private static String forEachLabel(SyntaxNode loop) {
    String variable =
        loop.childForField("left")
            .map(left -> DECLARATION_KEYWORD.matcher(left.text().trim()).replaceFirst(""))
            .orElse("item");
    String iterable = loop.childForField("right").map(SyntaxNode::text).orElse("items");
    return "for each " + variable + " " + iterationKeyword(loop) + " " + iterable;
  }

  private static String iterationKeyword(SyntaxNode loop) {
    Optional<String> operator = loop.childForField("operator").map(SyntaxNode::text);
    if (operator.isPresent()) {
      return operator.get();
    }
    for (SyntaxNode child : loop.children()) {
      if (!child.isNamed() && ("of".equals(child.text()) || "in".equals(child.text()))) {
        return child.text();
      }
    }
    return "of";
  }

  private static Optional<String> forHeaderCondition(SyntaxNode loop) {
    return loop.childForField("condition")
        .map(condition -> condition.text().trim())
        .map(text -> text.endsWith(";") ? text.substring(0, text.length() - 1).trim() : text)
        .filter(text -> !text.isEmpty());
  }

  /** Enclosing if statements whose consequence or alternative holds the call, outermost first. */
  List<BranchScope> branchChain(SyntaxNode call, SyntaxNode body) {
    List<BranchScope> chain = new ArrayList<>();
    Optional<SyntaxNode> current = call.parent();
    while (current.isPresent() && !current.get().equals(body)) {
      SyntaxNode node = current.get();
      if (IF_STATEMENT.equals(node.type())) {
        armOf(node, call)
            .ifPresent(
                arm ->
                    chain.add(
                        new BranchScope(
                            node, TypeScriptNodes.conditionText(node), arm, node.startLine())));
      }
      current = node.parent();
    }
    Collections.reverse(chain);
    return chain;
  }

  private static Optional<Arm> armOf(SyntaxNode ifStatement, SyntaxNode call) {
    boolean inConsequence =
        ifStatement.childForField("consequence").filter(arm -> arm.contains(call)).isPresent();
    if (inConsequence) {
      return Optional.of(Arm.THEN);
    }
    boolean inAlternative =
        ifStatement.childForField("alternative").filter(arm -> arm.contains(call)).isPresent();
    return inAlternative ? Optional.of(Arm.ELSE) : Optional.empty();
  }

  /** The statement holding the call is directly followed by a {@code return} in its block. */
  boolean isFollowedByReturn(SyntaxNode call, SyntaxNode body) {
    SyntaxNode statement = call;
    Optional<SyntaxNode> parent = statement.parent();
    while (parent.isPresent() && !STATEMENT_BLOCK.equals(parent.get().type())) {
      statement = parent.get();
      parent = statement.parent();
    }
    if (parent.isEmpty() || !body.contains(parent.get())) {
      return false;
    }
    List<SyntaxNode> siblings = parent.get().namedChildren();
    int index = siblings.indexOf(statement);
    return index >= 0
        && index < siblings.size() - 1
        && RETURN_STATEMENT.equals(siblings.get(index + 1).type());
  }

  /**
   * Top-level {@code if} statements of the body inside {@code [from, to]} whose consequence
   * unconditionally returns and which hold no tracked call.
   */
  List<GuardClause> guardsBetween(SyntaxNode body, List<SyntaxNode> calls, int from, int to) {
    List<GuardClause> guards = new ArrayList<>();
    for (SyntaxNode statement : body.namedChildren()) {
      if (!IF_STATEMENT.equals(statement.type())
          || statement.startOffset() < from
          || statement.endOffset() > to) {
        continue;
      }
      if (calls.stream().anyMatch(statement::contains)) {
        continue;
      }
      if (returnsUnconditionally(statement)) {
        String condition = TypeScriptNodes.conditionText(statement);
        guards.add(new GuardClause(condition, statement.startLine()));
      }
    }
    return guards;
  }

  private static boolean returnsUnconditionally(SyntaxNode ifStatement) {
    Optional<SyntaxNode> consequence = ifStatement.childForField("consequence");
    if (consequence.isEmpty()) {
      return false;
    }
    SyntaxNode arm = consequence.get();
    if (RETURN_STATEMENT.equals(arm.type())) {
      return true;
    }
    return STATEMENT_BLOCK.equals(arm.type())
        && arm.namedChildren().stream().anyMatch(child -> RETURN_STATEMENT.equals(child.type()));
  }
}

package com.aiadvent.mcp.workflowgraph.extraction;

import com.aiadvent.mcp.workflowgraph.ast.SyntaxNode;
import java.util.List;
import java.util.Optional;

/** Tracked {@code ctx.run(...)} calls of one run body with their structural context. */
public record ControlFlow(List<StepCall> steps, List<GuardClause> trailingGuards) {

  public ControlFlow {
    steps = steps != null ? List.copyOf(steps) : List.of();
    trailingGuards = trailingGuards != null ? List.copyOf(trailingGuards) : List.of();
  }

  public enum Arm {
    THEN,
    ELSE
  }

  /**
   * One tracked call.
   *
   * @param branches enclosing if statements, outermost first
   * @param guards guard clauses located between the previous tracked call and this one
   */
  public record StepCall(
      String reference,
      int line,
      SyntaxNode node,
      Optional<LoopScope> loop,
      List<BranchScope> branches,
      boolean earlyReturn,
      List<GuardClause> guards) {

    public StepCall {
      loop = loop != null ? loop : Optional.empty();
      branches = branches != null ? List.copyOf(branches) : List.of();
      guards = guards != null ? List.copyOf(guards) : List.of();
    }

    public Optional<BranchScope> innermostBranch() {
      return branches.isEmpty() ? Optional.empty() : Optional.of(branches.get(branches.size() - 1));
    }
  }

  public record LoopScope(SyntaxNode statement, String label) {}

  public record BranchScope(SyntaxNode statement, String condition, Arm arm, int line) {}

  public record GuardClause(String condition, int line) {}
}

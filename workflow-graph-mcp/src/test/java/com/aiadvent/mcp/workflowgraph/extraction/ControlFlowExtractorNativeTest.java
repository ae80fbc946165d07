package com.aiadvent.mcp.workflowgraph.extraction;

import static com.aiadvent.mcp.workflowgraph.WorkflowGraphTestSupport.parse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.aiadvent.mcp.workflowgraph.WorkflowGraphTestSupport;
import com.aiadvent.mcp.workflowgraph.ast.SyntaxNode;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.Arm;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.BranchScope;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.GuardClause;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.LoopScope;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.StepCall;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ControlFlowExtractorNativeTest {

  private final ControlFlowExtractor extractor = new ControlFlowExtractor();

  @BeforeEach
  void setUp() {
    assumeTrue(
        WorkflowGraphTestSupport.grammarAvailable(),
        "tree-sitter TypeScript grammar not available");
  }

  @Test
  void labelsEveryLoopKind() {
    ControlFlow flow =
        extract(
            """
            async function run(ctx) {
              for (let i = 0; i < pages; i++) { await ctx.run(a, i); }
              for (;;) { await ctx.run(b, {}); }
              for (const key in lookup) { await ctx.run(c, key); }
              do { await ctx.run(d, {}); } while (hasMore);
              while (queue.length > 0) { await ctx.run(e, queue.pop()); }
            }
            """);

    assertThat(flow.steps())
        .extracting(step -> step.loop().map(LoopScope::label).orElse(null))
        .containsExactly(
            "for i < pages",
            "for loop",
            "for each key in lookup",
            "do while hasMore",
            "while queue.length > 0");
  }

  @Test
  void innermostLoopOwnsTheCall() {
    ControlFlow flow =
        extract(
            """
            async function run(ctx) {
              for (const batch of batches) {
                for (const item of batch) {
                  await ctx.run(process, item);
                }
              }
            }
            """);

    assertThat(flow.steps().get(0).loop().map(LoopScope::label))
        .contains("for each item of batch");
  }

  @Test
  void recordsBranchArmsOutermostFirst() {
    ControlFlow flow =
        extract(
            """
            async function run(ctx) {
              if (a) {
                await ctx.run(first, {});
              } else if (b) {
                await ctx.run(second, {});
              } else {
                await ctx.run(third, {});
              }
            }
            """);

    assertThat(flow.steps().get(0).branches())
        .extracting(BranchScope::condition, BranchScope::arm, BranchScope::line)
        .containsExactly(tuple("a", Arm.THEN, 2));
    assertThat(flow.steps().get(1).branches())
        .extracting(BranchScope::condition, BranchScope::arm)
        .containsExactly(tuple("a", Arm.ELSE), tuple("b", Arm.THEN));
    assertThat(flow.steps().get(2).branches())
        .extracting(BranchScope::condition, BranchScope::arm)
        .containsExactly(tuple("a", Arm.ELSE), tuple("b", Arm.ELSE));
    assertThat(flow.steps().get(2).innermostBranch().map(BranchScope::condition)).contains("b");
  }

  @Test
  void detectsGuardsAndEarlyReturns() {
    ControlFlow flow =
        extract(
            """
            async function run(ctx, inputs) {
              if (!inputs.ok) {
                return null;
              }
              if (inputs.verbose) {
                console.log(inputs);
              }
              const lead = await ctx.run(lookup, inputs);
              if (lead.done) {
                const result = await ctx.run(finish, lead);
                return result;
              }
              if (lead.skip) return;
            }
            """);

    StepCall lookup = flow.steps().get(0);
    StepCall finish = flow.steps().get(1);
    assertThat(lookup.guards())
        .extracting(GuardClause::condition, GuardClause::line)
        .containsExactly(tuple("!inputs.ok", 2));
    assertThat(lookup.earlyReturn()).isFalse();
    assertThat(finish.earlyReturn()).isTrue();
    assertThat(finish.guards()).isEmpty();
    assertThat(flow.trailingGuards())
        .extracting(GuardClause::condition)
        .containsExactly("lead.skip");
  }

  @Test
  void tracksOnlyContextRunCalls() {
    ControlFlow flow =
        extract(
            """
            async function run(context) {
              await ctx.run(wrongContext, {});
              await context.execute(other, {});
              await context.run(tools.fetch, { url });
            }
            """,
            "context");

    assertThat(flow.steps())
        .extracting(StepCall::reference, StepCall::line, StepCall::loop)
        .containsExactly(tuple("tools.fetch", 4, Optional.empty()));
  }

  private ControlFlow extract(String source) {
    return extract(source, "ctx");
  }

  private ControlFlow extract(String source, String contextName) {
    SyntaxNode body = parse(source).firstDescendantOfType("statement_block").orElseThrow();
    return extractor.extract(body, contextName);
  }
}

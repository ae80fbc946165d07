package com.aiadvent.mcp.workflowgraph.extraction;

import static com.aiadvent.mcp.workflowgraph.WorkflowGraphTestSupport.fixture;
import static com.aiadvent.mcp.workflowgraph.WorkflowGraphTestSupport.parse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.aiadvent.mcp.workflowgraph.WorkflowGraphTestSupport;
import com.aiadvent.mcp.workflowgraph.config.WorkflowGraphProperties;
import com.aiadvent.mcp.workflowgraph.dag.DagEdge;
import com.aiadvent.mcp.workflowgraph.dag.DagNode;
import com.aiadvent.mcp.workflowgraph.dag.LoopGroup;
import com.aiadvent.mcp.workflowgraph.dag.NodeType;
import com.aiadvent.mcp.workflowgraph.dag.WorkflowDag;
import com.aiadvent.mcp.workflowgraph.extraction.WorkflowDagExtractor.ExtractionResult;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WorkflowDagExtractorNativeTest {

  private WorkflowGraphProperties properties;
  private WorkflowDagExtractor extractor;

  @BeforeEach
  void setUp() {
    assumeTrue(
        WorkflowGraphTestSupport.grammarAvailable(),
        "tree-sitter TypeScript grammar not available");
    properties = new WorkflowGraphProperties();
    extractor = WorkflowGraphTestSupport.pipeline(properties).extractor();
  }

  @Test
  void sequentialWorkflow() {
    WorkflowDag dag = single("src/workflows/lead-pipeline.ts", fixture("sequential.ts"));

    assertThat(dag.workflowName()).isEqualTo("lead-pipeline");
    assertThat(dag.version()).isEqualTo(2);
    assertThat(dag.filePath()).isEqualTo("src/workflows/lead-pipeline.ts");
    assertThat(dag.node("input").orElseThrow().fields()).containsExactly("domain", "limit");
    assertThat(dag.node("output").orElseThrow().fields()).containsExactly("leads", "total");
    assertThat(dag.nodes())
        .filteredOn(node -> node.type().isExecutable())
        .extracting(
            DagNode::id,
            DagNode::type,
            DagNode::executableName,
            DagNode::importPath,
            DagNode::lineNumber)
        .containsExactly(
            tuple("step-0", NodeType.NODE, "fetchLeads", "../nodes/fetch-leads.js", 19),
            tuple("step-1", NodeType.AGENT, "scorer", "../agents/scorer.js", 20),
            tuple(
                "step-2",
                NodeType.WORKFLOW,
                "enrichCompany",
                "../workflows/enrich-company.js",
                21));
    assertThat(dag.node("step-2").orElseThrow().label()).isEqualTo("Enrich Company");
    assertThat(edgePairs(dag))
        .containsExactly("input->step-0", "step-0->step-1", "step-1->step-2", "step-2->output");
    assertThat(dag.loopGroups()).isNull();
  }

  @Test
  void ifElseBranches() {
    WorkflowDag dag = single("triage.ts", fixture("branching.ts"));

    assertThat(dag.nodeIds())
        .containsExactly("input", "step-0", "condition-0", "step-1", "step-2", "step-3", "output");
    assertThat(dag.node("condition-0").orElseThrow())
        .extracting(DagNode::label, DagNode::lineNumber)
        .containsExactly("result.isHot", 11);
    assertThat(dag.edges())
        .extracting(DagEdge::source, DagEdge::target, DagEdge::label)
        .containsExactly(
            tuple("input", "step-0", null),
            tuple("step-0", "condition-0", null),
            tuple("condition-0", "step-1", "then"),
            tuple("condition-0", "step-2", "else"),
            tuple("step-1", "step-3", null),
            tuple("step-2", "step-3", null),
            tuple("step-3", "output", null));
  }

  @Test
  void guardClausesShortCircuit() {
    WorkflowDag dag = single("guarded.ts", fixture("guarded.ts"));

    assertThat(dag.nodeIds())
        .containsExactly("input", "condition-0", "step-0", "condition-1", "step-1", "output");
    assertThat(dag.nodes())
        .filteredOn(node -> node.type() == NodeType.CONDITION)
        .extracting(DagNode::label, DagNode::lineNumber)
        .containsExactly(tuple("!inputs.valid", 8), tuple("inputs.dryRun", 12));
    assertThat(dag.edges())
        .extracting(DagEdge::id, DagEdge::label)
        .containsExactly(
            tuple("input->condition-0", null),
            tuple("condition-0->output-guard", "yes"),
            tuple("condition-0->step-0", null),
            tuple("step-0->condition-1", null),
            tuple("condition-1->output-guard", "yes"),
            tuple("condition-1->step-1", null),
            tuple("step-1->output", null));
  }

  @Test
  void loopsProduceGroups() {
    WorkflowDag dag = single("crawler.ts", fixture("loops.ts"));

    assertThat(dag.loopGroups())
        .extracting(LoopGroup::id, LoopGroup::label, LoopGroup::nodeIds)
        .containsExactly(
            tuple("loop-0", "for each url of inputs.urls", List.of("step-0", "step-1")),
            tuple("loop-1", "while attempts < 3", List.of("step-2")));
    assertThat(edgePairs(dag))
        .containsExactly("input->step-0", "step-0->step-1", "step-1->step-2", "step-2->output");
  }

  @Test
  void earlyReturnConnectsStepToOutput() {
    WorkflowDag dag = single("upsert.ts", fixture("early-return.ts"));

    assertThat(edgePairs(dag))
        .containsExactly(
            "input->step-0",
            "step-0->condition-0",
            "condition-0->step-1",
            "step-1->output",
            "condition-0->step-2",
            "step-2->output");
  }

  @Test
  void nestedConditionsChain() {
    String source =
        """
        import { Workflow } from "0pflow";
        import { routeEu } from "../nodes/route-eu.js";

        export const route = Workflow.create({
          name: "route",
          async run(ctx, inputs) {
            if (inputs.premium) {
              if (inputs.region === "eu") {
                await ctx.run(routeEu, inputs);
              }
            }
          },
        });
        """;

    WorkflowDag dag = single("route.ts", source);

    assertThat(dag.nodes())
        .extracting(DagNode::id, DagNode::label)
        .containsExactly(
            tuple("input", "Input"),
            tuple("condition-0", "inputs.premium"),
            tuple("condition-1", "inputs.region === \"eu\""),
            tuple("step-0", "Route Eu"),
            tuple("output", "Output"));
    assertThat(dag.edges())
        .extracting(DagEdge::source, DagEdge::target, DagEdge::label)
        .contains(
            tuple("condition-0", "condition-1", "then"),
            tuple("condition-1", "step-0", "then"));
    assertThat(dag.reachableFromInput()).containsExactlyInAnyOrderElementsOf(dag.nodeIds());
  }

  @Test
  void stepsInOneArmAreEachReachedFromTheCondition() {
    String source =
        """
        import { Workflow } from "0pflow";
        import { fetchLeads } from "../nodes/fetch-leads.js";
        import { scoreLead } from "../agents/scorer.js";
        import { notifySales } from "../nodes/notify-sales.js";

        export const triage = Workflow.create({
          name: "triage",
          async run(ctx, inputs) {
            if (!inputs.ok) return;
            await ctx.run(fetchLeads, inputs);
            if (!inputs.ok) {
              await ctx.run(scoreLead, inputs);
              await ctx.run(notifySales, inputs);
            }
          },
        });
        """;

    WorkflowDag dag = single("triage.ts", source);

    assertThat(dag.nodes())
        .filteredOn(node -> node.type() == NodeType.CONDITION)
        .extracting(DagNode::id, DagNode::label)
        .containsExactly(tuple("condition-0", "!inputs.ok"));
    assertThat(dag.edges())
        .extracting(DagEdge::source, DagEdge::target, DagEdge::label)
        .contains(
            tuple("condition-0", "output", "yes"),
            tuple("condition-0", "step-0", null),
            tuple("condition-0", "step-1", "then"),
            tuple("condition-0", "step-2", "then"))
        .doesNotContain(tuple("step-1", "step-2", null));
    assertWellFormed(dag);
  }

  @Test
  void everyWorkflowDeclarationIsExtracted() {
    String source =
        """
        import { Workflow } from "0pflow";
        import { a } from "../nodes/a.js";
        import { b } from "../nodes/b.js";

        export const first = Workflow.create({
          name: "first",
          async run(ctx) { await ctx.run(a, {}); },
        });

        export const second = Workflow.create({
          name: "second",
          version: 3,
          async run(ctx) { await ctx.run(b, {}); },
        });
        """;

    List<WorkflowDag> workflows = extractor.extract("pair.ts", parse(source)).workflows();

    assertThat(workflows)
        .extracting(WorkflowDag::workflowName, WorkflowDag::version)
        .containsExactly(tuple("first", 1), tuple("second", 3));
    assertThat(workflows.get(1).node("step-0").orElseThrow().executableName()).isEqualTo("b");
  }

  @Test
  void untrackedCallsAreIgnored() {
    String source =
        """
        import { Workflow } from "0pflow";
        import { a } from "../nodes/a.js";

        export const wf = Workflow.create({
          name: "quiet",
          async run(ctx, inputs) {
            ctx.log("start");
            other.run(a, {});
            await ctx.run();
            await ctx.run(a, inputs);
          },
        });
        """;

    WorkflowDag dag = single("quiet.ts", source);

    assertThat(dag.nodeIds()).containsExactly("input", "step-0", "output");
    assertThat(dag.node("step-0").orElseThrow().lineNumber()).isEqualTo(10);
  }

  @Test
  void configuredFactoryAndArrowParameter() {
    properties.getExtraction().setFactoryIdentifier("Flow");
    extractor = WorkflowGraphTestSupport.pipeline(properties).extractor();
    String source =
        """
        import { Flow } from "@acme/flow";
        import { notify } from "../agents/notify.js";

        export const custom = Flow.create({
          name: `custom`,
          run: async c => {
            await c.run(notify, {});
          },
        });
        """;

    WorkflowDag dag = single("custom.ts", source);

    assertThat(dag.workflowName()).isEqualTo("custom");
    assertThat(dag.node("step-0").orElseThrow().type()).isEqualTo(NodeType.AGENT);
  }

  @Test
  void declarationWithoutRunIsDegenerate() {
    WorkflowDag dag =
        single(
            "empty.ts",
            "import { Workflow } from \"0pflow\";\n"
                + "export const empty = Workflow.create({ name: getName() });\n");

    assertThat(dag.workflowName()).isEqualTo("unknown");
    assertThat(dag.nodeIds()).containsExactly("input", "output");
    assertThat(edgePairs(dag)).containsExactly("input->output");
  }

  @Test
  void fallsBackToLinearChainWithoutCreateCall() {
    ExtractionResult result = extractor.extract("aliased.ts", parse(fixture("aliased-create.ts")));

    assertThat(result.degraded()).isTrue();
    assertThat(result.workflows()).hasSize(1);
    WorkflowDag dag = result.workflows().get(0);
    assertThat(dag.workflowName()).isEqualTo("aliased");
    assertThat(dag.nodes())
        .extracting(DagNode::id, DagNode::type)
        .containsExactly(
            tuple("input", NodeType.INPUT),
            tuple("step-0", NodeType.NODE),
            tuple("step-1", NodeType.AGENT),
            tuple("output", NodeType.OUTPUT));
    assertThat(edgePairs(dag)).containsExactly("input->step-0", "step-0->step-1", "step-1->output");
  }

  @Test
  void truncatedFileStillYieldsWellFormedGraphs() {
    ExtractionResult result = extractor.extract("half.ts", parse(fixture("truncated.ts")));

    assertThat(result.workflows()).isNotEmpty();
    for (WorkflowDag dag : result.workflows()) {
      assertWellFormed(dag);
    }
  }

  @Test
  void fileWithoutWorkflowsYieldsNothing() {
    ExtractionResult result =
        extractor.extract("util.ts", parse("export const answer = () => ctx.run(a);\n"));

    assertThat(result.workflows()).isEmpty();
    assertThat(result.degraded()).isFalse();
  }

  @Test
  void fixturesProduceWellFormedGraphs() {
    for (String name :
        List.of("sequential.ts", "branching.ts", "guarded.ts", "loops.ts", "early-return.ts")) {
      assertWellFormed(single(name, fixture(name)));
    }
  }

  private WorkflowDag single(String filePath, String source) {
    List<WorkflowDag> workflows = extractor.extract(filePath, parse(source)).workflows();
    assertThat(workflows).hasSize(1);
    return workflows.get(0);
  }

  private static void assertWellFormed(WorkflowDag dag) {
    assertThat(dag.nodes()).filteredOn(node -> node.type() == NodeType.INPUT).hasSize(1);
    assertThat(dag.nodes()).filteredOn(node -> node.type() == NodeType.OUTPUT).hasSize(1);
    assertThat(dag.nodeIds()).doesNotHaveDuplicates();
    Set<String> ids = new HashSet<>(dag.nodeIds());
    assertThat(dag.edges())
        .allSatisfy(
            edge -> {
              assertThat(ids).contains(edge.source(), edge.target());
              assertThat(edge.source()).isNotEqualTo(edge.target());
            });
    assertThat(dag.edges()).extracting(DagEdge::source, DagEdge::target).doesNotHaveDuplicates();
    assertThat(dag.edges()).noneMatch(edge -> edge.source().equals(DagNode.OUTPUT_ID));
    assertThat(dag.reachableFromInput()).containsExactlyInAnyOrderElementsOf(dag.nodeIds());
  }

  private static List<String> edgePairs(WorkflowDag dag) {
    return dag.edges().stream().map(edge -> edge.source() + "->" + edge.target()).toList();
  }
}

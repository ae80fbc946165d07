package com.aiadvent.mcp.workflowgraph.extraction;

import com.aiadvent.mcp.workflowgraph.ast.SyntaxNode;
import com.aiadvent.mcp.workflowgraph.dag.DagEdge;
import com.aiadvent.mcp.workflowgraph.dag.DagNode;
import com.aiadvent.mcp.workflowgraph.dag.LoopGroup;
import com.aiadvent.mcp.workflowgraph.dag.WorkflowDag;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.Arm;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.BranchScope;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.GuardClause;
import com.aiadvent.mcp.workflowgraph.extraction.ControlFlow.StepCall;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link ControlFlow} into a {@link WorkflowDag}.
 *
 * <p>Calls are processed in source order against a frontier: the ids whose outgoing edge has not
 * been drawn yet. Every edge points from an existing node to a newly created one or to {@code
 * output}, so the result is acyclic.
 */
@Component
public class DagAssembler {

  private static final String STEP_PREFIX = "step-";
  private static final String CONDITION_PREFIX = "condition-";
  private static final String LOOP_PREFIX = "loop-";
  private static final String GUARD_EDGE_SUFFIX = "->output-guard";

  /** Name, version and schema fields of a workflow declaration. */
  public record WorkflowHeader(
      String filePath,
      String workflowName,
      int version,
      List<String> inputFields,
      List<String> outputFields) {

    public WorkflowHeader {
      inputFields = inputFields != null ? List.copyOf(inputFields) : List.of();
      outputFields = outputFields != null ? List.copyOf(outputFields) : List.of();
    }
  }

  public WorkflowDag assemble(WorkflowHeader header, ControlFlow flow, ImportIndex imports) {
    Builder builder = new Builder(header, imports);
    for (int i = 0; i < flow.steps().size(); i++) {
      builder.addStep(i, flow.steps().get(i));
    }
    flow.trailingGuards().forEach(builder::addGuard);
    return builder.build();
  }

  /** {@code input -> output}, used when the declaration has no usable run body. */
  public WorkflowDag degenerate(WorkflowHeader header) {
    return new WorkflowDag(
        header.workflowName(),
        header.version(),
        header.filePath(),
        List.of(DagNode.input(header.inputFields()), DagNode.output(header.outputFields())),
        List.of(DagEdge.between(DagNode.INPUT_ID, DagNode.OUTPUT_ID)),
        null);
  }

  /** Straight chain over the given calls, for files whose declaration could not be parsed. */
  public WorkflowDag linear(WorkflowHeader header, List<StepCall> calls, ImportIndex imports) {
    List<DagNode> nodes = new ArrayList<>();
    List<DagEdge> edges = new ArrayList<>();
    nodes.add(DagNode.input(header.inputFields()));
    String previous = DagNode.INPUT_ID;
    for (int i = 0; i < calls.size(); i++) {
      DagNode step = stepNode(i, calls.get(i), imports);
      nodes.add(step);
      edges.add(DagEdge.between(previous, step.id()));
      previous = step.id();
    }
    nodes.add(DagNode.output(header.outputFields()));
    edges.add(DagEdge.between(previous, DagNode.OUTPUT_ID));
    return new WorkflowDag(
        header.workflowName(), header.version(), header.filePath(), nodes, edges, null);
  }

  private static DagNode stepNode(int index, StepCall call, ImportIndex imports) {
    String reference = call.reference();
    return DagNode.step(
        STEP_PREFIX + index,
        Labels.humanize(reference),
        imports.classify(reference),
        reference,
        imports.importPath(reference).orElse(null),
        call.line());
  }

  private static final class BranchState {
    private final String conditionId;
    private final Set<Arm> takenArms = EnumSet.noneOf(Arm.class);

    BranchState(String conditionId) {
      this.conditionId = conditionId;
    }

    boolean bothArmsTaken() {
      return takenArms.containsAll(EnumSet.allOf(Arm.class));
    }
  }

  private record LoopMembers(String label, List<String> nodeIds) {}

  private static final class Builder {
    private final WorkflowHeader header;
    private final ImportIndex imports;
    private final List<DagNode> nodes = new ArrayList<>();
    private final List<DagEdge> edges = new ArrayList<>();
    private final Set<String> edgeKeys = new HashSet<>();
    private final Set<String> connectedToOutput = new HashSet<>();
    private final Map<String, BranchState> branches = new HashMap<>();
    private final Map<SyntaxNode, LoopMembers> loops = new LinkedHashMap<>();
    private LinkedHashSet<String> frontier = new LinkedHashSet<>(List.of(DagNode.INPUT_ID));
    private int conditionCounter;

    Builder(WorkflowHeader header, ImportIndex imports) {
      this.header = header;
      this.imports = imports;
      nodes.add(DagNode.input(header.inputFields()));
    }

    void addStep(int index, StepCall call) {
      call.guards().forEach(this::addGuard);
      DagNode step = stepNode(index, call, imports);
      call.loop()
          .ifPresent(
              loop ->
                  loops
                      .computeIfAbsent(
                          loop.statement(), key -> new LoopMembers(loop.label(), new ArrayList<>()))
                      .nodeIds()
                      .add(step.id()));
      if (call.branches().isEmpty()) {
        nodes.add(step);
        wireFromFrontier(step.id());
        frontier = new LinkedHashSet<>(List.of(step.id()));
        return;
      }
      addBranchStep(step, call);
    }

    private void addBranchStep(DagNode step, StepCall call) {
      String stepId = step.id();
      List<BranchScope> chain = call.branches();
      BranchState outer = null;
      Arm outerArm = null;
      for (BranchScope scope : chain) {
        BranchState state = branches.get(scope.condition());
        if (state == null) {
          state = new BranchState(newCondition(scope.condition(), scope.line()));
          branches.put(scope.condition(), state);
          if (outer == null) {
            wireFromFrontier(state.conditionId);
            frontier = new LinkedHashSet<>(List.of(state.conditionId));
          } else {
            attachToArm(outer, outerArm, state.conditionId);
            frontier.add(state.conditionId);
          }
        }
        outer = state;
        outerArm = scope.arm();
      }
      nodes.add(step);
      attachToArm(outer, outerArm, stepId);
      if (call.earlyReturn()) {
        connect(DagEdge.between(stepId, DagNode.OUTPUT_ID));
      } else {
        frontier.add(stepId);
      }
      for (BranchScope scope : chain) {
        BranchState state = branches.get(scope.condition());
        if (state.bothArmsTaken()) {
          frontier.remove(state.conditionId);
        }
      }
    }

    private void attachToArm(BranchState state, Arm arm, String memberId) {
      String label = arm == Arm.ELSE ? DagEdge.ELSE : DagEdge.THEN;
      connect(DagEdge.labelled(state.conditionId, memberId, label));
      state.takenArms.add(arm);
    }

    // A later branch with the same condition text reuses the guard's node.
    void addGuard(GuardClause guard) {
      String conditionId = newCondition(guard.condition(), guard.line());
      branches.putIfAbsent(guard.condition(), new BranchState(conditionId));
      wireFromFrontier(conditionId);
      connect(
          new DagEdge(
              conditionId + GUARD_EDGE_SUFFIX, conditionId, DagNode.OUTPUT_ID, DagEdge.YES));
      frontier = new LinkedHashSet<>(List.of(conditionId));
    }

    private String newCondition(String label, int line) {
      String id = CONDITION_PREFIX + conditionCounter++;
      nodes.add(DagNode.condition(id, label, line));
      return id;
    }

    private void wireFromFrontier(String target) {
      for (String source : frontier) {
        connect(DagEdge.between(source, target));
      }
    }

    private void connect(DagEdge edge) {
      if (!edgeKeys.add(edge.source() + '\n' + edge.target())) {
        return;
      }
      edges.add(edge);
      if (DagNode.OUTPUT_ID.equals(edge.target())) {
        connectedToOutput.add(edge.source());
      }
    }

    WorkflowDag build() {
      nodes.add(DagNode.output(header.outputFields()));
      for (String id : frontier) {
        if (!connectedToOutput.contains(id)) {
          connect(DagEdge.between(id, DagNode.OUTPUT_ID));
        }
      }
      List<LoopGroup> groups = new ArrayList<>();
      for (LoopMembers members : loops.values()) {
        groups.add(new LoopGroup(LOOP_PREFIX + groups.size(), members.label(), members.nodeIds()));
      }
      return new WorkflowDag(
          header.workflowName(), header.version(), header.filePath(), nodes, edges, groups);
    }
  }
}

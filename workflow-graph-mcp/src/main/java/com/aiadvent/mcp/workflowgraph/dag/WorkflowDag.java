package com.aiadvent.mcp.workflowgraph.dag;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Control-flow graph of one {@code Workflow.create(...)} declaration. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowDag(
    String workflowName,
    int version,
    String filePath,
    List<DagNode> nodes,
    List<DagEdge> edges,
    List<LoopGroup> loopGroups) {

  public WorkflowDag {
    nodes = nodes != null ? List.copyOf(nodes) : List.of();
    edges = edges != null ? List.copyOf(edges) : List.of();
    loopGroups = loopGroups == null || loopGroups.isEmpty() ? null : List.copyOf(loopGroups);
  }

  public Optional<DagNode> node(String id) {
    return nodes.stream().filter(node -> node.id().equals(id)).findFirst();
  }

  @JsonIgnore
  public List<String> nodeIds() {
    return nodes.stream().map(DagNode::id).toList();
  }

  @JsonIgnore
  public List<LoopGroup> loopGroupsOrEmpty() {
    return loopGroups != null ? loopGroups : List.of();
  }

  /** Ids reachable from {@code input} along edges, in breadth-first order. */
  public Set<String> reachableFromInput() {
    Map<String, List<String>> adjacency = new HashMap<>();
    for (DagEdge edge : edges) {
      adjacency.computeIfAbsent(edge.source(), key -> new ArrayList<>()).add(edge.target());
    }
    Set<String> visited = new LinkedHashSet<>();
    Deque<String> queue = new ArrayDeque<>();
    queue.add(DagNode.INPUT_ID);
    while (!queue.isEmpty()) {
      String current = queue.poll();
      if (!visited.add(current)) {
        continue;
      }
      for (String next : adjacency.getOrDefault(current, List.of())) {
        if (!visited.contains(next)) {
          queue.add(next);
        }
      }
    }
    return visited;
  }

  public WorkflowDag withNodes(List<DagNode> replacement) {
    return new WorkflowDag(workflowName, version, filePath, replacement, edges, loopGroups);
  }
}

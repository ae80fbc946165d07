package com.aiadvent.mcp.workflowgraph.layout;

import com.aiadvent.mcp.workflowgraph.config.WorkflowGraphProperties;
import com.aiadvent.mcp.workflowgraph.dag.LoopGroup;
import com.aiadvent.mcp.workflowgraph.dag.WorkflowDag;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Left-to-right hierarchical layout: longest-path ranks become columns, one barycenter pass orders
 * each column by its parents, and every column is centered on {@code y = 0}.
 *
 * <p>Stateless; the same input always yields the same coordinates.
 */
@Component
public class LayoutEngine {

  private final WorkflowGraphProperties.Layout settings;

  @Autowired
  public LayoutEngine(WorkflowGraphProperties properties) {
    this(properties.getLayout());
  }

  public LayoutEngine(WorkflowGraphProperties.Layout settings) {
    this.settings = settings;
  }

  public WorkflowLayout layout(WorkflowDag dag) {
    List<LayoutEdge> edges = dag.edges().stream().map(LayoutEdge::of).toList();
    Map<String, Point> positions = computeLayout(dag.nodeIds(), edges);
    return new WorkflowLayout(positions, computeGroupLayouts(positions, dag.loopGroupsOrEmpty()));
  }

  /** Absolute top-left position of every node; edges naming unknown ids are ignored. */
  public Map<String, Point> computeLayout(List<String> nodeIds, List<LayoutEdge> edges) {
    if (nodeIds.isEmpty()) {
      return Map.of();
    }
    Set<String> known = new LinkedHashSet<>(nodeIds);
    Map<String, List<String>> children = new HashMap<>();
    Map<String, List<String>> parents = new HashMap<>();
    for (String id : known) {
      children.put(id, new ArrayList<>());
      parents.put(id, new ArrayList<>());
    }
    for (LayoutEdge edge : edges) {
      if (known.contains(edge.source()) && known.contains(edge.target())) {
        children.get(edge.source()).add(edge.target());
        parents.get(edge.target()).add(edge.source());
      }
    }

    Map<String, Integer> ranks = assignRanks(known, children, parents);
    TreeMap<Integer, List<String>> columns = new TreeMap<>();
    for (String id : known) {
      columns.computeIfAbsent(ranks.get(id), rank -> new ArrayList<>()).add(id);
    }
    orderWithinRanks(columns, ranks, parents);

    Map<String, Point> positions = new LinkedHashMap<>();
    int rowSpacing = settings.getNodeHeight() + settings.getNodeGap();
    for (Map.Entry<Integer, List<String>> column : columns.entrySet()) {
      List<String> members = column.getValue();
      int x = column.getKey() * (settings.getNodeWidth() + settings.getRankGap());
      double totalHeight =
          members.size() * settings.getNodeHeight() + (members.size() - 1) * settings.getNodeGap();
      double startY = -totalHeight / 2;
      for (int i = 0; i < members.size(); i++) {
        positions.put(members.get(i), new Point(x, (int) Math.round(startY + i * rowSpacing)));
      }
    }
    return positions;
  }

  // Rank relaxation stops at size - 1, which bounds the work when the input has a cycle.
  private static Map<String, Integer> assignRanks(
      Set<String> nodeIds, Map<String, List<String>> children, Map<String, List<String>> parents) {
    int maxRank = nodeIds.size() - 1;
    Map<String, Integer> ranks = new HashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    for (String id : nodeIds) {
      if (parents.get(id).isEmpty()) {
        ranks.put(id, 0);
        queue.add(id);
      }
    }
    if (queue.isEmpty()) {
      String first = nodeIds.iterator().next();
      ranks.put(first, 0);
      queue.add(first);
    }
    for (String id : nodeIds) {
      if (!ranks.containsKey(id)) {
        ranks.put(id, 0);
        queue.add(id);
      }
    }
    while (!queue.isEmpty()) {
      String current = queue.poll();
      int next = ranks.get(current) + 1;
      for (String child : children.get(current)) {
        if (next > ranks.get(child) && next <= maxRank) {
          ranks.put(child, next);
          queue.add(child);
        }
      }
    }
    return ranks;
  }

  private static void orderWithinRanks(
      TreeMap<Integer, List<String>> columns,
      Map<String, Integer> ranks,
      Map<String, List<String>> parents) {
    for (Map.Entry<Integer, List<String>> column : columns.entrySet()) {
      int rank = column.getKey();
      List<String> members = column.getValue();
      if (rank == 0 || members.size() <= 1) {
        continue;
      }
      Map<String, Integer> previousIndex = new HashMap<>();
      List<String> previous = columns.getOrDefault(rank - 1, List.of());
      for (int i = 0; i < previous.size(); i++) {
        previousIndex.put(previous.get(i), i);
      }
      Map<String, Double> barycenter = new HashMap<>();
      for (String id : members) {
        List<String> rankParents =
            parents.get(id).stream().filter(parent -> ranks.get(parent) == rank - 1).toList();
        double center =
            rankParents.stream()
                .mapToInt(parent -> previousIndex.getOrDefault(parent, 0))
                .average()
                .orElse(0);
        barycenter.put(id, center);
      }
      members.sort(Comparator.comparingDouble(barycenter::get));
    }
  }

  /**
   * Bounding boxes of the loop groups around their members' boxes. Groups whose members have no
   * position are skipped.
   */
  public List<GroupLayout> computeGroupLayouts(
      Map<String, Point> positions, List<LoopGroup> groups) {
    List<GroupLayout> layouts = new ArrayList<>();
    for (LoopGroup group : groups) {
      List<Map.Entry<String, Point>> members = new ArrayList<>();
      for (String id : group.nodeIds()) {
        Point position = positions.get(id);
        if (position != null) {
          members.add(Map.entry(id, position));
        }
      }
      if (members.isEmpty()) {
        continue;
      }
      int minX = Integer.MAX_VALUE;
      int minY = Integer.MAX_VALUE;
      int maxX = Integer.MIN_VALUE;
      int maxY = Integer.MIN_VALUE;
      for (Map.Entry<String, Point> member : members) {
        Point position = member.getValue();
        minX = Math.min(minX, position.x());
        minY = Math.min(minY, position.y());
        maxX = Math.max(maxX, position.x() + settings.getNodeWidth());
        maxY = Math.max(maxY, position.y() + settings.getNodeHeight());
      }
      Point origin =
          new Point(
              minX - settings.getGroupPaddingX(),
              minY - settings.getGroupLabelHeight() - settings.getGroupPaddingY());
      int width = maxX - minX + 2 * settings.getGroupPaddingX();
      int height =
          maxY - minY + settings.getGroupLabelHeight() + 2 * settings.getGroupPaddingY();
      Map<String, Point> childPositions = new LinkedHashMap<>();
      for (Map.Entry<String, Point> member : members) {
        childPositions.put(member.getKey(), member.getValue().translate(-origin.x(), -origin.y()));
      }
      layouts.add(new GroupLayout(group.id(), origin, width, height, childPositions));
    }
    return layouts;
  }
}

package com.aiadvent.mcp.workflowgraph.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "workflow-graph")
public class WorkflowGraphProperties {

  private final Parser parser = new Parser();
  private final Extraction extraction = new Extraction();
  private final Layout layout = new Layout();

  public Parser getParser() {
    return parser;
  }

  public Extraction getExtraction() {
    return extraction;
  }

  public Layout getLayout() {
    return layout;
  }

  public static class Parser {
    private boolean enabled = true;
    private final Health health = new Health();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Health getHealth() {
      return health;
    }
  }

  public static class Health {
    private int failureThreshold = 3;

    public int getFailureThreshold() {
      return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
      this.failureThreshold = Math.max(1, failureThreshold);
    }
  }

  /** Identifiers of the workflow authoring API that the extractor recognises. */
  public static class Extraction {
    private String factoryIdentifier = "Workflow";
    private String defaultContextName = "ctx";
    private String schemaBuilder = "z";
    private List<String> engineModules = new ArrayList<>(List.of("0pflow", "0pflow/nodes"));

    public String getFactoryIdentifier() {
      return factoryIdentifier;
    }

    public void setFactoryIdentifier(String factoryIdentifier) {
      this.factoryIdentifier =
          StringUtils.hasText(factoryIdentifier) ? factoryIdentifier.trim() : "Workflow";
    }

    public String getDefaultContextName() {
      return defaultContextName;
    }

    public void setDefaultContextName(String defaultContextName) {
      this.defaultContextName =
          StringUtils.hasText(defaultContextName) ? defaultContextName.trim() : "ctx";
    }

    public String getSchemaBuilder() {
      return schemaBuilder;
    }

    public void setSchemaBuilder(String schemaBuilder) {
      this.schemaBuilder = StringUtils.hasText(schemaBuilder) ? schemaBuilder.trim() : "z";
    }

    public List<String> getEngineModules() {
      return engineModules;
    }

    public void setEngineModules(List<String> engineModules) {
      this.engineModules =
          engineModules != null ? new ArrayList<>(engineModules) : new ArrayList<>();
    }
  }

  public static class Layout {
    private int nodeWidth = 220;
    private int nodeHeight = 50;
    private int rankGap = 80;
    private int nodeGap = 40;
    private int groupPaddingX = 20;
    private int groupPaddingY = 16;
    private int groupLabelHeight = 28;

    public int getNodeWidth() {
      return nodeWidth;
    }

    public void setNodeWidth(int nodeWidth) {
      this.nodeWidth = nodeWidth;
    }

    public int getNodeHeight() {
      return nodeHeight;
    }

    public void setNodeHeight(int nodeHeight) {
      this.nodeHeight = nodeHeight;
    }

    public int getRankGap() {
      return rankGap;
    }

    public void setRankGap(int rankGap) {
      this.rankGap = rankGap;
    }

    public int getNodeGap() {
      return nodeGap;
    }

    public void setNodeGap(int nodeGap) {
      this.nodeGap = nodeGap;
    }

    public int getGroupPaddingX() {
      return groupPaddingX;
    }

    public void setGroupPaddingX(int groupPaddingX) {
      this.groupPaddingX = groupPaddingX;
    }

    public int getGroupPaddingY() {
      return groupPaddingY;
    }

    public void setGroupPaddingY(int groupPaddingY) {
      this.groupPaddingY = groupPaddingY;
    }

    public int getGroupLabelHeight() {
      return groupLabelHeight;
    }

    public void setGroupLabelHeight(int groupLabelHeight) {
      this.groupLabelHeight = groupLabelHeight;
    }
  }
}

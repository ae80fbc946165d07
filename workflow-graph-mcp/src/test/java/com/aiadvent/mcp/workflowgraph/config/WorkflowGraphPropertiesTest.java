package com.aiadvent.mcp.workflowgraph.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class WorkflowGraphPropertiesTest {

  @Test
  void defaultsMatchWorkflowAuthoringApi() {
    WorkflowGraphProperties properties = new WorkflowGraphProperties();

    assertThat(properties.getParser().isEnabled()).isTrue();
    assertThat(properties.getParser().getHealth().getFailureThreshold()).isEqualTo(3);
    assertThat(properties.getExtraction().getFactoryIdentifier()).isEqualTo("Workflow");
    assertThat(properties.getExtraction().getDefaultContextName()).isEqualTo("ctx");
    assertThat(properties.getExtraction().getSchemaBuilder()).isEqualTo("z");
    assertThat(properties.getExtraction().getEngineModules())
        .containsExactly("0pflow", "0pflow/nodes");
    assertThat(properties.getLayout().getNodeWidth()).isEqualTo(220);
    assertThat(properties.getLayout().getNodeHeight()).isEqualTo(50);
    assertThat(properties.getLayout().getRankGap()).isEqualTo(80);
    assertThat(properties.getLayout().getNodeGap()).isEqualTo(40);
  }

  @Test
  void bindsNestedSections() {
    Map<String, String> props = new HashMap<>();
    props.put("workflow-graph.parser.enabled", "false");
    props.put("workflow-graph.parser.health.failure-threshold", "5");
    props.put("workflow-graph.extraction.factory-identifier", "Flow");
    props.put("workflow-graph.extraction.default-context-name", "context");
    props.put("workflow-graph.extraction.engine-modules[0]", "@acme/engine");
    props.put("workflow-graph.layout.node-width", "180");
    props.put("workflow-graph.layout.group-label-height", "24");

    WorkflowGraphProperties properties = bind(props);

    assertThat(properties.getParser().isEnabled()).isFalse();
    assertThat(properties.getParser().getHealth().getFailureThreshold()).isEqualTo(5);
    assertThat(properties.getExtraction().getFactoryIdentifier()).isEqualTo("Flow");
    assertThat(properties.getExtraction().getDefaultContextName()).isEqualTo("context");
    assertThat(properties.getExtraction().getEngineModules()).containsExactly("@acme/engine");
    assertThat(properties.getLayout().getNodeWidth()).isEqualTo(180);
    assertThat(properties.getLayout().getGroupLabelHeight()).isEqualTo(24);
  }

  @Test
  void blankIdentifiersFallBackToDefaults() {
    WorkflowGraphProperties properties = new WorkflowGraphProperties();

    properties.getExtraction().setFactoryIdentifier("  ");
    properties.getExtraction().setDefaultContextName(null);
    properties.getExtraction().setSchemaBuilder("");
    properties.getExtraction().setEngineModules(null);

    assertThat(properties.getExtraction().getFactoryIdentifier()).isEqualTo("Workflow");
    assertThat(properties.getExtraction().getDefaultContextName()).isEqualTo("ctx");
    assertThat(properties.getExtraction().getSchemaBuilder()).isEqualTo("z");
    assertThat(properties.getExtraction().getEngineModules()).isEmpty();
  }

  @Test
  void failureThresholdIsAtLeastOne() {
    WorkflowGraphProperties properties = new WorkflowGraphProperties();

    properties.getParser().getHealth().setFailureThreshold(0);

    assertThat(properties.getParser().getHealth().getFailureThreshold()).isEqualTo(1);
  }

  private WorkflowGraphProperties bind(Map<String, String> props) {
    return new Binder(new MapConfigurationPropertySource(props))
        .bind("workflow-graph", Bindable.of(WorkflowGraphProperties.class))
        .orElseGet(WorkflowGraphProperties::new);
  }
}

package com.aiadvent.mcp.workflowgraph.tool;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class WorkflowGraphToolConfiguration {

  @Bean
  ToolCallbackProvider workflowGraphToolCallbackProvider(WorkflowGraphTools tools) {
    return MethodToolCallbackProvider.builder().toolObjects(tools).build();
  }
}

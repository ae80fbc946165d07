package com.aiadvent.mcp.workflowgraph;

import com.aiadvent.mcp.workflowgraph.config.WorkflowGraphProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(WorkflowGraphProperties.class)
public class WorkflowGraphMcpApplication {

  public static void main(String[] args) {
    SpringApplication.run(WorkflowGraphMcpApplication.class, args);
  }
}

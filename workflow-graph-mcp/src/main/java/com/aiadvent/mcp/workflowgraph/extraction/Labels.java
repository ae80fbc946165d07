package com.aiadvent.mcp.workflowgraph.extraction;

import java.util.regex.Pattern;

final class Labels {

  private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");

  private Labels() {}

  /** {@code querySalesforceLeads} becomes {@code Query Salesforce Leads}. */
  static String humanize(String identifier) {
    if (identifier == null || identifier.isEmpty()) {
      return "";
    }
    String spaced = CAMEL_BOUNDARY.matcher(identifier).replaceAll("$1 $2");
    return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
  }
}

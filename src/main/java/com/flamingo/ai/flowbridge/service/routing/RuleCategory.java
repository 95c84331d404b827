package com.flamingo.ai.flowbridge.service.routing;

import com.fasterxml.jackson.annotation.JsonValue;

/** Grouping used when reviewing a trace. */
public enum RuleCategory {
  AT_RULE("at-rule"),
  ROOT("root"),
  MEDIA("media"),
  BASE("base"),
  PSEUDO("pseudo"),
  COMBINATOR("combinator"),
  ATTRIBUTE("attribute");

  private final String label;

  RuleCategory(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}

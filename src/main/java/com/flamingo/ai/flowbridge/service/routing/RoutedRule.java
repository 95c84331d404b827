package com.flamingo.ai.flowbridge.service.routing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Routing decision for one selector of one rule.
 *
 * @param id {@code rule-N}, unique within a trace
 * @param selector the single selector this entry covers, or the at-rule prelude
 * @param mediaQuery enclosing media condition, null at top level
 * @param originalCss the rule text as written
 * @param destination native, embed or split
 * @param category review grouping
 * @param reasons human-readable reasons, in decision order
 * @param properties per-declaration routing
 * @param breakpoint breakpoint remap, null when the rule is not inside a mapped query
 * @param classChain classes of a compound class selector, base first; empty for embed-only rules
 * @param state variant key of a supported pseudo-class, null when none
 * @param nativeOutput inline style string for the native declarations, null when none
 * @param embedOutput CSS text for the embedded declarations, null when none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoutedRule(
    String id,
    String selector,
    String mediaQuery,
    String originalCss,
    RouteDestination destination,
    RuleCategory category,
    List<String> reasons,
    List<RoutedProperty> properties,
    BreakpointMapping breakpoint,
    List<String> classChain,
    String state,
    String nativeOutput,
    String embedOutput) {

  public RoutedRule {
    reasons = List.copyOf(reasons);
    properties = List.copyOf(properties);
    classChain = List.copyOf(classChain);
  }

  @JsonIgnore
  public boolean hasNativeOutput() {
    return destination != RouteDestination.EMBED && nativeOutput != null;
  }

  @JsonIgnore
  public boolean hasEmbedOutput() {
    return destination != RouteDestination.NATIVE && embedOutput != null;
  }
}

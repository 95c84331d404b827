package com.flamingo.ai.flowbridge.service.routing;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Per-rule routing decisions for one stylesheet. */
public record RoutingTrace(List<RoutedRule> rules, RoutingSummary summary) {

  public RoutingTrace {
    rules = List.copyOf(rules);
  }

  public static RoutingTrace of(List<RoutedRule> rules) {
    return new RoutingTrace(rules, RoutingSummary.of(rules));
  }

  public static RoutingTrace empty() {
    return of(List.of());
  }

  /** Rules that contribute native style properties. */
  public List<RoutedRule> nativeRules() {
    return rules.stream().filter(RoutedRule::hasNativeOutput).toList();
  }

  /** Embedded CSS of every rule, each distinct text once, in rule order. */
  public String embedCss() {
    Set<String> texts = new LinkedHashSet<>();
    for (RoutedRule rule : rules) {
      if (rule.hasEmbedOutput()) {
        texts.add(rule.embedOutput());
      }
    }
    return String.join("\n", texts);
  }
}

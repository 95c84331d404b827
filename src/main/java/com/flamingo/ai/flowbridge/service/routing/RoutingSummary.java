package com.flamingo.ai.flowbridge.service.routing;

import java.util.List;

/** Counts over a trace. Root blocks count as extracted at-rules. */
public record RoutingSummary(
    int totalRules,
    int nativeRules,
    int embedRules,
    int splitRules,
    int breakpointMappings,
    int atRulesExtracted) {

  static RoutingSummary of(List<RoutedRule> rules) {
    int nativeRules = 0;
    int embedRules = 0;
    int splitRules = 0;
    int breakpointMappings = 0;
    int atRules = 0;
    for (RoutedRule rule : rules) {
      switch (rule.destination()) {
        case NATIVE -> nativeRules++;
        case EMBED -> embedRules++;
        case SPLIT -> splitRules++;
      }
      if (rule.breakpoint() != null) {
        breakpointMappings++;
      }
      if (rule.category() == RuleCategory.AT_RULE || rule.category() == RuleCategory.ROOT) {
        atRules++;
      }
    }
    return new RoutingSummary(
        rules.size(), nativeRules, embedRules, splitRules, breakpointMappings, atRules);
  }
}

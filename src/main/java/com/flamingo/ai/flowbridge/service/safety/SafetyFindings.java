package com.flamingo.ai.flowbridge.service.safety;

import java.util.ArrayList;
import java.util.List;

/** Mutable collector shared by the passes of one gate run. */
final class SafetyFindings {

  final List<String> fatalIssues = new ArrayList<>();
  final List<String> autoFixes = new ArrayList<>();
  final List<String> warnings = new ArrayList<>();
  final List<String> embedErrors = new ArrayList<>();
  final List<String> embedWarnings = new ArrayList<>();

  void fatal(String issue) {
    fatalIssues.add(issue);
  }

  void fix(String fix) {
    autoFixes.add(fix);
  }

  void warn(String warning) {
    warnings.add(warning);
  }

  /** Over-limit embed: recorded as a size error and as a fatal issue. */
  void embedError(String error) {
    embedErrors.add(error);
    fatalIssues.add(error);
  }

  void embedWarning(String warning) {
    embedWarnings.add(warning);
  }

  SafetyStatus status() {
    if (!fatalIssues.isEmpty()) {
      return SafetyStatus.BLOCK;
    }
    if (!autoFixes.isEmpty() || !warnings.isEmpty() || !embedWarnings.isEmpty()) {
      return SafetyStatus.WARN;
    }
    return SafetyStatus.OK;
  }
}

package com.flamingo.ai.flowbridge.service.safety;

import com.flamingo.ai.flowbridge.config.FlowbridgeConfig.MissingStylePolicy;
import com.flamingo.ai.flowbridge.domain.xscp.Node;
import com.flamingo.ai.flowbridge.domain.xscp.Style;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pass 5, runs last among the document passes. Afterwards every class a node references names a
 * declared style identifier. Modifier styles that no base lists are reported.
 */
final class ReferentialIntegrityPass implements SafetyPass {

  private final MissingStylePolicy policy;

  ReferentialIntegrityPass(MissingStylePolicy policy) {
    this.policy = policy;
  }

  @Override
  public String name() {
    return "referential-integrity";
  }

  @Override
  public void apply(XscpDocument document, SafetyFindings findings) {
    List<Style> styles = document.getPayload().getStyles();
    Set<String> declared = new HashSet<>();
    styles.forEach(style -> declared.add(style.getId()));

    Set<String> synthesized = new LinkedHashSet<>();
    for (Node node : document.getPayload().getNodes()) {
      List<String> classes = node.getClasses();
      if (classes == null) {
        continue;
      }
      if (classes.removeIf(reference -> reference == null || reference.isBlank())) {
        findings.fix("Removed blank class reference(s) from node " + node.getId());
      }
      if (policy == MissingStylePolicy.DROP) {
        for (String missing : classes.stream().filter(c -> !declared.contains(c)).toList()) {
          findings.fix("Dropped missing class " + missing + " from node " + node.getId());
        }
        classes.removeIf(reference -> !declared.contains(reference));
        continue;
      }
      for (String reference : classes) {
        if (!declared.contains(reference) && synthesized.add(reference)) {
          styles.add(Style.emptyClass(reference));
          findings.fix("Created placeholder style for missing class " + reference);
        }
      }
    }

    reportUnlistedModifiers(styles, findings);
  }

  // ---- private helpers ----

  private static void reportUnlistedModifiers(List<Style> styles, SafetyFindings findings) {
    Set<String> listed = new HashSet<>();
    styles.forEach(style -> listed.addAll(style.getChildren()));
    for (Style style : styles) {
      boolean modifier = style.getComb() != null && !style.getComb().isEmpty();
      if (modifier && !listed.contains(style.getName()) && !listed.contains(style.getId())) {
        findings.warn("Combo style " + style.getName() + " is not listed by any base style");
      }
    }
  }
}

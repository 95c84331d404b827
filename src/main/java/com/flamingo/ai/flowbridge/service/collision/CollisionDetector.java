package com.flamingo.ai.flowbridge.service.collision;

import com.flamingo.ai.flowbridge.domain.xscp.Style;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Compares a document's style names and variable references with a destination's. */
@Service
@Slf4j
public class CollisionDetector {

  private static final Pattern VARIABLE_REFERENCE =
      Pattern.compile("var\\(\\s*(--[\\w-]+)\\s*[,)]");

  public CollisionReport detect(XscpDocument document, DesignerDestination destination) {
    List<String> existingClasses = new ArrayList<>();
    List<String> missingVariables = new ArrayList<>();
    List<CollisionAction> actions = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    List<Style> styles = document.getPayload().getStyles();

    if (destination.supports(DestinationCapability.STYLE_LISTING)) {
      Set<String> existing = destination.listStyleNames();
      Set<String> seen = new LinkedHashSet<>();
      for (Style style : styles) {
        String name = style.getName();
        if (name != null && existing.contains(name) && seen.add(name)) {
          existingClasses.add(name);
          actions.add(
              new CollisionAction(
                  name,
                  CollisionAction.Resolution.SKIP,
                  "Class \"" + name + "\" already exists in this site"));
        }
      }
    } else {
      warnings.add("Destination cannot list styles; class collisions were not checked");
    }

    if (destination.supports(DestinationCapability.VARIABLE_LISTING)) {
      Set<String> existing = destination.listVariableNames();
      for (String variable : variableReferences(styles)) {
        if (!existing.contains(variable) && !existing.contains(variable.substring(2))) {
          missingVariables.add(variable);
        }
      }
    } else {
      warnings.add("Destination cannot list variables; variable references were not checked");
    }

    log.debug(
        "Collision check: {} existing class(es), {} missing variable(s)",
        existingClasses.size(),
        missingVariables.size());
    return new CollisionReport(existingClasses, missingVariables, actions, warnings);
  }

  /** Every distinct {@code --name} referenced through {@code var()} in base or variant styles. */
  public static Set<String> variableReferences(List<Style> styles) {
    Set<String> variables = new LinkedHashSet<>();
    for (Style style : styles) {
      collect(style.getStyleLess(), variables);
      if (style.getVariants() != null) {
        style.getVariants().values().forEach(variant -> collect(variant.styleLess(), variables));
      }
    }
    return variables;
  }

  // ---- private helpers ----

  private static void collect(String styleLess, Set<String> variables) {
    if (styleLess == null) {
      return;
    }
    Matcher matcher = VARIABLE_REFERENCE.matcher(styleLess);
    while (matcher.find()) {
      variables.add(matcher.group(1));
    }
  }
}

package com.flamingo.ai.flowbridge.service.collision;

import java.util.Set;

/** Destination described by name lists supplied with a request. */
public record InMemoryDestination(
    Set<String> styleNames, Set<String> variableNames, Set<DestinationCapability> capabilities)
    implements DesignerDestination {

  public InMemoryDestination {
    styleNames = styleNames == null ? Set.of() : Set.copyOf(styleNames);
    variableNames = variableNames == null ? Set.of() : Set.copyOf(variableNames);
    capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
  }

  @Override
  public Set<String> listStyleNames() {
    return styleNames;
  }

  @Override
  public Set<String> listVariableNames() {
    return variableNames;
  }
}

package com.flamingo.ai.flowbridge.service.routing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/** One declaration of a traced rule. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoutedProperty(
    String property,
    String value,
    RouteDestination destination,
    String reason,
    PropertyTransform transformed) {

  @JsonIgnore
  public boolean isNative() {
    return destination == RouteDestination.NATIVE;
  }
}

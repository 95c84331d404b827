package com.flamingo.ai.flowbridge.api.dto.request;

import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.service.collision.DestinationCapability;
import com.flamingo.ai.flowbridge.service.collision.InMemoryDestination;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.HashSet;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for checking a document against a destination's existing names. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollisionCheckRequest {

  @NotNull(message = "Document is required")
  private XscpDocument document;

  @NotNull(message = "Destination is required")
  @Valid
  private Destination destination;

  /** Destination snapshot. Capabilities default to both listings. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Destination {
    private Set<String> styleNames = new HashSet<>();
    private Set<String> variableNames = new HashSet<>();
    private Set<DestinationCapability> capabilities;

    public InMemoryDestination toDestination() {
      Set<DestinationCapability> declared =
          capabilities == null ? Set.of(DestinationCapability.values()) : capabilities;
      return new InMemoryDestination(styleNames, variableNames, declared);
    }
  }
}

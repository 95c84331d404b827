package com.flamingo.ai.flowbridge.api.rest;

import com.flamingo.ai.flowbridge.api.dto.request.CollisionCheckRequest;
import com.flamingo.ai.flowbridge.api.dto.request.RemapVariablesRequest;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.service.collision.CollisionDetector;
import com.flamingo.ai.flowbridge.service.collision.CollisionReport;
import com.flamingo.ai.flowbridge.service.collision.VariableRemapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for destination collision checks and variable remapping. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CollisionController {

  private final CollisionDetector collisionDetector;
  private final VariableRemapper variableRemapper;

  @PostMapping("/collisions")
  public ResponseEntity<CollisionReport> detect(
      @Valid @RequestBody CollisionCheckRequest request) {
    return ResponseEntity.ok(
        collisionDetector.detect(
            request.getDocument(), request.getDestination().toDestination()));
  }

  @PostMapping("/variables/remap")
  public ResponseEntity<XscpDocument> remap(@Valid @RequestBody RemapVariablesRequest request) {
    return ResponseEntity.ok(
        variableRemapper.remap(request.getDocument(), request.getVariableIds()));
  }
}

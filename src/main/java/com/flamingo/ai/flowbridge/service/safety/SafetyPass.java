package com.flamingo.ai.flowbridge.service.safety;

import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;

/** One document pass of the gate. Passes mutate the working copy they are given. */
interface SafetyPass {

  String name();

  void apply(XscpDocument document, SafetyFindings findings);
}

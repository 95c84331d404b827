package com.flamingo.ai.flowbridge.service.token;

/** Kind of design value a token carries. */
public enum TokenType {
  COLOR,
  FONT_FAMILY
}

package com.flamingo.ai.flowbridge.service.token;

import java.util.List;

/**
 * Font section of a token manifest.
 *
 * @param families every detected family name
 * @param googleFontsUrl stylesheet URL loading the Google families, empty when there are none
 * @param headSnippet markup to paste into the page head, empty when there are no Google families
 */
public record TokenFonts(List<String> families, String googleFontsUrl, String headSnippet) {

  public TokenFonts {
    families = List.copyOf(families);
  }

  public static TokenFonts none() {
    return new TokenFonts(List.of(), "", "");
  }
}

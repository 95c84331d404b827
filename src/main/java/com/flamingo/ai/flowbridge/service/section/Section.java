package com.flamingo.ai.flowbridge.service.section;

import java.util.List;

/**
 * One detected page region.
 *
 * @param id unique slug within one detection pass
 * @param name display name
 * @param tagName source element tag
 * @param className first class on the element, empty when it has none
 * @param htmlContent the element's markup slice
 * @param cssSelectors every class name referenced inside the element
 * @param cssContent the stylesheet subset matching those classes
 */
public record Section(
    String id,
    String name,
    String tagName,
    String className,
    String htmlContent,
    List<String> cssSelectors,
    String cssContent) {

  public Section {
    cssSelectors = List.copyOf(cssSelectors);
  }
}

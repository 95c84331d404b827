package com.flamingo.ai.flowbridge.domain.xscp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One named class style with per-variant overrides and its combo children. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Style {

  @JsonProperty("_id")
  private String id;

  private boolean fake;
  @Builder.Default private String type = "class";
  private String name;
  @Builder.Default private String namespace = "";
  @Builder.Default private String comb = "";
  @Builder.Default private String styleLess = "";
  @Builder.Default private Map<String, Variant> variants = new LinkedHashMap<>();
  @Builder.Default private List<String> children = new ArrayList<>();

  /** Empty base style whose id and name are both {@code name}. */
  public static Style emptyClass(String name) {
    return Style.builder().id(name).name(name).build();
  }

  public Style copy() {
    Map<String, Variant> variantCopies = new LinkedHashMap<>();
    if (variants != null) {
      variants.forEach(variantCopies::put);
    }
    return new Style(
        id,
        fake,
        type,
        name,
        namespace,
        comb,
        styleLess,
        variantCopies,
        children == null ? new ArrayList<>() : new ArrayList<>(children));
  }

  /**
   * Variant override.
   *
   * @param styleLess inline property string applied under the variant
   */
  public record Variant(String styleLess) {}
}

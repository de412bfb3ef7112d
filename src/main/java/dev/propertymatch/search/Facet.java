package dev.propertymatch.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A semantic similarity dimension with its own vector index. Every listing has exactly one vector
 * per facet. Declaration order is the order facets are fused in.
 */
public enum Facet {
  LOCATION("location"),
  FEATURES("features"),
  VISUAL("visual");

  private final String value;

  Facet(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static Facet fromValue(String value) {
    for (Facet facet : values()) {
      if (facet.value.equalsIgnoreCase(value)) {
        return facet;
      }
    }
    throw new IllegalArgumentException("Unknown facet: " + value);
  }
}

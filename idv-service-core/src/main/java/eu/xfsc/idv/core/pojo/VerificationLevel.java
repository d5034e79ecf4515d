package eu.xfsc.idv.core.pojo;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trust level assigned to a verification result.
 */
public enum VerificationLevel {
  /** Name match failed. */
  NONE("none"),
  /** Name matched; face match or liveness not both passed. */
  BASIC("basic"),
  /** Name, face match and liveness all passed. */
  ENHANCED("enhanced");

  private final String value;

  VerificationLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}

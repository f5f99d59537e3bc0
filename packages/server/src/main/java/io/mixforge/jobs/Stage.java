package io.mixforge.jobs;

import com.fasterxml.jackson.annotation.JsonValue;

/** Machine-readable stage labels carried by {@link Progress}. */
public enum Stage {
  SETUP("setup"),
  VALIDATING("validating"),
  TRANSFORMING("transforming"),
  VALIDATING_OUTPUT("validating-output"),
  FINALIZING("finalizing"),
  COMPLETED("completed");

  private final String label;

  Stage(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}

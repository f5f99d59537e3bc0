package io.mixforge.track;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.mixforge.exception.ValidationException;

/**
 * Parameters for the intro/outro extension. Lengths are in bars.
 *
 * <p>Missing values fall back to the defaults (16 bars, vocals preserved, automatic beat
 * detection). Out-of-range values are rejected at construction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessingSettings(
    int introLength, int outroLength, boolean preserveVocals, BeatDetection beatDetection) {

  public static final int MIN_BARS = 8;
  public static final int MAX_BARS = 64;
  public static final int DEFAULT_BARS = 16;

  public ProcessingSettings {
    checkBars("introLength", introLength);
    checkBars("outroLength", outroLength);
    if (beatDetection == null) beatDetection = BeatDetection.AUTO;
  }

  @JsonCreator
  public static ProcessingSettings of(
      @JsonProperty("introLength") Integer introLength,
      @JsonProperty("outroLength") Integer outroLength,
      @JsonProperty("preserveVocals") Boolean preserveVocals,
      @JsonProperty("beatDetection") BeatDetection beatDetection) {
    return new ProcessingSettings(
        introLength == null ? DEFAULT_BARS : introLength,
        outroLength == null ? DEFAULT_BARS : outroLength,
        preserveVocals == null || preserveVocals,
        beatDetection);
  }

  public static ProcessingSettings defaults() {
    return new ProcessingSettings(DEFAULT_BARS, DEFAULT_BARS, true, BeatDetection.AUTO);
  }

  private static void checkBars(String field, int value) {
    if (value < MIN_BARS || value > MAX_BARS) {
      throw new ValidationException(
              "%s must be between %d and %d bars, got %d"
                  .formatted(field, MIN_BARS, MAX_BARS, value))
          .withContext("field", field);
    }
  }
}

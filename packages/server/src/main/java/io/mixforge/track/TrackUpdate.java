package io.mixforge.track;

/**
 * Fields applied by {@link EntityStore#updateStatus}. {@code outputPath} and {@code duration} are
 * only meaningful for {@link TrackStatus#COMPLETED}, where the output becomes a new extended
 * version and the version count is incremented.
 */
public record TrackUpdate(
    TrackStatus status, String outputPath, Double duration, ProcessingSettings settings) {

  public static TrackUpdate status(TrackStatus status) {
    return new TrackUpdate(status, null, null, null);
  }

  public static TrackUpdate started(TrackStatus status, ProcessingSettings settings) {
    return new TrackUpdate(status, null, null, settings);
  }

  public static TrackUpdate completed(String outputPath, Double duration) {
    return new TrackUpdate(TrackStatus.COMPLETED, outputPath, duration, null);
  }
}

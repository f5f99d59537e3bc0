package io.mixforge.track;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of a stored track. Updates go through {@link EntityStore#updateStatus}, which
 * replaces the stored snapshot.
 */
public record TrackRecord(
    long id,
    String ownerId,
    String originalFilename,
    String originalPath,
    TrackStatus status,
    List<String> extendedPaths,
    List<Double> extendedDurations,
    Double duration,
    int versionCount,
    ProcessingSettings settings) {

  public TrackRecord {
    extendedPaths = List.copyOf(extendedPaths);
    // durations may be unknown (null), which List.copyOf rejects
    extendedDurations = Collections.unmodifiableList(new ArrayList<>(extendedDurations));
  }

  public boolean hasExtendedVersions() {
    return !extendedPaths.isEmpty();
  }
}

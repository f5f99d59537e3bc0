package io.mixforge.track;

import java.util.Optional;

/**
 * Key-based store for track records. It is the system of record for job results (final paths,
 * durations, status) but not for in-flight progress.
 */
public interface EntityStore {

  TrackRecord create(String ownerId, String originalFilename, String originalPath);

  Optional<TrackRecord> get(long entityId);

  /**
   * Apply {@code update} to the track.
   *
   * @return the updated record, or empty when no track has this id
   */
  Optional<TrackRecord> updateStatus(long entityId, TrackUpdate update);
}

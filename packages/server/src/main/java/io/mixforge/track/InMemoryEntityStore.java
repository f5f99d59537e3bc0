package io.mixforge.track;

import io.mixforge.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;

/** Simple in-memory EntityStore implementation. Ids are assigned sequentially from 1. */
public final class InMemoryEntityStore implements EntityStore {
  private static final Logger log = LoggingService.getLogger(InMemoryEntityStore.class);

  private final Map<Long, TrackRecord> tracks = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();

  @Override
  public TrackRecord create(String ownerId, String originalFilename, String originalPath) {
    long id = sequence.incrementAndGet();
    TrackRecord record =
        new TrackRecord(
            id,
            ownerId,
            originalFilename,
            originalPath,
            TrackStatus.UPLOADED,
            List.of(),
            List.of(),
            null,
            1,
            null);
    tracks.put(id, record);
    return record;
  }

  @Override
  public Optional<TrackRecord> get(long entityId) {
    return Optional.ofNullable(tracks.get(entityId));
  }

  @Override
  public Optional<TrackRecord> updateStatus(long entityId, TrackUpdate update) {
    TrackRecord updated =
        tracks.computeIfPresent(entityId, (id, current) -> apply(current, update));
    if (updated == null) {
      log.warn("Status update for unknown track {}", entityId);
    }
    return Optional.ofNullable(updated);
  }

  private static TrackRecord apply(TrackRecord current, TrackUpdate update) {
    List<String> paths = current.extendedPaths();
    List<Double> durations = current.extendedDurations();
    int versions = current.versionCount();
    if (update.status() == TrackStatus.COMPLETED && update.outputPath() != null) {
      paths = new ArrayList<>(paths);
      paths.add(update.outputPath());
      durations = new ArrayList<>(durations);
      durations.add(update.duration());
      versions++;
    }
    return new TrackRecord(
        current.id(),
        current.ownerId(),
        current.originalFilename(),
        current.originalPath(),
        update.status(),
        paths,
        durations,
        current.duration(),
        versions,
        update.settings() != null ? update.settings() : current.settings());
  }
}

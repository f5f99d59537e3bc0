package io.mixforge.jobs;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Simple in-memory JobStore implementation. */
final class InMemoryJobStore implements JobStore {
  private final Map<String, JobRecord> map = new ConcurrentHashMap<>();

  @Override
  public boolean putIfAbsent(JobRecord record) {
    return map.putIfAbsent(record.id, record) == null;
  }

  @Override
  public Optional<JobRecord> get(String id) {
    return Optional.ofNullable(map.get(id));
  }

  @Override
  public Collection<JobRecord> all() {
    return List.copyOf(map.values());
  }

  @Override
  public void remove(String id) {
    map.remove(id);
  }
}

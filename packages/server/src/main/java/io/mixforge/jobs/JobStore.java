package io.mixforge.jobs;

import java.util.Collection;
import java.util.Optional;

/** Abstraction for storing job records. */
interface JobStore {
  /**
   * Store a new record.
   *
   * @return false when a record with the same id already exists
   */
  boolean putIfAbsent(JobRecord record);

  Optional<JobRecord> get(String id);

  Collection<JobRecord> all();

  void remove(String id);
}

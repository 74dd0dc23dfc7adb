package com.m4brew.management.jobs;

import java.util.Optional;

/** Abstraction for persisting the single job document. */
public interface JobStore {
  /** @return the persisted record, or empty when none exists or it cannot be read */
  Optional<JobRecord> load();

  /** Persist the record; implementations may skip writes that change nothing. */
  void save(JobRecord record);

  void delete();
}

package com.m4brew.management.jobs;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/** Simple in-memory JobStore implementation. Stores and returns copies. */
public final class InMemoryJobStore implements JobStore {
  private final AtomicReference<JobRecord> current = new AtomicReference<>();
  private final AtomicInteger writes = new AtomicInteger();

  @Override
  public Optional<JobRecord> load() {
    JobRecord r = current.get();
    return r == null ? Optional.empty() : Optional.of(r.copy());
  }

  @Override
  public void save(JobRecord record) {
    current.set(record.copy());
    writes.incrementAndGet();
  }

  @Override
  public void delete() {
    current.set(null);
  }

  /** Number of saves performed so far. */
  public int writeCount() {
    return writes.get();
  }
}

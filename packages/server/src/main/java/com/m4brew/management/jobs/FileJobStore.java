package com.m4brew.management.jobs;

import com.m4brew.store.JsonFileStore;
import com.m4brew.utility.JacksonUtility;
import java.nio.file.Path;
import java.util.Optional;

/** JobStore backed by a JSON file, written atomically with fingerprinted writes. */
public final class FileJobStore implements JobStore {
  private final JsonFileStore<JobRecord> file;

  public FileJobStore(Path path) {
    this.file =
        new JsonFileStore<>(
            path, JobRecord.class, JacksonUtility.getJsonMapper(), JobRecord.FRESHNESS_FIELD);
  }

  @Override
  public Optional<JobRecord> load() {
    return file.load();
  }

  @Override
  public void save(JobRecord record) {
    file.save(record);
  }

  @Override
  public void delete() {
    file.delete();
  }
}

package com.m4brew.management.jobs;

/**
 * Outcome of {@link JobManager#start}.
 *
 * @param job the new job when accepted, otherwise the active job left untouched
 * @param accepted whether a new job was created
 */
public record StartResult(JobRecord job, boolean accepted) {}

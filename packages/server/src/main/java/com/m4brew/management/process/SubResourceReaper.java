package com.m4brew.management.process;

/**
 * Tears down resources the task spawned outside its own process group (for example helper
 * containers) that are labeled with the job id.
 */
@FunctionalInterface
public interface SubResourceReaper {
  SubResourceReaper NONE = jobId -> {};

  void killSubResources(String jobId);
}

package com.m4brew.management.process;

/** OS capability to signal and probe the task's process group. */
public interface ProcessGroupSignaller {
  /**
   * Deliver {@code signal} to every process in the group led by {@code pgid}.
   *
   * @throws com.m4brew.exception.ProcessException if the signal could not be delivered
   */
  void signal(long pgid, Signal signal);

  /** @return whether any process of the group is still running */
  boolean isAlive(long pgid);
}

package com.m4brew.management.process;

/** POSIX signals used to stop the task, in escalation order. */
public enum Signal {
  INT,
  TERM,
  KILL
}

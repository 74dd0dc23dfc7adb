package com.m4brew.exception;

/** Failures spawning or signaling the external task. */
public class ProcessException extends M4BrewException {
  public ProcessException(String message) {
    super(M4BrewErrorCode.PROCESS_ERROR, message);
  }

  public ProcessException(String message, Throwable cause) {
    super(M4BrewErrorCode.PROCESS_ERROR, message, cause);
  }
}

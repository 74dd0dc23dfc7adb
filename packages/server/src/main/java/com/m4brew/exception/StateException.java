package com.m4brew.exception;

/** Operation not allowed in the current lifecycle state. */
public class StateException extends M4BrewException {
  public StateException(String message) {
    super(M4BrewErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(M4BrewErrorCode.STATE_ERROR, message, cause);
  }
}

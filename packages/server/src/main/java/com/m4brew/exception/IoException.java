package com.m4brew.exception;

/** Failures reading or writing persisted documents. */
public class IoException extends M4BrewException {
  public IoException(String message) {
    super(M4BrewErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(M4BrewErrorCode.IO_ERROR, message, cause);
  }
}

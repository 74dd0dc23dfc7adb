package com.m4brew.exception;

/** Request parameters rejected before any state change. */
public class ValidationException extends M4BrewException {
  public ValidationException(String message) {
    super(M4BrewErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(M4BrewErrorCode.VALIDATION_ERROR, message, cause);
  }
}

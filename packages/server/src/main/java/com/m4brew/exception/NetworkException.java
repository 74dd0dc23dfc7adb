package com.m4brew.exception;

/** Errors while binding or running the HTTP listener. */
public class NetworkException extends M4BrewException {
  public NetworkException(String message) {
    super(M4BrewErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(M4BrewErrorCode.NETWORK_ERROR, message, cause);
  }
}

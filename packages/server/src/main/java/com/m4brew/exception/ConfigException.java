package com.m4brew.exception;

/** Invalid or missing configuration. */
public class ConfigException extends M4BrewException {
  public ConfigException(String message) {
    super(M4BrewErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(M4BrewErrorCode.CONFIG_ERROR, message, cause);
  }
}

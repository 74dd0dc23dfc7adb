package com.m4brew.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base class of all unchecked errors raised by the controller. */
public class M4BrewException extends RuntimeException {
  private final M4BrewErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public M4BrewException(M4BrewErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public M4BrewException(M4BrewErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public M4BrewErrorCode getCode() {
    return code;
  }

  /** Attach a diagnostic key/value pair, returning this exception for chaining. */
  public M4BrewException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }
}

package com.m4brew.exception;

import java.time.Instant;
import java.util.Map;

/** Structured description of a failure, suitable for logs and JSON responses. */
public record ErrorDetails(
    String type,
    String message,
    M4BrewErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}

package com.m4brew.exception;

/** Coarse classification of failures raised by the controller. */
public enum M4BrewErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  VALIDATION_ERROR,
  STATE_ERROR,
  IO_ERROR,
  NETWORK_ERROR,
  PROCESS_ERROR
}

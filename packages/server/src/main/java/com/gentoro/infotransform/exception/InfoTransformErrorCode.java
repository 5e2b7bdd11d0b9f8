package com.gentoro.infotransform.exception;

/** Stable error codes attached to every {@link InfoTransformException}. */
public enum InfoTransformErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  NETWORK_ERROR,
  CONVERSION_ERROR,
  INFERENCE_ERROR,
  JOB_NOT_FOUND,
  FILE_STORE_ERROR
}

package com.gentoro.infotransform.exception;

/** A component was used in an invalid state. */
public class StateException extends InfoTransformException {
  public StateException(String message) {
    super(InfoTransformErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(InfoTransformErrorCode.STATE_ERROR, message, cause);
  }
}

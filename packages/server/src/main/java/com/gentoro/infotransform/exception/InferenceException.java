package com.gentoro.infotransform.exception;

/** The inference collaborator failed or returned an unusable response. */
public class InferenceException extends InfoTransformException {
  public InferenceException(String message) {
    super(InfoTransformErrorCode.INFERENCE_ERROR, message);
  }

  public InferenceException(String message, Throwable cause) {
    super(InfoTransformErrorCode.INFERENCE_ERROR, message, cause);
  }
}

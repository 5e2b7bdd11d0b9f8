package com.gentoro.infotransform.exception;

/** Errors opening listeners or talking to remote endpoints. */
public class NetworkException extends InfoTransformException {
  public NetworkException(String message) {
    super(InfoTransformErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(InfoTransformErrorCode.NETWORK_ERROR, message, cause);
  }
}

package com.gentoro.infotransform.exception;

/** A single file could not be converted to markdown. */
public class ConversionException extends InfoTransformException {
  public ConversionException(String message) {
    super(InfoTransformErrorCode.CONVERSION_ERROR, message);
  }

  public ConversionException(String message, Throwable cause) {
    super(InfoTransformErrorCode.CONVERSION_ERROR, message, cause);
  }
}

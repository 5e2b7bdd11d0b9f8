package com.gentoro.infotransform.exception;

/** Invalid or missing configuration. */
public class ConfigException extends InfoTransformException {
  public ConfigException(String message) {
    super(InfoTransformErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(InfoTransformErrorCode.CONFIG_ERROR, message, cause);
  }
}

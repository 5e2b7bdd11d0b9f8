package com.gentoro.infotransform.exception;

/** Errors raised by the managed file store. */
public class FileStoreException extends InfoTransformException {
  public FileStoreException(String message) {
    super(InfoTransformErrorCode.FILE_STORE_ERROR, message);
  }

  public FileStoreException(String message, Throwable cause) {
    super(InfoTransformErrorCode.FILE_STORE_ERROR, message, cause);
  }
}

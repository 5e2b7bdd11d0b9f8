package com.gentoro.infotransform.exception;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/** Root of all unchecked exceptions raised by the pipeline. */
public class InfoTransformException extends RuntimeException {
  private final InfoTransformErrorCode code;
  private final Map<String, Object> context = new HashMap<>();

  public InfoTransformException(InfoTransformErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public InfoTransformException(InfoTransformErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public InfoTransformErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic key/value pair and return this exception for chaining. */
  public InfoTransformException with(String key, Object value) {
    context.put(key, value);
    return this;
  }
}

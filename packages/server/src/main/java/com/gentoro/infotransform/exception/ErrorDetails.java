package com.gentoro.infotransform.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, serializable description of a failure. */
public record ErrorDetails(
    String type,
    String message,
    InfoTransformErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}

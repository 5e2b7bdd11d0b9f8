package com.gentoro.infotransform.conversion;

import java.util.Locale;

/** Execution strategy of the converter pool. */
public enum WorkerType {
  /** Conversions mostly wait on I/O; run as many workers as configured. */
  IO,
  /** Conversions are CPU-bound; never run more workers than available processors. */
  CPU;

  public int threads(int maxWorkers) {
    if (this == CPU) {
      return Math.max(1, Math.min(maxWorkers, Runtime.getRuntime().availableProcessors()));
    }
    return Math.max(1, maxWorkers);
  }

  /** Accepts {@code io}/{@code thread} and {@code cpu}/{@code process}. */
  public static WorkerType parse(String value) {
    if (value == null) return IO;
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "cpu", "process" -> CPU;
      case "io", "thread", "" -> IO;
      default -> throw new com.gentoro.infotransform.exception.ConfigException(
          "Unknown conversion.worker-type: " + value);
    };
  }
}

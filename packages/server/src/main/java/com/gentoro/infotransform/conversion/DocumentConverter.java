package com.gentoro.infotransform.conversion;

import java.time.Duration;

/**
 * Text-extraction collaborator: turns the raw bytes of one file into markdown.
 *
 * <p>Implementations should honour thread interruption; the pool interrupts a conversion that
 * exceeds its timeout.
 */
public interface DocumentConverter {

  /** Whether this converter can handle the given file. */
  boolean supports(String filename, String mediaType);

  /**
   * @param content raw file bytes
   * @param typeHint resolved media type (see {@link TypeHints#resolve(String, String)})
   * @param timeout budget the caller will wait; informational for implementations
   * @return markdown text
   * @throws Exception any failure; reported as a failed item, never retried
   */
  String convert(byte[] content, String typeHint, Duration timeout) throws Exception;
}

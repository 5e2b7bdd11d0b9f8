package com.gentoro.infotransform.conversion;

import com.gentoro.infotransform.exception.ConversionException;
import java.time.Duration;
import java.util.List;

/** Delegates to the first converter that supports the file's type. */
public final class RoutingDocumentConverter implements DocumentConverter {
  private final List<DocumentConverter> delegates;

  public RoutingDocumentConverter(List<DocumentConverter> delegates) {
    this.delegates = List.copyOf(delegates);
  }

  @Override
  public boolean supports(String filename, String mediaType) {
    return delegates.stream().anyMatch(d -> d.supports(filename, mediaType));
  }

  @Override
  public String convert(byte[] content, String typeHint, Duration timeout) throws Exception {
    for (DocumentConverter delegate : delegates) {
      if (delegate.supports(null, typeHint)) {
        return delegate.convert(content, typeHint, timeout);
      }
    }
    throw new ConversionException("Unsupported file format.");
  }
}

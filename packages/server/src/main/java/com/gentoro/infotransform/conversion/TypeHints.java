package com.gentoro.infotransform.conversion;

import java.util.Locale;
import java.util.Map;

/** Resolves the media type used to route a file to a converter. */
public final class TypeHints {
  private static final Map<String, String> BY_EXTENSION =
      Map.ofEntries(
          Map.entry("txt", "text/plain"),
          Map.entry("text", "text/plain"),
          Map.entry("log", "text/plain"),
          Map.entry("md", "text/markdown"),
          Map.entry("markdown", "text/markdown"),
          Map.entry("csv", "text/csv"),
          Map.entry("tsv", "text/tab-separated-values"),
          Map.entry("json", "application/json"),
          Map.entry("xml", "application/xml"),
          Map.entry("html", "text/html"),
          Map.entry("htm", "text/html"),
          Map.entry("pdf", "application/pdf"),
          Map.entry("png", "image/png"),
          Map.entry("jpg", "image/jpeg"),
          Map.entry("jpeg", "image/jpeg"),
          Map.entry(
              "docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
          Map.entry("mp3", "audio/mpeg"),
          Map.entry("wav", "audio/wav"));

  private TypeHints() {}

  /**
   * Prefer the declared media type unless it is missing or generic, then fall back to the file
   * extension. Parameters such as {@code ;charset=} are stripped.
   */
  public static String resolve(String filename, String mediaType) {
    if (mediaType != null && !mediaType.isBlank()) {
      String base = mediaType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
      if (!base.equals("application/octet-stream") && !base.isEmpty()) {
        return base;
      }
    }
    if (filename != null) {
      int dot = filename.lastIndexOf('.');
      if (dot >= 0 && dot < filename.length() - 1) {
        String ext = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        String byExt = BY_EXTENSION.get(ext);
        if (byExt != null) return byExt;
      }
    }
    return "application/octet-stream";
  }
}

package com.gentoro.infotransform.conversion;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.infotransform.exception.ConversionException;
import com.gentoro.infotransform.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converter for text-based formats. Plain text and markdown pass through, CSV/TSV become a
 * markdown table and JSON/XML are wrapped in fenced code blocks.
 */
public final class PlainTextConverter implements DocumentConverter {
  private static final Set<String> SUPPORTED =
      Set.of(
          "text/plain",
          "text/markdown",
          "text/csv",
          "text/tab-separated-values",
          "text/html",
          "application/json",
          "application/xml",
          "text/xml");

  @Override
  public boolean supports(String filename, String mediaType) {
    return SUPPORTED.contains(TypeHints.resolve(filename, mediaType));
  }

  @Override
  public String convert(byte[] content, String typeHint, Duration timeout) {
    String text = new String(content, StandardCharsets.UTF_8);
    if (text.startsWith("\uFEFF")) text = text.substring(1);
    if (text.isBlank()) {
      throw new ConversionException("File is empty");
    }
    return switch (typeHint) {
      case "text/csv" -> toTable(text, ',');
      case "text/tab-separated-values" -> toTable(text, '\t');
      case "application/json" -> "```json\n" + prettyJson(text) + "\n```\n";
      case "application/xml", "text/xml" -> "```xml\n" + text.strip() + "\n```\n";
      default -> text;
    };
  }

  private static String prettyJson(String text) {
    try {
      JsonNode node = JacksonUtility.getJsonMapper().readTree(text);
      return JacksonUtility.getJsonMapper()
          .writerWithDefaultPrettyPrinter()
          .writeValueAsString(node);
    } catch (Exception e) {
      throw new ConversionException("Malformed JSON: " + e.getMessage(), e);
    }
  }

  static String toTable(String text, char separator) {
    List<List<String>> rows = new ArrayList<>();
    for (String line : text.split("\\r?\\n")) {
      if (line.isBlank()) continue;
      rows.add(splitRow(line, separator));
    }
    int width = rows.stream().mapToInt(List::size).max().orElse(0);
    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < rows.size(); r++) {
      List<String> row = rows.get(r);
      sb.append('|');
      for (int c = 0; c < width; c++) {
        String cell = c < row.size() ? row.get(c) : "";
        sb.append(' ').append(cell.replace("|", "\\|")).append(" |");
      }
      sb.append('\n');
      if (r == 0) {
        sb.append('|');
        sb.append(" --- |".repeat(width));
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  private static List<String> splitRow(String line, char separator) {
    List<String> cells = new ArrayList<>();
    StringBuilder cell = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < line.length(); i++) {
      char ch = line.charAt(i);
      if (ch == '"') {
        if (quoted && i + 1 < line.length() && line.charAt(i + 1) == '"') {
          cell.append('"');
          i++;
        } else {
          quoted = !quoted;
        }
      } else if (ch == separator && !quoted) {
        cells.add(cell.toString().trim());
        cell.setLength(0);
      } else {
        cell.append(ch);
      }
    }
    cells.add(cell.toString().trim());
    return cells;
  }
}

package com.gentoro.infotransform.conversion;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.infotransform.exception.ConversionException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class PlainTextConverterTest {

  private final PlainTextConverter converter = new PlainTextConverter();

  private String convert(String text, String type) {
    return converter.convert(text.getBytes(StandardCharsets.UTF_8), type, Duration.ofSeconds(1));
  }

  @Test
  void plainTextPassesThrough() {
    assertEquals("hello\nworld", convert("hello\nworld", "text/plain"));
  }

  @Test
  void csvBecomesMarkdownTable() {
    String md = convert("name,amount\n\"Acme, Inc\",12\nBob,3\n", "text/csv");
    assertEquals(
        "| name | amount |\n| --- | --- |\n| Acme, Inc | 12 |\n| Bob | 3 |\n", md);
  }

  @Test
  void jsonIsPrettyPrintedInFence() {
    String md = convert("{\"a\":1}", "application/json");
    assertTrue(md.startsWith("```json\n"));
    assertTrue(md.contains("\"a\" : 1"));
  }

  @Test
  void malformedJsonFails() {
    assertThrows(ConversionException.class, () -> convert("{nope", "application/json"));
  }

  @Test
  void emptyFileFails() {
    assertThrows(ConversionException.class, () -> convert("  \n", "text/plain"));
  }

  @Test
  void supportsByExtensionWhenMediaTypeIsGeneric() {
    assertTrue(converter.supports("report.md", "application/octet-stream"));
    assertFalse(converter.supports("scan.pdf", null));
  }

  @Test
  void routingRejectsUnsupportedFormats() {
    RoutingDocumentConverter routing = new RoutingDocumentConverter(List.of(converter));
    ConversionException e =
        assertThrows(
            ConversionException.class,
            () -> routing.convert(new byte[] {1}, "application/pdf", Duration.ofSeconds(1)));
    assertEquals("Unsupported file format.", e.getMessage());
  }

  @Test
  void typeHintsStripParametersAndFallBackToExtension() {
    assertEquals("text/csv", TypeHints.resolve("x.bin", "text/csv; charset=utf-8"));
    assertEquals("text/markdown", TypeHints.resolve("notes.MD", "application/octet-stream"));
    assertEquals("application/octet-stream", TypeHints.resolve("noext", null));
  }
}

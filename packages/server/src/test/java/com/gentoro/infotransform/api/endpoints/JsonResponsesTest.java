package com.gentoro.infotransform.api.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.infotransform.exception.FileStoreException;
import com.gentoro.infotransform.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletResponse;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class JsonResponsesTest {

  @Test
  void failureCarriesCodeTypeAndTrace() throws Exception {
    HttpServletResponse resp = Mockito.mock(HttpServletResponse.class);
    StringWriter out = new StringWriter();
    Mockito.when(resp.getWriter()).thenReturn(new PrintWriter(out, true));

    JsonResponses.failure(
        resp,
        "Failed to accept submission",
        new CompletionException(new FileStoreException("disk full")));

    Mockito.verify(resp).setStatus(500);
    JsonNode body = JacksonUtility.readTree(out.toString());
    assertEquals("Failed to accept submission: disk full", body.path("error").asText());
    assertEquals("FILE_STORE_ERROR", body.path("code").asText());
    assertEquals("FileStoreException", body.path("type").asText());
    assertTrue(body.path("trace").asText().contains("JsonResponsesTest"));
  }

  @Test
  void foreignExceptionsAreUnknown() throws Exception {
    HttpServletResponse resp = Mockito.mock(HttpServletResponse.class);
    StringWriter out = new StringWriter();
    Mockito.when(resp.getWriter()).thenReturn(new PrintWriter(out, true));

    JsonResponses.failure(resp, "Failed to start transform", new IllegalStateException("boom"));

    JsonNode body = JacksonUtility.readTree(out.toString());
    assertEquals("UNKNOWN", body.path("code").asText());
    assertEquals(
        "Failed to start transform: IllegalStateException: boom", body.path("error").asText());
  }
}

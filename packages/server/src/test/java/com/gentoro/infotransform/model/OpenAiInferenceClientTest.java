package com.gentoro.infotransform.model;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.infotransform.exception.InferenceException;
import com.gentoro.infotransform.utility.JacksonUtility;
import org.junit.jupiter.api.Test;

class OpenAiInferenceClientTest {

  @Test
  void parsesBareAndFencedObjects() {
    JsonNode bare = OpenAiInferenceClient.parse("{\"title\":\"Q3 report\"}");
    assertEquals("Q3 report", bare.path("title").asText());

    JsonNode fenced = OpenAiInferenceClient.parse("```json\n{\"pages\": 4}\n```\n");
    assertEquals(4, fenced.path("pages").asInt());
  }

  @Test
  void rejectsNonObjects() {
    assertThrows(InferenceException.class, () -> OpenAiInferenceClient.parse("[1, 2]"));
    assertThrows(InferenceException.class, () -> OpenAiInferenceClient.parse("sorry, no"));
    assertThrows(InferenceException.class, () -> OpenAiInferenceClient.parse(null));
  }

  @Test
  void systemPromptCarriesSchemaAndInstructions() {
    AnalysisContext context =
        new AnalysisContext(
            "invoice",
            JacksonUtility.readTree("{\"type\":\"object\"}"),
            "Dates as ISO-8601",
            null);
    String prompt = Prompts.system(context);
    assertTrue(prompt.contains("(invoice)"));
    assertTrue(prompt.contains("\"type\":\"object\""));
    assertTrue(prompt.endsWith("Dates as ISO-8601"));
  }
}

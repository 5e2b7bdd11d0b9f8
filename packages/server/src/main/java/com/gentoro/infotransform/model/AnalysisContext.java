package com.gentoro.infotransform.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Extraction parameters shared by every item of a submission.
 *
 * @param schemaKey caller-chosen name of the target structure, used for logging and caching
 * @param schema JSON description of the fields to extract
 * @param instructions optional free-form guidance appended to the prompt
 * @param model model id; {@code null} selects the configured default
 */
public record AnalysisContext(
    String schemaKey, JsonNode schema, String instructions, String model) {
  public AnalysisContext {
    Objects.requireNonNull(schema, "schema");
    if (schemaKey == null || schemaKey.isBlank()) schemaKey = "custom";
    if (instructions == null) instructions = "";
  }
}

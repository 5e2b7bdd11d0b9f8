package com.gentoro.infotransform.model;

import com.gentoro.infotransform.utility.JacksonUtility;

/** Prompt text for structured extraction. */
final class Prompts {
  private Prompts() {}

  static String system(AnalysisContext context) {
    StringBuilder sb = new StringBuilder();
    sb.append("You extract structured data from documents.\n")
        .append("Respond with a single JSON object and nothing else.\n")
        .append("The object must follow this schema (")
        .append(context.schemaKey())
        .append("):\n")
        .append(JacksonUtility.toJson(context.schema()))
        .append('\n')
        .append("Use null for fields the document does not contain.");
    if (!context.instructions().isBlank()) {
      sb.append("\n\nAdditional instructions:\n").append(context.instructions());
    }
    return sb.toString();
  }

  /** Remove a surrounding markdown code fence, if any. */
  static String stripFences(String content) {
    if (content == null) return "";
    String text = content.trim();
    if (text.startsWith("```")) {
      int firstNewline = text.indexOf('\n');
      int lastFence = text.lastIndexOf("```");
      if (firstNewline > 0 && lastFence > firstNewline) {
        text = text.substring(firstNewline + 1, lastFence).trim();
      }
    }
    return text;
  }
}

package com.flamingo.ai.extraction.agent.dto;

import java.util.List;
import java.util.Map;

/** One field value reported by FieldExtractionAgent. Which value slot is used depends on type. */
public record ExtractedValue(
    String field,
    String value, // scalar fields
    List<String> values, // list fields
    Map<String, String> properties, // structured fields
    Double confidence, // 0.0 to 1.0 as reported by the model
    String evidence // verbatim supporting quote
    ) {}

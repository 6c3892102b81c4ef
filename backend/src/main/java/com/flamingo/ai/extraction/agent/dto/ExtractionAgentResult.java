package com.flamingo.ai.extraction.agent.dto;

import java.util.List;

/** Structured output from FieldExtractionAgent for one page range. */
public record ExtractionAgentResult(List<ExtractedValue> values) {}

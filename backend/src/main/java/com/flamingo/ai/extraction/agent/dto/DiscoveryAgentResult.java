package com.flamingo.ai.extraction.agent.dto;

import java.util.List;

/** Structured output from FieldDiscoveryAgent for one discovery pass. */
public record DiscoveryAgentResult(
    String documentType, // e.g. "invoice", "contract"
    List<DiscoveredField> fields) {}

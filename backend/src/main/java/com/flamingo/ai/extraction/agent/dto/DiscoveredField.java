package com.flamingo.ai.extraction.agent.dto;

import java.util.List;

/** A field proposed by FieldDiscoveryAgent, before normalization. */
public record DiscoveredField(
    String name,
    String type, // "scalar", "list", "structured"
    String description,
    Boolean required,
    List<DiscoveredRule> validationRules) {}

package com.flamingo.ai.extraction.agent.dto;

/** A validation rule proposed by FieldDiscoveryAgent. */
public record DiscoveredRule(String kind, String argument) {}

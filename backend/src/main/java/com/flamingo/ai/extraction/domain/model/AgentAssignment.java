package com.flamingo.ai.extraction.domain.model;

import java.util.UUID;

/**
 * Work handed to exactly one extraction agent: its page range plus the frozen schema.
 *
 * @param documentId document being extracted
 * @param agentId agent identifier, unique within a run ("agent-1" ... "agent-K")
 * @param pageRange pages this agent exclusively owns for the run
 * @param schema read-only field specifications
 */
public record AgentAssignment(
    UUID documentId, String agentId, PageRange pageRange, FieldSchema schema) {}

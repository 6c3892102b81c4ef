package com.flamingo.ai.extraction.service.persistence;

import com.flamingo.ai.extraction.domain.model.ConsolidatedRecord;

/**
 * A consolidated record together with the version the sink assigned to it.
 *
 * @param version 1-based version, increasing with every run of the same document
 * @param record the immutable record
 */
public record StoredRecord(int version, ConsolidatedRecord record) {}

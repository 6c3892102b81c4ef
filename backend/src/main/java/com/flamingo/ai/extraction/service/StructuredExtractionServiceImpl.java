package com.flamingo.ai.extraction.service;

import com.flamingo.ai.extraction.domain.model.ConsolidatedRecord;
import com.flamingo.ai.extraction.domain.model.FieldSchema;
import com.flamingo.ai.extraction.domain.model.ScalingPlan;
import com.flamingo.ai.extraction.exception.ExtractionEscalatedException;
import com.flamingo.ai.extraction.exception.RecordNotFoundException;
import com.flamingo.ai.extraction.service.agent.ExtractionAgentPool;
import com.flamingo.ai.extraction.service.agent.ExtractionRun;
import com.flamingo.ai.extraction.service.consolidation.Consolidator;
import com.flamingo.ai.extraction.service.discovery.DiscoveryCoordinator;
import com.flamingo.ai.extraction.service.document.DocumentAccessor;
import com.flamingo.ai.extraction.service.persistence.RecordSink;
import com.flamingo.ai.extraction.service.persistence.StoredRecord;
import com.flamingo.ai.extraction.service.scaling.ScalingPlanner;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link StructuredExtractionService}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructuredExtractionServiceImpl implements StructuredExtractionService {

  private final DocumentAccessor documentAccessor;
  private final DiscoveryCoordinator discoveryCoordinator;
  private final ScalingPlanner scalingPlanner;
  private final ExtractionAgentPool agentPool;
  private final Consolidator consolidator;
  private final RecordSink recordSink;
  private final MeterRegistry meterRegistry;

  @Override
  public FieldSchema discoverFields(UUID documentId) {
    return discoveryCoordinator.discoverFields(documentId);
  }

  @Override
  @Timed(
      value = "extraction.run",
      extraTags = {"schema", "provided"},
      description = "Time to extract and persist one document")
  public StoredRecord extractStructured(UUID documentId, FieldSchema schema) {
    return runExtraction(documentId, schema);
  }

  @Override
  @Timed(
      value = "extraction.run",
      extraTags = {"schema", "discovered"},
      description = "Time to extract and persist one document")
  public StoredRecord discoverAndExtract(UUID documentId) {
    return runExtraction(documentId, discoverFields(documentId));
  }

  private StoredRecord runExtraction(UUID documentId, FieldSchema schema) {
    if (schema == null || schema.isEmpty()) {
      throw new IllegalArgumentException("Field schema must contain at least one field");
    }
    if (schema.documentId() != null && !schema.documentId().equals(documentId)) {
      throw new IllegalArgumentException(
          "Schema belongs to document " + schema.documentId() + ", not " + documentId);
    }

    UUID runId = UUID.randomUUID();
    int pageCount = documentAccessor.getPageCount(documentId);
    ScalingPlan plan = scalingPlanner.plan(documentId, pageCount, schema);

    log.info(
        "Extraction run {} for document {}: {} fields, {} agents",
        runId,
        documentId,
        schema.fields().size(),
        plan.agentCount());

    ExtractionRun run = agentPool.run(plan);
    if (run.allFailed()) {
      meterRegistry.counter("extraction.runs", "outcome", "escalated").increment();
      log.error(
          "Extraction run {} for document {} escalated: all {} agents failed",
          runId,
          documentId,
          run.outcomes().size());
      throw new ExtractionEscalatedException(documentId, run.outcomes());
    }

    ConsolidatedRecord record = consolidator.consolidate(runId, schema, run);
    StoredRecord stored = recordSink.write(documentId, record);

    meterRegistry
        .counter("extraction.runs", "outcome", record.isDegraded() ? "degraded" : "completed")
        .increment();
    log.info(
        "Extraction run {} for document {} stored as version {} ({} of {} agents completed)",
        runId,
        documentId,
        stored.version(),
        run.succeededCount(),
        run.outcomes().size());
    return stored;
  }

  @Override
  public StoredRecord getLatestRecord(UUID documentId) {
    return recordSink
        .findLatest(documentId)
        .orElseThrow(() -> new RecordNotFoundException(documentId));
  }
}

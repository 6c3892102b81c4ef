package com.flamingo.ai.extraction.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.extraction.domain.entity.ExtractionRecord;
import com.flamingo.ai.extraction.domain.model.ConsolidatedRecord;
import com.flamingo.ai.extraction.domain.model.RecordFlag;
import com.flamingo.ai.extraction.domain.repository.ExtractionRecordRepository;
import com.flamingo.ai.extraction.exception.PersistenceFailureException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link RecordSink} storing each record version as a JSON payload row in SQLite via JPA. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaRecordSink implements RecordSink {

  private final ExtractionRecordRepository repository;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public StoredRecord write(UUID documentId, ConsolidatedRecord record) {
    if (!documentId.equals(record.documentId())) {
      throw new IllegalArgumentException(
          "Record of document " + record.documentId() + " cannot be stored under " + documentId);
    }

    try {
      if (repository.existsByRunId(record.runId())) {
        throw new PersistenceFailureException(
            documentId, record.runId(), "Run " + record.runId() + " was already persisted", null);
      }

      int version = repository.findMaxVersion(documentId) + 1;
      ExtractionRecord entity =
          ExtractionRecord.builder()
              .documentId(documentId)
              .version(version)
              .runId(record.runId())
              .documentType(record.documentType())
              .flags(
                  record.flags().stream()
                      .map(RecordFlag::name)
                      .sorted()
                      .collect(Collectors.joining(",")))
              .fieldCount(record.fields().size())
              .completedFraction(record.completedFraction())
              .payload(objectMapper.writeValueAsString(record))
              .build();
      repository.saveAndFlush(entity);

      meterRegistry.counter("extraction.records.persisted").increment();
      log.info("Persisted extraction record v{} for document {}", version, documentId);
      return new StoredRecord(version, record);

    } catch (JsonProcessingException e) {
      meterRegistry.counter("extraction.records.persist_failed").increment();
      throw new PersistenceFailureException(
          documentId, record.runId(), "Failed to serialize record: " + e.getMessage(), e);
    } catch (DataAccessException e) {
      meterRegistry.counter("extraction.records.persist_failed").increment();
      throw new PersistenceFailureException(
          documentId, record.runId(), "Failed to store record: " + e.getMessage(), e);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<StoredRecord> findLatest(UUID documentId) {
    return repository.findFirstByDocumentIdOrderByVersionDesc(documentId).map(this::toStored);
  }

  private StoredRecord toStored(ExtractionRecord entity) {
    try {
      return new StoredRecord(
          entity.getVersion(),
          objectMapper.readValue(entity.getPayload(), ConsolidatedRecord.class));
    } catch (JsonProcessingException e) {
      throw new PersistenceFailureException(
          entity.getDocumentId(),
          entity.getRunId(),
          "Stored record v" + entity.getVersion() + " is unreadable: " + e.getMessage(),
          e);
    }
  }
}

package com.flamingo.ai.extraction.api.dto.response;

import com.flamingo.ai.extraction.domain.model.AgentRunSummary;
import com.flamingo.ai.extraction.domain.model.ConsolidatedField;
import com.flamingo.ai.extraction.domain.model.ConsolidatedRecord;
import com.flamingo.ai.extraction.domain.model.RecordFlag;
import com.flamingo.ai.extraction.service.persistence.StoredRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a persisted extraction record. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRecordResponse {

  private UUID documentId;
  private UUID runId;
  private Integer version;
  private String documentType;
  private Set<RecordFlag> flags;
  private Double completedFraction;
  private Map<String, ConsolidatedField> fields;
  private List<AgentRunSummary> agentRuns;
  private List<String> warnings;
  private Instant createdAt;

  /** Creates an ExtractionRecordResponse from a stored record. */
  public static ExtractionRecordResponse fromStored(StoredRecord stored) {
    ConsolidatedRecord record = stored.record();
    return ExtractionRecordResponse.builder()
        .documentId(record.documentId())
        .runId(record.runId())
        .version(stored.version())
        .documentType(record.documentType())
        .flags(record.flags())
        .completedFraction(record.completedFraction())
        .fields(record.fields())
        .agentRuns(record.agentRuns())
        .warnings(record.warnings())
        .createdAt(record.createdAt())
        .build();
  }
}

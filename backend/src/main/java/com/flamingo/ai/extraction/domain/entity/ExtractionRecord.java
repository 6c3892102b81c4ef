package com.flamingo.ai.extraction.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One persisted version of a document's consolidated extraction record. Rows are written once and
 * never updated; reprocessing a document inserts the next version.
 */
@Entity
@Table(
    name = "extraction_records",
    uniqueConstraints = @UniqueConstraint(columnNames = {"document_id", "version"}))
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractionRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "document_id", nullable = false)
  private UUID documentId;

  @Column(nullable = false)
  private Integer version;

  @Column(nullable = false, unique = true)
  private UUID runId;

  @Column(nullable = false)
  private String documentType;

  /** Comma-separated record flags, e.g. "PARTIAL,LOW_CONFIDENCE". */
  private String flags;

  private Integer fieldCount;

  private Double completedFraction;

  /** The full consolidated record serialized as JSON. */
  @Column(nullable = false, columnDefinition = "TEXT")
  private String payload;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}

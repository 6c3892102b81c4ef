package com.flamingo.ai.extraction.api.dto.response;

import com.flamingo.ai.extraction.service.document.StoredDocument;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an uploaded document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String fileName;
  private Long fileSize;
  private Integer pageCount;

  /** Creates a DocumentResponse from a stored document. */
  public static DocumentResponse fromStored(StoredDocument document) {
    return DocumentResponse.builder()
        .id(document.documentId())
        .fileName(document.fileName())
        .fileSize(document.fileSize())
        .pageCount(document.pageCount())
        .build();
  }
}

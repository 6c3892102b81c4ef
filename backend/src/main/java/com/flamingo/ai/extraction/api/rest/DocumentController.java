package com.flamingo.ai.extraction.api.rest;

import com.flamingo.ai.extraction.api.dto.response.DocumentResponse;
import com.flamingo.ai.extraction.exception.DocumentReadException;
import com.flamingo.ai.extraction.service.document.PdfDocumentStore;
import com.flamingo.ai.extraction.service.document.StoredDocument;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for document upload. */
@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final PdfDocumentStore documentStore;

  /** Uploads a PDF document. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> uploadDocument(
      @RequestParam("file") MultipartFile file) {
    byte[] content;
    try {
      content = file.getBytes();
    } catch (IOException e) {
      throw new DocumentReadException(null, "Failed to read upload: " + e.getMessage(), e);
    }
    StoredDocument document = documentStore.store(file.getOriginalFilename(), content);
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromStored(document));
  }
}

package com.flamingo.ai.extraction.service.document;

import com.flamingo.ai.extraction.config.ExtractionConfig;
import com.flamingo.ai.extraction.exception.DocumentNotFoundException;
import com.flamingo.ai.extraction.exception.DocumentReadException;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentAccessor} over PDF files stored under {@code extraction.documents.base-path}, one
 * file per document id.
 *
 * <p>Page texts are extracted with Apache PDFBox 3.x the first time a document is read and kept in
 * memory until {@link #evict(UUID)}; repeated reads return identical text.
 */
@Service
@Slf4j
public class PdfDocumentStore implements DocumentAccessor {

  private static final String PDF_SUFFIX = ".pdf";

  private final Path basePath;
  private final long maxFileSizeBytes;
  private final MeterRegistry meterRegistry;
  private final Map<UUID, List<String>> pageCache = new ConcurrentHashMap<>();

  public PdfDocumentStore(ExtractionConfig config, MeterRegistry meterRegistry) {
    this.basePath = Paths.get(config.getDocuments().getBasePath());
    this.maxFileSizeBytes = config.getDocuments().getMaxFileSizeBytes();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Validates and stores an uploaded PDF under a new document id.
   *
   * @param fileName original file name, informational only
   * @param content PDF bytes
   * @return identity and page count of the stored document
   */
  public StoredDocument store(String fileName, byte[] content) {
    if (content == null || content.length == 0) {
      throw new IllegalArgumentException("Uploaded file is empty");
    }
    if (content.length > maxFileSizeBytes) {
      throw new IllegalArgumentException(
          String.format(
              "File size %d exceeds the limit of %d bytes", content.length, maxFileSizeBytes));
    }

    UUID documentId = UUID.randomUUID();
    List<String> pages = extractPages(documentId, content);

    try {
      Files.createDirectories(basePath);
      Files.write(pathFor(documentId), content);
    } catch (IOException e) {
      throw new DocumentReadException(documentId, "Failed to store document: " + e.getMessage(), e);
    }

    pageCache.put(documentId, pages);
    meterRegistry.counter("document.stored").increment();
    log.info(
        "Stored document {} as {} ({} pages, {} bytes)",
        fileName,
        documentId,
        pages.size(),
        content.length);
    return new StoredDocument(documentId, fileName, content.length, pages.size());
  }

  @Override
  public int getPageCount(UUID documentId) {
    return pages(documentId).size();
  }

  @Override
  public String getPage(UUID documentId, int pageNumber) {
    List<String> pages = pages(documentId);
    if (pageNumber < 1 || pageNumber > pages.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Page %d out of range for document %s with %d pages",
              pageNumber, documentId, pages.size()));
    }
    return pages.get(pageNumber - 1);
  }

  /** Drops the cached page texts of a document. */
  public void evict(UUID documentId) {
    pageCache.remove(documentId);
  }

  private List<String> pages(UUID documentId) {
    return pageCache.computeIfAbsent(documentId, this::loadPages);
  }

  private List<String> loadPages(UUID documentId) {
    Path path = pathFor(documentId);
    if (!Files.isRegularFile(path)) {
      throw new DocumentNotFoundException(documentId);
    }
    try {
      return extractPages(documentId, Files.readAllBytes(path));
    } catch (IOException e) {
      throw new DocumentReadException(documentId, "Failed to read document: " + e.getMessage(), e);
    }
  }

  private List<String> extractPages(UUID documentId, byte[] content) {
    try (PDDocument pdfDoc = Loader.loadPDF(content)) {
      int pageCount = pdfDoc.getNumberOfPages();
      PDFTextStripper stripper = new PDFTextStripper();
      List<String> pages = new ArrayList<>(pageCount);
      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        pages.add(stripper.getText(pdfDoc).strip());
      }
      log.debug("Extracted text of {} pages for document {}", pageCount, documentId);
      return List.copyOf(pages);
    } catch (IOException e) {
      log.error("PDFBox parsing failed for document {}: {}", documentId, e.getMessage());
      throw new DocumentReadException(documentId, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  private Path pathFor(UUID documentId) {
    return basePath.resolve(documentId + PDF_SUFFIX);
  }
}

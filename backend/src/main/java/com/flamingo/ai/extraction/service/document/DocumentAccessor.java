package com.flamingo.ai.extraction.service.document;

import java.util.UUID;

/**
 * Page-level read access to a parsed document. Implementations must be idempotent and free of side
 * effects: the engine reads the same page from several threads and across retries.
 */
public interface DocumentAccessor {

  /**
   * Returns the number of pages of a document.
   *
   * @param documentId the document
   * @return page count; zero for a document without pages
   * @throws com.flamingo.ai.extraction.exception.DocumentNotFoundException if the document is
   *     unknown
   */
  int getPageCount(UUID documentId);

  /**
   * Returns the text content of one page.
   *
   * @param documentId the document
   * @param pageNumber 1-indexed page number
   * @return page text, possibly empty
   */
  String getPage(UUID documentId, int pageNumber);
}

package com.flamingo.ai.extraction.service.document;

import java.util.UUID;

/** Result of storing an uploaded document. */
public record StoredDocument(UUID documentId, String fileName, long fileSize, int pageCount) {}

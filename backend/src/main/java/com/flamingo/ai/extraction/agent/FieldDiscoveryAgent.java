package com.flamingo.ai.extraction.agent;

import com.flamingo.ai.extraction.agent.dto.DiscoveryAgentResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that proposes the extractable fields of a document from a sample of its pages.
 *
 * <p>Used both standalone (short documents) and as one pass of a sequential chain, in which case
 * the fields found by the earlier passes are supplied and must be confirmed or refined.
 */
public interface FieldDiscoveryAgent {

  @SystemMessage(
      """
        You are a document schema analyst. From sampled pages of a document you identify the
        structured fields worth extracting from the whole document.

        For each field return:
        - "name": short snake_case identifier
        - "type": "scalar" (single value), "list" (repeated values) or "structured"
          (a group of named sub-values)
        - "description": what the field holds and how to recognize it
        - "required": true when every document of this type must contain it
        - "validationRules": optional constraints, each {"kind": "...", "argument": "..."}
          with kind one of NOT_BLANK, MIN_LENGTH, MAX_LENGTH, PATTERN, NUMERIC, ONE_OF

        When previously discovered fields are given:
        - repeat each one you still consider valid, refining its type or description if the new
          pages show more about it
        - add fields that are new in these pages
        - do not rename previously discovered fields

        Return ONLY valid JSON matching this structure:
        {"documentType": "...", "fields": [{"name": "...", "type": "...", "description": "...",
         "required": false, "validationRules": []}]}
        """)
  @UserMessage(
      """
        Discovery pass {{passNumber}} of {{passCount}} for a document of {{pageCount}} pages.
        Document type so far: {{documentType}}

        Previously discovered fields:
        {{previousFields}}

        Sampled pages:
        {{pages}}
        """)
  DiscoveryAgentResult discover(
      @V("passNumber") int passNumber,
      @V("passCount") int passCount,
      @V("pageCount") int pageCount,
      @V("documentType") String documentType,
      @V("previousFields") String previousFields,
      @V("pages") String pages);
}

package com.flamingo.ai.extraction.agent;

import com.flamingo.ai.extraction.agent.dto.ExtractionAgentResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that fills in field values from one contiguous range of pages. */
public interface FieldExtractionAgent {

  @SystemMessage(
      """
        You are a precise structured-data extraction assistant. You receive a list of fields and
        the text of a range of pages. Extract values ONLY from the given pages.

        Rules:
        - Omit fields that do not appear in these pages. Never guess.
        - "scalar" fields: put the value in "value"
        - "list" fields: put every occurrence in "values"
        - "structured" fields: put named sub-values in "properties"
        - "confidence": 1.0 when the value is stated literally, 0.6-0.9 when it is paraphrased or
          inferred from context, below 0.5 when uncertain
        - "evidence": the shortest verbatim quote from the pages that supports the value

        Return ONLY valid JSON matching this structure:
        {"values": [{"field": "...", "value": "...", "values": [], "properties": {},
         "confidence": 0.0, "evidence": "..."}]}
        """)
  @UserMessage(
      """
        Pages {{startPage}} to {{endPage}}.

        Fields:
        {{fields}}

        Page text:
        {{pages}}
        """)
  ExtractionAgentResult extract(
      @V("startPage") int startPage,
      @V("endPage") int endPage,
      @V("fields") String fields,
      @V("pages") String pages);
}

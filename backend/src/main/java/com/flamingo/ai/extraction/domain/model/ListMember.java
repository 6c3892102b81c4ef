package com.flamingo.ai.extraction.domain.model;

import java.util.List;

/**
 * One distinct value of a consolidated list field.
 *
 * @param value the member value
 * @param confidence best confidence any agent reported for this member
 * @param agents agents that reported it, sorted
 */
public record ListMember(Object value, double confidence, List<String> agents) {

  public ListMember {
    agents = List.copyOf(agents);
  }
}

package com.flamingo.ai.extraction.service.discovery;

import com.flamingo.ai.extraction.domain.model.FieldSpecification;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Context carried from one discovery pass to the next: the document type and the cumulative field
 * set. Immutable; {@link #merge} returns the next state of the fold.
 *
 * @param documentType best document type so far, null before the first pass
 * @param fields cumulative fields in order of first discovery
 * @param sampledPages every page read so far, in pass order
 */
record DiscoveryState(
    String documentType, List<FieldSpecification> fields, List<Integer> sampledPages) {

  DiscoveryState {
    fields = List.copyOf(fields);
    sampledPages = List.copyOf(sampledPages);
  }

  static DiscoveryState initial() {
    return new DiscoveryState(null, List.of(), List.of());
  }

  /**
   * Folds the output of one pass into this state. A field whose normalized name already exists is
   * refined: a non-blank description and non-empty rules replace the earlier ones, and
   * {@code required} is kept once any pass asserted it. The type is replaced only when the pass
   * named it explicitly, so the latest explicit type wins, scalar included. New names are appended.
   *
   * @param explicitlyTyped normalized names whose type label this pass recognized
   */
  DiscoveryState merge(
      String passDocumentType,
      List<FieldSpecification> passFields,
      Set<String> explicitlyTyped,
      List<Integer> pages) {
    Map<String, FieldSpecification> merged = new LinkedHashMap<>();
    for (FieldSpecification field : fields) {
      merged.put(field.name(), field);
    }
    for (FieldSpecification field : passFields) {
      boolean typed = explicitlyTyped.contains(field.name());
      merged.merge(field.name(), field, (existing, update) -> refine(existing, update, typed));
    }

    List<Integer> allPages = new ArrayList<>(sampledPages);
    allPages.addAll(pages);

    String type =
        passDocumentType != null && !passDocumentType.isBlank()
            ? passDocumentType.trim()
            : documentType;
    return new DiscoveryState(type, new ArrayList<>(merged.values()), allPages);
  }

  private static FieldSpecification refine(
      FieldSpecification existing, FieldSpecification update, boolean typed) {
    return new FieldSpecification(
        existing.name(),
        typed ? update.type() : existing.type(),
        update.description().isBlank() ? existing.description() : update.description(),
        update.validationRules().isEmpty() ? existing.validationRules() : update.validationRules(),
        existing.required() || update.required());
  }
}

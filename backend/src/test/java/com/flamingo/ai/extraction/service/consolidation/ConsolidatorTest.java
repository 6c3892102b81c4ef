package com.flamingo.ai.extraction.service.consolidation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.extraction.config.ExtractionConfig;
import com.flamingo.ai.extraction.domain.model.AgentOutcome;
import com.flamingo.ai.extraction.domain.model.AgentRunSummary;
import com.flamingo.ai.extraction.domain.model.AgentStatus;
import com.flamingo.ai.extraction.domain.model.ConsolidatedField;
import com.flamingo.ai.extraction.domain.model.ConsolidatedRecord;
import com.flamingo.ai.extraction.domain.model.DiscoveryMethod;
import com.flamingo.ai.extraction.domain.model.FieldExtraction;
import com.flamingo.ai.extraction.domain.model.FieldFlag;
import com.flamingo.ai.extraction.domain.model.FieldSchema;
import com.flamingo.ai.extraction.domain.model.FieldSpecification;
import com.flamingo.ai.extraction.domain.model.FieldType;
import com.flamingo.ai.extraction.domain.model.ListMember;
import com.flamingo.ai.extraction.domain.model.PageRange;
import com.flamingo.ai.extraction.domain.model.RecordFlag;
import com.flamingo.ai.extraction.domain.model.ValidationRule;
import com.flamingo.ai.extraction.service.agent.ExtractionRun;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Consolidator Tests")
class ConsolidatorTest {

  private final UUID documentId = UUID.randomUUID();
  private final UUID runId = UUID.randomUUID();
  private Consolidator consolidator;
  private FieldSchema schema;

  @BeforeEach
  void setUp() {
    consolidator =
        new Consolidator(new ExtractionConfig(), new FieldValidator(), new SimpleMeterRegistry());
    schema =
        new FieldSchema(
            documentId,
            "invoice",
            DiscoveryMethod.SEQUENTIAL_CHAIN,
            List.of(
                FieldSpecification.scalar("total_value", "Invoice total", true),
                FieldSpecification.list("line_items", "Billed items", false),
                new FieldSpecification(
                    "billing_address", FieldType.STRUCTURED, "Address", List.of(), false),
                new FieldSpecification(
                    "invoice_number",
                    FieldType.SCALAR,
                    "Number",
                    List.of(ValidationRule.of(ValidationRule.Kind.NUMERIC)),
                    true),
                FieldSpecification.scalar("notes", "Free text", false)),
            List.of());
  }

  private static PageRange range(int agentNumber) {
    return new PageRange((agentNumber - 1) * 12 + 1, agentNumber * 12);
  }

  private static String agent(int agentNumber) {
    return "agent-" + agentNumber;
  }

  private static FieldExtraction extraction(
      String field, Object value, double confidence, int agentNumber) {
    return new FieldExtraction(field, value, confidence, range(agentNumber), agent(agentNumber));
  }

  private static AgentOutcome succeeded(int agentNumber, FieldExtraction... extractions) {
    return new AgentOutcome(
        agent(agentNumber),
        range(agentNumber),
        AgentStatus.SUCCEEDED,
        Arrays.asList(extractions),
        null,
        Duration.ofMillis(10));
  }

  private static AgentOutcome failed(int agentNumber) {
    return new AgentOutcome(
        agent(agentNumber),
        range(agentNumber),
        AgentStatus.FAILED,
        List.of(),
        "boom",
        Duration.ofMillis(10));
  }

  private ConsolidatedRecord consolidate(AgentOutcome... outcomes) {
    return consolidator.consolidate(runId, schema, new ExtractionRun(List.of(outcomes), false));
  }

  @Nested
  @DisplayName("Scalar conflicts")
  class ScalarConflicts {

    @Test
    @DisplayName("Higher confidence should win and the loser kept as discarded provenance")
    void shouldPreferHigherConfidence() {
      ConsolidatedRecord record =
          consolidate(
              succeeded(3, extraction("total_value", "1,250.00", 0.92, 3)),
              succeeded(7, extraction("total_value", "1,205.00", 0.65, 7)));

      ConsolidatedField total = record.field("total_value").orElseThrow();
      assertThat(total.value()).isEqualTo("1,250.00");
      assertThat(total.confidence()).isEqualTo(0.92);
      assertThat(total.contributingAgents()).containsExactly("agent-3");
      assertThat(total.discarded()).extracting(FieldExtraction::extractedByAgent)
          .containsExactly("agent-7");
      assertThat(total.hasFlag(FieldFlag.CONFLICT_RESOLVED)).isTrue();
    }

    @Test
    @DisplayName("Exact ties should go to the earliest page range")
    void shouldBreakTiesByEarliestPage() {
      ConsolidatedRecord record =
          consolidate(
              succeeded(4, extraction("total_value", "later", 0.9, 4)),
              succeeded(2, extraction("total_value", "earlier", 0.9, 2)));

      assertThat(record.field("total_value").orElseThrow().value()).isEqualTo("earlier");
    }

    @Test
    @DisplayName("Agreeing agents should all contribute without a conflict")
    void shouldMergeAgreeingValues() {
      ConsolidatedRecord record =
          consolidate(
              succeeded(1, extraction("total_value", "1,250.00", 0.7, 1)),
              succeeded(2, extraction("total_value", " 1,250.00 ", 0.9, 2)));

      ConsolidatedField total = record.field("total_value").orElseThrow();
      assertThat(total.contributingAgents()).containsExactly("agent-1", "agent-2");
      assertThat(total.confidence()).isEqualTo(0.9);
      assertThat(total.discarded()).isEmpty();
      assertThat(total.hasFlag(FieldFlag.CONFLICT_RESOLVED)).isFalse();
    }

    @Test
    @DisplayName("Structured fields should resolve like scalars")
    void shouldResolveStructuredLikeScalar() {
      ConsolidatedRecord record =
          consolidate(
              succeeded(1, extraction("billing_address", Map.of("city", "Lyon"), 0.6, 1)),
              succeeded(2, extraction("billing_address", Map.of("city", "Paris"), 0.8, 2)));

      ConsolidatedField address = record.field("billing_address").orElseThrow();
      assertThat(address.value()).isEqualTo(Map.of("city", "Paris"));
      assertThat(address.discarded()).hasSize(1);
    }
  }

  @Nested
  @DisplayName("List fields")
  class ListFields {

    @Test
    @DisplayName("Should union distinct members keeping each member's best confidence")
    void shouldUnionMembers() {
      ConsolidatedRecord record =
          consolidate(
              succeeded(1, extraction("line_items", List.of("Widget", "Gadget"), 0.6, 1)),
              succeeded(2, extraction("line_items", List.of(" Gadget ", "Sprocket"), 0.9, 2)));

      ConsolidatedField items = record.field("line_items").orElseThrow();
      assertThat(items.value()).isEqualTo(List.of("Widget", "Gadget", "Sprocket"));
      assertThat(items.confidence()).isEqualTo(0.9);
      assertThat(items.contributingAgents()).containsExactly("agent-1", "agent-2");

      ListMember gadget = items.members().get(1);
      assertThat(gadget.value()).isEqualTo("Gadget");
      assertThat(gadget.confidence()).isEqualTo(0.9);
      assertThat(gadget.agents()).containsExactly("agent-1", "agent-2");
      assertThat(items.members().get(0).confidence()).isEqualTo(0.6);
    }
  }

  @Nested
  @DisplayName("Flags")
  class Flags {

    @Test
    @DisplayName("Missing required fields should be flagged, optional ones omitted")
    void shouldFlagMissingRequired() {
      ConsolidatedRecord record =
          consolidate(succeeded(1, extraction("total_value", "10", 0.9, 1)));

      ConsolidatedField number = record.field("invoice_number").orElseThrow();
      assertThat(number.isMissing()).isTrue();
      assertThat(number.value()).isNull();
      assertThat(record.field("notes")).isEmpty();
      assertThat(record.hasFlag(RecordFlag.MISSING_REQUIRED)).isTrue();
    }

    @Test
    @DisplayName("Low-confidence values should be flagged but kept")
    void shouldFlagLowConfidence() {
      ConsolidatedRecord record =
          consolidate(succeeded(1, extraction("notes", "net 30", 0.4, 1)));

      ConsolidatedField notes = record.field("notes").orElseThrow();
      assertThat(notes.value()).isEqualTo("net 30");
      assertThat(notes.hasFlag(FieldFlag.LOW_CONFIDENCE)).isTrue();
      assertThat(record.hasFlag(RecordFlag.LOW_CONFIDENCE)).isTrue();
    }

    @Test
    @DisplayName("Validation failures should be flagged but never discard the value")
    void shouldFlagValidationFailure() {
      ConsolidatedRecord record =
          consolidate(succeeded(1, extraction("invoice_number", "INV-A", 0.9, 1)));

      ConsolidatedField number = record.field("invoice_number").orElseThrow();
      assertThat(number.value()).isEqualTo("INV-A");
      assertThat(number.violations()).hasSize(1);
      assertThat(number.hasFlag(FieldFlag.VALIDATION_FAILED)).isTrue();
      assertThat(record.hasFlag(RecordFlag.VALIDATION_FAILED)).isTrue();
    }

    @Test
    @DisplayName("Should mark the record degraded when too few agents completed")
    void shouldMarkDegraded() {
      ConsolidatedRecord record =
          consolidate(
              succeeded(1, extraction("total_value", "10", 0.9, 1)),
              succeeded(2),
              failed(3),
              failed(4),
              failed(5));

      assertThat(record.completedFraction()).isEqualTo(0.4);
      assertThat(record.isDegraded()).isTrue();
      assertThat(record.field("total_value").orElseThrow().value()).isEqualTo("10");
    }

    @Test
    @DisplayName("Should not mark the record degraded at the threshold")
    void shouldNotMarkDegraded_atThreshold() {
      ConsolidatedRecord record =
          consolidate(succeeded(1, extraction("total_value", "10", 0.9, 1)), failed(2));

      assertThat(record.isDegraded()).isFalse();
    }

    @Test
    @DisplayName("Should mark the record partial when the document deadline cancelled agents")
    void shouldMarkPartial() {
      ExtractionRun run =
          new ExtractionRun(
              List.of(
                  succeeded(1, extraction("total_value", "10", 0.9, 1)),
                  new AgentOutcome(
                      agent(2), range(2), AgentStatus.CANCELLED, List.of(), "deadline", null)),
              true);

      ConsolidatedRecord record = consolidator.consolidate(runId, schema, run);

      assertThat(record.isPartial()).isTrue();
      assertThat(record.agentRuns()).extracting(AgentRunSummary::status)
          .containsExactly(AgentStatus.SUCCEEDED, AgentStatus.CANCELLED);
    }
  }

  @Nested
  @DisplayName("Determinism")
  class Determinism {

    @Test
    @DisplayName("Completion order should not change the record")
    void shouldBeIndependentOfCompletionOrder() {
      List<AgentOutcome> outcomes =
          new ArrayList<>(
              List.of(
                  succeeded(
                      1,
                      extraction("total_value", "A", 0.8, 1),
                      extraction("line_items", List.of("x", "y"), 0.7, 1)),
                  succeeded(
                      2,
                      extraction("total_value", "B", 0.8, 2),
                      extraction("line_items", List.of("y", "z"), 0.9, 2)),
                  succeeded(3, extraction("notes", "n", 0.55, 3)),
                  failed(4)));

      ConsolidatedRecord forward =
          consolidator.consolidate(runId, schema, new ExtractionRun(outcomes, false));
      Collections.reverse(outcomes);
      ConsolidatedRecord reversed =
          consolidator.consolidate(runId, schema, new ExtractionRun(outcomes, false));

      assertThat(reversed.fields()).isEqualTo(forward.fields());
      assertThat(reversed.flags()).isEqualTo(forward.flags());
      assertThat(reversed.agentRuns()).isEqualTo(forward.agentRuns());
    }

    @Test
    @DisplayName("Every field extracted above the threshold should appear in the record")
    void shouldNeverDropAboveThresholdFields() {
      ConsolidatedRecord record =
          consolidate(
              succeeded(
                  1,
                  extraction("total_value", "10", 0.51, 1),
                  extraction("notes", "n", 0.99, 1),
                  extraction("unknown_field", "x", 0.99, 1)),
              succeeded(2, extraction("line_items", List.of("a"), 0.75, 2)));

      assertThat(record.fields().keySet())
          .contains("total_value", "notes", "line_items")
          .doesNotContain("unknown_field");
      assertThat(record.fields().values())
          .filteredOn(f -> !f.isMissing())
          .allMatch(f -> f.value() != null);
    }
  }
}

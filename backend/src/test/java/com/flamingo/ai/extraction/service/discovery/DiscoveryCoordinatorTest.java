package com.flamingo.ai.extraction.service.discovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.extraction.agent.FieldDiscoveryAgent;
import com.flamingo.ai.extraction.agent.dto.DiscoveredField;
import com.flamingo.ai.extraction.agent.dto.DiscoveredRule;
import com.flamingo.ai.extraction.agent.dto.DiscoveryAgentResult;
import com.flamingo.ai.extraction.config.ExtractionConfig;
import com.flamingo.ai.extraction.config.ResilienceConfig;
import com.flamingo.ai.extraction.domain.model.DiscoveryMethod;
import com.flamingo.ai.extraction.domain.model.FieldSchema;
import com.flamingo.ai.extraction.domain.model.FieldSpecification;
import com.flamingo.ai.extraction.domain.model.FieldType;
import com.flamingo.ai.extraction.domain.model.ValidationRule;
import com.flamingo.ai.extraction.exception.DiscoveryLowConfidenceException;
import com.flamingo.ai.extraction.exception.DiscoveryTimeoutException;
import com.flamingo.ai.extraction.exception.LlmServiceException;
import com.flamingo.ai.extraction.service.document.DocumentAccessor;
import dev.langchain4j.exception.RateLimitException;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("DiscoveryCoordinator Tests")
class DiscoveryCoordinatorTest {

  @Mock private DocumentAccessor documentAccessor;
  @Mock private FieldDiscoveryAgent discoveryAgent;

  private final UUID documentId = UUID.randomUUID();
  private ExtractionConfig config;
  private ThreadPoolTaskExecutor executor;
  private SimpleMeterRegistry meterRegistry;
  private DiscoveryCoordinator coordinator;

  @BeforeEach
  void setUp() {
    config = new ExtractionConfig();
    config.getDiscovery().setAgentTimeout(Duration.ofMillis(200));
    config.getDiscovery().setRetryWait(Duration.ofMillis(1));

    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.initialize();

    meterRegistry = new SimpleMeterRegistry();
    coordinator =
        new DiscoveryCoordinator(
            documentAccessor,
            discoveryAgent,
            config,
            new ResilienceConfig().discoveryRetry(RetryRegistry.ofDefaults(), config),
            executor,
            meterRegistry);

    lenient()
        .when(documentAccessor.getPage(eq(documentId), anyInt()))
        .thenAnswer(inv -> "Text of page " + inv.getArgument(1));
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  private static DiscoveryAgentResult result(String documentType, DiscoveredField... fields) {
    return new DiscoveryAgentResult(documentType, Arrays.asList(fields));
  }

  private static DiscoveredField field(String name, String description) {
    return new DiscoveredField(name, "scalar", description, false, List.of());
  }

  private void stubPass(int passNumber, DiscoveryAgentResult result) {
    when(discoveryAgent.discover(
            eq(passNumber), anyInt(), anyInt(), anyString(), anyString(), anyString()))
        .thenReturn(result);
  }

  @Nested
  @DisplayName("Branch selection")
  class BranchSelection {

    @Test
    @DisplayName("Should use a single agent over 8 pages for a 50-page document")
    void shouldUseSingleAgent_whenFiftyPages() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(50);
      stubPass(1, result("invoice", field("A", "a")));

      FieldSchema schema = coordinator.discoverFields(documentId);

      assertThat(schema.method()).isEqualTo(DiscoveryMethod.SINGLE_AGENT);
      assertThat(schema.sampledPages()).hasSize(8);
      verify(discoveryAgent, times(1))
          .discover(anyInt(), anyInt(), anyInt(), anyString(), anyString(), anyString());
      verify(discoveryAgent)
          .discover(eq(1), eq(1), eq(50), eq("unknown"), eq("(none)"), anyString());
    }

    @Test
    @DisplayName("Should use a chain of three agents over 15 pages each for a 51-page document")
    void shouldUseChain_whenFiftyOnePages() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(51);
      stubPass(1, result("invoice", field("A", "a")));
      stubPass(2, result("invoice", field("A", "a")));
      stubPass(3, result("invoice", field("A", "a")));

      FieldSchema schema = coordinator.discoverFields(documentId);

      assertThat(schema.method()).isEqualTo(DiscoveryMethod.SEQUENTIAL_CHAIN);
      assertThat(schema.sampledPages()).hasSize(45).doesNotHaveDuplicates();
      verify(discoveryAgent, times(3))
          .discover(anyInt(), eq(3), eq(51), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Should read every page of a document shorter than the sample")
    void shouldReadAllPages_whenShortDocument() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(3);
      stubPass(1, result("memo", field("A", "a")));

      assertThat(coordinator.discoverFields(documentId).sampledPages()).containsExactly(1, 2, 3);
    }
  }

  @Nested
  @DisplayName("Sequential chain")
  class SequentialChain {

    @Test
    @DisplayName("Should produce exactly {A,B,C} when later passes confirm and extend")
    void shouldAccumulateFieldsAcrossPasses() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(80);
      stubPass(1, result("invoice", field("A", "first a"), field("B", "first b")));
      stubPass(2, result("invoice", field("C", "c"), field("a", ""), field("b", "")));
      stubPass(3, result("invoice"));

      FieldSchema schema = coordinator.discoverFields(documentId);

      assertThat(schema.fieldNames()).containsExactly("a", "b", "c");
      assertThat(schema.field("A").orElseThrow().description()).isEqualTo("first a");
    }

    @Test
    @DisplayName("Each pass should receive the cumulative fields and document type")
    void shouldCarryContextToNextPass() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(80);
      stubPass(1, result("invoice", field("A", "a"), field("B", "b")));
      stubPass(2, result(null, field("C", "c")));
      stubPass(3, result("", field("D", "d")));

      coordinator.discoverFields(documentId);

      ArgumentCaptor<String> types = ArgumentCaptor.forClass(String.class);
      ArgumentCaptor<String> previous = ArgumentCaptor.forClass(String.class);
      verify(discoveryAgent, times(3))
          .discover(anyInt(), anyInt(), anyInt(), types.capture(), previous.capture(), any());

      assertThat(types.getAllValues()).containsExactly("unknown", "invoice", "invoice");
      assertThat(previous.getAllValues().get(0)).isEqualTo("(none)");
      assertThat(previous.getAllValues().get(1)).contains("- a").contains("- b");
      assertThat(previous.getAllValues().get(2)).contains("- a").contains("- b").contains("- c");
    }

    @Test
    @DisplayName("Later passes should refine description, type, rules and required flag")
    void shouldRefineExistingFields() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(80);
      stubPass(
          1, result("invoice", new DiscoveredField("line items", "scalar", "items", false, null)));
      stubPass(
          2,
          result(
              "invoice",
              new DiscoveredField(
                  "Line  Items",
                  "list",
                  "each billed line",
                  true,
                  List.of(
                      new DiscoveredRule("not_blank", null), new DiscoveredRule("bogus", "x")))));
      stubPass(3, result("invoice", new DiscoveredField("line items", null, "", false, null)));

      FieldSpecification field =
          coordinator.discoverFields(documentId).field("line items").orElseThrow();

      assertThat(field.type()).isEqualTo(FieldType.LIST);
      assertThat(field.description()).isEqualTo("each billed line");
      assertThat(field.required()).isTrue();
      assertThat(field.validationRules())
          .containsExactly(ValidationRule.of(ValidationRule.Kind.NOT_BLANK));
    }

    @Test
    @DisplayName("Should let a later pass narrow a field back to scalar when it says so")
    void shouldApplyLatestExplicitType() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(80);
      stubPass(1, result("invoice", new DiscoveredField("total", "list", "totals", false, null)));
      stubPass(2, result("invoice", new DiscoveredField("total", "", "", false, null)));
      stubPass(3, result("invoice", new DiscoveredField("Total", "scalar", "", false, null)));

      FieldSpecification field =
          coordinator.discoverFields(documentId).field("total").orElseThrow();

      assertThat(field.type()).isEqualTo(FieldType.SCALAR);
      assertThat(field.description()).isEqualTo("totals");
    }
  }

  @Nested
  @DisplayName("Normalization")
  class Normalization {

    @Test
    @DisplayName("Should merge names differing only in case and whitespace")
    void shouldMergeNormalizedDuplicates() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(10);
      stubPass(
          1,
          result(
              "invoice",
              field("  Invoice Number ", "number"),
              field("invoice   number", "the number"),
              field("   ", "unnamed")));

      FieldSchema schema = coordinator.discoverFields(documentId);

      assertThat(schema.fieldNames()).containsExactly("invoice number");
      assertThat(schema.documentType()).isEqualTo("invoice");
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Should fail with low confidence when nothing is discovered")
    void shouldThrowLowConfidence_whenNoFields() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(10);
      stubPass(1, result("unknown"));

      assertThatThrownBy(() -> coordinator.discoverFields(documentId))
          .isInstanceOf(DiscoveryLowConfidenceException.class)
          .satisfies(
              e ->
                  assertThat(((DiscoveryLowConfidenceException) e).getDiscoveredFieldCount())
                      .isZero());
      assertThat(meterRegistry.counter("discovery.low_confidence").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fail with low confidence below the configured minimum")
    void shouldThrowLowConfidence_whenBelowMinimum() {
      config.getDiscovery().setMinFieldCount(3);
      when(documentAccessor.getPageCount(documentId)).thenReturn(10);
      stubPass(1, result("invoice", field("A", "a"), field("B", "b")));

      assertThatThrownBy(() -> coordinator.discoverFields(documentId))
          .isInstanceOf(DiscoveryLowConfidenceException.class);
    }

    @Test
    @DisplayName("Should fail with low confidence for a document without pages")
    void shouldThrowLowConfidence_whenNoPages() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(0);

      assertThatThrownBy(() -> coordinator.discoverFields(documentId))
          .isInstanceOf(DiscoveryLowConfidenceException.class);
    }

    @Test
    @DisplayName("Should retry a timed-out pass once and then escalate")
    void shouldRetryOnceThenEscalate_whenPassTimesOut() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(10);
      when(discoveryAgent.discover(anyInt(), anyInt(), anyInt(), anyString(), anyString(), any()))
          .thenAnswer(
              inv -> {
                Thread.sleep(2_000);
                return result("invoice", field("A", "a"));
              });

      assertThatThrownBy(() -> coordinator.discoverFields(documentId))
          .isInstanceOf(DiscoveryTimeoutException.class)
          .satisfies(
              e -> assertThat(((DiscoveryTimeoutException) e).getPassNumber()).isEqualTo(1));
      verify(discoveryAgent, times(2))
          .discover(anyInt(), anyInt(), anyInt(), anyString(), anyString(), any());
      assertThat(meterRegistry.counter("discovery.timeouts").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should succeed when the retry answers in time")
    void shouldSucceed_whenRetryAnswersInTime() {
      AtomicInteger calls = new AtomicInteger();
      when(documentAccessor.getPageCount(documentId)).thenReturn(10);
      when(discoveryAgent.discover(anyInt(), anyInt(), anyInt(), anyString(), anyString(), any()))
          .thenAnswer(
              inv -> {
                if (calls.incrementAndGet() == 1) {
                  Thread.sleep(2_000);
                }
                return result("invoice", field("A", "a"));
              });

      FieldSchema schema = coordinator.discoverFields(documentId);

      assertThat(schema.fieldNames()).containsExactly("a");
      assertThat(meterRegistry.counter("discovery.timeouts").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not retry model errors other than timeouts")
    void shouldNotRetry_whenModelFails() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(10);
      when(discoveryAgent.discover(anyInt(), anyInt(), anyInt(), anyString(), anyString(), any()))
          .thenThrow(new RuntimeException("invalid JSON"));

      assertThatThrownBy(() -> coordinator.discoverFields(documentId))
          .isInstanceOf(LlmServiceException.class)
          .hasMessageContaining("invalid JSON");
      verify(discoveryAgent, times(1))
          .discover(anyInt(), anyInt(), anyInt(), anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Should mark provider rate limiting on the model failure")
    void shouldFlagRateLimit_whenProviderRejectsCall() {
      when(documentAccessor.getPageCount(documentId)).thenReturn(10);
      when(discoveryAgent.discover(anyInt(), anyInt(), anyInt(), anyString(), anyString(), any()))
          .thenThrow(new RateLimitException("429 Too Many Requests"));

      assertThatThrownBy(() -> coordinator.discoverFields(documentId))
          .isInstanceOf(LlmServiceException.class)
          .satisfies(e -> assertThat(((LlmServiceException) e).isRateLimited()).isTrue());
    }
  }

  @Nested
  @DisplayName("Shared executor")
  class SharedExecutor {

    @Test
    @DisplayName("Passes queued behind other documents should not time out while waiting")
    void shouldNotChargeQueueTime_whenDocumentsOutnumberThreads() throws Exception {
      when(documentAccessor.getPageCount(documentId)).thenReturn(10);
      when(discoveryAgent.discover(anyInt(), anyInt(), anyInt(), anyString(), anyString(), any()))
          .thenAnswer(
              inv -> {
                Thread.sleep(100);
                return result("invoice", field("A", "a"));
              });

      ExecutorService callers = Executors.newFixedThreadPool(6);
      try {
        List<Future<FieldSchema>> schemas = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
          schemas.add(callers.submit(() -> coordinator.discoverFields(documentId)));
        }
        for (Future<FieldSchema> schema : schemas) {
          assertThat(schema.get(10, TimeUnit.SECONDS).fieldNames()).containsExactly("a");
        }
      } finally {
        callers.shutdownNow();
      }
      assertThat(meterRegistry.counter("discovery.timeouts").count()).isZero();
    }
  }
}

package com.flamingo.ai.extraction.service.discovery;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PageSampler Tests")
class PageSamplerTest {

  @Test
  @DisplayName("Should spread samples evenly across the document")
  void shouldSpreadSamplesEvenly() {
    assertThat(PageSampler.evenlySpaced(40, 8)).containsExactly(3, 8, 13, 18, 23, 28, 33, 38);
  }

  @Test
  @DisplayName("Should return every page when the document is shorter than the sample")
  void shouldReturnAllPages_whenDocumentShorterThanSample() {
    assertThat(PageSampler.evenlySpaced(5, 8)).containsExactly(1, 2, 3, 4, 5);
    assertThat(PageSampler.evenlySpaced(8, 8)).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
  }

  @Test
  @DisplayName("Should return nothing for an empty document")
  void shouldReturnNothing_whenNoPages() {
    assertThat(PageSampler.evenlySpaced(0, 8)).isEmpty();
  }

  @Test
  @DisplayName("Samples should be distinct, ascending and within range for any page count")
  void samplesShouldBeDistinctAscendingAndInRange() {
    for (int pageCount = 1; pageCount <= 300; pageCount++) {
      List<Integer> pages = PageSampler.evenlySpaced(pageCount, 15);
      assertThat(pages).hasSize(Math.min(pageCount, 15)).isSorted().doesNotHaveDuplicates();
      assertThat(pages.get(0)).isGreaterThanOrEqualTo(1);
      assertThat(pages.get(pages.size() - 1)).isLessThanOrEqualTo(pageCount);
    }
  }

  @Test
  @DisplayName("Chain passes should not share pages and should each cover the whole document")
  void chainPassesShouldBeDisjointAndCoverDocument() {
    List<List<Integer>> passes = PageSampler.roundRobin(80, 3, 15);

    assertThat(passes).hasSize(3);
    Set<Integer> seen = new HashSet<>();
    for (List<Integer> pass : passes) {
      assertThat(pass).hasSize(15).isSorted();
      assertThat(pass.get(0)).isLessThanOrEqualTo(5);
      assertThat(pass.get(pass.size() - 1)).isGreaterThanOrEqualTo(75);
      pass.forEach(page -> assertThat(seen.add(page)).isTrue());
    }
    assertThat(seen).hasSize(45);
  }

  @Test
  @DisplayName("Sampling should be deterministic")
  void samplingShouldBeDeterministic() {
    assertThat(PageSampler.roundRobin(137, 3, 15)).isEqualTo(PageSampler.roundRobin(137, 3, 15));
  }
}

package com.flamingo.ai.extraction.service.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Deterministic page sampling for discovery. Samples are evenly spaced over the whole document so
 * that front matter, body and appendices all reach the discovery agents.
 */
public final class PageSampler {

  private PageSampler() {}

  /**
   * Picks {@code sampleCount} evenly spaced, distinct, ascending pages from {@code [1, pageCount]}.
   * Returns every page when the document is not longer than the sample.
   */
  public static List<Integer> evenlySpaced(int pageCount, int sampleCount) {
    if (pageCount <= 0 || sampleCount <= 0) {
      return List.of();
    }
    if (pageCount <= sampleCount) {
      return IntStream.rangeClosed(1, pageCount).boxed().toList();
    }
    List<Integer> pages = new ArrayList<>(sampleCount);
    for (int i = 0; i < sampleCount; i++) {
      // centre of the i-th of sampleCount equal slices; strictly increasing since slice >= 1 page
      pages.add(1 + (int) ((2L * i + 1) * pageCount / (2L * sampleCount)));
    }
    return List.copyOf(pages);
  }

  /**
   * Splits one evenly spaced sample of {@code passCount * pagesPerPass} pages across the passes of
   * a discovery chain, round-robin. Every pass covers the whole document and no page is shared
   * between passes.
   *
   * @return one ascending page list per pass
   */
  public static List<List<Integer>> roundRobin(int pageCount, int passCount, int pagesPerPass) {
    List<Integer> sample = evenlySpaced(pageCount, passCount * pagesPerPass);
    List<List<Integer>> passes = new ArrayList<>(passCount);
    for (int pass = 0; pass < passCount; pass++) {
      passes.add(new ArrayList<>());
    }
    for (int i = 0; i < sample.size(); i++) {
      passes.get(i % passCount).add(sample.get(i));
    }
    return passes.stream().map(List::copyOf).toList();
  }
}

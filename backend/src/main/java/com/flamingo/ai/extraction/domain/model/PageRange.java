package com.flamingo.ai.extraction.domain.model;

/**
 * A contiguous, inclusive, 1-indexed span of document pages.
 *
 * @param startPage first page, at least 1
 * @param endPage last page, not before {@code startPage}
 */
public record PageRange(int startPage, int endPage) implements Comparable<PageRange> {

  public PageRange {
    if (startPage < 1 || endPage < startPage) {
      throw new IllegalArgumentException(
          "Invalid page range [" + startPage + ", " + endPage + "]");
    }
  }

  public int size() {
    return endPage - startPage + 1;
  }

  public boolean contains(int page) {
    return page >= startPage && page <= endPage;
  }

  @Override
  public int compareTo(PageRange other) {
    int byStart = Integer.compare(startPage, other.startPage);
    return byStart != 0 ? byStart : Integer.compare(endPage, other.endPage);
  }

  @Override
  public String toString() {
    return "[" + startPage + "," + endPage + "]";
  }
}

package com.trackcoach.analyzer.corner;

/** Inclusive sample index range used while corner candidates are grouped and merged. */
record IndexRange(int start, int end) {
  IndexRange {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid index range: " + start + ".." + end);
    }
  }

  int count() {
    return end - start + 1;
  }
}

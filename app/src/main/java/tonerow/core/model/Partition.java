package tonerow.core.model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import tonerow.util.BitsetUtils;

/**
 * Ordered sequence of equal-size segments cut from a row. Each segment is held as a pitch-class
 * set, so order inside a segment is discarded while segment position is kept.
 */
public record Partition(List<BitSet> segments) {

  public Partition {
    Objects.requireNonNull(segments, "segments");
    List<BitSet> copies = new ArrayList<>(segments.size());
    for (BitSet segment : segments) {
      copies.add(BitsetUtils.copy(Objects.requireNonNull(segment, "segment")));
    }
    segments = Collections.unmodifiableList(copies);
  }

  public int size() {
    return segments.size();
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    for (BitSet segment : segments) {
      builder.append(BitsetUtils.signature(segment));
    }
    return builder.toString();
  }
}

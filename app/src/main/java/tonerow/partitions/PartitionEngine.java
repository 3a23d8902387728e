package tonerow.partitions;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import tonerow.core.PitchClass;
import tonerow.core.model.Partition;
import tonerow.util.BitsetUtils;

/**
 * Cuts twelve-note rows into consecutive equal-size segments and compares the resulting
 * partitions.
 */
public final class PartitionEngine {
  private PartitionEngine() {}

  /**
   * Splits {@code row} into {@code 12 / size.notes()} consecutive segments, each converted to a
   * pitch-class set.
   */
  public static Partition partition(int[] row, SegmentSize size) {
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(size, "size");
    if (row.length != PitchClass.COUNT) {
      throw new IllegalArgumentException(
          "Expected " + PitchClass.COUNT + " pitch classes but got " + row.length);
    }
    int notes = size.notes();
    List<BitSet> segments = new ArrayList<>(size.segmentCount());
    for (int start = 0; start < row.length; start += notes) {
      segments.add(BitsetUtils.fromRange(row, start, start + notes));
    }
    return new Partition(segments);
  }

  /**
   * True iff the candidate's segments, taken as an unordered collection, are exactly the
   * reference's segments.
   *
   * <p>Reference segments are consumed in order; each one removes a single equal segment from the
   * pool of unmatched candidate segments, so repeated set values are matched one-to-one. The
   * comparison fails as soon as a reference segment finds no partner.
   */
  public static boolean matchesAsMultiset(Partition candidate, Partition reference) {
    Objects.requireNonNull(candidate, "candidate");
    Objects.requireNonNull(reference, "reference");
    if (candidate.size() != reference.size()) {
      return false;
    }
    List<BitSet> remaining = new ArrayList<>(candidate.segments());
    for (BitSet wanted : reference.segments()) {
      if (!removeFirstEqual(remaining, wanted)) {
        return false;
      }
    }
    return remaining.isEmpty();
  }

  /** True iff the first segments of the two partitions share no pitch class. */
  public static boolean firstSegmentsDisjoint(Partition candidate, Partition reference) {
    Objects.requireNonNull(candidate, "candidate");
    Objects.requireNonNull(reference, "reference");
    return BitsetUtils.isDisjoint(candidate.segments().get(0), reference.segments().get(0));
  }

  private static boolean removeFirstEqual(List<BitSet> pool, BitSet wanted) {
    for (Iterator<BitSet> it = pool.iterator(); it.hasNext(); ) {
      if (it.next().equals(wanted)) {
        it.remove();
        return true;
      }
    }
    return false;
  }
}

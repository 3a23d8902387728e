package tonerow.util;

import java.util.BitSet;

/** Utility helpers for working with {@link BitSet} based pitch-class sets. */
public final class BitsetUtils {
  private BitsetUtils() {}

  /** Set of the values found in {@code values[from, to)}. */
  public static BitSet fromRange(int[] values, int from, int to) {
    BitSet bitSet = new BitSet(to - from);
    for (int i = from; i < to; i++) {
      bitSet.set(values[i]);
    }
    return bitSet;
  }

  public static boolean isDisjoint(BitSet first, BitSet second) {
    return !first.intersects(second);
  }

  public static BitSet copy(BitSet bitSet) {
    return bitSet == null ? new BitSet() : (BitSet) bitSet.clone();
  }

  public static String signature(BitSet bitSet) {
    StringBuilder builder = new StringBuilder();
    builder.append('{');
    boolean first = true;
    for (int i = bitSet.nextSetBit(0); i >= 0; i = bitSet.nextSetBit(i + 1)) {
      if (!first) {
        builder.append(',');
      }
      builder.append(i);
      first = false;
    }
    return builder.append('}').toString();
  }
}

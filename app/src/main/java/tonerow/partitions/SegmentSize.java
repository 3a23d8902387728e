package tonerow.partitions;

import java.util.Locale;
import tonerow.core.PitchClass;
import tonerow.core.model.Partition;
import tonerow.core.model.TransformationKind;

/**
 * Partition granularities used for combinatoriality, with the matching rule and identity-level
 * exclusion each one applies.
 *
 * <p>Hexachords are compared by complementation of the first segment and exclude level 0 for every
 * kind. Tetrachords and trichords require the candidate's segments to re-partition the reference
 * exactly, and only P and R forms exclude level 0.
 */
public enum SegmentSize {
  HEXACHORD(6, "hexachordal") {
    @Override
    public boolean matches(Partition candidate, Partition reference) {
      return PartitionEngine.firstSegmentsDisjoint(candidate, reference);
    }

    @Override
    public boolean excludesIdentityLevel(TransformationKind kind) {
      return true;
    }
  },
  TETRACHORD(4, "tetrachordal") {
    @Override
    public boolean matches(Partition candidate, Partition reference) {
      return PartitionEngine.matchesAsMultiset(candidate, reference);
    }

    @Override
    public boolean excludesIdentityLevel(TransformationKind kind) {
      return !kind.isInverted();
    }
  },
  TRICHORD(3, "trichordal") {
    @Override
    public boolean matches(Partition candidate, Partition reference) {
      return PartitionEngine.matchesAsMultiset(candidate, reference);
    }

    @Override
    public boolean excludesIdentityLevel(TransformationKind kind) {
      return !kind.isInverted();
    }
  };

  private final int notes;
  private final String adjective;

  SegmentSize(int notes, String adjective) {
    this.notes = notes;
    this.adjective = adjective;
  }

  /** Notes per segment. */
  public int notes() {
    return notes;
  }

  public int segmentCount() {
    return PitchClass.COUNT / notes;
  }

  /** {@code hexachordal}, {@code tetrachordal} or {@code trichordal}. */
  public String adjective() {
    return adjective;
  }

  /** Whether {@code candidate} is combinatorial with {@code reference} at this granularity. */
  public abstract boolean matches(Partition candidate, Partition reference);

  /** Whether level 0 of {@code kind} is dropped from the results at this granularity. */
  public abstract boolean excludesIdentityLevel(TransformationKind kind);

  /**
   * Parses a segment size given as a note count ({@code 6}), a short name ({@code hex}) or a full
   * name ({@code hexachord}, {@code hexachordal}), case-insensitively.
   */
  public static SegmentSize parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Segment size must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "6", "hex", "hexachord", "hexachordal" -> HEXACHORD;
      case "4", "tet", "tetrachord", "tetrachordal" -> TETRACHORD;
      case "3", "tri", "trichord", "trichordal" -> TRICHORD;
      default -> throw new IllegalArgumentException("Unsupported segment size: " + raw);
    };
  }
}

package tonerow.detect;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import tonerow.core.PitchClass;
import tonerow.core.ToneRow;
import tonerow.core.ToneRowMatrix;
import tonerow.core.model.Partition;
import tonerow.core.model.Transformation;
import tonerow.core.model.TransformationKind;
import tonerow.partitions.PartitionEngine;
import tonerow.partitions.SegmentSize;

/**
 * Finds the transformed forms of a row that are combinatorial with its prime form.
 *
 * <p>For every kind, twelve candidate forms are read from the matrix: rows for P, reversed rows
 * for R, columns for I and reversed columns for RI. Each candidate is partitioned at the requested
 * {@link SegmentSize} and compared against the partition of P0 using that size's rule. A
 * surviving candidate's level is the interval from the first note of the kind's untransposed form
 * to the candidate's first note.
 *
 * <p>The detector holds no state and may be shared across threads.
 */
public final class CombinatorialityDetector {

  /** Scans all 48 forms; results are grouped by kind in P, R, I, RI order. */
  public List<Transformation> detect(ToneRow row, SegmentSize size) {
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(size, "size");
    Partition reference = PartitionEngine.partition(row.prime(), size);
    List<Transformation> found = new ArrayList<>();
    for (TransformationKind kind : TransformationKind.values()) {
      scan(row.matrix(), kind, size, reference, found);
    }
    return found;
  }

  /** Scans the twelve forms of a single kind. */
  public List<Transformation> detect(ToneRow row, SegmentSize size, TransformationKind kind) {
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(size, "size");
    Objects.requireNonNull(kind, "kind");
    Partition reference = PartitionEngine.partition(row.prime(), size);
    List<Transformation> found = new ArrayList<>();
    scan(row.matrix(), kind, size, reference, found);
    return found;
  }

  /** Runs {@link #detect(ToneRow, SegmentSize)} once per segment size. */
  public Map<SegmentSize, List<Transformation>> detectAll(ToneRow row) {
    Map<SegmentSize, List<Transformation>> results = new EnumMap<>(SegmentSize.class);
    for (SegmentSize size : SegmentSize.values()) {
      results.put(size, List.copyOf(detect(row, size)));
    }
    return results;
  }

  private void scan(
      ToneRowMatrix matrix,
      TransformationKind kind,
      SegmentSize size,
      Partition reference,
      List<Transformation> sink) {
    int referenceFirstNote = candidateForm(matrix, kind, 0)[0];
    for (int index = 0; index < ToneRowMatrix.SIZE; index++) {
      int[] form = candidateForm(matrix, kind, index);
      if (!size.matches(PartitionEngine.partition(form, size), reference)) {
        continue;
      }
      Transformation found =
          new Transformation(kind, PitchClass.interval(referenceFirstNote, form[0]));
      if (found.isIdentityLevel() && size.excludesIdentityLevel(kind)) {
        continue;
      }
      sink.add(found);
    }
  }

  /** The {@code index}-th form of {@code kind}; index 0 is the untransposed form. */
  static int[] candidateForm(ToneRowMatrix matrix, TransformationKind kind, int index) {
    int[] form = kind.isInverted() ? matrix.column(index) : matrix.row(index);
    return kind.isRetrograde() ? ToneRow.reversed(form) : form;
  }
}

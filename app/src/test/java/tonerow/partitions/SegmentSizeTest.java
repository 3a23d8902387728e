package tonerow.partitions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import tonerow.core.model.TransformationKind;

final class SegmentSizeTest {

  @Test
  void segmentCountsCoverTheAggregate() {
    assertEquals(2, SegmentSize.HEXACHORD.segmentCount());
    assertEquals(3, SegmentSize.TETRACHORD.segmentCount());
    assertEquals(4, SegmentSize.TRICHORD.segmentCount());
    assertEquals(12, SegmentSize.TETRACHORD.notes() * SegmentSize.TETRACHORD.segmentCount());
  }

  @Test
  void parsesNumbersAndNames() {
    assertEquals(SegmentSize.HEXACHORD, SegmentSize.parse("6"));
    assertEquals(SegmentSize.HEXACHORD, SegmentSize.parse("Hexachordal"));
    assertEquals(SegmentSize.TETRACHORD, SegmentSize.parse(" tet "));
    assertEquals(SegmentSize.TRICHORD, SegmentSize.parse("trichord"));
    assertThrows(IllegalArgumentException.class, () -> SegmentSize.parse("2"));
    assertThrows(IllegalArgumentException.class, () -> SegmentSize.parse(" "));
  }

  @Test
  void hexachordsExcludeLevelZeroForEveryKind() {
    for (TransformationKind kind : TransformationKind.values()) {
      assertTrue(SegmentSize.HEXACHORD.excludesIdentityLevel(kind), kind.name());
    }
  }

  @Test
  void smallerSegmentsKeepLevelZeroForInvertedForms() {
    for (SegmentSize size : new SegmentSize[] {SegmentSize.TETRACHORD, SegmentSize.TRICHORD}) {
      assertTrue(size.excludesIdentityLevel(TransformationKind.PRIME));
      assertTrue(size.excludesIdentityLevel(TransformationKind.RETROGRADE));
      assertFalse(size.excludesIdentityLevel(TransformationKind.INVERSION));
      assertFalse(size.excludesIdentityLevel(TransformationKind.RETROGRADE_INVERSION));
    }
  }
}

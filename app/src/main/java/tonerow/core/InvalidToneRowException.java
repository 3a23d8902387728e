package tonerow.core;

import java.util.Arrays;
import java.util.Objects;

/** Raised when a sequence of integers is not a permutation of the twelve pitch classes. */
public final class InvalidToneRowException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /** Why the candidate row was rejected. */
  public enum Reason {
    WRONG_LENGTH,
    NOT_A_PERMUTATION
  }

  private final Reason reason;

  InvalidToneRowException(Reason reason, int[] candidate) {
    super(message(reason, candidate));
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() {
    return reason;
  }

  private static String message(Reason reason, int[] candidate) {
    return switch (reason) {
      case WRONG_LENGTH ->
          "tone row must contain "
              + PitchClass.COUNT
              + " pitch classes but had "
              + candidate.length
              + ": "
              + Arrays.toString(candidate);
      case NOT_A_PERMUTATION ->
          "tone row must contain each pitch class 0-11 exactly once: "
              + Arrays.toString(candidate);
    };
  }
}

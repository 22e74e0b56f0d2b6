package org.obligato.main;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Ascii;

/**
 * The life cycle of one compilation pass. A pass is solved, then reported; a reported pass either
 * ends in {@link #SUCCESS} or has repairs applied to it, which starts the next pass.
 */
public enum PassState {
  PENDING,
  SOLVED,
  REPORTED,
  APPLIED,
  SUCCESS;

  /** Returns {@code next}, or throws {@link IllegalStateException} if the move is not allowed. */
  public PassState moveTo(PassState next) {
    checkState(canMoveTo(next), "illegal pass transition %s -> %s", this, next);
    return next;
  }

  public boolean canMoveTo(PassState next) {
    switch (this) {
      case PENDING:
        return next == SOLVED;
      case SOLVED:
        return next == REPORTED;
      case REPORTED:
        return next == APPLIED || next == SUCCESS;
      case APPLIED:
        return next == PENDING;
      case SUCCESS:
        return false;
    }
    throw new AssertionError(this);
  }

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}

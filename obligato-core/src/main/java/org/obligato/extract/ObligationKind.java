package org.obligato.extract;

import com.google.common.base.Ascii;

/** What requires an obligation to be proven. */
public enum ObligationKind {
  REFINEMENT,
  PRECONDITION,
  POSTCONDITION,
  EFFECT,
  LINEARITY;

  /** Effect and linearity obligations are decided during extraction, without a solver. */
  public boolean needsSolver() {
    return this == REFINEMENT || this == PRECONDITION || this == POSTCONDITION;
  }

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}

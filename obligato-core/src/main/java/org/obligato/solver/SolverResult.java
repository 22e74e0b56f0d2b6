package org.obligato.solver;

import com.google.common.base.Ascii;

/** The verdict on an obligation. */
public enum SolverResult {
  DISCHARGED,
  COUNTEREXAMPLE,
  UNKNOWN;

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}

package org.obligato.solver;

import com.google.common.base.Ascii;

/** Why a goal could be neither refuted nor witnessed. */
public enum UnknownCategory {
  INCOMPLETE_FACTS,
  NONLINEAR,
  QUANTIFIED,
  TIMEOUT,
  UNSUPPORTED;

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}

package org.obligato.main;

import com.google.common.base.Ascii;

/** The overall verdict of a pass. */
public enum CompileStatus {
  /** No diagnostics, every obligation discharged and no open holes. */
  SUCCESS,
  /** No diagnostics, but some obligation is not discharged or some hole is open. */
  INCOMPLETE,
  /** At least one diagnostic, warnings included. */
  ERROR;

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}

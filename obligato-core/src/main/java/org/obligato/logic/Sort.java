package org.obligato.logic;

/**
 * The sort of a solver variable. Booleans are 0/1 integers; strings, enums and records are
 * symbols, compared for equality only, with distinct integer codes for their literals.
 */
public enum Sort {
  INT,
  REAL,
  BOOL,
  SYMBOL;

  /** Whether values of this sort are integers. */
  public boolean isIntegral() {
    return this != REAL;
  }
}

package org.obligato.repair;

import com.google.common.base.Ascii;

/** The nature of a repair. */
public enum RepairKind {
  LOCAL_FIX,
  REFACTOR,
  BOUNDARY_VALIDATION,
  SEMANTICS_CHANGE;

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}

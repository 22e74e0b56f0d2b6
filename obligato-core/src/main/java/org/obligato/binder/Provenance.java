package org.obligato.binder;

import com.google.common.base.Ascii;

/** Why a fact is known. */
public enum Provenance {
  PARAMETER_REFINEMENT,
  PRECONDITION,
  DECLARED_REFINEMENT,
  LET_DEFINITION,
  POSTCONDITION_OF_CALLEE,
  RETURN_REFINEMENT,
  FIELD_REFINEMENT,
  BRANCH_CONDITION,
  MATCH_PATTERN,
  LOOP_CONDITION,
  LOOP_EXIT,
  LOOP_RANGE,
  GUARD,
  BRANCH_MERGE;

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}

package org.obligato.repair;

import com.google.common.base.Ascii;

/** The closed set of structural edits. */
public enum PatchOpKind {
  REPLACE_NODE,
  INSERT_BEFORE,
  INSERT_AFTER,
  WRAP,
  DELETE_NODE,
  WIDEN_EFFECT,
  RENAME_SYMBOL,
  RENAME,
  RENAME_FIELD,
  ADD_FIELD,
  ADD_PARAM,
  ADD_REFINEMENT;

  /** The lower-case tag, also used to derive the ids of the nodes the edit creates. */
  public String tag() {
    return Ascii.toLowerCase(name());
  }

  @Override
  public String toString() {
    return tag();
  }
}

package org.obligato.repair;

import com.google.common.base.Ascii;

/** Whether applying a candidate can change what the program does. Declared safest first. */
public enum Safety {
  BEHAVIOR_PRESERVING,
  LIKELY_PRESERVING,
  BEHAVIOR_CHANGING;

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}

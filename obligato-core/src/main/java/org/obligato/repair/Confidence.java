package org.obligato.repair;

import com.google.common.base.Ascii;

/** How sure the synthesizer is that a candidate is the intended fix. Declared best first. */
public enum Confidence {
  HIGH,
  MEDIUM,
  LOW;

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}

package org.obligato.logic;

/** Thrown when an expression falls outside the decidable fragment. */
public class Untranslatable extends RuntimeException {

  /** Why an expression cannot be translated. */
  public enum Reason {
    QUANTIFIED,
    UNSUPPORTED
  }

  private final Reason reason;

  public Untranslatable(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}

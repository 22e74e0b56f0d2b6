package org.obligato.diag;

/** Diagnostic severity. */
public enum Severity {
  ERROR("error"),
  WARNING("warning");

  private final String name;

  Severity(String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return name;
  }
}

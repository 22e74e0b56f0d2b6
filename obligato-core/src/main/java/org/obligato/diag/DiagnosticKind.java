package org.obligato.diag;

import com.google.common.base.Ascii;

/** The closed set of static errors and warnings, with their message templates. */
public enum DiagnosticKind {
  UNRESOLVED_NAME("cannot find symbol %s"),
  UNKNOWN_FUNCTION("unknown function %s"),
  UNKNOWN_TYPE("unknown type %s"),
  UNKNOWN_FIELD("%s has no field %s"),
  MISSING_FIELD("missing field %s in %s"),
  DUPLICATE_FIELD("duplicate field %s"),
  ARITY_MISMATCH("%s expects %s argument(s), found %s"),
  NON_EXHAUSTIVE_MATCH("match is not exhaustive, missing %s"),
  IMMUTABLE_ASSIGNMENT("cannot assign to immutable binding %s"),
  TYPE_MISMATCH("expected %s, found %s"),
  DUPLICATE_DECLARATION("%s is already declared"),
  UNREACHABLE_CODE("unreachable statement", Severity.WARNING);

  private final String message;
  private final Severity severity;

  DiagnosticKind(String message) {
    this(message, Severity.ERROR);
  }

  DiagnosticKind(String message, Severity severity) {
    this.message = message;
    this.severity = severity;
  }

  public String format(Object... args) {
    return String.format(message, args);
  }

  public Severity severity() {
    return severity;
  }

  /** The stable machine-readable code, e.g. {@code unresolved_name}. */
  public String code() {
    return Ascii.toLowerCase(name());
  }
}

package org.obligato.diag;

import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;

/**
 * A malformed AST or patch: a reference to a node id that does not exist, a duplicated id, or an
 * edit that would violate the closed node vocabulary. Structural errors are fatal for the pass and
 * are reported to the driver, never as a {@link Diagnostic}.
 */
public class StructuralError extends RuntimeException {

  /** Structural error kinds. */
  public enum Kind {
    UNKNOWN_NODE_ID("unknown node id %s"),
    DUPLICATE_NODE_ID("duplicate node id %s"),
    INCONSISTENT_RESULT("inconsistent result: %s"),
    INVALID_PATCH("invalid patch: %s");

    private final String message;

    Kind(String message) {
      this.message = message;
    }

    String format(Object... args) {
      return String.format(message, args);
    }
  }

  @FormatMethod
  public static StructuralError create(Kind kind, @FormatString String format, Object... args) {
    return new StructuralError(kind, kind.format(String.format(format, args)));
  }

  public static StructuralError unknownNode(Object id) {
    return new StructuralError(Kind.UNKNOWN_NODE_ID, Kind.UNKNOWN_NODE_ID.format(id));
  }

  private final Kind kind;

  private StructuralError(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}

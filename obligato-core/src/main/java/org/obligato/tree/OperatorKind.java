package org.obligato.tree;

/** An operator kind, with precedence. */
public enum OperatorKind {
  NEG("-", Precedence.UNARY),
  NOT("!", Precedence.UNARY),
  MULT("*", Precedence.MULTIPLICATIVE),
  DIVIDE("/", Precedence.MULTIPLICATIVE),
  MODULO("%", Precedence.MULTIPLICATIVE),
  PLUS("+", Precedence.ADDITIVE),
  MINUS("-", Precedence.ADDITIVE),
  LESS_THAN("<", Precedence.RELATIONAL),
  LESS_THAN_EQ("<=", Precedence.RELATIONAL),
  GREATER_THAN(">", Precedence.RELATIONAL),
  GREATER_THAN_EQ(">=", Precedence.RELATIONAL),
  EQUAL("==", Precedence.EQUALITY),
  NOT_EQUAL("!=", Precedence.EQUALITY),
  AND("&&", Precedence.AND),
  OR("||", Precedence.OR),
  IMPLIES("==>", Precedence.IMPLIES);

  private final String name;
  private final Precedence prec;

  OperatorKind(String name, Precedence prec) {
    this.name = name;
    this.prec = prec;
  }

  @Override
  public String toString() {
    return name;
  }

  public Precedence prec() {
    return prec;
  }

  public boolean isComparison() {
    return prec == Precedence.RELATIONAL || prec == Precedence.EQUALITY;
  }

  public boolean isArithmetic() {
    return prec == Precedence.MULTIPLICATIVE || prec == Precedence.ADDITIVE;
  }

  public boolean isLogical() {
    return this == AND || this == OR || this == IMPLIES;
  }

  /** The comparison that holds exactly when this one does not. */
  public OperatorKind negate() {
    switch (this) {
      case LESS_THAN:
        return GREATER_THAN_EQ;
      case LESS_THAN_EQ:
        return GREATER_THAN;
      case GREATER_THAN:
        return LESS_THAN_EQ;
      case GREATER_THAN_EQ:
        return LESS_THAN;
      case EQUAL:
        return NOT_EQUAL;
      case NOT_EQUAL:
        return EQUAL;
      default:
        throw new IllegalArgumentException("not a comparison: " + this);
    }
  }

  /** Operator precedence groups. */
  public enum Precedence {
    UNARY(8),
    MULTIPLICATIVE(7),
    ADDITIVE(6),
    RELATIONAL(5),
    EQUALITY(4),
    AND(3),
    OR(2),
    IMPLIES(1);

    private final int rank;

    public int rank() {
      return rank;
    }

    Precedence(int rank) {
      this.rank = rank;
    }
  }
}

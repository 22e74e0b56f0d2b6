package org.obligato.model;

import com.google.errorprone.annotations.Immutable;
import java.math.BigDecimal;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;

/** Literal constants: integers, reals, booleans, strings and unit. */
@Immutable
public abstract class Const {

  @Override
  public abstract int hashCode();

  @Override
  public abstract boolean equals(@Nullable Object obj);

  /** The surface spelling of the constant. */
  @Override
  public abstract String toString();

  /** The constant kind. */
  public abstract Kind kind();

  /** A constant kind. */
  public enum Kind {
    INT,
    REAL,
    BOOL,
    STRING,
    UNIT
  }

  public static IntValue of(long value) {
    return new IntValue(BigInteger.valueOf(value));
  }

  public static BoolValue of(boolean value) {
    return value ? BoolValue.TRUE : BoolValue.FALSE;
  }

  public static StringValue of(String value) {
    return new StringValue(value);
  }

  /** An arbitrary precision integer literal. */
  @Immutable
  public static final class IntValue extends Const {
    private final BigInteger value;

    public IntValue(BigInteger value) {
      this.value = value;
    }

    public BigInteger value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.INT;
    }

    @Override
    public String toString() {
      return value.toString();
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj instanceof IntValue && value.equals(((IntValue) obj).value);
    }
  }

  /** A decimal real literal. */
  @Immutable
  public static final class RealValue extends Const {
    private final BigDecimal value;

    public RealValue(BigDecimal value) {
      this.value = value;
    }

    public BigDecimal value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.REAL;
    }

    @Override
    public String toString() {
      String s = value.toPlainString();
      return s.contains(".") ? s : s + ".0";
    }

    @Override
    public int hashCode() {
      return value.stripTrailingZeros().hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj instanceof RealValue && value.compareTo(((RealValue) obj).value) == 0;
    }
  }

  /** A boolean literal. */
  @Immutable
  public static final class BoolValue extends Const {
    static final BoolValue TRUE = new BoolValue(true);
    static final BoolValue FALSE = new BoolValue(false);

    private final boolean value;

    private BoolValue(boolean value) {
      this.value = value;
    }

    public boolean value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.BOOL;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }

    @Override
    public int hashCode() {
      return Boolean.hashCode(value);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj instanceof BoolValue && value == ((BoolValue) obj).value;
    }
  }

  /** A string literal. */
  @Immutable
  public static final class StringValue extends Const {
    private final String value;

    public StringValue(String value) {
      this.value = value;
    }

    public String value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.STRING;
    }

    @Override
    public String toString() {
      return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj instanceof StringValue && value.equals(((StringValue) obj).value);
    }
  }

  /** The unit value {@code ()}. */
  @Immutable
  public static final class UnitValue extends Const {
    public static final UnitValue INSTANCE = new UnitValue();

    private UnitValue() {}

    @Override
    public Kind kind() {
      return Kind.UNIT;
    }

    @Override
    public String toString() {
      return "()";
    }

    @Override
    public int hashCode() {
      return 0;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj instanceof UnitValue;
    }
  }
}

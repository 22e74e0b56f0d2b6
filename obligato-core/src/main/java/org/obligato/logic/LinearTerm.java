package org.obligato.logic;

import com.google.common.collect.ImmutableSortedMap;
import com.google.errorprone.annotations.Immutable;
import java.math.BigInteger;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/** A linear combination {@code c1*x1 + ... + cn*xn + k} with rational coefficients. */
@Immutable
public final class LinearTerm {

  public static final LinearTerm ZERO = new LinearTerm(ImmutableSortedMap.of(), Rational.ZERO);

  public static LinearTerm constant(Rational value) {
    return new LinearTerm(ImmutableSortedMap.of(), value);
  }

  public static LinearTerm constant(long value) {
    return constant(Rational.of(value));
  }

  public static LinearTerm var(Var var) {
    return new LinearTerm(ImmutableSortedMap.of(var, Rational.ONE), Rational.ZERO);
  }

  private final ImmutableSortedMap<Var, Rational> coefficients;
  private final Rational constant;

  private LinearTerm(ImmutableSortedMap<Var, Rational> coefficients, Rational constant) {
    this.coefficients = coefficients;
    this.constant = constant;
  }

  /** The nonzero coefficients, ordered by variable name. */
  public ImmutableSortedMap<Var, Rational> coefficients() {
    return coefficients;
  }

  public Rational constant() {
    return constant;
  }

  public Rational coefficient(Var var) {
    Rational c = coefficients.get(var);
    return c == null ? Rational.ZERO : c;
  }

  public boolean isConstant() {
    return coefficients.isEmpty();
  }

  public LinearTerm plus(LinearTerm o) {
    Map<Var, Rational> sum = new TreeMap<>(coefficients);
    for (Map.Entry<Var, Rational> e : o.coefficients.entrySet()) {
      Rational c = sum.getOrDefault(e.getKey(), Rational.ZERO).add(e.getValue());
      if (c.isZero()) {
        sum.remove(e.getKey());
      } else {
        sum.put(e.getKey(), c);
      }
    }
    return new LinearTerm(ImmutableSortedMap.copyOf(sum), constant.add(o.constant));
  }

  public LinearTerm minus(LinearTerm o) {
    return plus(o.negate());
  }

  public LinearTerm negate() {
    return times(Rational.ONE.negate());
  }

  public LinearTerm times(Rational factor) {
    if (factor.isZero()) {
      return ZERO;
    }
    ImmutableSortedMap.Builder<Var, Rational> result = ImmutableSortedMap.naturalOrder();
    for (Map.Entry<Var, Rational> e : coefficients.entrySet()) {
      result.put(e.getKey(), e.getValue().multiply(factor));
    }
    return new LinearTerm(result.buildOrThrow(), constant.multiply(factor));
  }

  /** Removes {@code var} by substituting {@code value} for it. */
  public LinearTerm substitute(Var var, LinearTerm value) {
    Rational c = coefficients.get(var);
    if (c == null) {
      return this;
    }
    Map<Var, Rational> rest = new TreeMap<>(coefficients);
    rest.remove(var);
    return new LinearTerm(ImmutableSortedMap.copyOf(rest), constant).plus(value.times(c));
  }

  /** Evaluates the term under a complete assignment of its variables. */
  public Rational evaluate(Map<Var, Rational> model) {
    Rational result = constant;
    for (Map.Entry<Var, Rational> e : coefficients.entrySet()) {
      Rational value = model.get(e.getKey());
      if (value == null) {
        throw new IllegalArgumentException("unassigned variable " + e.getKey());
      }
      result = result.add(e.getValue().multiply(value));
    }
    return result;
  }

  /** Whether every variable is integral and every coefficient and the constant are integers. */
  public boolean isIntegral() {
    if (!constant.isInteger()) {
      return false;
    }
    for (Map.Entry<Var, Rational> e : coefficients.entrySet()) {
      if (!e.getKey().sort().isIntegral() || !e.getValue().isInteger()) {
        return false;
      }
    }
    return true;
  }

  /** Whether every variable of the term is integral. */
  public boolean hasIntegralVars() {
    for (Var var : coefficients.keySet()) {
      if (!var.sort().isIntegral()) {
        return false;
      }
    }
    return true;
  }

  /** Scales the term by a positive factor so that its coefficients and constant are integers. */
  public LinearTerm clearDenominators() {
    BigInteger lcm = constant.denominator();
    for (Rational c : coefficients.values()) {
      BigInteger d = c.denominator();
      lcm = lcm.divide(lcm.gcd(d)).multiply(d);
    }
    return times(Rational.of(lcm));
  }

  /** The gcd of the coefficients of an integral term, or zero for a constant. */
  public BigInteger coefficientGcd() {
    BigInteger gcd = BigInteger.ZERO;
    for (Rational c : coefficients.values()) {
      gcd = gcd.gcd(c.numerator());
    }
    return gcd;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Var, Rational> e : coefficients.entrySet()) {
      if (sb.length() > 0) {
        sb.append(" + ");
      }
      if (!e.getValue().equals(Rational.ONE)) {
        sb.append(e.getValue()).append('*');
      }
      sb.append(e.getKey());
    }
    if (sb.length() == 0 || !constant.isZero()) {
      if (sb.length() > 0) {
        sb.append(" + ");
      }
      sb.append(constant);
    }
    return sb.toString();
  }

  @Override
  public int hashCode() {
    return 31 * coefficients.hashCode() + constant.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof LinearTerm)) {
      return false;
    }
    LinearTerm that = (LinearTerm) obj;
    return coefficients.equals(that.coefficients) && constant.equals(that.constant);
  }
}

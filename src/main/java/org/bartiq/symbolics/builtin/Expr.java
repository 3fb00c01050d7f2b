/*
 * Copyright 2025 The Bartiq Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.bartiq.symbolics.builtin;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An immutable expression of the built-in algebra engine.
 *
 * <p>Expressions are always in canonical form: instances are created by {@link Algebra} (or by
 * this class for atoms), never by direct construction of the compound subclasses, and two
 * mathematically identical expressions built the same way are {@link #equals equal}. The natural
 * order is deterministic and is used to sort the operands of sums and products.
 */
public abstract class Expr implements Comparable<Expr> {

  /** Lazily computed; racy initialization is harmless since the value is deterministic. */
  private ImmutableSet<String> freeSymbols;

  Expr() {}

  /** Orders expressions of different kinds; see {@link #compareTo}. */
  abstract int rank();

  /** Compares this with another expression of the same rank. */
  abstract int compareSameRank(Expr other);

  /** Returns this expression's immediate subexpressions. */
  abstract ImmutableList<Expr> children();

  /**
   * Returns an expression of the same kind with the given subexpressions (which must correspond
   * one-to-one to {@link #children}), canonicalized.
   */
  abstract Expr rebuild(List<Expr> newChildren);

  /** Returns the names of the free symbols in this expression. */
  public final ImmutableSet<String> freeSymbols() {
    ImmutableSet<String> result = freeSymbols;
    if (result == null) {
      result = computeFreeSymbols();
      freeSymbols = result;
    }
    return result;
  }

  ImmutableSet<String> computeFreeSymbols() {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (Expr child : children()) {
      builder.addAll(child.freeSymbols());
    }
    return builder.build();
  }

  /** Returns true if this expression contains a symbol naming a wildcarded path. */
  final boolean containsWildcard() {
    for (String name : freeSymbols()) {
      if (name.indexOf('~') >= 0) {
        return true;
      }
    }
    return false;
  }

  /** Returns the number of nodes in this expression. */
  final int size() {
    int result = 1;
    for (Expr child : children()) {
      result += child.size();
    }
    return result;
  }

  @Override
  public final int compareTo(Expr other) {
    return compare(this, other);
  }

  @Override
  public final String toString() {
    return Serializer.serialize(this);
  }

  /**
   * The canonical order of expressions. Numbers come first, in increasing order; other expressions
   * are compared factor by factor (each factor by its base and then its exponent), and finally by
   * their numeric coefficients.
   */
  static int compare(Expr a, Expr b) {
    if (a == b) {
      return 0;
    } else if (a instanceof Num na) {
      return (b instanceof Num nb) ? na.compareValue(nb) : -1;
    } else if (b instanceof Num) {
      return 1;
    }
    List<Expr> fa = Algebra.nonNumericFactors(a);
    List<Expr> fb = Algebra.nonNumericFactors(b);
    int n = Math.min(fa.size(), fb.size());
    for (int i = 0; i < n; i++) {
      int c = compareFactors(fa.get(i), fb.get(i));
      if (c != 0) {
        return c;
      }
    }
    int c = Integer.compare(fa.size(), fb.size());
    if (c != 0) {
      return c;
    }
    return Algebra.coefficient(a).compareValue(Algebra.coefficient(b));
  }

  private static int compareFactors(Expr x, Expr y) {
    Expr bx = Algebra.base(x);
    Expr by = Algebra.base(y);
    int c = Integer.compare(bx.rank(), by.rank());
    if (c == 0) {
      c = bx.compareSameRank(by);
    }
    return (c != 0) ? c : compare(Algebra.exponent(x), Algebra.exponent(y));
  }

  static int compareLists(List<Expr> xs, List<Expr> ys) {
    int n = Math.min(xs.size(), ys.size());
    for (int i = 0; i < n; i++) {
      int c = compare(xs.get(i), ys.get(i));
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(xs.size(), ys.size());
  }

  /**
   * A number: either an exact rational (with a positive denominator, in lowest terms) or a
   * double. Doubles are contagious; any arithmetic involving one produces a double.
   */
  public static final class Num extends Expr {
    public static final Num ZERO = new Num(BigInteger.ZERO, BigInteger.ONE);
    public static final Num ONE = new Num(BigInteger.ONE, BigInteger.ONE);
    public static final Num MINUS_ONE = new Num(BigInteger.ONE.negate(), BigInteger.ONE);
    public static final Num TWO = new Num(BigInteger.TWO, BigInteger.ONE);
    public static final Num HALF = new Num(BigInteger.ONE, BigInteger.TWO);

    /** Null if this is a double. */
    final @Nullable BigInteger numerator;

    /** Null if this is a double. */
    final @Nullable BigInteger denominator;

    /** For exact numbers, the nearest double. */
    final double value;

    private Num(BigInteger numerator, BigInteger denominator) {
      this.numerator = numerator;
      this.denominator = denominator;
      this.value =
          denominator.equals(BigInteger.ONE)
              ? numerator.doubleValue()
              : new BigDecimal(numerator)
                  .divide(new BigDecimal(denominator), MathContext.DECIMAL64)
                  .doubleValue();
    }

    private Num(double value) {
      this.numerator = null;
      this.denominator = null;
      this.value = value;
    }

    public static Num of(long n) {
      return of(BigInteger.valueOf(n));
    }

    public static Num of(BigInteger n) {
      return new Num(n, BigInteger.ONE);
    }

    /** Returns the rational {@code numerator/denominator}, reduced to lowest terms. */
    public static Num of(BigInteger numerator, BigInteger denominator) {
      if (denominator.signum() == 0) {
        throw new ArithmeticException("Division by zero");
      } else if (denominator.signum() < 0) {
        numerator = numerator.negate();
        denominator = denominator.negate();
      }
      BigInteger gcd = numerator.gcd(denominator);
      if (!gcd.equals(BigInteger.ONE)) {
        numerator = numerator.divide(gcd);
        denominator = denominator.divide(gcd);
      }
      return new Num(numerator, denominator);
    }

    public static Num of(long numerator, long denominator) {
      return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /** Returns a double; {@code d} must be finite. */
    public static Num of(double d) {
      checkArgument(Double.isFinite(d), "Not a finite number: %s", d);
      return new Num(d);
    }

    public boolean isExact() {
      return numerator != null;
    }

    /** True if this is an exact integer. */
    public boolean isInteger() {
      return numerator != null && denominator.equals(BigInteger.ONE);
    }

    /** True if this is an exact integer or a double with an integral value. */
    boolean isIntegral() {
      return isInteger() || (numerator == null && value == Math.rint(value));
    }

    public boolean isZero() {
      return (numerator != null) ? numerator.signum() == 0 : value == 0;
    }

    public boolean isOne() {
      return (numerator != null) ? (numerator.equals(BigInteger.ONE) && isInteger()) : value == 1;
    }

    /** True if this is the exact integer 1. */
    boolean isExactOne() {
      return isExact() && isOne();
    }

    public int signum() {
      return (numerator != null) ? numerator.signum() : (int) Math.signum(value);
    }

    public double doubleValue() {
      return value;
    }

    /** Returns this integer as a BigInteger; only valid if {@link #isInteger}. */
    BigInteger bigIntegerValue() {
      checkArgument(isInteger());
      return numerator;
    }

    /** Returns this number as a Long (if it is an integer that fits), BigInteger or Double. */
    public Number toNumber() {
      if (isInteger()) {
        return (numerator.bitLength() < 64) ? (Number) numerator.longValue() : numerator;
      }
      return value;
    }

    public Num negate() {
      return (numerator != null) ? new Num(numerator.negate(), denominator) : new Num(-value);
    }

    public Num plus(Num other) {
      if (isExact() && other.isExact()) {
        return of(
            numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
            denominator.multiply(other.denominator));
      }
      return of(value + other.value);
    }

    public Num minus(Num other) {
      return plus(other.negate());
    }

    public Num times(Num other) {
      if (isExact() && other.isExact()) {
        return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
      }
      return of(value * other.value);
    }

    /** Throws ArithmeticException if this is exact zero. */
    public Num reciprocal() {
      if (isExact()) {
        return of(denominator, numerator);
      }
      return of(1 / value);
    }

    public Num dividedBy(Num other) {
      return times(other.reciprocal());
    }

    /** Returns the largest integer not greater than this. */
    Num floor() {
      if (isExact()) {
        BigInteger[] qr = numerator.divideAndRemainder(denominator);
        BigInteger q = qr[0];
        if (qr[1].signum() < 0) {
          q = q.subtract(BigInteger.ONE);
        }
        return of(q);
      }
      return of(new BigDecimal(Math.floor(value)).toBigInteger());
    }

    /** Returns the smallest integer not less than this. */
    Num ceiling() {
      return negate().floor().negate();
    }

    Num abs() {
      return (signum() < 0) ? negate() : this;
    }

    int compareValue(Num other) {
      if (isExact() && other.isExact()) {
        return numerator
            .multiply(other.denominator)
            .compareTo(other.numerator.multiply(denominator));
      }
      int c = Double.compare(value, other.value);
      // Order an exact number before an equal double so that the order is total
      return (c != 0) ? c : Boolean.compare(!isExact(), !other.isExact());
    }

    @Override
    int rank() {
      return 0;
    }

    @Override
    int compareSameRank(Expr other) {
      return compareValue((Num) other);
    }

    @Override
    ImmutableList<Expr> children() {
      return ImmutableList.of();
    }

    @Override
    Expr rebuild(List<Expr> newChildren) {
      return this;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      } else if (!(obj instanceof Num other)) {
        return false;
      } else if (isExact()) {
        return other.isExact()
            && numerator.equals(other.numerator)
            && denominator.equals(other.denominator);
      } else {
        return !other.isExact() && Double.compare(value, other.value) == 0;
      }
    }

    @Override
    public int hashCode() {
      return isExact() ? Objects.hash(numerator, denominator) : Double.hashCode(value);
    }
  }

  /** A free symbol, optionally carrying a sign predicate. */
  public static final class Sym extends Expr {
    public final String name;

    /** What is known about this symbol's sign; does not affect equality. */
    public final Sign sign;

    Sym(String name, Sign sign) {
      this.name = name;
      this.sign = sign;
    }

    public static Sym of(String name) {
      return new Sym(name, Sign.UNKNOWN);
    }

    /** Returns a symbol with the given name that is known to have the given sign. */
    public static Sym of(String name, Sign sign) {
      return new Sym(name, sign);
    }

    @Override
    ImmutableSet<String> computeFreeSymbols() {
      return ImmutableSet.of(name);
    }

    @Override
    int rank() {
      return 2;
    }

    @Override
    int compareSameRank(Expr other) {
      return name.compareTo(((Sym) other).name);
    }

    @Override
    ImmutableList<Expr> children() {
      return ImmutableList.of();
    }

    @Override
    Expr rebuild(List<Expr> newChildren) {
      return this;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Sym other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /** A named mathematical constant. */
  public static final class Constant extends Expr {
    public static final Constant PI = new Constant("PI", Math.PI);
    public static final Constant INFINITY = new Constant("oo", Double.POSITIVE_INFINITY);
    /** The value of an indeterminate form such as {@code oo - oo} or {@code 0/0}. */
    public static final Constant UNDEFINED = new Constant("nan", Double.NaN);

    public final String name;
    final double value;

    private Constant(String name, double value) {
      this.name = name;
      this.value = value;
    }

    @Override
    int rank() {
      return 1;
    }

    @Override
    int compareSameRank(Expr other) {
      return Double.compare(value, ((Constant) other).value);
    }

    @Override
    ImmutableList<Expr> children() {
      return ImmutableList.of();
    }

    @Override
    Expr rebuild(List<Expr> newChildren) {
      return this;
    }

    // Fixed set of instances, so equals() and hashCode() are inherited from Object.
  }

  /** A pattern wildcard, e.g. {@code $x}; only meaningful as a substitution pattern. */
  public static final class Wild extends Expr {
    public final String name;

    Wild(String name) {
      this.name = name;
    }

    @Override
    int rank() {
      return 3;
    }

    @Override
    int compareSameRank(Expr other) {
      return name.compareTo(((Wild) other).name);
    }

    @Override
    ImmutableList<Expr> children() {
      return ImmutableList.of();
    }

    @Override
    Expr rebuild(List<Expr> newChildren) {
      return this;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Wild other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() + 1;
    }
  }

  /**
   * A function application. The function is either a built-in that could not be evaluated
   * further, or an uninterpreted user function.
   */
  public static final class Call extends Expr {
    public final String name;
    public final ImmutableList<Expr> args;

    Call(String name, ImmutableList<Expr> args) {
      this.name = name;
      this.args = args;
    }

    @Override
    int rank() {
      return 4;
    }

    @Override
    int compareSameRank(Expr other) {
      Call call = (Call) other;
      int c = name.compareTo(call.name);
      return (c != 0) ? c : compareLists(args, call.args);
    }

    @Override
    ImmutableList<Expr> children() {
      return args;
    }

    @Override
    Expr rebuild(List<Expr> newChildren) {
      return Algebra.call(name, newChildren);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Call other && name.equals(other.name) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
      return 31 * name.hashCode() + args.hashCode();
    }
  }

  /**
   * A sum or product of {@code term} over the integers from {@code start} to {@code end}
   * (inclusive). The iterator is bound by this expression.
   */
  public static final class RangeOp extends Expr {
    public final boolean isProduct;
    public final Expr term;
    public final String iterator;
    public final Expr start;
    public final Expr end;

    RangeOp(boolean isProduct, Expr term, String iterator, Expr start, Expr end) {
      this.isProduct = isProduct;
      this.term = term;
      this.iterator = iterator;
      this.start = start;
      this.end = end;
    }

    String functionName() {
      return isProduct ? "prod_over" : "sum_over";
    }

    @Override
    ImmutableSet<String> computeFreeSymbols() {
      ImmutableSet.Builder<String> builder = ImmutableSet.builder();
      for (String name : term.freeSymbols()) {
        if (!name.equals(iterator)) {
          builder.add(name);
        }
      }
      return builder.addAll(start.freeSymbols()).addAll(end.freeSymbols()).build();
    }

    @Override
    int rank() {
      return 5;
    }

    @Override
    int compareSameRank(Expr other) {
      RangeOp range = (RangeOp) other;
      int c = Boolean.compare(isProduct, range.isProduct);
      if (c == 0) {
        c = iterator.compareTo(range.iterator);
      }
      return (c != 0) ? c : compareLists(children(), range.children());
    }

    @Override
    ImmutableList<Expr> children() {
      return ImmutableList.of(term, start, end);
    }

    @Override
    Expr rebuild(List<Expr> newChildren) {
      return Ranges.create(
          isProduct, newChildren.get(0), iterator, newChildren.get(1), newChildren.get(2));
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof RangeOp other
          && isProduct == other.isProduct
          && iterator.equals(other.iterator)
          && term.equals(other.term)
          && start.equals(other.start)
          && end.equals(other.end);
    }

    @Override
    public int hashCode() {
      return Objects.hash(isProduct, term, iterator, start, end);
    }
  }

  /** A sum of two or more terms; a numeric term, if any, comes first. */
  public static final class Add extends Expr {
    public final ImmutableList<Expr> terms;

    Add(ImmutableList<Expr> terms) {
      this.terms = terms;
    }

    @Override
    int rank() {
      return 6;
    }

    @Override
    int compareSameRank(Expr other) {
      return compareLists(terms, ((Add) other).terms);
    }

    @Override
    ImmutableList<Expr> children() {
      return terms;
    }

    @Override
    Expr rebuild(List<Expr> newChildren) {
      return Algebra.add(newChildren);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Add other && terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
      return terms.hashCode() + 7;
    }
  }

  /** A product of two or more factors; a numeric coefficient, if any, comes first. */
  public static final class Mul extends Expr {
    public final ImmutableList<Expr> factors;

    Mul(ImmutableList<Expr> factors) {
      this.factors = factors;
    }

    @Override
    int rank() {
      return 7;
    }

    @Override
    int compareSameRank(Expr other) {
      return compareLists(factors, ((Mul) other).factors);
    }

    @Override
    ImmutableList<Expr> children() {
      return factors;
    }

    @Override
    Expr rebuild(List<Expr> newChildren) {
      return Algebra.mul(newChildren);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Mul other && factors.equals(other.factors);
    }

    @Override
    public int hashCode() {
      return factors.hashCode() + 11;
    }
  }

  /** {@code base} raised to {@code exponent}. */
  public static final class Pow extends Expr {
    public final Expr base;
    public final Expr exponent;

    Pow(Expr base, Expr exponent) {
      this.base = base;
      this.exponent = exponent;
    }

    @Override
    int rank() {
      return 8;
    }

    @Override
    int compareSameRank(Expr other) {
      Pow pow = (Pow) other;
      int c = compare(base, pow.base);
      return (c != 0) ? c : compare(exponent, pow.exponent);
    }

    @Override
    ImmutableList<Expr> children() {
      return ImmutableList.of(base, exponent);
    }

    @Override
    Expr rebuild(List<Expr> newChildren) {
      return Algebra.pow(newChildren.get(0), newChildren.get(1));
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Pow other && base.equals(other.base) && exponent.equals(other.exponent);
    }

    @Override
    public int hashCode() {
      return 31 * base.hashCode() + exponent.hashCode();
    }
  }
}

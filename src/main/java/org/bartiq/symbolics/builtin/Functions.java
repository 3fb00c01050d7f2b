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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.math.BigIntegerMath;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;
import org.bartiq.symbolics.builtin.Expr.Add;
import org.bartiq.symbolics.builtin.Expr.Call;
import org.bartiq.symbolics.builtin.Expr.Constant;
import org.bartiq.symbolics.builtin.Expr.Num;
import org.bartiq.symbolics.builtin.Expr.Pow;
import org.bartiq.symbolics.builtin.Expr.Sym;
import org.jspecify.annotations.Nullable;

/**
 * The registry of built-in functions. Built-in names are matched case-insensitively, and some
 * have aliases (e.g. {@code ceil} for {@code ceiling}); a call is always represented with the
 * function's canonical name.
 *
 * <p>Each built-in first tries a symbolic rule, which evaluates the call exactly or rewrites it
 * (e.g. {@code sqrt(x)} becomes {@code x^(1/2)}). If that fails and every argument is a number,
 * at least one of them a double, the function is evaluated in floating point. Otherwise the call
 * is left unevaluated.
 */
final class Functions {

  // Statics only
  private Functions() {}

  /** Exact evaluation or rewriting of a call; returns null to leave the call as is. */
  @FunctionalInterface
  interface Rule {
    @Nullable Expr apply(ImmutableList<Expr> args);
  }

  /** Floating-point evaluation of a call; returns NaN if the function is undefined there. */
  @FunctionalInterface
  interface NumericRule {
    double apply(double[] args);
  }

  /** A built-in function. */
  static final class Builtin {
    final String name;
    final int minArgs;

    /** -1 if there is no limit. */
    final int maxArgs;

    private final Rule rule;
    private final @Nullable NumericRule numeric;

    Builtin(String name, int minArgs, int maxArgs, Rule rule, @Nullable NumericRule numeric) {
      this.name = name;
      this.minArgs = minArgs;
      this.maxArgs = maxArgs;
      this.rule = rule;
      this.numeric = numeric;
    }

    void checkArity(int numArgs) {
      if (numArgs < minArgs || (maxArgs >= 0 && numArgs > maxArgs)) {
        String expected;
        if (minArgs == maxArgs) {
          expected = String.valueOf(minArgs);
        } else if (maxArgs < 0) {
          expected = "at least " + minArgs;
        } else {
          expected = minArgs + " to " + maxArgs;
        }
        throw new IllegalArgumentException(
            String.format(
                "Function %s takes %s argument%s, got %s",
                name, expected, (maxArgs == 1 ? "" : "s"), numArgs));
      }
    }

    Expr apply(ImmutableList<Expr> args) {
      Expr result = rule.apply(args);
      if (result != null) {
        return result;
      }
      if (numeric != null
          && args.stream().allMatch(a -> a instanceof Num)
          && args.stream().anyMatch(a -> !((Num) a).isExact())) {
        Expr value = Algebra.fromDouble(numeric.apply(toDoubles(args)));
        if (value != null) {
          return value;
        }
      }
      return new Call(name, args);
    }

    /** Returns the value of this function at the given arguments, or NaN. */
    double evaluate(double[] args) {
      return (numeric == null) ? Double.NaN : numeric.apply(args);
    }
  }

  /** Maps each accepted (lower case) spelling to its function. */
  private static final ImmutableMap<String, Builtin> BUILTINS;

  /** The canonical names of functions whose values are always integers. */
  private static final ImmutableSet<String> INTEGER_VALUED =
      ImmutableSet.of("ceiling", "floor", "sgn", "nlz", "multiplicity");

  /** Tolerance used when deciding the sign of a double. */
  private static final double EPSILON = 1e-12;

  static {
    ImmutableMap.Builder<String, Builtin> map = ImmutableMap.builder();
    define(map, "mod", 2, 2, Functions::mod, a -> a[0] - a[1] * Math.floor(a[0] / a[1]));
    define(map, "max", 1, -1, args -> maxOrMin(true, args), null);
    define(map, "min", 1, -1, args -> maxOrMin(false, args), null);
    define(map, "sum", 0, -1, Algebra::add, null);
    define(map, "prod", 0, -1, Algebra::mul, null);
    define(map, "sum_over", 4, 4, args -> Ranges.fromCall(false, args), null);
    define(map, "prod_over", 4, 4, args -> Ranges.fromCall(true, args), null);
    define(map, "round", 1, 2, Functions::round, null);
    define(map, "abs", 1, 1, Functions::abs, a -> Math.abs(a[0]));
    define(map, "sgn", 1, 1, Functions::sgn, null);
    defineTranscendental(map, "sin", Math::sin, Num.ZERO);
    defineTranscendental(map, "cos", Math::cos, Num.ONE);
    defineTranscendental(map, "tan", Math::tan, Num.ZERO);
    defineTranscendental(map, "cot", x -> 1 / Math.tan(x), null);
    defineTranscendental(map, "sec", x -> 1 / Math.cos(x), Num.ONE);
    defineTranscendental(map, "csc", x -> 1 / Math.sin(x), null);
    defineTranscendental(map, "asin", Math::asin, Num.ZERO);
    defineTranscendental(map, "acos", Math::acos, null);
    defineTranscendental(map, "atan", Math::atan, Num.ZERO);
    defineTranscendental(map, "acot", x -> Math.atan(1 / x), null);
    defineTranscendental(map, "asec", x -> Math.acos(1 / x), null);
    defineTranscendental(map, "acsc", x -> Math.asin(1 / x), null);
    defineTranscendental(map, "sinh", Math::sinh, Num.ZERO);
    defineTranscendental(map, "cosh", Math::cosh, Num.ONE);
    defineTranscendental(map, "tanh", Math::tanh, Num.ZERO);
    defineTranscendental(map, "coth", x -> 1 / Math.tanh(x), null);
    defineTranscendental(map, "sech", x -> 1 / Math.cosh(x), Num.ONE);
    defineTranscendental(map, "csch", x -> 1 / Math.sinh(x), null);
    defineTranscendental(map, "asinh", Numerics::asinh, Num.ZERO);
    defineTranscendental(map, "acosh", Numerics::acosh, null);
    defineTranscendental(map, "atanh", Numerics::atanh, Num.ZERO);
    defineTranscendental(map, "acoth", x -> Numerics.atanh(1 / x), null);
    defineTranscendental(map, "asech", x -> Numerics.acosh(1 / x), null);
    defineTranscendental(map, "acsch", x -> Numerics.asinh(1 / x), null);
    define(map, "sqrt", 1, 1, args -> Algebra.pow(args.get(0), Num.HALF), null);
    define(map, "cbrt", 1, 1, args -> Algebra.pow(args.get(0), Num.of(1, 3)), null);
    define(map, "exp", 1, 1, Functions::exp, a -> Math.exp(a[0]));
    define(map, "exp2", 1, 1, args -> Algebra.pow(Num.TWO, args.get(0)), null);
    define(map, "log", 1, 2, Functions::log, Functions::logNumeric);
    define(map, "log2", 1, 1, args -> log(args.get(0), Num.TWO), null, "log_2");
    define(map, "log10", 1, 1, args -> log(args.get(0), Num.of(10)), null, "log_10");
    define(map, "ceiling", 1, 1, args -> ceilingOrFloor(true, args.get(0)), null, "ceil");
    define(map, "floor", 1, 1, args -> ceilingOrFloor(false, args.get(0)), null);
    define(map, "frac", 1, 1, Functions::frac, a -> a[0] - Math.floor(a[0]));
    define(map, "gamma", 1, 1, Functions::gamma, a -> Numerics.gamma(a[0]));
    define(map, "heaviside", 1, 2, Functions::heaviside, null);
    define(map, "lambertw", 1, 1, Functions::lambertw, a -> Numerics.lambertW(a[0]));
    define(map, "multiplicity", 2, 2, Functions::multiplicity, null);
    define(map, "nlz", 1, 1, Functions::nlz, null);
    BUILTINS = map.buildOrThrow();
  }

  private static void define(
      ImmutableMap.Builder<String, Builtin> map,
      String name,
      int minArgs,
      int maxArgs,
      Rule rule,
      @Nullable NumericRule numeric,
      String... aliases) {
    Builtin builtin = new Builtin(name, minArgs, maxArgs, rule, numeric);
    map.put(name, builtin);
    for (String alias : aliases) {
      map.put(alias, builtin);
    }
  }

  /**
   * Defines a function of one argument that is evaluated exactly only at zero (if {@code
   * atZero} is non-null), and otherwise only for double arguments.
   */
  private static void defineTranscendental(
      ImmutableMap.Builder<String, Builtin> map,
      String name,
      DoubleUnaryOperator fn,
      @Nullable Num atZero) {
    Rule rule =
        args -> (atZero != null && args.get(0) instanceof Num x && x.isExact() && x.isZero())
            ? atZero
            : null;
    define(map, name, 1, 1, rule, a -> fn.applyAsDouble(a[0]));
  }

  /** Returns all accepted spellings of built-in function names. */
  static ImmutableSet<String> names() {
    return BUILTINS.keySet();
  }

  /** Returns the built-in function with the given name (in any case), or null. */
  static @Nullable Builtin lookup(String name) {
    return BUILTINS.get(Ascii.toLowerCase(name));
  }

  /** Returns true if {@code name} is a built-in function name. */
  static boolean isBuiltin(String name) {
    return lookup(name) != null;
  }

  /**
   * Returns an application of the named function: evaluated as far as possible for a built-in,
   * an uninterpreted call otherwise.
   *
   * @throws IllegalArgumentException if a built-in is called with the wrong number of arguments
   */
  static Expr apply(String name, ImmutableList<Expr> args) {
    Builtin builtin = lookup(name);
    if (builtin == null) {
      return new Call(name, args);
    }
    // A wildcard argument stands for an unknown number of arguments, so leave the call alone
    // until it is unrolled.
    for (Expr arg : args) {
      if (arg.containsWildcard()) {
        return new Call(builtin.name, args);
      }
    }
    builtin.checkArity(args.size());
    return builtin.apply(args);
  }

  /** True if {@code call} always has an integer value. */
  static boolean isIntegerValued(Call call) {
    return INTEGER_VALUED.contains(call.name)
        || (call.name.equals("round") && call.args.size() == 1);
  }

  private static double[] toDoubles(List<Expr> args) {
    double[] result = new double[args.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = ((Num) args.get(i)).doubleValue();
    }
    return result;
  }

  /** Returns a double approximation of a symbol-free expression, or NaN. */
  private static double approximate(Expr expr) {
    return expr.freeSymbols().isEmpty() ? Numerics.evaluate(expr) : Double.NaN;
  }

  private static @Nullable Expr mod(ImmutableList<Expr> args) {
    Expr x = args.get(0);
    Expr y = args.get(1);
    if (x instanceof Num a && y instanceof Num b) {
      if (b.isZero() || !a.isExact() || !b.isExact()) {
        return null;
      }
      // The result has the sign of the divisor
      return a.minus(b.times(a.dividedBy(b).floor()));
    } else if ((x instanceof Num a && a.isZero()) || x.equals(y)) {
      return Num.ZERO;
    }
    return null;
  }

  private static Expr maxOrMin(boolean isMax, ImmutableList<Expr> args) {
    String name = isMax ? "max" : "min";
    // Flatten nested calls of the same function, and drop duplicates.
    Set<Expr> unique = new LinkedHashSet<>();
    for (Expr arg : args) {
      if (arg instanceof Call call && call.name.equals(name)) {
        unique.addAll(call.args);
      } else {
        unique.add(arg);
      }
    }
    // Numbers can be combined directly.
    Num best = null;
    List<Expr> candidates = new ArrayList<>();
    for (Expr arg : unique) {
      if (arg instanceof Num num) {
        if (best == null || (isMax ? num.compareValue(best) > 0 : num.compareValue(best) < 0)) {
          best = num;
        }
      } else {
        candidates.add(arg);
      }
    }
    if (best != null) {
      candidates.add(best);
    }
    // Drop any argument that is provably dominated by one of the others.
    boolean[] dropped = new boolean[candidates.size()];
    List<Expr> kept = new ArrayList<>();
    for (int i = 0; i < candidates.size(); i++) {
      Expr b = candidates.get(i);
      for (int j = 0; j < candidates.size(); j++) {
        if (j != i && !dropped[j]) {
          Sign sign = Sign.of(Algebra.sub(candidates.get(j), b));
          if (isMax ? sign.isNonNegative() : sign.isNonPositive()) {
            dropped[i] = true;
            break;
          }
        }
      }
      if (!dropped[i]) {
        kept.add(b);
      }
    }
    if (kept.size() == 1) {
      return kept.get(0);
    }
    Collections.sort(kept);
    return new Call(name, ImmutableList.copyOf(kept));
  }

  private static @Nullable Expr round(ImmutableList<Expr> args) {
    Expr x = args.get(0);
    int digits = 0;
    if (args.size() == 2) {
      if (!(args.get(1) instanceof Num n
          && n.isInteger()
          && n.bigIntegerValue().bitLength() < 16)) {
        return null;
      }
      digits = n.bigIntegerValue().intValue();
    }
    BigDecimal value;
    boolean exact;
    if (x instanceof Num num) {
      exact = num.isExact();
      value =
          exact
              ? new BigDecimal(num.numerator)
                  .divide(new BigDecimal(num.denominator), MathContext.DECIMAL128)
              : BigDecimal.valueOf(num.doubleValue());
    } else {
      double d = approximate(x);
      if (!Double.isFinite(d)) {
        return null;
      }
      exact = false;
      value = BigDecimal.valueOf(d);
    }
    BigDecimal rounded = value.setScale(digits, RoundingMode.HALF_EVEN);
    if (args.size() == 1) {
      return Num.of(rounded.toBigIntegerExact());
    }
    return exact ? fromBigDecimal(rounded) : Num.of(rounded.doubleValue());
  }

  private static Num fromBigDecimal(BigDecimal value) {
    if (value.scale() <= 0) {
      return Num.of(value.toBigIntegerExact());
    }
    return Num.of(value.unscaledValue(), BigInteger.TEN.pow(value.scale()));
  }

  private static @Nullable Expr abs(ImmutableList<Expr> args) {
    Expr x = args.get(0);
    if (x instanceof Num num) {
      return num.abs();
    }
    Sign sign = Sign.of(x);
    if (sign.isNonNegative()) {
      return x;
    } else if (sign.isNonPositive()) {
      return Algebra.negate(x);
    } else if (Algebra.coefficient(x).signum() < 0) {
      return Algebra.call("abs", ImmutableList.of(Algebra.negate(x)));
    }
    return null;
  }

  private static @Nullable Expr sgn(ImmutableList<Expr> args) {
    Expr x = args.get(0);
    if (x instanceof Num num) {
      if (num.isExact()) {
        return Num.of(num.signum());
      }
      double d = num.doubleValue();
      return Num.of(d < -EPSILON ? -1 : d > EPSILON ? 1 : 0);
    }
    Sign sign = Sign.of(x);
    if (sign == Sign.ZERO) {
      return Num.ZERO;
    } else if (sign.isPositive()) {
      return Num.ONE;
    } else if (sign.isNegative()) {
      return Num.MINUS_ONE;
    }
    return null;
  }

  private static @Nullable Expr exp(ImmutableList<Expr> args) {
    Expr x = args.get(0);
    if (x instanceof Num num && num.isExact() && num.isZero()) {
      return Num.ONE;
    } else if (x instanceof Call call && call.name.equals("log") && call.args.size() == 1) {
      return call.args.get(0);
    } else if (x == Constant.INFINITY) {
      return x;
    } else if (x.equals(Algebra.negate(Constant.INFINITY))) {
      return Num.ZERO;
    }
    return null;
  }

  private static @Nullable Expr log(ImmutableList<Expr> args) {
    return (args.size() == 1) ? log(args.get(0), null) : log(args.get(0), args.get(1));
  }

  /** Returns the logarithm of {@code x} to the base {@code base} (natural if null). */
  private static Expr log(Expr x, @Nullable Expr base) {
    if (x instanceof Num num && num.isExactOne()) {
      return Num.ZERO;
    } else if (x == Constant.INFINITY) {
      return x;
    }
    if (base == null) {
      if (x instanceof Call call && call.name.equals("exp") && call.args.get(0) instanceof Num) {
        return call.args.get(0);
      } else if (x instanceof Num num && !num.isExact() && num.signum() > 0) {
        return Num.of(Math.log(num.doubleValue()));
      }
      return new Call("log", ImmutableList.of(x));
    }
    if (x.equals(base)) {
      return Num.ONE;
    } else if (x instanceof Pow pow && pow.base.equals(base)) {
      return pow.exponent;
    } else if (x instanceof Num n && base instanceof Num b) {
      if (n.isExact() && b.isExact()) {
        Expr exact = exactLog(n, b);
        if (exact != null) {
          return exact;
        }
      } else if (n.signum() > 0 && b.signum() > 0) {
        return Num.of(Math.log(n.doubleValue()) / Math.log(b.doubleValue()));
      }
    }
    return new Call("log", ImmutableList.of(x, base));
  }

  /** Returns the integer k such that {@code b^k == n}, or null if there is none. */
  private static @Nullable Expr exactLog(Num n, Num b) {
    if (n.signum() <= 0 || b.signum() <= 0 || b.isOne()) {
      return null;
    }
    double estimate = Math.log(n.doubleValue()) / Math.log(b.doubleValue());
    if (!Double.isFinite(estimate)) {
      return null;
    }
    long k = Math.round(estimate);
    if (Math.abs(k) > 10_000) {
      return null;
    }
    Expr power = Algebra.pow(b, Num.of(k));
    return power.equals(n) ? Num.of(k) : null;
  }

  private static double logNumeric(double[] args) {
    return (args.length == 1) ? Math.log(args[0]) : Math.log(args[0]) / Math.log(args[1]);
  }

  private static @Nullable Expr ceilingOrFloor(boolean isCeiling, Expr x) {
    if (x instanceof Num num) {
      return isCeiling ? num.ceiling() : num.floor();
    } else if (Algebra.isIntegerValued(x)) {
      return x;
    } else if (x.freeSymbols().isEmpty()) {
      double d = Numerics.evaluate(x);
      if (Double.isFinite(d)) {
        return Num.of(new BigDecimal(isCeiling ? Math.ceil(d) : Math.floor(d)).toBigInteger());
      }
    } else if (x instanceof Add add) {
      // Integer-valued terms can be moved outside
      List<Expr> integers = new ArrayList<>();
      List<Expr> rest = new ArrayList<>();
      for (Expr term : add.terms) {
        (Algebra.isIntegerValued(term) ? integers : rest).add(term);
      }
      if (!integers.isEmpty()) {
        String name = isCeiling ? "ceiling" : "floor";
        integers.add(Algebra.call(name, ImmutableList.of(Algebra.add(rest))));
        return Algebra.add(integers);
      }
    }
    return null;
  }

  private static @Nullable Expr frac(ImmutableList<Expr> args) {
    Expr x = args.get(0);
    if (x instanceof Num num && num.isExact()) {
      return num.minus(num.floor());
    } else if (Algebra.isIntegerValued(x)) {
      return Num.ZERO;
    }
    return null;
  }

  /** Factorials are computed exactly up to this argument. */
  private static final int MAX_EXACT_GAMMA = 1000;

  private static @Nullable Expr gamma(ImmutableList<Expr> args) {
    if (args.get(0) instanceof Num num
        && num.isInteger()
        && num.signum() > 0
        && num.bigIntegerValue().compareTo(BigInteger.valueOf(MAX_EXACT_GAMMA)) <= 0) {
      return Num.of(BigIntegerMath.factorial(num.bigIntegerValue().intValue() - 1));
    }
    return null;
  }

  private static @Nullable Expr heaviside(ImmutableList<Expr> args) {
    Sign sign = Sign.of(args.get(0));
    if (sign.isPositive()) {
      return Num.ONE;
    } else if (sign.isNegative()) {
      return Num.ZERO;
    } else if (sign == Sign.ZERO) {
      return (args.size() == 2) ? args.get(1) : Num.HALF;
    }
    return null;
  }

  private static @Nullable Expr lambertw(ImmutableList<Expr> args) {
    if (args.get(0) instanceof Num num && num.isExact() && num.isZero()) {
      return Num.ZERO;
    }
    return null;
  }

  private static @Nullable Expr multiplicity(ImmutableList<Expr> args) {
    if (!(args.get(0) instanceof Num p
        && p.isInteger()
        && args.get(1) instanceof Num n
        && n.isInteger())) {
      return null;
    }
    BigInteger base = p.bigIntegerValue();
    BigInteger value = n.bigIntegerValue();
    if (base.compareTo(BigInteger.TWO) < 0) {
      return null;
    } else if (value.signum() == 0) {
      return Constant.INFINITY;
    }
    int count = 0;
    BigInteger[] qr = value.divideAndRemainder(base);
    while (qr[1].signum() == 0) {
      count++;
      value = qr[0];
      qr = value.divideAndRemainder(base);
    }
    return Num.of(count);
  }

  private static @Nullable Expr nlz(ImmutableList<Expr> args) {
    if (args.get(0) instanceof Num n && n.isInteger()) {
      // The number of trailing zero bits, or -1 for zero
      return Num.of(n.bigIntegerValue().getLowestSetBit());
    }
    return null;
  }

  /** Verifies that {@code expr} is a symbol and returns its name. */
  static String symbolName(Expr expr, String function) {
    checkArgument(
        expr instanceof Sym, "The iterator of %s must be a symbol, not %s", function, expr);
    return ((Sym) expr).name;
  }
}

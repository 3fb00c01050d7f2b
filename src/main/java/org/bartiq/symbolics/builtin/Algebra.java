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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bartiq.symbolics.builtin.Expr.Add;
import org.bartiq.symbolics.builtin.Expr.Call;
import org.bartiq.symbolics.builtin.Expr.Constant;
import org.bartiq.symbolics.builtin.Expr.Mul;
import org.bartiq.symbolics.builtin.Expr.Num;
import org.bartiq.symbolics.builtin.Expr.Pow;
import org.jspecify.annotations.Nullable;

/**
 * The canonicalizing constructors for sums, products and powers.
 *
 * <ul>
 *   <li>Sums are flattened, their numeric terms are added, and terms that differ only in their
 *       numeric coefficient are combined.
 *   <li>Products are flattened, their numeric factors are multiplied, and powers of the same base
 *       are combined by adding exponents. A numeric coefficient times a single sum is distributed.
 *   <li>Powers with numeric exponents are simplified where that is exact: trivial exponents and
 *       bases, exact rational powers and roots, powers of powers and integer powers of products.
 * </ul>
 */
public final class Algebra {

  // Statics only
  private Algebra() {}

  /** Integer exponents larger than this are not expanded exactly. */
  private static final int MAX_EXACT_EXPONENT = 10_000;

  /** Exact powers whose result could exceed this many bits are left symbolic. */
  private static final long MAX_EXACT_BITS = 1L << 20;

  public static Expr add(Expr... terms) {
    return add(Arrays.asList(terms));
  }

  public static Expr add(List<Expr> terms) {
    List<Expr> flat = new ArrayList<>();
    for (Expr term : terms) {
      if (term instanceof Add add) {
        flat.addAll(add.terms);
      } else {
        flat.add(term);
      }
    }
    Num constant = Num.ZERO;
    Map<Expr, Num> collected = new LinkedHashMap<>();
    // Bit 1 for each infinite term seen with a positive coefficient, bit 2 for a negative one.
    Map<Expr, Integer> infiniteSigns = new HashMap<>();
    for (Expr term : flat) {
      if (term == Constant.UNDEFINED) {
        return Constant.UNDEFINED;
      } else if (term instanceof Num num) {
        constant = constant.plus(num);
      } else {
        Expr rest = withoutCoefficient(term);
        Num coefficient = coefficient(term);
        if (isInfinite(rest)
            && infiniteSigns.merge(rest, coefficient.signum() > 0 ? 1 : 2, (a, b) -> a | b) == 3) {
          // oo - oo
          return Constant.UNDEFINED;
        }
        collected.merge(rest, coefficient, Num::plus);
      }
    }
    List<Expr> result = new ArrayList<>();
    boolean infinite = false;
    for (Map.Entry<Expr, Num> entry : collected.entrySet()) {
      if (!entry.getValue().isZero()) {
        Expr rest = entry.getKey();
        infinite |= (rest == Constant.INFINITY);
        result.add(term(entry.getValue(), rest));
      }
    }
    if (infinite) {
      // Infinity absorbs any finite number
      constant = Num.ZERO;
    }
    if (result.isEmpty()) {
      return constant;
    } else if (result.size() == 1 && constant.isZero()) {
      return result.get(0);
    }
    Collections.sort(result);
    if (!constant.isZero()) {
      result.add(0, constant);
    }
    return new Add(ImmutableList.copyOf(result));
  }

  public static Expr mul(Expr... factors) {
    return mul(Arrays.asList(factors));
  }

  public static Expr mul(List<Expr> factors) {
    Num coefficient = Num.ONE;
    // Maps each base to the list of exponents it appears with.
    Map<Expr, List<Expr>> powers = new LinkedHashMap<>();
    for (Expr factor : factors) {
      if (factor instanceof Mul mul) {
        for (Expr f : mul.factors) {
          coefficient = collectFactor(f, coefficient, powers);
        }
      } else {
        coefficient = collectFactor(factor, coefficient, powers);
      }
    }
    if (powers.containsKey(Constant.UNDEFINED)) {
      return Constant.UNDEFINED;
    } else if (coefficient.isZero()) {
      List<Expr> infinite = powers.get(Constant.INFINITY);
      // 0 * oo is indeterminate
      return (infinite != null && Sign.of(add(infinite)).isPositive())
          ? Constant.UNDEFINED
          : coefficient;
    }
    List<Expr> result = new ArrayList<>();
    for (Map.Entry<Expr, List<Expr>> entry : powers.entrySet()) {
      List<Expr> exponents = entry.getValue();
      Expr exponent = (exponents.size() == 1) ? exponents.get(0) : add(exponents);
      Expr power = pow(entry.getKey(), exponent);
      if (power instanceof Num num) {
        coefficient = coefficient.times(num);
      } else if (power instanceof Mul mul) {
        coefficient = coefficient.times(coefficient(mul));
        result.addAll(nonNumericFactors(mul));
      } else {
        result.add(power);
      }
    }
    if (coefficient.isZero()) {
      return coefficient;
    } else if (result.isEmpty()) {
      return coefficient;
    } else if (result.contains(Constant.INFINITY)) {
      coefficient = Num.of(coefficient.signum());
    }
    if (result.size() == 1) {
      Expr only = result.get(0);
      if (coefficient.isExactOne()) {
        return only;
      } else if (only instanceof Add add) {
        List<Expr> distributed = new ArrayList<>(add.terms.size());
        for (Expr term : add.terms) {
          distributed.add(mul(coefficient, term));
        }
        return add(distributed);
      }
    }
    Collections.sort(result);
    if (!coefficient.isExactOne()) {
      result.add(0, coefficient);
    }
    return new Mul(ImmutableList.copyOf(result));
  }

  private static Num collectFactor(Expr factor, Num coefficient, Map<Expr, List<Expr>> powers) {
    if (factor instanceof Num num) {
      return coefficient.times(num);
    }
    powers.computeIfAbsent(base(factor), k -> new ArrayList<>()).add(exponent(factor));
    return coefficient;
  }

  public static Expr pow(Expr base, Expr exponent) {
    if (base == Constant.UNDEFINED || exponent == Constant.UNDEFINED) {
      return Constant.UNDEFINED;
    } else if (exponent instanceof Num e) {
      if (e.isZero()) {
        return Num.ONE;
      } else if (e.isExactOne()) {
        return base;
      } else if (base instanceof Num b) {
        Expr result = numericPower(b, e);
        return (result != null) ? result : new Pow(b, e);
      } else if (e.isInteger()) {
        if (base instanceof Pow inner) {
          return pow(inner.base, mul(inner.exponent, e));
        } else if (base instanceof Mul mul) {
          List<Expr> factors = new ArrayList<>(mul.factors.size());
          for (Expr factor : mul.factors) {
            factors.add(pow(factor, e));
          }
          return mul(factors);
        } else if (base == Constant.INFINITY) {
          return (e.signum() > 0) ? Constant.INFINITY : Num.ZERO;
        }
      }
    }
    if (base instanceof Num b) {
      if (b.isExactOne()) {
        return Num.ONE;
      } else if (b.isZero() && Sign.of(exponent).isPositive()) {
        return Num.ZERO;
      }
    }
    return new Pow(base, exponent);
  }

  /**
   * Returns {@code base^exponent} as a number if that can be done exactly (or if either is a
   * double), or null if the power should stay symbolic (e.g. {@code 2^(1/2)}).
   */
  private static @Nullable Expr numericPower(Num base, Num exponent) {
    if (!base.isExact() || !exponent.isExact()) {
      double d = Math.pow(base.doubleValue(), exponent.doubleValue());
      return Double.isFinite(d) ? Num.of(d) : null;
    }
    if (exponent.isInteger()) {
      BigInteger k = exponent.bigIntegerValue();
      if (k.abs().compareTo(BigInteger.valueOf(MAX_EXACT_EXPONENT)) > 0) {
        return null;
      } else if (base.isZero()) {
        // k is nonzero, so this is 0^k
        return (k.signum() > 0) ? Num.ZERO : Constant.INFINITY;
      }
      int n = k.abs().intValueExact();
      long bits = Math.max(base.numerator.bitLength(), base.denominator.bitLength());
      if (bits * n > MAX_EXACT_BITS) {
        return null;
      }
      Num result = Num.of(base.numerator.pow(n), base.denominator.pow(n));
      return (k.signum() > 0) ? result : result.reciprocal();
    }
    if (base.signum() < 0 || exponent.denominator.bitLength() > 31) {
      return null;
    }
    int root = exponent.denominator.intValueExact();
    BigInteger numRoot = exactRoot(base.numerator, root);
    BigInteger denRoot = exactRoot(base.denominator, root);
    if (numRoot == null || denRoot == null) {
      return null;
    }
    return numericPower(Num.of(numRoot, denRoot), Num.of(exponent.numerator));
  }

  /** Returns the exact {@code k}th root of {@code n >= 0}, or null if it is not an integer. */
  static @Nullable BigInteger exactRoot(BigInteger n, int k) {
    if (n.signum() == 0 || n.equals(BigInteger.ONE)) {
      return n;
    }
    BigInteger guess;
    if (k == 2) {
      guess = n.sqrt();
    } else {
      double d = Math.pow(n.doubleValue(), 1.0 / k);
      if (!Double.isFinite(d)) {
        return null;
      }
      guess = BigInteger.valueOf(Math.round(d));
    }
    for (int delta = -1; delta <= 1; delta++) {
      BigInteger candidate = guess.add(BigInteger.valueOf(delta));
      if (candidate.signum() > 0 && candidate.pow(k).equals(n)) {
        return candidate;
      }
    }
    return null;
  }

  /** True if {@code expr} is infinity or a product with an infinite factor. */
  private static boolean isInfinite(Expr expr) {
    return expr == Constant.INFINITY
        || (expr instanceof Mul mul && mul.factors.contains(Constant.INFINITY));
  }

  public static Expr negate(Expr x) {
    return mul(Num.MINUS_ONE, x);
  }

  public static Expr sub(Expr x, Expr y) {
    return add(x, negate(y));
  }

  public static Expr div(Expr x, Expr y) {
    return mul(x, pow(y, Num.MINUS_ONE));
  }

  /** Returns an application of the named function; built-in functions are evaluated if possible. */
  public static Expr call(String name, List<Expr> args) {
    return Functions.apply(name, ImmutableList.copyOf(args));
  }

  /**
   * Returns the given double as a number, or as (minus) infinity; returns null if {@code d} is
   * NaN.
   */
  static @Nullable Expr fromDouble(double d) {
    if (Double.isNaN(d)) {
      return null;
    } else if (d == Double.POSITIVE_INFINITY) {
      return Constant.INFINITY;
    } else if (d == Double.NEGATIVE_INFINITY) {
      return negate(Constant.INFINITY);
    }
    return Num.of(d);
  }

  /** Returns the numeric coefficient of a term; 1 if it has none. */
  static Num coefficient(Expr term) {
    if (term instanceof Num num) {
      return num;
    } else if (term instanceof Mul mul && mul.factors.get(0) instanceof Num num) {
      return num;
    }
    return Num.ONE;
  }

  /** Returns a term with its numeric coefficient removed. */
  static Expr withoutCoefficient(Expr term) {
    if (term instanceof Mul mul && mul.factors.get(0) instanceof Num) {
      return (mul.factors.size() == 2)
          ? mul.factors.get(1)
          : new Mul(mul.factors.subList(1, mul.factors.size()));
    }
    return term;
  }

  /** Returns the factors of a term other than its numeric coefficient. */
  static List<Expr> nonNumericFactors(Expr term) {
    if (term instanceof Num) {
      return ImmutableList.of();
    } else if (term instanceof Mul mul) {
      return (mul.factors.get(0) instanceof Num)
          ? mul.factors.subList(1, mul.factors.size())
          : mul.factors;
    }
    return ImmutableList.of(term);
  }

  /** Rebuilds a term from a coefficient and a coefficient-free remainder, without distributing. */
  private static Expr term(Num coefficient, Expr rest) {
    if (rest == Constant.INFINITY) {
      return (coefficient.signum() > 0) ? rest : new Mul(ImmutableList.of(Num.MINUS_ONE, rest));
    } else if (coefficient.isExactOne()) {
      return rest;
    } else if (rest instanceof Mul mul) {
      return new Mul(
          ImmutableList.<Expr>builderWithExpectedSize(mul.factors.size() + 1)
              .add(coefficient)
              .addAll(mul.factors)
              .build());
    }
    return new Mul(ImmutableList.of(coefficient, rest));
  }

  /** The base of a factor: {@code b} for {@code b^e}, otherwise the factor itself. */
  static Expr base(Expr factor) {
    return (factor instanceof Pow pow) ? pow.base : factor;
  }

  /** The exponent of a factor: {@code e} for {@code b^e}, otherwise 1. */
  static Expr exponent(Expr factor) {
    return (factor instanceof Pow pow) ? pow.exponent : Num.ONE;
  }

  /** True if {@code expr} is known to take only integer values. */
  static boolean isIntegerValued(Expr expr) {
    if (expr instanceof Num num) {
      return num.isInteger();
    } else if (expr instanceof Call call) {
      return Functions.isIntegerValued(call);
    } else if (expr instanceof Add add) {
      return add.terms.stream().allMatch(Algebra::isIntegerValued);
    } else if (expr instanceof Mul mul) {
      return mul.factors.stream().allMatch(Algebra::isIntegerValued);
    } else if (expr instanceof Pow pow) {
      return isIntegerValued(pow.base)
          && pow.exponent instanceof Num e
          && e.isInteger()
          && e.signum() > 0;
    }
    return false;
  }
}

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
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.bartiq.symbolics.builtin.Expr.Add;
import org.bartiq.symbolics.builtin.Expr.Mul;
import org.bartiq.symbolics.builtin.Expr.Num;
import org.bartiq.symbolics.builtin.Expr.Pow;
import org.bartiq.symbolics.builtin.Expr.RangeOp;
import org.bartiq.symbolics.builtin.Expr.Sym;

/**
 * Sums and products over integer ranges ({@code sum_over} and {@code prod_over}).
 *
 * <p>A range with integer bounds and at most {@link #MAX_EXPANDED_TERMS} terms is expanded. Sums
 * are split over the terms of their summand and constant factors are moved outside; a summand
 * that does not depend on the iterator, or that is a power of the iterator up to the third, has a
 * closed form. Products of factors that do not depend on the iterator become powers. Anything else
 * is kept as a {@link RangeOp}.
 */
final class Ranges {

  // Statics only
  private Ranges() {}

  static final int MAX_EXPANDED_TERMS = 1000;

  /** Handles a call of {@code sum_over} or {@code prod_over}. */
  static Expr fromCall(boolean isProduct, ImmutableList<Expr> args) {
    String iterator = Functions.symbolName(args.get(1), isProduct ? "prod_over" : "sum_over");
    return create(isProduct, args.get(0), iterator, args.get(2), args.get(3));
  }

  static Expr create(boolean isProduct, Expr term, String iterator, Expr start, Expr end) {
    Expr count = Algebra.add(end, Algebra.negate(start), Num.ONE);
    if (count instanceof Num n && n.isInteger() && start instanceof Num s && s.isInteger()) {
      if (n.signum() <= 0) {
        return isProduct ? Num.ONE : Num.ZERO;
      } else if (n.bigIntegerValue().compareTo(BigInteger.valueOf(MAX_EXPANDED_TERMS)) <= 0) {
        return expand(
            isProduct, term, iterator, s.bigIntegerValue(), n.bigIntegerValue().intValue());
      }
    }
    if (!term.freeSymbols().contains(iterator)) {
      return isProduct ? Algebra.pow(term, count) : Algebra.mul(term, count);
    }
    if (term instanceof Mul mul) {
      // Move the factors that don't depend on the iterator outside.
      List<Expr> constant = new ArrayList<>();
      List<Expr> varying = new ArrayList<>();
      for (Expr factor : mul.factors) {
        (factor.freeSymbols().contains(iterator) ? varying : constant).add(factor);
      }
      if (!constant.isEmpty()) {
        Expr inner = create(isProduct, Algebra.mul(varying), iterator, start, end);
        Expr outer = Algebra.mul(constant);
        return isProduct
            ? Algebra.mul(Algebra.pow(outer, count), inner)
            : Algebra.mul(outer, inner);
      }
    }
    if (!isProduct) {
      if (term instanceof Add add) {
        List<Expr> sums = new ArrayList<>(add.terms.size());
        for (Expr t : add.terms) {
          sums.add(create(false, t, iterator, start, end));
        }
        return Algebra.add(sums);
      }
      int degree = powerOf(term, iterator);
      if (degree > 0) {
        return Algebra.sub(
            powerSum(degree, end), powerSum(degree, Algebra.sub(start, Num.ONE)));
      }
    }
    return new RangeOp(isProduct, term, iterator, start, end);
  }

  private static Expr expand(
      boolean isProduct, Expr term, String iterator, BigInteger start, int count) {
    List<Expr> terms = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      Num value = Num.of(start.add(BigInteger.valueOf(i)));
      terms.add(Substitution.apply(term, ImmutableMap.of(iterator, value)));
    }
    return isProduct ? Algebra.mul(terms) : Algebra.add(terms);
  }

  /**
   * If {@code term} is {@code iterator} or {@code iterator^k} for {@code k} in 1..3, returns
   * {@code k}; otherwise returns 0.
   */
  private static int powerOf(Expr term, String iterator) {
    if (term instanceof Sym sym && sym.name.equals(iterator)) {
      return 1;
    } else if (term instanceof Pow pow
        && pow.base instanceof Sym sym
        && sym.name.equals(iterator)
        && pow.exponent instanceof Num e
        && e.isInteger()) {
      int k = e.bigIntegerValue().intValue();
      return (k >= 1 && k <= 3) ? k : 0;
    }
    return 0;
  }

  /** Returns the closed form of {@code sum(i^k, i, 1, n)} for k in 1..3. */
  private static Expr powerSum(int k, Expr n) {
    Expr nPlusOne = Algebra.add(n, Num.ONE);
    Expr triangle = Algebra.mul(Num.HALF, n, nPlusOne);
    switch (k) {
      case 1:
        return Expander.expand(triangle);
      case 2:
        return Expander.expand(
            Algebra.mul(Num.of(1, 6), n, nPlusOne, Algebra.add(Algebra.mul(Num.TWO, n), Num.ONE)));
      case 3:
        return Expander.expand(Algebra.pow(triangle, Num.TWO));
      default:
        throw new AssertionError(k);
    }
  }
}

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

import java.util.HashMap;
import java.util.Map;
import org.bartiq.symbolics.builtin.Expr.Add;
import org.bartiq.symbolics.builtin.Expr.Call;
import org.bartiq.symbolics.builtin.Expr.Constant;
import org.bartiq.symbolics.builtin.Expr.Mul;
import org.bartiq.symbolics.builtin.Expr.Num;
import org.bartiq.symbolics.builtin.Expr.Pow;
import org.bartiq.symbolics.builtin.Expr.RangeOp;
import org.bartiq.symbolics.builtin.Expr.Sym;

/** Floating-point evaluation of expressions, and the special functions that needs. */
final class Numerics {

  // Statics only
  private Numerics() {}

  /** Ranges with more terms than this are not evaluated. */
  private static final long MAX_RANGE_TERMS = 1_000_000;

  /** Returns the value of {@code expr}, or NaN if it has free symbols or is undefined. */
  static double evaluate(Expr expr) {
    return evaluate(expr, new HashMap<>());
  }

  /**
   * Returns the value of {@code expr} given values for the iterators of enclosing ranges, or
   * NaN.
   */
  private static double evaluate(Expr expr, Map<String, Double> iterators) {
    if (expr instanceof Num num) {
      return num.doubleValue();
    } else if (expr instanceof Constant constant) {
      return constant.value;
    } else if (expr instanceof Sym sym) {
      Double value = iterators.get(sym.name);
      return (value == null) ? Double.NaN : value;
    } else if (expr instanceof Add add) {
      double sum = 0;
      for (Expr term : add.terms) {
        sum += evaluate(term, iterators);
      }
      return sum;
    } else if (expr instanceof Mul mul) {
      double product = 1;
      for (Expr factor : mul.factors) {
        product *= evaluate(factor, iterators);
      }
      return product;
    } else if (expr instanceof Pow pow) {
      return Math.pow(evaluate(pow.base, iterators), evaluate(pow.exponent, iterators));
    } else if (expr instanceof Call call) {
      Functions.Builtin builtin = Functions.lookup(call.name);
      if (builtin == null) {
        return Double.NaN;
      }
      double[] args = new double[call.args.size()];
      for (int i = 0; i < args.length; i++) {
        args[i] = evaluate(call.args.get(i), iterators);
      }
      return builtin.evaluate(args);
    } else if (expr instanceof RangeOp range) {
      return evaluateRange(range, iterators);
    }
    return Double.NaN;
  }

  private static double evaluateRange(RangeOp range, Map<String, Double> iterators) {
    double start = evaluate(range.start, iterators);
    double end = evaluate(range.end, iterators);
    if (start != Math.rint(start) || end != Math.rint(end) || end - start >= MAX_RANGE_TERMS) {
      return Double.NaN;
    }
    Double saved = iterators.get(range.iterator);
    double result = range.isProduct ? 1 : 0;
    for (double i = start; i <= end; i++) {
      iterators.put(range.iterator, i);
      double term = evaluate(range.term, iterators);
      result = range.isProduct ? result * term : result + term;
    }
    if (saved == null) {
      iterators.remove(range.iterator);
    } else {
      iterators.put(range.iterator, saved);
    }
    return result;
  }

  static double asinh(double x) {
    return Math.log(x + Math.sqrt(x * x + 1));
  }

  static double acosh(double x) {
    return Math.log(x + Math.sqrt(x * x - 1));
  }

  static double atanh(double x) {
    return 0.5 * Math.log((1 + x) / (1 - x));
  }

  /** Coefficients of the Lanczos approximation with g = 7. */
  private static final double[] LANCZOS = {
    0.99999999999980993,
    676.5203681218851,
    -1259.1392167224028,
    771.32342877765313,
    -176.61502916214059,
    12.507343278686905,
    -0.13857109526572012,
    9.9843695780195716e-6,
    1.5056327351493116e-7
  };

  /** The gamma function, by the Lanczos approximation. */
  static double gamma(double x) {
    if (x == Math.rint(x) && x <= 0) {
      return Double.NaN;
    } else if (x < 0.5) {
      // Reflection formula
      return Math.PI / (Math.sin(Math.PI * x) * gamma(1 - x));
    }
    x -= 1;
    double a = LANCZOS[0];
    double t = x + 7.5;
    for (int i = 1; i < LANCZOS.length; i++) {
      a += LANCZOS[i] / (x + i);
    }
    return Math.sqrt(2 * Math.PI) * Math.pow(t, x + 0.5) * Math.exp(-t) * a;
  }

  /** The principal branch of the Lambert W function, by Halley's method. */
  static double lambertW(double x) {
    if (x < -1 / Math.E) {
      return Double.NaN;
    } else if (x == 0) {
      return 0;
    }
    double w = (x < 1) ? 0 : Math.log(x) - Math.log(Math.log(x) + 1);
    for (int i = 0; i < 100; i++) {
      double ew = Math.exp(w);
      double f = w * ew - x;
      double next = w - f / (ew * (w + 1) - (w + 2) * f / (2 * w + 2));
      if (Math.abs(next - w) <= 1e-15 * (1 + Math.abs(next))) {
        return next;
      }
      w = next;
    }
    return w;
  }
}

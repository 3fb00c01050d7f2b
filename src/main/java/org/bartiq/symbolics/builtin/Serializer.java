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
import java.util.List;
import org.bartiq.symbolics.builtin.Expr.Add;
import org.bartiq.symbolics.builtin.Expr.Call;
import org.bartiq.symbolics.builtin.Expr.Constant;
import org.bartiq.symbolics.builtin.Expr.Mul;
import org.bartiq.symbolics.builtin.Expr.Num;
import org.bartiq.symbolics.builtin.Expr.Pow;
import org.bartiq.symbolics.builtin.Expr.RangeOp;
import org.bartiq.symbolics.builtin.Expr.Sym;
import org.bartiq.symbolics.builtin.Expr.Wild;

/**
 * Converts expressions to text in the syntax accepted by the parser. Sums are written with their
 * numeric term last and subtractions where a term's coefficient is negative; products are written
 * with a single division for all factors with negative exponents; square roots are written as
 * {@code sqrt(x)}.
 */
final class Serializer {

  // Statics only
  private Serializer() {}

  // Operator precedences
  private static final int ADD = 10;
  private static final int MUL = 20;
  private static final int POW = 30;
  private static final int ATOM = 100;

  static String serialize(Expr expr) {
    StringBuilder sb = new StringBuilder();
    write(expr, sb);
    return sb.toString();
  }

  private static int precedence(Expr expr) {
    if (expr instanceof Num num) {
      return (num.signum() < 0 || (num.isExact() && !num.isInteger())) ? MUL : ATOM;
    } else if (expr instanceof Add) {
      return ADD;
    } else if (expr instanceof Mul) {
      return MUL;
    } else if (expr instanceof Pow pow) {
      if (pow.exponent.equals(Num.HALF)) {
        return ATOM;
      }
      return (pow.exponent instanceof Num e && e.signum() < 0) ? MUL : POW;
    }
    return ATOM;
  }

  /** Writes {@code expr}, parenthesized if its precedence is less than {@code minPrecedence}. */
  private static void write(Expr expr, StringBuilder sb, int minPrecedence) {
    if (precedence(expr) < minPrecedence) {
      sb.append('(');
      write(expr, sb);
      sb.append(')');
    } else {
      write(expr, sb);
    }
  }

  private static void write(Expr expr, StringBuilder sb) {
    if (expr instanceof Num num) {
      writeNumber(num, sb);
    } else if (expr instanceof Sym sym) {
      sb.append(sym.name);
    } else if (expr instanceof Constant constant) {
      sb.append(constant.name);
    } else if (expr instanceof Wild wild) {
      sb.append('$').append(wild.name);
    } else if (expr instanceof Add add) {
      writeSum(add, sb);
    } else if (expr instanceof Mul mul) {
      writeProduct(Algebra.coefficient(mul), Algebra.nonNumericFactors(mul), sb);
    } else if (expr instanceof Pow pow) {
      writePower(pow, sb);
    } else if (expr instanceof Call call) {
      writeCall(call.name, call.args, sb);
    } else if (expr instanceof RangeOp range) {
      writeCall(
          range.functionName(),
          ImmutableList.of(range.term, Sym.of(range.iterator), range.start, range.end),
          sb);
    } else {
      throw new AssertionError(expr.getClass());
    }
  }

  private static void writeNumber(Num num, StringBuilder sb) {
    if (!num.isExact()) {
      sb.append(num.doubleValue());
    } else if (num.isInteger()) {
      sb.append(num.numerator);
    } else {
      sb.append(num.numerator).append('/').append(num.denominator);
    }
  }

  private static void writeSum(Add add, StringBuilder sb) {
    // Numeric terms come first in the canonical order, but read better last.
    List<Expr> terms = new ArrayList<>(add.terms);
    if (terms.get(0) instanceof Num) {
      terms.add(terms.remove(0));
    }
    write(terms.get(0), sb, ADD);
    for (Expr term : terms.subList(1, terms.size())) {
      if (Algebra.coefficient(term).signum() < 0) {
        sb.append(" - ");
        write(Algebra.negate(term), sb, MUL);
      } else {
        sb.append(" + ");
        write(term, sb, ADD);
      }
    }
  }

  private static void writeProduct(Num coefficient, List<Expr> factors, StringBuilder sb) {
    List<Expr> numerator = new ArrayList<>();
    List<Expr> denominator = new ArrayList<>();
    for (Expr factor : factors) {
      if (factor instanceof Pow pow && pow.exponent instanceof Num e && e.signum() < 0) {
        denominator.add(Algebra.pow(pow.base, e.negate()));
      } else {
        numerator.add(factor);
      }
    }
    if (coefficient.signum() < 0) {
      sb.append('-');
      coefficient = coefficient.negate();
    }
    if (coefficient.isExact()) {
      if (!coefficient.numerator.equals(BigInteger.ONE)) {
        numerator.add(0, Num.of(coefficient.numerator));
      }
      if (!coefficient.denominator.equals(BigInteger.ONE)) {
        denominator.add(0, Num.of(coefficient.denominator));
      }
    } else if (!coefficient.isOne()) {
      numerator.add(0, coefficient);
    }
    if (numerator.isEmpty()) {
      sb.append('1');
    } else {
      writeFactors(numerator, sb);
    }
    if (!denominator.isEmpty()) {
      sb.append('/');
      if (denominator.size() == 1 && precedence(denominator.get(0)) > MUL) {
        write(denominator.get(0), sb);
      } else {
        sb.append('(');
        writeFactors(denominator, sb);
        sb.append(')');
      }
    }
  }

  private static void writeFactors(List<Expr> factors, StringBuilder sb) {
    for (int i = 0; i < factors.size(); i++) {
      if (i != 0) {
        sb.append('*');
      }
      write(factors.get(i), sb, MUL + 1);
    }
  }

  private static void writePower(Pow pow, StringBuilder sb) {
    if (pow.exponent.equals(Num.HALF)) {
      writeCall("sqrt", ImmutableList.of(pow.base), sb);
    } else if (pow.exponent instanceof Num e && e.signum() < 0) {
      writeProduct(Num.ONE, ImmutableList.of(pow), sb);
    } else {
      write(pow.base, sb, POW + 1);
      sb.append('^');
      write(pow.exponent, sb, ATOM);
    }
  }

  private static void writeCall(String name, List<Expr> args, StringBuilder sb) {
    sb.append(name).append('(');
    for (int i = 0; i < args.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      write(args.get(i), sb);
    }
    sb.append(')');
  }
}

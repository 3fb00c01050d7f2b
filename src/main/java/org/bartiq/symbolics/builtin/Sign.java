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

import org.bartiq.symbolics.builtin.Expr.Add;
import org.bartiq.symbolics.builtin.Expr.Call;
import org.bartiq.symbolics.builtin.Expr.Constant;
import org.bartiq.symbolics.builtin.Expr.Mul;
import org.bartiq.symbolics.builtin.Expr.Num;
import org.bartiq.symbolics.builtin.Expr.Pow;
import org.bartiq.symbolics.builtin.Expr.Sym;

/**
 * What is known about the sign of a real-valued expression. The values form a small lattice:
 * ZERO, POSITIVE and NEGATIVE are exact; NONNEGATIVE and NONPOSITIVE each cover two of them;
 * UNKNOWN covers everything.
 */
public enum Sign {
  ZERO,
  POSITIVE,
  NEGATIVE,
  NONNEGATIVE,
  NONPOSITIVE,
  UNKNOWN;

  public boolean isPositive() {
    return this == POSITIVE;
  }

  public boolean isNegative() {
    return this == NEGATIVE;
  }

  public boolean isNonNegative() {
    return this == POSITIVE || this == ZERO || this == NONNEGATIVE;
  }

  public boolean isNonPositive() {
    return this == NEGATIVE || this == ZERO || this == NONPOSITIVE;
  }

  /** True if the value is known to be nonzero. */
  public boolean isNonZero() {
    return this == POSITIVE || this == NEGATIVE;
  }

  public Sign negate() {
    return switch (this) {
      case POSITIVE -> NEGATIVE;
      case NEGATIVE -> POSITIVE;
      case NONNEGATIVE -> NONPOSITIVE;
      case NONPOSITIVE -> NONNEGATIVE;
      default -> this;
    };
  }

  /** Returns the sign of a sum of values with signs {@code this} and {@code other}. */
  Sign plus(Sign other) {
    if (this == ZERO) {
      return other;
    } else if (other == ZERO) {
      return this;
    } else if (isNonNegative() && other.isNonNegative()) {
      return (isPositive() || other.isPositive()) ? POSITIVE : NONNEGATIVE;
    } else if (isNonPositive() && other.isNonPositive()) {
      return (isNegative() || other.isNegative()) ? NEGATIVE : NONPOSITIVE;
    }
    return UNKNOWN;
  }

  /** Returns the sign of a product of values with signs {@code this} and {@code other}. */
  Sign times(Sign other) {
    if (this == ZERO || other == ZERO) {
      return ZERO;
    } else if (this == UNKNOWN || other == UNKNOWN) {
      return UNKNOWN;
    }
    boolean exact = isNonZero() && other.isNonZero();
    boolean negative = isNonPositive() != other.isNonPositive();
    if (negative) {
      return exact ? NEGATIVE : NONPOSITIVE;
    } else {
      return exact ? POSITIVE : NONNEGATIVE;
    }
  }

  /** Returns the sign of the given number. */
  static Sign of(Num num) {
    int signum = num.signum();
    return (signum > 0) ? POSITIVE : (signum < 0) ? NEGATIVE : ZERO;
  }

  /** Infers what can be determined about the sign of {@code expr}. */
  public static Sign of(Expr expr) {
    if (expr instanceof Num num) {
      return of(num);
    } else if (expr instanceof Sym sym) {
      return sym.sign;
    } else if (expr instanceof Constant) {
      return (expr == Constant.UNDEFINED) ? UNKNOWN : POSITIVE;
    } else if (expr instanceof Add add) {
      Sign result = ZERO;
      for (Expr term : add.terms) {
        result = result.plus(of(term));
        if (result == UNKNOWN) {
          break;
        }
      }
      return result;
    } else if (expr instanceof Mul mul) {
      Sign result = POSITIVE;
      for (Expr factor : mul.factors) {
        result = result.times(of(factor));
      }
      return result;
    } else if (expr instanceof Pow pow) {
      return ofPower(pow);
    } else if (expr instanceof Call call) {
      return ofCall(call);
    }
    return UNKNOWN;
  }

  private static Sign ofPower(Pow pow) {
    Sign base = of(pow.base);
    if (base == POSITIVE) {
      return POSITIVE;
    } else if (pow.exponent instanceof Num e && e.isInteger()) {
      boolean even = !e.bigIntegerValue().testBit(0);
      if (even) {
        return base.isNonZero() ? POSITIVE : NONNEGATIVE;
      }
      // Odd powers preserve the sign (negative exponents can't produce zero)
      return (base == ZERO) ? UNKNOWN : base;
    } else if (base.isNonNegative()) {
      return NONNEGATIVE;
    }
    return UNKNOWN;
  }

  private static Sign ofCall(Call call) {
    switch (call.name) {
      case "exp":
        return POSITIVE;
      case "abs":
        return of(call.args.get(0)).isNonZero() ? POSITIVE : NONNEGATIVE;
      case "heaviside":
        return NONNEGATIVE;
      case "ceiling":
        {
          Sign arg = of(call.args.get(0));
          if (arg.isPositive()) {
            return POSITIVE;
          }
          return arg.isNonNegative() ? NONNEGATIVE : arg.isNonPositive() ? NONPOSITIVE : UNKNOWN;
        }
      case "floor":
        {
          Sign arg = of(call.args.get(0));
          if (arg.isNegative()) {
            return NEGATIVE;
          }
          return arg.isNonPositive() ? NONPOSITIVE : arg.isNonNegative() ? NONNEGATIVE : UNKNOWN;
        }
      case "sgn":
        return of(call.args.get(0));
      case "max":
        {
          Sign result = UNKNOWN;
          for (Expr arg : call.args) {
            Sign s = of(arg);
            if (s.isPositive()) {
              return POSITIVE;
            } else if (s.isNonNegative()) {
              result = NONNEGATIVE;
            }
          }
          return result;
        }
      case "min":
        {
          Sign result = UNKNOWN;
          for (Expr arg : call.args) {
            Sign s = of(arg);
            if (s.isNegative()) {
              return NEGATIVE;
            } else if (s.isNonPositive()) {
              result = NONPOSITIVE;
            }
          }
          return result;
        }
      default:
        return UNKNOWN;
    }
  }
}

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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import java.math.BigDecimal;
import java.math.BigInteger;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.bartiq.symbolics.builtin.Expr.Constant;
import org.bartiq.symbolics.builtin.Expr.Num;
import org.bartiq.symbolics.builtin.Expr.Pow;
import org.junit.Test;
import org.junit.runner.RunWith;

/**
 * Checks the canonical forms produced by the constructors and built-in functions: each input must
 * parse to the same expression as its expected form.
 */
@RunWith(JUnitParamsRunner.class)
public class AlgebraTest {

  private static final BuiltinEngine ENGINE = BuiltinEngine.INSTANCE;

  private static Object[] arithmetic() {
    return new Object[] {
      new Object[] {"x + 2*x - 3*x", "0"},
      new Object[] {"x + x", "2*x"},
      new Object[] {"x * x", "x^2"},
      new Object[] {"x / x", "1"},
      new Object[] {"a*b/a", "b"},
      new Object[] {"2*(x + y)", "2*x + 2*y"},
      new Object[] {"(2*x)^2", "4*x^2"},
      new Object[] {"(a^2)^3", "a^6"},
      new Object[] {"(a*b)^2", "a^2*b^2"},
      new Object[] {"(x + 1)*(x - 1)", "(x - 1)*(x + 1)"},
      new Object[] {"sqrt(x)^2", "x"},
      new Object[] {"2/4", "1/2"},
      new Object[] {"1/3 + 1/6", "1/2"},
      new Object[] {"0.25 + 1/4", "0.5"},
      new Object[] {"2^10", "1024"},
      new Object[] {"4^(3/2)", "8"},
      new Object[] {"(1/4)^(1/2)", "1/2"},
      new Object[] {"0^(-1)", "oo"},
      new Object[] {"oo + 5", "oo"},
      new Object[] {"7 // 2", "3"},
      new Object[] {"-7 // 2", "-4"},
      new Object[] {"7 % 3", "1"},
      new Object[] {"x ** 2", "x^2"},
    };
  }

  private static Object[] functions() {
    return new Object[] {
      new Object[] {"sqrt(4)", "2"},
      new Object[] {"cbrt(27)", "3"},
      new Object[] {"sqrt(x)", "x^(1/2)"},
      new Object[] {"exp(0)", "1"},
      new Object[] {"exp(log(y))", "y"},
      new Object[] {"log(exp(2))", "2"},
      new Object[] {"log2(8)", "3"},
      new Object[] {"log_2(x)", "log(x, 2)"},
      new Object[] {"log10(1000)", "3"},
      new Object[] {"exp2(3)", "8"},
      new Object[] {"sin(0) + cos(0)", "1"},
      new Object[] {"mod(7, -3)", "-2"},
      new Object[] {"max(3, 5, 1)", "5"},
      new Object[] {"max(1, 2, x, x)", "max(x, 2)"},
      new Object[] {"max(a, max(b, c))", "max(a, b, c)"},
      new Object[] {"max(a, a + 1)", "a + 1"},
      new Object[] {"min(a, a + 1)", "a"},
      new Object[] {"abs(-3)", "3"},
      new Object[] {"abs(-2*x)", "abs(2*x)"},
      new Object[] {"ceiling(7/2)", "4"},
      new Object[] {"ceil(x + 3)", "ceiling(x) + 3"},
      new Object[] {"floor(-7/2)", "-4"},
      new Object[] {"floor(ceiling(x))", "ceiling(x)"},
      new Object[] {"frac(7/2)", "1/2"},
      new Object[] {"round(5/2)", "2"},
      new Object[] {"round(7/2)", "4"},
      new Object[] {"gamma(5)", "24"},
      new Object[] {"heaviside(2)", "1"},
      new Object[] {"heaviside(0)", "1/2"},
      new Object[] {"Heaviside(0, 1)", "1"},
      new Object[] {"multiplicity(2, 24)", "3"},
      new Object[] {"sum(a, b, a)", "2*a + b"},
      new Object[] {"prod(a, b, a)", "a^2*b"},
      new Object[] {"MAX(x, 1)", "max(1, x)"},
    };
  }

  private static Object[] ranges() {
    return new Object[] {
      new Object[] {"sum_over(i^2, i, 1, 4)", "30"},
      new Object[] {"prod_over(i, i, 1, 5)", "120"},
      new Object[] {"sum_over(i, i, 5, 4)", "0"},
      new Object[] {"prod_over(i, i, 5, 4)", "1"},
      new Object[] {"sum_over(c, i, 1, N)", "c*N"},
      new Object[] {"prod_over(2, i, 1, N)", "2^N"},
      new Object[] {"sum_over(3*i, i, 1, N)", "3*N/2 + 3*N^2/2"},
      new Object[] {"sum_over(i + 1, i, 0, N - 1)", "N/2 + N^2/2"},
      new Object[] {"sum_over(i^3, i, 1, N)", "N^2/4 + N^3/2 + N^4/4"},
    };
  }

  @Test
  @Parameters(method = "arithmetic")
  public void arithmetic(String input, String expected) {
    assertCanonical(input, expected);
  }

  @Test
  @Parameters(method = "functions")
  public void functions(String input, String expected) {
    assertCanonical(input, expected);
  }

  @Test
  @Parameters(method = "ranges")
  public void ranges(String input, String expected) {
    assertCanonical(input, expected);
  }

  private static void assertCanonical(String input, String expected) {
    assertWithMessage(input).that(ENGINE.parse(input)).isEqualTo(ENGINE.parse(expected));
  }

  @Test
  public void unevaluatedRange() {
    Expr range = ENGINE.parse("sum_over(log(i), i, 1, N)");
    assertThat(range).isInstanceOf(Expr.RangeOp.class);
    assertThat(range.freeSymbols()).containsExactly("N");
  }

  @Test
  public void doublesAreContagious() {
    Expr sum = ENGINE.parse("1/3 + 0.5");
    assertThat(sum).isInstanceOf(Num.class);
    assertThat(((Num) sum).isExact()).isFalse();
    assertThat(((Num) sum).doubleValue()).isWithin(1e-15).of(1.0 / 3 + 0.5);
  }

  @Test
  public void exactRationals() {
    Num third = Num.of(1, 3);
    assertThat(third.plus(third).plus(third)).isEqualTo(Num.ONE);
    assertThat(Num.of(6, -4)).isEqualTo(Num.of(-3, 2));
    assertThat(Num.of(-7, 2).floor()).isEqualTo(Num.of(-4));
    assertThat(Num.of(-7, 2).ceiling()).isEqualTo(Num.of(-3));
    assertThat(Num.of(2).equals(Num.of(2.0))).isFalse();
  }

  @Test
  public void floorOfLargeDouble() {
    BigInteger big = new BigDecimal(1e30).toBigInteger();
    assertThat(Num.of(1e30).floor()).isEqualTo(Num.of(big));
    assertThat(Num.of(-1e30).ceiling()).isEqualTo(Num.of(big.negate()));
    assertThat(Num.of(1e300).floor().bigIntegerValue().bitLength()).isGreaterThan(64);
    assertThat(Num.of(-2.5e20).floor()).isEqualTo(Num.of(new BigInteger("-250000000000000000000")));
  }

  @Test
  public void indeterminateForms() {
    for (String input : new String[] {"0/0", "0*oo", "oo - oo", "oo + x - oo", "x*oo - x*oo"}) {
      Expr result = ENGINE.parse(input);
      assertWithMessage(input).that(result).isEqualTo(Constant.UNDEFINED);
      assertWithMessage(input).that(ENGINE.numericValue(result)).isNull();
    }
    assertThat(ENGINE.parse("nan + 1")).isEqualTo(Constant.UNDEFINED);
    assertThat(ENGINE.parse("2*nan")).isEqualTo(Constant.UNDEFINED);
    assertThat(ENGINE.parse("nan^2")).isEqualTo(Constant.UNDEFINED);
    assertThat(Sign.of(Constant.UNDEFINED)).isEqualTo(Sign.UNKNOWN);
    // Determinate forms are unaffected
    assertThat(ENGINE.parse("oo + oo")).isEqualTo(Constant.INFINITY);
    assertThat(ENGINE.parse("0*x")).isEqualTo(Num.ZERO);
    assertThat(ENGINE.parse("0/oo")).isEqualTo(Num.ZERO);
  }

  @Test
  public void hugeExactPowersStaySymbolic() {
    Expr power = ENGINE.parse("(10^10000)^10000");
    assertThat(power).isInstanceOf(Pow.class);
    assertThat(((Pow) power).exponent).isEqualTo(Num.of(10000));
    assertThat(ENGINE.parse("10^10000")).isInstanceOf(Num.class);
    assertThat(ENGINE.parse("(2^1000)^1000")).isInstanceOf(Num.class);
  }

  @Test
  public void canonicalOrderIsIndependentOfInputOrder() {
    assertThat(ENGINE.parse("c*d + a + b*c")).isEqualTo(ENGINE.parse("b*c + c*d + a"));
    assertThat(ENGINE.parse("max(y, x, 0)")).isEqualTo(ENGINE.parse("max(0, x, y)"));
  }
}

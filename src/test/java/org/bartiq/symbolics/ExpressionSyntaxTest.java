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

package org.bartiq.symbolics;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.List;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class ExpressionSyntaxTest {

  /** Builds a fully parenthesized rendering of the parse tree. */
  private static final ExpressionBuilder<String> PRINTER =
      new ExpressionBuilder<>() {
        @Override
        public String number(String text) {
          return text;
        }

        @Override
        public String symbol(String name) {
          return name;
        }

        @Override
        public String wild(String name) {
          return "$" + name;
        }

        @Override
        public String call(String name, List<String> args) {
          if (name.equals("bad")) {
            throw new IllegalArgumentException("bad is not allowed");
          }
          return name + "(" + String.join(", ", args) + ")";
        }

        @Override
        public String negate(String x) {
          return "(-" + x + ")";
        }

        @Override
        public String add(String x, String y) {
          return binary(x, "+", y);
        }

        @Override
        public String subtract(String x, String y) {
          return binary(x, "-", y);
        }

        @Override
        public String multiply(String x, String y) {
          return binary(x, "*", y);
        }

        @Override
        public String divide(String x, String y) {
          return binary(x, "/", y);
        }

        @Override
        public String floorDivide(String x, String y) {
          return binary(x, "//", y);
        }

        @Override
        public String modulo(String x, String y) {
          return binary(x, "%", y);
        }

        @Override
        public String power(String x, String y) {
          return binary(x, "^", y);
        }

        private String binary(String x, String op, String y) {
          return "(" + x + " " + op + " " + y + ")";
        }
      };

  private static Object[] wellFormed() {
    return new Object[] {
      new Object[] {"a + b * c", "(a + (b * c))"},
      new Object[] {"a - b - c", "((a - b) - c)"},
      new Object[] {"-x^2", "(-(x ^ 2))"},
      new Object[] {"2^3^2", "(2 ^ (3 ^ 2))"},
      new Object[] {"a ** b", "(a ^ b)"},
      new Object[] {"2^-1", "(2 ^ (-1))"},
      new Object[] {"+x", "x"},
      new Object[] {"7 // 2 % 3", "((7 // 2) % 3)"},
      new Object[] {"(a + b) * c", "((a + b) * c)"},
      new Object[] {"1.5e-3 + .5", "(1.5e-3 + .5)"},
      new Object[] {"f(x, #in_0, a.b.#out_0)", "f(x, #in_0, a.b.#out_0)"},
      new Object[] {"g()", "g()"},
      new Object[] {"sum(~.T) + max(step~.T)", "(sum(~.T) + max(step~.T))"},
      new Object[] {"log($x + $N)", "log(($x + $N))"},
    };
  }

  @Test
  @Parameters(method = "wellFormed")
  public void parse(String text, String expected) {
    assertThat(ExpressionSyntax.parse(text, PRINTER)).isEqualTo(expected);
  }

  @Test
  public void syntaxErrors() {
    assertThrows(ParseError.class, () -> ExpressionSyntax.parse("2 +", PRINTER));
    assertThrows(ParseError.class, () -> ExpressionSyntax.parse("(a", PRINTER));
    assertThrows(ParseError.class, () -> ExpressionSyntax.parse("a b", PRINTER));
    ParseError e = assertThrows(ParseError.class, () -> ExpressionSyntax.parse("a + * b", PRINTER));
    assertThat(e.position).isEqualTo(4);
    assertThat(e.text).isEqualTo("a + * b");
  }

  @Test
  public void wildcardFunctionName() {
    ParseError e =
        assertThrows(ParseError.class, () -> ExpressionSyntax.parse("x + ~(y)", PRINTER));
    assertThat(e).hasMessageThat().contains("Wildcards cannot name a function: '~'");
  }

  @Test
  public void builderRejection() {
    ParseError e =
        assertThrows(ParseError.class, () -> ExpressionSyntax.parse("1 + bad(2)", PRINTER));
    assertThat(e.msg).isEqualTo("bad is not allowed");
    assertThat(e.position).isEqualTo(4);
  }

  @Test
  public void numberOutOfRange() {
    ParseError e =
        assertThrows(ParseError.class, () -> ExpressionSyntax.parse("2 * 1e400", PRINTER));
    assertThat(e.msg).isEqualTo("Number out of range: 1e400");
    assertThat(e.position).isEqualTo(4);
    // Integers are exact, whatever their size
    String big = "1" + "0".repeat(400);
    assertThat(ExpressionSyntax.parse(big, PRINTER)).isEqualTo(big);
  }

  @Test
  public void paths() {
    assertThat(ExpressionSyntax.isWildcarded("a~.T")).isTrue();
    assertThat(ExpressionSyntax.isWildcarded("a.T")).isFalse();
    assertThat(ExpressionSyntax.joinPath("a", "#out_0")).isEqualTo("a.#out_0");
    assertThat(ExpressionSyntax.portVariable("in_0")).isEqualTo("#in_0");
  }
}

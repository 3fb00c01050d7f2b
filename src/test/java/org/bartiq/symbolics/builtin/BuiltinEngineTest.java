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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.bartiq.symbolics.ComparisonResult;
import org.bartiq.symbolics.FunctionDefinition;
import org.bartiq.symbolics.ParseError;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BuiltinEngineTest {

  private final BuiltinEngine engine = BuiltinEngine.INSTANCE;

  private Expr parse(String text) {
    return engine.parse(text);
  }

  @Test
  public void numbers() {
    assertThat(engine.number(3)).isEqualTo(Expr.Num.of(3));
    assertThat(engine.number(0.5)).isEqualTo(Expr.Num.of(0.5));
    assertThat(engine.number(Double.POSITIVE_INFINITY)).isSameInstanceAs(Expr.Constant.INFINITY);
    assertThat(parse("1e3")).isEqualTo(Expr.Num.of(1000.0));
    assertThat(parse("12345678901234567890")).isInstanceOf(Expr.Num.class);
  }

  @Test
  public void reservedSymbols() {
    assertThat(parse("PI")).isSameInstanceAs(Expr.Constant.PI);
    assertThat(parse("Infinity")).isSameInstanceAs(Expr.Constant.INFINITY);
    assertThat(parse("noo")).isEqualTo(engine.sub(engine.number(0), Expr.Constant.INFINITY));
    // Only the reserved spellings are constants when parsing
    assertThat(parse("pi")).isEqualTo(engine.symbol("pi"));
  }

  @Test
  public void arityErrors() {
    ParseError e = assertThrows(ParseError.class, () -> parse("1 + sin(1, 2)"));
    assertThat(e).hasMessageThat().contains("Function sin takes 1 argument, got 2");
    e = assertThrows(ParseError.class, () -> parse("log()"));
    assertThat(e).hasMessageThat().contains("Function log takes 1 to 2 arguments, got 0");
    e = assertThrows(ParseError.class, () -> parse("x + 1e400"));
    assertThat(e).hasMessageThat().contains("Number out of range: 1e400");
    // Unknown functions take any number of arguments
    assertThat(parse("f(1, 2, 3)").freeSymbols()).isEmpty();
  }

  @Test
  public void numericValue() {
    assertThat(engine.numericValue(parse("7 // 2"))).isEqualTo(3L);
    assertThat(engine.numericValue(parse("log(8, 2)"))).isEqualTo(3L);
    assertThat(engine.numericValue(parse("sqrt(16)"))).isEqualTo(4L);
    assertThat(engine.numericValue(parse("1/4"))).isEqualTo(0.25);
    assertThat(engine.numericValue(parse("sqrt(2)")).doubleValue())
        .isWithin(1e-12)
        .of(Math.sqrt(2));
    assertThat(engine.numericValue(parse("2*PI")).doubleValue()).isWithin(1e-12).of(2 * Math.PI);
    // Rounded to 15 significant digits
    assertThat(engine.numericValue(parse("2*sin(PI/6)"))).isEqualTo(1L);
    assertThat(engine.numericValue(parse("x + 1"))).isNull();
    assertThat(engine.numericValue(parse("oo"))).isNull();
  }

  @Test
  public void numericCache() {
    BuiltinEngine cached = new BuiltinEngine(100);
    Expr root2 = parse("sqrt(2)");
    Number first = cached.numericValue(root2);
    assertThat(cached.numericCacheSize()).isEqualTo(1L);
    assertThat(cached.numericValue(root2)).isEqualTo(first);
    assertThat(cached.numericCacheSize()).isEqualTo(1L);
    // Values that are already numbers, and expressions with free symbols, aren't cached
    assertThat(cached.numericValue(parse("3"))).isEqualTo(3L);
    assertThat(cached.numericValue(parse("x"))).isNull();
    assertThat(cached.numericCacheSize()).isEqualTo(1L);

    BuiltinEngine uncached = new BuiltinEngine(0);
    assertThat(uncached.numericValue(root2)).isEqualTo(first);
    assertThat(uncached.numericCacheSize()).isEqualTo(0L);
  }

  @Test
  public void substitute() {
    assertThat(
            engine.substitute(
                parse("a*b + c"), ImmutableMap.of("a", parse("2"), "b", parse("3"))))
        .isEqualTo(parse("c + 6"));
    assertThat(engine.substitute(parse("x^2"), ImmutableMap.of("x", parse("y + 1"))))
        .isEqualTo(parse("(y + 1)^2"));
    // A symbol-free result is reduced to a number
    Expr root2 = engine.substitute(parse("sqrt(x)"), ImmutableMap.of("x", parse("2")));
    assertThat(root2).isInstanceOf(Expr.Num.class);
    assertThat(((Expr.Num) root2).doubleValue()).isWithin(1e-12).of(Math.sqrt(2));
    // Unchanged expressions are returned as is
    Expr pi = parse("PI");
    assertThat(engine.substitute(pi, ImmutableMap.of("x", parse("2")))).isSameInstanceAs(pi);
  }

  @Test
  public void substituteIntoRange() {
    Expr range = parse("sum_over(log(i), i, 1, N)");
    // The iterator is bound, so only N is replaced
    Expr result = engine.substitute(range, ImmutableMap.of("i", parse("5"), "N", parse("3")));
    assertThat(engine.numericValue(result).doubleValue()).isWithin(1e-12).of(Math.log(6));
  }

  @Test
  public void substituteFunctions() {
    FunctionDefinition<Expr> twice = args -> engine.mul(engine.number(2), args.get(0));
    assertThat(engine.substitute(parse("f(x) + 1"), ImmutableMap.of(), ImmutableMap.of("f", twice)))
        .isEqualTo(parse("2*x + 1"));
    // Returning null leaves the call alone
    FunctionDefinition<Expr> never = args -> null;
    assertThat(engine.substitute(parse("f(x)"), ImmutableMap.of(), ImmutableMap.of("f", never)))
        .isEqualTo(parse("f(x)"));
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> engine.substitute(parse("x"), ImmutableMap.of(), ImmutableMap.of("Max", twice)));
    assertThat(e).hasMessageThat().isEqualTo("Cannot redefine built-in function: Max");
  }

  @Test
  public void simplifyAndExpand() {
    assertThat(engine.simplify(parse("x*(y + 1) - x*y"))).isEqualTo(parse("x"));
    assertThat(engine.expand(parse("(a + b)^2"))).isEqualTo(parse("a^2 + 2*a*b + b^2"));
    assertThat(engine.expand(parse("c*(a + b)"))).isEqualTo(parse("a*c + b*c"));
    // Simplifying never makes an expression larger
    Expr product = parse("(a + b)*(c + d)");
    assertThat(engine.simplify(product)).isEqualTo(product);
  }

  @Test
  public void freeSymbols() {
    Expr expr = parse("sum_over(log(i)*x, i, 1, N) + a.b.T + #in_0");
    assertThat(engine.freeSymbols(expr)).containsExactly("x", "N", "a.b.T", "#in_0");
  }

  @Test
  public void compare() {
    assertThat(engine.compare(parse("(x + 1)^2"), parse("x^2 + 2*x + 1")))
        .isEqualTo(ComparisonResult.EQUAL);
    assertThat(engine.compare(parse("x"), parse("x + 1"))).isEqualTo(ComparisonResult.NOT_EQUAL);
    assertThat(engine.compare(parse("x"), parse("y"))).isEqualTo(ComparisonResult.UNKNOWN);
    assertThat(engine.compare(parse("2*PI"), parse("6.283185307179586")))
        .isEqualTo(ComparisonResult.EQUAL);
    assertThat(engine.compare(parse("1"), parse("2"))).isEqualTo(ComparisonResult.NOT_EQUAL);
  }

  @Test
  public void parseConstant() {
    assertThat(engine.parseConstant(parse("2*pi"))).isEqualTo(parse("2*PI"));
    assertThat(engine.parseConstant(parse("2*infinity"))).isSameInstanceAs(Expr.Constant.INFINITY);
    Expr e = engine.parseConstant(parse("E"));
    assertThat(engine.serialize(e)).isEqualTo("exp(1)");
    assertThat(engine.numericValue(e).doubleValue()).isWithin(1e-12).of(Math.E);
    Expr unchanged = parse("x + y");
    assertThat(engine.parseConstant(unchanged)).isSameInstanceAs(unchanged);
  }

  @Test
  public void sequences() {
    Expr n = engine.symbol("N");
    assertThat(engine.sequenceSum(parse("i"), "i", engine.number(1), n))
        .isEqualTo(engine.expand(parse("N*(N + 1)/2")));
    assertThat(engine.sequenceProd(parse("2"), "i", engine.number(1), n)).isEqualTo(parse("2^N"));
    assertThat(engine.sequenceSum(parse("i^2"), "i", engine.number(1), engine.number(4)))
        .isEqualTo(parse("30"));
  }

  @Test
  public void undefinedFunctions() {
    Expr expr = parse("sinn(x) + qqq(y) + f(z) + sin(sinn(w))");
    assertThat(engine.findUndefinedFunctions(expr, ImmutableSet.of("f")))
        .containsExactly("sinn", "sin", "qqq", "");
    assertThat(engine.findUndefinedFunctions(parse("log(x) + ceil(y)"), ImmutableSet.of()))
        .isEmpty();
  }

  @Test
  public void inspection() {
    assertThat(engine.singleParameterName(parse("x"))).isEqualTo("x");
    assertThat(engine.singleParameterName(parse("x + 1"))).isNull();
    assertThat(engine.isConstantInt(parse("6/2"))).isTrue();
    assertThat(engine.isConstantInt(parse("3/2"))).isFalse();
    assertThat(engine.isConstantInt(parse("n"))).isFalse();
    assertThat(engine.reservedFunctions()).containsAtLeast("log2", "ceil", "ceiling", "sum_over");
  }

  @Test
  public void unrollWildcards() {
    ImmutableMap<String, ImmutableList<String>> two =
        ImmutableMap.of("~.T", ImmutableList.of("a.T", "b.T"));
    assertThat(engine.unrollWildcards(parse("sum(~.T) + 2"), two))
        .isEqualTo(parse("a.T + b.T + 2"));
    assertThat(engine.unrollWildcards(parse("max(~.T, 0)"), two))
        .isEqualTo(parse("max(0, a.T, b.T)"));
    ImmutableMap<String, ImmutableList<String>> one =
        ImmutableMap.of("~.T", ImmutableList.of("a.T"));
    assertThat(engine.unrollWildcards(parse("max(~.T)"), one)).isEqualTo(parse("a.T"));
    assertThat(engine.unrollWildcards(parse("2*~.T"), one)).isEqualTo(parse("2*a.T"));
    assertThrows(
        IllegalArgumentException.class, () -> engine.unrollWildcards(parse("~.T + 1"), two));
  }

  @Test
  public void serializedTextReparses() {
    for (String text :
        ImmutableList.of(
            "x^2 + 2*x + 1",
            "a - b/(c*d)",
            "-x^(1/3)",
            "sqrt(x + 1)*PI",
            "max(0, a - 1) + ceiling(log(n, 2))",
            "sum_over(log(i)*i, i, 1, N)",
            "2^(x + 1)*3/4")) {
      Expr expr = parse(text);
      assertThat(parse(engine.serialize(expr))).isEqualTo(expr);
    }
  }
}

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


package org.bartiq.rewriter;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.bartiq.rewriter.Instruction.Assumption;
import org.bartiq.rewriter.Instruction.Substitution;
import org.bartiq.symbolics.builtin.BuiltinEngine;
import org.bartiq.symbolics.builtin.Expr;
import org.bartiq.symbolics.builtin.Expr.Sym;
import org.bartiq.symbolics.builtin.Sign;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class BuiltinRewriterTest {

  private static final BuiltinEngine ENGINE = BuiltinEngine.INSTANCE;

  private static final String TRIVIAL = "a";
  private static final String SUM_AND_MUL = "a + b + c + d + c*d + a*b";
  private static final String MANY_FUNCS =
      "a*log2(x/n) + b*(max(0, 1 + y, 2 + x) + Heaviside(aleph, beth))";
  private static final String NESTED_MAX = "max(a, 1 - max(b, 1 - max(c, lamda)))";

  private static Expr parse(String text) {
    return ENGINE.parse(text);
  }

  @Test
  public void individualTerms() {
    assertThat(BuiltinRewriter.of(TRIVIAL).individualTerms()).containsExactly(parse("a"));
    assertThat(BuiltinRewriter.of(SUM_AND_MUL).individualTerms())
        .containsExactly(
            parse("a"), parse("b"), parse("c"), parse("d"), parse("c*d"), parse("a*b"));
  }

  @Test
  public void freeSymbols() {
    assertThat(BuiltinRewriter.of(NESTED_MAX).freeSymbols())
        .containsExactly("a", "b", "c", "lamda");
    assertThat(BuiltinRewriter.of(MANY_FUNCS).freeSymbols())
        .containsExactly("a", "b", "x", "n", "y", "aleph", "beth");
  }

  @Test
  public void focus() {
    BuiltinRewriter rewriter = BuiltinRewriter.of(SUM_AND_MUL);
    assertThat(rewriter.focus("a", "Xi")).isEqualTo(parse("a*(b + 1)"));
    assertThat(rewriter.focus("c")).isEqualTo(parse("c*(d + 1)"));
    assertThat(rewriter.focus("Xi")).isNull();
    // Focusing does not change the rewriter
    assertThat(rewriter.history()).containsExactly(Instruction.INITIAL);
  }

  @Test
  public void assumePositive() {
    ExpressionRewriter<Expr> rewriter = BuiltinRewriter.of("max(0, X)").assume("X > 0");
    assertThat(rewriter.toString()).isEqualTo("X");
    assertThat(((Sym) rewriter.expression).sign).isEqualTo(Sign.POSITIVE);
  }

  @Test
  public void assumeNegative() {
    ExpressionRewriter<Expr> rewriter = BuiltinRewriter.of("min(0, X)").assume("X < 0");
    assertThat(rewriter.expression).isEqualTo(parse("X"));
  }

  @Test
  public void assumeNonzeroBound() {
    ExpressionRewriter<Expr> rewriter = BuiltinRewriter.of("max(5, X)").assume("X > 5");
    assertThat(rewriter.expression).isEqualTo(parse("X"));
    assertThat(rewriter.freeSymbols()).containsExactly("X");
  }

  @Test
  public void assumptionsAreTracked() {
    ExpressionRewriter<Expr> rewriter = BuiltinRewriter.of(SUM_AND_MUL);
    for (String assumption : ImmutableList.of("a>0", "b<0", "c>=0", "d<=10")) {
      rewriter = rewriter.assume(assumption);
    }
    assertThat(rewriter.assumptions())
        .containsExactly(
            new Assumption("a", Comparator.GREATER_THAN, 0),
            new Assumption("b", Comparator.LESS_THAN, 0),
            new Assumption("c", Comparator.GREATER_THAN_OR_EQUAL, 0),
            new Assumption("d", Comparator.LESS_THAN_OR_EQUAL, 10))
        .inOrder();
    assertThat(rewriter.expression).isEqualTo(parse(SUM_AND_MUL));
  }

  @Test
  public void history() {
    ExpressionRewriter<Expr> rewriter =
        BuiltinRewriter.of(MANY_FUNCS).expand().simplify().assume("beth>0");
    assertThat(rewriter.history())
        .containsExactly(
            Instruction.INITIAL,
            Instruction.EXPAND,
            Instruction.SIMPLIFY,
            Assumption.parse("beth>0"))
        .inOrder();
  }

  @Test
  public void undoPrevious() {
    ExpressionRewriter<Expr> initial = BuiltinRewriter.of(MANY_FUNCS);
    ExpressionRewriter<Expr> oneStep = initial.expand();
    ExpressionRewriter<Expr> twoStep = oneStep.simplify();
    ExpressionRewriter<Expr> threeStep = twoStep.assume("beth>0");
    assertThat(threeStep.undoPrevious()).isSameInstanceAs(twoStep);
    assertThat(threeStep.undoPrevious(2)).isSameInstanceAs(oneStep);
    assertThat(threeStep.undoPrevious(3)).isSameInstanceAs(initial);
    assertThat(oneStep.undoPrevious()).isSameInstanceAs(initial);
  }

  @Test
  public void original() {
    ExpressionRewriter<Expr> initial = BuiltinRewriter.of(TRIVIAL);
    assertThat(initial.expand().simplify().assume("a>0").original()).isSameInstanceAs(initial);
  }

  @Test
  public void undoTooMany() {
    ExpressionRewriter<Expr> rewriter =
        BuiltinRewriter.of(MANY_FUNCS).expand().simplify().assume("a > 0");
    RewriterError e = assertThrows(RewriterError.class, () -> rewriter.undoPrevious(6));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "Attempting to undo too many operations! Only 3 transforming commands in history.");
  }

  @Test
  @Parameters({"0", "-1"})
  public void undoTooFew(int steps) {
    ExpressionRewriter<Expr> rewriter = BuiltinRewriter.of(TRIVIAL).expand().simplify();
    RewriterError e = assertThrows(RewriterError.class, () -> rewriter.undoPrevious(steps));
    assertThat(e).hasMessageThat().isEqualTo("Can't undo fewer than one previous command.");
  }

  @Test
  public void reapplyAllAssumptions() {
    ExpressionRewriter<Expr> assumed =
        BuiltinRewriter.of("max(0, x) + y").assume("x>0").substitute("y", "max(0, x + 1)");
    assertThat(assumed.expression).isEqualTo(parse("x + max(0, x + 1)"));

    ExpressionRewriter<Expr> reapplied = assumed.reapplyAllAssumptions();
    assertThat(reapplied.undoPrevious()).isSameInstanceAs(assumed);
    assertThat(reapplied.history().get(3)).isEqualTo(Instruction.REAPPLY_ALL_ASSUMPTIONS);
    assertThat(reapplied.expression).isEqualTo(parse("2*x + 1"));
  }

  private Object[] substitutions() {
    return new Object[] {
      new Object[] {TRIVIAL, "a", "b", "b"},
      new Object[] {SUM_AND_MUL, "a + b", "X", "X + c + d + c*d + a*b"},
      new Object[] {
        MANY_FUNCS,
        "a*log2(x/n)",
        "A(x)",
        "A(x) + b*(max(0, 1 + y, 2 + x) + Heaviside(aleph, beth))"
      },
      new Object[] {NESTED_MAX, "max(b, 1 - max(c, lamda))", "1 - lamda", "max(a, lamda)"},
      new Object[] {"f(a + b) + f(c)", "f($x)", "g(x)", "g(a + b) + g(c)"},
      new Object[] {"f(2) + f(a)", "f($x)", "x", "f(2) + a"},
      new Object[] {"f(a) + f(a + b)", "f($X)", "X", "a + f(a + b)"},
    };
  }

  @Test
  @Parameters(method = "substitutions")
  public void substitute(String expression, String pattern, String replacement, String expected) {
    assertThat(BuiltinRewriter.of(expression).substitute(pattern, replacement).expression)
        .isEqualTo(parse(expected));
  }

  @Test
  public void substitutionsAreTracked() {
    ImmutableList<Substitution> substitutions =
        ImmutableList.of(
            new Substitution("x/n", "z"),
            new Substitution("a*log2(z)", "A"),
            new Substitution("Heaviside(aleph, beth)", "h"),
            new Substitution("b*(max(0, 1 + y, 2 + x) + h)", "B"));
    ExpressionRewriter<Expr> rewriter = BuiltinRewriter.of(MANY_FUNCS);
    for (Substitution substitution : substitutions) {
      rewriter = rewriter.substitute(substitution);
    }
    assertThat(rewriter.expression).isEqualTo(parse("A + B"));
    assertThat(rewriter.substitutions()).containsExactlyElementsIn(substitutions).inOrder();
    assertThat(rewriter.linkedSymbols().get("z")).containsExactly("x", "n");
    assertThat(rewriter.linkedSymbols().get("B")).containsExactly("b", "x", "y", "h");
    // n was replaced by z, which was replaced by A
    assertThat(rewriter.focus("n")).isEqualTo(parse("A"));
  }

  @Test
  public void wildSubstitutionsAreNotLinked() {
    ExpressionRewriter<Expr> rewriter =
        BuiltinRewriter.of("log(a) + log(b)").substitute("log($x)", "L");
    assertThat(rewriter.expression).isEqualTo(parse("2*L"));
    assertThat(rewriter.linkedSymbols()).isEmpty();
  }

  @Test
  public void evaluateExpression() {
    ExpressionRewriter<Expr> rewriter = BuiltinRewriter.of("a*max(0, 1 + y, 2 + x) + b");
    Expr value =
        rewriter.evaluateExpression(
            ImmutableMap.of(
                "a", ENGINE.number(2),
                "b", ENGINE.number(1),
                "x", ENGINE.number(2),
                "y", ENGINE.number(3)));
    assertThat(ENGINE.numericValue(value).doubleValue()).isWithin(1e-12).of(9.0);
    assertThat(rewriter.history()).hasSize(1);
  }

  @Test
  public void withInstructions() {
    ImmutableList<Instruction> instructions =
        ImmutableList.of(
            Instruction.INITIAL,
            Instruction.EXPAND,
            Instruction.SIMPLIFY,
            Assumption.parse("y > 0"),
            Assumption.parse("x > 0"),
            new Substitution("a*log2(x/n)", "Xi"));
    ExpressionRewriter<Expr> rewriter = BuiltinRewriter.of(MANY_FUNCS);
    ExpressionRewriter<Expr> updated = rewriter.withInstructions(instructions);

    assertThat(updated.history()).containsExactlyElementsIn(instructions).inOrder();
    assertThat(updated)
        .isEqualTo(
            rewriter
                .expand()
                .simplify()
                .assume("y > 0")
                .assume("x > 0")
                .substitute("a*log2(x/n)", "Xi"));
  }

  @Test
  public void functionsAndArguments() {
    BuiltinRewriter rewriter = BuiltinRewriter.of("max(a, f(b, c)) + f(d, e)");
    assertThat(rewriter.allFunctionsAndArguments())
        .containsExactly(parse("max(a, f(b, c))"), parse("f(b, c)"), parse("f(d, e)"));
    assertThat(rewriter.listArgumentsOfFunction("F"))
        .containsExactly(
            ImmutableList.of(parse("b"), parse("c")), ImmutableList.of(parse("d"), parse("e")));
    assertThat(rewriter.listArgumentsOfFunction("g")).isEmpty();
  }
}

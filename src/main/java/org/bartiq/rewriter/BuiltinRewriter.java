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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.bartiq.rewriter.Instruction.Assumption;
import org.bartiq.symbolics.builtin.BuiltinEngine;
import org.bartiq.symbolics.builtin.Expr;
import org.bartiq.symbolics.builtin.Expr.Call;
import org.bartiq.symbolics.builtin.Expr.Num;
import org.bartiq.symbolics.builtin.Expr.Sym;
import org.bartiq.symbolics.builtin.Sign;

/** An {@link ExpressionRewriter} for expressions of the {@link BuiltinEngine}. */
public final class BuiltinRewriter extends ExpressionRewriter<Expr> {
  private static final BuiltinEngine ENGINE = BuiltinEngine.INSTANCE;

  /**
   * The name of the symbol that temporarily stands for {@code subject - bound} while an assumption
   * with a nonzero bound is applied.
   */
  private static final String PLACEHOLDER = "__";

  private BuiltinRewriter(Expr expression) {
    super(ENGINE, expression);
  }

  private BuiltinRewriter(
      BuiltinRewriter previous,
      Instruction instruction,
      Expr expression,
      ImmutableMap<String, ImmutableSet<String>> linked) {
    super(previous, instruction, expression, linked);
  }

  public static BuiltinRewriter of(Expr expression) {
    return new BuiltinRewriter(expression);
  }

  public static BuiltinRewriter of(String text) {
    return new BuiltinRewriter(ENGINE.parse(text));
  }

  @Override
  protected ExpressionRewriter<Expr> next(
      Instruction instruction, Expr expression, ImmutableMap<String, ImmutableSet<String>> linked) {
    return new BuiltinRewriter(this, instruction, expression, linked);
  }

  /**
   * If the assumption compares a symbol with zero, each occurrence of the symbol is marked with
   * the corresponding sign. Otherwise the subject is replaced by {@code placeholder + bound}, where
   * the placeholder is a symbol with that sign, and then the placeholder is replaced by {@code
   * subject - bound}. Whatever the placeholder's sign allows is simplified in between.
   */
  @Override
  protected Expr applyAssumption(Expr expr, Assumption assumption) {
    Sign sign =
        switch (assumption.comparator) {
          case GREATER_THAN -> Sign.POSITIVE;
          case GREATER_THAN_OR_EQUAL -> Sign.NONNEGATIVE;
          case LESS_THAN -> Sign.NEGATIVE;
          case LESS_THAN_OR_EQUAL -> Sign.NONPOSITIVE;
        };
    Expr subject = ENGINE.parse(assumption.subject);
    if (assumption.bound == 0 && subject instanceof Sym sym) {
      return ENGINE.withSign(expr, sym.name, sign);
    }
    Expr bound = toExpr(assumption.bound);
    Sym placeholder = Sym.of(PLACEHOLDER, sign);
    Expr shifted = ENGINE.replace(expr, subject, ENGINE.add(placeholder, bound));
    return ENGINE.replace(shifted, placeholder, ENGINE.sub(subject, bound));
  }

  private static Expr toExpr(double bound) {
    if (bound == Math.rint(bound) && Math.abs(bound) < 1e15) {
      return Num.of((long) bound);
    }
    return ENGINE.number(bound);
  }

  @Override
  protected Expr applySubstitution(Expr expr, Expr pattern, Expr replacement) {
    return ENGINE.replace(expr, pattern, replacement);
  }

  @Override
  public ImmutableList<Expr> individualTerms() {
    return ENGINE.terms(expression);
  }

  @Override
  public ImmutableSet<Expr> allFunctionsAndArguments() {
    return ImmutableSet.copyOf(ENGINE.calls(expression));
  }

  @Override
  public ImmutableList<ImmutableList<Expr>> listArgumentsOfFunction(String name) {
    ImmutableList.Builder<ImmutableList<Expr>> builder = ImmutableList.builder();
    for (Call call : ENGINE.calls(expression)) {
      if (Ascii.equalsIgnoreCase(call.name, name)) {
        builder.add(call.args);
      }
    }
    return builder.build();
  }
}

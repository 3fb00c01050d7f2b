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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.bartiq.symbolics.ExpressionParser.CallExpressionContext;
import org.bartiq.symbolics.ExpressionParser.ExpressionContext;
import org.bartiq.symbolics.ExpressionParser.NumberExpressionContext;
import org.bartiq.symbolics.ExpressionParser.PowerExpressionContext;
import org.bartiq.symbolics.ExpressionParser.ProductExpressionContext;
import org.bartiq.symbolics.ExpressionParser.SumExpressionContext;
import org.bartiq.symbolics.ExpressionParser.SymbolExpressionContext;
import org.bartiq.symbolics.ExpressionParser.UnaryExpressionContext;
import org.bartiq.symbolics.ExpressionParser.WildExpressionContext;

/**
 * Parses the text syntax of cost expressions and hands each construct to an {@link
 * ExpressionBuilder}, so that every algebra engine shares one grammar.
 */
public final class ExpressionSyntax {

  // Static methods only
  private ExpressionSyntax() {}

  /** The character that marks a wildcarded path segment, e.g. {@code ~.T}. */
  public static final char WILDCARD = '~';

  /** The prefix of a port reference, e.g. {@code #in_0}. */
  public static final char PORT_PREFIX = '#';

  /** The separator between the segments of a path, e.g. {@code a.b.T}. */
  public static final char PATH_SEPARATOR = '.';

  /**
   * Parses {@code text}, building the result with {@code builder}.
   *
   * @throws ParseError if the text is not a well-formed expression
   */
  public static <E> E parse(String text, ExpressionBuilder<E> builder) {
    checkNotNull(text);
    // Throw ParseErrors in response to lexing or parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new ParseError(msg, text, charPositionInLine);
          }
        };
    ExpressionLexer lexer = new ExpressionLexer(CharStreams.fromString(text));
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    ExpressionParser parser = new ExpressionParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    ExpressionContext tree = parser.unit().expression();
    return new Reader<>(text, builder).visit(tree);
  }

  /** Returns true if {@code name} is a path segment list containing a wildcard. */
  public static boolean isWildcarded(String name) {
    return name.indexOf(WILDCARD) >= 0;
  }

  /** Joins two path fragments with {@link #PATH_SEPARATOR}. */
  public static String joinPath(String prefix, String suffix) {
    return prefix + PATH_SEPARATOR + suffix;
  }

  /** Returns the port-reference name for the given port, e.g. {@code #in_0}. */
  public static String portVariable(String portName) {
    return PORT_PREFIX + portName;
  }

  /** Walks a parse tree, calling the builder for each node. */
  private static class Reader<E> extends VisitorBase<E> {
    final ExpressionBuilder<E> builder;

    Reader(String text, ExpressionBuilder<E> builder) {
      super(text);
      this.builder = builder;
    }

    @Override
    public E visitNumberExpression(NumberExpressionContext ctx) {
      String number = ctx.NUMBER().getText();
      if (!isInteger(number) && Double.isInfinite(Double.parseDouble(number))) {
        throw error("Number out of range: %s", number);
      }
      return builder.number(number);
    }

    private static boolean isInteger(String number) {
      return number.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    @Override
    public E visitSymbolExpression(SymbolExpressionContext ctx) {
      return builder.symbol(ctx.IDENTIFIER().getText());
    }

    @Override
    public E visitWildExpression(WildExpressionContext ctx) {
      // Drop the "$"
      return builder.wild(ctx.WILD().getText().substring(1));
    }

    @Override
    public E visitCallExpression(CallExpressionContext ctx) {
      String name = ctx.IDENTIFIER().getText();
      if (isWildcarded(name)) {
        throw error("Wildcards cannot name a function: '%s'", name);
      }
      List<E> args = new ArrayList<>();
      for (ExpressionContext arg : ctx.expression()) {
        args.add(visit(arg));
      }
      try {
        return builder.call(name, args);
      } catch (IllegalArgumentException e) {
        throw error(e.getMessage());
      }
    }

    @Override
    public E visitUnaryExpression(UnaryExpressionContext ctx) {
      E operand = visit(ctx.expression());
      return (ctx.op.getType() == TokenType.MINUS) ? builder.negate(operand) : operand;
    }

    @Override
    public E visitPowerExpression(PowerExpressionContext ctx) {
      // "^" and "**" are synonyms
      return builder.power(visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public E visitProductExpression(ProductExpressionContext ctx) {
      E x = visit(ctx.expression(0));
      E y = visit(ctx.expression(1));
      int op = ctx.op.getType();
      if (op == TokenType.STAR) {
        return builder.multiply(x, y);
      } else if (op == TokenType.SLASH) {
        return builder.divide(x, y);
      } else if (op == TokenType.DOUBLE_SLASH) {
        return builder.floorDivide(x, y);
      } else {
        assert op == TokenType.PERCENT;
        return builder.modulo(x, y);
      }
    }

    @Override
    public E visitSumExpression(SumExpressionContext ctx) {
      E x = visit(ctx.expression(0));
      E y = visit(ctx.expression(1));
      return (ctx.op.getType() == TokenType.PLUS) ? builder.add(x, y) : builder.subtract(x, y);
    }
  }
}

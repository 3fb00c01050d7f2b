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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.function.Function;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.bartiq.symbolics.ExpressionParser.ParenExpressionContext;

/**
 * A base class for ANTLR visitors over the expression grammar that provides two useful functions:
 *
 * <ul>
 *   <li>It disables the default "do nothing" behavior for node types that haven't been overridden.
 *       Visiting a node that doesn't have an explicit visit* method will throw an AssertionError.
 *   <li>It provides error() methods that automatically fill in the node currently being visited as
 *       the location of the error.
 * </ul>
 */
abstract class VisitorBase<T> extends ExpressionBaseVisitor<T> {

  /** The complete text being parsed, for error messages. */
  private final String text;

  /** The node currently being visited. */
  private ParseTree currentNode;

  VisitorBase(String text) {
    this.text = text;
  }

  @Override
  protected final T defaultResult() {
    // Called by all the default visitXXX() methods of ExpressionBaseVisitor; every node type
    // that can be reached has an explicit override.
    throw new AssertionError();
  }

  @Override
  public final T visit(ParseTree tree) {
    return visitWithCurrentNode(tree, super::visit);
  }

  /**
   * Calls {@code visitor} with the given node, binding {@link #currentNode} for the duration of the
   * call.
   *
   * <p>Assumes that if the function throws an exception, this Visitor will not be used again (no
   * attempt is made to restore the correct currentNode state).
   */
  @CanIgnoreReturnValue
  T visitWithCurrentNode(ParseTree node, Function<ParseTree, T> visitor) {
    ParseTree prevNode = currentNode;
    currentNode = node;
    T result = visitor.apply(node);
    currentNode = prevNode;
    return result;
  }

  @Override
  public final T visitParenExpression(ParenExpressionContext ctx) {
    // Parentheses don't change the interpretation of the parenthesized expression.
    return visit(ctx.expression());
  }

  /** Returns the first token of the current node. */
  Token currentToken() {
    return ((ParserRuleContext) currentNode).start;
  }

  /** Returns a {@link ParseError} pointing at the current node. */
  ParseError error(String msg) {
    Token token = currentToken();
    return new ParseError(msg, text, token == null ? -1 : token.getCharPositionInLine());
  }

  /** Returns a {@link ParseError} pointing at the current node. */
  @FormatMethod
  ParseError error(String fmt, Object... fmtArgs) {
    return error(String.format(fmt, fmtArgs));
  }
}

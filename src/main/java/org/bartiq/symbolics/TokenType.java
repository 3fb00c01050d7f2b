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

import com.google.common.collect.ImmutableMap;
import org.antlr.v4.runtime.Vocabulary;

/**
 * A statics-only class providing convenient access to the operator token types of the expression
 * grammar.
 *
 * <p>The operators are implicit literal tokens, so ANTLR only gives them names like {@code T__5};
 * we build a map from the literal text to the token type once and look up each operator we need.
 */
class TokenType {

  // Statics only
  private TokenType() {}

  /** A Map from token name (a quoted literal like "{@code '^'}" or a symbolic name) to type. */
  static final ImmutableMap<String, Integer> MAP;

  static {
    // Token types are allocated densely starting from 1.
    Vocabulary vocab = ExpressionLexer.VOCABULARY;
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 1; i <= vocab.getMaxTokenType(); i++) {
      String s = vocab.getLiteralName(i);
      if (s == null) {
        s = vocab.getSymbolicName(i);
        if (s == null) {
          continue;
        }
      }
      builder.put(s, i);
    }
    MAP = builder.buildOrThrow();
  }

  /**
   * Returns the token type for the given name. Throws an exception if there is no such token name.
   */
  static int of(String name) {
    Integer result = MAP.get(name);
    if (result == null) {
      throw new IllegalArgumentException("No token named " + name);
    }
    return result;
  }

  static final int PLUS = of("'+'");
  static final int MINUS = of("'-'");
  static final int STAR = of("'*'");
  static final int SLASH = of("'/'");
  static final int DOUBLE_SLASH = of("'//'");
  static final int PERCENT = of("'%'");
}

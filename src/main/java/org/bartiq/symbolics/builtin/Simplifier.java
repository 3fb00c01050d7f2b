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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.bartiq.symbolics.builtin.Expr.Call;

/**
 * Simplifies expressions by applying a set of rewrite rules repeatedly until the result reaches a
 * fixed point.
 *
 * <p>The rules are: {@code log(exp(x)) = x}; and a sum or product is replaced by its expansion if
 * that is smaller (e.g. {@code x*(y + 1) - x*y} becomes {@code x}).
 */
final class Simplifier {

  // Statics only
  private Simplifier() {}

  /** Bound on the number of rounds, in case the rules ever cycle. */
  private static final int MAX_ROUNDS = 1000;

  static Expr simplify(Expr expr) {
    Expr simplified = expr;
    Set<Expr> seen = new HashSet<>();
    seen.add(simplified);
    while (true) {
      simplified = simplifyOnce(simplified);
      if (seen.contains(simplified)) {
        return simplified;
      }
      if (seen.size() > MAX_ROUNDS) {
        throw new IllegalStateException("Infinite loop while simplifying " + expr);
      }
      seen.add(simplified);
    }
  }

  /** Applies every rule once, bottom up. */
  private static Expr simplifyOnce(Expr expr) {
    ImmutableList<Expr> children = expr.children();
    if (children.isEmpty()) {
      return expr;
    }
    List<Expr> simplified = new ArrayList<>(children.size());
    for (Expr child : children) {
      simplified.add(simplifyOnce(child));
    }
    Expr result = expr.rebuild(simplified);
    if (result instanceof Call call
        && call.name.equals("log")
        && call.args.size() == 1
        && call.args.get(0) instanceof Call inner
        && inner.name.equals("exp")) {
      return inner.args.get(0);
    }
    Expr expanded = Expander.expand(result);
    return (expanded.size() < result.size()) ? expanded : result;
  }
}

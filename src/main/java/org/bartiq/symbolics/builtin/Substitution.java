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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.bartiq.symbolics.FunctionDefinition;
import org.bartiq.symbolics.builtin.Expr.Call;
import org.bartiq.symbolics.builtin.Expr.RangeOp;
import org.bartiq.symbolics.builtin.Expr.Sym;

/**
 * Replaces symbols and user-defined function calls throughout an expression, rebuilding (and so
 * re-canonicalizing) every node whose operands changed.
 */
final class Substitution {

  private final Map<String, Expr> values;
  private final Map<String, FunctionDefinition<Expr>> functions;

  private Substitution(Map<String, Expr> values, Map<String, FunctionDefinition<Expr>> functions) {
    this.values = values;
    this.functions = functions;
  }

  /**
   * Returns {@code expr} with each free symbol named in {@code values} replaced, and each call of a
   * function named in {@code functions} replaced by the function's result.
   */
  static Expr apply(
      Expr expr, Map<String, Expr> values, Map<String, FunctionDefinition<Expr>> functions) {
    if (functions.isEmpty() && !mentionsAny(expr, values)) {
      return expr;
    }
    return new Substitution(values, functions).visit(expr);
  }

  static Expr apply(Expr expr, Map<String, Expr> values) {
    return apply(expr, values, ImmutableMap.of());
  }

  private static boolean mentionsAny(Expr expr, Map<String, Expr> values) {
    for (String name : expr.freeSymbols()) {
      if (values.containsKey(name)) {
        return true;
      }
    }
    return false;
  }

  private Expr visit(Expr expr) {
    if (functions.isEmpty() && !mentionsAny(expr, values)) {
      return expr;
    } else if (expr instanceof Sym sym) {
      Expr value = values.get(sym.name);
      return (value == null) ? expr : value;
    } else if (expr instanceof RangeOp range && values.containsKey(range.iterator)) {
      // The iterator is bound within the range, so it must not be replaced there.
      Map<String, Expr> inner = new HashMap<>(values);
      inner.remove(range.iterator);
      Expr term = new Substitution(inner, functions).visit(range.term);
      return range.rebuild(ImmutableList.of(term, visit(range.start), visit(range.end)));
    }
    ImmutableList<Expr> children = expr.children();
    List<Expr> newChildren = new ArrayList<>(children.size());
    boolean changed = false;
    for (Expr child : children) {
      Expr newChild = visit(child);
      newChildren.add(newChild);
      // Compare identities, so that replacing a symbol by an equal one with a different sign
      // predicate still rebuilds
      changed |= (newChild != child);
    }
    if (expr instanceof Call call) {
      FunctionDefinition<Expr> fn = functions.get(call.name);
      if (fn != null) {
        Expr result = fn.apply(ImmutableList.copyOf(newChildren));
        if (result != null) {
          return result;
        }
      }
    }
    return changed ? expr.rebuild(newChildren) : expr;
  }
}

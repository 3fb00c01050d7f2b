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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.bartiq.symbolics.builtin.Expr.Add;
import org.bartiq.symbolics.builtin.Expr.Call;
import org.bartiq.symbolics.builtin.Expr.Mul;
import org.bartiq.symbolics.builtin.Expr.Num;
import org.bartiq.symbolics.builtin.Expr.Pow;
import org.bartiq.symbolics.builtin.Expr.RangeOp;
import org.bartiq.symbolics.builtin.Expr.Sym;
import org.bartiq.symbolics.builtin.Expr.Wild;
import org.jspecify.annotations.Nullable;

/**
 * Replaces the subexpressions of an expression that match a pattern.
 *
 * <p>A pattern may contain wildcards ({@code $name}). What a wildcard matches depends on its name:
 *
 * <ul>
 *   <li>a name starting with {@code N} matches a nonzero number;
 *   <li>any other name starting with an upper case letter matches a symbol;
 *   <li>any other name matches any nonzero expression.
 * </ul>
 *
 * Each occurrence of a wildcard must match the same subexpression. Sums and products are matched
 * without regard to the order of their operands; if the last of a sum's (or product's) operands is
 * a wildcard of the third kind, it matches all the operands left over by the others.
 */
final class PatternMatcher {

  // Statics only
  private PatternMatcher() {}

  /** Returns true if {@code expr} contains a wildcard. */
  static boolean hasWild(Expr expr) {
    if (expr instanceof Wild) {
      return true;
    }
    for (Expr child : expr.children()) {
      if (hasWild(child)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns {@code expr} with each subexpression that matches {@code pattern} replaced by {@code
   * replacement}, in which each wildcard (and each symbol with a wildcard's name) has been
   * replaced by what the wildcard matched.
   *
   * <p>Subexpressions are tried from the top down, and the subexpressions matched by a wildcard
   * are themselves searched for matches. Symbols and numbers are never replaced, and a match in
   * which every wildcard matched a number is ignored.
   */
  static Expr replaceMatches(Expr expr, Expr pattern, Expr replacement) {
    if (!(expr instanceof Sym || expr instanceof Num)) {
      Map<String, Expr> bindings = match(pattern, expr, ImmutableMap.of());
      if (bindings != null && !bindsOnlyNumbers(bindings)) {
        Map<String, Expr> replaced = new HashMap<>();
        for (Map.Entry<String, Expr> binding : bindings.entrySet()) {
          Expr value = binding.getValue();
          replaced.put(
              binding.getKey(),
              value.equals(expr) ? value : replaceMatches(value, pattern, replacement));
        }
        return instantiate(replacement, replaced);
      }
    }
    ImmutableList<Expr> children = expr.children();
    List<Expr> newChildren = new ArrayList<>(children.size());
    boolean changed = false;
    for (Expr child : children) {
      Expr newChild = replaceMatches(child, pattern, replacement);
      newChildren.add(newChild);
      changed |= !newChild.equals(child);
    }
    return changed ? expr.rebuild(newChildren) : expr;
  }

  /**
   * Returns {@code expr} with each occurrence of {@code pattern} (which must not contain
   * wildcards) replaced by {@code replacement}. A sum (or product) pattern also matches part of a
   * larger sum (or product) that has all of its operands.
   */
  static Expr replaceStructure(Expr expr, Expr pattern, Expr replacement) {
    if (pattern instanceof Sym sym) {
      return Substitution.apply(expr, ImmutableMap.of(sym.name, replacement));
    } else if (expr.equals(pattern)) {
      return replacement;
    }
    if (pattern instanceof Add p && expr instanceof Add e) {
      List<Expr> rest = removeAll(e.terms, p.terms);
      if (rest != null) {
        rest.replaceAll(term -> replaceStructure(term, pattern, replacement));
        rest.add(replacement);
        return Algebra.add(rest);
      }
    } else if (pattern instanceof Mul p && expr instanceof Mul e) {
      List<Expr> rest = removeAll(e.factors, p.factors);
      if (rest != null) {
        rest.replaceAll(factor -> replaceStructure(factor, pattern, replacement));
        rest.add(replacement);
        return Algebra.mul(rest);
      }
    }
    ImmutableList<Expr> children = expr.children();
    List<Expr> newChildren = new ArrayList<>(children.size());
    boolean changed = false;
    for (Expr child : children) {
      Expr newChild = replaceStructure(child, pattern, replacement);
      newChildren.add(newChild);
      changed |= !newChild.equals(child);
    }
    return changed ? expr.rebuild(newChildren) : expr;
  }

  /**
   * If each element of {@code toRemove} can be paired with an equal element of {@code from},
   * returns the unpaired elements of {@code from}; otherwise returns null.
   */
  private static @Nullable List<Expr> removeAll(List<Expr> from, List<Expr> toRemove) {
    List<Expr> rest = new ArrayList<>(from);
    for (Expr x : toRemove) {
      if (!rest.remove(x)) {
        return null;
      }
    }
    return rest;
  }

  /**
   * Tries to match {@code expr} against {@code pattern}, given the wildcard values already
   * determined. Returns the extended wildcard values, or null if they do not match.
   */
  static @Nullable Map<String, Expr> match(
      Expr pattern, Expr expr, Map<String, Expr> bindings) {
    if (pattern instanceof Wild wild) {
      return bind(wild, expr, bindings);
    } else if (!hasWild(pattern)) {
      return pattern.equals(expr) ? bindings : null;
    } else if (pattern instanceof Call p) {
      return (expr instanceof Call e && p.name.equals(e.name))
          ? matchInOrder(p.args, e.args, bindings)
          : null;
    } else if (pattern instanceof Pow p) {
      return (expr instanceof Pow) ? matchInOrder(p.children(), expr.children(), bindings) : null;
    } else if (pattern instanceof RangeOp p) {
      return (expr instanceof RangeOp e
              && p.isProduct == e.isProduct
              && p.iterator.equals(e.iterator))
          ? matchInOrder(p.children(), e.children(), bindings)
          : null;
    } else if (pattern instanceof Add p) {
      return (expr instanceof Add e) ? matchUnordered(p.terms, e.terms, bindings, false) : null;
    } else if (pattern instanceof Mul p) {
      return (expr instanceof Mul e) ? matchUnordered(p.factors, e.factors, bindings, true) : null;
    }
    return null;
  }

  private static @Nullable Map<String, Expr> matchInOrder(
      List<Expr> patterns, List<Expr> exprs, Map<String, Expr> bindings) {
    if (patterns.size() != exprs.size()) {
      return null;
    }
    for (int i = 0; i < patterns.size() && bindings != null; i++) {
      bindings = match(patterns.get(i), exprs.get(i), bindings);
    }
    return bindings;
  }

  private static @Nullable Map<String, Expr> matchUnordered(
      List<Expr> patterns, List<Expr> exprs, Map<String, Expr> bindings, boolean isProduct) {
    // Match the structured operands first, since they constrain the wildcards.
    List<Expr> ordered = new ArrayList<>(patterns.size());
    List<Expr> wilds = new ArrayList<>();
    for (Expr p : patterns) {
      (p instanceof Wild ? wilds : ordered).add(p);
    }
    ordered.addAll(wilds);
    return matchUnordered(ordered, 0, exprs, bindings, isProduct);
  }

  private static @Nullable Map<String, Expr> matchUnordered(
      List<Expr> patterns,
      int index,
      List<Expr> remaining,
      Map<String, Expr> bindings,
      boolean isProduct) {
    if (index == patterns.size()) {
      return remaining.isEmpty() ? bindings : null;
    }
    Expr pattern = patterns.get(index);
    if (index == patterns.size() - 1
        && remaining.size() > 1
        && pattern instanceof Wild wild
        && kind(wild) == Kind.ANY) {
      Expr rest = isProduct ? Algebra.mul(remaining) : Algebra.add(remaining);
      return bind(wild, rest, bindings);
    }
    for (int i = 0; i < remaining.size(); i++) {
      Map<String, Expr> extended = match(pattern, remaining.get(i), bindings);
      if (extended != null) {
        List<Expr> rest = new ArrayList<>(remaining);
        rest.remove(i);
        Map<String, Expr> result = matchUnordered(patterns, index + 1, rest, extended, isProduct);
        if (result != null) {
          return result;
        }
      }
    }
    return null;
  }

  private enum Kind {
    NUMBER,
    SYMBOL,
    ANY
  }

  private static Kind kind(Wild wild) {
    char first = wild.name.charAt(0);
    if (first == 'N') {
      return Kind.NUMBER;
    }
    return Ascii.isUpperCase(first) ? Kind.SYMBOL : Kind.ANY;
  }

  private static @Nullable Map<String, Expr> bind(
      Wild wild, Expr expr, Map<String, Expr> bindings) {
    boolean accepted =
        switch (kind(wild)) {
          case NUMBER -> expr instanceof Num num && !num.isZero();
          case SYMBOL -> expr instanceof Sym;
          case ANY -> !(expr instanceof Num num && num.isZero());
        };
    if (!accepted) {
      return null;
    }
    Expr previous = bindings.get(wild.name);
    if (previous != null) {
      return previous.equals(expr) ? bindings : null;
    }
    Map<String, Expr> result = new HashMap<>(bindings);
    result.put(wild.name, expr);
    return result;
  }

  private static boolean bindsOnlyNumbers(Map<String, Expr> bindings) {
    return !bindings.isEmpty() && bindings.values().stream().allMatch(v -> v instanceof Num);
  }

  /**
   * Replaces each wildcard in {@code replacement}, and each symbol named like a wildcard, by that
   * wildcard's value.
   */
  private static Expr instantiate(Expr replacement, Map<String, Expr> bindings) {
    if (replacement instanceof Wild wild) {
      Expr value = bindings.get(wild.name);
      return (value == null) ? replacement : value;
    } else if (replacement instanceof Sym sym) {
      Expr value = bindings.get(sym.name);
      return (value == null) ? replacement : value;
    }
    ImmutableList<Expr> children = replacement.children();
    if (children.isEmpty()) {
      return replacement;
    }
    List<Expr> newChildren = new ArrayList<>(children.size());
    for (Expr child : children) {
      newChildren.add(instantiate(child, bindings));
    }
    return replacement.rebuild(newChildren);
  }
}

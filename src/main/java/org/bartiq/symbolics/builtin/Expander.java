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
import java.util.Collections;
import java.util.List;
import org.bartiq.symbolics.builtin.Expr.Add;
import org.bartiq.symbolics.builtin.Expr.Mul;
import org.bartiq.symbolics.builtin.Expr.Num;
import org.bartiq.symbolics.builtin.Expr.Pow;

/** Distributes products, and small positive integer powers, over sums. */
final class Expander {

  // Statics only
  private Expander() {}

  /** Powers of sums with larger exponents are left alone. */
  static final int MAX_EXPANDED_POWER = 20;

  static Expr expand(Expr expr) {
    ImmutableList<Expr> children = expr.children();
    if (children.isEmpty()) {
      return expr;
    }
    List<Expr> expanded = new ArrayList<>(children.size());
    boolean changed = false;
    for (Expr child : children) {
      Expr e = expand(child);
      expanded.add(e);
      changed |= !e.equals(child);
    }
    Expr result = changed ? expr.rebuild(expanded) : expr;
    if (result instanceof Mul mul) {
      return distribute(mul.factors);
    } else if (result instanceof Pow pow
        && pow.base instanceof Add
        && pow.exponent instanceof Num e
        && e.isInteger()
        && e.signum() > 0
        && e.bigIntegerValue().intValue() <= MAX_EXPANDED_POWER) {
      return distribute(Collections.nCopies(e.bigIntegerValue().intValue(), pow.base));
    }
    return result;
  }

  /** Returns the sum of products of one term from each factor. */
  private static Expr distribute(List<Expr> factors) {
    List<Expr> products = ImmutableList.of(Num.ONE);
    for (Expr factor : factors) {
      List<Expr> terms = (factor instanceof Add add) ? add.terms : ImmutableList.of(factor);
      List<Expr> next = new ArrayList<>(products.size() * terms.size());
      for (Expr product : products) {
        for (Expr term : terms) {
          next.add(Algebra.mul(product, term));
        }
      }
      products = next;
    }
    return Algebra.add(products);
  }
}

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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.bartiq.symbolics.AlgebraEngine;
import org.bartiq.symbolics.ComparisonResult;
import org.bartiq.symbolics.ExpressionBuilder;
import org.bartiq.symbolics.ExpressionSyntax;
import org.bartiq.symbolics.FunctionDefinition;
import org.bartiq.symbolics.builtin.Expr.Add;
import org.bartiq.symbolics.builtin.Expr.Call;
import org.bartiq.symbolics.builtin.Expr.Constant;
import org.bartiq.symbolics.builtin.Expr.Num;
import org.bartiq.symbolics.builtin.Expr.Sym;
import org.bartiq.symbolics.builtin.Expr.Wild;
import org.bartiq.util.Similarity;
import org.jspecify.annotations.Nullable;

/**
 * An {@link AlgebraEngine} over {@link Expr} trees.
 *
 * <p>Numeric values are cached per expression instance. The cache holds at most {@code
 * bartiq.numericCacheSize} entries (a system property, default 10000); setting it to 0 disables
 * caching.
 */
public final class BuiltinEngine implements AlgebraEngine<Expr> {

  /** The shared instance; the engine has no per-instance state apart from its cache. */
  public static final BuiltinEngine INSTANCE = new BuiltinEngine();

  private static final int NUMERIC_CACHE_SIZE =
      Integer.getInteger("bartiq.numericCacheSize", 10_000);

  /** Numeric values are rounded to this many significant digits. */
  private static final MathContext NUMERIC_PRECISION = new MathContext(15);

  /** Two values closer than this are considered equal when comparing approximately. */
  private static final double EPSILON = 1e-12;

  /** Cached in place of a value for expressions that have none. */
  private static final Double NOT_NUMERIC = Double.NaN;

  /** Maps each spelling that {@link #parseConstant} recognizes to its constant. */
  private static final ImmutableMap<String, Expr> NAMED_CONSTANTS;

  static {
    ImmutableMap.Builder<String, Expr> builder = ImmutableMap.builder();
    Expr e = Algebra.call("exp", ImmutableList.of(Num.ONE));
    for (String name : ImmutableList.of("pi", "PI", "Pi")) {
      builder.put(name, Constant.PI);
    }
    builder.put("e", e).put("E", e);
    for (String name : ImmutableList.of("oo", "OO", "Oo", "infinity", "INFINITY", "Infinity")) {
      builder.put(name, Constant.INFINITY);
    }
    NAMED_CONSTANTS = builder.buildOrThrow();
  }

  private final @Nullable Cache<Expr, Number> numericCache;

  private BuiltinEngine() {
    this(NUMERIC_CACHE_SIZE);
  }

  @VisibleForTesting
  BuiltinEngine(int cacheSize) {
    numericCache =
        (cacheSize == 0)
            ? null
            : CacheBuilder.newBuilder().weakKeys().maximumSize(cacheSize).build();
  }

  private final ExpressionBuilder<Expr> builder =
      new ExpressionBuilder<>() {
        @Override
        public Expr number(String text) {
          if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
            return Num.of(Double.parseDouble(text));
          }
          return Num.of(new BigInteger(text));
        }

        @Override
        public Expr symbol(String name) {
          switch (name) {
            case "PI":
              return Constant.PI;
            case "oo":
            case "Infinity":
              return Constant.INFINITY;
            case "noo":
            case "NegativeInfinity":
              return Algebra.negate(Constant.INFINITY);
            case "nan":
              return Constant.UNDEFINED;
            default:
              return Sym.of(name);
          }
        }

        @Override
        public Expr wild(String name) {
          return new Wild(name);
        }

        @Override
        public Expr call(String name, List<Expr> args) {
          return Algebra.call(name, args);
        }

        @Override
        public Expr negate(Expr x) {
          return Algebra.negate(x);
        }

        @Override
        public Expr add(Expr x, Expr y) {
          return Algebra.add(x, y);
        }

        @Override
        public Expr subtract(Expr x, Expr y) {
          return Algebra.sub(x, y);
        }

        @Override
        public Expr multiply(Expr x, Expr y) {
          return Algebra.mul(x, y);
        }

        @Override
        public Expr divide(Expr x, Expr y) {
          return Algebra.div(x, y);
        }

        @Override
        public Expr floorDivide(Expr x, Expr y) {
          return Algebra.call("floor", ImmutableList.of(Algebra.div(x, y)));
        }

        @Override
        public Expr modulo(Expr x, Expr y) {
          return Algebra.call("mod", ImmutableList.of(x, y));
        }

        @Override
        public Expr power(Expr x, Expr y) {
          return Algebra.pow(x, y);
        }
      };

  @Override
  public Expr parse(String text) {
    return ExpressionSyntax.parse(text, builder);
  }

  @Override
  public Expr number(Number value) {
    if (value instanceof Double || value instanceof Float) {
      Expr result = Algebra.fromDouble(value.doubleValue());
      checkArgument(result != null, "Not a number: %s", value);
      return result;
    } else if (value instanceof BigInteger big) {
      return Num.of(big);
    } else if (value instanceof BigDecimal decimal) {
      return Num.of(decimal.doubleValue());
    }
    return Num.of(value.longValue());
  }

  @Override
  public Expr symbol(String name) {
    return Sym.of(name);
  }

  @Override
  public Expr add(Expr x, Expr y) {
    return Algebra.add(x, y);
  }

  @Override
  public Expr sub(Expr x, Expr y) {
    return Algebra.sub(x, y);
  }

  @Override
  public Expr mul(Expr x, Expr y) {
    return Algebra.mul(x, y);
  }

  @Override
  public Expr div(Expr x, Expr y) {
    return Algebra.div(x, y);
  }

  @Override
  public Expr pow(Expr base, Expr exponent) {
    return Algebra.pow(base, exponent);
  }

  @Override
  public Expr sum(List<Expr> terms) {
    return Algebra.add(terms);
  }

  @Override
  public Expr max(List<Expr> args) {
    return Algebra.call("max", args);
  }

  @Override
  public Expr min(List<Expr> args) {
    return Algebra.call("min", args);
  }

  @Override
  public Expr call(String name, List<Expr> args) {
    return Algebra.call(name, args);
  }

  @Override
  public Expr substitute(
      Expr expr, Map<String, Expr> values, Map<String, FunctionDefinition<Expr>> functions) {
    for (String name : functions.keySet()) {
      checkArgument(!Functions.isBuiltin(name), "Cannot redefine built-in function: %s", name);
    }
    Expr result = Substitution.apply(expr, values, functions);
    if (result != expr && !(result instanceof Num) && result.freeSymbols().isEmpty()) {
      // Reduce a symbol-free result to a number, if it has a finite value
      double d = Numerics.evaluate(result);
      if (Double.isFinite(d)) {
        return Num.of(d);
      }
    }
    return result;
  }

  @Override
  public Expr simplify(Expr expr) {
    return Simplifier.simplify(expr);
  }

  @Override
  public Expr expand(Expr expr) {
    return Expander.expand(expr);
  }

  @Override
  public ImmutableSet<String> freeSymbols(Expr expr) {
    return expr.freeSymbols();
  }

  @Override
  public @Nullable Number numericValue(Expr expr) {
    if (expr instanceof Num num) {
      return num.toNumber();
    } else if (!expr.freeSymbols().isEmpty()) {
      return null;
    }
    Number result = (numericCache == null) ? null : numericCache.getIfPresent(expr);
    if (result == null) {
      result = computeNumericValue(expr);
      if (numericCache != null) {
        numericCache.put(expr, result);
      }
    }
    return (result instanceof Double d && d.isNaN()) ? null : result;
  }

  private static Number computeNumericValue(Expr expr) {
    double d = Numerics.evaluate(expr);
    if (!Double.isFinite(d)) {
      return NOT_NUMERIC;
    }
    double rounded = new BigDecimal(d).round(NUMERIC_PRECISION).doubleValue();
    if (rounded == Math.rint(rounded) && Math.abs(rounded) < 0x1p53) {
      return (long) rounded;
    }
    return rounded;
  }

  @VisibleForTesting
  long numericCacheSize() {
    return (numericCache == null) ? 0 : numericCache.size();
  }

  @Override
  public ComparisonResult compare(Expr lhs, Expr rhs) {
    if (lhs.equals(rhs)) {
      return ComparisonResult.EQUAL;
    }
    Expr difference = Simplifier.simplify(Expander.expand(Algebra.sub(lhs, rhs)));
    if (difference instanceof Num num) {
      return num.isZero() ? ComparisonResult.EQUAL : ComparisonResult.NOT_EQUAL;
    } else if (difference.freeSymbols().isEmpty()) {
      double d = Numerics.evaluate(difference);
      if (!Double.isNaN(d)) {
        return (Math.abs(d) < EPSILON) ? ComparisonResult.EQUAL : ComparisonResult.NOT_EQUAL;
      }
    } else if (Sign.of(difference).isNonZero()) {
      return ComparisonResult.NOT_EQUAL;
    }
    return ComparisonResult.UNKNOWN;
  }

  @Override
  public String serialize(Expr expr) {
    return Serializer.serialize(expr);
  }

  @Override
  public Expr parseConstant(Expr expr) {
    Map<String, Expr> values = new HashMap<>();
    for (String name : expr.freeSymbols()) {
      Expr constant = NAMED_CONSTANTS.get(name);
      if (constant != null) {
        values.put(name, constant);
      }
    }
    return values.isEmpty() ? expr : Substitution.apply(expr, values);
  }

  @Override
  public Expr sequenceSum(Expr term, String iterator, Expr start, Expr end) {
    return Ranges.create(false, term, iterator, start, end);
  }

  @Override
  public Expr sequenceProd(Expr term, String iterator, Expr start, Expr end) {
    return Ranges.create(true, term, iterator, start, end);
  }

  @Override
  public ImmutableMap<String, String> findUndefinedFunctions(Expr expr, Set<String> userDefined) {
    Map<String, String> result = new LinkedHashMap<>();
    for (Call call : calls(expr)) {
      if (!Functions.isBuiltin(call.name)
          && !userDefined.contains(call.name)
          && !result.containsKey(call.name)) {
        String match =
            Similarity.closestMatch(call.name, Functions.names(), Similarity.DEFAULT_CUTOFF);
        result.put(call.name, (match == null) ? "" : match);
      }
    }
    return ImmutableMap.copyOf(result);
  }

  @Override
  public @Nullable String singleParameterName(Expr expr) {
    return (expr instanceof Sym sym) ? sym.name : null;
  }

  @Override
  public boolean isConstantInt(Expr expr) {
    return expr instanceof Num num && num.isInteger();
  }

  @Override
  public ImmutableSet<String> reservedFunctions() {
    return Functions.names();
  }

  @Override
  public Expr unrollWildcards(Expr expr, Map<String, ImmutableList<String>> expansions) {
    if (expr instanceof Sym sym) {
      ImmutableList<String> names = expansions.get(sym.name);
      if (names == null) {
        return expr;
      }
      checkArgument(
          names.size() == 1,
          "Wildcard %s must expand to exactly one symbol outside a function call, not %s",
          sym.name,
          names);
      return Sym.of(names.get(0));
    }
    ImmutableList<Expr> children = expr.children();
    if (children.isEmpty() || !expr.containsWildcard()) {
      return expr;
    }
    List<Expr> newChildren = new ArrayList<>();
    for (Expr child : children) {
      ImmutableList<String> names =
          (expr instanceof Call && child instanceof Sym sym) ? expansions.get(sym.name) : null;
      if (names != null) {
        names.forEach(name -> newChildren.add(Sym.of(name)));
      } else {
        newChildren.add(unrollWildcards(child, expansions));
      }
    }
    return (expr instanceof Call call)
        ? Algebra.call(call.name, newChildren)
        : expr.rebuild(newChildren);
  }

  /**
   * Returns {@code expr} with each subexpression matching {@code pattern} replaced. If the pattern
   * contains wildcards ({@code $name}), they are matched as described in {@link PatternMatcher};
   * otherwise each occurrence of the pattern (or of a sum or product with all of its operands) is
   * replaced.
   */
  public Expr replace(Expr expr, Expr pattern, Expr replacement) {
    return PatternMatcher.hasWild(pattern)
        ? PatternMatcher.replaceMatches(expr, pattern, replacement)
        : PatternMatcher.replaceStructure(expr, pattern, replacement);
  }

  /** Returns true if {@code expr} contains a pattern wildcard. */
  public boolean hasWild(Expr expr) {
    return PatternMatcher.hasWild(expr);
  }

  /**
   * Returns {@code expr} with each occurrence of the named symbol replaced by one that is known to
   * have the given sign, and recanonicalized.
   */
  public Expr withSign(Expr expr, String symbol, Sign sign) {
    return Substitution.apply(expr, ImmutableMap.of(symbol, Sym.of(symbol, sign)));
  }

  /** Returns what can be determined about the sign of {@code expr}. */
  public Sign sign(Expr expr) {
    return Sign.of(expr);
  }

  /** Returns the terms of {@code expr} if it is a sum, or a list containing just {@code expr}. */
  public ImmutableList<Expr> terms(Expr expr) {
    return (expr instanceof Add add) ? add.terms : ImmutableList.of(expr);
  }

  /**
   * Returns every function call in {@code expr} (including those nested in the arguments of other
   * calls), outermost first.
   */
  public ImmutableList<Call> calls(Expr expr) {
    ImmutableList.Builder<Call> builder = ImmutableList.builder();
    addCalls(expr, builder);
    return builder.build();
  }

  private static void addCalls(Expr expr, ImmutableList.Builder<Call> builder) {
    if (expr instanceof Call call) {
      builder.add(call);
    }
    for (Expr child : expr.children()) {
      addCalls(child, builder);
    }
  }
}

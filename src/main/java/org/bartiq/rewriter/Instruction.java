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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One step in the history of an {@link ExpressionRewriter}. Replaying a rewriter's history on its
 * original expression reproduces its current expression.
 */
public abstract class Instruction {

  /** The first entry of every history; replaying it does nothing. */
  public static final Instruction INITIAL = new Basic("Initial");

  public static final Instruction SIMPLIFY = new Basic("Simplify");

  public static final Instruction EXPAND = new Basic("Expand");

  /** Applies each of the rewriter's previous assumptions again. */
  public static final Instruction REAPPLY_ALL_ASSUMPTIONS = new Basic("ReapplyAllAssumptions");

  Instruction() {}

  /** An instruction with no arguments. */
  private static final class Basic extends Instruction {
    final String name;

    Basic(String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Asserts that {@code subject comparator bound} holds for all values of interest. */
  public static final class Assumption extends Instruction {
    private static final Pattern COMPARATOR = Pattern.compile(">=|<=|>|<");
    private static final Pattern NUMBER =
        Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    /** The text of the expression being constrained; usually just a symbol. */
    public final String subject;

    public final Comparator comparator;
    public final double bound;

    public Assumption(String subject, Comparator comparator, double bound) {
      this.subject = checkNotNull(subject);
      this.comparator = checkNotNull(comparator);
      this.bound = bound;
    }

    /**
     * Parses an assumption of the form {@code "X > 5"}. The bound must be a number; it may appear
     * on either side.
     */
    public static Assumption parse(String text) {
      String stripped = text.replaceAll("\\s+", "");
      Matcher matcher = COMPARATOR.matcher(stripped);
      if (!matcher.find()) {
        throw invalid(text);
      }
      String lhs = stripped.substring(0, matcher.start());
      String rhs = stripped.substring(matcher.end());
      Comparator comparator = Comparator.fromSymbol(matcher.group());
      if (lhs.isEmpty() || rhs.isEmpty() || matcher.find()) {
        throw invalid(text);
      }
      if (NUMBER.matcher(rhs).matches()) {
        return new Assumption(lhs, comparator, Double.parseDouble(rhs));
      } else if (NUMBER.matcher(lhs).matches()) {
        return new Assumption(rhs, comparator.reverse(), Double.parseDouble(lhs));
      } else if (IDENTIFIER.matcher(rhs).matches()) {
        throw RewriterError.of(
            "Assumption tries to draw a comparison between two variables: %s and %s."
                + " At present this is not possible.",
            lhs,
            rhs);
      }
      throw invalid(text);
    }

    private static RewriterError invalid(String text) {
      return RewriterError.of("Invalid assumption! Could not parse the following input: %s", text);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Assumption assumption
          && subject.equals(assumption.subject)
          && comparator == assumption.comparator
          && bound == assumption.bound;
    }

    @Override
    public int hashCode() {
      return Objects.hash(subject, comparator, bound);
    }

    @Override
    public String toString() {
      String boundText = (bound == Math.rint(bound)) ? Long.toString((long) bound) : "" + bound;
      return String.format("Assumption(%s %s %s)", subject, comparator, boundText);
    }
  }

  /**
   * Replaces each occurrence of {@link #pattern} by {@link #replacement}. Names in the pattern
   * that start with {@code $} are wildcards.
   */
  public static final class Substitution extends Instruction {
    public final String pattern;
    public final String replacement;

    public Substitution(String pattern, String replacement) {
      this.pattern = checkNotNull(pattern);
      this.replacement = checkNotNull(replacement);
    }

    public boolean isWild() {
      return pattern.indexOf('$') >= 0;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Substitution substitution
          && pattern.equals(substitution.pattern)
          && replacement.equals(substitution.replacement);
    }

    @Override
    public int hashCode() {
      return Objects.hash(pattern, replacement);
    }

    @Override
    public String toString() {
      return String.format("Substitution(%s -> %s)", pattern, replacement);
    }
  }
}

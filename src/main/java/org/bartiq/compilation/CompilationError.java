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


package org.bartiq.compilation;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import org.bartiq.routine.Constraint;

/**
 * All errors detected while compiling a routine throw a CompilationError. Compilation stops at
 * the first error; no partially compiled routine is returned.
 *
 * <p>Errors with a more specific cause use one of the nested subclasses.
 */
public class CompilationError extends RuntimeException {
  public final String msg;

  /** The dotted path of the routine being compiled when the error was detected. */
  public final String path;

  public CompilationError(String msg, String path) {
    super(msg);
    this.msg = msg;
    this.path = path;
  }

  @FormatMethod
  static CompilationError of(String path, String fmt, Object... fmtArgs) {
    return new CompilationError(String.format(fmt, fmtArgs), path);
  }

  @Override
  public String getMessage() {
    return String.format("%s: %s", path, msg);
  }

  /** A constraint that is provably false once parameters have been propagated. */
  public static class ConstraintViolation extends CompilationError {
    /** The constraint as declared (or as generated by preprocessing). */
    public final Constraint<?> original;

    /** The constraint with propagated values substituted. */
    public final Constraint<?> compiled;

    public ConstraintViolation(String path, Constraint<?> original, Constraint<?> compiled) {
      super(
          String.format(
              "Constraint %s == %s violated: %s != %s",
              original.lhs, original.rhs, compiled.lhs, compiled.rhs),
          path);
      this.original = original;
      this.compiled = compiled;
    }
  }

  /** A symbol that is not resolved to the root routine's parameters. */
  public static class UnresolvedParameter extends CompilationError {
    public final String symbol;

    public UnresolvedParameter(String path, String symbol, String msg) {
      super(msg, path);
      this.symbol = symbol;
    }

    @FormatMethod
    static UnresolvedParameter of(String path, String symbol, String fmt, Object... fmtArgs) {
      return new UnresolvedParameter(path, symbol, String.format(fmt, fmtArgs));
    }
  }

  /** Dependencies that form a cycle, so no order of evaluation exists. */
  public static class CyclicDependency extends CompilationError {
    /** The nodes that could not be ordered. */
    public final ImmutableList<String> remaining;

    public CyclicDependency(String path, ImmutableList<String> remaining, String msg) {
      super(msg, path);
      this.remaining = remaining;
    }
  }

  /** A repetition whose sequence cannot be compiled or summed. */
  public static class RepetitionError extends CompilationError {
    public RepetitionError(String msg, String path) {
      super(msg, path);
    }
  }
}

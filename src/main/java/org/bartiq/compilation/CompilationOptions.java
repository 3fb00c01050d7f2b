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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.bartiq.symbolics.FunctionDefinition;

/** Configures a call to {@link Compiler#compile}. */
public final class CompilationOptions<E> {

  /**
   * The preprocessing stages to apply before compiling; {@link Preprocessing#defaultStages} by
   * default.
   */
  public final ImmutableList<PreprocessingStage<E>> preprocessingStages;

  /** The stages to apply to the compiled routine; none by default. */
  public final ImmutableList<PostprocessingStage<E>> postprocessingStages;

  /** Resources to compute for each routine after it is compiled; none by default. */
  public final ImmutableList<DerivedResource<E>> derivedResources;

  /** Definitions of functions that are not built into the algebra engine. */
  public final ImmutableMap<String, FunctionDefinition<E>> functions;

  /**
   * If true (the default), each compiled routine is checked to depend only on the root's
   * parameters.
   */
  public final boolean verify;

  private CompilationOptions(Builder<E> builder) {
    this.preprocessingStages = ImmutableList.copyOf(builder.preprocessingStages);
    this.postprocessingStages = ImmutableList.copyOf(builder.postprocessingStages);
    this.derivedResources = ImmutableList.copyOf(builder.derivedResources);
    this.functions = ImmutableMap.copyOf(builder.functions);
    this.verify = builder.verify;
  }

  public static <E> CompilationOptions<E> defaults() {
    return new Builder<E>().build();
  }

  public static <E> Builder<E> builder() {
    return new Builder<>();
  }

  public static final class Builder<E> {
    private List<PreprocessingStage<E>> preprocessingStages = Preprocessing.defaultStages();
    private List<PostprocessingStage<E>> postprocessingStages = ImmutableList.of();
    private final List<DerivedResource<E>> derivedResources = new ArrayList<>();
    private Map<String, FunctionDefinition<E>> functions = ImmutableMap.of();
    private boolean verify = true;

    private Builder() {}

    /** Replaces the default preprocessing stages; an empty list skips preprocessing. */
    @CanIgnoreReturnValue
    public Builder<E> preprocessingStages(List<PreprocessingStage<E>> stages) {
      this.preprocessingStages = stages;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> postprocessingStages(List<PostprocessingStage<E>> stages) {
      this.postprocessingStages = stages;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> addDerivedResource(DerivedResource<E> derived) {
      derivedResources.add(derived);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> functions(Map<String, FunctionDefinition<E>> functions) {
      this.functions = functions;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> verify(boolean verify) {
      this.verify = verify;
      return this;
    }

    public CompilationOptions<E> build() {
      return new CompilationOptions<>(this);
    }
  }
}

/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.mir.opt;

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.ForOverride;
import java.util.function.Supplier;

/**
 * A named source of MIR pass instances.
 *
 * <p>Whether a created pass actually runs is up to {@link MirPass#isEnabled}.
 */
@AutoValue
public abstract class PassFactory {

  /** The name of the pass as it will appear in logs. */
  public abstract String getName();

  /** Creates pass instances. Callers use {@link #create()} instead. */
  abstract Supplier<? extends MirPass> getInternalFactory();

  PassFactory() {}

  /** A builder for a {@link PassFactory}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String x);

    public abstract Builder setInternalFactory(Supplier<? extends MirPass> x);

    @ForOverride
    abstract PassFactory autoBuild();

    public final PassFactory build() {
      PassFactory result = autoBuild();
      checkState(!result.getName().isEmpty(), "pass factory needs a name");
      return result;
    }
  }

  public static Builder builder() {
    return new AutoValue_PassFactory.Builder();
  }

  /** Creates a new pass to be run. */
  public final MirPass create() {
    return getInternalFactory().get();
  }
}

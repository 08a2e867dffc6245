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

import com.google.common.collect.ImmutableList;

/** The passes run by default, in order. */
public final class DefaultPassConfig {

  private DefaultPassConfig() {}

  /** Returns the optimization passes. */
  public static ImmutableList<PassFactory> getOptimizations() {
    return ImmutableList.of(scalarReplacementOfAggregates);
  }

  /** Splits aggregate locals into one local per field. */
  static final PassFactory scalarReplacementOfAggregates =
      PassFactory.builder()
          .setName(PassNames.SCALAR_REPLACEMENT_OF_AGGREGATES)
          .setInternalFactory(ScalarReplacementOfAggregates::new)
          .build();

  /** Checks the structure of a body without changing it. */
  static final PassFactory validateMir =
      PassFactory.builder()
          .setName(PassNames.VALIDATE_MIR)
          .setInternalFactory(MirValidator::new)
          .build();
}

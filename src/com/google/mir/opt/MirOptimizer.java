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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.mir.ir.Body;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs a sequence of passes over function bodies.
 *
 * <p>Passes that are not enabled under the options are skipped.
 * When the options ask for it, the body is validated after each pass that ran.
 */
public final class MirOptimizer {
  private static final Logger logger = Logger.getLogger(MirOptimizer.class.getName());

  private final MirOptions options;
  private final ImmutableList<PassFactory> passes;

  public MirOptimizer(MirOptions options, List<PassFactory> passes) {
    this.options = checkNotNull(options);
    this.passes = ImmutableList.copyOf(passes);
  }

  /** Creates an optimizer running the {@link DefaultPassConfig} optimizations. */
  public static MirOptimizer createDefault(MirOptions options) {
    return new MirOptimizer(options, DefaultPassConfig.getOptimizations());
  }

  /** Runs every enabled pass over {@code body}, in order. */
  public void process(Body body) {
    for (PassFactory factory : passes) {
      String name = factory.getName();
      MirPass pass = factory.create();
      if (!pass.isEnabled(options)) {
        logger.fine("Pass " + name + " is disabled at level " + options.getMirOptLevel());
        continue;
      }
      logger.fine("Running pass " + name + " on " + body.getName());
      pass.process(body);
      if (options.shouldValidateAfterEachPass()) {
        DefaultPassConfig.validateMir.create().process(body);
      }
    }
  }

  /** Runs every enabled pass over each body. */
  public void process(List<Body> bodies) {
    for (Body body : bodies) {
      process(body);
    }
  }
}

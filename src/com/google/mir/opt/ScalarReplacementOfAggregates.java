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

import com.google.mir.ir.Body;
import java.util.BitSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scalar replacement of aggregates: splits tuple and struct locals whose fields are only ever
 * used one at a time into one local per field.
 *
 * <p>For example
 *
 * <pre>
 * _1 = Pair { a: const 1_i32, b: const 2_i32 };
 * _0 = Add(copy _1.0, copy _1.1);
 * </pre>
 *
 * becomes
 *
 * <pre>
 * _2 = const 1_i32;
 * _3 = const 2_i32;
 * _0 = Add(copy _2, copy _3);
 * </pre>
 *
 * <p>Runs at optimization level 3 and above. The work happens in three steps:
 * {@link EscapingLocals} finds locals that must stay whole, {@link FlatteningPlanner} picks the
 * fields to split out and {@link ReplaceFlattenedLocals} rewrites the body.
 */
public final class ScalarReplacementOfAggregates implements MirPass {
  private static final Logger logger =
      Logger.getLogger(ScalarReplacementOfAggregates.class.getName());

  static final int MIN_MIR_OPT_LEVEL = 3;

  public ScalarReplacementOfAggregates() {}

  @Override
  public boolean isEnabled(MirOptions options) {
    return options.getMirOptLevel() >= MIN_MIR_OPT_LEVEL;
  }

  @Override
  public void process(Body body) {
    BitSet escaping = EscapingLocals.compute(body);
    boolean fine = logger.isLoggable(Level.FINE);
    if (fine) {
      logger.fine("Escaping locals of " + body.getName() + ": " + escaping);
    }
    ReplacementMap replacements = FlatteningPlanner.computeFlattening(body, escaping);
    if (replacements.isEmpty()) {
      if (fine) {
        logger.fine("Nothing to split in " + body.getName());
      }
      return;
    }
    if (fine) {
      logger.fine("Split plan for " + body.getName() + ": " + replacements.asMap());
    }
    ReplaceFlattenedLocals.replaceFlattenedLocals(body, replacements);
  }
}

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

/**
 * A transformation or check run over one function body at a time.
 *
 * <p>Passes hold no state between bodies, so one instance may process many bodies.
 */
public interface MirPass {

  /** Whether the pass should run under {@code options}. */
  default boolean isEnabled(MirOptions options) {
    return true;
  }

  /**
   * Processes {@code body}, modifying it in place.
   */
  void process(Body body);
}

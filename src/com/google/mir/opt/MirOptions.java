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

import static com.google.common.base.Preconditions.checkArgument;

/** Options that control which passes run and how they are checked. */
public class MirOptions {

  /** How aggressively to optimize. Passes pick the lowest level they run at. */
  private int mirOptLevel = 1;

  /** Whether to run {@link MirValidator} after every pass. */
  private boolean validateAfterEachPass = false;

  public MirOptions() {}

  public int getMirOptLevel() {
    return mirOptLevel;
  }

  public void setMirOptLevel(int mirOptLevel) {
    checkArgument(mirOptLevel >= 0, "negative optimization level %s", mirOptLevel);
    this.mirOptLevel = mirOptLevel;
  }

  public boolean shouldValidateAfterEachPass() {
    return validateAfterEachPass;
  }

  public void setValidateAfterEachPass(boolean validateAfterEachPass) {
    this.validateAfterEachPass = validateAfterEachPass;
  }
}

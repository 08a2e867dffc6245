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

package com.google.mir.ir;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/**
 * Index of one slot in a {@link Body}'s local table.
 *
 * <p>Slot zero always holds the return value and slots {@code 1..argCount} hold the parameters.
 */
@AutoValue
@Immutable
public abstract class Local implements Comparable<Local> {

  /** The slot that receives the function's return value. */
  public static final Local RETURN_PLACE = of(0);

  public abstract int index();

  public static Local of(int index) {
    checkArgument(index >= 0, "negative local index: %s", index);
    return new AutoValue_Local(index);
  }

  public final boolean isReturnPlace() {
    return index() == 0;
  }

  @Override
  public final int compareTo(Local other) {
    return Integer.compare(index(), other.index());
  }

  @Override
  public final String toString() {
    return "_" + index();
  }
}

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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;

/** One piece of a composite debug variable: the place holding the value at {@code projection}. */
@AutoValue
@Immutable
public abstract class VarDebugInfoFragment {

  /** Field path into the user variable; empty only for a fragment covering all of it. */
  public abstract ImmutableList<ProjectionElem> getProjection();

  public abstract Place getContents();

  public static VarDebugInfoFragment create(
      ImmutableList<ProjectionElem> projection, Place contents) {
    return new AutoValue_VarDebugInfoFragment(projection, contents);
  }

  public final VarDebugInfoFragment withContents(Place newContents) {
    return newContents.equals(getContents()) ? this : create(getProjection(), newContents);
  }

  @Override
  public final String toString() {
    return MirPrinter.formatPlace(null, getProjection()) + " => " + getContents();
  }
}

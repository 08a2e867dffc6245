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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import java.util.List;

/**
 * Shares equal projection lists between the places of one {@link Body}.
 *
 * <p>Each body owns its interner, so nothing interned here outlives the body.
 */
public final class ProjectionInterner {
  private final Interner<ImmutableList<ProjectionElem>> interner = Interners.newStrongInterner();

  public ImmutableList<ProjectionElem> intern(List<ProjectionElem> projection) {
    return interner.intern(ImmutableList.copyOf(projection));
  }

  /** Returns the interned concatenation of {@code prefix} and {@code suffix}. */
  public ImmutableList<ProjectionElem> concat(
      List<ProjectionElem> prefix, List<ProjectionElem> suffix) {
    if (suffix.isEmpty()) {
      return intern(prefix);
    }
    return interner.intern(
        ImmutableList.<ProjectionElem>builderWithExpectedSize(prefix.size() + suffix.size())
            .addAll(prefix)
            .addAll(suffix)
            .build());
  }
}

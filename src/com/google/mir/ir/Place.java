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
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A memory location: a local followed by a sequence of projection steps.
 *
 * <p>Places built through a {@link Body} or a {@link ProjectionInterner} share their projection
 * lists.
 */
@AutoValue
@Immutable
public abstract class Place {

  public abstract Local getLocal();

  public abstract ImmutableList<ProjectionElem> getProjection();

  /** Creates a place whose projection is already interned (or empty). */
  public static Place create(Local local, ImmutableList<ProjectionElem> projection) {
    return new AutoValue_Place(local, projection);
  }

  public static Place of(Local local) {
    return new AutoValue_Place(local, ImmutableList.of());
  }

  /** Returns the local if this place is a bare local with no projection. */
  public final @Nullable Local asLocal() {
    return getProjection().isEmpty() ? getLocal() : null;
  }

  /** Whether reaching this place goes through a pointer dereference. */
  public final boolean isIndirect() {
    for (ProjectionElem elem : getProjection()) {
      if (elem.isDeref()) {
        return true;
      }
    }
    return false;
  }

  public final PlaceRef asRef() {
    return PlaceRef.of(getLocal(), getProjection());
  }

  /** Returns this place with {@code suffix} appended to its projection. */
  public final Place projectDeeper(List<ProjectionElem> suffix, ProjectionInterner interner) {
    if (suffix.isEmpty()) {
      return this;
    }
    return create(getLocal(), interner.concat(getProjection(), suffix));
  }

  @Override
  public final String toString() {
    return MirPrinter.formatPlace(getLocal(), getProjection());
  }
}

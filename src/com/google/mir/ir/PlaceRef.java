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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * A non-owning view of a place: a local plus a slice of some place's projection.
 *
 * <p>Equality and hashing are structural, which makes a {@code PlaceRef} usable as a map key
 * regardless of which place the slice was taken from.
 */
@AutoValue
@Immutable
public abstract class PlaceRef {

  public abstract Local getLocal();

  public abstract ImmutableList<ProjectionElem> getProjection();

  public static PlaceRef of(Local local, ImmutableList<ProjectionElem> projection) {
    return new AutoValue_PlaceRef(local, projection);
  }

  public static PlaceRef of(Local local) {
    return of(local, ImmutableList.of());
  }

  public final @Nullable Local asLocal() {
    return getProjection().isEmpty() ? getLocal() : null;
  }

  /** Whether the first projection step selects a field. */
  public final boolean startsWithField() {
    return !getProjection().isEmpty() && getProjection().get(0).isField();
  }

  /** Returns the view of the first {@code length} projection steps. */
  public final PlaceRef prefix(int length) {
    checkArgument(length <= getProjection().size(), "prefix longer than %s", this);
    return of(getLocal(), getProjection().subList(0, length));
  }

  /** Whether this place's projection starts with all of {@code other}'s steps. */
  public final boolean extendsProjection(ImmutableList<ProjectionElem> other) {
    return getProjection().size() >= other.size()
        && getProjection().subList(0, other.size()).equals(other);
  }

  @Override
  public final String toString() {
    return MirPrinter.formatPlace(getLocal(), getProjection());
  }
}

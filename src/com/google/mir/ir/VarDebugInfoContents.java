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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/** Where a debugger finds a user variable. */
@AutoValue
@Immutable
public abstract class VarDebugInfoContents {

  /** The three ways a user variable can be described. */
  public enum Kind {
    PLACE,
    CONST,
    /** A value of {@code type} scattered over several places. */
    COMPOSITE
  }

  public abstract Kind getKind();

  abstract @Nullable Place place();

  abstract @Nullable Constant constant();

  abstract @Nullable Type type();

  abstract ImmutableList<VarDebugInfoFragment> fragments();

  public static VarDebugInfoContents place(Place place) {
    return new AutoValue_VarDebugInfoContents(
        Kind.PLACE, checkNotNull(place), null, null, ImmutableList.of());
  }

  public static VarDebugInfoContents constant(Constant constant) {
    return new AutoValue_VarDebugInfoContents(
        Kind.CONST, null, checkNotNull(constant), null, ImmutableList.of());
  }

  public static VarDebugInfoContents composite(
      Type type, ImmutableList<VarDebugInfoFragment> fragments) {
    return new AutoValue_VarDebugInfoContents(
        Kind.COMPOSITE, null, null, checkNotNull(type), fragments);
  }

  public final Place getPlace() {
    checkState(getKind() == Kind.PLACE, "%s is not a place", this);
    return place();
  }

  public final Constant getConstant() {
    checkState(getKind() == Kind.CONST, "%s is not a constant", this);
    return constant();
  }

  public final Type getType() {
    checkState(getKind() == Kind.COMPOSITE, "%s is not composite", this);
    return type();
  }

  public final ImmutableList<VarDebugInfoFragment> getFragments() {
    checkState(getKind() == Kind.COMPOSITE, "%s is not composite", this);
    return fragments();
  }

  @Override
  public final String toString() {
    return MirPrinter.formatDebugContents(this);
  }
}

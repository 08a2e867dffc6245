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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/** A non-branching instruction inside a basic block. */
@AutoValue
@Immutable
public abstract class Statement {

  /** Statement shapes. */
  public enum Kind {
    /** {@code place = rvalue}. */
    ASSIGN,
    STORAGE_LIVE,
    STORAGE_DEAD,
    /** Marks the place as uninitialized before it is written field by field. */
    DEINIT,
    /** {@code discriminant(place) = variant}. */
    SET_DISCRIMINANT,
    NOP
  }

  public abstract Kind getKind();

  public abstract SourceInfo getSourceInfo();

  abstract @Nullable Place place();

  abstract @Nullable Rvalue rvalue();

  abstract @Nullable Local local();

  abstract int variantIndex();

  private static Statement create(
      Kind kind,
      SourceInfo sourceInfo,
      @Nullable Place place,
      @Nullable Rvalue rvalue,
      @Nullable Local local,
      int variantIndex) {
    return new AutoValue_Statement(kind, sourceInfo, place, rvalue, local, variantIndex);
  }

  public static Statement assign(SourceInfo sourceInfo, Place place, Rvalue rvalue) {
    return create(Kind.ASSIGN, sourceInfo, checkNotNull(place), checkNotNull(rvalue), null, 0);
  }

  public static Statement assign(Place place, Rvalue rvalue) {
    return assign(SourceInfo.unknown(), place, rvalue);
  }

  public static Statement storageLive(SourceInfo sourceInfo, Local local) {
    return create(Kind.STORAGE_LIVE, sourceInfo, null, null, checkNotNull(local), 0);
  }

  public static Statement storageLive(Local local) {
    return storageLive(SourceInfo.unknown(), local);
  }

  public static Statement storageDead(SourceInfo sourceInfo, Local local) {
    return create(Kind.STORAGE_DEAD, sourceInfo, null, null, checkNotNull(local), 0);
  }

  public static Statement storageDead(Local local) {
    return storageDead(SourceInfo.unknown(), local);
  }

  public static Statement deinit(SourceInfo sourceInfo, Place place) {
    return create(Kind.DEINIT, sourceInfo, checkNotNull(place), null, null, 0);
  }

  public static Statement deinit(Place place) {
    return deinit(SourceInfo.unknown(), place);
  }

  public static Statement setDiscriminant(SourceInfo sourceInfo, Place place, int variantIndex) {
    checkArgument(variantIndex >= 0, "negative variant index %s", variantIndex);
    return create(Kind.SET_DISCRIMINANT, sourceInfo, checkNotNull(place), null, null, variantIndex);
  }

  public static Statement nop(SourceInfo sourceInfo) {
    return create(Kind.NOP, sourceInfo, null, null, null, 0);
  }

  public final boolean isAssign() {
    return getKind() == Kind.ASSIGN;
  }

  public final boolean isStorageMarker() {
    return getKind() == Kind.STORAGE_LIVE || getKind() == Kind.STORAGE_DEAD;
  }

  /** Returns the written place of an assignment, deinit or discriminant write. */
  public final Place getPlace() {
    checkState(place() != null, "%s has no place", this);
    return place();
  }

  public final Rvalue getRvalue() {
    checkState(isAssign(), "%s is not an assignment", this);
    return rvalue();
  }

  /** Returns the local of a storage marker. */
  public final Local getLocal() {
    checkState(isStorageMarker(), "%s is not a storage marker", this);
    return local();
  }

  public final int getVariantIndex() {
    checkState(getKind() == Kind.SET_DISCRIMINANT, "%s sets no discriminant", this);
    return variantIndex();
  }

  /** Returns an assignment with the same source info and the given parts. */
  public final Statement withAssign(Place newPlace, Rvalue newRvalue) {
    checkState(isAssign(), "%s is not an assignment", this);
    if (newPlace.equals(place()) && newRvalue.equals(rvalue())) {
      return this;
    }
    return assign(getSourceInfo(), newPlace, newRvalue);
  }

  /** Returns this deinit or discriminant write applied to {@code newPlace}. */
  public final Statement withPlace(Place newPlace) {
    checkState(
        getKind() == Kind.DEINIT || getKind() == Kind.SET_DISCRIMINANT, "%s", this);
    if (newPlace.equals(place())) {
      return this;
    }
    return create(getKind(), getSourceInfo(), newPlace, null, null, variantIndex());
  }

  /** Returns this storage marker applied to {@code newLocal}. */
  public final Statement withLocal(Local newLocal) {
    checkState(isStorageMarker(), "%s is not a storage marker", this);
    if (newLocal.equals(local())) {
      return this;
    }
    return create(getKind(), getSourceInfo(), null, null, newLocal, 0);
  }

  @Override
  public final String toString() {
    return MirPrinter.formatStatement(this);
  }
}

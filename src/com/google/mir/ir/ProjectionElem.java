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

/**
 * One step of a {@link Place}'s projection.
 *
 * <p>Field steps carry the type of the field they select, so the type of a place can be read
 * off its last field step without consulting the aggregate's definition.
 */
@AutoValue
@Immutable
public abstract class ProjectionElem {

  /** The kinds of projection step. */
  public enum Kind {
    /** {@code p.N}: a field of a tuple, struct, union or downcast enum. */
    FIELD,
    /** {@code (*p)}: the target of a reference or raw pointer. */
    DEREF,
    /** {@code p[_i]}: an array element selected by a local. */
    INDEX,
    /** {@code p[N of M]}: an array element at a constant offset. */
    CONSTANT_INDEX,
    /** {@code (p as Variant)}: a view of an enum as one of its variants. */
    DOWNCAST
  }

  private static final ProjectionElem DEREF = create(Kind.DEREF, 0, 0, false, null, null, null);

  public abstract Kind getKind();

  abstract int number();

  abstract int minLength();

  abstract boolean fromEnd();

  abstract @Nullable Type type();

  abstract @Nullable Local local();

  abstract @Nullable String name();

  private static ProjectionElem create(
      Kind kind,
      int number,
      int minLength,
      boolean fromEnd,
      @Nullable Type type,
      @Nullable Local local,
      @Nullable String name) {
    return new AutoValue_ProjectionElem(kind, number, minLength, fromEnd, type, local, name);
  }

  public static ProjectionElem field(int index, Type type) {
    checkArgument(index >= 0, "negative field index: %s", index);
    return create(Kind.FIELD, index, 0, false, checkNotNull(type), null, null);
  }

  public static ProjectionElem deref() {
    return DEREF;
  }

  public static ProjectionElem index(Local local) {
    return create(Kind.INDEX, 0, 0, false, null, checkNotNull(local), null);
  }

  public static ProjectionElem constantIndex(int offset, int minLength, boolean fromEnd) {
    checkArgument(
        offset >= 0 && offset <= minLength,
        "offset %s out of range for minimum length %s",
        offset,
        minLength);
    return create(Kind.CONSTANT_INDEX, offset, minLength, fromEnd, null, null, null);
  }

  public static ProjectionElem downcast(int variantIndex, String variantName) {
    return create(Kind.DOWNCAST, variantIndex, 0, false, null, null, checkNotNull(variantName));
  }

  public final boolean isField() {
    return getKind() == Kind.FIELD;
  }

  public final boolean isDeref() {
    return getKind() == Kind.DEREF;
  }

  public final int getFieldIndex() {
    checkState(isField(), "not a field projection: %s", this);
    return number();
  }

  public final Type getFieldType() {
    checkState(isField(), "not a field projection: %s", this);
    return type();
  }

  public final Local getIndexLocal() {
    checkState(getKind() == Kind.INDEX, "not an index projection: %s", this);
    return local();
  }

  public final int getOffset() {
    checkState(getKind() == Kind.CONSTANT_INDEX, "not a constant index: %s", this);
    return number();
  }

  public final int getMinLength() {
    checkState(getKind() == Kind.CONSTANT_INDEX, "not a constant index: %s", this);
    return minLength();
  }

  public final boolean isFromEnd() {
    checkState(getKind() == Kind.CONSTANT_INDEX, "not a constant index: %s", this);
    return fromEnd();
  }

  public final int getVariantIndex() {
    checkState(getKind() == Kind.DOWNCAST, "not a downcast: %s", this);
    return number();
  }

  public final String getVariantName() {
    checkState(getKind() == Kind.DOWNCAST, "not a downcast: %s", this);
    return name();
  }

  /** Returns this index step reading {@code newLocal} instead. */
  public final ProjectionElem withIndexLocal(Local newLocal) {
    checkState(getKind() == Kind.INDEX, "not an index projection: %s", this);
    return newLocal.equals(local()) ? this : index(newLocal);
  }

  @Override
  public final String toString() {
    switch (getKind()) {
      case FIELD:
        return "." + number();
      case DEREF:
        return "*";
      case INDEX:
        return "[" + local() + "]";
      case CONSTANT_INDEX:
        return "[" + (fromEnd() ? "-" : "") + number() + " of " + minLength() + "]";
      case DOWNCAST:
        return " as " + name();
    }
    throw new AssertionError(getKind());
  }
}

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
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/** A value read by an rvalue or terminator: a copy of a place, a move out of it, or a constant. */
@AutoValue
@Immutable
public abstract class Operand {

  /** How the operand obtains its value. */
  public enum Kind {
    COPY,
    MOVE,
    CONSTANT
  }

  public abstract Kind getKind();

  abstract @Nullable Place place();

  abstract @Nullable Constant constant();

  public static Operand copy(Place place) {
    return new AutoValue_Operand(Kind.COPY, checkNotNull(place), null);
  }

  public static Operand move(Place place) {
    return new AutoValue_Operand(Kind.MOVE, checkNotNull(place), null);
  }

  public static Operand constant(Constant constant) {
    return new AutoValue_Operand(Kind.CONSTANT, null, checkNotNull(constant));
  }

  public final boolean isConstant() {
    return getKind() == Kind.CONSTANT;
  }

  /** Returns the place read by a copy or move. */
  public final Place getPlace() {
    checkState(!isConstant(), "constant operand has no place: %s", this);
    return place();
  }

  public final Constant getConstant() {
    checkState(isConstant(), "not a constant: %s", this);
    return constant();
  }

  /** Returns an operand of the same kind reading {@code newPlace}. */
  public final Operand withPlace(Place newPlace) {
    checkState(!isConstant(), "constant operand has no place: %s", this);
    if (newPlace.equals(place())) {
      return this;
    }
    return getKind() == Kind.COPY ? copy(newPlace) : move(newPlace);
  }

  @Override
  public final String toString() {
    switch (getKind()) {
      case COPY:
        return "copy " + place();
      case MOVE:
        return "move " + place();
      case CONSTANT:
        return "const " + constant();
    }
    throw new AssertionError(getKind());
  }
}

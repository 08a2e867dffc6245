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
import org.jspecify.annotations.Nullable;

/**
 * The type of a projected place: a type, plus the selected variant once an enum has been
 * downcast.
 */
@AutoValue
@Immutable
public abstract class PlaceTy {

  public abstract Type getType();

  public abstract @Nullable Integer getVariantIndex();

  public static PlaceTy of(Type type) {
    return new AutoValue_PlaceTy(type, null);
  }

  static PlaceTy downcast(Type type, int variantIndex) {
    return new AutoValue_PlaceTy(type, variantIndex);
  }

  /** Returns the type of the place one projection step further. */
  public final PlaceTy project(ProjectionElem elem) {
    switch (elem.getKind()) {
      case DEREF:
        return of(getType().getPointee());
      case FIELD:
        // Field steps must agree with the aggregate they project out of.
        Type declared = getType().getFieldType(getVariantIndex(), elem.getFieldIndex());
        checkArgument(
            declared.equals(elem.getFieldType()),
            "field %s of %s has type %s, not %s",
            elem.getFieldIndex(),
            getType(),
            declared,
            elem.getFieldType());
        return of(declared);
      case INDEX:
      case CONSTANT_INDEX:
        return of(getType().getElementType());
      case DOWNCAST:
        checkArgument(getType().isEnum(), "cannot downcast %s", getType());
        getType().getAdtDef().getVariant(elem.getVariantIndex());
        return downcast(getType(), elem.getVariantIndex());
    }
    throw new AssertionError(elem.getKind());
  }
}

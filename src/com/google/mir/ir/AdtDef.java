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

/**
 * The definition of a nominal algebraic data type: a struct, an enum or a union.
 *
 * <p>Structs and unions have exactly one variant, named after the type. Enums have one variant
 * per case.
 */
@AutoValue
@Immutable
public abstract class AdtDef {

  /** The shape of an {@link AdtDef}. */
  public enum Kind {
    STRUCT,
    ENUM,
    UNION
  }

  public abstract String getName();

  public abstract Kind getKind();

  public abstract ImmutableList<VariantDef> getVariants();

  public static AdtDef struct(String name, ImmutableList<FieldDef> fields) {
    return new AutoValue_AdtDef(
        name, Kind.STRUCT, ImmutableList.of(VariantDef.create(name, fields)));
  }

  public static AdtDef union(String name, ImmutableList<FieldDef> fields) {
    return new AutoValue_AdtDef(
        name, Kind.UNION, ImmutableList.of(VariantDef.create(name, fields)));
  }

  public static AdtDef enumeration(String name, ImmutableList<VariantDef> variants) {
    return new AutoValue_AdtDef(name, Kind.ENUM, variants);
  }

  public final boolean isStruct() {
    return getKind() == Kind.STRUCT;
  }

  public final boolean isEnum() {
    return getKind() == Kind.ENUM;
  }

  public final boolean isUnion() {
    return getKind() == Kind.UNION;
  }

  /** Returns the only variant of a struct or union. */
  public final VariantDef getNonEnumVariant() {
    checkArgument(!isEnum(), "%s is an enum", getName());
    return getVariants().get(0);
  }

  public final VariantDef getVariant(int index) {
    checkArgument(
        index >= 0 && index < getVariants().size(),
        "variant index %s out of range for %s",
        index,
        getName());
    return getVariants().get(index);
  }

  /** Returns the index of the named variant, or -1. */
  public final int indexOfVariant(String name) {
    for (int i = 0; i < getVariants().size(); i++) {
      if (getVariants().get(i).getName().equals(name)) {
        return i;
      }
    }
    return -1;
  }

  /** One case of an enum, or the single body of a struct or union. */
  @AutoValue
  @Immutable
  public abstract static class VariantDef {
    public abstract String getName();

    public abstract ImmutableList<FieldDef> getFields();

    public static VariantDef create(String name, ImmutableList<FieldDef> fields) {
      return new AutoValue_AdtDef_VariantDef(name, fields);
    }

    public final FieldDef getField(int index) {
      checkArgument(
          index >= 0 && index < getFields().size(),
          "field index %s out of range for %s",
          index,
          getName());
      return getFields().get(index);
    }

    /** Returns the index of the named field, or -1. */
    public final int indexOfField(String name) {
      for (int i = 0; i < getFields().size(); i++) {
        if (getFields().get(i).getName().equals(name)) {
          return i;
        }
      }
      return -1;
    }

    /** Whether the fields are positional, as in {@code Some(i32)}. */
    public final boolean isPositional() {
      for (int i = 0; i < getFields().size(); i++) {
        if (!getFields().get(i).getName().equals(String.valueOf(i))) {
          return false;
        }
      }
      return !getFields().isEmpty();
    }
  }

  /** A named, typed field of a variant. */
  @AutoValue
  @Immutable
  public abstract static class FieldDef {
    public abstract String getName();

    public abstract Type getType();

    public static FieldDef create(String name, Type type) {
      return new AutoValue_AdtDef_FieldDef(name, type);
    }
  }
}

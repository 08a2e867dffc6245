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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The static type of a local or of a projected place.
 *
 * <p>Types are immutable and compared structurally. Nominal types compare by their
 * {@link AdtDef}.
 */
@Immutable
public final class Type {

  /** The type constructors understood by the IR. */
  public enum Kind {
    /** Integers, floats, bool and char. */
    SCALAR,
    /** Tuples, including the unit type {@code ()}. */
    TUPLE,
    /** Structs, enums and unions. */
    ADT,
    /** {@code &T} and {@code &mut T}. */
    REF,
    /** {@code *const T} and {@code *mut T}. */
    RAW_PTR,
    /** {@code [T; N]}. */
    ARRAY
  }

  public static final ImmutableSet<String> SCALAR_NAMES =
      ImmutableSet.of(
          "i8", "i16", "i32", "i64", "i128", "isize", "u8", "u16", "u32", "u64", "u128", "usize",
          "f32", "f64", "bool", "char");

  private static final Type UNIT = new Type(Kind.TUPLE, "", ImmutableList.of(), null, null, 0);

  private final Kind kind;
  private final String name;
  private final ImmutableList<Type> elements;
  private final @Nullable AdtDef adt;
  private final @Nullable Mutability mutability;
  private final long length;

  private Type(
      Kind kind,
      String name,
      ImmutableList<Type> elements,
      @Nullable AdtDef adt,
      @Nullable Mutability mutability,
      long length) {
    this.kind = kind;
    this.name = name;
    this.elements = elements;
    this.adt = adt;
    this.mutability = mutability;
    this.length = length;
  }

  public static Type scalar(String name) {
    checkArgument(SCALAR_NAMES.contains(name), "not a scalar type: %s", name);
    return new Type(Kind.SCALAR, name, ImmutableList.of(), null, null, 0);
  }

  public static Type unit() {
    return UNIT;
  }

  public static Type tuple(Type... elements) {
    return tuple(ImmutableList.copyOf(elements));
  }

  public static Type tuple(ImmutableList<Type> elements) {
    if (elements.isEmpty()) {
      return UNIT;
    }
    return new Type(Kind.TUPLE, "", elements, null, null, 0);
  }

  public static Type adt(AdtDef adt) {
    return new Type(Kind.ADT, adt.getName(), ImmutableList.of(), checkNotNull(adt), null, 0);
  }

  public static Type ref(Mutability mutability, Type pointee) {
    return new Type(Kind.REF, "", ImmutableList.of(pointee), null, mutability, 0);
  }

  public static Type rawPtr(Mutability mutability, Type pointee) {
    return new Type(Kind.RAW_PTR, "", ImmutableList.of(pointee), null, mutability, 0);
  }

  public static Type array(Type element, long length) {
    checkArgument(length >= 0, "negative array length: %s", length);
    return new Type(Kind.ARRAY, "", ImmutableList.of(element), null, null, length);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isScalar() {
    return kind == Kind.SCALAR;
  }

  public boolean isTuple() {
    return kind == Kind.TUPLE;
  }

  public boolean isUnit() {
    return kind == Kind.TUPLE && elements.isEmpty();
  }

  public boolean isAdt() {
    return kind == Kind.ADT;
  }

  public boolean isStruct() {
    return adt != null && adt.isStruct();
  }

  public boolean isEnum() {
    return adt != null && adt.isEnum();
  }

  public boolean isUnion() {
    return adt != null && adt.isUnion();
  }

  public boolean isRef() {
    return kind == Kind.REF;
  }

  public boolean isRawPtr() {
    return kind == Kind.RAW_PTR;
  }

  public boolean isArray() {
    return kind == Kind.ARRAY;
  }

  /** Returns the name of a scalar or nominal type. */
  public String getName() {
    checkState(kind == Kind.SCALAR || kind == Kind.ADT, "%s has no name", this);
    return name;
  }

  public AdtDef getAdtDef() {
    checkState(adt != null, "%s is not an ADT", this);
    return adt;
  }

  public ImmutableList<Type> getTupleElements() {
    checkState(kind == Kind.TUPLE, "%s is not a tuple", this);
    return elements;
  }

  /** Returns the target of a reference or raw pointer. */
  public Type getPointee() {
    checkState(kind == Kind.REF || kind == Kind.RAW_PTR, "cannot dereference %s", this);
    return elements.get(0);
  }

  public Mutability getMutability() {
    checkState(mutability != null, "%s has no mutability", this);
    return mutability;
  }

  public Type getElementType() {
    checkState(kind == Kind.ARRAY, "cannot index %s", this);
    return elements.get(0);
  }

  public long getLength() {
    checkState(kind == Kind.ARRAY, "%s is not an array", this);
    return length;
  }

  /**
   * Returns the number of fields of a tuple, a struct, a union or (given {@code variantIndex}) an
   * enum variant.
   */
  public int getFieldCount(@Nullable Integer variantIndex) {
    switch (kind) {
      case TUPLE:
        checkArgument(variantIndex == null, "tuples have no variants");
        return elements.size();
      case ADT:
        return variantOf(variantIndex).getFields().size();
      default:
        throw new IllegalArgumentException("type " + this + " has no fields");
    }
  }

  /** Returns the type of the given field, selecting {@code variantIndex} for enums. */
  public Type getFieldType(@Nullable Integer variantIndex, int fieldIndex) {
    switch (kind) {
      case TUPLE:
        checkArgument(variantIndex == null, "tuples have no variants");
        checkArgument(
            fieldIndex >= 0 && fieldIndex < elements.size(),
            "field %s out of range for %s",
            fieldIndex,
            this);
        return elements.get(fieldIndex);
      case ADT:
        return variantOf(variantIndex).getField(fieldIndex).getType();
      default:
        throw new IllegalArgumentException("type " + this + " has no field " + fieldIndex);
    }
  }

  private AdtDef.VariantDef variantOf(@Nullable Integer variantIndex) {
    AdtDef def = getAdtDef();
    if (def.isEnum()) {
      checkArgument(variantIndex != null, "enum %s needs a downcast before a field", name);
      return def.getVariant(variantIndex);
    }
    checkArgument(variantIndex == null, "%s has no variants", name);
    return def.getNonEnumVariant();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Type)) {
      return false;
    }
    Type that = (Type) o;
    return kind == that.kind
        && length == that.length
        && name.equals(that.name)
        && elements.equals(that.elements)
        && Objects.equals(adt, that.adt)
        && mutability == that.mutability;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, name, elements, adt, mutability, length);
  }

  @Override
  public String toString() {
    switch (kind) {
      case SCALAR:
      case ADT:
        return name;
      case TUPLE:
        if (elements.size() == 1) {
          return "(" + elements.get(0) + ",)";
        }
        return "(" + Joiner.on(", ").join(elements) + ")";
      case REF:
        return mutability.isMut() ? "&mut " + elements.get(0) : "&" + elements.get(0);
      case RAW_PTR:
        return (mutability.isMut() ? "*mut " : "*const ") + elements.get(0);
      case ARRAY:
        return "[" + elements.get(0) + "; " + length + "]";
    }
    throw new AssertionError(kind);
  }
}

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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * The right-hand side of an assignment.
 *
 * <p>Like {@code Node}s of different tokens, rvalues of different kinds populate different
 * properties; the typed getters check the kind before answering.
 */
@AutoValue
@Immutable
public abstract class Rvalue {

  /** The shapes of right-hand side. */
  public enum Kind {
    /** {@code operand}: the value of a single operand. */
    USE,
    /** {@code &place} or {@code &mut place}. */
    REF,
    /** {@code &raw const place} or {@code &raw mut place}. */
    ADDRESS_OF,
    BINARY_OP,
    /** A binary operator that also produces an overflow flag. */
    CHECKED_BINARY_OP,
    UNARY_OP,
    /** Construction of a tuple, struct, enum variant or array from its elements. */
    AGGREGATE,
    CAST,
    /** The length of an array place. */
    LEN,
    /** The discriminant of an enum place. */
    DISCRIMINANT
  }

  /** What an {@link Kind#AGGREGATE} rvalue builds. */
  public enum AggregateKind {
    TUPLE,
    ADT,
    ARRAY
  }

  public abstract Kind getKind();

  public abstract ImmutableList<Operand> getOperands();

  abstract @Nullable Place place();

  abstract @Nullable Mutability mutability();

  abstract @Nullable BinOp binOp();

  abstract @Nullable UnOp unOp();

  abstract @Nullable AggregateKind aggregateKind();

  /** The ADT or array type of an aggregate, or the target type of a cast. */
  abstract @Nullable Type type();

  abstract @Nullable Integer variantIndex();

  private static Rvalue create(
      Kind kind,
      ImmutableList<Operand> operands,
      @Nullable Place place,
      @Nullable Mutability mutability,
      @Nullable BinOp binOp,
      @Nullable UnOp unOp,
      @Nullable AggregateKind aggregateKind,
      @Nullable Type type,
      @Nullable Integer variantIndex) {
    return new AutoValue_Rvalue(
        kind, operands, place, mutability, binOp, unOp, aggregateKind, type, variantIndex);
  }

  public static Rvalue use(Operand operand) {
    return create(Kind.USE, ImmutableList.of(operand), null, null, null, null, null, null, null);
  }

  public static Rvalue ref(Mutability mutability, Place place) {
    return create(
        Kind.REF,
        ImmutableList.of(),
        checkNotNull(place),
        mutability,
        null,
        null,
        null,
        null,
        null);
  }

  public static Rvalue addressOf(Mutability mutability, Place place) {
    return create(
        Kind.ADDRESS_OF,
        ImmutableList.of(),
        checkNotNull(place),
        mutability,
        null,
        null,
        null,
        null,
        null);
  }

  public static Rvalue binaryOp(BinOp op, Operand lhs, Operand rhs) {
    return create(
        Kind.BINARY_OP, ImmutableList.of(lhs, rhs), null, null, op, null, null, null, null);
  }

  public static Rvalue checkedBinaryOp(BinOp op, Operand lhs, Operand rhs) {
    return create(
        Kind.CHECKED_BINARY_OP, ImmutableList.of(lhs, rhs), null, null, op, null, null, null, null);
  }

  public static Rvalue unaryOp(UnOp op, Operand operand) {
    return create(
        Kind.UNARY_OP, ImmutableList.of(operand), null, null, null, op, null, null, null);
  }

  public static Rvalue tuple(ImmutableList<Operand> fields) {
    return create(
        Kind.AGGREGATE, fields, null, null, null, null, AggregateKind.TUPLE, null, null);
  }

  /** Builds a struct value, or (with {@code variantIndex}) an enum variant. */
  public static Rvalue adt(
      Type adtType, @Nullable Integer variantIndex, ImmutableList<Operand> fields) {
    checkArgument(adtType.isStruct() || adtType.isEnum(), "cannot build %s", adtType);
    checkArgument(
        adtType.isEnum() == (variantIndex != null),
        "variant index must be given exactly for enums: %s",
        adtType);
    return create(
        Kind.AGGREGATE, fields, null, null, null, null, AggregateKind.ADT, adtType, variantIndex);
  }

  public static Rvalue array(Type elementType, ImmutableList<Operand> elements) {
    return create(
        Kind.AGGREGATE,
        elements,
        null,
        null,
        null,
        null,
        AggregateKind.ARRAY,
        Type.array(elementType, elements.size()),
        null);
  }

  public static Rvalue cast(Operand operand, Type target) {
    return create(
        Kind.CAST, ImmutableList.of(operand), null, null, null, null, null, target, null);
  }

  public static Rvalue len(Place place) {
    return create(
        Kind.LEN, ImmutableList.of(), checkNotNull(place), null, null, null, null, null, null);
  }

  public static Rvalue discriminant(Place place) {
    return create(
        Kind.DISCRIMINANT,
        ImmutableList.of(),
        checkNotNull(place),
        null,
        null,
        null,
        null,
        null,
        null);
  }

  public final boolean isUse() {
    return getKind() == Kind.USE;
  }

  public final boolean isAggregate() {
    return getKind() == Kind.AGGREGATE;
  }

  /** Returns the operand of a use, unary operator or cast. */
  public final Operand getOperand() {
    checkState(
        getKind() == Kind.USE || getKind() == Kind.UNARY_OP || getKind() == Kind.CAST,
        "%s has no single operand",
        this);
    return getOperands().get(0);
  }

  /** Returns the place of a borrow, address-of, length or discriminant read. */
  public final Place getPlace() {
    checkState(place() != null, "%s reads no place", this);
    return place();
  }

  public final Mutability getMutability() {
    checkState(mutability() != null, "%s has no mutability", this);
    return mutability();
  }

  public final BinOp getBinOp() {
    checkState(binOp() != null, "%s is not a binary operation", this);
    return binOp();
  }

  public final UnOp getUnOp() {
    checkState(unOp() != null, "%s is not a unary operation", this);
    return unOp();
  }

  public final AggregateKind getAggregateKind() {
    checkState(aggregateKind() != null, "%s is not an aggregate", this);
    return aggregateKind();
  }

  /** Returns the type built by an ADT or array aggregate. */
  public final Type getAggregateType() {
    checkState(isAggregate() && type() != null, "%s has no aggregate type", this);
    return type();
  }

  public final @Nullable Integer getVariantIndex() {
    checkState(isAggregate(), "%s is not an aggregate", this);
    return variantIndex();
  }

  public final Type getCastType() {
    checkState(getKind() == Kind.CAST, "%s is not a cast", this);
    return type();
  }

  /** Returns an rvalue of the same shape with the given operands. */
  public final Rvalue withOperands(ImmutableList<Operand> newOperands) {
    checkArgument(
        newOperands.size() == getOperands().size(), "operand count changed for %s", this);
    if (newOperands.equals(getOperands())) {
      return this;
    }
    return create(
        getKind(),
        newOperands,
        place(),
        mutability(),
        binOp(),
        unOp(),
        aggregateKind(),
        type(),
        variantIndex());
  }

  /** Returns an rvalue of the same shape reading {@code newPlace}. */
  public final Rvalue withPlace(Place newPlace) {
    checkState(place() != null, "%s reads no place", this);
    if (newPlace.equals(place())) {
      return this;
    }
    return create(
        getKind(),
        getOperands(),
        newPlace,
        mutability(),
        binOp(),
        unOp(),
        aggregateKind(),
        type(),
        variantIndex());
  }

  @Override
  public final String toString() {
    return MirPrinter.formatRvalue(this);
  }
}

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
 * The instruction that ends a basic block and names its successors.
 *
 * <p>Successor blocks are stored in {@link #getTargets()}. For {@code switchInt} the last target
 * is the {@code otherwise} edge and the others pair up with {@link #getValues()}.
 */
@AutoValue
@Immutable
public abstract class Terminator {

  /** Terminator shapes. */
  public enum Kind {
    GOTO,
    SWITCH_INT,
    RETURN,
    UNREACHABLE,
    /** {@code destination = func(args) -> target}; a call without target diverges. */
    CALL,
    DROP,
    /** {@code replace(place <- operand)}: drops the place and writes the operand into it. */
    DROP_AND_REPLACE,
    ASSERT
  }

  public abstract Kind getKind();

  public abstract SourceInfo getSourceInfo();

  public abstract ImmutableList<Integer> getTargets();

  abstract @Nullable Operand operand();

  abstract @Nullable Place place();

  abstract ImmutableList<Operand> args();

  abstract @Nullable String func();

  abstract ImmutableList<Long> values();

  abstract boolean expected();

  private static Terminator create(
      Kind kind,
      SourceInfo sourceInfo,
      ImmutableList<Integer> targets,
      @Nullable Operand operand,
      @Nullable Place place,
      ImmutableList<Operand> args,
      @Nullable String func,
      ImmutableList<Long> values,
      boolean expected) {
    return new AutoValue_Terminator(
        kind, sourceInfo, targets, operand, place, args, func, values, expected);
  }

  private static Terminator simple(
      Kind kind, SourceInfo sourceInfo, ImmutableList<Integer> targets) {
    return create(
        kind, sourceInfo, targets, null, null, ImmutableList.of(), null, ImmutableList.of(), false);
  }

  public static Terminator gotoBlock(SourceInfo sourceInfo, int target) {
    return simple(Kind.GOTO, sourceInfo, ImmutableList.of(target));
  }

  public static Terminator gotoBlock(int target) {
    return gotoBlock(SourceInfo.unknown(), target);
  }

  public static Terminator returnTerminator(SourceInfo sourceInfo) {
    return simple(Kind.RETURN, sourceInfo, ImmutableList.of());
  }

  public static Terminator returnTerminator() {
    return returnTerminator(SourceInfo.unknown());
  }

  public static Terminator unreachable(SourceInfo sourceInfo) {
    return simple(Kind.UNREACHABLE, sourceInfo, ImmutableList.of());
  }

  /**
   * Creates a switch on {@code discr}. {@code targets} holds one block per value followed by
   * the {@code otherwise} block.
   */
  public static Terminator switchInt(
      SourceInfo sourceInfo,
      Operand discr,
      ImmutableList<Long> values,
      ImmutableList<Integer> targets) {
    checkArgument(
        targets.size() == values.size() + 1,
        "switch needs one target per value plus otherwise: %s -> %s",
        values,
        targets);
    return create(
        Kind.SWITCH_INT,
        sourceInfo,
        targets,
        checkNotNull(discr),
        null,
        ImmutableList.of(),
        null,
        values,
        false);
  }

  public static Terminator call(
      SourceInfo sourceInfo,
      String func,
      ImmutableList<Operand> args,
      Place destination,
      @Nullable Integer target) {
    return create(
        Kind.CALL,
        sourceInfo,
        target == null ? ImmutableList.of() : ImmutableList.of(target),
        null,
        checkNotNull(destination),
        args,
        checkNotNull(func),
        ImmutableList.of(),
        false);
  }

  public static Terminator drop(SourceInfo sourceInfo, Place place, int target) {
    return create(
        Kind.DROP,
        sourceInfo,
        ImmutableList.of(target),
        null,
        checkNotNull(place),
        ImmutableList.of(),
        null,
        ImmutableList.of(),
        false);
  }

  public static Terminator dropAndReplace(
      SourceInfo sourceInfo, Place place, Operand value, int target) {
    return create(
        Kind.DROP_AND_REPLACE,
        sourceInfo,
        ImmutableList.of(target),
        checkNotNull(value),
        checkNotNull(place),
        ImmutableList.of(),
        null,
        ImmutableList.of(),
        false);
  }

  /** Continues to {@code target} when {@code cond} equals {@code expected}, panics otherwise. */
  public static Terminator assertTerminator(
      SourceInfo sourceInfo, Operand cond, boolean expected, int target) {
    return create(
        Kind.ASSERT,
        sourceInfo,
        ImmutableList.of(target),
        checkNotNull(cond),
        null,
        ImmutableList.of(),
        null,
        ImmutableList.of(),
        expected);
  }

  /** Returns the switch discriminant, assert condition or replacement value. */
  public final Operand getOperand() {
    checkState(operand() != null, "%s has no operand", this);
    return operand();
  }

  /** Returns the dropped place or the call destination. */
  public final Place getPlace() {
    checkState(place() != null, "%s has no place", this);
    return place();
  }

  public final ImmutableList<Operand> getArgs() {
    checkState(getKind() == Kind.CALL, "%s is not a call", this);
    return args();
  }

  public final String getFunc() {
    checkState(getKind() == Kind.CALL, "%s is not a call", this);
    return func();
  }

  public final ImmutableList<Long> getValues() {
    checkState(getKind() == Kind.SWITCH_INT, "%s is not a switch", this);
    return values();
  }

  public final boolean getExpected() {
    checkState(getKind() == Kind.ASSERT, "%s is not an assert", this);
    return expected();
  }

  public final Terminator withOperand(Operand newOperand) {
    checkState(operand() != null, "%s has no operand", this);
    if (newOperand.equals(operand())) {
      return this;
    }
    return create(
        getKind(),
        getSourceInfo(),
        getTargets(),
        newOperand,
        place(),
        args(),
        func(),
        values(),
        expected());
  }

  public final Terminator withPlace(Place newPlace) {
    checkState(place() != null, "%s has no place", this);
    if (newPlace.equals(place())) {
      return this;
    }
    return create(
        getKind(),
        getSourceInfo(),
        getTargets(),
        operand(),
        newPlace,
        args(),
        func(),
        values(),
        expected());
  }

  public final Terminator withArgs(ImmutableList<Operand> newArgs) {
    checkState(getKind() == Kind.CALL, "%s is not a call", this);
    if (newArgs.equals(args())) {
      return this;
    }
    return create(
        getKind(),
        getSourceInfo(),
        getTargets(),
        operand(),
        place(),
        newArgs,
        func(),
        values(),
        expected());
  }

  @Override
  public final String toString() {
    return MirPrinter.formatTerminator(this);
  }
}

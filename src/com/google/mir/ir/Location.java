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

/**
 * A point in a body: a block and an index into its statements. An index equal to the statement
 * count addresses the terminator.
 */
@AutoValue
@Immutable
public abstract class Location implements Comparable<Location> {

  public abstract int getBlock();

  public abstract int getStatementIndex();

  public static Location create(int block, int statementIndex) {
    checkArgument(
        block >= 0 && statementIndex >= 0, "bad location bb%s[%s]", block, statementIndex);
    return new AutoValue_Location(block, statementIndex);
  }

  public static Location start(int block) {
    return create(block, 0);
  }

  /** The next location in the same block. */
  public final Location successorWithinBlock() {
    return create(getBlock(), getStatementIndex() + 1);
  }

  @Override
  public final int compareTo(Location other) {
    int byBlock = Integer.compare(getBlock(), other.getBlock());
    return byBlock != 0 ? byBlock : Integer.compare(getStatementIndex(), other.getStatementIndex());
  }

  @Override
  public final String toString() {
    return "bb" + getBlock() + "[" + getStatementIndex() + "]";
  }
}

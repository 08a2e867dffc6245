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

import java.util.ArrayList;
import java.util.List;

/** A straight-line run of statements ended by one terminator. Blocks are mutable. */
public final class BasicBlockData {
  private final List<Statement> statements;
  private Terminator terminator;

  public BasicBlockData(List<Statement> statements, Terminator terminator) {
    this.statements = new ArrayList<>(statements);
    this.terminator = checkNotNull(terminator);
  }

  /** The live statement list. Edits to it change the block. */
  public List<Statement> getStatements() {
    return statements;
  }

  public Terminator getTerminator() {
    return terminator;
  }

  public void setTerminator(Terminator terminator) {
    this.terminator = checkNotNull(terminator);
  }

  /** Returns the location of this block's terminator given the block's index. */
  public Location terminatorLocation(int block) {
    return Location.create(block, statements.size());
  }
}

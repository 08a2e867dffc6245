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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A batch of statement insertions and deletions, staged while a body is being walked and applied
 * to it in one step afterwards.
 *
 * <p>Locations always refer to the body as it was before {@link #apply}; staging an edit never
 * shifts the location of another.
 */
public final class MirPatch {
  private final ListMultimap<Location, Statement> insertions = ArrayListMultimap.create();
  private final Set<Location> deletions = new HashSet<>();
  private boolean applied = false;

  /**
   * Inserts {@code statement} before the statement at {@code location}, or before the
   * terminator when the location addresses it. Statements staged at one location keep their
   * staging order.
   */
  public void addStatement(Location location, Statement statement) {
    checkState(!applied, "patch already applied");
    insertions.put(location, statement);
  }

  /** Removes the statement at {@code location}. */
  public void deleteStatement(Location location) {
    checkState(!applied, "patch already applied");
    deletions.add(location);
  }

  public boolean isEmpty() {
    return insertions.isEmpty() && deletions.isEmpty();
  }

  /** Performs every staged edit. A patch can be applied once. */
  public void apply(Body body) {
    checkState(!applied, "patch already applied");
    applied = true;
    for (Location location : insertions.keySet()) {
      checkLocation(body, location);
    }
    for (Location location : deletions) {
      checkArgument(
          location.getStatementIndex()
              < body.getBlock(location.getBlock()).getStatements().size(),
          "cannot delete the terminator at %s",
          location);
    }
    List<BasicBlockData> blocks = body.getBasicBlocks();
    for (int b = 0; b < blocks.size(); b++) {
      List<Statement> statements = blocks.get(b).getStatements();
      List<Statement> result = new ArrayList<>(statements.size());
      for (int i = 0; i <= statements.size(); i++) {
        Location location = Location.create(b, i);
        result.addAll(insertions.get(location));
        if (i < statements.size() && !deletions.contains(location)) {
          result.add(statements.get(i));
        }
      }
      statements.clear();
      statements.addAll(result);
    }
  }

  private static void checkLocation(Body body, Location location) {
    checkArgument(
        location.getBlock() < body.getBasicBlocks().size(), "no block at %s", location);
    checkArgument(
        location.getStatementIndex()
            <= body.getBlock(location.getBlock()).getStatements().size(),
        "no statement at %s",
        location);
  }
}

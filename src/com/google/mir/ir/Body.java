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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One function body: its local table, control-flow graph and debug information.
 *
 * <p>Local {@code _0} is the return place and locals {@code _1} through {@code _argCount} are the
 * parameters. A body owns the interner its places' projections come from, so places built for
 * one body should be built through {@link #makePlace}.
 */
public final class Body {
  private final String name;
  private final int argCount;
  private final ImmutableList<AdtDef> adtDefs;
  private final List<LocalDecl> localDecls = new ArrayList<>();
  private final List<BasicBlockData> basicBlocks = new ArrayList<>();
  private final List<VarDebugInfo> varDebugInfo = new ArrayList<>();
  private final ProjectionInterner interner = new ProjectionInterner();

  /**
   * @param adtDefs the type definitions the body mentions, kept so the printed body stays
   *     self-contained
   */
  public Body(String name, int argCount, List<AdtDef> adtDefs) {
    checkArgument(argCount >= 0, "negative argument count %s", argCount);
    this.name = checkNotNull(name);
    this.argCount = argCount;
    this.adtDefs = ImmutableList.copyOf(adtDefs);
  }

  public String getName() {
    return name;
  }

  public int getArgCount() {
    return argCount;
  }

  public ImmutableList<AdtDef> getAdtDefs() {
    return adtDefs;
  }

  public ProjectionInterner getInterner() {
    return interner;
  }

  /** Appends a local to the table and returns it. */
  @CanIgnoreReturnValue
  public Local pushLocal(LocalDecl decl) {
    localDecls.add(checkNotNull(decl));
    return Local.of(localDecls.size() - 1);
  }

  public int getLocalCount() {
    return localDecls.size();
  }

  public LocalDecl getLocalDecl(Local local) {
    checkElementIndex(local.index(), localDecls.size(), "local");
    return localDecls.get(local.index());
  }

  public List<LocalDecl> getLocalDecls() {
    return Collections.unmodifiableList(localDecls);
  }

  public boolean isArgument(Local local) {
    return local.index() >= 1 && local.index() <= argCount;
  }

  /** Appends a block and returns its index. */
  @CanIgnoreReturnValue
  public int addBlock(BasicBlockData block) {
    basicBlocks.add(checkNotNull(block));
    return basicBlocks.size() - 1;
  }

  public BasicBlockData getBlock(int index) {
    checkElementIndex(index, basicBlocks.size(), "block");
    return basicBlocks.get(index);
  }

  public List<BasicBlockData> getBasicBlocks() {
    return Collections.unmodifiableList(basicBlocks);
  }

  /** The live debug-info list. Entries are replaced in place by passes. */
  public List<VarDebugInfo> getVarDebugInfo() {
    return varDebugInfo;
  }

  public Place makePlace(Local local, List<ProjectionElem> projection) {
    return Place.create(local, interner.intern(projection));
  }

  /** Returns the static type of {@code place}. */
  public PlaceTy placeTy(PlaceRef place) {
    PlaceTy ty = PlaceTy.of(getLocalDecl(place.getLocal()).getType());
    for (ProjectionElem elem : place.getProjection()) {
      ty = ty.project(elem);
    }
    return ty;
  }

  public PlaceTy placeTy(Place place) {
    return placeTy(place.asRef());
  }

  @Override
  public String toString() {
    return MirPrinter.print(this);
  }
}

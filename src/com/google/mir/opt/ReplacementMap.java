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

package com.google.mir.opt;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.mir.ir.Body;
import com.google.mir.ir.Local;
import com.google.mir.ir.Place;
import com.google.mir.ir.PlaceRef;
import com.google.mir.ir.ProjectionElem;
import com.google.mir.ir.VarDebugInfoFragment;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The decomposition plan: which single-field places of which locals are replaced by which new
 * locals. Entries keep the order they were planned in.
 */
final class ReplacementMap {
  private final Map<PlaceRef, Local> fields = new LinkedHashMap<>();

  /** Per split local, its (field projection, new local) pairs in plan order. */
  private final ListMultimap<Local, Fragment> fragments = LinkedListMultimap.create();

  /** One field of a split local and the local that replaces it. */
  static final class Fragment {
    final ImmutableList<ProjectionElem> projection;
    final Local replacement;

    Fragment(ImmutableList<ProjectionElem> projection, Local replacement) {
      this.projection = projection;
      this.replacement = replacement;
    }

    /** The field index selected by the projection. */
    int getFieldIndex() {
      return projection.get(0).getFieldIndex();
    }
  }

  boolean isEmpty() {
    return fields.isEmpty();
  }

  boolean contains(PlaceRef place) {
    return fields.containsKey(place);
  }

  /** Records that {@code place}, a local with one field step, is replaced by {@code local}. */
  void put(PlaceRef place, Local replacement) {
    checkArgument(
        place.getProjection().size() == 1 && place.startsWithField(),
        "only single field steps are replaced: %s",
        place);
    checkArgument(!fields.containsKey(place), "%s planned twice", place);
    fields.put(place, replacement);
    fragments.put(place.getLocal(), new Fragment(place.getProjection(), replacement));
  }

  @Nullable Local get(PlaceRef place) {
    return fields.get(place);
  }

  ImmutableMap<PlaceRef, Local> asMap() {
    return ImmutableMap.copyOf(fields);
  }

  /** Returns the fragments of a split local, or null if it is not split. */
  @Nullable List<Fragment> fragmentsOf(Local local) {
    return fragments.containsKey(local) ? fragments.get(local) : null;
  }

  /** Returns the fragments of {@code place} if it is a bare split local. */
  @Nullable List<Fragment> placeFragments(Place place) {
    Local local = place.asLocal();
    return local == null ? null : fragmentsOf(local);
  }

  /** The locals that are split. None of them may be referenced once the plan is applied. */
  BitSet deadLocals() {
    BitSet dead = new BitSet();
    for (PlaceRef place : fields.keySet()) {
      dead.set(place.getLocal().index());
    }
    return dead;
  }

  /**
   * Returns {@code place} rebased onto the local replacing its leading field, or null when the
   * place does not start with a replaced field.
   */
  @Nullable Place replacePlace(Body body, Place place) {
    ImmutableList<ProjectionElem> projection = place.getProjection();
    if (projection.isEmpty() || !projection.get(0).isField()) {
      return null;
    }
    Local local = fields.get(place.asRef().prefix(1));
    if (local == null) {
      return null;
    }
    return body.makePlace(local, projection.subList(1, projection.size()));
  }

  /**
   * Describes {@code place} of a split local as debug-info fragments: every fragment of the local
   * under {@code place}, with {@code place}'s projection stripped. Returns null when the local is
   * not split.
   */
  @Nullable ImmutableList<VarDebugInfoFragment> gatherDebugInfoFragments(
      Body body, PlaceRef place) {
    List<Fragment> parts = fragmentsOf(place.getLocal());
    if (parts == null) {
      return null;
    }
    ImmutableList.Builder<VarDebugInfoFragment> result = ImmutableList.builder();
    int prefixLength = place.getProjection().size();
    for (Fragment part : parts) {
      PlaceRef fragment = PlaceRef.of(place.getLocal(), part.projection);
      if (fragment.extendsProjection(place.getProjection())) {
        result.add(
            VarDebugInfoFragment.create(
                body.getInterner()
                    .intern(part.projection.subList(prefixLength, part.projection.size())),
                Place.of(part.replacement)));
      }
    }
    return result.build();
  }
}

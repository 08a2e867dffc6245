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

import com.google.mir.ir.BasicBlockData;
import com.google.mir.ir.Body;
import com.google.mir.ir.Local;
import com.google.mir.ir.LocalDecl;
import com.google.mir.ir.Location;
import com.google.mir.ir.MirVisitor;
import com.google.mir.ir.Place;
import com.google.mir.ir.PlaceRef;
import com.google.mir.ir.Type;
import java.util.BitSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Plans which fields of non-escaping locals get their own local.
 *
 * <p>Every place that starts with a field step of a non-escaping local plans that one field. The
 * new local has the field's type and copies the mutability and span of the local it is carved
 * out of. Fields are planned in the order they are first seen, walking blocks in order and each
 * block's statements before its terminator; debug info is not consulted.
 */
final class FlatteningPlanner {

  private FlatteningPlanner() {}

  /** Plans the split of {@code body}'s locals, appending the new locals to its local table. */
  static ReplacementMap computeFlattening(Body body, BitSet escaping) {
    ReplacementMap map = new ReplacementMap();
    PreFlattenVisitor visitor = new PreFlattenVisitor(body, escaping, map);
    List<BasicBlockData> blocks = body.getBasicBlocks();
    for (int i = 0; i < blocks.size(); i++) {
      visitor.visitBasicBlock(i, blocks.get(i));
    }
    return map;
  }

  private static final class PreFlattenVisitor extends MirVisitor {
    private final Body body;
    private final BitSet escaping;
    private final ReplacementMap map;

    PreFlattenVisitor(Body body, BitSet escaping, ReplacementMap map) {
      this.body = body;
      this.escaping = escaping;
      this.map = map;
    }

    @Override
    public void visitPlace(Place place, @Nullable Location location) {
      if (place.asRef().startsWithField()) {
        createPlace(place.asRef().prefix(1));
      }
    }

    private void createPlace(PlaceRef place) {
      if (escaping.get(place.getLocal().index()) || map.contains(place)) {
        return;
      }
      Type type = body.placeTy(place).getType();
      LocalDecl owner = body.getLocalDecl(place.getLocal());
      Local local = body.pushLocal(owner.withType(type));
      map.put(place, local);
    }
  }
}

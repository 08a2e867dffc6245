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

import com.google.mir.ir.Body;
import com.google.mir.ir.Local;
import com.google.mir.ir.Location;
import com.google.mir.ir.MirVisitor;
import com.google.mir.ir.Place;
import com.google.mir.ir.ProjectionElem;
import com.google.mir.ir.Rvalue;
import com.google.mir.ir.Statement;
import com.google.mir.ir.Terminator;
import com.google.mir.ir.Type;
import com.google.mir.ir.VarDebugInfo;
import java.util.BitSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Finds the locals whose storage has to stay in one piece.
 *
 * <p>A local escapes when the body observes it as a whole: it is used without a field projection,
 * its address is taken, or it is dropped. The return place and the parameters always escape, as
 * do locals of union and enum type, whose fields overlap.
 *
 * <p>Some whole-local uses are not escapes because the rewriter expands them: storage markers,
 * {@code Deinit}, and assignments of an aggregate or a plain operand into a bare local.
 * Debug info never causes an escape.
 */
public final class EscapingLocals {

  private EscapingLocals() {}

  /** Returns the set of local indices that must not be split. */
  public static BitSet compute(Body body) {
    BitSet set = new BitSet(body.getLocalCount());
    set.set(0, body.getArgCount() + 1);
    for (int i = 0; i < body.getLocalCount(); i++) {
      Type type = body.getLocalDecl(Local.of(i)).getType();
      if (type.isUnion() || type.isEnum()) {
        set.set(i);
      }
    }
    new EscapeVisitor(set).visitBody(body);
    return set;
  }

  private static final class EscapeVisitor extends MirVisitor {
    private final BitSet set;

    EscapeVisitor(BitSet set) {
      this.set = set;
    }

    @Override
    public void visitLocal(Local local, @Nullable Location location) {
      set.set(local.index());
    }

    @Override
    public void visitPlace(Place place, @Nullable Location location) {
      List<ProjectionElem> projection = place.getProjection();
      if (!projection.isEmpty() && projection.get(0).isField()) {
        // Only the leading field step reads through the local; later steps may still use
        // other locals as indices.
        for (ProjectionElem elem : projection.subList(1, projection.size())) {
          visitProjectionElem(elem, location);
        }
        return;
      }
      superPlace(place, location);
    }

    @Override
    public void visitRvalue(Rvalue rvalue, Location location) {
      if (rvalue.getKind() == Rvalue.Kind.REF || rvalue.getKind() == Rvalue.Kind.ADDRESS_OF) {
        Place place = rvalue.getPlace();
        if (!place.isIndirect()) {
          // A pointer can reach anything inside the enclosing local.
          set.set(place.getLocal().index());
          return;
        }
      }
      superRvalue(rvalue, location);
    }

    @Override
    public void visitAssign(Place place, Rvalue rvalue, Location location) {
      if (place.asLocal() != null && (rvalue.isAggregate() || rvalue.isUse())) {
        visitRvalue(rvalue, location);
        return;
      }
      superAssign(place, rvalue, location);
    }

    @Override
    public void visitStatement(Statement statement, Location location) {
      switch (statement.getKind()) {
        case STORAGE_LIVE:
        case STORAGE_DEAD:
        case DEINIT:
          return;
        default:
          superStatement(statement, location);
      }
    }

    @Override
    public void visitTerminator(Terminator terminator, Location location) {
      if (terminator.getKind() == Terminator.Kind.DROP
          || terminator.getKind() == Terminator.Kind.DROP_AND_REPLACE) {
        Place place = terminator.getPlace();
        // Dropping takes the address of the place.
        if (!place.isIndirect()) {
          set.set(place.getLocal().index());
          if (terminator.getKind() == Terminator.Kind.DROP_AND_REPLACE) {
            visitOperand(terminator.getOperand(), location);
          }
          return;
        }
      }
      superTerminator(terminator, location);
    }

    @Override
    public void visitVarDebugInfo(VarDebugInfo debugInfo) {}
  }
}

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

import com.google.mir.ir.AdtDef;
import com.google.mir.ir.BasicBlockData;
import com.google.mir.ir.Body;
import com.google.mir.ir.Local;
import com.google.mir.ir.Location;
import com.google.mir.ir.MirVisitor;
import com.google.mir.ir.Operand;
import com.google.mir.ir.Place;
import com.google.mir.ir.PlaceTy;
import com.google.mir.ir.ProjectionElem;
import com.google.mir.ir.Rvalue;
import com.google.mir.ir.Statement;
import com.google.mir.ir.Type;
import com.google.mir.ir.VarDebugInfo;
import com.google.mir.ir.VarDebugInfoContents;
import com.google.mir.ir.VarDebugInfoFragment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Walks a body and checks that its structure is well formed. */
public final class MirValidator implements MirPass {

  /** Violation handler */
  public interface ViolationHandler {
    /** @param location where the violation was found, or null for debug info */
    void handleViolation(String message, @Nullable Location location);
  }

  private final ViolationHandler violationHandler;

  public MirValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  public MirValidator() {
    this(
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, @Nullable Location location) {
            throw new IllegalStateException(
                message + (location == null ? " in debug info" : " at " + location));
          }
        });
  }

  @Override
  public void process(Body body) {
    validateBody(body);
  }

  public void validateBody(Body body) {
    if (body.getLocalCount() < body.getArgCount() + 1) {
      violation(
          "body " + body.getName() + " declares fewer locals than its signature needs", null);
      return;
    }
    if (body.getBasicBlocks().isEmpty()) {
      violation("body " + body.getName() + " has no blocks", null);
      return;
    }
    new Checker(body).visitBody(body);
  }

  private void violation(String message, @Nullable Location location) {
    violationHandler.handleViolation(message, location);
  }

  private final class Checker extends MirVisitor {
    private final Body body;

    Checker(Body body) {
      this.body = body;
    }

    @Override
    public void visitBasicBlock(int block, BasicBlockData data) {
      for (int target : data.getTerminator().getTargets()) {
        if (target < 0 || target >= body.getBasicBlocks().size()) {
          violation("jump to missing block bb" + target, data.terminatorLocation(block));
        }
      }
      superBasicBlock(block, data);
    }

    @Override
    public void visitStatement(Statement statement, Location location) {
      switch (statement.getKind()) {
        case STORAGE_LIVE:
        case STORAGE_DEAD:
          Local local = statement.getLocal();
          if (local.isReturnPlace() || body.isArgument(local)) {
            violation("storage marker on " + local + ", whose storage is never scoped", location);
          }
          break;
        case SET_DISCRIMINANT:
          PlaceTy placeTy = placeTyOrNull(statement.getPlace());
          if (placeTy != null) {
            Type type = placeTy.getType();
            if (!type.isEnum()) {
              violation("discriminant set on non-enum " + type, location);
            } else if (statement.getVariantIndex() >= type.getAdtDef().getVariants().size()) {
              violation("no variant " + statement.getVariantIndex() + " in " + type, location);
            }
          }
          break;
        default:
          break;
      }
      superStatement(statement, location);
    }

    @Override
    public void visitAssign(Place place, Rvalue rvalue, Location location) {
      superAssign(place, rvalue, location);
      PlaceTy destination = placeTyOrNull(place);
      if (destination == null) {
        return;
      }
      if (rvalue.isUse()) {
        Type valueType = typeOf(rvalue.getOperand());
        if (valueType != null && !valueType.equals(destination.getType())) {
          violation(
              "assignment of " + valueType + " to " + place + " of type " + destination.getType(),
              location);
        }
      } else if (rvalue.isAggregate()) {
        validateAggregate(place, destination.getType(), rvalue, location);
      }
    }

    private void validateAggregate(
        Place place, Type destination, Rvalue rvalue, Location location) {
      List<Operand> operands = rvalue.getOperands();
      List<Type> fieldTypes;
      switch (rvalue.getAggregateKind()) {
        case TUPLE:
          fieldTypes = destination.isTuple() ? destination.getTupleElements() : null;
          break;
        case ADT:
          Type adtType = rvalue.getAggregateType();
          if (!adtType.equals(destination)) {
            violation("aggregate of type " + adtType + " assigned to " + destination, location);
            return;
          }
          AdtDef adt = adtType.getAdtDef();
          AdtDef.VariantDef variant =
              adt.isEnum() ? adt.getVariant(rvalue.getVariantIndex()) : adt.getNonEnumVariant();
          fieldTypes = new ArrayList<>();
          for (AdtDef.FieldDef field : variant.getFields()) {
            fieldTypes.add(field.getType());
          }
          break;
        case ARRAY:
          Type arrayType = rvalue.getAggregateType();
          if (!arrayType.equals(destination)) {
            violation("aggregate of type " + arrayType + " assigned to " + destination, location);
            return;
          }
          fieldTypes = Collections.nCopies(operands.size(), arrayType.getElementType());
          break;
        default:
          throw new AssertionError(rvalue.getAggregateKind());
      }
      if (fieldTypes == null || fieldTypes.size() != operands.size()) {
        violation(
            "aggregate "
                + rvalue
                + " has "
                + operands.size()
                + " operands but "
                + place
                + " of type "
                + destination
                + " needs "
                + (fieldTypes == null ? "a tuple" : String.valueOf(fieldTypes.size())),
            location);
        return;
      }
      for (int i = 0; i < operands.size(); i++) {
        Type operandType = typeOf(operands.get(i));
        if (operandType != null && !operandType.equals(fieldTypes.get(i))) {
          violation(
              "field " + i + " of " + destination + " is " + fieldTypes.get(i)
                  + " but got " + operandType,
              location);
        }
      }
    }

    @Override
    public void visitPlace(Place place, @Nullable Location location) {
      superPlace(place, location);
      validPlaceTy(place, location);
    }

    @Override
    public void visitLocal(Local local, @Nullable Location location) {
      if (local.index() >= body.getLocalCount()) {
        violation("undeclared local " + local, location);
      }
    }

    @Override
    public void visitVarDebugInfo(VarDebugInfo debugInfo) {
      superVarDebugInfo(debugInfo);
      VarDebugInfoContents contents = debugInfo.getContents();
      if (contents.getKind() != VarDebugInfoContents.Kind.COMPOSITE) {
        return;
      }
      for (VarDebugInfoFragment fragment : contents.getFragments()) {
        PlaceTy fragmentTy = PlaceTy.of(contents.getType());
        try {
          for (ProjectionElem elem : fragment.getProjection()) {
            if (!elem.isField()) {
              violation("debug fragment of " + debugInfo.getName() + " is not a field path", null);
              return;
            }
            fragmentTy = fragmentTy.project(elem);
          }
        } catch (IllegalArgumentException | IllegalStateException e) {
          violation("bad debug fragment of " + debugInfo.getName() + ": " + e.getMessage(), null);
          continue;
        }
        PlaceTy contentsTy = placeTyOrNull(fragment.getContents());
        if (contentsTy != null && !contentsTy.getType().equals(fragmentTy.getType())) {
          violation(
              "debug fragment of " + debugInfo.getName() + " has type " + contentsTy.getType()
                  + " but describes " + fragmentTy.getType(),
              null);
        }
      }
    }

    /** Returns the type of {@code place}, or null after reporting why it has none. */
    private @Nullable PlaceTy validPlaceTy(Place place, @Nullable Location location) {
      if (place.getLocal().index() >= body.getLocalCount()) {
        return null;
      }
      try {
        return body.placeTy(place);
      } catch (IllegalArgumentException | IllegalStateException e) {
        violation("ill-typed place " + place + ": " + e.getMessage(), location);
        return null;
      }
    }

    /** Like {@link #validPlaceTy} for places that were already checked when visited. */
    private @Nullable PlaceTy placeTyOrNull(Place place) {
      if (place.getLocal().index() >= body.getLocalCount()) {
        return null;
      }
      try {
        return body.placeTy(place);
      } catch (IllegalArgumentException | IllegalStateException e) {
        // Already reported when the place itself was visited.
        return null;
      }
    }

    private @Nullable Type typeOf(Operand operand) {
      if (operand.isConstant()) {
        return operand.getConstant().getType();
      }
      PlaceTy placeTy = placeTyOrNull(operand.getPlace());
      return placeTy == null ? null : placeTy.getType();
    }
  }
}

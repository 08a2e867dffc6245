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

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A read-only walk over a {@link Body}.
 *
 * <p>Each {@code visitX} hook defaults to the matching {@code superX} method, which visits the
 * children of the node. Subclasses override a hook and call its {@code superX} to keep
 * descending, or skip the call to prune the walk.
 */
public abstract class MirVisitor {

  public void visitBody(Body body) {
    superBody(body);
  }

  public void visitBasicBlock(int block, BasicBlockData data) {
    superBasicBlock(block, data);
  }

  public void visitStatement(Statement statement, Location location) {
    superStatement(statement, location);
  }

  public void visitAssign(Place place, Rvalue rvalue, Location location) {
    superAssign(place, rvalue, location);
  }

  public void visitRvalue(Rvalue rvalue, Location location) {
    superRvalue(rvalue, location);
  }

  public void visitOperand(Operand operand, Location location) {
    superOperand(operand, location);
  }

  public void visitConstant(Constant constant, @Nullable Location location) {}

  public void visitTerminator(Terminator terminator, Location location) {
    superTerminator(terminator, location);
  }

  public void visitPlace(Place place, @Nullable Location location) {
    superPlace(place, location);
  }

  public void visitProjectionElem(ProjectionElem elem, @Nullable Location location) {
    superProjectionElem(elem, location);
  }

  /** Called for every mention of a local, including storage markers and index steps. */
  public void visitLocal(Local local, @Nullable Location location) {}

  /** Debug info has no location; its places are visited with a null one. */
  public void visitVarDebugInfo(VarDebugInfo debugInfo) {
    superVarDebugInfo(debugInfo);
  }

  protected final void superBody(Body body) {
    List<BasicBlockData> blocks = body.getBasicBlocks();
    for (int i = 0; i < blocks.size(); i++) {
      visitBasicBlock(i, blocks.get(i));
    }
    for (VarDebugInfo debugInfo : body.getVarDebugInfo()) {
      visitVarDebugInfo(debugInfo);
    }
  }

  protected final void superBasicBlock(int block, BasicBlockData data) {
    List<Statement> statements = data.getStatements();
    for (int i = 0; i < statements.size(); i++) {
      visitStatement(statements.get(i), Location.create(block, i));
    }
    visitTerminator(data.getTerminator(), data.terminatorLocation(block));
  }

  protected final void superStatement(Statement statement, Location location) {
    switch (statement.getKind()) {
      case ASSIGN:
        visitAssign(statement.getPlace(), statement.getRvalue(), location);
        break;
      case STORAGE_LIVE:
      case STORAGE_DEAD:
        visitLocal(statement.getLocal(), location);
        break;
      case DEINIT:
      case SET_DISCRIMINANT:
        visitPlace(statement.getPlace(), location);
        break;
      case NOP:
        break;
    }
  }

  protected final void superAssign(Place place, Rvalue rvalue, Location location) {
    visitPlace(place, location);
    visitRvalue(rvalue, location);
  }

  protected final void superRvalue(Rvalue rvalue, Location location) {
    for (Operand operand : rvalue.getOperands()) {
      visitOperand(operand, location);
    }
    switch (rvalue.getKind()) {
      case REF:
      case ADDRESS_OF:
      case LEN:
      case DISCRIMINANT:
        visitPlace(rvalue.getPlace(), location);
        break;
      default:
        break;
    }
  }

  protected final void superOperand(Operand operand, Location location) {
    if (operand.isConstant()) {
      visitConstant(operand.getConstant(), location);
    } else {
      visitPlace(operand.getPlace(), location);
    }
  }

  protected final void superTerminator(Terminator terminator, Location location) {
    switch (terminator.getKind()) {
      case SWITCH_INT:
      case ASSERT:
        visitOperand(terminator.getOperand(), location);
        break;
      case CALL:
        for (Operand arg : terminator.getArgs()) {
          visitOperand(arg, location);
        }
        visitPlace(terminator.getPlace(), location);
        break;
      case DROP:
        visitPlace(terminator.getPlace(), location);
        break;
      case DROP_AND_REPLACE:
        visitPlace(terminator.getPlace(), location);
        visitOperand(terminator.getOperand(), location);
        break;
      case RETURN:
        // Returning reads the return place.
        visitLocal(Local.RETURN_PLACE, location);
        break;
      case GOTO:
      case UNREACHABLE:
        break;
    }
  }

  protected final void superPlace(Place place, @Nullable Location location) {
    visitLocal(place.getLocal(), location);
    for (ProjectionElem elem : place.getProjection()) {
      visitProjectionElem(elem, location);
    }
  }

  protected final void superProjectionElem(ProjectionElem elem, @Nullable Location location) {
    if (elem.getKind() == ProjectionElem.Kind.INDEX) {
      visitLocal(elem.getIndexLocal(), location);
    }
  }

  protected final void superVarDebugInfo(VarDebugInfo debugInfo) {
    VarDebugInfoContents contents = debugInfo.getContents();
    switch (contents.getKind()) {
      case PLACE:
        visitPlace(contents.getPlace(), null);
        break;
      case CONST:
        visitConstant(contents.getConstant(), null);
        break;
      case COMPOSITE:
        for (VarDebugInfoFragment fragment : contents.getFragments()) {
          visitPlace(fragment.getContents(), null);
        }
        break;
    }
  }
}

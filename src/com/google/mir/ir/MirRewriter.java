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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A structural rewrite of a {@link Body} in place.
 *
 * <p>Every {@code rewriteX} hook returns the node to put in place of its argument. The default
 * hooks rebuild a node only when one of its children changed, so an identity rewriter leaves
 * every node untouched.
 */
public abstract class MirRewriter {
  protected final Body body;

  protected MirRewriter(Body body) {
    this.body = checkNotNull(body);
  }

  /** Rewrites every statement, terminator and debug-info entry of the body. */
  public void rewriteBody() {
    List<BasicBlockData> blocks = body.getBasicBlocks();
    for (int b = 0; b < blocks.size(); b++) {
      BasicBlockData data = blocks.get(b);
      List<Statement> statements = data.getStatements();
      for (int i = 0; i < statements.size(); i++) {
        statements.set(i, rewriteStatement(statements.get(i), Location.create(b, i)));
      }
      data.setTerminator(rewriteTerminator(data.getTerminator(), data.terminatorLocation(b)));
    }
    List<VarDebugInfo> debugInfo = body.getVarDebugInfo();
    for (int i = 0; i < debugInfo.size(); i++) {
      debugInfo.set(i, rewriteVarDebugInfo(debugInfo.get(i)));
    }
  }

  public Statement rewriteStatement(Statement statement, Location location) {
    switch (statement.getKind()) {
      case ASSIGN:
        return statement.withAssign(
            rewritePlace(statement.getPlace()), rewriteRvalue(statement.getRvalue()));
      case STORAGE_LIVE:
      case STORAGE_DEAD:
        return statement.withLocal(rewriteLocal(statement.getLocal()));
      case DEINIT:
      case SET_DISCRIMINANT:
        return statement.withPlace(rewritePlace(statement.getPlace()));
      case NOP:
        return statement;
    }
    throw new AssertionError(statement.getKind());
  }

  public Rvalue rewriteRvalue(Rvalue rvalue) {
    Rvalue result = rvalue.withOperands(rewriteOperands(rvalue.getOperands()));
    switch (rvalue.getKind()) {
      case REF:
      case ADDRESS_OF:
      case LEN:
      case DISCRIMINANT:
        return result.withPlace(rewritePlace(rvalue.getPlace()));
      default:
        return result;
    }
  }

  public Operand rewriteOperand(Operand operand) {
    if (operand.isConstant()) {
      return operand;
    }
    return operand.withPlace(rewritePlace(operand.getPlace()));
  }

  public Terminator rewriteTerminator(Terminator terminator, Location location) {
    switch (terminator.getKind()) {
      case SWITCH_INT:
      case ASSERT:
        return terminator.withOperand(rewriteOperand(terminator.getOperand()));
      case CALL:
        return terminator
            .withArgs(rewriteOperands(terminator.getArgs()))
            .withPlace(rewritePlace(terminator.getPlace()));
      case DROP:
        return terminator.withPlace(rewritePlace(terminator.getPlace()));
      case DROP_AND_REPLACE:
        return terminator
            .withPlace(rewritePlace(terminator.getPlace()))
            .withOperand(rewriteOperand(terminator.getOperand()));
      case RETURN:
      case GOTO:
      case UNREACHABLE:
        return terminator;
    }
    throw new AssertionError(terminator.getKind());
  }

  public Place rewritePlace(Place place) {
    Local local = rewriteLocal(place.getLocal());
    ImmutableList<ProjectionElem> projection = place.getProjection();
    ImmutableList.Builder<ProjectionElem> newProjection = null;
    for (int i = 0; i < projection.size(); i++) {
      ProjectionElem elem = projection.get(i);
      ProjectionElem newElem = rewriteProjectionElem(elem);
      if (newProjection == null && !newElem.equals(elem)) {
        newProjection = ImmutableList.builder();
        newProjection.addAll(projection.subList(0, i));
      }
      if (newProjection != null) {
        newProjection.add(newElem);
      }
    }
    if (newProjection == null) {
      return local.equals(place.getLocal()) ? place : Place.create(local, projection);
    }
    return body.makePlace(local, newProjection.build());
  }

  public ProjectionElem rewriteProjectionElem(ProjectionElem elem) {
    if (elem.getKind() == ProjectionElem.Kind.INDEX) {
      return elem.withIndexLocal(rewriteLocal(elem.getIndexLocal()));
    }
    return elem;
  }

  public Local rewriteLocal(Local local) {
    return local;
  }

  public VarDebugInfo rewriteVarDebugInfo(VarDebugInfo debugInfo) {
    VarDebugInfoContents contents = debugInfo.getContents();
    switch (contents.getKind()) {
      case PLACE:
        return debugInfo.withContents(
            VarDebugInfoContents.place(rewritePlace(contents.getPlace())));
      case CONST:
        return debugInfo;
      case COMPOSITE:
        ImmutableList.Builder<VarDebugInfoFragment> fragments = ImmutableList.builder();
        for (VarDebugInfoFragment fragment : contents.getFragments()) {
          fragments.add(fragment.withContents(rewritePlace(fragment.getContents())));
        }
        return debugInfo.withContents(
            VarDebugInfoContents.composite(contents.getType(), fragments.build()));
    }
    throw new AssertionError(contents.getKind());
  }

  private ImmutableList<Operand> rewriteOperands(ImmutableList<Operand> operands) {
    ImmutableList.Builder<Operand> result = ImmutableList.builderWithExpectedSize(operands.size());
    for (Operand operand : operands) {
      result.add(rewriteOperand(operand));
    }
    return result.build();
  }
}

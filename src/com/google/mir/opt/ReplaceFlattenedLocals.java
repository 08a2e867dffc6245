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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.mir.ir.Body;
import com.google.mir.ir.Local;
import com.google.mir.ir.Location;
import com.google.mir.ir.MirPatch;
import com.google.mir.ir.MirRewriter;
import com.google.mir.ir.MirVisitor;
import com.google.mir.ir.Operand;
import com.google.mir.ir.Place;
import com.google.mir.ir.Rvalue;
import com.google.mir.ir.Statement;
import com.google.mir.ir.VarDebugInfo;
import com.google.mir.ir.VarDebugInfoContents;
import com.google.mir.ir.VarDebugInfoFragment;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Applies a {@link ReplacementMap} to a body.
 *
 * <p>Whole-local statements on a split local are expanded into one statement per field:
 *
 * <ul>
 *   <li>{@code StorageLive(x)}, {@code StorageDead(x)} and {@code Deinit(x)} become one marker per
 *       new local.
 *   <li>{@code x = Aggregate(ops)} becomes {@code new_i = ops[i]}.
 *   <li>{@code x = const C} is kept, followed by {@code new_f = move x.f}. A constant has no place
 *       to project, so {@code x} stays alive for this one read.
 *   <li>{@code x = copy P} becomes {@code new_f = copy P.f}, and likewise for moves.
 * </ul>
 *
 * Every other place that starts with a replaced field is rebased onto the new local. Debug info
 * for a split local becomes a composite of the new locals.
 *
 * <p>A composite debug entry keeps only the fragments that name a replaced field or a split local.
 * Fragments naming any other place, such as a parameter, are lost whenever the body has a plan.
 *
 * <p>Statements are inserted and removed through a {@link MirPatch} applied after the walk, so
 * inserted statements are never rewritten again. Once applied, the body must not mention a split
 * local anywhere except where a constant was kept.
 */
final class ReplaceFlattenedLocals extends MirRewriter {
  private static final Logger logger = Logger.getLogger(ReplaceFlattenedLocals.class.getName());

  private final ReplacementMap replacements;
  private final BitSet allDeadLocals;
  private final MirPatch patch = new MirPatch();

  private ReplaceFlattenedLocals(Body body, ReplacementMap replacements) {
    super(body);
    this.replacements = replacements;
    this.allDeadLocals = replacements.deadLocals();
  }

  /** Rewrites {@code body} according to {@code replacements}. An empty plan leaves it alone. */
  static void replaceFlattenedLocals(Body body, ReplacementMap replacements) {
    if (replacements.isEmpty()) {
      return;
    }
    ReplaceFlattenedLocals rewriter = new ReplaceFlattenedLocals(body, replacements);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Splitting locals " + rewriter.allDeadLocals + " of " + body.getName());
    }
    rewriter.rewriteBody();
    rewriter.patch.apply(body);
    new DeadLocalChecker(rewriter.allDeadLocals).visitBody(body);
  }

  @Override
  public Statement rewriteStatement(Statement statement, Location location) {
    switch (statement.getKind()) {
      case STORAGE_LIVE:
      case STORAGE_DEAD:
        List<ReplacementMap.Fragment> markers = replacements.fragmentsOf(statement.getLocal());
        if (markers != null) {
          for (ReplacementMap.Fragment fragment : markers) {
            patch.addStatement(location, statement.withLocal(fragment.replacement));
          }
          patch.deleteStatement(location);
        }
        return statement;
      case DEINIT:
        List<ReplacementMap.Fragment> deinits =
            replacements.placeFragments(statement.getPlace());
        if (deinits != null) {
          for (ReplacementMap.Fragment fragment : deinits) {
            patch.addStatement(
                location,
                Statement.deinit(statement.getSourceInfo(), Place.of(fragment.replacement)));
          }
          patch.deleteStatement(location);
          return statement;
        }
        break;
      case ASSIGN:
        if (expandAssign(statement, location)) {
          return statement;
        }
        break;
      default:
        break;
    }
    return super.rewriteStatement(statement, location);
  }

  /** Expands an assignment into a split local. Returns whether it did. */
  private boolean expandAssign(Statement statement, Location location) {
    Place lhs = statement.getPlace();
    List<ReplacementMap.Fragment> fragments = replacements.placeFragments(lhs);
    if (fragments == null) {
      return false;
    }
    Rvalue rvalue = statement.getRvalue();
    if (rvalue.isAggregate()) {
      ImmutableList<Operand> operands = rvalue.getOperands();
      for (ReplacementMap.Fragment fragment : fragments) {
        int index = fragment.getFieldIndex();
        checkState(
            index < operands.size(),
            "aggregate %s has no operand for field %s of %s",
            rvalue,
            index,
            lhs);
        addAssign(statement, location, fragment.replacement, rewriteOperand(operands.get(index)));
      }
      patch.deleteStatement(location);
      return true;
    }
    if (!rvalue.isUse()) {
      return false;
    }
    Operand operand = rvalue.getOperand();
    if (operand.isConstant()) {
      // The constant stays; each new local reads its field right after it.
      Location next = location.successorWithinBlock();
      for (ReplacementMap.Fragment fragment : fragments) {
        Place field = lhs.projectDeeper(fragment.projection, body.getInterner());
        addAssign(statement, next, fragment.replacement, Operand.move(field));
      }
      allDeadLocals.clear(lhs.getLocal().index());
      return true;
    }
    Place source = rewritePlace(operand.getPlace());
    for (ReplacementMap.Fragment fragment : fragments) {
      Place field = source.projectDeeper(fragment.projection, body.getInterner());
      addAssign(statement, location, fragment.replacement, operand.withPlace(field));
    }
    patch.deleteStatement(location);
    return true;
  }

  private void addAssign(Statement original, Location location, Local target, Operand value) {
    patch.addStatement(
        location, Statement.assign(original.getSourceInfo(), Place.of(target), Rvalue.use(value)));
  }

  @Override
  public Place rewritePlace(Place place) {
    Place replacement = replacements.replacePlace(body, place);
    return replacement != null ? replacement : super.rewritePlace(place);
  }

  @Override
  public VarDebugInfo rewriteVarDebugInfo(VarDebugInfo debugInfo) {
    VarDebugInfoContents contents = debugInfo.getContents();
    switch (contents.getKind()) {
      case PLACE:
        Place place = contents.getPlace();
        Place replacement = replacements.replacePlace(body, place);
        if (replacement != null) {
          return debugInfo.withContents(VarDebugInfoContents.place(replacement));
        }
        ImmutableList<VarDebugInfoFragment> gathered =
            replacements.gatherDebugInfoFragments(body, place.asRef());
        if (gathered != null) {
          return debugInfo.withContents(
              VarDebugInfoContents.composite(body.placeTy(place).getType(), gathered));
        }
        return debugInfo;
      case COMPOSITE:
        List<VarDebugInfoFragment> kept = new ArrayList<>();
        List<VarDebugInfoFragment> expanded = new ArrayList<>();
        for (VarDebugInfoFragment fragment : contents.getFragments()) {
          Place fragmentPlace = fragment.getContents();
          Place substituted = replacements.replacePlace(body, fragmentPlace);
          if (substituted != null) {
            kept.add(fragment.withContents(substituted));
            continue;
          }
          ImmutableList<VarDebugInfoFragment> nested =
              replacements.gatherDebugInfoFragments(body, fragmentPlace.asRef());
          if (nested == null) {
            // Fragments that neither name a split field nor a split local are dropped.
            continue;
          }
          for (VarDebugInfoFragment inner : nested) {
            expanded.add(
                VarDebugInfoFragment.create(
                    body.getInterner().concat(fragment.getProjection(), inner.getProjection()),
                    inner.getContents()));
          }
        }
        kept.addAll(expanded);
        return debugInfo.withContents(
            VarDebugInfoContents.composite(contents.getType(), ImmutableList.copyOf(kept)));
      case CONST:
        return debugInfo;
    }
    throw new AssertionError(contents.getKind());
  }

  /** Fails if a split local is still mentioned after the rewrite. */
  private static final class DeadLocalChecker extends MirVisitor {
    private final BitSet deadLocals;

    DeadLocalChecker(BitSet deadLocals) {
      this.deadLocals = deadLocals;
    }

    @Override
    public void visitLocal(Local local, @Nullable Location location) {
      checkState(
          !deadLocals.get(local.index()),
          "split local %s is still used at %s",
          local,
          location == null ? "debug info" : location);
    }
  }
}

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

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Renders bodies in the textual form {@link MirParser} reads back.
 *
 * <p>Source info is not printed, so two bodies that differ only in spans print the same.
 */
public final class MirPrinter {
  private static final Joiner COMMA_JOINER = Joiner.on(", ");
  private static final String INDENT = "    ";

  private MirPrinter() {}

  /** Prints the type definitions of {@code body} followed by the function itself. */
  public static String print(Body body) {
    StringBuilder sb = new StringBuilder();
    for (AdtDef adt : body.getAdtDefs()) {
      sb.append(formatAdtDef(adt)).append('\n');
    }
    if (!body.getAdtDefs().isEmpty()) {
      sb.append('\n');
    }
    sb.append(printFunction(body));
    return sb.toString();
  }

  /** Prints only the function, without type definitions. */
  public static String printFunction(Body body) {
    StringBuilder sb = new StringBuilder();
    List<String> params = new ArrayList<>();
    for (int i = 1; i <= body.getArgCount(); i++) {
      params.add(formatLocalDecl(Local.of(i), body.getLocalDecl(Local.of(i))));
    }
    sb.append("fn ")
        .append(body.getName())
        .append('(')
        .append(COMMA_JOINER.join(params))
        .append(')');
    Type returnType = body.getLocalDecl(Local.RETURN_PLACE).getType();
    if (!returnType.isUnit()) {
      sb.append(" -> ").append(returnType);
    }
    sb.append(" {\n");
    for (int i = body.getArgCount() + 1; i < body.getLocalCount(); i++) {
      Local local = Local.of(i);
      sb.append(INDENT)
          .append("let ")
          .append(formatLocalDecl(local, body.getLocalDecl(local)))
          .append(";\n");
    }
    for (VarDebugInfo debugInfo : body.getVarDebugInfo()) {
      sb.append(INDENT)
          .append("debug ")
          .append(debugInfo.getName())
          .append(" => ")
          .append(formatDebugContents(debugInfo.getContents()))
          .append(";\n");
    }
    List<BasicBlockData> blocks = body.getBasicBlocks();
    for (int b = 0; b < blocks.size(); b++) {
      sb.append('\n').append(INDENT).append("bb").append(b).append(": {\n");
      for (Statement statement : blocks.get(b).getStatements()) {
        sb.append(INDENT).append(INDENT).append(formatStatement(statement)).append(";\n");
      }
      sb.append(INDENT)
          .append(INDENT)
          .append(formatTerminator(blocks.get(b).getTerminator()))
          .append(";\n");
      sb.append(INDENT).append("}\n");
    }
    sb.append("}\n");
    return sb.toString();
  }

  private static String formatLocalDecl(Local local, LocalDecl decl) {
    return (decl.getMutability().isMut() ? "mut " : "") + local + ": " + decl.getType();
  }

  public static String formatAdtDef(AdtDef adt) {
    switch (adt.getKind()) {
      case STRUCT:
        AdtDef.VariantDef variant = adt.getNonEnumVariant();
        if (variant.isPositional() || variant.getFields().isEmpty()) {
          return "struct " + adt.getName() + formatVariantFields(variant) + ";";
        }
        return "struct " + adt.getName() + formatVariantFields(variant);
      case UNION:
        return "union " + adt.getName() + formatVariantFields(adt.getNonEnumVariant());
      case ENUM:
        List<String> variants = new ArrayList<>();
        for (AdtDef.VariantDef v : adt.getVariants()) {
          variants.add(v.getName() + formatVariantFields(v));
        }
        return "enum " + adt.getName() + " { " + COMMA_JOINER.join(variants) + " }";
    }
    throw new AssertionError(adt.getKind());
  }

  private static String formatVariantFields(AdtDef.VariantDef variant) {
    if (variant.getFields().isEmpty()) {
      return "";
    }
    List<String> fields = new ArrayList<>();
    for (AdtDef.FieldDef field : variant.getFields()) {
      fields.add(
          variant.isPositional()
              ? field.getType().toString()
              : field.getName() + ": " + field.getType());
    }
    return variant.isPositional()
        ? "(" + COMMA_JOINER.join(fields) + ")"
        : " { " + COMMA_JOINER.join(fields) + " }";
  }

  /**
   * Formats a place. A null local prints the projection alone, as composite debug-info
   * fragments do.
   */
  public static String formatPlace(@Nullable Local local, List<ProjectionElem> projection) {
    String result = local == null ? "" : local.toString();
    for (ProjectionElem elem : projection) {
      switch (elem.getKind()) {
        case DEREF:
          result = "(*" + result + ")";
          break;
        case DOWNCAST:
          result = "(" + result + elem + ")";
          break;
        default:
          result = result + elem;
          break;
      }
    }
    return result;
  }

  public static String formatRvalue(Rvalue rvalue) {
    switch (rvalue.getKind()) {
      case USE:
        return rvalue.getOperand().toString();
      case REF:
        return (rvalue.getMutability().isMut() ? "&mut " : "&") + rvalue.getPlace();
      case ADDRESS_OF:
        return (rvalue.getMutability().isMut() ? "&raw mut " : "&raw const ")
            + rvalue.getPlace();
      case BINARY_OP:
        return rvalue.getBinOp().getMirName()
            + "("
            + COMMA_JOINER.join(rvalue.getOperands())
            + ")";
      case CHECKED_BINARY_OP:
        return "Checked"
            + rvalue.getBinOp().getMirName()
            + "("
            + COMMA_JOINER.join(rvalue.getOperands())
            + ")";
      case UNARY_OP:
        return rvalue.getUnOp().getMirName() + "(" + rvalue.getOperand() + ")";
      case AGGREGATE:
        return formatAggregate(rvalue);
      case CAST:
        return rvalue.getOperand() + " as " + rvalue.getCastType();
      case LEN:
        return "Len(" + rvalue.getPlace() + ")";
      case DISCRIMINANT:
        return "discriminant(" + rvalue.getPlace() + ")";
    }
    throw new AssertionError(rvalue.getKind());
  }

  private static String formatAggregate(Rvalue rvalue) {
    List<Operand> operands = rvalue.getOperands();
    switch (rvalue.getAggregateKind()) {
      case TUPLE:
        if (operands.size() == 1) {
          return "(" + operands.get(0) + ",)";
        }
        return "(" + COMMA_JOINER.join(operands) + ")";
      case ARRAY:
        return "[" + COMMA_JOINER.join(operands) + "]";
      case ADT:
        AdtDef adt = rvalue.getAggregateType().getAdtDef();
        AdtDef.VariantDef variant;
        String head;
        if (adt.isEnum()) {
          variant = adt.getVariant(rvalue.getVariantIndex());
          head = adt.getName() + "::" + variant.getName();
        } else {
          variant = adt.getNonEnumVariant();
          head = adt.getName();
        }
        if (operands.isEmpty()) {
          return head;
        }
        if (variant.isPositional()) {
          return head + "(" + COMMA_JOINER.join(operands) + ")";
        }
        List<String> fields = new ArrayList<>();
        for (int i = 0; i < operands.size(); i++) {
          String name =
              i < variant.getFields().size() ? variant.getField(i).getName() : String.valueOf(i);
          fields.add(name + ": " + operands.get(i));
        }
        return head + " { " + COMMA_JOINER.join(fields) + " }";
    }
    throw new AssertionError(rvalue.getAggregateKind());
  }

  public static String formatStatement(Statement statement) {
    switch (statement.getKind()) {
      case ASSIGN:
        return statement.getPlace() + " = " + statement.getRvalue();
      case STORAGE_LIVE:
        return "StorageLive(" + statement.getLocal() + ")";
      case STORAGE_DEAD:
        return "StorageDead(" + statement.getLocal() + ")";
      case DEINIT:
        return "Deinit(" + statement.getPlace() + ")";
      case SET_DISCRIMINANT:
        return "discriminant(" + statement.getPlace() + ") = " + statement.getVariantIndex();
      case NOP:
        return "nop";
    }
    throw new AssertionError(statement.getKind());
  }

  public static String formatTerminator(Terminator terminator) {
    List<Integer> targets = terminator.getTargets();
    switch (terminator.getKind()) {
      case GOTO:
        return "goto -> bb" + targets.get(0);
      case SWITCH_INT:
        List<String> arms = new ArrayList<>();
        List<Long> values = terminator.getValues();
        for (int i = 0; i < values.size(); i++) {
          arms.add(values.get(i) + ": bb" + targets.get(i));
        }
        arms.add("otherwise: bb" + targets.get(values.size()));
        return "switchInt(" + terminator.getOperand() + ") -> [" + COMMA_JOINER.join(arms) + "]";
      case RETURN:
        return "return";
      case UNREACHABLE:
        return "unreachable";
      case CALL:
        String call =
            terminator.getPlace()
                + " = "
                + terminator.getFunc()
                + "("
                + COMMA_JOINER.join(terminator.getArgs())
                + ")";
        return targets.isEmpty() ? call : call + " -> bb" + targets.get(0);
      case DROP:
        return "drop(" + terminator.getPlace() + ") -> bb" + targets.get(0);
      case DROP_AND_REPLACE:
        return "replace("
            + terminator.getPlace()
            + " <- "
            + terminator.getOperand()
            + ") -> bb"
            + targets.get(0);
      case ASSERT:
        return "assert("
            + (terminator.getExpected() ? "" : "!")
            + terminator.getOperand()
            + ") -> bb"
            + targets.get(0);
    }
    throw new AssertionError(terminator.getKind());
  }

  public static String formatDebugContents(VarDebugInfoContents contents) {
    switch (contents.getKind()) {
      case PLACE:
        return contents.getPlace().toString();
      case CONST:
        return "const " + contents.getConstant();
      case COMPOSITE:
        if (contents.getFragments().isEmpty()) {
          return contents.getType() + " { }";
        }
        return contents.getType() + " { " + COMMA_JOINER.join(contents.getFragments()) + " }";
    }
    throw new AssertionError(contents.getKind());
  }
}

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
import com.google.mir.ir.MirTokenStream.Token;
import com.google.mir.ir.MirTokenStream.TokenType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Reads the textual form written by {@link MirPrinter}.
 *
 * <p>A source holds type definitions and functions, in any order, as long as every type is
 * defined before it is used:
 *
 * <pre>
 * struct Pair { a: i32, b: i32 }
 *
 * fn make(_1: i32) -&gt; i32 {
 *     let mut _2: Pair;
 *     debug p =&gt; _2;
 *
 *     bb0: {
 *         _2 = Pair { a: copy _1, b: const 2_i32 };
 *         _0 = copy _2.0;
 *         return;
 *     }
 * }
 * </pre>
 *
 * Locals are declared in index order: parameters in the signature, the rest with {@code let}.
 * Local {@code _0} is implicitly declared with the return type. Debug entries follow the
 * {@code let}s; blocks come last and are labelled in order.
 */
public final class MirParser {
  private static final Pattern LOCAL_NAME = Pattern.compile("_[0-9]+");
  private static final Pattern BLOCK_NAME = Pattern.compile("bb[0-9]+");

  private final String sourceName;
  private final List<Token> tokens = new ArrayList<>();
  private final Map<String, AdtDef> adts = new LinkedHashMap<>();
  private int index = 0;
  private Body body;

  private MirParser(String sourceName, String source) {
    this.sourceName = checkNotNull(sourceName);
    MirTokenStream stream = new MirTokenStream(sourceName, source);
    Token token;
    do {
      token = stream.next();
      tokens.add(token);
    } while (token.type != TokenType.EOF);
  }

  /** Parses every function in {@code source}. */
  public static ImmutableList<Body> parse(String sourceName, String source) {
    return new MirParser(sourceName, source).parseFile();
  }

  /** Parses a source that holds exactly one function. */
  public static Body parseBody(String sourceName, String source) {
    MirParser parser = new MirParser(sourceName, source);
    ImmutableList<Body> bodies = parser.parseFile();
    if (bodies.size() != 1) {
      throw new MirSyntaxException(
          "expected exactly one function but found " + bodies.size(), sourceName, 1, 1);
    }
    return bodies.get(0);
  }

  private ImmutableList<Body> parseFile() {
    ImmutableList.Builder<Body> bodies = ImmutableList.builder();
    while (peek().type != TokenType.EOF) {
      if (peek().is("struct") || peek().is("enum") || peek().is("union")) {
        parseAdtDef();
      } else if (peek().is("fn")) {
        bodies.add(parseFunction());
      } else {
        throw error(peek(), "expected 'fn' or a type definition but found " + peek());
      }
    }
    return bodies.build();
  }

  // Type definitions.

  private void parseAdtDef() {
    Token keyword = next();
    Token name = expectIdent();
    if (adts.containsKey(name.text) || Type.SCALAR_NAMES.contains(name.text)) {
      throw error(name, "duplicate type " + name.text);
    }
    AdtDef adt;
    switch (keyword.text) {
      case "struct":
        boolean braced = peek().is("{");
        ImmutableList<AdtDef.FieldDef> fields = parseVariantFields();
        if (!braced) {
          expect(";");
        }
        adt = AdtDef.struct(name.text, fields);
        break;
      case "union":
        if (!peek().is("{")) {
          throw error(peek(), "expected '{' after union name");
        }
        adt = AdtDef.union(name.text, parseVariantFields());
        break;
      default:
        expect("{");
        ImmutableList.Builder<AdtDef.VariantDef> variants = ImmutableList.builder();
        while (!accept("}")) {
          Token variant = expectIdent();
          variants.add(AdtDef.VariantDef.create(variant.text, parseVariantFields()));
          if (!accept(",")) {
            expect("}");
            break;
          }
        }
        adt = AdtDef.enumeration(name.text, variants.build());
        break;
    }
    adts.put(name.text, adt);
  }

  /** Parses {@code (T, U)}, {@code { a: T, b: U }} or nothing. */
  private ImmutableList<AdtDef.FieldDef> parseVariantFields() {
    ImmutableList.Builder<AdtDef.FieldDef> fields = ImmutableList.builder();
    if (accept("(")) {
      int i = 0;
      while (!accept(")")) {
        fields.add(AdtDef.FieldDef.create(String.valueOf(i++), parseType()));
        if (!accept(",")) {
          expect(")");
          break;
        }
      }
    } else if (accept("{")) {
      while (!accept("}")) {
        Token field = expectIdent();
        expect(":");
        fields.add(AdtDef.FieldDef.create(field.text, parseType()));
        if (!accept(",")) {
          expect("}");
          break;
        }
      }
    }
    return fields.build();
  }

  private Type parseType() {
    Token start = next();
    switch (start.text) {
      case "(":
        if (accept(")")) {
          return Type.unit();
        }
        List<Type> elements = new ArrayList<>();
        boolean sawComma = false;
        while (true) {
          elements.add(parseType());
          if (accept(",")) {
            sawComma = true;
            if (accept(")")) {
              break;
            }
          } else {
            expect(")");
            break;
          }
        }
        return sawComma ? Type.tuple(ImmutableList.copyOf(elements)) : elements.get(0);
      case "&":
        Mutability refMutability = accept("mut") ? Mutability.MUT : Mutability.NOT;
        return Type.ref(refMutability, parseType());
      case "*":
        Mutability ptrMutability;
        if (accept("mut")) {
          ptrMutability = Mutability.MUT;
        } else {
          expect("const");
          ptrMutability = Mutability.NOT;
        }
        return Type.rawPtr(ptrMutability, parseType());
      case "[":
        Type element = parseType();
        expect(";");
        long length = parseIndex(next());
        expect("]");
        return Type.array(element, length);
      default:
        if (start.type == TokenType.IDENT) {
          if (Type.SCALAR_NAMES.contains(start.text)) {
            return Type.scalar(start.text);
          }
          AdtDef adt = adts.get(start.text);
          if (adt != null) {
            return Type.adt(adt);
          }
          throw error(start, "unknown type " + start.text);
        }
        throw error(start, "expected a type but found " + start);
    }
  }

  // Functions.

  private Body parseFunction() {
    Token fn = expect("fn");
    Token name = expectIdent();
    expect("(");
    List<LocalDecl> params = new ArrayList<>();
    while (!accept(")")) {
      Mutability mutability = accept("mut") ? Mutability.MUT : Mutability.NOT;
      Token local = expectIdent();
      if (!local.text.equals("_" + (params.size() + 1))) {
        throw error(local, "expected parameter _" + (params.size() + 1));
      }
      expect(":");
      params.add(LocalDecl.create(mutability, parseType(), sourceInfo(local)));
      if (!accept(",")) {
        expect(")");
        break;
      }
    }
    Type returnType = accept("->") ? parseType() : Type.unit();
    expect("{");

    body = new Body(name.text, params.size(), ImmutableList.copyOf(adts.values()));
    body.pushLocal(LocalDecl.create(Mutability.MUT, returnType, sourceInfo(fn)));
    for (LocalDecl param : params) {
      body.pushLocal(param);
    }

    while (accept("let")) {
      Mutability mutability = accept("mut") ? Mutability.MUT : Mutability.NOT;
      Token local = expectIdent();
      if (!local.text.equals("_" + body.getLocalCount())) {
        throw error(local, "expected local _" + body.getLocalCount());
      }
      expect(":");
      body.pushLocal(LocalDecl.create(mutability, parseType(), sourceInfo(local)));
      expect(";");
    }

    while (peek().is("debug")) {
      Token debug = next();
      Token var = expectIdent();
      expect("=>");
      VarDebugInfoContents contents = parseDebugContents();
      expect(";");
      body.getVarDebugInfo().add(VarDebugInfo.create(var.text, sourceInfo(debug), contents));
    }

    while (!accept("}")) {
      parseBlock();
    }
    if (body.getBasicBlocks().isEmpty()) {
      throw error(name, "function " + name.text + " has no blocks");
    }
    Body result = body;
    body = null;
    return result;
  }

  private VarDebugInfoContents parseDebugContents() {
    if (accept("const")) {
      return VarDebugInfoContents.constant(parseConstant());
    }
    if (!compositeAhead()) {
      return VarDebugInfoContents.place(parsePlace());
    }
    Type type = parseType();
    expect("{");
    ImmutableList.Builder<VarDebugInfoFragment> fragments = ImmutableList.builder();
    while (!accept("}")) {
      Token start = peek();
      PlaceTy placeTy = PlaceTy.of(type);
      List<ProjectionElem> projection = new ArrayList<>();
      while (accept(".")) {
        Token number = next();
        ProjectionElem elem = fieldOf(placeTy, number);
        projection.add(elem);
        placeTy = placeTy.project(elem);
      }
      if (projection.isEmpty()) {
        throw error(start, "expected a field path but found " + start);
      }
      expect("=>");
      fragments.add(
          VarDebugInfoFragment.create(body.getInterner().intern(projection), parsePlace()));
      if (!accept(",")) {
        expect("}");
        break;
      }
    }
    return VarDebugInfoContents.composite(type, fragments.build());
  }

  /** Whether a '{' comes before the end of the current entry. */
  private boolean compositeAhead() {
    for (int i = index; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (token.is("{")) {
        return true;
      }
      if (token.is(";") || token.type == TokenType.EOF) {
        return false;
      }
    }
    return false;
  }

  private void parseBlock() {
    Token label = expectIdent();
    if (!label.text.equals("bb" + body.getBasicBlocks().size())) {
      throw error(label, "expected block bb" + body.getBasicBlocks().size());
    }
    expect(":");
    expect("{");
    List<Statement> statements = new ArrayList<>();
    Terminator terminator = null;
    while (terminator == null) {
      if (peek().is("}")) {
        throw error(peek(), "block " + label.text + " has no terminator");
      }
      terminator = parseStatementOrTerminator(statements);
    }
    expect("}");
    body.addBlock(new BasicBlockData(statements, terminator));
  }

  /** Parses one line of a block, returning the terminator if it was one. */
  private @Nullable Terminator parseStatementOrTerminator(List<Statement> statements) {
    Token start = peek();
    SourceInfo sourceInfo = sourceInfo(start);
    switch (start.text) {
      case "StorageLive":
      case "StorageDead":
        next();
        expect("(");
        Local local = parseLocal();
        expect(")");
        expect(";");
        statements.add(
            start.text.equals("StorageLive")
                ? Statement.storageLive(sourceInfo, local)
                : Statement.storageDead(sourceInfo, local));
        return null;
      case "Deinit":
        next();
        expect("(");
        Place deinit = parsePlace();
        expect(")");
        expect(";");
        statements.add(Statement.deinit(sourceInfo, deinit));
        return null;
      case "discriminant":
        next();
        expect("(");
        Place place = parsePlace();
        expect(")");
        expect("=");
        int variant = (int) parseIndex(next());
        expect(";");
        try {
          body.placeTy(place).getType().getAdtDef().getVariant(variant);
        } catch (IllegalArgumentException | IllegalStateException e) {
          throw error(start, e.getMessage());
        }
        statements.add(Statement.setDiscriminant(sourceInfo, place, variant));
        return null;
      case "nop":
        next();
        expect(";");
        statements.add(Statement.nop(sourceInfo));
        return null;
      case "goto":
        next();
        expect("->");
        int target = parseBlockRef();
        expect(";");
        return Terminator.gotoBlock(sourceInfo, target);
      case "return":
        next();
        expect(";");
        return Terminator.returnTerminator(sourceInfo);
      case "unreachable":
        next();
        expect(";");
        return Terminator.unreachable(sourceInfo);
      case "switchInt":
        return parseSwitchInt(sourceInfo);
      case "drop":
        next();
        expect("(");
        Place dropped = parsePlace();
        expect(")");
        expect("->");
        int dropTarget = parseBlockRef();
        expect(";");
        return Terminator.drop(sourceInfo, dropped, dropTarget);
      case "replace":
        next();
        expect("(");
        Place replaced = parsePlace();
        expect("<-");
        Operand value = parseOperand();
        expect(")");
        expect("->");
        int replaceTarget = parseBlockRef();
        expect(";");
        return Terminator.dropAndReplace(sourceInfo, replaced, value, replaceTarget);
      case "assert":
        next();
        expect("(");
        boolean expected = !accept("!");
        Operand cond = parseOperand();
        expect(")");
        expect("->");
        int assertTarget = parseBlockRef();
        expect(";");
        return Terminator.assertTerminator(sourceInfo, cond, expected, assertTarget);
      default:
        break;
    }
    Place destination = parsePlace();
    expect("=");
    if (isCallStart()) {
      return parseCall(sourceInfo, destination);
    }
    Rvalue rvalue = parseRvalue(body.placeTy(destination).getType());
    expect(";");
    statements.add(Statement.assign(sourceInfo, destination, rvalue));
    return null;
  }

  private Terminator parseSwitchInt(SourceInfo sourceInfo) {
    next();
    expect("(");
    Operand discr = parseOperand();
    expect(")");
    expect("->");
    expect("[");
    ImmutableList.Builder<Long> values = ImmutableList.builder();
    ImmutableList.Builder<Integer> targets = ImmutableList.builder();
    while (true) {
      if (accept("otherwise")) {
        expect(":");
        targets.add(parseBlockRef());
        expect("]");
        break;
      }
      boolean negative = accept("-");
      long value = parseIndex(next());
      values.add(negative ? -value : value);
      expect(":");
      targets.add(parseBlockRef());
      expect(",");
    }
    expect(";");
    return Terminator.switchInt(sourceInfo, discr, values.build(), targets.build());
  }

  private boolean isCallStart() {
    Token token = peek();
    if (token.type != TokenType.IDENT || !(peek(1).is("(") || peek(1).is("::"))) {
      return false;
    }
    switch (token.text) {
      case "copy":
      case "move":
      case "const":
      case "Len":
      case "discriminant":
        return false;
      default:
        return !adts.containsKey(token.text)
            && UnOp.fromMirName(token.text) == null
            && binOpOf(token.text) == null;
    }
  }

  private Terminator parseCall(SourceInfo sourceInfo, Place destination) {
    StringBuilder func = new StringBuilder(expectIdent().text);
    while (accept("::")) {
      func.append("::").append(expectIdent().text);
    }
    expect("(");
    ImmutableList<Operand> args = parseOperandList(")");
    Integer target = null;
    if (accept("->")) {
      target = parseBlockRef();
    }
    expect(";");
    return Terminator.call(sourceInfo, func.toString(), args, destination, target);
  }

  // Rvalues and operands.

  private Rvalue parseRvalue(Type destinationType) {
    Token start = peek();
    if (accept("&")) {
      if (accept("raw")) {
        Mutability mutability;
        if (accept("mut")) {
          mutability = Mutability.MUT;
        } else {
          expect("const");
          mutability = Mutability.NOT;
        }
        return Rvalue.addressOf(mutability, parsePlace());
      }
      Mutability mutability = accept("mut") ? Mutability.MUT : Mutability.NOT;
      return Rvalue.ref(mutability, parsePlace());
    }
    if (start.is("copy") || start.is("move") || start.is("const")) {
      Operand operand = parseOperand();
      if (accept("as")) {
        return Rvalue.cast(operand, parseType());
      }
      return Rvalue.use(operand);
    }
    if (accept("(")) {
      List<Operand> fields = new ArrayList<>();
      while (!accept(")")) {
        fields.add(parseOperand());
        if (!accept(",")) {
          expect(")");
          break;
        }
      }
      return Rvalue.tuple(ImmutableList.copyOf(fields));
    }
    if (accept("[")) {
      if (!destinationType.isArray()) {
        throw error(start, "array assigned to a place of type " + destinationType);
      }
      return Rvalue.array(destinationType.getElementType(), parseOperandList("]"));
    }
    if (start.type != TokenType.IDENT) {
      throw error(start, "expected an rvalue but found " + start);
    }
    if (adts.containsKey(start.text)) {
      return parseAdtAggregate();
    }
    next();
    if (start.is("Len") || start.is("discriminant")) {
      expect("(");
      Place place = parsePlace();
      expect(")");
      return start.is("Len") ? Rvalue.len(place) : Rvalue.discriminant(place);
    }
    UnOp unOp = UnOp.fromMirName(start.text);
    if (unOp != null) {
      expect("(");
      Operand operand = parseOperand();
      expect(")");
      return Rvalue.unaryOp(unOp, operand);
    }
    BinOp binOp = binOpOf(start.text);
    if (binOp != null) {
      expect("(");
      Operand lhs = parseOperand();
      expect(",");
      Operand rhs = parseOperand();
      expect(")");
      return start.text.startsWith("Checked")
          ? Rvalue.checkedBinaryOp(binOp, lhs, rhs)
          : Rvalue.binaryOp(binOp, lhs, rhs);
    }
    throw error(start, "unknown operation " + start.text);
  }

  private static @Nullable BinOp binOpOf(String name) {
    if (name.startsWith("Checked")) {
      return BinOp.fromMirName(name.substring("Checked".length()));
    }
    return BinOp.fromMirName(name);
  }

  private Rvalue parseAdtAggregate() {
    Token name = next();
    AdtDef adt = adts.get(name.text);
    Integer variantIndex = null;
    AdtDef.VariantDef variant;
    if (adt.isEnum()) {
      expect("::");
      Token variantName = expectIdent();
      variantIndex = adt.indexOfVariant(variantName.text);
      if (variantIndex < 0) {
        throw error(variantName, adt.getName() + " has no variant " + variantName.text);
      }
      variant = adt.getVariant(variantIndex);
    } else if (adt.isUnion()) {
      throw error(name, "cannot build a union value");
    } else {
      variant = adt.getNonEnumVariant();
    }
    ImmutableList<Operand> fields;
    if (accept("(")) {
      fields = parseOperandList(")");
    } else if (accept("{")) {
      Operand[] byIndex = new Operand[variant.getFields().size()];
      while (!accept("}")) {
        Token field = next();
        int fieldIndex = variant.indexOfField(field.text);
        if (fieldIndex < 0) {
          throw error(field, variant.getName() + " has no field " + field.text);
        }
        if (byIndex[fieldIndex] != null) {
          throw error(field, "field " + field.text + " given twice");
        }
        expect(":");
        byIndex[fieldIndex] = parseOperand();
        if (!accept(",")) {
          expect("}");
          break;
        }
      }
      for (int i = 0; i < byIndex.length; i++) {
        if (byIndex[i] == null) {
          throw error(name, "missing field " + variant.getField(i).getName());
        }
      }
      fields = ImmutableList.copyOf(byIndex);
    } else {
      fields = ImmutableList.of();
    }
    return Rvalue.adt(Type.adt(adt), variantIndex, fields);
  }

  /** Parses operands up to and including {@code close}. */
  private ImmutableList<Operand> parseOperandList(String close) {
    ImmutableList.Builder<Operand> operands = ImmutableList.builder();
    while (!accept(close)) {
      operands.add(parseOperand());
      if (!accept(",")) {
        expect(close);
        break;
      }
    }
    return operands.build();
  }

  private Operand parseOperand() {
    Token start = next();
    switch (start.text) {
      case "copy":
        return Operand.copy(parsePlace());
      case "move":
        return Operand.move(parsePlace());
      case "const":
        return Operand.constant(parseConstant());
      default:
        throw error(start, "expected an operand but found " + start);
    }
  }

  private Constant parseConstant() {
    Token start = peek();
    String literal;
    Type type = null;
    if (accept("(")) {
      expect(")");
      literal = "()";
      type = Type.unit();
    } else if (start.is("true") || start.is("false")) {
      literal = next().text;
      type = Type.scalar("bool");
    } else {
      boolean negative = accept("-");
      Token token = next();
      if (token.type == TokenType.NUMBER) {
        String text = token.text;
        if (!text.contains("_") && peek().is(".") && peek(1).type == TokenType.NUMBER) {
          next();
          text = text + "." + next().text;
        }
        literal = negative ? "-" + text : text;
        int suffix = text.indexOf('_');
        if (suffix >= 0 && Type.SCALAR_NAMES.contains(text.substring(suffix + 1))) {
          type = Type.scalar(text.substring(suffix + 1));
        }
      } else if (token.type == TokenType.IDENT && !negative) {
        literal = token.text;
      } else {
        throw error(token, "expected a constant but found " + token);
      }
    }
    if (accept(":")) {
      type = parseType();
    }
    if (type == null) {
      throw error(start, "constant " + literal + " needs a type");
    }
    return Constant.create(literal, type);
  }

  // Places.

  private Place parsePlace() {
    List<ProjectionElem> projection = new ArrayList<>();
    Local local = parsePlaceInto(projection);
    return body.makePlace(local, projection);
  }

  private Local parsePlaceInto(List<ProjectionElem> projection) {
    Local local;
    Token start = peek();
    if (accept("(")) {
      if (accept("*")) {
        local = parsePlaceInto(projection);
        expect(")");
        PlaceTy pointer = placeTy(start, local, projection);
        if (!pointer.getType().isRef() && !pointer.getType().isRawPtr()) {
          throw error(start, "cannot dereference a value of type " + pointer.getType());
        }
        projection.add(ProjectionElem.deref());
      } else {
        local = parsePlaceInto(projection);
        expect("as");
        Token variant = expectIdent();
        expect(")");
        PlaceTy placeTy = placeTy(start, local, projection);
        if (!placeTy.getType().isEnum()) {
          throw error(start, "cannot downcast a value of type " + placeTy.getType());
        }
        int variantIndex = placeTy.getType().getAdtDef().indexOfVariant(variant.text);
        if (variantIndex < 0) {
          throw error(variant, placeTy.getType() + " has no variant " + variant.text);
        }
        projection.add(ProjectionElem.downcast(variantIndex, variant.text));
      }
    } else {
      local = parseLocal();
    }
    while (true) {
      if (peek().is(".") && peek(1).type == TokenType.NUMBER) {
        next();
        Token number = next();
        projection.add(fieldOf(placeTy(number, local, projection), number));
      } else if (accept("[")) {
        if (peek().type == TokenType.IDENT) {
          projection.add(ProjectionElem.index(parseLocal()));
        } else {
          boolean fromEnd = accept("-");
          Token offset = next();
          expect("of");
          Token minLength = next();
          try {
            projection.add(
                ProjectionElem.constantIndex(
                    (int) parseIndex(offset), (int) parseIndex(minLength), fromEnd));
          } catch (IllegalArgumentException e) {
            throw error(offset, e.getMessage());
          }
        }
        expect("]");
      } else {
        return local;
      }
    }
  }

  private PlaceTy placeTy(Token at, Local local, List<ProjectionElem> projection) {
    try {
      return body.placeTy(PlaceRef.of(local, ImmutableList.copyOf(projection)));
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw error(at, e.getMessage());
    }
  }

  private ProjectionElem fieldOf(PlaceTy base, Token number) {
    int fieldIndex = (int) parseIndex(number);
    try {
      return ProjectionElem.field(
          fieldIndex, base.getType().getFieldType(base.getVariantIndex(), fieldIndex));
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw error(number, e.getMessage());
    }
  }

  private Local parseLocal() {
    Token token = next();
    if (token.type != TokenType.IDENT || !LOCAL_NAME.matcher(token.text).matches()) {
      throw error(token, "expected a local but found " + token);
    }
    int localIndex = Integer.parseInt(token.text.substring(1));
    if (localIndex >= body.getLocalCount()) {
      throw error(token, "undeclared local " + token.text);
    }
    return Local.of(localIndex);
  }

  private int parseBlockRef() {
    Token token = next();
    if (token.type != TokenType.IDENT || !BLOCK_NAME.matcher(token.text).matches()) {
      throw error(token, "expected a block but found " + token);
    }
    return Integer.parseInt(token.text.substring(2));
  }

  private long parseIndex(Token token) {
    if (token.type != TokenType.NUMBER || token.text.contains("_")) {
      throw error(token, "expected a number but found " + token);
    }
    try {
      return Long.parseLong(token.text);
    } catch (NumberFormatException e) {
      throw error(token, "number out of range: " + token.text);
    }
  }

  // Tokens.

  private Token peek() {
    return tokens.get(index);
  }

  private Token peek(int ahead) {
    return tokens.get(Math.min(index + ahead, tokens.size() - 1));
  }

  private Token next() {
    Token token = tokens.get(index);
    if (token.type != TokenType.EOF) {
      index++;
    }
    return token;
  }

  private boolean accept(String text) {
    if (peek().is(text)) {
      index++;
      return true;
    }
    return false;
  }

  private Token expect(String text) {
    Token token = peek();
    if (!token.is(text)) {
      throw error(token, "expected '" + text + "' but found " + token);
    }
    index++;
    return token;
  }

  private Token expectIdent() {
    Token token = next();
    if (token.type != TokenType.IDENT) {
      throw error(token, "expected a name but found " + token);
    }
    return token;
  }

  private static SourceInfo sourceInfo(Token token) {
    return SourceInfo.at(token.line, token.column);
  }

  private MirSyntaxException error(Token token, String message) {
    return new MirSyntaxException(message, sourceName, token.line, token.column);
  }
}

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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MirParserTest {

  private static final String EVERYTHING =
      """
      struct Pair { a: i32, b: bool }
      struct Wrap(u8, (i32, i32));
      struct Unit;
      union Bits { i: i32, u: u32 }
      enum Opt { None, Some(i32), Named { x: i64 } }

      fn everything(_1: &mut Pair, mut _2: [i32; 4], _3: usize) -> i32 {
          let mut _4: Pair;
          let _5: Wrap;
          let mut _6: Opt;
          let _7: *const Pair;
          let mut _8: (i32, bool);
          let _9: ();
          let _10: f64;
          let mut _11: Bits;
          let _12: Unit;
          let _13: &i32;
          debug p => _1;
          debug first => (*_1).0;
          debug c => const 5_i32;
          debug w => Wrap { .1.0 => _8.0, .0 => _4.0 };
          debug nothing => Unit { };

          bb0: {
              StorageLive(_4);
              _4 = Pair { a: const -1_i32, b: const true };
              _5 = Wrap(const 7_u8, const PAIR: (i32, i32));
              _6 = Opt::Named { x: const 3_i64 };
              _6 = Opt::None;
              discriminant(_6) = 1;
              _7 = &raw const _4;
              _13 = &(*_1).0;
              _8 = CheckedAdd(copy _4.0, copy (*_1).0);
              _0 = Neg(copy _8.0);
              _2 = [copy _0, copy _0, const 0_i32, move _2[_3]];
              _10 = const 1.5_f64;
              _9 = const ();
              _0 = copy _2[-1 of 4] as i32;
              _3 = Len(_2);
              _0 = copy (_6 as Some).0;
              _12 = Unit;
              _11.1 = const 2_u32;
              Deinit(_8);
              nop;
              StorageDead(_4);
              switchInt(copy _3) -> [0: bb1, 1: bb2, otherwise: bb3];
          }

          bb1: {
              _0 = helper::compute(copy _0, move _4) -> bb2;
          }

          bb2: {
              assert(!copy _8.1) -> bb3;
          }

          bb3: {
              drop(_4) -> bb4;
          }

          bb4: {
              replace(_4 <- move _4) -> bb5;
          }

          bb5: {
              _9 = abort();
          }

          bb6: {
              return;
          }

          bb7: {
              unreachable;
          }
      }
      """;

  @Test
  public void testPrintParsesBack() {
    Body body = parse(EVERYTHING);

    assertThat(MirPrinter.print(body)).isEqualTo(EVERYTHING);
  }

  @Test
  public void testSignature() {
    Body body = parse(EVERYTHING);

    assertThat(body.getName()).isEqualTo("everything");
    assertThat(body.getArgCount()).isEqualTo(3);
    assertThat(body.getLocalCount()).isEqualTo(14);
    assertThat(body.getLocalDecl(Local.RETURN_PLACE).getMutability()).isEqualTo(Mutability.MUT);
    assertThat(body.getLocalDecl(Local.of(1)).getMutability()).isEqualTo(Mutability.NOT);
    assertThat(body.getLocalDecl(Local.of(2)).getMutability()).isEqualTo(Mutability.MUT);
    assertThat(body.isArgument(Local.of(3))).isTrue();
    assertThat(body.isArgument(Local.of(4))).isFalse();
    assertThat(body.getBasicBlocks()).hasSize(8);
    assertThat(body.getVarDebugInfo()).hasSize(5);
  }

  @Test
  public void testTypedProjections() {
    Body body = parse(EVERYTHING);
    Statement borrow = body.getBlock(0).getStatements().get(7);

    Place borrowed = borrow.getRvalue().getPlace();
    assertThat(borrowed.getLocal()).isEqualTo(Local.of(1));
    assertThat(borrowed.isIndirect()).isTrue();
    assertThat(borrowed.getProjection().get(1).getFieldType()).isEqualTo(Type.scalar("i32"));

    Statement read = body.getBlock(0).getStatements().get(15);
    PlaceTy readTy = body.placeTy(read.getRvalue().getOperand().getPlace());
    assertThat(readTy.getType()).isEqualTo(Type.scalar("i32"));
  }

  @Test
  public void testSourceInfo() {
    Body body = parse("fn f() {\n    bb0: {\n        nop;\n        return;\n    }\n}\n");

    Statement nop = body.getBlock(0).getStatements().get(0);
    assertThat(nop.getSourceInfo().lineno()).isEqualTo(3);
    assertThat(nop.getSourceInfo().charno()).isEqualTo(9);
  }

  @Test
  public void testSeveralFunctionsShareTypes() {
    ImmutableList<Body> bodies =
        MirParser.parse(
            "testcode",
            """
            struct S { a: i32 }

            fn f(_1: S) {
                bb0: {
                    return;
                }
            }

            fn g() -> S {
                bb0: {
                    _0 = S { a: const 1_i32 };
                    return;
                }
            }
            """);

    assertThat(bodies).hasSize(2);
    assertThat(bodies.get(0).getAdtDefs()).isEqualTo(bodies.get(1).getAdtDefs());
    assertThat(bodies.get(1).getLocalDecl(Local.RETURN_PLACE).getType().getAdtDef())
        .isSameInstanceAs(bodies.get(0).getAdtDefs().get(0));
  }

  @Test
  public void testCommentsIgnored() {
    Body body =
        parse(
            """
            // leading comment
            fn f() -> i32 {
                bb0: {
                    _0 = const 1_i32; // trailing comment
                    return;
                }
            }
            """);

    assertThat(body.getBlock(0).getStatements()).hasSize(1);
  }

  @Test
  public void testUndeclaredLocal() {
    assertError(
        "fn f() {\n    bb0: {\n        _0 = copy _3;\n        return;\n    }\n}\n",
        "undeclared local _3",
        3,
        19);
  }

  @Test
  public void testLocalsOutOfOrder() {
    assertError("fn f() {\n    let _2: i32;\n}\n", "expected local _1", 2, 9);
  }

  @Test
  public void testUnknownType() {
    assertError("fn f() {\n    let _1: Foo;\n}\n", "unknown type Foo", 2, 13);
  }

  @Test
  public void testFieldOutOfRange() {
    MirSyntaxException e =
        assertThrows(
            MirSyntaxException.class,
            () -> parse("fn f(_1: (i32, i32)) -> i32 {\n    bb0: {\n        _0 = copy _1.2;\n"));
    assertThat(e.lineNumber()).isEqualTo(3);
    assertThat(e.details()).contains("out of range");
  }

  @Test
  public void testDerefOfNonPointer() {
    assertError(
        "fn f(_1: i32) -> i32 {\n    bb0: {\n        _0 = copy (*_1);\n",
        "cannot dereference a value of type i32",
        3,
        19);
  }

  @Test
  public void testUnionValueRejected() {
    MirSyntaxException e =
        assertThrows(
            MirSyntaxException.class,
            () ->
                parse(
                    """
                    union U { a: i32 }

                    fn f() -> U {
                        bb0: {
                            _0 = U { a: const 1_i32 };
                            return;
                        }
                    }
                    """));
    assertThat(e.details()).isEqualTo("cannot build a union value");
  }

  @Test
  public void testMissingTerminator() {
    MirSyntaxException e =
        assertThrows(
            MirSyntaxException.class,
            () -> parse("fn f() {\n    bb0: {\n        nop;\n    }\n}\n"));
    assertThat(e.details()).isEqualTo("block bb0 has no terminator");
  }

  @Test
  public void testBlocksOutOfOrder() {
    MirSyntaxException e =
        assertThrows(
            MirSyntaxException.class,
            () -> parse("fn f() {\n    bb1: {\n        return;\n    }\n}\n"));
    assertThat(e.details()).isEqualTo("expected block bb0");
  }

  @Test
  public void testUntypedConstant() {
    MirSyntaxException e =
        assertThrows(
            MirSyntaxException.class,
            () -> parse("fn f() -> i32 {\n    bb0: {\n        _0 = const 1;\n"));
    assertThat(e.details()).isEqualTo("constant 1 needs a type");
  }

  @Test
  public void testParseBodyNeedsOneFunction() {
    MirSyntaxException e =
        assertThrows(
            MirSyntaxException.class,
            () -> parse("struct S;\n"));
    assertThat(e.details()).isEqualTo("expected exactly one function but found 0");
  }

  @Test
  public void testMessageHasPosition() {
    MirSyntaxException e =
        assertThrows(
            MirSyntaxException.class,
            () -> MirParser.parse("input.mir", "fn f() {\n    let _1: Foo;\n}\n"));
    assertThat(e.sourceName()).isEqualTo("input.mir");
    assertThat(e).hasMessageThat().isEqualTo("unknown type Foo (input.mir#2:13)");
  }

  private static Body parse(String source) {
    return MirParser.parseBody("testcode", source);
  }

  private static void assertError(String source, String details, int line, int column) {
    MirSyntaxException e = assertThrows(MirSyntaxException.class, () -> parse(source));
    assertThat(e.details()).isEqualTo(details);
    assertThat(e.lineNumber()).isEqualTo(line);
    assertThat(e.columnNumber()).isEqualTo(column);
  }
}

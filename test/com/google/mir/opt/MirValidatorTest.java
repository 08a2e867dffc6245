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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.mir.ir.BasicBlockData;
import com.google.mir.ir.Body;
import com.google.mir.ir.Local;
import com.google.mir.ir.LocalDecl;
import com.google.mir.ir.Location;
import com.google.mir.ir.MirParser;
import com.google.mir.ir.Mutability;
import com.google.mir.ir.Operand;
import com.google.mir.ir.Place;
import com.google.mir.ir.Rvalue;
import com.google.mir.ir.SourceInfo;
import com.google.mir.ir.Statement;
import com.google.mir.ir.Terminator;
import com.google.mir.ir.Type;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MirValidatorTest {
  private List<String> violations;

  @Before
  public void setUp() {
    violations = new ArrayList<>();
  }

  @Test
  public void testValidBody() {
    validate(
        """
        struct Pair { a: i32, b: bool }
        enum Opt { None, Some(i32) }

        fn f(_1: i32) -> i32 {
            let mut _2: Pair;
            let mut _3: Opt;
            let mut _4: [i32; 2];
            debug p => Pair { .0 => _1 };

            bb0: {
                StorageLive(_2);
                _2 = Pair { a: copy _1, b: const true };
                _3 = Opt::Some(copy _2.0);
                discriminant(_3) = 0;
                _4 = [copy _1, const 2_i32];
                switchInt(copy _1) -> [0: bb1, otherwise: bb2];
            }

            bb1: {
                StorageDead(_2);
                _0 = copy _4[-1 of 2];
                return;
            }

            bb2: {
                unreachable;
            }
        }
        """);

    assertThat(violations).isEmpty();
  }

  @Test
  public void testJumpToMissingBlock() {
    validate(
        """
        fn f() {
            bb0: {
                goto -> bb3;
            }
        }
        """);

    assertThat(violations).containsExactly("jump to missing block bb3 at bb0[0]");
  }

  @Test
  public void testStorageMarkerOnArgument() {
    validate(
        """
        fn f(_1: i32) {
            bb0: {
                StorageLive(_1);
                StorageDead(_0);
                return;
            }
        }
        """);

    assertThat(violations)
        .containsExactly(
            "storage marker on _1, whose storage is never scoped at bb0[0]",
            "storage marker on _0, whose storage is never scoped at bb0[1]")
        .inOrder();
  }

  @Test
  public void testAssignmentTypeMismatch() {
    validate(
        """
        fn f() -> i32 {
            bb0: {
                _0 = const 1_i64;
                return;
            }
        }
        """);

    assertThat(violations).containsExactly("assignment of i64 to _0 of type i32 at bb0[0]");
  }

  @Test
  public void testAggregateArityMismatch() {
    validate(
        """
        fn f() {
            let mut _1: (i32, i32);

            bb0: {
                _1 = (const 1_i32,);
                return;
            }
        }
        """);

    assertThat(violations).hasSize(1);
    assertThat(violations.get(0)).contains("has 1 operands but _1 of type (i32, i32) needs 2");
  }

  @Test
  public void testAggregateFieldTypeMismatch() {
    validate(
        """
        struct Pair { a: i32, b: bool }

        fn f() {
            let mut _1: Pair;

            bb0: {
                _1 = Pair { a: const 1_i32, b: const 2_i32 };
                return;
            }
        }
        """);

    assertThat(violations).containsExactly("field 1 of Pair is bool but got i32 at bb0[0]");
  }

  @Test
  public void testAdtAggregateOfWrongType() {
    validate(
        """
        struct A { x: i32 }
        struct B { x: i32 }

        fn f() {
            let mut _1: B;

            bb0: {
                _1 = A { x: const 1_i32 };
                return;
            }
        }
        """);

    assertThat(violations).containsExactly("aggregate of type A assigned to B at bb0[0]");
  }

  @Test
  public void testDebugFragmentTypeMismatch() {
    validate(
        """
        fn f() {
            let _1: bool;
            debug p => (i32, i32) { .1 => _1 };

            bb0: {
                return;
            }
        }
        """);

    assertThat(violations)
        .containsExactly("debug fragment of p has type bool but describes i32 in debug info");
  }

  @Test
  public void testSetDiscriminantOnStruct() {
    Body body =
        MirParser.parseBody(
            "testcode",
            """
            fn f() {
                let mut _1: (i32,);

                bb0: {
                    return;
                }
            }
            """);
    body.getBlock(0)
        .getStatements()
        .add(Statement.setDiscriminant(SourceInfo.unknown(), Place.of(Local.of(1)), 0));

    newValidator().validateBody(body);

    assertThat(violations).containsExactly("discriminant set on non-enum (i32,) at bb0[0]");
  }

  @Test
  public void testUndeclaredLocal() {
    Body body = new Body("f", 0, ImmutableList.of());
    body.pushLocal(LocalDecl.create(Mutability.MUT, Type.scalar("i32")));
    List<Statement> statements = new ArrayList<>();
    statements.add(
        Statement.assign(
            Place.of(Local.RETURN_PLACE), Rvalue.use(Operand.copy(Place.of(Local.of(4))))));
    body.addBlock(new BasicBlockData(statements, Terminator.returnTerminator()));

    newValidator().validateBody(body);

    assertThat(violations).containsExactly("undeclared local _4 at bb0[0]");
  }

  @Test
  public void testBodyWithoutBlocks() {
    Body body = new Body("empty", 0, ImmutableList.of());
    body.pushLocal(LocalDecl.create(Mutability.MUT, Type.unit()));

    newValidator().validateBody(body);

    assertThat(violations).containsExactly("body empty has no blocks in debug info");
  }

  @Test
  public void testDefaultHandlerThrows() {
    Body body =
        MirParser.parseBody(
            "testcode",
            """
            fn f() {
                bb0: {
                    goto -> bb1;
                }
            }
            """);

    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> new MirValidator().validateBody(body));
    assertThat(e).hasMessageThat().isEqualTo("jump to missing block bb1 at bb0[0]");
  }

  private void validate(String source) {
    newValidator().validateBody(MirParser.parseBody("testcode", source));
  }

  private MirValidator newValidator() {
    return new MirValidator(
        (String message, @Nullable Location location) ->
            violations.add(message + (location == null ? " in debug info" : " at " + location)));
  }
}

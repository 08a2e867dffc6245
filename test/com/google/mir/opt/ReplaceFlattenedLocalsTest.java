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

import com.google.mir.ir.Body;
import com.google.mir.ir.VarDebugInfo;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for how {@link ReplaceFlattenedLocals} keeps debug info pointing at the new locals. The
 * statement rewrites are covered by {@link ScalarReplacementOfAggregatesTest}.
 */
@RunWith(JUnit4.class)
public final class ReplaceFlattenedLocalsTest extends MirPassTestCase {

  @Override
  protected MirPass getProcessor() {
    return new ScalarReplacementOfAggregates();
  }

  @Test
  public void testFieldEntryRebased() {
    test(
        """
        fn f(_1: i32) -> i32 {
            let mut _2: (i32, i32);
            debug first => _2.0;
            debug second => _2.1;

            bb0: {
                _2 = (copy _1, const 2_i32);
                _0 = Add(copy _2.0, copy _2.1);
                return;
            }
        }
        """,
        """
        fn f(_1: i32) -> i32 {
            let mut _2: (i32, i32);
            let mut _3: i32;
            let mut _4: i32;
            debug first => _3;
            debug second => _4;

            bb0: {
                _3 = copy _1;
                _4 = const 2_i32;
                _0 = Add(copy _3, copy _4);
                return;
            }
        }
        """);
  }

  @Test
  public void testNestedEntries() {
    disableFixedPointCheck();
    test(
        """
        fn f(_1: (i32, i32)) -> i32 {
            let mut _2: ((i32, i32), i32);
            debug whole => _2;
            debug inner => _2.0.1;

            bb0: {
                _2 = (copy _1, const 3_i32);
                _0 = Add(copy _2.0.1, copy _2.1);
                return;
            }
        }
        """,
        """
        fn f(_1: (i32, i32)) -> i32 {
            let mut _2: ((i32, i32), i32);
            let mut _3: (i32, i32);
            let mut _4: i32;
            debug whole => ((i32, i32), i32) { .0 => _3, .1 => _4 };
            debug inner => _3.1;

            bb0: {
                _3 = copy _1;
                _4 = const 3_i32;
                _0 = Add(copy _3.1, copy _4);
                return;
            }
        }
        """);
  }

  @Test
  public void testUnplannedFieldBecomesEmptyComposite() {
    test(
        """
        fn f() -> i32 {
            let mut _1: (i32, i32, i32);
            debug middle => _1.1;

            bb0: {
                _1 = (const 1_i32, const 2_i32, const 3_i32);
                _0 = Add(copy _1.0, copy _1.2);
                return;
            }
        }
        """,
        """
        fn f() -> i32 {
            let mut _1: (i32, i32, i32);
            let mut _2: i32;
            let mut _3: i32;
            debug middle => i32 { };

            bb0: {
                _2 = const 1_i32;
                _3 = const 3_i32;
                _0 = Add(copy _2, copy _3);
                return;
            }
        }
        """);
  }

  @Test
  public void testCompositeFragmentsReexpanded() {
    test(
        """
        fn f(_1: i32) -> i32 {
            let mut _2: (i32, i32);
            let mut _3: (i32, i32);
            debug p => ((i32, i32), i32, i32) { .0 => _2, .1 => _3.1, .2 => _1 };

            bb0: {
                _2 = (copy _1, const 1_i32);
                _3 = (const 2_i32, copy _1);
                _0 = Add(copy _2.0, copy _3.1);
                _0 = Add(copy _0, copy _2.1);
                return;
            }
        }
        """,
        """
        fn f(_1: i32) -> i32 {
            let mut _2: (i32, i32);
            let mut _3: (i32, i32);
            let mut _4: i32;
            let mut _5: i32;
            let mut _6: i32;
            debug p => ((i32, i32), i32, i32) { .1 => _5, .0.0 => _4, .0.1 => _6 };

            bb0: {
                _4 = copy _1;
                _6 = const 1_i32;
                _5 = copy _1;
                _0 = Add(copy _4, copy _5);
                _0 = Add(copy _0, copy _6);
                return;
            }
        }
        """);
  }

  @Test
  public void testCompositeLosesFragmentsOfUnsplitLocals() {
    test(
        """
        fn f(_1: i32) -> i32 {
            let mut _2: (i32, i32);
            debug z => (i32, i32) { .0 => _1, .1 => _2.1 };

            bb0: {
                _2 = (copy _1, const 2_i32);
                _0 = copy _2.1;
                return;
            }
        }
        """,
        """
        fn f(_1: i32) -> i32 {
            let mut _2: (i32, i32);
            let mut _3: i32;
            debug z => (i32, i32) { .1 => _3 };

            bb0: {
                _3 = const 2_i32;
                _0 = copy _3;
                return;
            }
        }
        """);
  }

  @Test
  public void testEntriesOfUnsplitLocalsKept() {
    Body body =
        process(
            """
            fn f(_1: (i32, i32)) -> i32 {
                let mut _2: (i32, i32);
                debug arg => _1;
                debug arg_field => _1.0;
                debug c => const 5_i32;

                bb0: {
                    _2 = copy _1;
                    _0 = copy _2.1;
                    return;
                }
            }
            """);

    assertThat(body.getVarDebugInfo()).hasSize(3);
    VarDebugInfo arg = body.getVarDebugInfo().get(0);
    assertThat(arg.getName()).isEqualTo("arg");
    assertThat(arg.getContents().toString()).isEqualTo("_1");
    assertThat(body.getVarDebugInfo().get(1).getContents().toString()).isEqualTo("_1.0");
    assertThat(body.getVarDebugInfo().get(2).getContents().toString()).isEqualTo("const 5_i32");
  }

  @Test
  public void testSourceInfoOfEntriesKept() {
    Body original =
        parse(
            """
            fn f() -> i32 {
                let mut _1: (i32, i32);
                debug x => _1;

                bb0: {
                    _1 = (const 1_i32, const 2_i32);
                    _0 = copy _1.0;
                    return;
                }
            }
            """);
    VarDebugInfo before = original.getVarDebugInfo().get(0);

    new ScalarReplacementOfAggregates().process(original);

    VarDebugInfo after = original.getVarDebugInfo().get(0);
    assertThat(after.getSourceInfo()).isEqualTo(before.getSourceInfo());
    assertThat(after.getContents().toString()).isEqualTo("(i32, i32) { .0 => _2 }");
  }
}

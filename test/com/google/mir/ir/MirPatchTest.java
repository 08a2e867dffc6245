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

import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MirPatchTest {
  private Body body;

  @Before
  public void setUp() {
    body =
        MirParser.parseBody(
            "testcode",
            """
            fn f() {
                let mut _1: i32;
                let mut _2: i32;
                let mut _3: i32;

                bb0: {
                    _1 = const 1_i32;
                    _2 = const 2_i32;
                    goto -> bb1;
                }

                bb1: {
                    return;
                }
            }
            """);
  }

  @Test
  public void testInsertionsKeepStagingOrder() {
    MirPatch patch = new MirPatch();
    patch.addStatement(Location.create(0, 1), storageLive(3));
    patch.addStatement(Location.create(0, 0), storageLive(1));
    patch.addStatement(Location.create(0, 1), storageDead(3));
    patch.addStatement(Location.create(0, 0), storageLive(2));

    patch.apply(body);

    assertThat(statements(0))
        .containsExactly(
            "StorageLive(_1)",
            "StorageLive(_2)",
            "_1 = const 1_i32",
            "StorageLive(_3)",
            "StorageDead(_3)",
            "_2 = const 2_i32")
        .inOrder();
  }

  @Test
  public void testInsertBeforeTerminator() {
    MirPatch patch = new MirPatch();
    patch.addStatement(body.getBlock(0).terminatorLocation(0), storageDead(1));
    patch.addStatement(body.getBlock(1).terminatorLocation(1), storageDead(2));

    patch.apply(body);

    assertThat(statements(0))
        .containsExactly("_1 = const 1_i32", "_2 = const 2_i32", "StorageDead(_1)")
        .inOrder();
    assertThat(statements(1)).containsExactly("StorageDead(_2)");
  }

  @Test
  public void testLocationsReferToOriginalBody() {
    MirPatch patch = new MirPatch();
    patch.deleteStatement(Location.create(0, 0));
    patch.addStatement(Location.create(0, 0), storageLive(3));
    patch.addStatement(Location.create(0, 1), storageDead(3));
    patch.deleteStatement(Location.create(0, 1));

    patch.apply(body);

    assertThat(statements(0)).containsExactly("StorageLive(_3)", "StorageDead(_3)").inOrder();
  }

  @Test
  public void testEmptyPatch() {
    MirPatch patch = new MirPatch();
    assertThat(patch.isEmpty()).isTrue();
    patch.deleteStatement(Location.create(0, 1));
    assertThat(patch.isEmpty()).isFalse();
  }

  @Test
  public void testApplyOnlyOnce() {
    MirPatch patch = new MirPatch();
    patch.apply(body);

    assertThrows(IllegalStateException.class, () -> patch.apply(body));
    assertThrows(
        IllegalStateException.class,
        () -> patch.addStatement(Location.create(0, 0), storageLive(1)));
    assertThrows(IllegalStateException.class, () -> patch.deleteStatement(Location.create(0, 0)));
  }

  @Test
  public void testCannotDeleteTerminator() {
    MirPatch patch = new MirPatch();
    patch.deleteStatement(Location.create(0, 2));

    assertThrows(IllegalArgumentException.class, () -> patch.apply(body));
  }

  @Test
  public void testInsertPastTerminatorRejected() {
    MirPatch patch = new MirPatch();
    patch.addStatement(Location.create(1, 1), storageLive(1));

    assertThrows(IllegalArgumentException.class, () -> patch.apply(body));
  }

  @Test
  public void testInsertIntoMissingBlockRejected() {
    MirPatch patch = new MirPatch();
    patch.addStatement(Location.create(2, 0), storageLive(1));

    assertThrows(IllegalArgumentException.class, () -> patch.apply(body));
  }

  private static Statement storageLive(int local) {
    return Statement.storageLive(Local.of(local));
  }

  private static Statement storageDead(int local) {
    return Statement.storageDead(Local.of(local));
  }

  private List<String> statements(int block) {
    List<String> result = new ArrayList<>();
    for (Statement statement : body.getBlock(block).getStatements()) {
      result.add(statement.toString());
    }
    return result;
  }
}

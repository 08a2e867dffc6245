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
import com.google.mir.ir.Body;
import com.google.mir.ir.MirParser;
import com.google.mir.ir.MirPrinter;
import com.google.mir.ir.Terminator;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MirOptimizerTest {
  private static final String PAIR =
      """
      fn pair() -> i32 {
          let mut _1: (i32, i32);

          bb0: {
              _1 = (const 1_i32, const 2_i32);
              _0 = Add(copy _1.0, copy _1.1);
              return;
          }
      }
      """;

  private List<String> passesRun;
  private MirOptions options;

  @Before
  public void setUp() {
    passesRun = new ArrayList<>();
    options = new MirOptions();
  }

  @Test
  public void testPassesRunInOrder() {
    MirOptimizer optimizer =
        new MirOptimizer(options, ImmutableList.of(recording("first"), recording("second")));

    optimizer.process(ImmutableList.of(parse(PAIR), parse(PAIR)));

    assertThat(passesRun)
        .containsExactly("first:pair", "second:pair", "first:pair", "second:pair")
        .inOrder();
  }

  @Test
  public void testDisabledPassSkipped() {
    PassFactory highLevelOnly =
        PassFactory.builder()
            .setName("highLevelOnly")
            .setInternalFactory(
                () ->
                    new MirPass() {
                      @Override
                      public boolean isEnabled(MirOptions passOptions) {
                        return passOptions.getMirOptLevel() > 1;
                      }

                      @Override
                      public void process(Body body) {
                        passesRun.add("highLevelOnly:" + body.getName());
                      }
                    })
            .build();
    MirOptimizer optimizer =
        new MirOptimizer(options, ImmutableList.of(highLevelOnly, recording("kept")));

    optimizer.process(parse(PAIR));
    assertThat(passesRun).containsExactly("kept:pair");

    options.setMirOptLevel(2);
    passesRun.clear();
    optimizer.process(parse(PAIR));
    assertThat(passesRun).containsExactly("highLevelOnly:pair", "kept:pair").inOrder();
  }

  @Test
  public void testDefaultPassesDisabledAtDefaultLevel() {
    Body body = parse(PAIR);
    String before = MirPrinter.print(body);

    MirOptimizer.createDefault(options).process(body);

    assertThat(MirPrinter.print(body)).isEqualTo(before);
  }

  @Test
  public void testDefaultPassesSplitAtLevelThree() {
    options.setMirOptLevel(3);
    options.setValidateAfterEachPass(true);
    Body body = parse(PAIR);

    MirOptimizer.createDefault(options).process(body);

    assertThat(MirPrinter.print(body))
        .isEqualTo(
            MirPrinter.print(
                parse(
                    """
                    fn pair() -> i32 {
                        let mut _1: (i32, i32);
                        let mut _2: i32;
                        let mut _3: i32;

                        bb0: {
                            _2 = const 1_i32;
                            _3 = const 2_i32;
                            _0 = Add(copy _2, copy _3);
                            return;
                        }
                    }
                    """)));
  }

  @Test
  public void testValidationAfterEachPass() {
    PassFactory broken =
        PassFactory.builder()
            .setName("broken")
            .setInternalFactory(
                () -> (Body b) -> b.getBlock(0).setTerminator(Terminator.gotoBlock(7)))
            .build();
    options.setValidateAfterEachPass(true);
    MirOptimizer optimizer = new MirOptimizer(options, ImmutableList.of(broken));

    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> optimizer.process(parse(PAIR)));
    assertThat(e).hasMessageThat().contains("jump to missing block bb7");
  }

  @Test
  public void testNoValidationByDefault() {
    PassFactory broken =
        PassFactory.builder()
            .setName("broken")
            .setInternalFactory(
                () -> (Body b) -> b.getBlock(0).setTerminator(Terminator.gotoBlock(7)))
            .build();
    Body body = parse(PAIR);

    new MirOptimizer(options, ImmutableList.of(broken)).process(body);

    assertThat(body.getBlock(0).getTerminator().getTargets()).containsExactly(7);
  }

  @Test
  public void testEmptyNameRejected() {
    assertThrows(
        IllegalStateException.class,
        () -> PassFactory.builder().setName("").setInternalFactory(() -> (Body b) -> {}).build());
  }

  private PassFactory recording(String name) {
    return PassFactory.builder()
        .setName(name)
        .setInternalFactory(() -> (Body body) -> passesRun.add(name + ":" + body.getName()))
        .build();
  }

  private static Body parse(String source) {
    return MirParser.parseBody("testcode", source);
  }
}

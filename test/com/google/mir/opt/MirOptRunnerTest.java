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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Files;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MirOptRunnerTest {
  private static final String PAIR =
      """
      struct Pair { a: i32, b: i32 }

      fn pair() -> i32 {
          let mut _1: Pair;

          bb0: {
              _1 = Pair { a: const 1_i32, b: const 2_i32 };
              _0 = Add(copy _1.0, copy _1.1);
              return;
          }
      }

      fn identity(_1: i32) -> i32 {
          bb0: {
              _0 = copy _1;
              return;
          }
      }
      """;

  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;

  @Before
  public void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
  }

  @Test
  public void testNoInputFiles() {
    MirOptRunner runner = createRunner();

    assertThat(runner.shouldRunOptimizer()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
    assertThat(errText()).contains("No input files");
    assertThat(errText()).contains("Usage: mir-opt");
  }

  @Test
  public void testHelp() {
    MirOptRunner runner = createRunner("--help");

    assertThat(runner.shouldRunOptimizer()).isFalse();
    assertThat(runner.hasErrors()).isFalse();
    assertThat(outText()).contains("--mir_opt_level");
    assertThat(outText()).contains("--print_escaping");
  }

  @Test
  public void testBadLoggingLevel() {
    MirOptRunner runner = createRunner("--logging_level", "LOUD", "in.mir");

    assertThat(runner.shouldRunOptimizer()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
    assertThat(errText()).contains("Bad value for --logging_level: LOUD");
  }

  @Test
  public void testOptions() {
    MirOptions options =
        createRunner("--mir_opt_level", "3", "--validate", "in.mir").createOptions();

    assertThat(options.getMirOptLevel()).isEqualTo(3);
    assertThat(options.shouldValidateAfterEachPass()).isTrue();
  }

  @Test
  public void testDefaultOptions() {
    MirOptions options = createRunner("in.mir").createOptions();

    assertThat(options.getMirOptLevel()).isEqualTo(new MirOptions().getMirOptLevel());
    assertThat(options.shouldValidateAfterEachPass()).isFalse();
  }

  @Test
  public void testSplitsAtLevelThree() throws IOException {
    File input = write("pair.mir", PAIR);
    MirOptRunner runner =
        createRunner("--mir_opt_level", "3", "--validate", input.getPath());

    assertThat(runner.shouldRunOptimizer()).isTrue();
    runner.run();

    assertThat(runner.hasErrors()).isFalse();
    String output = outText();
    assertThat(output).startsWith("struct Pair { a: i32, b: i32 }\n\n");
    assertThat(output).contains("let mut _2: i32;");
    assertThat(output).contains("_2 = const 1_i32;");
    assertThat(output).contains("_0 = Add(copy _2, copy _3);");
    assertThat(output).doesNotContain("_1.0");
    assertThat(output).contains("fn identity(_1: i32) -> i32 {");
  }

  @Test
  public void testUnchangedAtDefaultLevel() throws IOException {
    File input = write("pair.mir", PAIR);
    MirOptRunner runner = createRunner(input.getPath());

    runner.run();

    assertThat(runner.hasErrors()).isFalse();
    assertThat(outText()).contains("_0 = Add(copy _1.0, copy _1.1);");
  }

  @Test
  public void testPrintEscaping() throws IOException {
    File input = write("pair.mir", PAIR);
    MirOptRunner runner = createRunner("--print_escaping", input.getPath());

    runner.run();

    assertThat(outText()).contains("// escaping locals: _0\nfn pair() -> i32 {");
    assertThat(outText()).contains("// escaping locals: _0, _1\nfn identity(_1: i32) -> i32 {");
  }

  @Test
  public void testSyntaxErrorReported() throws IOException {
    File broken = write("broken.mir", "fn broken() {\n    bb0: {\n        goto bb1;\n    }\n}\n");
    File good = write("good.mir", PAIR);
    MirOptRunner runner = createRunner(broken.getPath(), good.getPath());

    runner.run();

    assertThat(runner.hasErrors()).isTrue();
    assertThat(errText()).contains(broken.getPath() + "#3:");
    assertThat(outText()).contains("fn pair() -> i32 {");
  }

  @Test
  public void testMissingFileReported() {
    MirOptRunner runner = createRunner(new File(folder.getRoot(), "absent.mir").getPath());

    runner.run();

    assertThat(runner.hasErrors()).isTrue();
    assertThat(errText()).contains("Cannot read");
  }

  private MirOptRunner createRunner(String... args) {
    return new MirOptRunner(
        args, new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8));
  }

  private File write(String name, String contents) throws IOException {
    File file = folder.newFile(name);
    Files.asCharSink(file, UTF_8).write(contents);
    return file;
  }

  private String outText() {
    return out.toString(UTF_8);
  }

  private String errText() {
    return err.toString(UTF_8);
  }
}

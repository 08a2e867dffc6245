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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import com.google.mir.ir.AdtDef;
import com.google.mir.ir.Body;
import com.google.mir.ir.Local;
import com.google.mir.ir.MirParser;
import com.google.mir.ir.MirPrinter;
import com.google.mir.ir.MirSyntaxException;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;

/**
 * Command line entry point: reads textual MIR files, optimizes every function in them and prints
 * the result to standard output.
 *
 * <pre>
 * mir-opt [--mir_opt_level N] [--validate] [--print_escaping] [--logging_level L] files...
 * </pre>
 *
 * This class is not thread-safe.
 */
public class MirOptRunner {
  private static final Logger logger = Logger.getLogger(MirOptRunner.class.getName());

  /** The logger shared by everything under {@code com.google.mir}. */
  private static final Logger rootLogger = Logger.getLogger("com.google.mir");

  private static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--mir_opt_level",
        usage = "The optimization level. Scalar replacement of aggregates runs at 3 and above")
    private int mirOptLevel = new MirOptions().getMirOptLevel();

    @Option(
        name = "--validate",
        handler = BooleanOptionHandler.class,
        usage = "Checks the structure of every function after each pass")
    private boolean validate = false;

    @Option(
        name = "--print_escaping",
        handler = BooleanOptionHandler.class,
        usage = "Prints, as a comment before each function, the locals that cannot be split")
    private boolean printEscaping = false;

    @Option(
        name = "--logging_level",
        usage =
            "The logging level (standard java.util.logging.Level values) for optimizer"
                + " progress")
    private String loggingLevel = Level.WARNING.getName();

    @Argument private List<String> files = new ArrayList<>();

    private final CmdLineParser parser;

    Flags() {
      parser = new CmdLineParser(this);
    }

    private void parse(String[] args) throws CmdLineException {
      parser.parseArgument(args);
      if (mirOptLevel < 0) {
        throw new CmdLineException(parser, "Bad value for --mir_opt_level: " + mirOptLevel);
      }
      try {
        Level.parse(loggingLevel);
      } catch (IllegalArgumentException e) {
        throw new CmdLineException(parser, "Bad value for --logging_level: " + loggingLevel, e);
      }
    }

    private void printUsage(PrintStream ps) {
      ps.println("Usage: mir-opt [options] files...");
      parser.printUsage(ps);
      ps.flush();
    }
  }

  private final Flags flags = new Flags();
  private final PrintStream out;
  private final PrintStream err;
  private boolean runOptimizer = false;
  private boolean hasErrors = false;

  public MirOptRunner(String[] args, PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
    try {
      flags.parse(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      flags.printUsage(err);
      hasErrors = true;
      return;
    }
    if (flags.displayHelp) {
      flags.printUsage(out);
      return;
    }
    if (flags.files.isEmpty()) {
      err.println("No input files");
      flags.printUsage(err);
      hasErrors = true;
      return;
    }
    runOptimizer = true;
  }

  public MirOptRunner(String[] args) {
    this(args, System.out, System.err);
  }

  public boolean shouldRunOptimizer() {
    return runOptimizer;
  }

  public boolean hasErrors() {
    return hasErrors;
  }

  MirOptions createOptions() {
    MirOptions options = new MirOptions();
    options.setMirOptLevel(flags.mirOptLevel);
    options.setValidateAfterEachPass(flags.validate);
    return options;
  }

  /** Optimizes every input file. Files that fail to load are reported and skipped. */
  public void run() {
    rootLogger.setLevel(Level.parse(flags.loggingLevel));
    MirOptimizer optimizer = MirOptimizer.createDefault(createOptions());
    int functions = 0;
    for (String fileName : flags.files) {
      ImmutableList<Body> bodies;
      try {
        bodies = MirParser.parse(fileName, Files.asCharSource(new File(fileName), UTF_8).read());
      } catch (IOException e) {
        err.println("Cannot read " + fileName + ": " + e.getMessage());
        hasErrors = true;
        continue;
      } catch (MirSyntaxException e) {
        err.println(e.getMessage());
        hasErrors = true;
        continue;
      }
      List<String> printed = new ArrayList<>();
      for (Body body : bodies) {
        StringBuilder sb = new StringBuilder();
        if (flags.printEscaping) {
          sb.append("// escaping locals: ").append(formatLocals(EscapingLocals.compute(body)));
          sb.append('\n');
        }
        try {
          optimizer.process(body);
        } catch (IllegalStateException e) {
          err.println(fileName + ": " + body.getName() + ": " + e.getMessage());
          hasErrors = true;
          continue;
        }
        sb.append(MirPrinter.printFunction(body));
        printed.add(sb.toString());
        functions++;
      }
      out.print(printFile(bodies, printed));
    }
    logger.info("Optimized " + functions + " functions from " + flags.files.size() + " files");
  }

  private static String printFile(List<Body> bodies, List<String> functions) {
    Set<AdtDef> adts = new LinkedHashSet<>();
    for (Body body : bodies) {
      adts.addAll(body.getAdtDefs());
    }
    StringBuilder sb = new StringBuilder();
    for (AdtDef adt : adts) {
      sb.append(MirPrinter.formatAdtDef(adt)).append('\n');
    }
    if (!adts.isEmpty()) {
      sb.append('\n');
    }
    sb.append(Joiner.on('\n').join(functions));
    return sb.toString();
  }

  private static String formatLocals(BitSet locals) {
    List<Local> result = new ArrayList<>();
    for (int i = locals.nextSetBit(0); i >= 0; i = locals.nextSetBit(i + 1)) {
      result.add(Local.of(i));
    }
    return Joiner.on(", ").join(result);
  }

  public static void main(String[] args) {
    MirOptRunner runner = new MirOptRunner(args);
    if (runner.shouldRunOptimizer()) {
      runner.run();
    }
    if (runner.hasErrors()) {
      System.exit(-1);
    }
  }
}

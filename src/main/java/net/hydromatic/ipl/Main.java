/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.ipl;

import com.google.common.collect.ImmutableList;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.ipl.check.CheckResult;
import net.hydromatic.ipl.check.DerivationChecker;
import net.hydromatic.ipl.check.Prop;
import net.hydromatic.ipl.check.Tracer;
import net.hydromatic.ipl.check.Tracers;
import net.hydromatic.ipl.parse.Command;
import net.hydromatic.ipl.parse.IplParseException;
import net.hydromatic.ipl.parse.IplParser;
import net.hydromatic.ipl.type.TypeSystem;

/**
 * Command-line proof checker.
 *
 * <p>Reads proof scripts, from the files named on the command line or from
 * standard input, and checks each "{@code (check sequent derivation)}"
 * command, printing "{@code accept}" or the reason for rejection.
 *
 * <p>Options:
 *
 * <ul>
 *   <li>{@code --echo} prints each command before its result;
 *   <li>{@code --trace} prints each sub-derivation as it is checked;
 *   <li>{@code --name=value} sets a {@link Prop property}, e.g. {@code
 *       --maxDepth=50}.
 * </ul>
 *
 * <p>The exit status is 0 if every command is accepted, 1 if any is rejected,
 * and 2 if a script cannot be read or parsed.
 */
public class Main {
  static final int ACCEPTED = 0;
  static final int REJECTED = 1;
  static final int ERROR = 2;

  private final List<String> files = new ArrayList<>();
  private final Reader in;
  private final PrintWriter out;
  private final boolean echo;
  private final boolean trace;
  private final Map<Prop, Object> propMap = new LinkedHashMap<>();

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final int status;
    try {
      final Main main =
          new Main(
              ImmutableList.copyOf(args),
              new InputStreamReader(System.in, StandardCharsets.UTF_8),
              new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
      status = main.run();
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.exit(ERROR);
      return;
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(ERROR);
      return;
    }
    System.exit(status);
  }

  /**
   * Creates a Main.
   *
   * @throws IllegalArgumentException if an option is invalid
   */
  public Main(List<String> argList, Reader in, Writer out) {
    this.in = in;
    this.out =
        out instanceof PrintWriter
            ? (PrintWriter) out
            : new PrintWriter(
                out instanceof BufferedWriter ? out : new BufferedWriter(out));
    boolean echo = false;
    boolean trace = false;
    for (String arg : argList) {
      if (arg.equals("--echo")) {
        echo = true;
      } else if (arg.equals("--trace")) {
        trace = true;
      } else if (arg.startsWith("--") && arg.contains("=")) {
        final int i = arg.indexOf('=');
        Prop.lookup(arg.substring(2, i))
            .setLenient(propMap, arg.substring(i + 1));
      } else if (arg.startsWith("--")) {
        throw new IllegalArgumentException("unknown option " + arg);
      } else {
        files.add(arg);
      }
    }
    this.echo = echo;
    this.trace = trace;
  }

  /** Checks every script; returns the exit status. */
  public int run() {
    int status = ACCEPTED;
    try {
      if (files.isEmpty()) {
        status = run("stdIn", readAll(in));
      } else {
        for (String file : files) {
          final String text;
          try {
            text = new String(
                Files.readAllBytes(Paths.get(file)), StandardCharsets.UTF_8);
          } catch (IOException e) {
            out.println("Error: cannot read " + file + ": " + e.getMessage());
            status = ERROR;
            continue;
          }
          status = Math.max(status, run(file, text));
        }
      }
    } finally {
      out.flush();
    }
    return status;
  }

  /** Checks the commands in a script; returns the exit status. */
  private int run(String file, String text) {
    final IplParser parser = new IplParser(new TypeSystem(), file, text);
    final DerivationChecker checker = new DerivationChecker(propMap, tracer());
    int status = ACCEPTED;
    try {
      while (!parser.atEnd()) {
        final Command command = parser.parseCommand();
        if (echo) {
          out.println("> " + command);
        }
        final CheckResult result =
            checker.check(command.derivation, command.target);
        out.println(result);
        if (!result.isAccept()) {
          status = REJECTED;
        }
      }
    } catch (IplParseException e) {
      out.println(e.describeTo(new StringBuilder()));
      return ERROR;
    }
    return status;
  }

  private Tracer tracer() {
    if (!trace) {
      return Tracers.empty();
    }
    return Tracers.withOnStep(
        Tracers.empty(),
        (location, derivation) ->
            out.println("  " + location + " " + derivation.rule() + " "
                + derivation.conclusion()));
  }

  private static String readAll(Reader r) {
    final StringBuilder b = new StringBuilder();
    final char[] chars = new char[1024];
    try {
      for (;;) {
        final int read = r.read(chars);
        if (read < 0) {
          return b.toString();
        }
        b.append(chars, 0, read);
      }
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}

// End Main.java

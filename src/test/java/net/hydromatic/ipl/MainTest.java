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

import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link Main}. */
public class MainTest {
  private static final String IDENTITY =
      "(check (() ⊢ (λ (x : P) x) : (P -> P))\n"
          + "  (LambdaIntro (() ⊢ (λ (x : P) x) : (P -> P))\n"
          + "    (Assm (((x : P)) ⊢ x : P))))\n";

  private static final String ASSUMPTION =
      "(check (((x : P)) ⊢ x : P) (Assm (((x : P)) ⊢ x : P)))\n";

  private static final String UNBOUND =
      "; leaves refer to variables that are not in the environment\n"
          + "(check (() ⊢ (cons a b) : (P × Q))\n"
          + "  (PairIntro (() ⊢ (cons a b) : (P × Q))\n"
          + "    (Assm (() ⊢ a : P))\n"
          + "    (Assm (() ⊢ b : Q))))\n";

  /** Result of running the shell. */
  private static class Run {
    final int status;
    final String output;

    Run(int status, String output) {
      this.status = status;
      this.output = output;
    }
  }

  private static Run run(List<String> args, String input) {
    final StringWriter out = new StringWriter();
    final Main main = new Main(args, new StringReader(input), out);
    final int status = main.run();
    return new Run(status,
        out.toString().replace(System.lineSeparator(), "\n"));
  }

  private static Run run(String input) {
    return run(ImmutableList.of(), input);
  }

  @Test
  void testAccept() {
    final Run run = run(IDENTITY + ASSUMPTION);
    assertThat(run.output, is("accept\naccept\n"));
    assertThat(run.status, is(0));
  }

  @Test
  void testEmpty() {
    final Run run = run("; nothing to check\n");
    assertThat(run.output, is(""));
    assertThat(run.status, is(0));
  }

  @Test
  void testReject() {
    final Run run = run(IDENTITY + UNBOUND + ASSUMPTION);
    assertThat(run.output,
        is("accept\n"
            + "reject: premise-invalid: unbound-variable at 0: "
            + "variable 'a' is not bound in ()\n"
            + "accept\n"));
    assertThat(run.status, is(1));
  }

  @Test
  void testTargetMismatch() {
    final Run run =
        run("(check (((x : P)) ⊢ x : Q) (Assm (((x : P)) ⊢ x : P)))");
    assertThat(run.output,
        is("reject: conclusion-target-mismatch at root: "
            + "derivation concludes ((x : P)) ⊢ x : P, "
            + "but must prove ((x : P)) ⊢ x : Q\n"));
    assertThat(run.status, is(1));
  }

  /** Commands before a syntax error are checked; the rest are not. */
  @Test
  void testParseError() {
    final Run run = run(ASSUMPTION + "(check (Assm) (Assm))\n" + ASSUMPTION);
    assertThat(run.output,
        is("accept\nstdIn:2.8-2.14 Error: "
            + "expected a sequent (env ⊢ term : type)\n"));
    assertThat(run.status, is(2));
  }

  @Test
  void testEcho() {
    final Run run = run(ImmutableList.of("--echo"), ASSUMPTION);
    assertThat(run.output,
        is("> (check (((x : P)) ⊢ x : P) (Assm (((x : P)) ⊢ x : P)))\n"
            + "accept\n"));
  }

  @Test
  void testTrace() {
    final Run run = run(ImmutableList.of("--trace"), IDENTITY);
    assertThat(run.output,
        is("  root LambdaIntro () ⊢ (λ (x : P) x) : (P -> P)\n"
            + "  0 Assm ((x : P)) ⊢ x : P\n"
            + "accept\n"));
  }

  @Test
  void testProperty() {
    final Run run = run(ImmutableList.of("--maxDepth=0"), IDENTITY);
    assertThat(run.output,
        is("reject: malformed-input at root: term is deeper than 0\n"));
    assertThat(run.status, is(1));

    final Run run2 =
        run(ImmutableList.of("--checkInput=false"),
            "(check (((case : P)) ⊢ case : P)"
                + " (Assm (((case : P)) ⊢ case : P)))");
    assertThat(run2.status, is(2));
  }

  @Test
  void testBadOption() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> run(ImmutableList.of("--frobnicate"), ""));
    assertThat(e.getMessage(), is("unknown option --frobnicate"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> run(ImmutableList.of("--noSuchProperty=1"), ""));
    assertThat(e2.getMessage(), is("property noSuchProperty not found"));
  }

  @Test
  void testFiles(@TempDir Path dir) throws IOException {
    final Path good = dir.resolve("good.ipl");
    final Path bad = dir.resolve("bad.ipl");
    Files.write(good, IDENTITY.getBytes(StandardCharsets.UTF_8));
    Files.write(bad, UNBOUND.getBytes(StandardCharsets.UTF_8));

    final Run run =
        run(ImmutableList.of(good.toString(), bad.toString()), "");
    assertThat(run.output,
        is("accept\n"
            + "reject: premise-invalid: unbound-variable at 0: "
            + "variable 'a' is not bound in ()\n"));
    assertThat(run.status, is(1));

    final Run run2 =
        run(ImmutableList.of(good.toString(),
            dir.resolve("missing.ipl").toString()), "");
    assertThat(run2.output, startsWith("accept\nError: cannot read "));
    assertThat(run2.status, is(2));
  }
}

// End MainTest.java

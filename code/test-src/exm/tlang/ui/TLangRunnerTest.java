/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.tlang.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.tlang.common.Logging;
import exm.tlang.common.exceptions.ErrorKind;

public class TLangRunnerTest {

  private static final Logger logger = Logging.getTLangLogger();

  private final TLangRunner runner = new TLangRunner(logger, 1000, 1 << 20);

  private static void assertFailure(RunResult result, ErrorKind kind,
                                    String stderr, String stdout) {
    assertEquals(result.toString(), -1, result.getExitCode());
    assertEquals(kind, result.getErrorKind());
    assertEquals(stderr, result.getStderr());
    assertEquals(stdout, result.getStdout());
  }

  @Test
  public void testPrintVariable() {
    RunResult result = runner.run("int x = 5; print(x);");
    assertEquals("5\n", result.getStdout());
    assertEquals("", result.getStderr());
    assertEquals(0, result.getExitCode());
    assertTrue(result.isSuccess());
  }

  @Test
  public void testPrintCharOutsideBmp() {
    RunResult result = runner.run("char c = '\uD83D\uDE00'; print(c);");
    assertEquals("", result.getStderr());
    assertEquals("\uD83D\uDE00\n", result.getStdout());
    assertEquals(0, result.getExitCode());
  }

  @Test
  public void testForLoop() {
    RunResult result = runner.run("for(int i=0;i<3;i=i+1){print(i);}");
    assertEquals("0\n1\n2\n", result.getStdout());
    assertEquals(0, result.getExitCode());
  }

  @Test
  public void testSemanticFailurePrintsNothing() {
    assertFailure(runner.run("print(1);\nint x = 5.0;"), ErrorKind.TYPE_ERROR,
        "TypeError: Type mismatch: cannot assign float to 'x' of type int "
        + "at line 2\n", "");
  }

  @Test
  public void testTypeErrorAtReturn() {
    RunResult result = runner.run("def float f(){ return 1; }");
    assertEquals(ErrorKind.TYPE_ERROR, result.getErrorKind());
    assertTrue(result.getStderr(),
               result.getStderr().endsWith("at line 1\n"));
  }

  @Test
  public void testIndexError() {
    assertFailure(runner.run("int[] a = {1,2,3}; print(a[5]);"),
        ErrorKind.INDEX_ERROR, "IndexError: Array index out of bounds: "
        + "index 5, length 3 at line 1\n", "");
  }

  @Test
  public void testDivisionByZero() {
    assertFailure(runner.run("print(5/0);"), ErrorKind.DIVISION_BY_ZERO,
        "DivisionByZero: Division by zero at line 1\n", "");
  }

  @Test
  public void testOutputBeforeRuntimeErrorKept() {
    assertFailure(runner.run("print(1);\nprint(1/0);"),
        ErrorKind.DIVISION_BY_ZERO,
        "DivisionByZero: Division by zero at line 2\n", "1\n");
  }

  @Test
  public void testBlockVariableNotVisibleAfter() {
    assertFailure(runner.run("if (true) { int y = 1; }\nprint(y);"),
        ErrorKind.NAME_ERROR,
        "NameError: Variable 'y' is not defined at line 2\n", "");
  }

  @Test
  public void testFunctionCannotSeeCallerLocals() {
    RunResult result = runner.run(
        "def int g() { return v; }\n" +
        "def int h() { int v = 3; return g(); }\n" +
        "print(h());");
    assertFailure(result, ErrorKind.NAME_ERROR,
        "NameError: Variable 'v' is not defined at line 1\n", "");
  }

  @Test
  public void testFunctionSeesGlobals() {
    RunResult result = runner.run(
        "int g = 2;\ndef int twice() { return g * 2; }\nprint(twice());");
    assertEquals("4\n", result.getStdout());
  }

  @Test
  public void testLexError() {
    assertFailure(runner.run("int x = 5 @ 3;"), ErrorKind.LEX_ERROR,
        "LexError: Unexpected character: '@' at line 1:11\n", "");
  }

  @Test
  public void testSyntaxError() {
    assertFailure(runner.run("print(1);\nint x = 5"), ErrorKind.SYNTAX_ERROR,
        "SyntaxError: Expected token SEMI but found EOF at line 2\n", "");
  }

  @Test
  public void testCallErrors() {
    assertEquals(ErrorKind.TYPE_ERROR, runner.run(
        "def int f(int a) { return a; } print(f());").getErrorKind());
    assertEquals(ErrorKind.TYPE_ERROR, runner.run(
        "def int f(int a) { return a; } print(f(\"s\"));").getErrorKind());
    assertEquals(ErrorKind.NAME_ERROR,
                 runner.run("nothing();").getErrorKind());
  }

  @Test
  public void testMissingReturn() {
    assertFailure(runner.run("def int f() { print(0); }\nprint(f());"),
        ErrorKind.RUNTIME_ERROR, "RuntimeError: Function 'f' finished "
        + "without returning a value at line 2\n", "0\n");
  }

  @Test
  public void testRecursionLimit() {
    TLangRunner limited = new TLangRunner(logger, 100, 1 << 20);
    RunResult result = limited.run(
        "def int f(int n) { return f(n + 1); }\nprint(f(0));");
    assertFailure(result, ErrorKind.RECURSION_ERROR,
        "RecursionError: Maximum recursion depth exceeded (100) at line 1\n",
        "");
  }

  @Test
  public void testOutputLimit() {
    TLangRunner limited = new TLangRunner(logger, 1000, 8);
    assertFailure(limited.run("while (true) { print(1); }"),
        ErrorKind.OUTPUT_LIMIT,
        "OutputLimitExceeded: Program output exceeded 8 bytes at line 1\n",
        "1\n1\n1\n1\n");
  }

  @Test
  public void testEmptyProgram() {
    RunResult result = runner.run("");
    assertEquals(RunResult.success(""), result);
  }

  @Test
  public void testIdempotent() {
    String[] sources = {
        "int x = 5; print(x); print(x * 2.5);",
        "print(1); print(1/0);",
        "int y = true;",
    };
    for (String source: sources) {
      assertEquals(source, runner.run(source), runner.run(source));
    }
  }
}

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
package exm.tlang.interp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

import org.apache.log4j.Logger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tlang.ast.Program;
import exm.tlang.common.Logging;
import exm.tlang.common.exceptions.ArrayIndexException;
import exm.tlang.common.exceptions.DivisionByZeroException;
import exm.tlang.common.exceptions.MissingReturnException;
import exm.tlang.common.exceptions.OutputLimitException;
import exm.tlang.common.exceptions.RecursionDepthException;
import exm.tlang.common.exceptions.TimeoutException;
import exm.tlang.common.exceptions.UserException;
import exm.tlang.frontend.Analysis;
import exm.tlang.frontend.Lexer;
import exm.tlang.frontend.Parser;
import exm.tlang.frontend.SemanticAnalyzer;

public class InterpreterTest {

  private static final Logger logger = Logging.getTLangLogger();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static String exec(String source) throws UserException {
    return exec(source, new OutputBuffer(1 << 20), 1000);
  }

  private static String exec(String source, OutputBuffer output,
                             int maxDepth) throws UserException {
    Program program = new Parser(new Lexer(source).tokenize()).parse();
    Analysis analysis = new SemanticAnalyzer(logger).analyze(program);
    new Interpreter(logger, analysis, output, maxDepth).execute(program);
    return output.getText();
  }

  @Test
  public void testIntArithmetic() throws Exception {
    assertEquals("Division truncates toward zero", "3\n-3\n7\n-1\n",
        exec("print(7 / 2); print(-7 / 2); print(1 + 2 * 3); print(2 - 3);"));
  }

  @Test
  public void testFloatArithmetic() throws Exception {
    assertEquals("3.5\n3.0\n-0.5\n",
        exec("print(7.0 / 2); print(2.0 * 1.5); print(-0.5);"));
  }

  @Test
  public void testPrintForms() throws Exception {
    assertEquals("hi\nc\ntrue\nfalse\n[1, 2, 3]\n[]\n",
        exec("print(\"hi\"); print('c'); print(true); print(1 > 2);\n" +
             "int[] a = {1, 2, 3}; print(a); int[] e = {}; print(e);"));
  }

  @Test
  public void testCharOutsideBmp() throws Exception {
    assertEquals("\uD83D\uDE00\ntrue\nfalse\n",
        exec("char c = '\uD83D\uDE00'; print(c);\n" +
             "print(c == '\uD83D\uDE00'); print(c == '\uD83D\uDE01');"));
  }

  @Test
  public void testPrintLargeFloat() throws Exception {
    assertEquals("10000000.0\n1e+16\n",
        exec("print(10000000.0); print(10000000000000000.0);"));
  }

  @Test
  public void testComparisons() throws Exception {
    assertEquals("true\ntrue\nfalse\ntrue\ntrue\ntrue\n",
        exec("print(1 < 1.5); print(2 >= 2); print(3 <= 2);\n" +
             "print(!(1 > 2)); print('a' == 'a'); print(\"x\" != \"y\");"));
  }

  @Test
  public void testArrayEquality() throws Exception {
    assertEquals("true\nfalse\n",
        exec("int[] a = {1, 2}; int[] b = {1, 2}; int[] c = {2, 1};\n" +
             "print(a == b); print(a == c);"));
  }

  @Test
  public void testArrayElementAssignment() throws Exception {
    assertEquals("[1, 5, 3]\n",
        exec("int[] a = {1, 2, 3}; a[1] = 5; print(a);"));
  }

  @Test
  public void testArraysSharedByReference() throws Exception {
    assertEquals("9\n7\n",
        exec("int[] a = {1}; int[] b = a; b[0] = 9; print(a[0]);\n" +
             "def int set(int[] arr) { arr[0] = 7; return 0; }\n" +
             "set(a); print(b[0]);"));
  }

  @Test
  public void testWhile() throws Exception {
    assertEquals("3\n2\n1\n",
        exec("int n = 3; while (n > 0) { print(n); n = n - 1; }"));
  }

  @Test
  public void testFor() throws Exception {
    assertEquals("0\n1\n2\n", exec("for(int i=0;i<3;i=i+1){print(i);}"));
    assertEquals("10\n",
        exec("int s = 0;\n" +
             "for (int i = 1; i <= 4; i = i + 1) { s = s + i; }\n" +
             "print(s);"));
    assertEquals("Init by assignment", "3\n",
        exec("int i = 0; for (i = 0; i < 3; i = i + 1) { } print(i);"));
  }

  @Test
  public void testIfElse() throws Exception {
    assertEquals("big\nsmall\n",
        exec("def int show(int x) {\n" +
             "  if (x > 10) { print(\"big\"); } else { print(\"small\"); }\n" +
             "  return 0;\n" +
             "}\n" +
             "show(11); show(3);"));
  }

  @Test
  public void testBlockScopes() throws Exception {
    assertEquals("2\n1\n",
        exec("int x = 1; if (true) { int x = 2; print(x); } print(x);"));
    assertEquals("Assignment in block updates outer variable", "2\n",
        exec("int x = 1; if (true) { x = 2; } print(x);"));
  }

  @Test
  public void testRecursion() throws Exception {
    assertEquals("55\n120\n",
        exec("def int fib(int n) {\n" +
             "  if (n < 2) { return n; }\n" +
             "  return fib(n - 1) + fib(n - 2);\n" +
             "}\n" +
             "def int fact(int n) {\n" +
             "  if (n <= 1) { return 1; }\n" +
             "  return n * fact(n - 1);\n" +
             "}\n" +
             "print(fib(10)); print(fact(5));"));
  }

  @Test
  public void testReturnFromNestedLoop() throws Exception {
    assertEquals("2\n-1\n",
        exec("def int find(int[] a, int v) {\n" +
             "  for (int i = 0; i < 1; i = i + 1) {\n" +
             "    while (true) {\n" +
             "      if (a[i] == v) { return i; }\n" +
             "      i = i + 1;\n" +
             "      if (i == 3) { return -1; }\n" +
             "    }\n" +
             "  }\n" +
             "  return -2;\n" +
             "}\n" +
             "int[] a = {4, 5, 6}; print(find(a, 6)); print(find(a, 9));"));
  }

  @Test
  public void testBodyLocalShadowsParameter() throws Exception {
    assertEquals("40\n4\n",
        exec("def int f(int n) { int n = n * 10; return n; }\n" +
             "def int g(int n) { if (true) { int n = 0; } return n; }\n" +
             "print(f(4)); print(g(4));"));
  }

  @Test
  public void testFunctionSeesGlobalsAtCallTime() throws Exception {
    assertEquals("5\n",
        exec("int g = 1; def int f() { return g; } g = 5; print(f());"));
  }

  @Test
  public void testFunctionCanUpdateGlobals() throws Exception {
    assertEquals("1\n2\n",
        exec("int count = 0;\n" +
             "def int bump() { count = count + 1; return count; }\n" +
             "bump(); print(count); print(bump());"));
  }

  @Test
  public void testBareCallMayDiscardMissingValue() throws Exception {
    assertEquals("1\n", exec("def int f() { print(1); } f();"));
  }

  @Test
  public void testMissingReturnValueUsed() throws Exception {
    exception.expect(MissingReturnException.class);
    exception.expectMessage("RuntimeError: Function 'f' finished without "
                            + "returning a value at line 2");
    exec("def int f() { int x = 1; }\nprint(f());");
  }

  @Test
  public void testIntDivisionByZero() throws Exception {
    exception.expect(DivisionByZeroException.class);
    exception.expectMessage("DivisionByZero: Division by zero at line 1");
    exec("print(5/0);");
  }

  @Test
  public void testFloatDivisionByZero() throws Exception {
    exception.expect(DivisionByZeroException.class);
    exec("float z = 0.0; print(1.0 / z);");
  }

  @Test
  public void testIndexOutOfBounds() throws Exception {
    exception.expect(ArrayIndexException.class);
    exception.expectMessage("IndexError: Array index out of bounds: index 5, "
                            + "length 3 at line 1");
    exec("int[] a = {1,2,3}; print(a[5]);");
  }

  @Test
  public void testNegativeIndexOnAssignment() throws Exception {
    exception.expect(ArrayIndexException.class);
    exception.expectMessage("at line 2");
    exec("int[] a = {1,2,3};\na[-1] = 0;");
  }

  @Test
  public void testOutputKeptOnFailure() throws Exception {
    OutputBuffer output = new OutputBuffer(1 << 20);
    try {
      exec("print(1);\nprint(1 / 0);", output, 1000);
      fail("Expected division by zero");
    } catch (DivisionByZeroException e) {
      assertEquals(2, e.getLine());
    }
    assertEquals("1\n", output.getText());
  }

  @Test
  public void testRecursionLimit() throws Exception {
    exception.expect(RecursionDepthException.class);
    exception.expectMessage("RecursionError: Maximum recursion depth "
                            + "exceeded (50) at line 1");
    exec("def int f(int n) { return f(n + 1); } print(f(0));",
         new OutputBuffer(1 << 20), 50);
  }

  @Test
  public void testRecursionWithinLimit() throws Exception {
    assertEquals("50\n",
        exec("def int depth(int n) {\n" +
             "  if (n == 0) { return 0; }\n" +
             "  return 1 + depth(n - 1);\n" +
             "}\n" +
             "print(depth(50));", new OutputBuffer(1 << 20), 51));
  }

  @Test
  public void testOutputLimit() throws Exception {
    OutputBuffer output = new OutputBuffer(10);
    try {
      exec("print(\"hello\"); print(\"world\");", output, 1000);
      fail("Expected output limit");
    } catch (OutputLimitException e) {
      assertEquals(1, e.getLine());
    }
    assertEquals("Line that passed the limit is dropped", "hello\n",
                 output.getText());
  }

  @Test
  public void testInterruptStopsLoop() throws Exception {
    Thread.currentThread().interrupt();
    try {
      exec("while (true) { }");
      fail("Expected loop to stop");
    } catch (TimeoutException e) {
      assertFalse("Interrupt flag consumed",
                  Thread.currentThread().isInterrupted());
    }
  }
}

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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.tlang.common.exceptions.ErrorKind;

public class MainTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private ByteArrayOutputStream outBytes;
  private ByteArrayOutputStream errBytes;
  private PrintStream out;
  private PrintStream err;

  @Before
  public void setUp() throws Exception {
    outBytes = new ByteArrayOutputStream();
    errBytes = new ByteArrayOutputStream();
    out = new PrintStream(outBytes, true, "UTF-8");
    err = new PrintStream(errBytes, true, "UTF-8");
  }

  private String source(String text) throws Exception {
    File f = tmp.newFile();
    FileUtils.writeStringToFile(f, text, "UTF-8");
    return f.getPath();
  }

  private String stdout() throws UnsupportedEncodingException {
    return outBytes.toString("UTF-8");
  }

  private String stderr() throws UnsupportedEncodingException {
    return errBytes.toString("UTF-8");
  }

  @Test
  public void testSuccess() throws Exception {
    int code = Main.run(new String[] {source("int x = 5; print(x);")},
                        out, err);
    assertEquals(ExitCode.SUCCESS.code(), code);
    assertEquals("5\n", stdout());
    assertEquals("", stderr());
  }

  @Test
  public void testUtf8Source() throws Exception {
    int code = Main.run(new String[] {source("print(\"héllo\");")}, out, err);
    assertEquals(0, code);
    assertEquals("héllo\n", stdout());
  }

  @Test
  public void testProgramFailure() throws Exception {
    int code = Main.run(new String[] {source("print(1);\nprint(5/0);")},
                        out, err);
    assertEquals(ExitCode.ERROR_USER.code(), code);
    assertEquals("1\n", stdout());
    assertEquals("DivisionByZero: Division by zero at line 2\n", stderr());
  }

  @Test
  public void testFileNotFound() throws Exception {
    String path = new File(tmp.getRoot(), "missing.tl").getPath();
    int code = Main.run(new String[] {path}, out, err);
    assertEquals(ExitCode.ERROR_IO.code(), code);
    assertTrue(stderr(), stderr().startsWith(
                     "Error: File not found at '" + path + "'"));
    assertEquals("", stdout());
  }

  @Test
  public void testWrongArgumentCount() throws Exception {
    assertEquals(ExitCode.ERROR_COMMAND.code(),
                 Main.run(new String[0], out, err));
    assertTrue(stderr().contains("Expected one input file"));
    assertEquals(ExitCode.ERROR_COMMAND.code(),
                 Main.run(new String[] {"a.tl", "b.tl"}, out, err));
  }

  @Test
  public void testUnknownOption() throws Exception {
    assertEquals(ExitCode.ERROR_COMMAND.code(),
                 Main.run(new String[] {"--bogus", "a.tl"}, out, err));
  }

  @Test
  public void testMaxDepthOption() throws Exception {
    String file = source("def int f(int n) { return f(n + 1); }\nprint(f(0));");
    int code = Main.run(new String[] {"--max-depth", "20", file}, out, err);
    assertEquals(ExitCode.ERROR_USER.code(), code);
    assertEquals("RecursionError: Maximum recursion depth exceeded (20) "
                 + "at line 1\n", stderr());
  }

  @Test
  public void testInvalidMaxDepth() throws Exception {
    String file = source("print(1);");
    int code = Main.run(new String[] {"-d", "lots", file}, out, err);
    assertEquals(ExitCode.ERROR_COMMAND.code(), code);
    assertTrue(stderr(), stderr().contains("tlang.max-call-depth"));
  }

  @Test
  public void testTimeoutOption() throws Exception {
    String file = source("while (true) { }");
    int code = Main.run(new String[] {"-T", "200", file}, out, err);
    assertEquals(ExitCode.ERROR_USER.code(), code);
    assertEquals("Timeout: Execution timed out after 200 ms\n", stderr());
  }

  @Test
  public void testOptionsDoNotCarryOver() throws Exception {
    String file = source("def int f(int n) {\n"
        + "  if (n == 0) { return 0; } else { return f(n - 1); }\n}\n"
        + "print(f(50));");
    assertEquals(ExitCode.ERROR_USER.code(),
                 Main.run(new String[] {"-d", "10", file}, out, err));
    outBytes.reset();
    errBytes.reset();
    assertEquals("Default depth applies again", ExitCode.SUCCESS.code(),
                 Main.run(new String[] {file}, out, err));
    assertEquals("0\n", stdout());
    assertEquals("", stderr());
  }

  @Test
  public void testLogFileDoesNotCarryOver() throws Exception {
    File log = new File(tmp.getRoot(), "run.log");
    String file = source("print(1);");
    assertEquals(0, Main.run(new String[] {"-l", log.getPath(), file},
                             out, err));
    long logged = log.length();
    assertTrue("First run logs to file", logged > 0);
    assertEquals(0, Main.run(new String[] {file}, out, err));
    assertEquals("Second run has no log file", logged, log.length());
  }

  @Test
  public void testExitCodeForInternalError() {
    assertEquals(ExitCode.SUCCESS, Main.exitCodeFor(RunResult.success("x")));
    assertEquals(ExitCode.ERROR_USER, Main.exitCodeFor(
        RunResult.failure("", ErrorKind.TYPE_ERROR, "TypeError: bad")));
    assertEquals(ExitCode.ERROR_INTERNAL, Main.exitCodeFor(
        RunResult.failure("", ErrorKind.INTERNAL_ERROR,
                          "InternalError: java.lang.IllegalStateException")));
  }
}

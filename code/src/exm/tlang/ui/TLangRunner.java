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

import java.util.List;

import org.apache.log4j.Logger;

import exm.tlang.ast.Program;
import exm.tlang.ast.Token;
import exm.tlang.common.Settings;
import exm.tlang.common.exceptions.ErrorKind;
import exm.tlang.common.exceptions.InvalidOptionException;
import exm.tlang.common.exceptions.RecursionDepthException;
import exm.tlang.common.exceptions.UserException;
import exm.tlang.common.util.Misc;
import exm.tlang.frontend.Analysis;
import exm.tlang.frontend.Lexer;
import exm.tlang.frontend.Parser;
import exm.tlang.frontend.SemanticAnalyzer;
import exm.tlang.interp.Interpreter;
import exm.tlang.interp.OutputBuffer;

/**
 * This is the main entry point to the interpreter: it runs source text
 * through the lexer, parser, semantic analyzer and interpreter in turn.
 *
 * Each call to {@link #run(String)} builds fresh state for every stage,
 * so one runner can be reused, including from several threads.
 */
public class TLangRunner {

  private final Logger logger;
  private final int maxCallDepth;
  private final long maxOutputBytes;

  public TLangRunner(Logger logger, int maxCallDepth, long maxOutputBytes) {
    this.logger = logger;
    this.maxCallDepth = maxCallDepth;
    this.maxOutputBytes = maxOutputBytes;
  }

  /**
   * Create runner with limits taken from Settings
   * @throws InvalidOptionException
   */
  public static TLangRunner fromSettings(Logger logger)
      throws InvalidOptionException {
    return new TLangRunner(logger, Settings.getInt(Settings.MAX_CALL_DEPTH),
                           Settings.getLong(Settings.MAX_OUTPUT_BYTES));
  }

  /**
   * Run a program.  Never throws: every failure, including internal
   * errors, is reported in the result.
   * @param source program text
   * @return output, diagnostic and exit code
   */
  public RunResult run(String source) {
    OutputBuffer output = new OutputBuffer(maxOutputBytes);
    logger.debug("Run starting: " + Misc.timestamp());
    try {
      runOnce(source, output);
      logger.debug("Run done: " + Misc.timestamp());
      return RunResult.success(output.getText());
    }
    catch (UserException e) {
      logger.debug("Run failed: " + e.getMessage());
      if (logger.isTraceEnabled())
        logger.trace(Misc.stackTrace(e));
      return RunResult.failure(output.getText(), e.getKind(), e.getMessage());
    }
    catch (StackOverflowError e) {
      // Host stack ran out before the call depth limit was reached
      RecursionDepthException re = new RecursionDepthException(
            "Maximum recursion depth exceeded (host stack exhausted)");
      logger.debug("Run failed: stack overflow");
      return RunResult.failure(output.getText(), re.getKind(),
                               re.getMessage());
    }
    catch (Throwable e) {
      reportInternalError(logger, e);
      return RunResult.failure(output.getText(), ErrorKind.INTERNAL_ERROR,
                               ErrorKind.INTERNAL_ERROR + ": " + e);
    }
  }

  private void runOnce(String source, OutputBuffer output)
      throws UserException {
    long start = System.nanoTime();
    List<Token> tokens = new Lexer(source).tokenize();
    logger.debug("Lexed " + tokens.size() + " token(s) in "
                 + Misc.elapsed(start));

    start = System.nanoTime();
    Program program = new Parser(tokens).parse();
    logger.debug("Parsed " + program.stmts().size() + " statement(s) in "
                 + Misc.elapsed(start));

    /*
     * Check scoping and types of the whole program before executing any of
     * it, so a program with semantic errors prints nothing.
     */
    start = System.nanoTime();
    Analysis analysis = new SemanticAnalyzer(logger).analyze(program);
    logger.debug("Analyzed " + analysis.typedExprCount()
                 + " expression(s) in " + Misc.elapsed(start));

    start = System.nanoTime();
    Interpreter interp = new Interpreter(logger, analysis, output,
                                         maxCallDepth);
    interp.execute(program);
    logger.debug("Executed in " + Misc.elapsed(start));
  }

  public static void reportInternalError(Logger logger, Throwable e) {
    logger.error("TLANG INTERNAL ERROR\n" + Misc.stackTrace(e));
  }
}

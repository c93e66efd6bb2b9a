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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.tlang.common.Logging;
import exm.tlang.common.Settings;
import exm.tlang.common.exceptions.ErrorKind;
import exm.tlang.common.exceptions.InvalidOptionException;
import exm.tlang.common.exceptions.TLangFatal;
import exm.tlang.service.ExecutionService;

/**
 * Command line interface to the interpreter.  Some options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String LOG_FILE_FLAG = "l";
  private static final String TRACE_FLAG = "t";
  private static final String MAX_DEPTH_FLAG = "d";
  private static final String TIMEOUT_FLAG = "T";

  public static void main(String[] args) {
    int code = run(args, System.out, System.err);
    System.exit(code);
  }

  /**
   * Run the command line interface without exiting the JVM
   * @param args command line arguments
   * @param out receives the program's output
   * @param err receives diagnostics
   * @return process exit code
   */
  public static int run(String[] args, PrintStream out, PrintStream err) {
    try {
      Settings.initTLangProperties();
      // Command line options take precedence over system properties
      String inputFilename = processArgs(args, err);
      Settings.validateProperties();
      Logger logger = setupLogging(err);

      String source = readSource(inputFilename, err);
      ExecutionService service = ExecutionService.fromSettings(logger);
      RunResult result;
      try {
        result = service.execute(source);
      } finally {
        service.shutdown();
      }

      out.print(result.getStdout());
      out.flush();
      err.print(result.getStderr());
      err.flush();
      return exitCodeFor(result).code();
    } catch (TLangFatal ex) {
      return ex.exitCode;
    } catch (InvalidOptionException ex) {
      err.println("Error setting up options: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND.code();
    }
  }

  static ExitCode exitCodeFor(RunResult result) {
    if (result.isSuccess()) {
      return ExitCode.SUCCESS;
    } else if (result.getErrorKind() == ErrorKind.INTERNAL_ERROR) {
      return ExitCode.ERROR_INTERNAL;
    } else {
      return ExitCode.ERROR_USER;
    }
  }

  private static Options initOptions() {
    Options opts = new Options();

    opts.addOption(new Option(LOG_FILE_FLAG, "log-file", true,
                              "Write debug log to file"));
    opts.addOption(new Option(TRACE_FLAG, "trace", false,
                              "Log at trace level (with --log-file)"));
    opts.addOption(new Option(MAX_DEPTH_FLAG, "max-depth", true,
                              "Maximum call depth (default 1000)"));
    opts.addOption(new Option(TIMEOUT_FLAG, "timeout", true,
                              "Timeout in milliseconds (default 10000)"));
    return opts;
  }

  /**
   * Parse arguments, recording options in Settings
   * @return input file name
   */
  private static String processArgs(String[] args, PrintStream err) {
    Options opts = initOptions();

    CommandLine cmd;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      err.println(ex.getMessage());
      usage(opts, err);
      throw new TLangFatal(ExitCode.ERROR_COMMAND.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      err.println("Expected one input file, but got "
                  + remainingArgs.length + " arguments");
      usage(opts, err);
      throw new TLangFatal(ExitCode.ERROR_COMMAND.code());
    }

    if (cmd.hasOption(LOG_FILE_FLAG)) {
      Settings.set(Settings.LOG_FILE, cmd.getOptionValue(LOG_FILE_FLAG));
    }
    if (cmd.hasOption(TRACE_FLAG)) {
      Settings.set(Settings.LOG_TRACE, "true");
    }
    if (cmd.hasOption(MAX_DEPTH_FLAG)) {
      Settings.set(Settings.MAX_CALL_DEPTH,
                   cmd.getOptionValue(MAX_DEPTH_FLAG));
    }
    if (cmd.hasOption(TIMEOUT_FLAG)) {
      Settings.set(Settings.TIMEOUT_MS, cmd.getOptionValue(TIMEOUT_FLAG));
    }
    return remainingArgs[0];
  }

  private static Logger setupLogging(PrintStream err) {
    try {
      String logfile = Settings.get(Settings.LOG_FILE);
      boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
      return Logging.setupLogging(logfile, trace);
    } catch (InvalidOptionException ex) {
      err.println("Error setting up logging: " + ex.getMessage());
      throw new TLangFatal(ExitCode.ERROR_COMMAND.code());
    }
  }

  private static String readSource(String filename, PrintStream err) {
    File input = new File(filename);
    if (!input.isFile()) {
      err.println("Error: File not found at '" + filename + "'");
      throw new TLangFatal(ExitCode.ERROR_IO.code());
    }
    try {
      return FileUtils.readFileToString(input, "UTF-8");
    } catch (IOException ex) {
      err.println("Error reading '" + filename + "': " + ex.getMessage());
      throw new TLangFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static void usage(Options opts, PrintStream err) {
    HelpFormatter fmt = new HelpFormatter();
    PrintWriter pw = new PrintWriter(err);
    fmt.printHelp(pw, HelpFormatter.DEFAULT_WIDTH, "tlang <input>", null,
                  opts, HelpFormatter.DEFAULT_LEFT_PAD,
                  HelpFormatter.DEFAULT_DESC_PAD, null, true);
    pw.flush();
  }
}

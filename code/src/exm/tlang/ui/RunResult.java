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

import exm.tlang.common.exceptions.ErrorKind;

/**
 * Outcome of running one program: everything it printed, the diagnostic
 * if it failed, and the exit code (0 on success, -1 on failure).
 */
public class RunResult {
  public static final int FAILURE_EXIT_CODE = -1;

  private final String stdout;
  private final String stderr;
  private final int exitCode;
  /** Null on success */
  private final ErrorKind errorKind;

  private RunResult(String stdout, String stderr, int exitCode,
                    ErrorKind errorKind) {
    this.stdout = stdout;
    this.stderr = stderr;
    this.exitCode = exitCode;
    this.errorKind = errorKind;
  }

  public static RunResult success(String stdout) {
    return new RunResult(stdout, "", 0, null);
  }

  /**
   * @param stdout output produced before the failure
   * @param kind
   * @param message full diagnostic, without trailing newline
   */
  public static RunResult failure(String stdout, ErrorKind kind,
                                  String message) {
    return new RunResult(stdout, message + "\n", FAILURE_EXIT_CODE, kind);
  }

  public String getStdout() {
    return stdout;
  }

  public String getStderr() {
    return stderr;
  }

  public int getExitCode() {
    return exitCode;
  }

  public boolean isSuccess() {
    return exitCode == 0;
  }

  public ErrorKind getErrorKind() {
    return errorKind;
  }

  @Override
  public int hashCode() {
    return (stdout.hashCode() * 31 + stderr.hashCode()) * 31 + exitCode;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof RunResult))
      return false;
    RunResult other = (RunResult)obj;
    return exitCode == other.exitCode && stdout.equals(other.stdout) &&
           stderr.equals(other.stderr);
  }

  @Override
  public String toString() {
    return "{exitCode=" + exitCode + ", stdout=" + stdout + ", stderr="
           + stderr + "}";
  }
}

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
package exm.tlang.common.exceptions;

/**
 * Categories of failure reported to the user.  The display name is the
 * prefix of the diagnostic written to stderr.
 */
public enum ErrorKind {
  LEX_ERROR("LexError"),
  SYNTAX_ERROR("SyntaxError"),
  NAME_ERROR("NameError"),
  TYPE_ERROR("TypeError"),
  INDEX_ERROR("IndexError"),
  DIVISION_BY_ZERO("DivisionByZero"),
  RECURSION_ERROR("RecursionError"),
  RUNTIME_ERROR("RuntimeError"),
  OUTPUT_LIMIT("OutputLimitExceeded"),
  TIMEOUT("Timeout"),
  INTERNAL_ERROR("InternalError");

  private final String displayName;

  ErrorKind(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}

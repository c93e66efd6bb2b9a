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

import exm.tlang.frontend.Context;

/**
 * Represents an error caused by user input
 * Thus, this should contain good error message information
 * */
public class UserException
extends Exception
{
  private final ErrorKind kind;
  private final int line;
  private final String detail;

  public UserException(ErrorKind kind, Context context, String message)
  {
    this(kind, context.getLine(), message);
  }

  public UserException(ErrorKind kind, int line, String message) {
    super(kind.displayName() + ": " + message +
          (line > 0 ? " at line " + line : ""));
    this.kind = kind;
    this.line = line;
    this.detail = message;
  }

  public ErrorKind getKind() {
    return kind;
  }

  /**
   * @return source line, or 0 if unknown
   */
  public int getLine() {
    return line;
  }

  /**
   * @return message without kind prefix or location
   */
  public String getDetail() {
    return detail;
  }

  private static final long serialVersionUID = 1L;
}

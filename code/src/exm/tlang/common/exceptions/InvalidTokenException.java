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
 * Input character that no lexical rule matches
 */
public class InvalidTokenException extends UserException {
  private final int column;

  public InvalidTokenException(int codePoint, int line, int column) {
    super(ErrorKind.LEX_ERROR, 0,
          "Unexpected character: '" + new String(Character.toChars(codePoint))
          + "' at line " + line + ":" + column);
    this.column = column;
  }

  public int getColumn() {
    return column;
  }

  private static final long serialVersionUID = 1L;
}

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
package exm.tlang.ast;

/**
 * A classified lexical unit with its source position.
 * Lines and columns count from 1.
 */
public class Token {
  private final TokenType type;
  private final String text;
  private final int line;
  private final int column;

  public Token(TokenType type, String text, int line, int column) {
    this.type = type;
    this.text = text;
    this.line = line;
    this.column = column;
  }

  public TokenType getType() {
    return type;
  }

  /**
   * @return the matched source text, verbatim
   */
  public String getText() {
    return text;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public String toString() {
    if (text.isEmpty()) {
      return type.toString();
    }
    return type + "(" + text + ")";
  }

  @Override
  public int hashCode() {
    return ((type.hashCode() * 31 + text.hashCode()) * 31 + line) * 31
           + column;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Token))
      return false;
    Token other = (Token) obj;
    return type == other.type && text.equals(other.text) &&
           line == other.line && column == other.column;
  }
}

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
 * Closed set of token kinds produced by the lexer
 */
public enum TokenType {
  // Keywords
  IF, ELSE, WHILE, FOR, DEF, RETURN, PRINT,
  // Type keywords
  INT, FLOAT, BOOL, CHAR, STRING,

  // Literals
  NUMBER, FLOAT_LIT, STRING_LIT, CHAR_LIT, BOOL_LIT,

  ID,

  // Operators
  EQ, NEQ, GTE, LTE, GT, LT, NOT, ASSIGN, PLUS, MINUS, MUL, DIV,

  // Delimiters
  LBRACKET, RBRACKET, LPAREN, RPAREN, LBRACE, RBRACE, SEMI, COMMA,

  EOF;

  public boolean isTypeKeyword() {
    switch (this) {
      case INT:
      case FLOAT:
      case BOOL:
      case CHAR:
      case STRING:
        return true;
      default:
        return false;
    }
  }
}

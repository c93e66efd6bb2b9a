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
package exm.tlang.common.lang;

import java.util.EnumMap;
import java.util.Map;

import exm.tlang.ast.TokenType;

/**
 * This class serves to define details of builtin operators
 */
public class Operators {

  public static enum OpCategory {
    /** + - * / : numeric operands, numeric result */
    ARITHMETIC,
    /** < > <= >= : numeric operands, bool result */
    COMPARISON,
    /** == != : operands of the same type, bool result */
    EQUALITY,
  }

  public static enum BinaryOp {
    PLUS("+", OpCategory.ARITHMETIC),
    MINUS("-", OpCategory.ARITHMETIC),
    MULT("*", OpCategory.ARITHMETIC),
    DIV("/", OpCategory.ARITHMETIC),
    LT("<", OpCategory.COMPARISON),
    GT(">", OpCategory.COMPARISON),
    LTE("<=", OpCategory.COMPARISON),
    GTE(">=", OpCategory.COMPARISON),
    EQ("==", OpCategory.EQUALITY),
    NEQ("!=", OpCategory.EQUALITY);

    private final String symbol;
    private final OpCategory category;

    BinaryOp(String symbol, OpCategory category) {
      this.symbol = symbol;
      this.category = category;
    }

    public String symbol() {
      return symbol;
    }

    public OpCategory category() {
      return category;
    }
  }

  public static enum UnaryOp {
    NOT("!"), NEGATE("-");

    private final String symbol;

    UnaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  /** Map of <token type> -> binary operator */
  private static final Map<TokenType, BinaryOp> binaryOps =
                        new EnumMap<TokenType, BinaryOp>(TokenType.class);

  static {
    binaryOps.put(TokenType.PLUS, BinaryOp.PLUS);
    binaryOps.put(TokenType.MINUS, BinaryOp.MINUS);
    binaryOps.put(TokenType.MUL, BinaryOp.MULT);
    binaryOps.put(TokenType.DIV, BinaryOp.DIV);
    binaryOps.put(TokenType.LT, BinaryOp.LT);
    binaryOps.put(TokenType.GT, BinaryOp.GT);
    binaryOps.put(TokenType.LTE, BinaryOp.LTE);
    binaryOps.put(TokenType.GTE, BinaryOp.GTE);
    binaryOps.put(TokenType.EQ, BinaryOp.EQ);
    binaryOps.put(TokenType.NEQ, BinaryOp.NEQ);
  }

  /**
   * @param tokenType
   * @return the binary operator for the token, or null if not an operator
   */
  public static BinaryOp binaryOpFor(TokenType tokenType) {
    return binaryOps.get(tokenType);
  }

  /**
   * @param tokenType
   * @return the unary operator for the token, or null if not an operator
   */
  public static UnaryOp unaryOpFor(TokenType tokenType) {
    switch (tokenType) {
      case NOT:
        return UnaryOp.NOT;
      case MINUS:
        return UnaryOp.NEGATE;
      default:
        return null;
    }
  }
}

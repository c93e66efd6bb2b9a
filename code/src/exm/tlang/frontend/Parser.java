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
package exm.tlang.frontend;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.tlang.ast.Expr;
import exm.tlang.ast.Expr.ArrayAccess;
import exm.tlang.ast.Expr.ArrayLiteral;
import exm.tlang.ast.Expr.BinOp;
import exm.tlang.ast.Expr.BoolLit;
import exm.tlang.ast.Expr.Call;
import exm.tlang.ast.Expr.CharLit;
import exm.tlang.ast.Expr.FloatLit;
import exm.tlang.ast.Expr.IntLit;
import exm.tlang.ast.Expr.LValue;
import exm.tlang.ast.Expr.StrLit;
import exm.tlang.ast.Expr.UnaryOpExpr;
import exm.tlang.ast.Expr.VarRef;
import exm.tlang.ast.Program;
import exm.tlang.ast.Stmt;
import exm.tlang.ast.Stmt.Assign;
import exm.tlang.ast.Stmt.Block;
import exm.tlang.ast.Stmt.ExprStmt;
import exm.tlang.ast.Stmt.For;
import exm.tlang.ast.Stmt.FuncDef;
import exm.tlang.ast.Stmt.If;
import exm.tlang.ast.Stmt.Param;
import exm.tlang.ast.Stmt.Print;
import exm.tlang.ast.Stmt.Return;
import exm.tlang.ast.Stmt.VarDecl;
import exm.tlang.ast.Stmt.While;
import exm.tlang.ast.Token;
import exm.tlang.ast.TokenType;
import exm.tlang.ast.TypeRef;
import exm.tlang.common.Logging;
import exm.tlang.common.exceptions.InvalidSyntaxException;
import exm.tlang.common.lang.Operators;
import exm.tlang.common.lang.Operators.BinaryOp;
import exm.tlang.common.lang.Operators.UnaryOp;

/**
 * Recursive descent parser building the syntax tree from tokens.
 *
 * Expression precedence, lowest to highest:
 * equality, comparison, term, factor, unary, primary.
 * Parsing stops at the first error.
 */
public class Parser {

  private static final Logger logger = Logging.getTLangLogger();

  private final List<Token> tokens;
  private int pos = 0;

  /**
   * @param tokens lexer output, ending with EOF
   */
  public Parser(List<Token> tokens) {
    this.tokens = tokens;
  }

  public Program parse() throws InvalidSyntaxException {
    List<Stmt> stmts = new ArrayList<Stmt>();
    while (current().getType() != TokenType.EOF) {
      stmts.add(statement());
    }
    logger.debug("Parsed " + stmts.size() + " top-level statements");
    return new Program(stmts);
  }

  private Token current() {
    return peek(0);
  }

  /**
   * Look ahead k tokens without consuming.  Past the end, the
   * final EOF token is returned.
   */
  private Token peek(int k) {
    int i = pos + k;
    if (i < tokens.size()) {
      return tokens.get(i);
    }
    return tokens.get(tokens.size() - 1);
  }

  private Token advance() {
    Token tok = current();
    if (pos < tokens.size()) {
      pos++;
    }
    return tok;
  }

  private boolean check(TokenType type) {
    return current().getType() == type;
  }

  /**
   * Consume current token if it has the expected type
   * @return consumed token
   * @throws InvalidSyntaxException if the type doesn't match
   */
  private Token eat(TokenType type) throws InvalidSyntaxException {
    Token tok = current();
    if (tok.getType() == type) {
      return advance();
    }
    throw new InvalidSyntaxException(tok.getLine(), "Expected token " +
                      type + " but found " + tok.getType());
  }

  private Stmt statement() throws InvalidSyntaxException {
    Token tok = current();
    TokenType type = tok.getType();
    if (type.isTypeKeyword()) {
      return varDecl();
    }
    switch (type) {
      case DEF:
        return funcDef();
      case PRINT:
        return printStmt();
      case RETURN:
        return returnStmt();
      case IF:
        return ifStmt();
      case WHILE:
        return whileStmt();
      case FOR:
        return forStmt();
      case ID: {
        TokenType next = peek(1).getType();
        if (next == TokenType.ASSIGN || next == TokenType.LBRACKET) {
          Assign assign = assignment();
          eat(TokenType.SEMI);
          return assign;
        }
        Call call = call();
        eat(TokenType.SEMI);
        return new ExprStmt(call, call.getLine());
      }
      default:
        throw new InvalidSyntaxException(tok.getLine(), "Unexpected token "
                                      + type + " at start of statement");
    }
  }

  private TypeRef type() throws InvalidSyntaxException {
    Token tok = current();
    if (!tok.getType().isTypeKeyword()) {
      throw new InvalidSyntaxException(tok.getLine(),
              "Expected type but found " + tok.getType());
    }
    advance();
    boolean array = false;
    if (check(TokenType.LBRACKET)) {
      eat(TokenType.LBRACKET);
      eat(TokenType.RBRACKET);
      array = true;
    }
    return new TypeRef(TypeRef.primTypeFor(tok.getType()), array,
                       tok.getLine());
  }

  private VarDecl varDecl() throws InvalidSyntaxException {
    TypeRef type = type();
    Token name = eat(TokenType.ID);
    eat(TokenType.ASSIGN);
    Expr init = expression();
    eat(TokenType.SEMI);
    return new VarDecl(type, name.getText(), init, type.getLine());
  }

  /**
   * Assignment without the trailing semicolon
   */
  private Assign assignment() throws InvalidSyntaxException {
    int line = current().getLine();
    LValue target;
    if (peek(1).getType() == TokenType.LBRACKET) {
      target = arrayAccess();
    } else {
      Token name = eat(TokenType.ID);
      target = new VarRef(name.getText(), name.getLine());
    }
    eat(TokenType.ASSIGN);
    Expr value = expression();
    return new Assign(target, value, line);
  }

  private Print printStmt() throws InvalidSyntaxException {
    int line = eat(TokenType.PRINT).getLine();
    eat(TokenType.LPAREN);
    Expr value = expression();
    eat(TokenType.RPAREN);
    eat(TokenType.SEMI);
    return new Print(value, line);
  }

  private Return returnStmt() throws InvalidSyntaxException {
    int line = eat(TokenType.RETURN).getLine();
    Expr value = expression();
    eat(TokenType.SEMI);
    return new Return(value, line);
  }

  private If ifStmt() throws InvalidSyntaxException {
    int line = eat(TokenType.IF).getLine();
    eat(TokenType.LPAREN);
    Expr condition = expression();
    eat(TokenType.RPAREN);
    Block thenBlock = block();
    Block elseBlock = null;
    if (check(TokenType.ELSE)) {
      eat(TokenType.ELSE);
      elseBlock = block();
    }
    return new If(condition, thenBlock, elseBlock, line);
  }

  private While whileStmt() throws InvalidSyntaxException {
    int line = eat(TokenType.WHILE).getLine();
    eat(TokenType.LPAREN);
    Expr condition = expression();
    eat(TokenType.RPAREN);
    return new While(condition, block(), line);
  }

  /**
   * for (init; cond; update) { ... }
   * The init clause is a full statement including its semicolon,
   * the update clause an assignment without one.
   */
  private For forStmt() throws InvalidSyntaxException {
    int line = eat(TokenType.FOR).getLine();
    eat(TokenType.LPAREN);

    Stmt init;
    if (current().getType().isTypeKeyword()) {
      init = varDecl();
    } else {
      init = assignment();
      eat(TokenType.SEMI);
    }

    Expr condition = expression();
    eat(TokenType.SEMI);

    Assign update = assignment();
    eat(TokenType.RPAREN);
    Block body = block();
    return new For(init, condition, update, body, line);
  }

  private Block block() throws InvalidSyntaxException {
    int line = eat(TokenType.LBRACE).getLine();
    List<Stmt> stmts = new ArrayList<Stmt>();
    while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
      stmts.add(statement());
    }
    eat(TokenType.RBRACE);
    return new Block(stmts, line);
  }

  private FuncDef funcDef() throws InvalidSyntaxException {
    eat(TokenType.DEF);
    TypeRef returnType = type();
    Token name = eat(TokenType.ID);
    eat(TokenType.LPAREN);
    List<Param> params = new ArrayList<Param>();
    if (!check(TokenType.RPAREN)) {
      params.add(param());
      while (check(TokenType.COMMA)) {
        eat(TokenType.COMMA);
        params.add(param());
      }
    }
    eat(TokenType.RPAREN);
    Block body = block();
    return new FuncDef(returnType, name.getText(), params, body,
                       name.getLine());
  }

  private Param param() throws InvalidSyntaxException {
    TypeRef type = type();
    Token name = eat(TokenType.ID);
    return new Param(type, name.getText());
  }

  public Expr expression() throws InvalidSyntaxException {
    return equality();
  }

  private Expr equality() throws InvalidSyntaxException {
    Expr node = comparison();
    while (check(TokenType.EQ) || check(TokenType.NEQ)) {
      Token op = advance();
      node = binOp(op, node, comparison());
    }
    return node;
  }

  private Expr comparison() throws InvalidSyntaxException {
    Expr node = term();
    while (check(TokenType.LT) || check(TokenType.GT) ||
           check(TokenType.LTE) || check(TokenType.GTE)) {
      Token op = advance();
      node = binOp(op, node, term());
    }
    return node;
  }

  private Expr term() throws InvalidSyntaxException {
    Expr node = factor();
    while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
      Token op = advance();
      node = binOp(op, node, factor());
    }
    return node;
  }

  private Expr factor() throws InvalidSyntaxException {
    Expr node = unary();
    while (check(TokenType.MUL) || check(TokenType.DIV)) {
      Token op = advance();
      node = binOp(op, node, unary());
    }
    return node;
  }

  private Expr binOp(Token opTok, Expr left, Expr right) {
    BinaryOp op = Operators.binaryOpFor(opTok.getType());
    assert(op != null) : opTok;
    return new BinOp(op, left, right, opTok.getLine());
  }

  private Expr unary() throws InvalidSyntaxException {
    Token tok = current();
    if (tok.getType() == TokenType.NOT || tok.getType() == TokenType.MINUS) {
      advance();
      UnaryOp op = Operators.unaryOpFor(tok.getType());
      return new UnaryOpExpr(op, unary(), tok.getLine());
    }
    return primary();
  }

  private Expr primary() throws InvalidSyntaxException {
    Token tok = current();
    switch (tok.getType()) {
      case FLOAT_LIT:
        advance();
        return new FloatLit(Double.parseDouble(tok.getText()), tok.getLine());
      case STRING_LIT: {
        advance();
        String text = tok.getText();
        return new StrLit(text.substring(1, text.length() - 1), tok.getLine());
      }
      case BOOL_LIT:
        advance();
        return new BoolLit(tok.getText().equals("true"), tok.getLine());
      case CHAR_LIT: {
        advance();
        String text = tok.getText();
        return new CharLit(text.substring(1, text.length() - 1), tok.getLine());
      }
      case NUMBER:
        advance();
        return new IntLit(parseInt(tok), tok.getLine());
      case ID: {
        TokenType next = peek(1).getType();
        if (next == TokenType.LPAREN) {
          return call();
        } else if (next == TokenType.LBRACKET) {
          return arrayAccess();
        }
        advance();
        return new VarRef(tok.getText(), tok.getLine());
      }
      case LPAREN: {
        eat(TokenType.LPAREN);
        Expr inner = expression();
        eat(TokenType.RPAREN);
        return inner;
      }
      case LBRACE:
        return arrayLiteral();
      default:
        throw new InvalidSyntaxException(tok.getLine(),
              "Unexpected token in expression: " + tok.getType());
    }
  }

  private long parseInt(Token tok) throws InvalidSyntaxException {
    try {
      return Long.parseLong(tok.getText());
    } catch (NumberFormatException e) {
      throw new InvalidSyntaxException(tok.getLine(),
              "Integer literal out of range: " + tok.getText());
    }
  }

  private Call call() throws InvalidSyntaxException {
    Token name = eat(TokenType.ID);
    eat(TokenType.LPAREN);
    List<Expr> args = new ArrayList<Expr>();
    if (!check(TokenType.RPAREN)) {
      args.add(expression());
      while (check(TokenType.COMMA)) {
        eat(TokenType.COMMA);
        args.add(expression());
      }
    }
    eat(TokenType.RPAREN);
    return new Call(name.getText(), args, name.getLine());
  }

  private ArrayLiteral arrayLiteral() throws InvalidSyntaxException {
    int line = eat(TokenType.LBRACE).getLine();
    List<Expr> elems = new ArrayList<Expr>();
    if (!check(TokenType.RBRACE)) {
      elems.add(expression());
      while (check(TokenType.COMMA)) {
        eat(TokenType.COMMA);
        elems.add(expression());
      }
    }
    eat(TokenType.RBRACE);
    return new ArrayLiteral(elems, line);
  }

  private ArrayAccess arrayAccess() throws InvalidSyntaxException {
    Token name = eat(TokenType.ID);
    eat(TokenType.LBRACKET);
    Expr index = expression();
    eat(TokenType.RBRACKET);
    return new ArrayAccess(name.getText(), index, name.getLine());
  }
}

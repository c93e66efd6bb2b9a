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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.tlang.ast.Expr.Call;
import exm.tlang.ast.Expr.LValue;
import exm.tlang.common.exceptions.UserException;

/**
 * Statement nodes, plus blocks.
 */
public abstract class Stmt extends Node {

  protected Stmt(int line) {
    super(line);
  }

  public abstract <R> R accept(Visitor<R> visitor) throws UserException;

  public static interface Visitor<R> {
    R visitBlock(Block stmt) throws UserException;
    R visitVarDecl(VarDecl stmt) throws UserException;
    R visitAssign(Assign stmt) throws UserException;
    R visitPrint(Print stmt) throws UserException;
    R visitIf(If stmt) throws UserException;
    R visitWhile(While stmt) throws UserException;
    R visitFor(For stmt) throws UserException;
    R visitFuncDef(FuncDef stmt) throws UserException;
    R visitReturn(Return stmt) throws UserException;
    R visitExprStmt(ExprStmt stmt) throws UserException;
  }

  /**
   * Brace-delimited statement list; opens a new scope
   */
  public static class Block extends Stmt {
    private final ImmutableList<Stmt> stmts;

    public Block(List<Stmt> stmts, int line) {
      super(line);
      this.stmts = ImmutableList.copyOf(stmts);
    }

    public List<Stmt> stmts() {
      return stmts;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitBlock(this);
    }
  }

  public static class VarDecl extends Stmt {
    private final TypeRef type;
    private final String name;
    private final Expr init;

    public VarDecl(TypeRef type, String name, Expr init, int line) {
      super(line);
      this.type = type;
      this.name = name;
      this.init = init;
    }

    public TypeRef type() {
      return type;
    }

    public String name() {
      return name;
    }

    public Expr init() {
      return init;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitVarDecl(this);
    }
  }

  public static class Assign extends Stmt {
    private final LValue target;
    private final Expr value;

    public Assign(LValue target, Expr value, int line) {
      super(line);
      this.target = target;
      this.value = value;
    }

    public LValue target() {
      return target;
    }

    public Expr value() {
      return value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitAssign(this);
    }
  }

  public static class Print extends Stmt {
    private final Expr expr;

    public Print(Expr expr, int line) {
      super(line);
      this.expr = expr;
    }

    public Expr expr() {
      return expr;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitPrint(this);
    }
  }

  public static class If extends Stmt {
    private final Expr condition;
    private final Block thenBlock;
    private final Block elseBlock;

    public If(Expr condition, Block thenBlock, Block elseBlock, int line) {
      super(line);
      this.condition = condition;
      this.thenBlock = thenBlock;
      this.elseBlock = elseBlock;
    }

    public Expr condition() {
      return condition;
    }

    public Block thenBlock() {
      return thenBlock;
    }

    /**
     * @return else block, or null if none
     */
    public Block elseBlock() {
      return elseBlock;
    }

    public boolean hasElse() {
      return elseBlock != null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitIf(this);
    }
  }

  public static class While extends Stmt {
    private final Expr condition;
    private final Block body;

    public While(Expr condition, Block body, int line) {
      super(line);
      this.condition = condition;
      this.body = body;
    }

    public Expr condition() {
      return condition;
    }

    public Block body() {
      return body;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitWhile(this);
    }
  }

  public static class For extends Stmt {
    /** VarDecl or Assign */
    private final Stmt init;
    private final Expr condition;
    private final Assign update;
    private final Block body;

    public For(Stmt init, Expr condition, Assign update, Block body,
               int line) {
      super(line);
      this.init = init;
      this.condition = condition;
      this.update = update;
      this.body = body;
    }

    public Stmt init() {
      return init;
    }

    public Expr condition() {
      return condition;
    }

    public Assign update() {
      return update;
    }

    public Block body() {
      return body;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitFor(this);
    }
  }

  public static class FuncDef extends Stmt {
    private final TypeRef returnType;
    private final String name;
    private final ImmutableList<Param> params;
    private final Block body;

    public FuncDef(TypeRef returnType, String name, List<Param> params,
                   Block body, int line) {
      super(line);
      this.returnType = returnType;
      this.name = name;
      this.params = ImmutableList.copyOf(params);
      this.body = body;
    }

    public TypeRef returnType() {
      return returnType;
    }

    public String name() {
      return name;
    }

    public List<Param> params() {
      return params;
    }

    public Block body() {
      return body;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitFuncDef(this);
    }
  }

  public static class Param {
    private final TypeRef type;
    private final String name;

    public Param(TypeRef type, String name) {
      this.type = type;
      this.name = name;
    }

    public TypeRef type() {
      return type;
    }

    public String name() {
      return name;
    }

    @Override
    public String toString() {
      return type + " " + name;
    }
  }

  public static class Return extends Stmt {
    private final Expr value;

    public Return(Expr value, int line) {
      super(line);
      this.value = value;
    }

    public Expr value() {
      return value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitReturn(this);
    }
  }

  /**
   * Function call evaluated for its side effects
   */
  public static class ExprStmt extends Stmt {
    private final Call call;

    public ExprStmt(Call call, int line) {
      super(line);
      this.call = call;
    }

    public Call call() {
      return call;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitExprStmt(this);
    }
  }
}

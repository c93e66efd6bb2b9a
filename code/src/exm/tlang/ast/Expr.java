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

import exm.tlang.common.exceptions.UserException;
import exm.tlang.common.lang.Operators.BinaryOp;
import exm.tlang.common.lang.Operators.UnaryOp;

/**
 * Expression nodes.  The set of node kinds is closed: every pass
 * implements {@link Visitor}, so a new kind must be handled everywhere.
 */
public abstract class Expr extends Node {

  protected Expr(int line) {
    super(line);
  }

  public abstract <R> R accept(Visitor<R> visitor) throws UserException;

  public static interface Visitor<R> {
    R visitBinOp(BinOp expr) throws UserException;
    R visitUnaryOp(UnaryOpExpr expr) throws UserException;
    R visitCall(Call expr) throws UserException;
    R visitIntLit(IntLit expr) throws UserException;
    R visitFloatLit(FloatLit expr) throws UserException;
    R visitStrLit(StrLit expr) throws UserException;
    R visitCharLit(CharLit expr) throws UserException;
    R visitBoolLit(BoolLit expr) throws UserException;
    R visitVar(VarRef expr) throws UserException;
    R visitArrayLiteral(ArrayLiteral expr) throws UserException;
    R visitArrayAccess(ArrayAccess expr) throws UserException;
  }

  /**
   * Something that can be assigned to: a variable or an array element
   */
  public static interface LValue {
    /**
     * @return name of variable being assigned, or of the array
     */
    String name();

    Expr asExpr();
  }

  public static class BinOp extends Expr {
    private final BinaryOp op;
    private final Expr left;
    private final Expr right;

    public BinOp(BinaryOp op, Expr left, Expr right, int line) {
      super(line);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    public BinaryOp op() {
      return op;
    }

    public Expr left() {
      return left;
    }

    public Expr right() {
      return right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitBinOp(this);
    }

    @Override
    public String toString() {
      return "(" + left + " " + op.symbol() + " " + right + ")";
    }
  }

  public static class UnaryOpExpr extends Expr {
    private final UnaryOp op;
    private final Expr operand;

    public UnaryOpExpr(UnaryOp op, Expr operand, int line) {
      super(line);
      this.op = op;
      this.operand = operand;
    }

    public UnaryOp op() {
      return op;
    }

    public Expr operand() {
      return operand;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitUnaryOp(this);
    }

    @Override
    public String toString() {
      return "(" + op.symbol() + operand + ")";
    }
  }

  public static class Call extends Expr {
    private final String function;
    private final ImmutableList<Expr> args;

    public Call(String function, List<Expr> args, int line) {
      super(line);
      this.function = function;
      this.args = ImmutableList.copyOf(args);
    }

    public String function() {
      return function;
    }

    public List<Expr> args() {
      return args;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitCall(this);
    }

    @Override
    public String toString() {
      return function + args.toString().replace('[', '(').replace(']', ')');
    }
  }

  public static class IntLit extends Expr {
    private final long value;

    public IntLit(long value, int line) {
      super(line);
      this.value = value;
    }

    public long value() {
      return value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitIntLit(this);
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  public static class FloatLit extends Expr {
    private final double value;

    public FloatLit(double value, int line) {
      super(line);
      this.value = value;
    }

    public double value() {
      return value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitFloatLit(this);
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  public static class StrLit extends Expr {
    /** Text between the quotes, unprocessed */
    private final String value;

    public StrLit(String value, int line) {
      super(line);
      this.value = value;
    }

    public String value() {
      return value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitStrLit(this);
    }

    @Override
    public String toString() {
      return '"' + value + '"';
    }
  }

  /**
   * A single character, held as a string since one code point outside
   * the Basic Multilingual Plane takes two Java chars
   */
  public static class CharLit extends Expr {
    private final String value;

    public CharLit(String value, int line) {
      super(line);
      this.value = value;
    }

    public String value() {
      return value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitCharLit(this);
    }

    @Override
    public String toString() {
      return "'" + value + "'";
    }
  }

  public static class BoolLit extends Expr {
    private final boolean value;

    public BoolLit(boolean value, int line) {
      super(line);
      this.value = value;
    }

    public boolean value() {
      return value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitBoolLit(this);
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  public static class VarRef extends Expr implements LValue {
    private final String name;

    public VarRef(String name, int line) {
      super(line);
      this.name = name;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Expr asExpr() {
      return this;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitVar(this);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static class ArrayLiteral extends Expr {
    private final ImmutableList<Expr> elems;

    public ArrayLiteral(List<Expr> elems, int line) {
      super(line);
      this.elems = ImmutableList.copyOf(elems);
    }

    public List<Expr> elems() {
      return elems;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitArrayLiteral(this);
    }

    @Override
    public String toString() {
      return elems.toString().replace('[', '{').replace(']', '}');
    }
  }

  public static class ArrayAccess extends Expr implements LValue {
    private final String array;
    private final Expr index;

    public ArrayAccess(String array, Expr index, int line) {
      super(line);
      this.array = array;
      this.index = index;
    }

    @Override
    public String name() {
      return array;
    }

    public Expr index() {
      return index;
    }

    @Override
    public Expr asExpr() {
      return this;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws UserException {
      return visitor.visitArrayAccess(this);
    }

    @Override
    public String toString() {
      return array + "[" + index + "]";
    }
  }
}

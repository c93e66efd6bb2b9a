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

import java.util.IdentityHashMap;
import java.util.List;

import exm.tlang.ast.Expr;
import exm.tlang.ast.Expr.ArrayAccess;
import exm.tlang.ast.Expr.ArrayLiteral;
import exm.tlang.ast.Expr.BinOp;
import exm.tlang.ast.Expr.BoolLit;
import exm.tlang.ast.Expr.Call;
import exm.tlang.ast.Expr.CharLit;
import exm.tlang.ast.Expr.FloatLit;
import exm.tlang.ast.Expr.IntLit;
import exm.tlang.ast.Expr.StrLit;
import exm.tlang.ast.Expr.UnaryOpExpr;
import exm.tlang.ast.Expr.VarRef;
import exm.tlang.common.exceptions.TLangRuntimeError;
import exm.tlang.common.exceptions.TypeMismatchException;
import exm.tlang.common.exceptions.UndefinedFunctionException;
import exm.tlang.common.exceptions.UndefinedVarError;
import exm.tlang.common.exceptions.UserException;
import exm.tlang.common.lang.FunctionSymbol;
import exm.tlang.common.lang.Operators.BinaryOp;
import exm.tlang.common.lang.Types;
import exm.tlang.common.lang.Types.ArrayType;
import exm.tlang.common.lang.Types.Type;
import exm.tlang.common.lang.Var;

/**
 * This module handles checking the internal consistency of expressions,
 * and inferring the types of expressions, bottom up.
 */
public class TypeChecker implements Expr.Visitor<Type> {

  /** Every expression checked so far, with its type */
  private final IdentityHashMap<Expr, Type> exprTypes =
                                  new IdentityHashMap<Expr, Type>();

  /** Scope of expression currently being checked */
  private Context context;

  /**
   * Determine the type of an expression. If the expression is valid,
   * then this will return the type of the expression. If it is invalid,
   * it will throw an exception.
   *
   * @param context
   *          the scope in which the expression resides
   * @param expr
   *          the expression tree
   * @return expression type
   * @throws UserException
   */
  public Type findExprType(Context context, Expr expr) throws UserException {
    Context saved = this.context;
    this.context = context;
    try {
      return check(expr);
    } finally {
      this.context = saved;
    }
  }

  IdentityHashMap<Expr, Type> getExprTypes() {
    return exprTypes;
  }

  private Type check(Expr expr) throws UserException {
    Type cached = exprTypes.get(expr);
    if (cached != null) {
      return cached;
    }
    context.syncLine(expr);
    Type t = expr.accept(this);
    exprTypes.put(expr, t);
    LogHelper.trace(context, "Expr " + expr + " has type " + t);
    return t;
  }

  @Override
  public Type visitBinOp(BinOp expr) throws UserException {
    Type left = check(expr.left());
    Type right = check(expr.right());
    context.syncLine(expr);
    BinaryOp op = expr.op();
    switch (op.category()) {
      case ARITHMETIC:
        if (!left.isNumeric() || !right.isNumeric()) {
          throw new TypeMismatchException(context, "Unsupported operand "
              + "types for arithmetic '" + op.symbol() + "': '" + left
              + "' and '" + right + "'");
        }
        return Types.numericResult(left, right);
      case COMPARISON:
        if (!left.isNumeric() || !right.isNumeric()) {
          throw new TypeMismatchException(context, "Unsupported operand "
              + "types for comparison '" + op.symbol() + "': '" + left
              + "' and '" + right + "'");
        }
        return Types.BOOL;
      case EQUALITY:
        if (!left.equals(right)) {
          throw new TypeMismatchException(context, "Cannot compare "
              + left + " and " + right + " for equality");
        }
        return Types.BOOL;
      default:
        throw new TLangRuntimeError("Unknown operator category: " + op);
    }
  }

  @Override
  public Type visitUnaryOp(UnaryOpExpr expr) throws UserException {
    Type operand = check(expr.operand());
    context.syncLine(expr);
    switch (expr.op()) {
      case NOT:
        if (operand.equals(Types.BOOL)) {
          return Types.BOOL;
        }
        break;
      case NEGATE:
        if (operand.isNumeric()) {
          return operand;
        }
        break;
      default:
        throw new TLangRuntimeError("Unknown unary operator: " + expr.op());
    }
    throw new TypeMismatchException(context, "Unsupported unary operator '"
              + expr.op().symbol() + "' for type " + operand);
  }

  @Override
  public Type visitCall(Call expr) throws UserException {
    FunctionSymbol fn = context.lookupFunction(expr.function());
    if (fn == null) {
      throw UndefinedFunctionException.unknownFunction(context,
                                                       expr.function());
    }

    List<Var> params = fn.params();
    List<Expr> args = expr.args();
    if (params.size() != args.size()) {
      throw new TypeMismatchException(context, "Function '" + fn.name()
          + "' expects " + params.size() + " argument(s) but got "
          + args.size());
    }
    for (int i = 0; i < args.size(); i++) {
      Type argType = check(args.get(i));
      Type paramType = params.get(i).type();
      if (!argType.assignableTo(paramType)) {
        context.syncLine(expr);
        throw new TypeMismatchException(context, "Argument " + (i + 1)
            + " of '" + fn.name() + "' should be " + paramType
            + " but was " + argType);
      }
    }
    return fn.returnType();
  }

  @Override
  public Type visitIntLit(IntLit expr) {
    return Types.INT;
  }

  @Override
  public Type visitFloatLit(FloatLit expr) {
    return Types.FLOAT;
  }

  @Override
  public Type visitStrLit(StrLit expr) {
    return Types.STRING;
  }

  @Override
  public Type visitCharLit(CharLit expr) {
    return Types.CHAR;
  }

  @Override
  public Type visitBoolLit(BoolLit expr) {
    return Types.BOOL;
  }

  @Override
  public Type visitVar(VarRef expr) throws UndefinedVarError {
    return context.lookupVarUser(expr.name()).type();
  }

  @Override
  public Type visitArrayLiteral(ArrayLiteral expr) throws UserException {
    List<Expr> elems = expr.elems();
    if (elems.isEmpty()) {
      return Types.EMPTY_ARRAY;
    }
    Type first = check(elems.get(0));
    for (Expr elem: elems.subList(1, elems.size())) {
      Type t = check(elem);
      if (!t.equals(first)) {
        context.syncLine(expr);
        throw new TypeMismatchException(context, "Array elements must "
            + "all be of the same type, but found " + first + " and " + t);
      }
    }
    return new ArrayType(first);
  }

  @Override
  public Type visitArrayAccess(ArrayAccess expr) throws UserException {
    Var array = context.lookupVarUnsafe(expr.name());
    if (array == null) {
      throw new UndefinedVarError(context, "Array '" + expr.name()
                                  + "' is not defined");
    }
    if (!array.type().isArray()) {
      throw new TypeMismatchException(context, "'" + expr.name()
            + "' is not an array and cannot be indexed");
    }
    Type indexType = check(expr.index());
    if (!indexType.equals(Types.INT)) {
      context.syncLine(expr);
      throw new TypeMismatchException(context, "Array index must be an "
          + "integer, but got " + indexType);
    }
    return array.type().asArray().memberType();
  }
}

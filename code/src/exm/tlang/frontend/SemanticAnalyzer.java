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
import exm.tlang.ast.Expr.LValue;
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
import exm.tlang.common.exceptions.InvalidSyntaxException;
import exm.tlang.common.exceptions.TypeMismatchException;
import exm.tlang.common.exceptions.UserException;
import exm.tlang.common.lang.FunctionSymbol;
import exm.tlang.common.lang.Types;
import exm.tlang.common.lang.Types.Type;
import exm.tlang.common.lang.Var;

/**
 * This class walks the syntax tree of a program, checking scoping and
 * typing rules before anything is executed.  The first violation found
 * is thrown as a {@link UserException} and aborts the walk.
 *
 * A new context is opened for the program, for every block, for every
 * for loop header and for every function parameter list.  Function
 * parameter contexts hang off the global context, never off the scope
 * where the definition appears.
 */
public class SemanticAnalyzer implements Stmt.Visitor<Void> {

  private final Logger logger;

  private final TypeChecker typeChecker = new TypeChecker();

  private GlobalContext globals;

  /** Innermost open scope */
  private Context context;

  public SemanticAnalyzer(Logger logger) {
    this.logger = logger;
  }

  /**
   * Check a whole program.
   * @param program
   * @return types of all expressions and the function table
   * @throws UserException on the first semantic error
   */
  public Analysis analyze(Program program) throws UserException {
    globals = new GlobalContext(logger);
    context = globals;
    for (Stmt stmt: program.stmts()) {
      walk(stmt);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Analysis finished: " + globals.getFunctions().size() +
          " function(s), " + globals.getScopeVariables().size() +
          " global(s)");
    }
    return new Analysis(typeChecker.getExprTypes(), globals.getFunctions());
  }

  private void walk(Stmt stmt) throws UserException {
    context.syncLine(stmt);
    stmt.accept(this);
  }

  private Type exprType(Expr expr) throws UserException {
    return typeChecker.findExprType(context, expr);
  }

  /**
   * Run body in a child context of the current one
   */
  private void enterScope(Context child) {
    LogHelper.trace(child, "enter scope <level " + child.getLevel() + ">");
    context = child;
  }

  private void exitScope(Context saved) {
    LogHelper.trace(context, "exit scope");
    context = saved;
  }

  @Override
  public Void visitBlock(Block block) throws UserException {
    Context saved = context;
    enterScope(LocalContext.blockContext(context));
    try {
      for (Stmt stmt: block.stmts()) {
        walk(stmt);
      }
    } finally {
      exitScope(saved);
    }
    return null;
  }

  @Override
  public Void visitVarDecl(VarDecl decl) throws UserException {
    Type declared = decl.type().toType();
    Type initType = exprType(decl.init());
    context.syncLine(decl);
    if (!initType.assignableTo(declared)) {
      throw new TypeMismatchException(context, "Type mismatch: cannot assign "
            + initType + " to '" + decl.name() + "' of type " + declared);
    }
    // Declared after the initializer is checked: int x = x; is an error
    context.declareVariable(declared, decl.name());
    LogHelper.trace(context, "declared " + declared + " " + decl.name());
    return null;
  }

  @Override
  public Void visitAssign(Assign assign) throws UserException {
    LValue target = assign.target();
    Type targetType = exprType(target.asExpr());
    Type valueType = exprType(assign.value());
    if (!valueType.equals(targetType)) {
      context.syncLine(assign);
      throw new TypeMismatchException(context, "Type mismatch in "
          + "assignment: cannot assign " + valueType + " to "
          + describeTarget(target) + " of type " + targetType);
    }
    return null;
  }

  private static String describeTarget(LValue target) {
    if (target instanceof ArrayAccess) {
      return "element of '" + target.name() + "'";
    }
    return "'" + target.name() + "'";
  }

  @Override
  public Void visitPrint(Print print) throws UserException {
    exprType(print.expr());
    return null;
  }

  @Override
  public Void visitIf(If stmt) throws UserException {
    checkCondition("If statement", stmt.condition());
    walk(stmt.thenBlock());
    if (stmt.hasElse()) {
      walk(stmt.elseBlock());
    }
    return null;
  }

  @Override
  public Void visitWhile(While loop) throws UserException {
    checkCondition("While loop", loop.condition());
    walk(loop.body());
    return null;
  }

  @Override
  public Void visitFor(For loop) throws UserException {
    Context saved = context;
    // Loop variable lives in its own scope around the body
    enterScope(LocalContext.blockContext(context));
    try {
      walk(loop.init());
      checkCondition("For loop", loop.condition());
      walk(loop.update());
      walk(loop.body());
    } finally {
      exitScope(saved);
    }
    return null;
  }

  private void checkCondition(String construct, Expr condition)
      throws UserException {
    Type t = exprType(condition);
    if (!t.equals(Types.BOOL)) {
      context.syncLine(condition);
      throw new TypeMismatchException(context, construct + " condition "
          + "must be a boolean, but got " + t);
    }
  }

  @Override
  public Void visitFuncDef(FuncDef def) throws UserException {
    List<Var> params = new ArrayList<Var>(def.params().size());
    for (Param p: def.params()) {
      params.add(new Var(p.name(), p.type().toType(), def.getLine()));
    }
    FunctionSymbol fn = new FunctionSymbol(def.name(),
                        def.returnType().toType(), params, def);
    // Defined before body is checked so the body can recurse
    globals.defineFunction(fn);
    LogHelper.debug(context, "function " + fn);

    Context saved = context;
    LocalContext fnContext = LocalContext.fnContext(globals, fn);
    fnContext.syncLine(def);
    enterScope(fnContext);
    try {
      for (Var param: params) {
        context.declareVariable(param.type(), param.name());
      }
      walk(def.body());
    } finally {
      exitScope(saved);
    }
    return null;
  }

  @Override
  public Void visitReturn(Return ret) throws UserException {
    Type valueType = exprType(ret.value());
    context.syncLine(ret);
    FunctionContext fc = context.getFunctionContext();
    if (fc == null) {
      throw new InvalidSyntaxException(context,
                  "Return statement found outside of a function");
    }
    if (!valueType.assignableTo(fc.getReturnType())) {
      throw new TypeMismatchException(context, "Type mismatch: function '"
          + fc.getFunctionName() + "' should return " + fc.getReturnType()
          + ", but returns " + valueType);
    }
    return null;
  }

  @Override
  public Void visitExprStmt(ExprStmt stmt) throws UserException {
    exprType(stmt.call());
    return null;
  }
}

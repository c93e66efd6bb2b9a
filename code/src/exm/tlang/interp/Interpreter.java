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
package exm.tlang.interp;

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
import exm.tlang.ast.Stmt.Print;
import exm.tlang.ast.Stmt.Return;
import exm.tlang.ast.Stmt.VarDecl;
import exm.tlang.ast.Stmt.While;
import exm.tlang.common.exceptions.DivisionByZeroException;
import exm.tlang.common.exceptions.MissingReturnException;
import exm.tlang.common.exceptions.RecursionDepthException;
import exm.tlang.common.exceptions.TLangRuntimeError;
import exm.tlang.common.exceptions.TimeoutException;
import exm.tlang.common.exceptions.UserException;
import exm.tlang.common.lang.FunctionSymbol;
import exm.tlang.common.lang.Operators.BinaryOp;
import exm.tlang.common.lang.Var;
import exm.tlang.common.util.StackLite;
import exm.tlang.frontend.Analysis;

/**
 * Tree-walking evaluator for analyzed programs.
 *
 * Statements evaluate to an {@link ExecResult}: a return inside a function
 * body comes back up through the enclosing blocks and loops as a value
 * rather than unwinding with an exception.  Expressions evaluate to
 * run-time values as described in {@link Values}.
 *
 * An instance runs one program once; it is not thread-safe.
 */
public class Interpreter implements Stmt.Visitor<ExecResult>,
                                    Expr.Visitor<Object> {

  private final Logger logger;

  private final Analysis analysis;

  private final OutputBuffer output;

  private final int maxCallDepth;

  private final Environment globals = new Environment();

  /** Current innermost frame */
  private Environment env = globals;

  /** Names of active functions, innermost last */
  private final StackLite<String> callStack = new StackLite<String>();

  public Interpreter(Logger logger, Analysis analysis, OutputBuffer output,
                     int maxCallDepth) {
    this.logger = logger;
    this.analysis = analysis;
    this.output = output;
    this.maxCallDepth = maxCallDepth;
  }

  /**
   * Run a program from its first statement.  Output printed before a
   * failure stays in the output buffer.
   * @param program
   * @throws UserException on the first run-time error
   */
  public void execute(Program program) throws UserException {
    logger.debug("Executing " + program.stmts().size() + " statement(s)");
    for (Stmt stmt: program.stmts()) {
      ExecResult res = exec(stmt);
      if (res.isReturn()) {
        // Analyzer rejects return outside functions
        throw new TLangRuntimeError("return at top level, line "
                                    + stmt.getLine());
      }
    }
    logger.debug("Execution finished, " + output.byteCount()
                 + " bytes of output");
  }

  public Environment getGlobals() {
    return globals;
  }

  private ExecResult exec(Stmt stmt) throws UserException {
    return stmt.accept(this);
  }

  private Object eval(Expr expr) throws UserException {
    return expr.accept(this);
  }

  /**
   * Stop if the thread running us was interrupted, e.g. on timeout
   */
  private void checkInterrupted(int line) throws TimeoutException {
    if (Thread.interrupted()) {
      String fn = callStack.peekOrNull();
      throw new TimeoutException(line, "Execution interrupted" +
                    (fn != null ? " in function '" + fn + "'" : ""));
    }
  }

  /**
   * Execute statements in a fresh frame nested in the current one
   */
  private ExecResult execBlock(List<Stmt> stmts, Environment frame)
      throws UserException {
    Environment saved = env;
    env = frame;
    try {
      for (Stmt stmt: stmts) {
        ExecResult res = exec(stmt);
        if (res.isReturn()) {
          return res;
        }
      }
      return ExecResult.NORMAL;
    } finally {
      env = saved;
    }
  }

  @Override
  public ExecResult visitBlock(Block block) throws UserException {
    return execBlock(block.stmts(), new Environment(env));
  }

  @Override
  public ExecResult visitVarDecl(VarDecl decl) throws UserException {
    Object value = eval(decl.init());
    env.define(decl.name(), value);
    return ExecResult.NORMAL;
  }

  @Override
  public ExecResult visitAssign(Assign assign) throws UserException {
    Object value = eval(assign.value());
    LValue target = assign.target();
    if (target instanceof ArrayAccess) {
      ArrayAccess elem = (ArrayAccess)target;
      ArrayValue array = (ArrayValue)env.get(elem.name());
      long index = Values.toLong(eval(elem.index()));
      array.set(index, value, assign.getLine());
    } else {
      env.assign(target.name(), value);
    }
    return ExecResult.NORMAL;
  }

  @Override
  public ExecResult visitPrint(Print print) throws UserException {
    Object value = eval(print.expr());
    output.println(Values.format(value), print.getLine());
    return ExecResult.NORMAL;
  }

  @Override
  public ExecResult visitIf(If stmt) throws UserException {
    if (Values.toBoolean(eval(stmt.condition()))) {
      return exec(stmt.thenBlock());
    } else if (stmt.hasElse()) {
      return exec(stmt.elseBlock());
    }
    return ExecResult.NORMAL;
  }

  @Override
  public ExecResult visitWhile(While loop) throws UserException {
    while (true) {
      checkInterrupted(loop.getLine());
      if (!Values.toBoolean(eval(loop.condition()))) {
        break;
      }
      ExecResult res = exec(loop.body());
      if (res.isReturn()) {
        return res;
      }
    }
    return ExecResult.NORMAL;
  }

  @Override
  public ExecResult visitFor(For loop) throws UserException {
    Environment saved = env;
    // Frame for the init variable, kept across iterations
    env = new Environment(env);
    try {
      exec(loop.init());
      while (true) {
        checkInterrupted(loop.getLine());
        if (!Values.toBoolean(eval(loop.condition()))) {
          break;
        }
        ExecResult res = exec(loop.body());
        if (res.isReturn()) {
          return res;
        }
        exec(loop.update());
      }
      return ExecResult.NORMAL;
    } finally {
      env = saved;
    }
  }

  @Override
  public ExecResult visitFuncDef(FuncDef def) {
    // Function table was built during analysis
    return ExecResult.NORMAL;
  }

  @Override
  public ExecResult visitReturn(Return ret) throws UserException {
    return ExecResult.returning(eval(ret.value()));
  }

  @Override
  public ExecResult visitExprStmt(ExprStmt stmt) throws UserException {
    callFunction(stmt.call(), false);
    return ExecResult.NORMAL;
  }

  @Override
  public Object visitCall(Call call) throws UserException {
    return callFunction(call, true);
  }

  /**
   * @param call
   * @param valueUsed if false, the function may finish without return
   * @return the returned value, or null if none and not used
   */
  private Object callFunction(Call call, boolean valueUsed)
      throws UserException {
    int line = call.getLine();
    checkInterrupted(line);
    FunctionSymbol fn = analysis.lookupFunction(call.function());
    if (fn == null) {
      throw new TLangRuntimeError("Function " + call.function() +
                                  " missing from function table");
    }

    // Arguments are evaluated in the caller's frame
    List<Object> args = new ArrayList<Object>(call.args().size());
    for (Expr arg: call.args()) {
      args.add(eval(arg));
    }

    if (callStack.size() >= maxCallDepth) {
      throw new RecursionDepthException(line, maxCallDepth);
    }

    // Function frames see globals, not the caller's locals
    Environment frame = new Environment(globals);
    List<Var> params = fn.params();
    for (int i = 0; i < params.size(); i++) {
      frame.define(params.get(i).name(), args.get(i));
    }

    if (logger.isTraceEnabled()) {
      logger.trace("call " + fn.name() + args + " depth "
                   + (callStack.size() + 1));
    }
    callStack.push(fn.name());
    ExecResult res;
    try {
      // Body block gets its own frame nested in the parameter frame
      res = execBlock(fn.definition().body().stmts(), new Environment(frame));
    } finally {
      callStack.pop();
    }

    if (res.isReturn()) {
      return res.value();
    } else if (valueUsed) {
      throw new MissingReturnException(line, fn.name());
    }
    return null;
  }

  @Override
  public Object visitBinOp(BinOp expr) throws UserException {
    Object left = eval(expr.left());
    Object right = eval(expr.right());
    BinaryOp op = expr.op();
    switch (op.category()) {
      case ARITHMETIC:
        return arith(op, left, right, expr.getLine());
      case COMPARISON:
        return compare(op, left, right);
      case EQUALITY:
        boolean eq = Values.valueEquals(left, right);
        return op == BinaryOp.EQ ? eq : !eq;
      default:
        throw new TLangRuntimeError("Unknown operator category " + op);
    }
  }

  private static Object arith(BinaryOp op, Object left, Object right,
                              int line) throws DivisionByZeroException {
    if (!Values.isFloat(left) && !Values.isFloat(right)) {
      long l = Values.toLong(left), r = Values.toLong(right);
      switch (op) {
        case PLUS: return l + r;
        case MINUS: return l - r;
        case MULT: return l * r;
        case DIV:
          if (r == 0) {
            throw new DivisionByZeroException(line);
          }
          // Truncates toward zero
          return l / r;
        default:
          throw new TLangRuntimeError("Not arithmetic: " + op);
      }
    }

    double l = Values.toDouble(left), r = Values.toDouble(right);
    switch (op) {
      case PLUS: return l + r;
      case MINUS: return l - r;
      case MULT: return l * r;
      case DIV:
        if (r == 0.0) {
          throw new DivisionByZeroException(line);
        }
        return l / r;
      default:
        throw new TLangRuntimeError("Not arithmetic: " + op);
    }
  }

  private static Boolean compare(BinaryOp op, Object left, Object right) {
    int cmp;
    if (!Values.isFloat(left) && !Values.isFloat(right)) {
      cmp = Long.compare(Values.toLong(left), Values.toLong(right));
    } else {
      double l = Values.toDouble(left), r = Values.toDouble(right);
      switch (op) {
        // Primitive comparisons so NaN compares false
        case LT: return l < r;
        case GT: return l > r;
        case LTE: return l <= r;
        case GTE: return l >= r;
        default:
          throw new TLangRuntimeError("Not a comparison: " + op);
      }
    }
    switch (op) {
      case LT: return cmp < 0;
      case GT: return cmp > 0;
      case LTE: return cmp <= 0;
      case GTE: return cmp >= 0;
      default:
        throw new TLangRuntimeError("Not a comparison: " + op);
    }
  }

  @Override
  public Object visitUnaryOp(UnaryOpExpr expr) throws UserException {
    Object operand = eval(expr.operand());
    switch (expr.op()) {
      case NOT:
        return !Values.toBoolean(operand);
      case NEGATE:
        if (Values.isFloat(operand)) {
          return -Values.toDouble(operand);
        }
        return -Values.toLong(operand);
      default:
        throw new TLangRuntimeError("Unknown unary operator " + expr.op());
    }
  }

  @Override
  public Object visitIntLit(IntLit expr) {
    return expr.value();
  }

  @Override
  public Object visitFloatLit(FloatLit expr) {
    return expr.value();
  }

  @Override
  public Object visitStrLit(StrLit expr) {
    return expr.value();
  }

  @Override
  public Object visitCharLit(CharLit expr) {
    return expr.value();
  }

  @Override
  public Object visitBoolLit(BoolLit expr) {
    return expr.value();
  }

  @Override
  public Object visitVar(VarRef expr) {
    return env.get(expr.name());
  }

  @Override
  public Object visitArrayLiteral(ArrayLiteral expr) throws UserException {
    List<Object> elems = new ArrayList<Object>(expr.elems().size());
    for (Expr elem: expr.elems()) {
      elems.add(eval(elem));
    }
    return new ArrayValue(elems);
  }

  @Override
  public Object visitArrayAccess(ArrayAccess expr) throws UserException {
    ArrayValue array = (ArrayValue)env.get(expr.name());
    long index = Values.toLong(eval(expr.index()));
    return array.get(index, expr.getLine());
  }
}

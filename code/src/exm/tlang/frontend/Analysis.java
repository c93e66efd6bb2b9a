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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

import exm.tlang.ast.Expr;
import exm.tlang.common.exceptions.TLangRuntimeError;
import exm.tlang.common.lang.FunctionSymbol;
import exm.tlang.common.lang.Types.Type;

/**
 * Output of semantic analysis: the resolved type of every expression
 * and the global function table.  Only built for programs that passed
 * every check.
 */
public class Analysis {
  /** Keyed on node identity: structurally equal nodes are distinct */
  private final Map<Expr, Type> exprTypes;
  private final Map<String, FunctionSymbol> functions;

  Analysis(IdentityHashMap<Expr, Type> exprTypes,
           Map<String, FunctionSymbol> functions) {
    this.exprTypes = Collections.unmodifiableMap(exprTypes);
    this.functions = functions;
  }

  /**
   * @param expr an expression in the analyzed program
   * @return its type
   */
  public Type typeOf(Expr expr) {
    Type t = exprTypes.get(expr);
    if (t == null) {
      throw new TLangRuntimeError("No type recorded for expression " + expr
                                  + " at line " + expr.getLine());
    }
    return t;
  }

  public int typedExprCount() {
    return exprTypes.size();
  }

  public FunctionSymbol lookupFunction(String name) {
    return functions.get(name);
  }

  public Map<String, FunctionSymbol> getFunctions() {
    return functions;
  }
}

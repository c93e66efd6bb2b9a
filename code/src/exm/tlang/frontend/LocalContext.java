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

import exm.tlang.common.lang.FunctionSymbol;
import exm.tlang.common.lang.Var;

/**
 * Track context below the global scope.  New child contexts are created
 * for every new variable scope: blocks, for loop initializers and
 * function parameter lists.
 *
 */
public class LocalContext extends Context {
  private final Context parent;
  private final GlobalContext globals;
  private final FunctionContext functionContext;

  private LocalContext(Context parent, FunctionSymbol function) {
    super(parent.getLogger(), parent.getLevel() + 1);
    this.functionContext = function != null ?
          new FunctionContext(function) : null;
    this.parent = parent;
    this.globals = parent.getGlobals();
    line = parent.line;
  }

  /**
   * Subcontext for a block or loop within the current scope
   * @param parent
   * @return
   */
  public static LocalContext blockContext(Context parent) {
    return new LocalContext(parent, null);
  }

  /**
   * Context for the parameters of a function.  The parent is the global
   * context, not the scope the definition appears in, so function bodies
   * see only globals and their own parameters.
   * @param global
   * @param function
   * @return
   */
  public static LocalContext fnContext(GlobalContext global,
                                       FunctionSymbol function) {
    return new LocalContext(global, function);
  }

  @Override
  public GlobalContext getGlobals() {
    return globals;
  }

  @Override
  public Var lookupVarUnsafe(String name) {
    Var result;
    result = variables.get(name);
    if (result != null)
      return result;
    return parent.lookupVarUnsafe(name);
  }

  @Override
  public FunctionContext getFunctionContext() {
    if (this.functionContext != null) {
      return this.functionContext;
    } else {
      return parent.getFunctionContext();
    }
  }

  @Override
  public List<Var> getVisibleVariables() {
    List<Var> result = new ArrayList<Var>();

    // All variable from parent visible, plus variables defined in this scope
    result.addAll(parent.getVisibleVariables());
    result.addAll(variables.values());

    return result;
  }

  @Override
  public String toString() {
    return getVisibleVariables().toString();
  }
}

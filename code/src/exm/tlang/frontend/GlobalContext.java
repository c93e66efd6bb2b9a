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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.tlang.common.exceptions.DoubleDefineException;
import exm.tlang.common.lang.FunctionSymbol;
import exm.tlang.common.lang.Var;

/**
 * Global context for entire program.  Holds top-level variables and the
 * single flat function table: function definitions are not block scoped.
 *
 */
public class GlobalContext extends Context {

  private final Map<String, FunctionSymbol> functions =
                          new LinkedHashMap<String, FunctionSymbol>();

  public GlobalContext(Logger logger) {
    super(logger, ROOT_LEVEL);
  }

  @Override
  public GlobalContext getGlobals() {
    return this;
  }

  @Override
  public Var lookupVarUnsafe(String name) {
    return variables.get(name);
  }

  @Override
  public FunctionContext getFunctionContext() {
    return null;
  }

  @Override
  public List<Var> getVisibleVariables() {
    return new ArrayList<Var>(variables.values());
  }

  /**
   * Add function to the function table
   * @param function
   * @throws DoubleDefineException if a function with the name exists
   */
  public void defineFunction(FunctionSymbol function)
                                throws DoubleDefineException {
    FunctionSymbol old = functions.get(function.name());
    if (old != null) {
      throw new DoubleDefineException(this, "Function '" + function.name()
          + "' already defined at line " + old.definition().getLine());
    }
    logger.trace("context: defineFunction: " + function);
    functions.put(function.name(), function);
  }

  @Override
  public FunctionSymbol lookupFunction(String name) {
    return functions.get(name);
  }

  /**
   * @return all functions, in definition order
   */
  public Map<String, FunctionSymbol> getFunctions() {
    return Collections.unmodifiableMap(functions);
  }

  @Override
  public String toString() {
    return "globals: " + variables.values() + " functions: " +
            functions.values();
  }
}

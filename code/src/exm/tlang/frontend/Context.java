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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.tlang.ast.Node;
import exm.tlang.common.exceptions.DoubleDefineException;
import exm.tlang.common.exceptions.UndefinedVarError;
import exm.tlang.common.lang.FunctionSymbol;
import exm.tlang.common.lang.Types.Type;
import exm.tlang.common.lang.Var;

/**
 * Abstract interface used to track and access contextual information about the
 * program at different points in the tree.  Each context is one scope: a
 * symbol table with a reference to the enclosing scope.
 */
public abstract class Context {

  public static final int ROOT_LEVEL = 0;

  /**
   * How many levels from root: 0 if this is the root
   */
  protected final int level;

  /**
   * A logger for use by child classes
   */
  protected final Logger logger;

  /**
     Map from variable name to Variable object, in declaration order
   */
  protected final Map<String,Var> variables = new LinkedHashMap<String,Var>();

  /**
     Current line in input file
   */
  protected int line = 0;

  public Context(Logger logger, int level) {
    super();
    this.level = level;
    this.logger = logger;
  }

  /**
     Return global context.
     If this is a GlobalContext, return this,
     else return the GlobalContext this is using.
   */
  public abstract GlobalContext getGlobals();

  /**
   * Lookup variable based on name.  This version will
   * return null if variable undeclared, leaving handling
   * to caller.
   * @param name
   * @return variable if declared, null if not declared
   */
  public abstract Var lookupVarUnsafe(String name);

  /** Get info about the enclosing function, or null at top level */
  public abstract FunctionContext getFunctionContext();

  /**
   * Returns a list of all variables visible in this scope, outermost first
   * @return
   */
  public abstract List<Var> getVisibleVariables();

  /**
   * Declare a new variable that will be visible in the
   * current scope and all descendant scopes
   * @param type
   * @param name
   * @return the new variable
   * @throws DoubleDefineException if already declared in this scope
   */
  public Var declareVariable(Type type, String name)
              throws DoubleDefineException {
    if (logger.isTraceEnabled()) {
      logger.trace("context: declareVariable: " +
                 type.toString() + " " + name + " <level " + level + ">");
    }

    Var old = variables.get(name);
    if (old != null) {
      throw new DoubleDefineException(this, "Variable '" + name +
          "' already declared in this scope (previous declaration at line "
          + old.line() + ")");
    }

    Var shadowed = lookupVarUnsafe(name);
    if (shadowed != null) {
      LogHelper.uniqueWarn(this, "Variable '" + name + "' shadows variable "
                + "declared at line " + shadowed.line());
    }

    Var variable = new Var(name, type, line);
    variables.put(name, variable);
    return variable;
  }

  /**
   * Lookup variable based on name that is referred to
   * in user code
   * @param name
   * @return the variable
   * @throws UndefinedVarError if not found
   */
  public Var lookupVarUser(String name)
    throws UndefinedVarError {
    Var result = lookupVarUnsafe(name);
    if (result == null) {
      throw UndefinedVarError.fromName(this, name);
    }
    return result;
  }

  /**
   * Lookup function in the global function table
   * @param name
   * @return the function, or null if not defined
   */
  public FunctionSymbol lookupFunction(String name) {
    return getGlobals().lookupFunction(name);
  }

  /**
   * Update current position to node being checked
   * @param node
   */
  public void syncLine(Node node) {
    if (node.getLine() > 0) {
      this.line = node.getLine();
    }
  }

  public int getLine() {
    return line;
  }

  /**
     @return E.g.; "line 42: "
   */
  public String getLocation() {
    return "line " + getLine() + ": ";
  }

  public final int getLevel() {
    return level;
  }

  public final Logger getLogger() {
    return logger;
  }

  /**
   * @return the variables which were declared in this scope
   */
  public Collection<Var> getScopeVariables() {
    return Collections.unmodifiableCollection(variables.values());
  }
}

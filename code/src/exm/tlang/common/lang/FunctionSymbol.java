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
package exm.tlang.common.lang;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.tlang.ast.Stmt.FuncDef;
import exm.tlang.common.lang.Types.Type;

/**
 * Entry in the global function table.  Holds the signature for
 * type checking calls, and the definition for executing them.
 */
public class FunctionSymbol {
  private final String name;
  private final Type returnType;
  private final ImmutableList<Var> params;
  private final FuncDef definition;

  public FunctionSymbol(String name, Type returnType, List<Var> params,
                        FuncDef definition) {
    this.name = name;
    this.returnType = returnType;
    this.params = ImmutableList.copyOf(params);
    this.definition = definition;
  }

  public String name() {
    return name;
  }

  public Type returnType() {
    return returnType;
  }

  public List<Var> params() {
    return params;
  }

  public FuncDef definition() {
    return definition;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(returnType.typeName()).append(' ').append(name).append('(');
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(params.get(i));
    }
    sb.append(')');
    return sb.toString();
  }
}

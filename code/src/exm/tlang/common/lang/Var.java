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

import exm.tlang.common.lang.Types.Type;

/**
 * A declared variable: the analyzer's record of a name and its type.
 */
public class Var {
  private final String name;
  private final Type type;
  /** Line of declaration */
  private final int line;

  public Var(String name, Type type, int line) {
    this.name = name;
    this.type = type;
    this.line = line;
  }

  public String name() {
    return name;
  }

  public Type type() {
    return type;
  }

  public int line() {
    return line;
  }

  @Override
  public String toString() {
    return type.typeName() + " " + name;
  }
}

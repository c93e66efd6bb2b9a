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

import java.util.LinkedHashMap;
import java.util.Map;

import exm.tlang.common.exceptions.TLangRuntimeError;

/**
 * Run-time frame binding variable names to values.  Each frame has a
 * reference to its enclosing frame; lookups and assignments walk
 * outward until they find the name.
 *
 * The analyzer has already resolved every name, so a failed lookup here
 * is a bug rather than a user error.
 */
public class Environment {
  private final Environment enclosing;
  private final Map<String, Object> values = new LinkedHashMap<String, Object>();
  private final int depth;

  /** Global frame: end of every chain */
  public Environment() {
    this.enclosing = null;
    this.depth = 0;
  }

  public Environment(Environment enclosing) {
    this.enclosing = enclosing;
    this.depth = enclosing.depth + 1;
  }

  public int getDepth() {
    return depth;
  }

  /**
   * Bind a new name in this frame
   */
  public void define(String name, Object value) {
    values.put(name, value);
  }

  public boolean isDefinedLocally(String name) {
    return values.containsKey(name);
  }

  public Object get(String name) {
    Environment env = lookup(name);
    return env.values.get(name);
  }

  /**
   * Rebind name in the nearest frame that holds it
   */
  public void assign(String name, Object value) {
    Environment env = lookup(name);
    env.values.put(name, value);
  }

  private Environment lookup(String name) {
    for (Environment env = this; env != null; env = env.enclosing) {
      if (env.values.containsKey(name)) {
        return env;
      }
    }
    throw new TLangRuntimeError("Variable '" + name + "' not bound at "
                                + "run time");
  }

  @Override
  public String toString() {
    return "frame " + depth + ": " + values.keySet();
  }
}

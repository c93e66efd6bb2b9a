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
package exm.tlang.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Root of the syntax tree: the top-level statements of one source text
 */
public class Program extends Node {
  private final ImmutableList<Stmt> stmts;

  public Program(List<Stmt> stmts) {
    super(1);
    this.stmts = ImmutableList.copyOf(stmts);
  }

  public List<Stmt> stmts() {
    return stmts;
  }
}

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

import exm.tlang.common.lang.Types.ArrayType;
import exm.tlang.common.lang.Types.PrimType;
import exm.tlang.common.lang.Types.ScalarType;
import exm.tlang.common.lang.Types.Type;

/**
 * Type as written in source, e.g. int or int[]
 */
public class TypeRef extends Node {
  private final PrimType base;
  private final boolean array;

  public TypeRef(PrimType base, boolean array, int line) {
    super(line);
    this.base = base;
    this.array = array;
  }

  public Type toType() {
    Type baseType = new ScalarType(base);
    return array ? new ArrayType(baseType) : baseType;
  }

  @Override
  public String toString() {
    return base.typeName() + (array ? "[]" : "");
  }

  /**
   * @param tokenType a type keyword
   * @return primitive type for the keyword, or null if it isn't one
   */
  public static PrimType primTypeFor(TokenType tokenType) {
    switch (tokenType) {
      case INT: return PrimType.INT;
      case FLOAT: return PrimType.FLOAT;
      case BOOL: return PrimType.BOOL;
      case CHAR: return PrimType.CHAR;
      case STRING: return PrimType.STRING;
      default: return null;
    }
  }
}

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

import exm.tlang.common.exceptions.TLangRuntimeError;

/**
 * Type descriptors for the language.
 *
 * There are five primitive types and one-dimensional arrays.
 * Types are compared structurally, so any two descriptors for
 * int[] are equal.  The wildcard type only appears as the member type of
 * an empty array literal before it is matched against a declaration.
 */
public class Types {

  public static enum PrimType {
    INT("int"), FLOAT("float"), BOOL("bool"), CHAR("char"), STRING("string");

    private final String typeName;

    PrimType(String typeName) {
      this.typeName = typeName;
    }

    public String typeName() {
      return typeName;
    }
  }

  public abstract static class Type {

    /**
     * @return true if a value of this type can be stored in a slot
     *        of type other.  This is equality, except that an array of
     *        the wildcard type matches any array type.
     */
    public abstract boolean assignableTo(Type other);

    public abstract String typeName();

    public boolean isArray() {
      return false;
    }

    public boolean isNumeric() {
      return false;
    }

    public ArrayType asArray() {
      throw new TLangRuntimeError(typeName() + " is not an array type");
    }

    @Override
    public String toString() {
      return typeName();
    }
  }

  public static class ScalarType extends Type {
    private final PrimType primType;

    public ScalarType(PrimType primType) {
      this.primType = primType;
    }

    public PrimType primType() {
      return primType;
    }

    @Override
    public boolean assignableTo(Type other) {
      return this.equals(other);
    }

    @Override
    public String typeName() {
      return primType.typeName();
    }

    @Override
    public boolean isNumeric() {
      return primType == PrimType.INT || primType == PrimType.FLOAT;
    }

    @Override
    public int hashCode() {
      return primType.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof ScalarType))
        return false;
      return primType == ((ScalarType)obj).primType;
    }
  }

  public static class ArrayType extends Type {
    private final Type memberType;

    public ArrayType(Type memberType) {
      if (memberType == null) {
        throw new TLangRuntimeError("null array member type");
      }
      this.memberType = memberType;
    }

    public Type memberType() {
      return memberType;
    }

    @Override
    public boolean isArray() {
      return true;
    }

    @Override
    public ArrayType asArray() {
      return this;
    }

    @Override
    public boolean assignableTo(Type other) {
      if (!other.isArray()) {
        return false;
      }
      Type otherMember = other.asArray().memberType;
      return memberType instanceof WildcardType ||
             memberType.assignableTo(otherMember);
    }

    @Override
    public String typeName() {
      return memberType.typeName() + "[]";
    }

    @Override
    public int hashCode() {
      return 31 * memberType.hashCode() + 7;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof ArrayType))
        return false;
      return memberType.equals(((ArrayType)obj).memberType);
    }
  }

  /**
   * Member type of an empty array literal
   */
  public static class WildcardType extends Type {
    private WildcardType() {
    }

    @Override
    public boolean assignableTo(Type other) {
      return true;
    }

    @Override
    public String typeName() {
      return "any";
    }
  }

  public static final Type INT = new ScalarType(PrimType.INT);
  public static final Type FLOAT = new ScalarType(PrimType.FLOAT);
  public static final Type BOOL = new ScalarType(PrimType.BOOL);
  public static final Type CHAR = new ScalarType(PrimType.CHAR);
  public static final Type STRING = new ScalarType(PrimType.STRING);
  public static final Type ANY = new WildcardType();
  public static final ArrayType EMPTY_ARRAY = new ArrayType(ANY);

  /**
   * Result type of int/float arithmetic: float if either side is float
   */
  public static Type numericResult(Type left, Type right) {
    assert(left.isNumeric() && right.isNumeric());
    if (left.equals(FLOAT) || right.equals(FLOAT)) {
      return FLOAT;
    }
    return INT;
  }
}

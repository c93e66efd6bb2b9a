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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.tlang.common.exceptions.ArrayIndexException;

/**
 * Mutable fixed-length array.  Shared by reference: assigning an array
 * to another variable or passing it to a function aliases it.
 */
public class ArrayValue {
  private final List<Object> elems;

  public ArrayValue(List<Object> elems) {
    this.elems = new ArrayList<Object>(elems);
  }

  public int length() {
    return elems.size();
  }

  /**
   * @param index
   * @param line source line for error reporting
   * @return element at index
   * @throws ArrayIndexException if index is out of range
   */
  public Object get(long index, int line) throws ArrayIndexException {
    checkIndex(index, line);
    return elems.get((int)index);
  }

  public void set(long index, Object value, int line)
                                      throws ArrayIndexException {
    checkIndex(index, line);
    elems.set((int)index, value);
  }

  private void checkIndex(long index, int line) throws ArrayIndexException {
    if (index < 0 || index >= elems.size()) {
      throw new ArrayIndexException(line, index, elems.size());
    }
  }

  public List<Object> elements() {
    return Collections.unmodifiableList(elems);
  }

  @Override
  public int hashCode() {
    return elems.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof ArrayValue))
      return false;
    List<Object> other = ((ArrayValue)obj).elems;
    if (other.size() != elems.size())
      return false;
    for (int i = 0; i < elems.size(); i++) {
      if (!Values.valueEquals(elems.get(i), other.get(i)))
        return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return Values.format(this);
  }
}

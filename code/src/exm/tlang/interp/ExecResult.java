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

/**
 * How a statement finished: normally, or by executing a return.
 * A return result travels back up through enclosing statements to the
 * call site.
 */
public class ExecResult {
  public static final ExecResult NORMAL = new ExecResult(false, null);

  private final boolean returning;
  private final Object value;

  private ExecResult(boolean returning, Object value) {
    this.returning = returning;
    this.value = value;
  }

  public static ExecResult returning(Object value) {
    return new ExecResult(true, value);
  }

  public boolean isReturn() {
    return returning;
  }

  public Object value() {
    return value;
  }

  @Override
  public String toString() {
    return returning ? "return " + value : "normal";
  }
}

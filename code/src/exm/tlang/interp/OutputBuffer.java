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

import com.google.common.base.Utf8;

import exm.tlang.common.exceptions.OutputLimitException;

/**
 * Collects program output, up to a maximum number of UTF-8 bytes
 */
public class OutputBuffer {
  private final StringBuilder text = new StringBuilder();
  private final long maxBytes;
  private long bytes = 0;

  public OutputBuffer(long maxBytes) {
    this.maxBytes = maxBytes;
  }

  /**
   * Append a line of output.
   * @param line source line of the print, for error reporting
   * @throws OutputLimitException if the limit would be passed.  Nothing
   *        from this line is kept in that case.
   */
  public void println(String s, int line) throws OutputLimitException {
    long added = Utf8.encodedLength(s) + 1;
    if (bytes + added > maxBytes) {
      throw new OutputLimitException(line, maxBytes);
    }
    bytes += added;
    text.append(s).append('\n');
  }

  public long byteCount() {
    return bytes;
  }

  public String getText() {
    return text.toString();
  }
}

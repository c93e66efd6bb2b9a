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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import exm.tlang.common.exceptions.ArrayIndexException;
import exm.tlang.common.exceptions.OutputLimitException;

public class ValuesTest {

  @Test
  public void testFormat() {
    assertEquals("42", Values.format(42L));
    assertEquals("false", Values.format(false));
    assertEquals("x", Values.format("x"));
    assertEquals("\uD83D\uDE00", Values.format("\uD83D\uDE00"));
    assertEquals("[a, b]", Values.format(
        new ArrayValue(Arrays.<Object>asList("a", "b"))));
  }

  @Test
  public void testFormatFloat() {
    assertEquals("2.5", Values.format(2.5));
    assertEquals("-3.0", Values.format(-3.0));
    assertEquals("0.1", Values.format(0.1));
    assertEquals("No exponent below 1e16", "10000000.0",
                 Values.format(1e7));
    assertEquals("1234567890123456.0", Values.format(1234567890123456.0));
    assertEquals("0.0001", Values.format(1e-4));
    assertEquals("1e+16", Values.format(1e16));
    assertEquals("1.5e+20", Values.format(1.5e20));
    assertEquals("1.5e-05", Values.format(1.5e-5));
    assertEquals("-2e-07", Values.format(-2e-7));
    assertEquals("0.0", Values.format(0.0));
    assertEquals("-0.0", Values.format(-0.0));
    assertEquals("inf", Values.format(Double.POSITIVE_INFINITY));
    assertEquals("-inf", Values.format(Double.NEGATIVE_INFINITY));
    assertEquals("nan", Values.format(Double.NaN));
  }

  @Test
  public void testEquality() {
    assertTrue(Values.valueEquals(0.0, -0.0));
    assertFalse("NaN is never equal",
                Values.valueEquals(Double.NaN, Double.NaN));
    assertTrue(Values.valueEquals(
        new ArrayValue(Arrays.<Object>asList(1.0, 2.0)),
        new ArrayValue(Arrays.<Object>asList(1.0, 2.0))));
  }

  @Test
  public void testArrayBounds() throws Exception {
    ArrayValue array = new ArrayValue(Arrays.<Object>asList(1L, 2L));
    array.set(1, 5L, 1);
    assertEquals(5L, array.get(1, 1));
    try {
      array.get(2, 3);
      fail("Expected index error");
    } catch (ArrayIndexException e) {
      assertEquals(3, e.getLine());
    }
  }

  @Test
  public void testOutputBufferCountsUtf8Bytes() throws Exception {
    OutputBuffer output = new OutputBuffer(7);
    // Two bytes per character, plus the newline
    output.println("ééé", 1);
    assertEquals(7, output.byteCount());
    try {
      output.println("", 2);
      fail("Expected output limit");
    } catch (OutputLimitException e) {
      assertEquals("ééé\n", output.getText());
    }
  }
}

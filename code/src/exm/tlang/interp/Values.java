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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.tlang.common.exceptions.TLangRuntimeError;

/**
 * Operations on run-time values.
 *
 * int is Long, float is Double, bool is Boolean, char is a String
 * holding one code point, string is String, arrays are ArrayValue.
 */
public class Values {

  /**
   * Text written by print
   */
  public static String format(Object value) {
    if (value instanceof ArrayValue) {
      List<String> parts = new ArrayList<String>();
      for (Object elem: ((ArrayValue)value).elements()) {
        parts.add(format(elem));
      }
      return "[" + StringUtils.join(parts, ", ") + "]";
    } else if (value instanceof Double) {
      return formatFloat((Double)value);
    } else if (value instanceof Long || value instanceof Boolean ||
               value instanceof String) {
      return value.toString();
    } else {
      throw new TLangRuntimeError("Unexpected value: " + value);
    }
  }

  /**
   * Shortest digits that read back as the same double.  Plain notation
   * for magnitudes in [1e-4, 1e16), otherwise d.ddde+XX.
   */
  static String formatFloat(double d) {
    if (Double.isNaN(d)) {
      return "nan";
    } else if (Double.isInfinite(d)) {
      return d > 0 ? "inf" : "-inf";
    } else if (d == 0.0) {
      return (1.0 / d < 0) ? "-0.0" : "0.0";
    }

    // Double.toString already picks the shortest round-trip digits
    BigDecimal exact = new BigDecimal(Double.toString(d)).stripTrailingZeros();
    double magnitude = Math.abs(d);
    if (magnitude >= 1e-4 && magnitude < 1e16) {
      String plain = exact.toPlainString();
      return plain.indexOf('.') >= 0 ? plain : plain + ".0";
    }

    String digits = exact.unscaledValue().abs().toString();
    int exponent = digits.length() - exact.scale() - 1;
    StringBuilder sb = new StringBuilder();
    if (d < 0) {
      sb.append('-');
    }
    sb.append(digits.charAt(0));
    if (digits.length() > 1) {
      sb.append('.').append(digits, 1, digits.length());
    }
    sb.append('e').append(exponent < 0 ? '-' : '+');
    String expText = Integer.toString(Math.abs(exponent));
    if (expText.length() < 2) {
      sb.append('0');
    }
    sb.append(expText);
    return sb.toString();
  }

  public static boolean isFloat(Object value) {
    return value instanceof Double;
  }

  public static double toDouble(Object value) {
    if (value instanceof Long) {
      return ((Long)value).doubleValue();
    } else if (value instanceof Double) {
      return (Double)value;
    }
    throw new TLangRuntimeError("Not a numeric value: " + value);
  }

  public static long toLong(Object value) {
    if (value instanceof Long) {
      return (Long)value;
    }
    throw new TLangRuntimeError("Not an int value: " + value);
  }

  public static boolean toBoolean(Object value) {
    if (value instanceof Boolean) {
      return (Boolean)value;
    }
    throw new TLangRuntimeError("Not a bool value: " + value);
  }

  /**
   * Equality as the == operator sees it.  Floats compare numerically,
   * arrays element by element.
   */
  public static boolean valueEquals(Object left, Object right) {
    if (left instanceof Double && right instanceof Double) {
      return ((Double)left).doubleValue() == ((Double)right).doubleValue();
    }
    if (left == null) {
      return right == null;
    }
    return left.equals(right);
  }
}

package com.consullo.cup.format;

import com.consullo.cup.core.Bounds;
import org.apache.commons.lang3.StringUtils;

/**
 * Small formatting helpers shared by the text serializers.
 */
final class TextSupport {

  private TextSupport() {
  }

  static String truncate(String s, int max) {
    if (s.length() <= max) {
      return s;
    }
    return StringUtils.left(s, max) + "...";
  }

  /**
   * Escapes a string for use inside double quotes on a single line.
   */
  static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\' || c == '"') {
        sb.append('\\').append(c);
      } else if (c == '\n' || c == '\r') {
        sb.append(' ');
      } else {
        sb.append(c);
      }
    }
    return sb.append('"').toString();
  }

  static String bounds(Bounds b) {
    return (long) b.x() + "," + (long) b.y() + " " + (long) b.w() + "x" + (long) b.h();
  }

  /**
   * Renders a scalar without a trailing ".0" for integral numbers.
   */
  static String scalar(Object v) {
    if (v instanceof Double || v instanceof Float) {
      double d = ((Number) v).doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d)) {
        return Long.toString((long) d);
      }
    }
    return String.valueOf(v);
  }
}

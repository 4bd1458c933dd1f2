/*
 * Copyright 2026 The Pasta Authors.
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
 * limitations under the License.
 */

package com.google.pasta.syntax;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Ascii;
import java.math.BigDecimal;
import java.math.BigInteger;

/** Decoding of Python literal spellings and their canonical re-spelling. */
public final class Literals {

  private Literals() {}

  /**
   * Decodes the value of one string literal token, including its prefix and quotes. Raw strings
   * and f-strings keep their body as written; other strings have their escapes processed.
   */
  public static String decodeString(String spelling) {
    String prefix = prefixOf(spelling);
    int quote = prefix.length();
    checkArgument(quote < spelling.length(), "malformed string %s", spelling);
    char q = spelling.charAt(quote);
    int width = spelling.startsWith(String.valueOf(q).repeat(3), quote) ? 3 : 1;
    checkArgument(spelling.length() >= quote + 2 * width, "malformed string %s", spelling);
    String body = spelling.substring(quote + width, spelling.length() - width);
    if (prefix.contains("r") || prefix.contains("f")) {
      return body;
    }
    return unescape(body, prefix.contains("b"));
  }

  private static String unescape(String body, boolean bytes) {
    StringBuilder sb = new StringBuilder(body.length());
    int i = 0;
    while (i < body.length()) {
      char c = body.charAt(i);
      if (c != '\\' || i + 1 >= body.length()) {
        sb.append(c);
        i++;
        continue;
      }
      char next = body.charAt(i + 1);
      i += 2;
      switch (next) {
        case '\n':
          break;
        case '\r':
          if (i < body.length() && body.charAt(i) == '\n') {
            i++;
          }
          break;
        case '\\':
        case '\'':
        case '"':
          sb.append(next);
          break;
        case 'a':
          sb.append('\u0007');
          break;
        case 'b':
          sb.append('\b');
          break;
        case 'f':
          sb.append('\f');
          break;
        case 'n':
          sb.append('\n');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'v':
          sb.append('\u000b');
          break;
        case 'x':
          i = appendCodePoint(sb, body, i, 2, 16, "\\x");
          break;
        case 'u':
          i = bytes ? appendRaw(sb, "\\u", i) : appendCodePoint(sb, body, i, 4, 16, "\\u");
          break;
        case 'U':
          i = bytes ? appendRaw(sb, "\\U", i) : appendCodePoint(sb, body, i, 8, 16, "\\U");
          break;
        case 'N':
          i = bytes ? appendRaw(sb, "\\N", i) : appendNamedCharacter(sb, body, i);
          break;
        default:
          if (next >= '0' && next <= '7') {
            int end = i - 1;
            while (end < body.length() && end < i + 2 && isOctalDigit(body.charAt(end))) {
              end++;
            }
            sb.appendCodePoint(Integer.parseInt(body.substring(i - 1, end), 8));
            i = end;
          } else {
            sb.append('\\').append(next);
          }
      }
    }
    return sb.toString();
  }

  private static int appendRaw(StringBuilder sb, String text, int resume) {
    sb.append(text);
    return resume;
  }

  private static int appendCodePoint(
      StringBuilder sb, String body, int start, int digits, int radix, String escape) {
    int end = start + digits;
    if (end <= body.length()) {
      try {
        sb.appendCodePoint(Integer.parseInt(body.substring(start, end), radix));
        return end;
      } catch (IllegalArgumentException e) {
        // Not a valid escape; keep the text as written.
      }
    }
    sb.append(escape);
    return start;
  }

  private static int appendNamedCharacter(StringBuilder sb, String body, int start) {
    int close = body.indexOf('}', start);
    if (start < body.length() && body.charAt(start) == '{' && close > start) {
      try {
        sb.appendCodePoint(Character.codePointOf(body.substring(start + 1, close)));
        return close + 1;
      } catch (IllegalArgumentException e) {
        // Unknown name; keep the text as written.
      }
    }
    sb.append("\\N");
    return start;
  }

  private static boolean isOctalDigit(char c) {
    return c >= '0' && c <= '7';
  }

  /** Whether a string literal token spells a {@code bytes} value. */
  public static boolean isBytes(String spelling) {
    return prefixOf(spelling).indexOf('b') >= 0;
  }

  /** Whether a string literal token is an f-string. */
  public static boolean isFormatted(String spelling) {
    return prefixOf(spelling).indexOf('f') >= 0;
  }

  private static String prefixOf(String spelling) {
    int quote = 0;
    while (quote < spelling.length()
        && spelling.charAt(quote) != '\''
        && spelling.charAt(quote) != '"') {
      quote++;
    }
    return Ascii.toLowerCase(spelling.substring(0, quote));
  }

  /** Spells {@code value} as a single-quoted string literal, the way Python's repr does. */
  public static String stringRepr(String value) {
    return stringRepr(value, false, false);
  }

  /**
   * Spells a string literal of the given kind. A bytes value is spelled the way Python's repr
   * spells it. The value of an f-string is its body as written, so it is quoted but not escaped.
   */
  public static String stringRepr(String value, boolean bytes, boolean formatted) {
    checkArgument(!(bytes && formatted), "there are no formatted bytes literals");
    if (formatted) {
      return formattedRepr(value);
    }
    char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
    StringBuilder sb = new StringBuilder();
    if (bytes) {
      sb.append('b');
    }
    sb.append(quote);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == quote || c == '\\') {
        sb.append('\\').append(c);
      } else if (c == '\n') {
        sb.append("\\n");
      } else if (c == '\r') {
        sb.append("\\r");
      } else if (c == '\t') {
        sb.append("\\t");
      } else if (c < 0x20 || c == 0x7f || (bytes && c > 0x7f)) {
        checkArgument(c <= 0xff, "bytes literal with character U+%04X", (int) c);
        sb.append(String.format("\\x%02x", (int) c));
      } else {
        sb.append(c);
      }
    }
    return sb.append(quote).toString();
  }

  private static String formattedRepr(String body) {
    boolean multiline = body.indexOf('\n') >= 0 || body.indexOf('\r') >= 0;
    for (char q : new char[] {'\'', '"'}) {
      String quote = String.valueOf(q);
      if (multiline) {
        String triple = quote.repeat(3);
        if (!body.contains(triple) && !body.endsWith(quote)) {
          return "f" + triple + body + triple;
        }
      } else if (!hasUnescaped(body, q)) {
        return "f" + quote + body + quote;
      }
    }
    throw new IllegalArgumentException("cannot quote f-string body " + body);
  }

  private static boolean hasUnescaped(String body, char quote) {
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c == '\\') {
        i++;
      } else if (c == quote) {
        return true;
      }
    }
    return false;
  }

  public static boolean isImaginary(String spelling) {
    char last = spelling.charAt(spelling.length() - 1);
    return last == 'j' || last == 'J';
  }

  /**
   * Decodes a number literal to a {@link BigInteger} for integers and a {@link Double} for floats
   * and imaginary numbers.
   */
  public static Number decodeNumber(String spelling) {
    String text = spelling.replace("_", "");
    if (isImaginary(text)) {
      return Double.parseDouble(text.substring(0, text.length() - 1));
    }
    if (text.length() > 1 && text.charAt(0) == '0') {
      switch (Ascii.toLowerCase(text.charAt(1))) {
        case 'x':
          return new BigInteger(text.substring(2), 16);
        case 'o':
          return new BigInteger(text.substring(2), 8);
        case 'b':
          return new BigInteger(text.substring(2), 2);
        default:
          break;
      }
    }
    if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
      return Double.parseDouble(text);
    }
    return new BigInteger(text);
  }

  /** Spells a number the way Python's repr does. */
  public static String numberRepr(Number value, boolean imaginary) {
    if (value instanceof BigInteger) {
      return value + (imaginary ? "j" : "");
    }
    double d = value.doubleValue();
    String repr = floatRepr(d);
    if (imaginary) {
      // Python drops the fraction of integral imaginary parts: 2j, not 2.0j.
      return (repr.endsWith(".0") ? repr.substring(0, repr.length() - 2) : repr) + "j";
    }
    return repr;
  }

  private static String floatRepr(double d) {
    if (Double.isNaN(d)) {
      return "nan";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "inf" : "-inf";
    }
    if (d == 0) {
      return (1 / d < 0) ? "-0.0" : "0.0";
    }
    BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(d))).stripTrailingZeros();
    String digits = decimal.unscaledValue().toString();
    int exponent = digits.length() - 1 - decimal.scale();
    String sign = d < 0 ? "-" : "";
    if (exponent < -4 || exponent >= 16) {
      String mantissa =
          digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
      String exp = String.format("%02d", Math.abs(exponent));
      return sign + mantissa + "e" + (exponent < 0 ? "-" : "+") + exp;
    }
    String plain = decimal.toPlainString();
    return sign + (plain.indexOf('.') >= 0 ? plain : plain + ".0");
  }
}

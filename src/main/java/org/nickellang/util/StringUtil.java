/*
 * Copyright 2025 The Nickel Authors
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

package org.nickellang.util;

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/** Statics-only helpers for converting between Nickel string literals and Java strings. */
public final class StringUtil {

  // Statics only
  private StringUtil() {}

  private static final Escaper ESCAPER =
      Escapers.builder()
          .addEscape('"', "\\\"")
          .addEscape('\\', "\\\\")
          .addEscape('#', "\\#")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .build();

  /** Returns {@code s} as a standard Nickel string literal, including the enclosing quotes. */
  public static String quote(String s) {
    return '"' + ESCAPER.escape(s) + '"';
  }

  /**
   * Returns the character denoted by an escape sequence in a standard string literal, such as
   * {@code \n}. Throws an IllegalArgumentException if {@code escape} is not a valid escape (the
   * lexer only produces valid ones).
   */
  public static char unescape(String escape) {
    if (escape.length() != 2 || escape.charAt(0) != '\\') {
      throw new IllegalArgumentException("Not an escape sequence: " + escape);
    }
    char c = escape.charAt(1);
    switch (c) {
      case 'n':
        return '\n';
      case 'r':
        return '\r';
      case 't':
        return '\t';
      case '"':
      case '\\':
      case '#':
        return c;
      default:
        throw new IllegalArgumentException("Unknown escape sequence: " + escape);
    }
  }
}

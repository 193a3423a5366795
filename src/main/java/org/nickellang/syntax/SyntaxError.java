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

package org.nickellang.syntax;

import org.jspecify.annotations.Nullable;
import org.nickellang.term.Span;

/** Thrown when a sequence of tokens doesn't match the grammar. */
public class SyntaxError extends ParseError {
  public final Kind kind;

  /** The text of the offending token, if there was one. */
  public final @Nullable String found;

  /** A description of the tokens that would have been accepted, if it could be determined. */
  public final @Nullable String expected;

  public SyntaxError(
      Kind kind,
      String msg,
      int lineNum,
      int charPositionInLine,
      @Nullable Span span,
      @Nullable String found,
      @Nullable String expected) {
    super(msg, lineNum, charPositionInLine, span);
    this.kind = kind;
    this.found = found;
    this.expected = expected;
  }

  public enum Kind {
    UNEXPECTED_TOKEN,
    UNEXPECTED_EOF,
    /** A string opened with one kind of delimiter and closed with the other. */
    DELIMITER_MISMATCH
  }
}

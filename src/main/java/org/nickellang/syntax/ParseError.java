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

/**
 * All errors detected while turning source text into a term throw a ParseError: either a {@link
 * LexicalError} from the token source or a {@link SyntaxError} from the grammar. Any ParseError
 * aborts the parse.
 */
public abstract class ParseError extends RuntimeException {
  public final String msg;
  public final int lineNum;
  public final int charPositionInLine;

  /** The offending source range, if known. */
  public final @Nullable Span span;

  ParseError(String msg, int lineNum, int charPositionInLine, @Nullable Span span) {
    super(msg);
    this.msg = msg;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
    this.span = span;
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s:%s)", msg, lineNum, charPositionInLine);
  }
}

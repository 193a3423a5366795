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

import com.google.errorprone.annotations.FormatMethod;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.nickellang.term.FileId;
import org.nickellang.term.Span;

/**
 * A base class for ANTLR visitors that provides three useful functions:
 *
 * <ul>
 *   <li>It disables the default "do nothing" behavior for node types that haven't been overridden.
 *       Visiting a node that doesn't have an explicit visit* method will throw an AssertionError.
 *   <li>It converts the token range of a node into a {@link Span} in the file being parsed.
 *   <li>It provides an error() method that locates a {@link SyntaxError} in the file being
 *       parsed.
 * </ul>
 */
class VisitorBase<T> extends NickelParserBaseVisitor<T> {

  final FileId file;

  VisitorBase(FileId file) {
    this.file = file;
  }

  @Override
  protected final T defaultResult() {
    // defaultResult() is called by all the default visitXXX() methods defined on
    // NickelParserBaseVisitor.  Our intent is to override all of the methods that might
    // be called, so we should never get here.
    throw new AssertionError();
  }

  /** Returns the source range covered by {@code ctx}. */
  Span span(ParserRuleContext ctx) {
    return span(ctx.start, ctx.stop);
  }

  /** Returns the source range from the start of {@code first} to the end of {@code last}. */
  Span span(Token first, Token last) {
    int start = first.getStartIndex();
    // An empty rule ends before it starts.
    int end = (last == null) ? start : Math.max(start, last.getStopIndex() + 1);
    return new Span(file, start, end);
  }

  /** Returns a {@link SyntaxError} located at {@code token}. */
  @FormatMethod
  SyntaxError error(Token token, SyntaxError.Kind kind, String fmt, Object... fmtArgs) {
    return TermParser.error(file, token, kind, fmt, fmtArgs);
  }
}

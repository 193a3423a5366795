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
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.jspecify.annotations.Nullable;
import org.nickellang.syntax.NickelParser.ReplBindingContext;
import org.nickellang.syntax.NickelParser.ReplExpressionContext;
import org.nickellang.syntax.NickelParser.ReplInputContext;
import org.nickellang.term.FileId;
import org.nickellang.term.Ident;
import org.nickellang.term.RichTerm;
import org.nickellang.term.Span;
import org.nickellang.types.Types;

/**
 * The entry points for turning Nickel source text into terms.
 *
 * <p>Each call builds a fresh lexer, parser and {@link TermBuilder}, so nothing is shared between
 * calls and independent inputs may be parsed concurrently. The first problem found aborts the parse
 * with a {@link ParseError}; no partial result is returned.
 */
public class TermParser {

  // Statics only
  private TermParser() {}

  /** Parses a complete Nickel expression. */
  public static RichTerm parseTerm(FileId file, CharStream input) {
    NickelParser parser = parser(file, input);
    return new TermBuilder(file).visit(parser.termEof().term());
  }

  /** Parses a complete Nickel expression. */
  public static RichTerm parseTerm(FileId file, String input) {
    return parseTerm(file, CharStreams.fromString(input));
  }

  /**
   * Parses a line of interactive input, which is either an expression or a {@code let} binding
   * without a body.
   */
  public static ExtendedTerm parseReplInput(FileId file, String input) {
    NickelParser parser = parser(file, CharStreams.fromString(input));
    ReplInputContext ctx = parser.replInput();
    TermBuilder builder = new TermBuilder(file);
    if (ctx instanceof ReplBindingContext binding) {
      Ident id = Ident.of(binding.ident().getText());
      RichTerm bound = builder.visit(binding.term());
      return new ExtendedTerm.Binding(id, builder.metas.annotate(binding.annotation(), bound));
    }
    return new ExtendedTerm.Expression(builder.visit(((ReplExpressionContext) ctx).term()));
  }

  /** Parses a complete type. */
  public static Types parseType(FileId file, String input) {
    NickelParser parser = parser(file, CharStreams.fromString(input));
    return new TermBuilder(file).types.visit(parser.typesEof().types());
  }

  /**
   * Returns a parser for the given input that throws a {@link LexicalError} or {@link SyntaxError}
   * in response to the first problem it finds.
   */
  private static NickelParser parser(FileId file, CharStream input) {
    NickelLexer lexer = new NickelLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            Span span = null;
            if (e instanceof LexerNoViableAltException noViableAlt) {
              int start = noViableAlt.getStartIndex();
              span = new Span(file, start, Math.min(start + 1, input.size()));
            }
            throw new LexicalError(msg, lineNum, charPositionInLine, span);
          }
        });
    NickelParser parser = new NickelParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            Token token = (Token) offendingSymbol;
            String expected = expectedTokens((Parser) recognizer);
            if (token != null && token.getType() == Token.EOF) {
              throw new SyntaxError(
                  SyntaxError.Kind.UNEXPECTED_EOF,
                  msg,
                  lineNum,
                  charPositionInLine,
                  span(file, token),
                  null,
                  expected);
            }
            throw new SyntaxError(
                SyntaxError.Kind.UNEXPECTED_TOKEN,
                msg,
                lineNum,
                charPositionInLine,
                (token == null) ? null : span(file, token),
                (token == null) ? null : token.getText(),
                expected);
          }
        });
    return parser;
  }

  private static @Nullable String expectedTokens(Parser parser) {
    try {
      return parser.getExpectedTokens().toString(parser.getVocabulary());
    } catch (IllegalArgumentException e) {
      // Thrown by ANTLR when the parser's state no longer identifies a single ATN state.
      return null;
    }
  }

  /** Returns the span of a single token. */
  static Span span(FileId file, Token token) {
    int start = Math.max(token.getStartIndex(), 0);
    int end = Math.max(start, token.getStopIndex() + 1);
    return new Span(file, start, end);
  }

  /** Returns a new SyntaxError referring to the given token. */
  @FormatMethod
  static SyntaxError error(
      FileId file, Token token, SyntaxError.Kind kind, String fmt, Object... fmtArgs) {
    String msg = String.format(fmt, fmtArgs);
    if (token == null) {
      // Shouldn't happen, but 0:0 is less useless than a NullPointerException.
      return new SyntaxError(kind, msg, 0, 0, null, null, null);
    }
    return new SyntaxError(
        kind,
        msg,
        token.getLine(),
        token.getCharPositionInLine(),
        span(file, token),
        token.getText(),
        null);
  }
}

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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.nickellang.syntax.NickelParser.ChunkLiteralContext;
import org.nickellang.term.RichTerm;
import org.nickellang.term.StrChunk;
import org.nickellang.util.StringUtil;

/**
 * Collects the pieces of a string literal, in source order, and returns them as a list of {@link
 * StrChunk}s. Adjacent pieces of text are joined into a single {@link StrChunk.Literal}.
 *
 * <p>Multiline strings ({@code m#"..."#m}) have their common indentation removed when they are
 * built; see {@link #stripIndent}.
 */
class StringAssembler {
  private final boolean multiline;
  private final List<StrChunk> chunks = new ArrayList<>();
  private final StringBuilder text = new StringBuilder();

  StringAssembler(boolean multiline) {
    this.multiline = multiline;
  }

  /** Appends the text of a sequence of literal tokens, decoding any escapes. */
  @CanIgnoreReturnValue
  StringAssembler literal(ChunkLiteralContext ctx) {
    for (ParseTree child : ctx.children) {
      Token token = ((TerminalNode) child).getSymbol();
      if (token.getType() == NickelLexer.ESCAPED_CHAR) {
        text.append(StringUtil.unescape(token.getText()));
      } else {
        text.append(token.getText());
      }
    }
    return this;
  }

  @CanIgnoreReturnValue
  StringAssembler literal(String s) {
    text.append(s);
    return this;
  }

  /** Appends an interpolated expression. */
  @CanIgnoreReturnValue
  StringAssembler expr(RichTerm term) {
    flushText();
    chunks.add(new StrChunk.Expr(term, 0));
    return this;
  }

  ImmutableList<StrChunk> build() {
    flushText();
    return multiline ? stripIndent(chunks) : ImmutableList.copyOf(chunks);
  }

  private void flushText() {
    if (text.length() != 0) {
      chunks.add(new StrChunk.Literal(text.toString()));
      text.setLength(0);
    }
  }

  /**
   * Returns the smallest indentation (count of leading spaces and tabs) of any line that contains
   * something other than whitespace or that starts with an interpolated expression. Returns 0 if
   * there are no such lines.
   */
  @VisibleForTesting
  static int minIndent(List<StrChunk> chunks) {
    int min = Integer.MAX_VALUE;
    int current = 0;
    boolean inIndent = true;
    for (StrChunk chunk : chunks) {
      if (chunk instanceof StrChunk.Literal literal) {
        for (int i = 0; i < literal.value().length(); i++) {
          char c = literal.value().charAt(i);
          if (c == '\n') {
            current = 0;
            inIndent = true;
          } else if (inIndent && isIndent(c)) {
            current++;
          } else if (inIndent && !Character.isWhitespace(c)) {
            min = Math.min(min, current);
            inIndent = false;
          }
        }
      } else if (inIndent) {
        min = Math.min(min, current);
        inIndent = false;
      }
    }
    return (min == Integer.MAX_VALUE) ? 0 : min;
  }

  /**
   * Removes the common indentation of a multiline string.
   *
   * <ul>
   *   <li>If the first line is only whitespace, it is removed; so is the last line.
   *   <li>Up to {@link #minIndent} leading spaces or tabs are removed from every line.
   *   <li>An interpolated expression that starts a line records how much further it is indented
   *       than the rest of the string, unless text or another expression follows it on the same
   *       line, in which case its indent is 0.
   * </ul>
   */
  @VisibleForTesting
  static ImmutableList<StrChunk> stripIndent(List<StrChunk> chunks) {
    List<StrChunk> trimmed = trimFirstAndLastLines(chunks);
    int min = minIndent(trimmed);
    List<StrChunk> result = new ArrayList<>();
    StringBuilder buffer = new StringBuilder();
    int current = 0;
    boolean inIndent = true;
    // The index in result of an expression that started the current line, or -1.
    int exprOnLine = -1;
    for (StrChunk chunk : trimmed) {
      if (chunk instanceof StrChunk.Literal literal) {
        String s = literal.value();
        for (int i = 0; i < s.length(); i++) {
          char c = s.charAt(i);
          if (c == '\n') {
            buffer.append(c);
            current = 0;
            inIndent = true;
            exprOnLine = -1;
          } else if (inIndent && isIndent(c)) {
            if (current >= min) {
              buffer.append(c);
            }
            current++;
          } else {
            if (!Character.isWhitespace(c) && exprOnLine >= 0) {
              // Text after the expression on the same line.
              result.set(exprOnLine, ((StrChunk.Expr) result.get(exprOnLine)).withIndent(0));
              exprOnLine = -1;
            }
            inIndent = false;
            buffer.append(c);
          }
        }
      } else {
        StrChunk.Expr expr = (StrChunk.Expr) chunk;
        if (buffer.length() != 0) {
          result.add(new StrChunk.Literal(buffer.toString()));
          buffer.setLength(0);
        }
        if (inIndent) {
          result.add(expr.withIndent(current - min));
          exprOnLine = result.size() - 1;
          inIndent = false;
        } else {
          if (exprOnLine >= 0) {
            result.set(exprOnLine, ((StrChunk.Expr) result.get(exprOnLine)).withIndent(0));
            exprOnLine = -1;
          }
          result.add(expr.withIndent(0));
        }
      }
    }
    if (buffer.length() != 0) {
      result.add(new StrChunk.Literal(buffer.toString()));
    }
    return ImmutableList.copyOf(result);
  }

  /** Drops a first line and a last line that contain nothing but whitespace. */
  private static List<StrChunk> trimFirstAndLastLines(List<StrChunk> chunks) {
    List<StrChunk> result = new ArrayList<>(chunks);
    if (!result.isEmpty() && result.get(0) instanceof StrChunk.Literal first) {
      String s = first.value();
      int newline = s.indexOf('\n');
      if (newline >= 0 && s.substring(0, newline).isBlank()) {
        replaceLiteral(result, 0, s.substring(newline + 1));
      }
    }
    if (!result.isEmpty() && result.get(result.size() - 1) instanceof StrChunk.Literal last) {
      String s = last.value();
      int newline = s.lastIndexOf('\n');
      if (newline >= 0 && s.substring(newline + 1).isBlank()) {
        int end = (newline > 0 && s.charAt(newline - 1) == '\r') ? newline - 1 : newline;
        replaceLiteral(result, result.size() - 1, s.substring(0, end));
      }
    }
    return result;
  }

  private static void replaceLiteral(List<StrChunk> chunks, int index, String value) {
    if (value.isEmpty()) {
      chunks.remove(index);
    } else {
      chunks.set(index, new StrChunk.Literal(value));
    }
  }

  private static boolean isIndent(char c) {
    return c == ' ' || c == '\t';
  }
}

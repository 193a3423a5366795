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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.nickellang.term.RichTerm;
import org.nickellang.term.StrChunk;
import org.nickellang.term.Terms;

@RunWith(JUnit4.class)
public class StringAssemblerTest {
  private static final RichTerm X = Terms.var("x");
  private static final RichTerm Y = Terms.var("y");

  private static StrChunk lit(String s) {
    return new StrChunk.Literal(s);
  }

  private static StrChunk expr(RichTerm term, int indent) {
    return new StrChunk.Expr(term, indent);
  }

  @Test
  public void adjacentLiteralsAreJoined() {
    ImmutableList<StrChunk> chunks =
        new StringAssembler(false).literal("a").literal("b").expr(X).literal("c").build();
    assertThat(chunks).containsExactly(lit("ab"), expr(X, 0), lit("c")).inOrder();
  }

  @Test
  public void standardStringsAreNotStripped() {
    ImmutableList<StrChunk> chunks = new StringAssembler(false).literal("\n  a\n").build();
    assertThat(chunks).containsExactly(lit("\n  a\n"));
  }

  @Test
  public void emptyString() {
    assertThat(new StringAssembler(true).build()).isEmpty();
    assertThat(new StringAssembler(false).build()).isEmpty();
  }

  @Test
  public void minIndentIgnoresBlankLines() {
    assertThat(StringAssembler.minIndent(ImmutableList.of(lit("    a\n \n   b")))).isEqualTo(3);
    assertThat(StringAssembler.minIndent(ImmutableList.of(lit("  \n\t\n")))).isEqualTo(0);
  }

  @Test
  public void minIndentCountsLinesStartingWithAnExpression() {
    assertThat(StringAssembler.minIndent(ImmutableList.of(lit("    a\n  "), expr(X, 0))))
        .isEqualTo(2);
    // An expression that doesn't start its line doesn't count.
    assertThat(StringAssembler.minIndent(ImmutableList.of(lit("    a "), expr(X, 0))))
        .isEqualTo(4);
  }

  @Test
  public void stripsCommonIndentation() {
    assertThat(StringAssembler.stripIndent(ImmutableList.of(lit("\n   a\n     b\n   c\n"))))
        .containsExactly(lit("a\n  b\nc"));
  }

  @Test
  public void tabsCountAsIndentation() {
    assertThat(StringAssembler.stripIndent(ImmutableList.of(lit("\t\ta\n\t\t\tb"))))
        .containsExactly(lit("a\n\tb"));
  }

  @Test
  public void firstAndLastLinesAreOnlyDroppedIfBlank() {
    assertThat(StringAssembler.stripIndent(ImmutableList.of(lit("a\n  b\n c"))))
        .containsExactly(lit("a\n  b\n c"));
    assertThat(StringAssembler.stripIndent(ImmutableList.of(lit("  \n  a\n  "))))
        .containsExactly(lit("a"));
  }

  @Test
  public void crlfLineEndings() {
    assertThat(StringAssembler.stripIndent(ImmutableList.of(lit("\r\n  a\r\n  b\r\n"))))
        .containsExactly(lit("a\r\nb"));
  }

  @Test
  public void expressionAloneOnItsLineKeepsRelativeIndent() {
    ImmutableList<StrChunk> chunks =
        StringAssembler.stripIndent(ImmutableList.of(lit("\n  a\n      "), expr(X, 0), lit("\n")));
    assertThat(chunks).containsExactly(lit("a\n    "), expr(X, 4)).inOrder();
  }

  @Test
  public void textAfterExpressionResetsIndent() {
    ImmutableList<StrChunk> chunks =
        StringAssembler.stripIndent(
            ImmutableList.of(lit("\n  a\n    "), expr(X, 0), lit(" and more\n")));
    assertThat(chunks).containsExactly(lit("a\n  "), expr(X, 0), lit(" and more")).inOrder();
  }

  @Test
  public void secondExpressionResetsIndent() {
    ImmutableList<StrChunk> chunks =
        StringAssembler.stripIndent(
            ImmutableList.of(lit("\n  a\n    "), expr(X, 0), expr(Y, 0), lit("\n    "), expr(Y, 0)));
    assertThat(chunks)
        .containsExactly(lit("a\n  "), expr(X, 0), expr(Y, 0), lit("\n  "), expr(Y, 2))
        .inOrder();
  }

  @Test
  public void trailingWhitespaceAfterExpressionKeepsIndent() {
    ImmutableList<StrChunk> chunks =
        StringAssembler.stripIndent(ImmutableList.of(lit("\n  a\n    "), expr(X, 0), lit("  \n  b")));
    assertThat(chunks).containsExactly(lit("a\n  "), expr(X, 2), lit("  \nb")).inOrder();
  }
}

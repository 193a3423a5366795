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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.nickellang.term.FileId;
import org.nickellang.term.Ident;
import org.nickellang.term.RichTerm;
import org.nickellang.term.Span;
import org.nickellang.term.Term;
import org.nickellang.types.Types;

@RunWith(JUnit4.class)
public class TermParserTest {
  private static final FileId FILE = new FileId(3);

  private static RichTerm parse(String source) {
    return TermParser.parseTerm(FILE, source);
  }

  @Test
  public void positions() {
    RichTerm sum = parse("1 + 20");
    assertThat(sum.pos()).isEqualTo(new Span(FILE, 0, 6));
    Term.Op2 op2 = (Term.Op2) sum.term();
    assertThat(op2.left().pos()).isEqualTo(new Span(FILE, 0, 1));
    assertThat(op2.right().pos()).isEqualTo(new Span(FILE, 4, 6));
  }

  @Test
  public void parenthesesKeepInnerPosition() {
    RichTerm term = parse("( x )");
    assertThat(term.pos()).isEqualTo(new Span(FILE, 2, 3));
  }

  @Test
  public void everyFunctionWrapperHasTheWholeSpan() {
    RichTerm term = parse("fun x y => x");
    Span whole = new Span(FILE, 0, 12);
    assertThat(term.pos()).isEqualTo(whole);
    Term.Fun outer = (Term.Fun) term.term();
    assertThat(outer.param()).isEqualTo(Ident.of("x"));
    assertThat(outer.body().pos()).isEqualTo(whole);
    Term.Fun inner = (Term.Fun) outer.body().term();
    assertThat(inner.param()).isEqualTo(Ident.of("y"));
    assertThat(inner.body().pos()).isEqualTo(new Span(FILE, 11, 12));
  }

  @Test
  public void desugaredNodesHaveNoPosition() {
    RichTerm term = parse("if a then b else c");
    assertThat(term.pos()).isEqualTo(new Span(FILE, 0, 18));
    Term.App outer = (Term.App) term.term();
    assertThat(outer.fun().pos()).isNull();
    Term.App inner = (Term.App) outer.fun().term();
    assertThat(inner.fun().pos()).isNull();
    assertThat(((Term.Op1) inner.fun().term()).arg().pos()).isEqualTo(new Span(FILE, 3, 4));
  }

  @Test
  public void typeAnnotationLabelSpansTheType() {
    RichTerm term = parse("let f : Num -> Num = g in f");
    Term.Let let = (Term.Let) term.term();
    Term.Promise promise = (Term.Promise) let.bound().term();
    assertThat(promise.type()).isEqualTo(Types.arrow(Types.NUM, Types.NUM));
    assertThat(promise.label().span()).isEqualTo(new Span(FILE, 8, 18));
    assertThat(promise.label().types()).isEqualTo(promise.type());
    assertThat(promise.label().polarity()).isTrue();
    assertThat(promise.label().path()).isEmpty();
    assertThat(promise.term().toString()).isEqualTo("Var(g)");
  }

  @Test
  public void constructorLabelSpansTheConstructor() {
    RichTerm term = parse("x + Assume(Num, y)");
    Term.Assume assume = (Term.Assume) ((Term.Op2) term.term()).right().term();
    assertThat(assume.label().span()).isEqualTo(new Span(FILE, 4, 18));
  }

  @Test
  public void duplicateRecordFieldLastWins() {
    Term.RecRecord record = (Term.RecRecord) parse("{ a = 1; b = 2; a = 3 }").term();
    assertThat(record.fields().keySet()).containsExactly(Ident.of("a"), Ident.of("b")).inOrder();
    assertThat(record.fields().get(Ident.of("a")).toString()).isEqualTo("Num(3)");
  }

  @Test
  public void emptyContainers() {
    assertThat(parse("{}").term()).isEqualTo(new Term.RecRecord(ImmutableMap.of()));
    assertThat(parse("[]").term()).isEqualTo(new Term.List(ImmutableList.of()));
  }

  @Test
  public void replBinding() {
    ExtendedTerm result = TermParser.parseReplInput(FILE, "let x : Num = 1 + 1");
    assertThat(result).isInstanceOf(ExtendedTerm.Binding.class);
    ExtendedTerm.Binding binding = (ExtendedTerm.Binding) result;
    assertThat(binding.id()).isEqualTo(Ident.of("x"));
    assertThat(binding.term().toString()).isEqualTo("Promise(Num, Op2(Plus, Num(1), Num(1)))");
  }

  @Test
  public void replExpression() {
    ExtendedTerm result = TermParser.parseReplInput(FILE, "let x = 1 in x");
    assertThat(result).isInstanceOf(ExtendedTerm.Expression.class);
    assertThat(((ExtendedTerm.Expression) result).term().toString())
        .isEqualTo("Let(x, Num(1), Var(x))");
  }

  @Test
  public void parseType() {
    assertThat(TermParser.parseType(FILE, "Num -> Bool -> Str"))
        .isEqualTo(Types.arrow(Types.NUM, Types.arrow(Types.BOOL, Types.STR)));
    assertThat(TermParser.parseType(FILE, "forall a b. a"))
        .isEqualTo(
            new Types.Forall(Ident.of("a"), new Types.Forall(Ident.of("b"), Types.var("a"))));
  }

  @Test
  public void unexpectedEof() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> parse("1 +"));
    assertThat(e.kind).isEqualTo(SyntaxError.Kind.UNEXPECTED_EOF);
    assertThat(e.lineNum).isEqualTo(1);
    assertThat(e.span).isEqualTo(new Span(FILE, 3, 3));
  }

  @Test
  public void unexpectedToken() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> parse("let x =\n  1 +\n  )"));
    assertThat(e.kind).isEqualTo(SyntaxError.Kind.UNEXPECTED_TOKEN);
    assertThat(e.found).isEqualTo(")");
    assertThat(e.lineNum).isEqualTo(3);
    assertThat(e.charPositionInLine).isEqualTo(2);
    assertThat(e.span).isEqualTo(new Span(FILE, 16, 17));
    assertThat(e.getMessage()).endsWith("(3:2)");
  }

  @Test
  public void delimiterMismatch() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> parse("x ++ \"abc\"#m"));
    assertThat(e.kind).isEqualTo(SyntaxError.Kind.DELIMITER_MISMATCH);
    assertThat(e.found).isEqualTo("\"#m");
    assertThat(e.span).isEqualTo(new Span(FILE, 9, 12));
  }

  @Test
  public void lexicalError() {
    LexicalError e = assertThrows(LexicalError.class, () -> parse("1 ~ 2"));
    assertThat(e.getMessage()).isEqualTo("token recognition error at: '~' (1:2)");
    assertThat(e.span).isEqualTo(new Span(FILE, 2, 3));
  }

  @Test
  public void staticStringsDoNotInterpolate() {
    assertThrows(SyntaxError.class, () -> parse("import \"a#{x}\""));
  }
}

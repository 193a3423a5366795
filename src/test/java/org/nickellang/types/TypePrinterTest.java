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
package org.nickellang.types;

import static com.google.common.truth.Truth.assertThat;

import java.util.stream.Stream;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.nickellang.syntax.TermParser;
import org.nickellang.term.FileId;
import org.nickellang.term.Ident;
import org.nickellang.term.Terms;

@RunWith(JUnitParamsRunner.class)
public class TypePrinterTest {

  @Test
  public void printsSurfaceSyntax() {
    Types row = new Types.RowExtend(Ident.of("a"), Types.NUM, Types.DYN);
    assertThat(TypePrinter.print(new Types.StaticRecord(row))).isEqualTo("{a: Num | Dyn}");
    assertThat(TypePrinter.print(new Types.Enum(Types.ROW_EMPTY))).isEqualTo("<>");
    assertThat(TypePrinter.print(new Types.DynRecord(new Types.List(Types.NUM))))
        .isEqualTo("{_: List Num}");
    assertThat(TypePrinter.print(Types.arrow(new Types.List(Types.NUM), Types.NUM)))
        .isEqualTo("List Num -> Num");
    assertThat(TypePrinter.print(new Types.Flat(Terms.var("c")))).isEqualTo("#Var(c)");
  }

  @Test
  public void listTypes() {
    Types listOfNum = new Types.List(Types.NUM);
    assertThat(TypePrinter.print(listOfNum)).isEqualTo("List Num");
    assertThat(TypePrinter.print(new Types.List(listOfNum))).isEqualTo("List (List Num)");
    assertThat(TypePrinter.print(new Types.List(Types.arrow(Types.NUM, Types.NUM))))
        .isEqualTo("List (Num -> Num)");
    assertThat(TypePrinter.print(Types.arrow(Types.NUM, listOfNum))).isEqualTo("Num -> List Num");
  }

  @Test
  public void rowHelpers() {
    Types row =
        new Types.RowExtend(
            Ident.of("a"), null, new Types.RowExtend(Ident.of("b"), null, Types.var("r")));
    assertThat(Types.rowLabels(row)).containsExactly(Ident.of("a"), Ident.of("b")).inOrder();
    assertThat(Types.rowTail(row)).isEqualTo(Types.var("r"));
    assertThat(Types.rowTail(Types.ROW_EMPTY)).isEqualTo(Types.ROW_EMPTY);
  }

  private static Object[] canonicalTypes() {
    return Stream.of(
            "Dyn",
            "Num -> Bool -> Str",
            "(Num -> Num) -> Num",
            "forall a b. a -> b",
            "(forall a. a) -> Num",
            "List (List Num)",
            "List Dyn",
            "<a, b | r>",
            "{a: Num, b: <x, y> | Dyn}",
            "{_: Num -> Num}",
            "{}")
        .map(source -> new Object[] {source})
        .toArray();
  }

  /** Printing a parsed type gives back the source, for sources written in canonical form. */
  @Test
  @Parameters(method = "canonicalTypes")
  public void roundTrip(String source) {
    assertThat(TypePrinter.print(TermParser.parseType(new FileId(0), source))).isEqualTo(source);
  }

  @Test
  public void rowsKeepSourceOrder() {
    Types type = TermParser.parseType(new FileId(0), "{c: Num, a: Str, b: Bool}");
    Types row = ((Types.StaticRecord) type).row();
    assertThat(Types.rowLabels(row))
        .containsExactly(Ident.of("c"), Ident.of("a"), Ident.of("b"))
        .inOrder();
    assertThat(Types.rowTail(row)).isEqualTo(Types.ROW_EMPTY);
  }
}

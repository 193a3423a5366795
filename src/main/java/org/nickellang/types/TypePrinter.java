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

import org.nickellang.term.Pretty;

/**
 * Prints types in Nickel's surface syntax, e.g. {@code forall a. List a -> {x: a | Dyn}}.
 * Parenthesization is minimal, so parsing the output gives back an equal type (up to the terms
 * inside flat types, which are printed as trees).
 */
public final class TypePrinter {

  private final StringBuilder sb = new StringBuilder();

  private TypePrinter() {}

  public static String print(Types types) {
    TypePrinter printer = new TypePrinter();
    printer.append(types);
    return printer.sb.toString();
  }

  private void append(Types types) {
    if (types instanceof Types.Arrow arrow) {
      appendOperand(arrow.domain(), true);
      sb.append(" -> ");
      append(arrow.codomain());
    } else if (types instanceof Types.Forall forall) {
      sb.append("forall ").append(forall.var());
      Types body = forall.body();
      while (body instanceof Types.Forall inner) {
        sb.append(' ').append(inner.var());
        body = inner.body();
      }
      sb.append(". ");
      append(body);
    } else {
      appendAtom(types);
    }
  }

  /**
   * Appends a type that appears as an operand (the domain of an arrow or the element of a list),
   * parenthesizing it if needed.
   */
  private void appendOperand(Types types, boolean isDomain) {
    boolean needsParens =
        types instanceof Types.Arrow
            || types instanceof Types.Forall
            || (!isDomain && types instanceof Types.List);
    if (needsParens) {
      sb.append('(');
      append(types);
      sb.append(')');
    } else {
      appendAtom(types);
    }
  }

  /** Appends a type that is neither an arrow nor a {@code forall}. */
  private void appendAtom(Types types) {
    if (types instanceof Types.Dyn) {
      sb.append("Dyn");
    } else if (types instanceof Types.Num) {
      sb.append("Num");
    } else if (types instanceof Types.Bool) {
      sb.append("Bool");
    } else if (types instanceof Types.Str) {
      sb.append("Str");
    } else if (types instanceof Types.Var var) {
      sb.append(var.id());
    } else if (types instanceof Types.List list) {
      sb.append("List ");
      appendOperand(list.element(), false);
    } else if (types instanceof Types.Flat flat) {
      sb.append("#").append(Pretty.print(flat.contract()));
    } else if (types instanceof Types.Enum enumType) {
      sb.append('<');
      appendRow(enumType.row());
      sb.append('>');
    } else if (types instanceof Types.StaticRecord record) {
      sb.append('{');
      appendRow(record.row());
      sb.append('}');
    } else if (types instanceof Types.DynRecord record) {
      sb.append("{_: ");
      append(record.element());
      sb.append('}');
    } else if (types instanceof Types.RowEmpty || types instanceof Types.RowExtend) {
      // A bare row; only seen when printing a row on its own.
      sb.append('(');
      appendRow(types);
      sb.append(')');
    } else {
      throw new AssertionError("Unexpected type " + types.getClass());
    }
  }

  private void appendRow(Types row) {
    String separator = "";
    while (row instanceof Types.RowExtend extend) {
      sb.append(separator).append(extend.label());
      separator = ", ";
      if (extend.type() != null) {
        sb.append(": ");
        append(extend.type());
      }
      row = extend.tail();
    }
    if (!(row instanceof Types.RowEmpty)) {
      sb.append(" | ");
      append(row);
    }
  }
}

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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.nickellang.term.Ident;
import org.nickellang.term.RichTerm;

/**
 * A Nickel type.
 *
 * <p>Enum and record types are built from rows. A row is itself a type: a chain of {@link
 * RowExtend}s ending with {@link RowEmpty} (a closed row), a {@link Var} (a row variable) or
 * {@link #DYN} (an open row whose remaining fields are unconstrained).
 */
public sealed interface Types {

  Types DYN = new Dyn();
  Types NUM = new Num();
  Types BOOL = new Bool();
  Types STR = new Str();
  Types ROW_EMPTY = new RowEmpty();

  record Dyn() implements Types {}

  record Num() implements Types {}

  record Bool() implements Types {}

  record Str() implements Types {}

  record Arrow(Types domain, Types codomain) implements Types {}

  record Forall(Ident var, Types body) implements Types {}

  record Var(Ident id) implements Types {}

  /** A list type; a list written without an element type has elements of type {@link #DYN}. */
  record List(Types element) implements Types {}

  /** An opaque type defined by a contract, which may be any term. */
  record Flat(RichTerm contract) implements Types {}

  /** An enum type; {@code row} contains only field names (all field types are null). */
  record Enum(Types row) implements Types {}

  record StaticRecord(Types row) implements Types {}

  /** A record with any field names, whose fields all have type {@code element}. */
  record DynRecord(Types element) implements Types {}

  /** The end of a closed row. */
  record RowEmpty() implements Types {}

  /**
   * A row with one more field. {@code type} is the field's type in a record row, and null in an
   * enum row.
   */
  record RowExtend(Ident label, @Nullable Types type, Types tail) implements Types {}

  static Types var(String id) {
    return new Var(Ident.of(id));
  }

  static Types arrow(Types domain, Types codomain) {
    return new Arrow(domain, codomain);
  }

  /** Returns the field names of a row, outermost (i.e. first declared) first. */
  static ImmutableList<Ident> rowLabels(Types row) {
    ImmutableList.Builder<Ident> builder = ImmutableList.builder();
    while (row instanceof RowExtend extend) {
      builder.add(extend.label());
      row = extend.tail();
    }
    return builder.build();
  }

  /** Returns what remains after all the {@link RowExtend}s of a row. */
  static Types rowTail(Types row) {
    while (row instanceof RowExtend extend) {
      row = extend.tail();
    }
    return row;
  }
}

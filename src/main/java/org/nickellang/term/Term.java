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

package org.nickellang.term;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;
import org.nickellang.types.Types;

/**
 * A Nickel term, without position information (see {@link RichTerm}).
 *
 * <p>Each syntactic form is a separate record; consumers dispatch with {@code instanceof}. Terms
 * are immutable and never shared between two parents.
 */
public sealed interface Term {

  /** A boolean literal. */
  record Bool(boolean value) implements Term {}

  /** A number literal; all numbers are 64-bit floats. */
  record Num(double value) implements Term {}

  /** A fully resolved string. */
  record Str(String value) implements Term {}

  /** A string with interpolated expressions, as a sequence of chunks in source order. */
  record StrChunks(ImmutableList<StrChunk> chunks) implements Term {}

  record Var(Ident id) implements Term {}

  /** A single-parameter function. */
  record Fun(Ident param, RichTerm body) implements Term {}

  record Let(Ident id, RichTerm bound, RichTerm body) implements Term {}

  record App(RichTerm fun, RichTerm arg) implements Term {}

  /** A primitive operator applied to one argument. */
  record Op1(UnaryOp op, RichTerm arg) implements Term {}

  /** A primitive operator applied to two arguments. */
  record Op2(BinaryOp op, RichTerm left, RichTerm right) implements Term {}

  /**
   * A pattern match over enum tags. {@code defaultCase} is null if there is no {@code _} branch.
   */
  record Switch(RichTerm exp, ImmutableMap<Ident, RichTerm> cases, @Nullable RichTerm defaultCase)
      implements Term {}

  /** An import of another file; the path is neither resolved nor validated. */
  record Import(String path) implements Term {}

  record List(ImmutableList<RichTerm> elements) implements Term {}

  /** An enum tag, e.g. {@code `foo}. */
  record Enum(Ident tag) implements Term {}

  /** A record with statically known field names. */
  record RecRecord(ImmutableMap<Ident, RichTerm> fields) implements Term {}

  /** A type ascription: {@code term} is statically checked against {@code type}. */
  record Promise(Types type, Label label, RichTerm term) implements Term {}

  /** A contract assumption: {@code term} is checked against {@code type} at runtime. */
  record Assume(Types type, Label label, RichTerm term) implements Term {}

  /** A value enriched with metadata. */
  record Meta(MetaValue meta) implements Term {}
}

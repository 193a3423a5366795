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

import com.google.common.base.CaseFormat;
import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * A primitive operator of arity two. Only {@link Kind#DYN_EXTEND} carries a term: the value bound
 * to the new field, while the operands are the field name and the record being extended.
 */
public record BinaryOp(Kind kind, @Nullable RichTerm value) {

  public BinaryOp {
    Preconditions.checkArgument(
        (value != null) == (kind == Kind.DYN_EXTEND), "Bad value for %s", kind);
  }

  public static BinaryOp of(Kind kind) {
    return new BinaryOp(kind, null);
  }

  public static BinaryOp dynExtend(RichTerm value) {
    return new BinaryOp(Kind.DYN_EXTEND, value);
  }

  @Override
  public String toString() {
    return (value == null) ? kind.toString() : String.format("%s(%s)", kind, value);
  }

  /** The binary operators, with the token that denotes each one (null if none). */
  public enum Kind {
    PLUS("+"),
    SUB("-"),
    MULT("*"),
    DIV("/"),
    MODULO("%"),
    PLUS_STR("++"),
    LIST_CONCAT("@"),
    MERGE("&"),
    LESS_THAN("<"),
    LESS_OR_EQ("<="),
    GREATER_THAN(">"),
    GREATER_OR_EQ(">="),
    EQ("=="),
    DYN_ACCESS(".$"),
    DYN_REMOVE("-$"),
    DYN_EXTEND(null),
    UNWRAP("unwrap"),
    GO_FIELD("goField"),
    HAS_FIELD("hasField"),
    ELEM_AT("elemAt"),
    LIST_MAP("map"),
    STR_SPLIT("strSplit"),
    STR_CONTAINS("strContains");

    public final @Nullable String spelling;

    private final String displayName;

    Kind(@Nullable String spelling) {
      this.spelling = spelling;
      this.displayName = CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, name());
    }

    @Override
    public String toString() {
      return displayName;
    }
  }
}

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
 * A primitive operator of arity one. {@link Kind#STATIC_ACCESS} and {@link Kind#EMBED} carry an
 * identifier (the field name and the enum tag respectively); no other kind does.
 */
public record UnaryOp(Kind kind, @Nullable Ident ident) {

  public UnaryOp {
    Preconditions.checkArgument(
        (ident != null) == kind.hasIdent, "Bad identifier for %s: %s", kind, ident);
  }

  public static UnaryOp of(Kind kind) {
    return new UnaryOp(kind, null);
  }

  public static UnaryOp staticAccess(Ident field) {
    return new UnaryOp(Kind.STATIC_ACCESS, field);
  }

  public static UnaryOp embed(Ident tag) {
    return new UnaryOp(Kind.EMBED, tag);
  }

  @Override
  public String toString() {
    return (ident == null) ? kind.toString() : String.format("%s(%s)", kind, ident);
  }

  /**
   * The unary operators. Operators with a spelling are written as prefix keywords (e.g. {@code
   * isNum x}); the others are only produced by desugaring.
   */
  public enum Kind {
    ITE(null),
    BOOL_AND(null),
    BOOL_OR(null),
    BOOL_NOT(null),
    STATIC_ACCESS(null, true),
    EMBED("embed", true),
    IS_NUM("isNum"),
    IS_BOOL("isBool"),
    IS_STR("isStr"),
    IS_FUN("isFun"),
    IS_LIST("isList"),
    IS_RECORD("isRecord"),
    BLAME("blame"),
    CHNG_POL("chngPol"),
    POLARITY("polarity"),
    GO_DOM("goDom"),
    GO_CODOM("goCodom"),
    GO_LIST("goList"),
    WRAP("wrap"),
    HEAD("head"),
    TAIL("tail"),
    LENGTH("length"),
    FIELDS_OF("fieldsOf"),
    VALUES_OF("valuesOf"),
    SEQ("seq"),
    DEEP_SEQ("deepSeq"),
    STR_TRIM("strTrim"),
    STR_CHARS("strChars"),
    STR_LENGTH("strLength"),
    STR_UPPERCASE("strUppercase"),
    STR_LOWERCASE("strLowercase"),
    STR_FROM("strFrom"),
    NUM_FROM("numFrom"),
    ENUM_FROM("enumFrom"),
    CHAR_CODE("charCode"),
    CHAR_FROM_CODE("charFromCode");

    /** The keyword for this operator, or null if it has no surface syntax of its own. */
    public final @Nullable String spelling;

    final boolean hasIdent;

    private final String displayName;

    Kind(@Nullable String spelling) {
      this(spelling, false);
    }

    Kind(@Nullable String spelling, boolean hasIdent) {
      this.spelling = spelling;
      this.hasIdent = hasIdent;
      this.displayName = CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, name());
    }

    @Override
    public String toString() {
      return displayName;
    }
  }
}

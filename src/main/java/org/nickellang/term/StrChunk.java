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

/** One piece of a {@link Term.StrChunks}: either literal text or an interpolated expression. */
public sealed interface StrChunk {

  record Literal(String value) implements StrChunk {}

  /**
   * An interpolated expression. {@code indent} is non-zero only for an expression that stands
   * alone on its line in a multiline string; each line of its value will be indented by that many
   * characters when the string is evaluated.
   */
  record Expr(RichTerm term, int indent) implements StrChunk {
    public Expr withIndent(int indent) {
      return new Expr(term, indent);
    }
  }
}

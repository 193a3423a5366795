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

import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;

/** A term together with the span of source it was parsed from, if any. */
public record RichTerm(Term term, @Nullable Span pos) {

  /** Returns a RichTerm with no position. */
  public static RichTerm of(Term term) {
    return new RichTerm(term, null);
  }

  /** Returns a RichTerm with the same term and the given position. */
  public RichTerm withPos(@Nullable Span pos) {
    return new RichTerm(term, pos);
  }

  /**
   * Applies {@code fn} to every node of this term, children first. See {@link Traversal}.
   */
  public RichTerm traverse(UnaryOperator<RichTerm> fn) {
    return Traversal.bottomUp(this, fn);
  }

  @Override
  public String toString() {
    return Pretty.print(this);
  }
}

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
import org.nickellang.types.Types;

/**
 * A blame label: identifies the place where a contract obligation was introduced, so that a
 * violation can be reported against it.
 *
 * <p>{@code tag}, {@code polarity} and {@code path} are maintained by the contract machinery; a
 * label built by the parser always has an empty tag, positive polarity and an empty path.
 */
public record Label(
    Types types, String tag, Span span, boolean polarity, ImmutableList<PathElem> path) {

  /**
   * Returns a fresh label for a contract on {@code types} written at {@code span}. The result
   * depends only on its arguments, so reparsing the same source gives equal labels.
   */
  public static Label of(Types types, Span span) {
    return new Label(types, "", span, true, ImmutableList.of());
  }

  /**
   * A step from a type to one of its components. Only the contract machinery extends a path; the
   * parser never does.
   */
  public enum PathElem {
    DOMAIN,
    CODOMAIN
  }
}

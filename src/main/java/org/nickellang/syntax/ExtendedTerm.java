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

import org.nickellang.term.Ident;
import org.nickellang.term.RichTerm;

/**
 * The result of parsing a line of interactive input: either a plain term, or a top-level {@code
 * let} without a body, which binds an identifier for the rest of the session.
 */
public sealed interface ExtendedTerm {

  record Expression(RichTerm term) implements ExtendedTerm {}

  record Binding(Ident id, RichTerm term) implements ExtendedTerm {}
}

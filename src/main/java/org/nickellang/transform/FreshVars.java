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
package org.nickellang.transform;

import org.nickellang.term.Ident;

/**
 * Generates identifiers that cannot clash with user-written ones, since they start with a
 * character that is not allowed in the surface syntax. Not thread-safe; use one instance per
 * transformation.
 */
public class FreshVars {
  private int next;

  public Ident next() {
    return Ident.of("%" + next++);
  }
}

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

import com.google.common.base.Preconditions;

/**
 * A range of characters in a source file. {@code start} is the offset of the first character and
 * {@code end} is the offset just past the last one.
 */
public record Span(FileId file, int start, int end) {
  public Span {
    Preconditions.checkArgument(start >= 0 && start <= end, "Bad span %s..%s", start, end);
  }

  public int length() {
    return end - start;
  }

  @Override
  public String toString() {
    return String.format("%s:%s-%s", file, start, end);
  }
}

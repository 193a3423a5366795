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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.List;
import org.nickellang.term.FileId;
import org.nickellang.term.Span;

/**
 * Keeps the name and contents of each source file, so that spans can be turned back into
 * human-readable locations. Safe for use from multiple threads.
 */
public class Files {

  private record SourceFile(String name, String contents) {}

  @GuardedBy("this")
  private final List<SourceFile> files = new ArrayList<>();

  /** Registers a new source file and returns its id. */
  public synchronized FileId add(String name, String contents) {
    files.add(new SourceFile(name, contents));
    return new FileId(files.size() - 1);
  }

  public synchronized String name(FileId id) {
    return get(id).name;
  }

  public synchronized String contents(FileId id) {
    return get(id).contents;
  }

  /** Returns the source text covered by {@code span}. */
  public synchronized String text(Span span) {
    return get(span.file()).contents.substring(span.start(), span.end());
  }

  /** Returns the start of {@code span} as "{@code name:line:column}", both 1-based. */
  public synchronized String location(Span span) {
    SourceFile file = get(span.file());
    int line = 1;
    int lineStart = 0;
    int end = Math.min(span.start(), file.contents.length());
    for (int i = 0; i < end; i++) {
      if (file.contents.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
    return String.format("%s:%s:%s", file.name, line, span.start() - lineStart + 1);
  }

  @GuardedBy("this")
  private SourceFile get(FileId id) {
    Preconditions.checkArgument(id.index() < files.size(), "Unknown file %s", id);
    return files.get(id.index());
  }
}

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

/**
 * The priority of a value when two records define the same field and are merged. Declaration
 * order matters: {@code DEFAULT < NORMAL}, and a value with a lower priority is overridden by one
 * with a higher priority.
 */
public enum MergePriority {
  DEFAULT,
  NORMAL;

  /** Returns the lower of the two priorities. */
  public static MergePriority min(MergePriority p1, MergePriority p2) {
    return (p1.compareTo(p2) <= 0) ? p1 : p2;
  }

  @Override
  public String toString() {
    return (this == DEFAULT) ? "Default" : "Normal";
  }
}

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

import org.jspecify.annotations.Nullable;
import org.nickellang.types.Types;

/**
 * The metadata that can be attached to a value: documentation, a contract and a merge priority.
 * {@code value} is the annotated term, or null for metadata that doesn't wrap a value (e.g. {@code
 * Contract(Num)}).
 */
public record MetaValue(
    @Nullable String doc,
    @Nullable Contract contract,
    MergePriority priority,
    @Nullable RichTerm value) {

  /** No documentation, no contract, normal priority and no value. */
  public static final MetaValue EMPTY = new MetaValue(null, null, MergePriority.NORMAL, null);

  public static MetaValue ofDoc(String doc) {
    return new MetaValue(doc, null, MergePriority.NORMAL, null);
  }

  public static MetaValue ofContract(Types types, Label label) {
    return new MetaValue(null, new Contract(types, label), MergePriority.NORMAL, null);
  }

  public static MetaValue ofPriority(MergePriority priority) {
    return new MetaValue(null, null, priority, null);
  }

  public MetaValue withValue(@Nullable RichTerm value) {
    return new MetaValue(doc, contract, priority, value);
  }

  /**
   * Combines the metadata of two annotations, where {@code outer} was written before {@code
   * inner}.
   *
   * <p>The documentation, contract and value of {@code outer} are kept if present; the priority
   * is the lower of the two. Folding a sequence of annotations with this function thus keeps the
   * first documentation, contract and value, but the most overridable priority.
   */
  public static MetaValue flatten(MetaValue outer, MetaValue inner) {
    return new MetaValue(
        (outer.doc != null) ? outer.doc : inner.doc,
        (outer.contract != null) ? outer.contract : inner.contract,
        MergePriority.min(outer.priority, inner.priority),
        (outer.value != null) ? outer.value : inner.value);
  }

  /** A contract, with the label to blame if it is violated. */
  public record Contract(Types types, Label label) {}
}

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

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.nickellang.term.BinaryOp;
import org.nickellang.term.Ident;
import org.nickellang.term.RichTerm;
import org.nickellang.term.Span;
import org.nickellang.term.Term;

/**
 * Collects the fields of a record literal and builds the corresponding term.
 *
 * <p>Fields with a static name go into a {@link Term.RecRecord}; if a name is repeated the last
 * value wins. Each field with a computed name ({@code $key = value}) is then added on top of that
 * record, in source order, by a {@link BinaryOp.Kind#DYN_EXTEND} operation.
 */
class RecordAssembler {
  private final Map<Ident, RichTerm> staticFields = new LinkedHashMap<>();
  private final List<DynamicField> dynamicFields = new ArrayList<>();

  private record DynamicField(RichTerm key, RichTerm value) {}

  @CanIgnoreReturnValue
  RecordAssembler addStatic(Ident id, RichTerm value) {
    staticFields.put(id, value);
    return this;
  }

  @CanIgnoreReturnValue
  RecordAssembler addDynamic(RichTerm key, RichTerm value) {
    dynamicFields.add(new DynamicField(key, value));
    return this;
  }

  /** Returns the record term; {@code pos} is attached to the outermost node. */
  RichTerm build(Span pos) {
    RichTerm result = RichTerm.of(new Term.RecRecord(ImmutableMap.copyOf(staticFields)));
    for (DynamicField field : dynamicFields) {
      result = RichTerm.of(new Term.Op2(BinaryOp.dynExtend(field.value), field.key, result));
    }
    return result.withPos(pos);
  }
}

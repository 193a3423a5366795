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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.nickellang.term.Ident;
import org.nickellang.term.MetaValue;
import org.nickellang.term.RichTerm;
import org.nickellang.term.Term;
import org.nickellang.term.Terms;

/**
 * Rewrites a term so that the expensive subterms of records, lists and annotated values are bound
 * to variables by an enclosing {@code let}, and so are evaluated at most once when the containing
 * value is copied.
 *
 * <p>For example {@code {a = 1 + 1; b = 2}} becomes {@code let %0 = 1 + 1 in {a = %0; b = 2}}.
 * Values that are already cheap to copy, such as numbers or variables, are left in place.
 */
public class ShareNormalForm {

  // Statics only
  private ShareNormalForm() {}

  /** Applies the rewrite to every node of {@code rt}, from the leaves up. */
  public static RichTerm transform(RichTerm rt) {
    FreshVars fresh = new FreshVars();
    return rt.traverse(node -> transformOne(node, fresh));
  }

  /**
   * Applies one step of the rewrite to the top-level node of {@code rt}; subterms are not
   * visited. Returns {@code rt} unchanged if it is not a record, a list, or metadata with a value.
   */
  public static RichTerm transformOne(RichTerm rt, FreshVars fresh) {
    List<Binding> bindings = new ArrayList<>();
    Term result;
    if (rt.term() instanceof Term.RecRecord record) {
      ImmutableMap.Builder<Ident, RichTerm> fields = ImmutableMap.builder();
      for (Map.Entry<Ident, RichTerm> entry : record.fields().entrySet()) {
        fields.put(entry.getKey(), share(entry.getValue(), bindings, fresh));
      }
      result = new Term.RecRecord(fields.buildOrThrow());
    } else if (rt.term() instanceof Term.List list) {
      ImmutableList.Builder<RichTerm> elements = ImmutableList.builder();
      for (RichTerm element : list.elements()) {
        elements.add(share(element, bindings, fresh));
      }
      result = new Term.List(elements.build());
    } else if (rt.term() instanceof Term.Meta meta && meta.meta().value() != null) {
      MetaValue value = meta.meta();
      result = new Term.Meta(value.withValue(share(value.value(), bindings, fresh)));
    } else {
      return rt;
    }
    if (bindings.isEmpty()) {
      return rt;
    }
    // The first binding ends up innermost.
    RichTerm acc = new RichTerm(result, rt.pos());
    for (Binding binding : bindings) {
      acc = Terms.let(binding.id, binding.term, acc);
    }
    return acc;
  }

  private record Binding(Ident id, RichTerm term) {}

  /**
   * If {@code term} should be shared, records a binding for it and returns a reference to the new
   * variable; otherwise returns {@code term}.
   */
  private static RichTerm share(RichTerm term, List<Binding> bindings, FreshVars fresh) {
    if (!shouldShare(term.term())) {
      return term;
    }
    Ident id = fresh.next();
    bindings.add(new Binding(id, term));
    return RichTerm.of(new Term.Var(id));
  }

  /**
   * Returns true unless {@code term} is already a value that can be copied without duplicating
   * work.
   */
  static boolean shouldShare(Term term) {
    return !(term instanceof Term.Bool
        || term instanceof Term.Num
        || term instanceof Term.Str
        || term instanceof Term.Var
        || term instanceof Term.Enum
        || term instanceof Term.Fun);
  }
}

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

import java.util.List;
import org.nickellang.syntax.NickelParser.AnnotationContext;
import org.nickellang.syntax.NickelParser.ContractAnnotContext;
import org.nickellang.syntax.NickelParser.DefaultAnnotContext;
import org.nickellang.syntax.NickelParser.DocAnnotContext;
import org.nickellang.syntax.NickelParser.MetaAnnotAtomContext;
import org.nickellang.syntax.NickelParser.TypeAnnotContext;
import org.nickellang.term.Label;
import org.nickellang.term.MergePriority;
import org.nickellang.term.MetaValue;
import org.nickellang.term.RichTerm;
import org.nickellang.term.Term;
import org.nickellang.types.Types;

/**
 * Builds the metadata described by the annotations on a {@code let} binding or record field, e.g.
 * {@code | Num | default | doc "a number"}.
 *
 * <p>Each annotation contributes a MetaValue with a single piece of content; these are merged from
 * left to right with {@link MetaValue#flatten}, so the first doc and contract win and the priority
 * is the lowest one given.
 */
class MetaBuilder extends VisitorBase<MetaValue> {
  private final TermBuilder terms;

  MetaBuilder(TermBuilder terms) {
    super(terms.file);
    this.terms = terms;
  }

  /** Merges a sequence of annotations, starting from {@link MetaValue#EMPTY}. */
  MetaValue merge(List<MetaAnnotAtomContext> atoms) {
    MetaValue result = MetaValue.EMPTY;
    for (MetaAnnotAtomContext atom : atoms) {
      result = MetaValue.flatten(result, visit(atom));
    }
    return result;
  }

  /**
   * Wraps {@code value} as required by {@code annotation}: a type annotation makes it a {@link
   * Term.Promise}, and any metadata makes the result the value of a {@link Term.Meta}.
   */
  RichTerm annotate(AnnotationContext annotation, RichTerm value) {
    RichTerm result = value;
    TypeAnnotContext typeAnnot = annotation.typeAnnot();
    if (typeAnnot != null) {
      Types type = terms.types.visit(typeAnnot.types());
      Label label = Label.of(type, span(typeAnnot.types()));
      result = new RichTerm(new Term.Promise(type, label, result), value.pos());
    }
    List<MetaAnnotAtomContext> atoms = annotation.metaAnnotAtom();
    if (!atoms.isEmpty()) {
      MetaValue meta = merge(atoms).withValue(result);
      result = new RichTerm(new Term.Meta(meta), value.pos());
    }
    return result;
  }

  @Override
  public MetaValue visitDefaultAnnot(DefaultAnnotContext ctx) {
    return MetaValue.ofPriority(MergePriority.DEFAULT);
  }

  @Override
  public MetaValue visitDocAnnot(DocAnnotContext ctx) {
    return MetaValue.ofDoc(terms.staticString(ctx.staticString()));
  }

  @Override
  public MetaValue visitContractAnnot(ContractAnnotContext ctx) {
    Types type = terms.types.visit(ctx.types());
    return MetaValue.ofContract(type, Label.of(type, span(ctx.types())));
  }
}

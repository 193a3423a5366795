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
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * Rebuilds a term tree by applying a function to each node.
 *
 * <p>The traversal is bottom-up: a node's children are transformed before the node itself is
 * passed to the function, so the function always sees already-transformed subterms. Terms
 * embedded in types (flat contracts) are left alone.
 */
public final class Traversal {

  // Statics only
  private Traversal() {}

  public static RichTerm bottomUp(RichTerm rt, UnaryOperator<RichTerm> fn) {
    Term mapped = mapChildren(rt.term(), child -> bottomUp(child, fn));
    return fn.apply(new RichTerm(mapped, rt.pos()));
  }

  /** Returns a copy of {@code term} with {@code fn} applied to each immediate subterm. */
  static Term mapChildren(Term term, UnaryOperator<RichTerm> fn) {
    if (term instanceof Term.Fun fun) {
      return new Term.Fun(fun.param(), fn.apply(fun.body()));
    } else if (term instanceof Term.Let let) {
      return new Term.Let(let.id(), fn.apply(let.bound()), fn.apply(let.body()));
    } else if (term instanceof Term.App app) {
      return new Term.App(fn.apply(app.fun()), fn.apply(app.arg()));
    } else if (term instanceof Term.Op1 op1) {
      return new Term.Op1(op1.op(), fn.apply(op1.arg()));
    } else if (term instanceof Term.Op2 op2) {
      BinaryOp op = op2.op();
      if (op.value() != null) {
        op = BinaryOp.dynExtend(fn.apply(op.value()));
      }
      return new Term.Op2(op, fn.apply(op2.left()), fn.apply(op2.right()));
    } else if (term instanceof Term.Switch sw) {
      RichTerm defaultCase = sw.defaultCase();
      return new Term.Switch(
          fn.apply(sw.exp()),
          mapValues(sw.cases(), fn),
          (defaultCase == null) ? null : fn.apply(defaultCase));
    } else if (term instanceof Term.List list) {
      return new Term.List(
          list.elements().stream().map(fn).collect(ImmutableList.toImmutableList()));
    } else if (term instanceof Term.RecRecord record) {
      return new Term.RecRecord(mapValues(record.fields(), fn));
    } else if (term instanceof Term.StrChunks chunks) {
      return new Term.StrChunks(
          chunks.chunks().stream()
              .map(chunk -> mapChunk(chunk, fn))
              .collect(ImmutableList.toImmutableList()));
    } else if (term instanceof Term.Promise promise) {
      return new Term.Promise(promise.type(), promise.label(), fn.apply(promise.term()));
    } else if (term instanceof Term.Assume assume) {
      return new Term.Assume(assume.type(), assume.label(), fn.apply(assume.term()));
    } else if (term instanceof Term.Meta meta) {
      @Nullable RichTerm value = meta.meta().value();
      return (value == null) ? term : new Term.Meta(meta.meta().withValue(fn.apply(value)));
    }
    // Bool, Num, Str, Var, Enum and Import have no subterms.
    return term;
  }

  private static StrChunk mapChunk(StrChunk chunk, UnaryOperator<RichTerm> fn) {
    if (chunk instanceof StrChunk.Expr expr) {
      return new StrChunk.Expr(fn.apply(expr.term()), expr.indent());
    }
    return chunk;
  }

  private static ImmutableMap<Ident, RichTerm> mapValues(
      ImmutableMap<Ident, RichTerm> map, UnaryOperator<RichTerm> fn) {
    ImmutableMap.Builder<Ident, RichTerm> builder =
        ImmutableMap.builderWithExpectedSize(map.size());
    for (Map.Entry<Ident, RichTerm> entry : map.entrySet()) {
      builder.put(entry.getKey(), fn.apply(entry.getValue()));
    }
    return builder.buildOrThrow();
  }
}

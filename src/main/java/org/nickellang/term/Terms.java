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

/** Convenience constructors for unpositioned terms. */
public final class Terms {

  // Statics only
  private Terms() {}

  public static RichTerm var(String id) {
    return RichTerm.of(new Term.Var(Ident.of(id)));
  }

  public static RichTerm num(double value) {
    return RichTerm.of(new Term.Num(value));
  }

  public static RichTerm bool(boolean value) {
    return RichTerm.of(new Term.Bool(value));
  }

  public static RichTerm str(String value) {
    return RichTerm.of(new Term.Str(value));
  }

  /** Returns {@code fn} applied to each of {@code args} in turn. */
  public static RichTerm app(RichTerm fn, RichTerm... args) {
    RichTerm result = fn;
    for (RichTerm arg : args) {
      result = RichTerm.of(new Term.App(result, arg));
    }
    return result;
  }

  public static RichTerm op1(UnaryOp.Kind kind, RichTerm arg) {
    return op1(UnaryOp.of(kind), arg);
  }

  public static RichTerm op1(UnaryOp op, RichTerm arg) {
    return RichTerm.of(new Term.Op1(op, arg));
  }

  public static RichTerm op2(BinaryOp.Kind kind, RichTerm left, RichTerm right) {
    return op2(BinaryOp.of(kind), left, right);
  }

  public static RichTerm op2(BinaryOp op, RichTerm left, RichTerm right) {
    return RichTerm.of(new Term.Op2(op, left, right));
  }

  public static RichTerm let(Ident id, RichTerm bound, RichTerm body) {
    return RichTerm.of(new Term.Let(id, bound, body));
  }
}

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

import java.util.Map;
import org.nickellang.types.TypePrinter;
import org.nickellang.util.StringUtil;

/**
 * Renders a term as a one-line constructor tree, e.g. {@code Fun(x, Op2(Plus, Var(x), Num(1)))}.
 * Positions are not printed. Types are printed in their surface syntax.
 */
public final class Pretty {

  private final StringBuilder sb = new StringBuilder();

  private Pretty() {}

  public static String print(RichTerm rt) {
    Pretty pretty = new Pretty();
    pretty.append(rt);
    return pretty.sb.toString();
  }

  /** Formats a number the way it would usually be written: integral values have no fraction. */
  public static String formatNum(double d) {
    if (d == Math.rint(d) && Math.abs(d) < 1e15) {
      return Long.toString((long) d);
    }
    return Double.toString(d);
  }

  private void append(RichTerm rt) {
    Term term = rt.term();
    if (term instanceof Term.Bool bool) {
      sb.append("Bool(").append(bool.value()).append(')');
    } else if (term instanceof Term.Num num) {
      sb.append("Num(").append(formatNum(num.value())).append(')');
    } else if (term instanceof Term.Str str) {
      sb.append("Str(").append(StringUtil.quote(str.value())).append(')');
    } else if (term instanceof Term.StrChunks chunks) {
      sb.append("Chunks[");
      String separator = "";
      for (StrChunk chunk : chunks.chunks()) {
        sb.append(separator);
        separator = ", ";
        if (chunk instanceof StrChunk.Literal literal) {
          sb.append(StringUtil.quote(literal.value()));
        } else {
          StrChunk.Expr expr = (StrChunk.Expr) chunk;
          sb.append("Expr(");
          append(expr.term());
          sb.append(", ").append(expr.indent()).append(')');
        }
      }
      sb.append(']');
    } else if (term instanceof Term.Var var) {
      sb.append("Var(").append(var.id()).append(')');
    } else if (term instanceof Term.Fun fun) {
      sb.append("Fun(").append(fun.param()).append(", ");
      append(fun.body());
      sb.append(')');
    } else if (term instanceof Term.Let let) {
      sb.append("Let(").append(let.id()).append(", ");
      append(let.bound());
      sb.append(", ");
      append(let.body());
      sb.append(')');
    } else if (term instanceof Term.App app) {
      sb.append("App(");
      append(app.fun());
      sb.append(", ");
      append(app.arg());
      sb.append(')');
    } else if (term instanceof Term.Op1 op1) {
      sb.append("Op1(").append(op1.op()).append(", ");
      append(op1.arg());
      sb.append(')');
    } else if (term instanceof Term.Op2 op2) {
      sb.append("Op2(");
      appendOp(op2.op());
      sb.append(", ");
      append(op2.left());
      sb.append(", ");
      append(op2.right());
      sb.append(')');
    } else if (term instanceof Term.Switch sw) {
      sb.append("Switch(");
      append(sw.exp());
      sb.append(", {");
      appendEntries(sw.cases(), " => ", ", ");
      sb.append('}');
      if (sw.defaultCase() != null) {
        sb.append(", _ => ");
        append(sw.defaultCase());
      }
      sb.append(')');
    } else if (term instanceof Term.Import imp) {
      sb.append("Import(").append(StringUtil.quote(imp.path())).append(')');
    } else if (term instanceof Term.List list) {
      sb.append("List[");
      String separator = "";
      for (RichTerm element : list.elements()) {
        sb.append(separator);
        separator = ", ";
        append(element);
      }
      sb.append(']');
    } else if (term instanceof Term.Enum enumTag) {
      sb.append("Enum(").append(enumTag.tag()).append(')');
    } else if (term instanceof Term.RecRecord record) {
      sb.append("Record{");
      appendEntries(record.fields(), " = ", "; ");
      sb.append('}');
    } else if (term instanceof Term.Promise promise) {
      sb.append("Promise(").append(TypePrinter.print(promise.type())).append(", ");
      append(promise.term());
      sb.append(')');
    } else if (term instanceof Term.Assume assume) {
      sb.append("Assume(").append(TypePrinter.print(assume.type())).append(", ");
      append(assume.term());
      sb.append(')');
    } else if (term instanceof Term.Meta meta) {
      appendMeta(meta.meta());
    } else {
      throw new AssertionError("Unexpected term " + term.getClass());
    }
  }

  private void appendOp(BinaryOp op) {
    sb.append(op.kind());
    if (op.value() != null) {
      sb.append('(');
      append(op.value());
      sb.append(')');
    }
  }

  private void appendEntries(Map<Ident, RichTerm> map, String arrow, String separator) {
    String sep = "";
    for (Map.Entry<Ident, RichTerm> entry : map.entrySet()) {
      sb.append(sep).append(entry.getKey()).append(arrow);
      sep = separator;
      append(entry.getValue());
    }
  }

  private void appendMeta(MetaValue meta) {
    sb.append("Meta(");
    if (meta.doc() != null) {
      sb.append("doc=").append(StringUtil.quote(meta.doc())).append(", ");
    }
    if (meta.contract() != null) {
      sb.append("contract=").append(TypePrinter.print(meta.contract().types())).append(", ");
    }
    sb.append("priority=").append(meta.priority());
    if (meta.value() != null) {
      sb.append(", value=");
      append(meta.value());
    }
    sb.append(')');
  }
}

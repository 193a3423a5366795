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
import org.nickellang.syntax.NickelParser.ArrowsContext;
import org.nickellang.syntax.NickelParser.ArrowsTypeContext;
import org.nickellang.syntax.NickelParser.BaseTypeContext;
import org.nickellang.syntax.NickelParser.DynRecordTypeContext;
import org.nickellang.syntax.NickelParser.DynTailContext;
import org.nickellang.syntax.NickelParser.EnumTypeContext;
import org.nickellang.syntax.NickelParser.FlatTypeContext;
import org.nickellang.syntax.NickelParser.ForallTypeContext;
import org.nickellang.syntax.NickelParser.IdentContext;
import org.nickellang.syntax.NickelParser.ListTypeContext;
import org.nickellang.syntax.NickelParser.ParenTypeContext;
import org.nickellang.syntax.NickelParser.RecordTypeContext;
import org.nickellang.syntax.NickelParser.RecordTypeFieldContext;
import org.nickellang.syntax.NickelParser.RowTailContext;
import org.nickellang.syntax.NickelParser.VarTailContext;
import org.nickellang.syntax.NickelParser.VarTypeContext;
import org.nickellang.term.Ident;
import org.nickellang.types.Types;

/**
 * Builds {@link Types} from the type syntax: arrows, {@code forall}, base types, lists, flat
 * contracts and enum or record rows.
 */
class TypeBuilder extends VisitorBase<Types> {
  private final TermBuilder terms;

  TypeBuilder(TermBuilder terms) {
    super(terms.file);
    this.terms = terms;
  }

  @Override
  public Types visitForallType(ForallTypeContext ctx) {
    Types result = visit(ctx.arrows());
    List<IdentContext> vars = ctx.ident();
    for (int i = vars.size() - 1; i >= 0; i--) {
      result = new Types.Forall(Ident.of(vars.get(i).getText()), result);
    }
    return result;
  }

  @Override
  public Types visitArrowsType(ArrowsTypeContext ctx) {
    return visit(ctx.arrows());
  }

  @Override
  public Types visitArrows(ArrowsContext ctx) {
    Types domain = visit(ctx.subType());
    // The grammar nests the codomain, so arrows associate to the right.
    return (ctx.arrows() == null) ? domain : Types.arrow(domain, visit(ctx.arrows()));
  }

  @Override
  public Types visitBaseType(BaseTypeContext ctx) {
    int type = ctx.getStart().getType();
    if (type == NickelLexer.DYN) {
      return Types.DYN;
    } else if (type == NickelLexer.NUM) {
      return Types.NUM;
    } else if (type == NickelLexer.BOOL) {
      return Types.BOOL;
    } else {
      assert type == NickelLexer.STR;
      return Types.STR;
    }
  }

  @Override
  public Types visitListType(ListTypeContext ctx) {
    return new Types.List((ctx.subType() == null) ? Types.DYN : visit(ctx.subType()));
  }

  @Override
  public Types visitVarType(VarTypeContext ctx) {
    return Types.var(ctx.ident().getText());
  }

  @Override
  public Types visitFlatType(FlatTypeContext ctx) {
    return new Types.Flat(terms.visit(ctx.atom()));
  }

  @Override
  public Types visitParenType(ParenTypeContext ctx) {
    return visit(ctx.types());
  }

  @Override
  public Types visitEnumType(EnumTypeContext ctx) {
    Types row = tail(ctx.rowTail());
    List<IdentContext> tags = ctx.ident();
    for (int i = tags.size() - 1; i >= 0; i--) {
      row = new Types.RowExtend(Ident.of(tags.get(i).getText()), null, row);
    }
    return new Types.Enum(row);
  }

  @Override
  public Types visitRecordType(RecordTypeContext ctx) {
    Types row = tail(ctx.rowTail());
    List<RecordTypeFieldContext> fields = ctx.recordTypeField();
    for (int i = fields.size() - 1; i >= 0; i--) {
      RecordTypeFieldContext field = fields.get(i);
      row = new Types.RowExtend(Ident.of(field.ident().getText()), visit(field.types()), row);
    }
    return new Types.StaticRecord(row);
  }

  @Override
  public Types visitDynRecordType(DynRecordTypeContext ctx) {
    return new Types.DynRecord(visit(ctx.types()));
  }

  @Override
  public Types visitVarTail(VarTailContext ctx) {
    return Types.var(ctx.ident().getText());
  }

  @Override
  public Types visitDynTail(DynTailContext ctx) {
    return Types.DYN;
  }

  /** Returns the end of a row: the given tail, or {@link Types#ROW_EMPTY} if there is none. */
  private Types tail(RowTailContext ctx) {
    return (ctx == null) ? Types.ROW_EMPTY : visit(ctx);
  }
}

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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.nickellang.syntax.NickelParser.AddExprContext;
import org.nickellang.syntax.NickelParser.AndExprContext;
import org.nickellang.syntax.NickelParser.ApplicativeExprContext;
import org.nickellang.syntax.NickelParser.ApplyExprContext;
import org.nickellang.syntax.NickelParser.AssumeAtomContext;
import org.nickellang.syntax.NickelParser.AtomOperandContext;
import org.nickellang.syntax.NickelParser.BinaryPrimopContext;
import org.nickellang.syntax.NickelParser.BoolAtomContext;
import org.nickellang.syntax.NickelParser.ChunkExprContext;
import org.nickellang.syntax.NickelParser.ChunkLiteralContext;
import org.nickellang.syntax.NickelParser.CompareExprContext;
import org.nickellang.syntax.NickelParser.ConcatExprContext;
import org.nickellang.syntax.NickelParser.ContractAtomContext;
import org.nickellang.syntax.NickelParser.ContractDefaultAtomContext;
import org.nickellang.syntax.NickelParser.DefaultAtomContext;
import org.nickellang.syntax.NickelParser.DefaultCaseContext;
import org.nickellang.syntax.NickelParser.DocstringAtomContext;
import org.nickellang.syntax.NickelParser.DynAccessContext;
import org.nickellang.syntax.NickelParser.DynExtendContext;
import org.nickellang.syntax.NickelParser.DynRemoveContext;
import org.nickellang.syntax.NickelParser.DynamicFieldContext;
import org.nickellang.syntax.NickelParser.EmbedUopContext;
import org.nickellang.syntax.NickelParser.EnumAtomContext;
import org.nickellang.syntax.NickelParser.EqExprContext;
import org.nickellang.syntax.NickelParser.FunTermContext;
import org.nickellang.syntax.NickelParser.IdentContext;
import org.nickellang.syntax.NickelParser.ImportTermContext;
import org.nickellang.syntax.NickelParser.InfixExprContext;
import org.nickellang.syntax.NickelParser.InfixTermContext;
import org.nickellang.syntax.NickelParser.IteTermContext;
import org.nickellang.syntax.NickelParser.LetTermContext;
import org.nickellang.syntax.NickelParser.ListAtomContext;
import org.nickellang.syntax.NickelParser.MergeExprContext;
import org.nickellang.syntax.NickelParser.MultExprContext;
import org.nickellang.syntax.NickelParser.NamedCaseContext;
import org.nickellang.syntax.NickelParser.NegExprContext;
import org.nickellang.syntax.NickelParser.NotExprContext;
import org.nickellang.syntax.NickelParser.NumAtomContext;
import org.nickellang.syntax.NickelParser.OperandExprContext;
import org.nickellang.syntax.NickelParser.OrExprContext;
import org.nickellang.syntax.NickelParser.ParenAtomContext;
import org.nickellang.syntax.NickelParser.PromiseAtomContext;
import org.nickellang.syntax.NickelParser.RecordAtomContext;
import org.nickellang.syntax.NickelParser.RecordFieldContext;
import org.nickellang.syntax.NickelParser.SimpleUopContext;
import org.nickellang.syntax.NickelParser.StaticAccessContext;
import org.nickellang.syntax.NickelParser.StaticFieldContext;
import org.nickellang.syntax.NickelParser.StaticStringContext;
import org.nickellang.syntax.NickelParser.StrChunksContext;
import org.nickellang.syntax.NickelParser.StringAtomContext;
import org.nickellang.syntax.NickelParser.SwitchCaseContext;
import org.nickellang.syntax.NickelParser.SwitchTermContext;
import org.nickellang.syntax.NickelParser.UnaryPrimopContext;
import org.nickellang.syntax.NickelParser.UopContext;
import org.nickellang.syntax.NickelParser.VarAtomContext;
import org.nickellang.term.BinaryOp;
import org.nickellang.term.FileId;
import org.nickellang.term.Ident;
import org.nickellang.term.Label;
import org.nickellang.term.MergePriority;
import org.nickellang.term.MetaValue;
import org.nickellang.term.RichTerm;
import org.nickellang.term.StrChunk;
import org.nickellang.term.Term;
import org.nickellang.term.Terms;
import org.nickellang.term.UnaryOp;
import org.nickellang.types.Types;

/**
 * Builds a {@link RichTerm} from a parse tree. Each term built directly from a node of the parse
 * tree is given the span of that node; the extra nodes introduced by desugaring (e.g. the {@code
 * Ite} operator application inside an {@code if}) have no position of their own.
 *
 * <p>Types and annotations are handled by the {@link TypeBuilder} and {@link MetaBuilder} created
 * with each TermBuilder, which call back into it for flat contracts and doc strings.
 */
class TermBuilder extends VisitorBase<RichTerm> {
  final TypeBuilder types;
  final MetaBuilder metas;

  TermBuilder(FileId file) {
    super(file);
    this.types = new TypeBuilder(this);
    this.metas = new MetaBuilder(this);
  }

  /** Returns {@code term} with the span of {@code ctx} as its position. */
  private RichTerm spanned(ParserRuleContext ctx, Term term) {
    return new RichTerm(term, span(ctx));
  }

  private RichTerm spanned(ParserRuleContext ctx, RichTerm term) {
    return term.withPos(span(ctx));
  }

  static Ident ident(IdentContext ctx) {
    return Ident.of(ctx.getText());
  }

  @Override
  public RichTerm visitFunTerm(FunTermContext ctx) {
    RichTerm result = visit(ctx.term());
    List<IdentContext> params = ctx.ident();
    for (int i = params.size() - 1; i >= 0; i--) {
      result = spanned(ctx, new Term.Fun(ident(params.get(i)), result));
    }
    return result;
  }

  @Override
  public RichTerm visitLetTerm(LetTermContext ctx) {
    RichTerm bound = metas.annotate(ctx.annotation(), visit(ctx.term(0)));
    return spanned(ctx, new Term.Let(ident(ctx.ident()), bound, visit(ctx.term(1))));
  }

  @Override
  public RichTerm visitSwitchTerm(SwitchTermContext ctx) {
    // A repeated case (or default) replaces the earlier one.
    Map<Ident, RichTerm> cases = new LinkedHashMap<>();
    RichTerm defaultCase = null;
    for (SwitchCaseContext switchCase : ctx.switchCase()) {
      if (switchCase instanceof NamedCaseContext named) {
        cases.put(ident(named.ident()), visit(named.term()));
      } else {
        defaultCase = visit(((DefaultCaseContext) switchCase).term());
      }
    }
    return spanned(
        ctx, new Term.Switch(visit(ctx.term()), ImmutableMap.copyOf(cases), defaultCase));
  }

  @Override
  public RichTerm visitIteTerm(IteTermContext ctx) {
    RichTerm ite = Terms.op1(UnaryOp.Kind.ITE, visit(ctx.term(0)));
    return spanned(ctx, Terms.app(ite, visit(ctx.term(1)), visit(ctx.term(2))));
  }

  @Override
  public RichTerm visitImportTerm(ImportTermContext ctx) {
    return spanned(ctx, new Term.Import(staticString(ctx.staticString())));
  }

  @Override
  public RichTerm visitInfixTerm(InfixTermContext ctx) {
    return visit(ctx.infixExpr());
  }

  @Override
  public RichTerm visitApplicativeExpr(ApplicativeExprContext ctx) {
    return visit(ctx.applicative());
  }

  @Override
  public RichTerm visitNegExpr(NegExprContext ctx) {
    return spanned(ctx, Terms.op2(BinaryOp.Kind.SUB, Terms.num(0), visit(ctx.infixExpr())));
  }

  @Override
  public RichTerm visitConcatExpr(ConcatExprContext ctx) {
    return binary(ctx, TokenType.binaryOp(ctx.op), ctx.infixExpr());
  }

  @Override
  public RichTerm visitMultExpr(MultExprContext ctx) {
    return binary(ctx, TokenType.binaryOp(ctx.op), ctx.infixExpr());
  }

  @Override
  public RichTerm visitAddExpr(AddExprContext ctx) {
    return binary(ctx, TokenType.binaryOp(ctx.op), ctx.infixExpr());
  }

  @Override
  public RichTerm visitNotExpr(NotExprContext ctx) {
    return spanned(ctx, Terms.op1(UnaryOp.Kind.BOOL_NOT, visit(ctx.infixExpr())));
  }

  @Override
  public RichTerm visitMergeExpr(MergeExprContext ctx) {
    return binary(ctx, BinaryOp.Kind.MERGE, ctx.infixExpr());
  }

  @Override
  public RichTerm visitCompareExpr(CompareExprContext ctx) {
    return binary(ctx, TokenType.binaryOp(ctx.op), ctx.infixExpr());
  }

  @Override
  public RichTerm visitEqExpr(EqExprContext ctx) {
    return binary(ctx, BinaryOp.Kind.EQ, ctx.infixExpr());
  }

  @Override
  public RichTerm visitAndExpr(AndExprContext ctx) {
    // The second operand is only evaluated if needed, so these are applications rather than Op2s.
    RichTerm and = Terms.op1(UnaryOp.Kind.BOOL_AND, visit(ctx.infixExpr(0)));
    return spanned(ctx, Terms.app(and, visit(ctx.infixExpr(1))));
  }

  @Override
  public RichTerm visitOrExpr(OrExprContext ctx) {
    RichTerm or = Terms.op1(UnaryOp.Kind.BOOL_OR, visit(ctx.infixExpr(0)));
    return spanned(ctx, Terms.app(or, visit(ctx.infixExpr(1))));
  }

  private RichTerm binary(ParserRuleContext ctx, BinaryOp.Kind op, List<InfixExprContext> args) {
    return spanned(ctx, Terms.op2(op, visit(args.get(0)), visit(args.get(1))));
  }

  @Override
  public RichTerm visitApplyExpr(ApplyExprContext ctx) {
    return spanned(ctx, new Term.App(visit(ctx.applicative()), visit(ctx.atom())));
  }

  @Override
  public RichTerm visitUnaryPrimop(UnaryPrimopContext ctx) {
    return spanned(ctx, new Term.Op1(unaryOp(ctx.uop()), visit(ctx.atom())));
  }

  private static UnaryOp unaryOp(UopContext ctx) {
    if (ctx instanceof EmbedUopContext embed) {
      return UnaryOp.embed(ident(embed.ident()));
    }
    return UnaryOp.of(TokenType.unaryOp(((SimpleUopContext) ctx).op));
  }

  @Override
  public RichTerm visitBinaryPrimop(BinaryPrimopContext ctx) {
    BinaryOp.Kind op = TokenType.binaryOp(ctx.bopPre().op);
    return spanned(ctx, Terms.op2(op, visit(ctx.atom(0)), visit(ctx.atom(1))));
  }

  @Override
  public RichTerm visitOperandExpr(OperandExprContext ctx) {
    return visit(ctx.recordOperand());
  }

  @Override
  public RichTerm visitStaticAccess(StaticAccessContext ctx) {
    UnaryOp op = UnaryOp.staticAccess(ident(ctx.ident()));
    return spanned(ctx, Terms.op1(op, visit(ctx.recordOperand())));
  }

  @Override
  public RichTerm visitDynAccess(DynAccessContext ctx) {
    RichTerm record = visit(ctx.recordOperand());
    return spanned(ctx, Terms.op2(BinaryOp.Kind.DYN_ACCESS, visit(ctx.atom()), record));
  }

  @Override
  public RichTerm visitDynRemove(DynRemoveContext ctx) {
    RichTerm record = visit(ctx.recordOperand());
    return spanned(ctx, Terms.op2(BinaryOp.Kind.DYN_REMOVE, visit(ctx.atom()), record));
  }

  @Override
  public RichTerm visitDynExtend(DynExtendContext ctx) {
    RichTerm record = visit(ctx.recordOperand());
    BinaryOp op = BinaryOp.dynExtend(visit(ctx.term(1)));
    return spanned(ctx, Terms.op2(op, visit(ctx.term(0)), record));
  }

  @Override
  public RichTerm visitAtomOperand(AtomOperandContext ctx) {
    return visit(ctx.atom());
  }

  @Override
  public RichTerm visitParenAtom(ParenAtomContext ctx) {
    // Parentheses don't change the interpretation of the parenthesized term.
    return visit(ctx.term());
  }

  @Override
  public RichTerm visitPromiseAtom(PromiseAtomContext ctx) {
    Types type = types.visit(ctx.types());
    return spanned(ctx, new Term.Promise(type, Label.of(type, span(ctx)), visit(ctx.term())));
  }

  @Override
  public RichTerm visitAssumeAtom(AssumeAtomContext ctx) {
    Types type = types.visit(ctx.types());
    return spanned(ctx, new Term.Assume(type, Label.of(type, span(ctx)), visit(ctx.term())));
  }

  @Override
  public RichTerm visitContractAtom(ContractAtomContext ctx) {
    Types type = types.visit(ctx.types());
    return spanned(ctx, new Term.Meta(MetaValue.ofContract(type, Label.of(type, span(ctx)))));
  }

  @Override
  public RichTerm visitDefaultAtom(DefaultAtomContext ctx) {
    MetaValue meta = MetaValue.ofPriority(MergePriority.DEFAULT).withValue(visit(ctx.term()));
    return spanned(ctx, new Term.Meta(meta));
  }

  @Override
  public RichTerm visitContractDefaultAtom(ContractDefaultAtomContext ctx) {
    Types type = types.visit(ctx.types());
    MetaValue.Contract contract = new MetaValue.Contract(type, Label.of(type, span(ctx)));
    MetaValue meta = new MetaValue(null, contract, MergePriority.DEFAULT, visit(ctx.term()));
    return spanned(ctx, new Term.Meta(meta));
  }

  @Override
  public RichTerm visitDocstringAtom(DocstringAtomContext ctx) {
    MetaValue meta = MetaValue.ofDoc(staticString(ctx.staticString())).withValue(visit(ctx.term()));
    return spanned(ctx, new Term.Meta(meta));
  }

  @Override
  public RichTerm visitNumAtom(NumAtomContext ctx) {
    return spanned(ctx, new Term.Num(Double.parseDouble(ctx.getText())));
  }

  @Override
  public RichTerm visitBoolAtom(BoolAtomContext ctx) {
    return spanned(ctx, new Term.Bool(ctx.getStart().getType() == NickelLexer.TRUE));
  }

  @Override
  public RichTerm visitStringAtom(StringAtomContext ctx) {
    return visit(ctx.strChunks());
  }

  @Override
  public RichTerm visitStrChunks(StrChunksContext ctx) {
    checkDelimiters(ctx.open, ctx.close);
    StringAssembler assembler = new StringAssembler(isMultiline(ctx.open));
    for (ParseTree child : ctx.children) {
      if (child instanceof ChunkLiteralContext literal) {
        assembler.literal(literal);
      } else if (child instanceof ChunkExprContext expr) {
        assembler.expr(visit(expr.term()));
      }
    }
    return spanned(ctx, new Term.StrChunks(assembler.build()));
  }

  /**
   * Returns the contents of a string that may not contain interpolated expressions, as used by
   * {@code import} and doc annotations.
   */
  String staticString(StaticStringContext ctx) {
    checkDelimiters(ctx.open, ctx.close);
    StringAssembler assembler = new StringAssembler(isMultiline(ctx.open));
    if (ctx.chunkLiteral() != null) {
      assembler.literal(ctx.chunkLiteral());
    }
    StringBuilder result = new StringBuilder();
    for (StrChunk chunk : assembler.build()) {
      result.append(((StrChunk.Literal) chunk).value());
    }
    return result.toString();
  }

  private static boolean isMultiline(Token open) {
    return open.getType() == NickelLexer.MULTI_STRING_START;
  }

  private void checkDelimiters(Token open, Token close) {
    boolean multilineClose = close.getType() == NickelLexer.MULTI_STRING_END;
    if (isMultiline(open) != multilineClose) {
      throw error(
          close,
          SyntaxError.Kind.DELIMITER_MISMATCH,
          "String starting with '%s' cannot end with '%s'",
          open.getText(),
          close.getText());
    }
  }

  @Override
  public RichTerm visitVarAtom(VarAtomContext ctx) {
    return spanned(ctx, new Term.Var(ident(ctx.ident())));
  }

  @Override
  public RichTerm visitEnumAtom(EnumAtomContext ctx) {
    return spanned(ctx, new Term.Enum(ident(ctx.ident())));
  }

  @Override
  public RichTerm visitRecordAtom(RecordAtomContext ctx) {
    RecordAssembler assembler = new RecordAssembler();
    for (RecordFieldContext field : ctx.recordField()) {
      if (field instanceof StaticFieldContext staticField) {
        RichTerm value = metas.annotate(staticField.annotation(), visit(staticField.term()));
        assembler.addStatic(ident(staticField.ident()), value);
      } else {
        DynamicFieldContext dynamicField = (DynamicFieldContext) field;
        RichTerm value = metas.annotate(dynamicField.annotation(), visit(dynamicField.term()));
        assembler.addDynamic(visit(dynamicField.atom()), value);
      }
    }
    return assembler.build(span(ctx));
  }

  @Override
  public RichTerm visitListAtom(ListAtomContext ctx) {
    ImmutableList<RichTerm> elements =
        ctx.term().stream().map(this::visit).collect(ImmutableList.toImmutableList());
    return spanned(ctx, new Term.List(elements));
  }
}

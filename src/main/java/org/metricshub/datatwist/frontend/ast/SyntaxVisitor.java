package org.metricshub.datatwist.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * DataTwist
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

/**
 * Exhaustive case analysis over the syntax tree variants.
 *
 * @param <R> result type
 */
public interface SyntaxVisitor<R> {

	R visitProgram(Program node);

	R visitAssignment(Assignment node);

	R visitIdentifier(Identifier node);

	R visitWildcardAccess(WildcardAccess node);

	R visitFieldAccess(FieldAccess node);

	R visitNumberLiteral(NumberLiteral node);

	R visitStringLiteral(StringLiteral node);

	R visitBoolLiteral(BoolLiteral node);

	R visitNilLiteral(NilLiteral node);

	R visitRecordLiteral(RecordLiteral node);

	R visitListLiteral(ListLiteral node);

	R visitFunctionDef(FunctionDef node);

	R visitApplication(Application node);

	R visitPipeline(Pipeline node);

	R visitLetBinding(LetBinding node);

	R visitIfExpr(IfExpr node);

	R visitMatchExpr(MatchExpr node);

	R visitMatchClause(MatchClause node);

	R visitRecordPattern(RecordPattern node);

	R visitCatchAllPattern(CatchAllPattern node);

	R visitLiteralPattern(LiteralPattern node);

	R visitGuardPattern(GuardPattern node);

	R visitTryCatch(TryCatch node);

	R visitCatchClause(CatchClause node);

	R visitError(ErrorNode node);
}

package org.metricshub.datatwist.frontend;

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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.datatwist.frontend.ast.Application;
import org.metricshub.datatwist.frontend.ast.Assignment;
import org.metricshub.datatwist.frontend.ast.BoolLiteral;
import org.metricshub.datatwist.frontend.ast.CatchAllPattern;
import org.metricshub.datatwist.frontend.ast.CatchClause;
import org.metricshub.datatwist.frontend.ast.ErrorNode;
import org.metricshub.datatwist.frontend.ast.FieldAccess;
import org.metricshub.datatwist.frontend.ast.FunctionDef;
import org.metricshub.datatwist.frontend.ast.GuardPattern;
import org.metricshub.datatwist.frontend.ast.Identifier;
import org.metricshub.datatwist.frontend.ast.IfExpr;
import org.metricshub.datatwist.frontend.ast.LetBinding;
import org.metricshub.datatwist.frontend.ast.ListLiteral;
import org.metricshub.datatwist.frontend.ast.LiteralPattern;
import org.metricshub.datatwist.frontend.ast.MatchClause;
import org.metricshub.datatwist.frontend.ast.MatchExpr;
import org.metricshub.datatwist.frontend.ast.NilLiteral;
import org.metricshub.datatwist.frontend.ast.NumberLiteral;
import org.metricshub.datatwist.frontend.ast.Pipeline;
import org.metricshub.datatwist.frontend.ast.Program;
import org.metricshub.datatwist.frontend.ast.RecordLiteral;
import org.metricshub.datatwist.frontend.ast.RecordPattern;
import org.metricshub.datatwist.frontend.ast.StringLiteral;
import org.metricshub.datatwist.frontend.ast.SyntaxNode;
import org.metricshub.datatwist.frontend.ast.SyntaxVisitor;
import org.metricshub.datatwist.frontend.ast.TryCatch;
import org.metricshub.datatwist.frontend.ast.WildcardAccess;

/**
 * Dumps a syntax tree as a Lisp-like s-expression, one node per
 * parenthesized group, for debugging and tests.
 * <p>
 * {@code data filter _.age > 18} dumps as
 * {@code (pipeline (id data) (stage filter (> (_ age) (num 18))))}.
 */
public class SyntaxTreeDumper implements SyntaxVisitor<String> {

	public String dump(SyntaxNode node) {
		return node.accept(this);
	}

	private String parenthesize(String name, Object... parts) {
		StringBuilder sb = new StringBuilder("(").append(name);
		for (Object part : parts) {
			sb.append(' ');
			if (part instanceof SyntaxNode) {
				sb.append(((SyntaxNode) part).accept(this));
			} else {
				sb.append(part);
			}
		}
		return sb.append(')').toString();
	}

	private String parenthesizeAll(String name, String head, List<? extends SyntaxNode> nodes) {
		List<Object> parts = new ArrayList<Object>();
		if (head != null) {
			parts.add(head);
		}
		parts.addAll(nodes);
		return parenthesize(name, parts.toArray());
	}

	@Override
	public String visitProgram(Program node) {
		return parenthesizeAll("program", null, node.getStatements());
	}

	@Override
	public String visitAssignment(Assignment node) {
		return parenthesize("=", node.getName(), node.getValue());
	}

	@Override
	public String visitIdentifier(Identifier node) {
		return parenthesize("id", node.getName());
	}

	@Override
	public String visitWildcardAccess(WildcardAccess node) {
		return parenthesize("_", node.getPath().toArray());
	}

	@Override
	public String visitFieldAccess(FieldAccess node) {
		return parenthesize(".", node.getTarget(), node.getField());
	}

	@Override
	public String visitNumberLiteral(NumberLiteral node) {
		return parenthesize("num", node.getText());
	}

	@Override
	public String visitStringLiteral(StringLiteral node) {
		List<Object> parts = new ArrayList<Object>();
		for (StringLiteral.Segment segment : node.getSegments()) {
			if (segment.isLiteral()) {
				parts.add("\"" + segment.getText().replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"");
			} else {
				parts.add(segment.getExpression());
			}
		}
		return parenthesize("str", parts.toArray());
	}

	@Override
	public String visitBoolLiteral(BoolLiteral node) {
		return node.getValue() ? "true" : "false";
	}

	@Override
	public String visitNilLiteral(NilLiteral node) {
		return "nil";
	}

	@Override
	public String visitRecordLiteral(RecordLiteral node) {
		List<Object> parts = new ArrayList<Object>();
		for (RecordLiteral.Field field : node.getFields()) {
			parts.add(parenthesize(field.getKey() + ":", field.getValue()));
		}
		return parenthesize("record", parts.toArray());
	}

	@Override
	public String visitListLiteral(ListLiteral node) {
		return parenthesizeAll("list", null, node.getElements());
	}

	@Override
	public String visitFunctionDef(FunctionDef node) {
		return parenthesize("fn", "[" + String.join(" ", node.getParams()) + "]", node.getBody());
	}

	@Override
	public String visitApplication(Application node) {
		if (node.isBinaryOperator()) {
			return parenthesize(node.getCalleeName(), node.getArgs().get(0), node.getArgs().get(1));
		}
		List<Object> parts = new ArrayList<Object>();
		parts.add(node.getCallee());
		parts.addAll(node.getArgs());
		return parenthesize("apply", parts.toArray());
	}

	@Override
	public String visitPipeline(Pipeline node) {
		List<Object> parts = new ArrayList<Object>();
		parts.add(node.getSeed());
		for (Application stage : node.getStages()) {
			String name = stage.getCallee() instanceof Identifier ?
					((Identifier) stage.getCallee()).getName() : stage.getCallee().accept(this);
			parts.add(parenthesizeAll("stage", name, stage.getArgs()));
		}
		return parenthesize("pipeline", parts.toArray());
	}

	@Override
	public String visitLetBinding(LetBinding node) {
		List<Object> parts = new ArrayList<Object>();
		for (LetBinding.Binding binding : node.getBindings()) {
			parts.add(parenthesize(binding.getName(), binding.getValue()));
		}
		parts.add(node.getBody());
		return parenthesize("let", parts.toArray());
	}

	@Override
	public String visitIfExpr(IfExpr node) {
		List<Object> parts = new ArrayList<Object>();
		for (IfExpr.Branch branch : node.getBranches()) {
			parts.add(parenthesize("when", branch.getCondition(), branch.getResult()));
		}
		parts.add(parenthesize("else", node.getElseExpr()));
		return parenthesize("if", parts.toArray());
	}

	@Override
	public String visitMatchExpr(MatchExpr node) {
		List<Object> parts = new ArrayList<Object>();
		parts.add(node.getScrutinee());
		parts.addAll(node.getClauses());
		return parenthesize("match", parts.toArray());
	}

	@Override
	public String visitMatchClause(MatchClause node) {
		if (node.getGuard() == null) {
			return parenthesize("|", node.getPattern(), node.getResult());
		}
		return parenthesize("|", node.getPattern(), parenthesize("when", node.getGuard()), node.getResult());
	}

	@Override
	public String visitRecordPattern(RecordPattern node) {
		List<Object> parts = new ArrayList<Object>();
		for (RecordPattern.FieldPattern field : node.getFields()) {
			switch (field.getConstraint()) {
			case BIND:
				parts.add(field.getField() + "=" + field.getBinding());
				break;
			case LITERAL:
				parts.add(parenthesize(field.getField() + ":", field.getLiteral()));
				break;
			default:
				parts.add(field.getField() + "?");
			}
		}
		return parenthesize("record-pattern", parts.toArray());
	}

	@Override
	public String visitCatchAllPattern(CatchAllPattern node) {
		return node.getSpelling().getText();
	}

	@Override
	public String visitLiteralPattern(LiteralPattern node) {
		return parenthesize("literal", node.getLiteral());
	}

	@Override
	public String visitGuardPattern(GuardPattern node) {
		return parenthesize("guard", node.getCondition());
	}

	@Override
	public String visitTryCatch(TryCatch node) {
		List<Object> parts = new ArrayList<Object>();
		parts.add(node.getBody());
		parts.addAll(node.getCatches());
		return parenthesize("try", parts.toArray());
	}

	@Override
	public String visitCatchClause(CatchClause node) {
		return parenthesize(
				"catch",
				node.getErrorTag() == null ? "*" : node.getErrorTag(),
				node.getBinding() == null ? "-" : node.getBinding(),
				node.getHandler());
	}

	@Override
	public String visitError(ErrorNode node) {
		return parenthesize("error", "\"" + node.getDiagnostic().getReason() + "\"");
	}
}

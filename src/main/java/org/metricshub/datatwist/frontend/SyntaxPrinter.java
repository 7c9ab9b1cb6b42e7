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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
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
import org.metricshub.datatwist.util.ParserSettings;

/**
 * Renders a syntax tree as DataTwist source, in canonical layout.
 * <p>
 * Parsing the output with the same pipeline operations gives back a tree
 * equal to the printed one. Pipelines are printed with one stage per line,
 * match clauses are always on their own lines, and records, lists and the
 * other constructs spread over several lines only when one of their parts
 * does. Parentheses are added where the grammar would otherwise read the
 * text differently.
 * <p>
 * Inside string interpolations, where line breaks are not allowed,
 * everything is printed on a single line.
 */
public class SyntaxPrinter {

	private static final int DEFAULT_STEP = 2;

	private final Set<String> pipelineOperations;
	private final String step;

	/**
	 * @param settings settings of the parser the output is meant for
	 */
	public SyntaxPrinter(ParserSettings settings) {
		this.pipelineOperations = new HashSet<String>(settings.getPipelineOperations());
		this.step = String.join("", Collections.nCopies(Math.max(DEFAULT_STEP, settings.getMinimumIndentWidth()), " "));
	}

	/**
	 * Prints a program, or any other node as if it were a single statement.
	 *
	 * @param node the tree to print
	 * @return DataTwist source
	 * @throws IllegalArgumentException if the tree contains an error node, or
	 *         a construct that has no source form
	 */
	public String print(SyntaxNode node) {
		if (node instanceof Program) {
			List<String> statements = new ArrayList<String>();
			for (SyntaxNode statement : ((Program) node).getStatements()) {
				statements.add(statement(statement));
			}
			return String.join("\n", statements);
		}
		return statement(node);
	}

	private String statement(SyntaxNode node) {
		String text = value(node, "", false);
		if (!(node instanceof Assignment) && looksLikeAssignment(text)) {
			return "(" + text + ")";
		}
		return text;
	}

	/**
	 * {@code a = b} at the start of a statement is an assignment, not a comparison.
	 */
	private static boolean looksLikeAssignment(String text) {
		int end = 0;
		while (end < text.length() && " =\n(".indexOf(text.charAt(end)) < 0) {
			end++;
		}
		return end > 0 && isIdentifierText(text.substring(0, end)) && text.startsWith(" = ", end);
	}

	// POSITIONS

	private String value(SyntaxNode node, String indent, boolean flat) {
		return node.accept(new Renderer(indent, flat));
	}

	private String parens(SyntaxNode node, String indent, boolean flat) {
		return "(" + value(node, indent, flat) + ")";
	}

	/**
	 * A position followed by more of the enclosing construct, where a match or
	 * a try/catch printed on one line would take over what follows.
	 */
	private String inline(SyntaxNode node, String indent, boolean flat) {
		if (flat && (node instanceof MatchExpr || node instanceof TryCatch)) {
			return parens(node, indent, true);
		}
		return value(node, indent, flat);
	}

	/**
	 * A position followed by a keyword on the same line: conditions, the
	 * scrutinee of a match, guards.
	 */
	private String condition(SyntaxNode node, String indent, boolean flat) {
		if (isConstruct(node)) {
			return parens(node, indent, flat);
		}
		String text = value(node, indent, flat);
		return text.contains("\n") ? "(" + text + ")" : text;
	}

	private String argument(SyntaxNode node, String indent, boolean flat) {
		if (isPrimary(node) && !startsWithPipelineOperation(node)) {
			return value(node, indent, flat);
		}
		return parens(node, indent, flat);
	}

	private String element(SyntaxNode node, String indent, boolean flat) {
		if (startsWithPipelineOperation(node)) {
			return parens(node, indent, flat);
		}
		if (isPrimary(node)) {
			return value(node, indent, flat);
		}
		if (isBinary(node)) {
			return binary((Application) node, indent, flat, false);
		}
		return parens(node, indent, flat);
	}

	private String binary(Application node, String indent, boolean flat, boolean juxtaposition) {
		Operator operator = Operator.bySymbol(node.getCalleeName());
		int precedence = operator.getPrecedence();
		String left = operand(node.getArgs().get(0), precedence, false, indent, flat, juxtaposition);
		String right = operand(node.getArgs().get(1), precedence, true, indent, flat, juxtaposition);
		return left + " " + operator.getSymbol() + " " + right;
	}

	private String operand(
			SyntaxNode node,
			int precedence,
			boolean right,
			String indent,
			boolean flat,
			boolean juxtaposition) {
		if (isBinary(node)) {
			int own = Operator.bySymbol(((Application) node).getCalleeName()).getPrecedence();
			if (own < precedence || (right && own == precedence)) {
				return parens(node, indent, flat);
			}
			return binary((Application) node, indent, flat, juxtaposition);
		}
		if (node instanceof Application) {
			return juxtaposition ? value(node, indent, flat) : parens(node, indent, flat);
		}
		if (isConstruct(node)) {
			return parens(node, indent, flat);
		}
		if (!juxtaposition && node instanceof NumberLiteral && ((NumberLiteral) node).isNegative()) {
			return parens(node, indent, flat);
		}
		return value(node, indent, flat);
	}

	private static boolean isBinary(SyntaxNode node) {
		return node instanceof Application && ((Application) node).isBinaryOperator();
	}

	private static boolean isConstruct(SyntaxNode node) {
		return node instanceof Pipeline
				|| node instanceof LetBinding
				|| node instanceof IfExpr
				|| node instanceof MatchExpr
				|| node instanceof TryCatch;
	}

	/**
	 * @return {@code true} if the node reads as a single argument when printed as is
	 */
	private static boolean isPrimary(SyntaxNode node) {
		if (node instanceof NumberLiteral) {
			return !((NumberLiteral) node).isNegative();
		}
		if (node instanceof Identifier) {
			return !((Identifier) node).isOperator();
		}
		return node instanceof WildcardAccess
				|| node instanceof FieldAccess
				|| node instanceof StringLiteral
				|| node instanceof BoolLiteral
				|| node instanceof NilLiteral
				|| node instanceof RecordLiteral
				|| node instanceof ListLiteral
				|| node instanceof FunctionDef;
	}

	/**
	 * A registered pipeline operation after a complete operand starts a
	 * pipeline stage.
	 */
	private boolean startsWithPipelineOperation(SyntaxNode node) {
		SyntaxNode first = node;
		while (true) {
			if (first instanceof FieldAccess) {
				first = ((FieldAccess) first).getTarget();
			} else if (isBinary(first)) {
				first = ((Application) first).getArgs().get(0);
			} else {
				break;
			}
		}
		return first instanceof Identifier && pipelineOperations.contains(((Identifier) first).getName());
	}

	// TEXT

	private static boolean isIdentifierText(String text) {
		if (text.isEmpty() || !isLetter(text.charAt(0))) {
			return false;
		}
		int end = text.length();
		char last = text.charAt(end - 1);
		if (end > 1 && (last == '?' || last == '!')) {
			end--;
		}
		for (int i = 1; i < end; i++) {
			char ch = text.charAt(i);
			if (!isLetter(ch) && !(ch >= '0' && ch <= '9') && ch != '_' && ch != '-') {
				return false;
			}
		}
		return true;
	}

	private static boolean isLetter(char ch) {
		return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
	}

	private static String key(String name) {
		if (isIdentifierText(name) && !TokenType.isKeyword(name)) {
			return name;
		}
		return "\"" + escape(name) + "\"";
	}

	private static String escape(String text) {
		StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			switch (ch) {
			case '"':
			case '\\':
			case '{':
			case '}':
				sb.append('\\').append(ch);
				break;
			case '\n':
				sb.append("\\n");
				break;
			case '\t':
				sb.append("\\t");
				break;
			case '\r':
				sb.append("\\r");
				break;
			default:
				sb.append(ch);
			}
		}
		return sb.toString();
	}

	private static boolean anyMultiLine(List<String> texts) {
		for (String text : texts) {
			if (text.contains("\n")) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Prints one node at a given indentation; nested blocks are one step deeper.
	 */
	private final class Renderer implements SyntaxVisitor<String> {

		private final String indent;
		private final String inner;
		private final boolean flat;

		Renderer(String indent, boolean flat) {
			this.indent = indent;
			this.inner = indent + step;
			this.flat = flat;
		}

		@Override
		public String visitProgram(Program node) {
			throw new IllegalArgumentException("A program cannot be nested in an expression");
		}

		@Override
		public String visitAssignment(Assignment node) {
			return node.getName() + " = " + value(node.getValue(), indent, flat);
		}

		@Override
		public String visitIdentifier(Identifier node) {
			return node.getName();
		}

		@Override
		public String visitWildcardAccess(WildcardAccess node) {
			StringBuilder sb = new StringBuilder("_");
			for (String field : node.getPath()) {
				sb.append('.').append(field);
			}
			return sb.toString();
		}

		@Override
		public String visitFieldAccess(FieldAccess node) {
			SyntaxNode target = node.getTarget();
			boolean plain = (target instanceof Identifier && !((Identifier) target).isOperator())
					|| target instanceof FieldAccess
					|| target instanceof StringLiteral
					|| target instanceof BoolLiteral
					|| target instanceof NilLiteral
					|| target instanceof RecordLiteral
					|| target instanceof ListLiteral
					|| target instanceof FunctionDef;
			String text = plain ? value(target, indent, flat) : parens(target, indent, flat);
			return text + "." + node.getField();
		}

		@Override
		public String visitNumberLiteral(NumberLiteral node) {
			return node.getText();
		}

		@Override
		public String visitStringLiteral(StringLiteral node) {
			StringBuilder sb = new StringBuilder("\"");
			for (StringLiteral.Segment segment : node.getSegments()) {
				if (segment.isLiteral()) {
					sb.append(escape(segment.getText()));
				} else {
					sb.append('{').append(value(segment.getExpression(), indent, true)).append('}');
				}
			}
			return sb.append('"').toString();
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
			List<String> fields = new ArrayList<String>();
			for (RecordLiteral.Field field : node.getFields()) {
				fields.add(key(field.getKey()) + ": " + inline(field.getValue(), inner, flat));
			}
			return block("{", fields, "}");
		}

		@Override
		public String visitListLiteral(ListLiteral node) {
			List<String> elements = new ArrayList<String>();
			for (SyntaxNode element : node.getElements()) {
				elements.add(element(element, inner, flat));
			}
			return block("[", elements, "]");
		}

		private String block(String open, List<String> items, String close) {
			if (items.isEmpty()) {
				return open + close;
			}
			if (flat || !anyMultiLine(items)) {
				return open + String.join(" ", items) + close;
			}
			return open + "\n" + inner + String.join("\n" + inner, items) + "\n" + indent + close;
		}

		@Override
		public String visitFunctionDef(FunctionDef node) {
			return "[" + String.join(" ", node.getParams()) + " -> " + value(node.getBody(), indent, flat) + "]";
		}

		@Override
		public String visitApplication(Application node) {
			if (node.isBinaryOperator()) {
				return binary(node, indent, flat, true);
			}
			SyntaxNode callee = node.getCallee();
			if (!(callee instanceof FieldAccess) && !(callee instanceof Identifier && !((Identifier) callee).isOperator())) {
				throw new IllegalArgumentException("Cannot print an application of " + callee.getKind());
			}
			StringBuilder sb = new StringBuilder(value(callee, indent, flat));
			for (SyntaxNode arg : node.getArgs()) {
				sb.append(' ').append(argument(arg, indent, flat));
			}
			return sb.toString();
		}

		@Override
		public String visitPipeline(Pipeline node) {
			SyntaxNode seed = node.getSeed();
			StringBuilder sb = new StringBuilder(isConstruct(seed) ? parens(seed, indent, flat) : value(seed, indent, flat));
			for (Application stage : node.getStages()) {
				SyntaxNode callee = stage.getCallee();
				if (!(callee instanceof Identifier) || ((Identifier) callee).isOperator()) {
					throw new IllegalArgumentException("Pipeline stages must be named operations");
				}
				String name = ((Identifier) callee).getName();
				if (flat) {
					if (!pipelineOperations.contains(name)) {
						throw new IllegalArgumentException(
								"Pipeline operation '" + name + "' must be registered to be printed on a single line");
					}
					sb.append(' ');
				} else {
					sb.append('\n').append(inner);
				}
				sb.append(name);
				for (SyntaxNode arg : stage.getArgs()) {
					sb.append(' ').append(argument(arg, inner, flat));
				}
			}
			return sb.toString();
		}

		@Override
		public String visitLetBinding(LetBinding node) {
			List<String> bindings = new ArrayList<String>();
			for (LetBinding.Binding binding : node.getBindings()) {
				bindings.add(binding.getName() + " = " + inline(binding.getValue(), inner, flat));
			}
			String body = value(node.getBody(), indent, flat);
			if (flat || (!anyMultiLine(bindings) && !body.contains("\n"))) {
				return "let " + String.join(", ", bindings) + " in " + body;
			}
			return "let\n" + inner + String.join("\n" + inner, bindings) + "\n" + indent + "in " + body;
		}

		@Override
		public String visitIfExpr(IfExpr node) {
			List<String> conditions = new ArrayList<String>();
			List<String> results = new ArrayList<String>();
			for (IfExpr.Branch branch : node.getBranches()) {
				conditions.add(condition(branch.getCondition(), inner, flat));
				results.add(inline(branch.getResult(), inner, flat));
			}
			SyntaxNode elseExpr = node.getElseExpr();
			String otherwise = elseExpr instanceof IfExpr ? parens(elseExpr, inner, flat) : inline(elseExpr, inner, flat);
			boolean multiLine = !flat && (anyMultiLine(results) || otherwise.contains("\n"));

			StringBuilder sb = new StringBuilder();
			for (int i = 0; i < conditions.size(); i++) {
				sb.append(i == 0 ? "if " : "else if ").append(conditions.get(i));
				sb.append(multiLine ? "\n" + inner : " ").append("then ").append(results.get(i));
				sb.append(multiLine ? "\n" + inner : " ");
			}
			return sb.append("else ").append(otherwise).toString();
		}

		@Override
		public String visitMatchExpr(MatchExpr node) {
			String scrutinee = node.hasImplicitScrutinee() ? "_" : condition(node.getScrutinee(), indent, flat);
			StringBuilder sb = new StringBuilder("match ").append(scrutinee);
			for (MatchClause clause : node.getClauses()) {
				sb.append(flat ? " " : "\n" + inner).append(value(clause, inner, flat));
			}
			return sb.toString();
		}

		@Override
		public String visitMatchClause(MatchClause node) {
			StringBuilder sb = new StringBuilder("| ").append(value(node.getPattern(), indent, flat));
			if (node.getGuard() != null) {
				sb.append(" when ").append(condition(node.getGuard(), indent, flat));
			}
			return sb.append(" -> ").append(inline(node.getResult(), indent, flat)).toString();
		}

		@Override
		public String visitRecordPattern(RecordPattern node) {
			List<String> fields = new ArrayList<String>();
			for (RecordPattern.FieldPattern field : node.getFields()) {
				String name = key(field.getField());
				switch (field.getConstraint()) {
				case BIND:
					boolean shorthand = field.getBinding().equals(field.getField()) && name.equals(field.getField());
					fields.add(shorthand ? name : name + ": " + field.getBinding());
					break;
				case LITERAL:
					fields.add(name + ": " + value(field.getLiteral(), indent, flat));
					break;
				default:
					fields.add(name + ": _");
				}
			}
			return "{" + String.join(" ", fields) + "}";
		}

		@Override
		public String visitCatchAllPattern(CatchAllPattern node) {
			return node.getSpelling().getText();
		}

		@Override
		public String visitLiteralPattern(LiteralPattern node) {
			return value(node.getLiteral(), indent, flat);
		}

		@Override
		public String visitGuardPattern(GuardPattern node) {
			SyntaxNode guard = node.getCondition();
			boolean literal = guard instanceof NumberLiteral
					|| guard instanceof StringLiteral
					|| guard instanceof BoolLiteral
					|| guard instanceof NilLiteral
					|| (guard instanceof WildcardAccess && ((WildcardAccess) guard).isBare());
			String text = condition(guard, indent, flat);
			return literal || text.startsWith("{") ? "(" + text + ")" : text;
		}

		@Override
		public String visitTryCatch(TryCatch node) {
			SyntaxNode body = node.getBody();
			String text = body instanceof MatchExpr || body instanceof TryCatch ?
					parens(body, indent, flat) : value(body, indent, flat);
			List<String> catches = new ArrayList<String>();
			for (CatchClause clause : node.getCatches()) {
				catches.add(value(clause, inner, flat));
			}
			if (flat || (!text.contains("\n") && !anyMultiLine(catches))) {
				return "try " + text + " " + String.join(" ", catches);
			}
			return "try " + text + "\n" + inner + String.join("\n" + inner, catches);
		}

		@Override
		public String visitCatchClause(CatchClause node) {
			StringBuilder sb = new StringBuilder("catch ");
			if (node.getErrorTag() != null) {
				sb.append(node.getErrorTag()).append(' ');
			}
			if (node.getBinding() != null) {
				sb.append(node.getBinding()).append(' ');
			}
			SyntaxNode handler = node.getHandler();
			String text = handler instanceof TryCatch ? parens(handler, indent, flat) : inline(handler, indent, flat);
			return sb.append("-> ").append(text).toString();
		}

		@Override
		public String visitError(ErrorNode node) {
			throw new IllegalArgumentException("Cannot print a tree with a parse error: " + node.getDiagnostic().getReason());
		}
	}
}

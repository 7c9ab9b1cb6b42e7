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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.datatwist.frontend.ast.Application;
import org.metricshub.datatwist.frontend.ast.Assignment;
import org.metricshub.datatwist.frontend.ast.BoolLiteral;
import org.metricshub.datatwist.frontend.ast.CatchAllPattern;
import org.metricshub.datatwist.frontend.ast.CatchClause;
import org.metricshub.datatwist.frontend.ast.Diagnostic;
import org.metricshub.datatwist.frontend.ast.DiagnosticKind;
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
import org.metricshub.datatwist.frontend.ast.Pattern;
import org.metricshub.datatwist.frontend.ast.Pipeline;
import org.metricshub.datatwist.frontend.ast.Program;
import org.metricshub.datatwist.frontend.ast.RecordLiteral;
import org.metricshub.datatwist.frontend.ast.RecordPattern;
import org.metricshub.datatwist.frontend.ast.SourceSpan;
import org.metricshub.datatwist.frontend.ast.StringLiteral;
import org.metricshub.datatwist.frontend.ast.SyntaxException;
import org.metricshub.datatwist.frontend.ast.SyntaxNode;
import org.metricshub.datatwist.frontend.ast.TryCatch;
import org.metricshub.datatwist.frontend.ast.WildcardAccess;

/**
 * Creates the nodes of the syntax tree from tokens and sub-trees, computing
 * their source spans, and enforces the rules that are checked once a
 * construct is complete: unique record keys, unique function parameters,
 * unique fields in record patterns.
 */
public class TreeBuilder {

	// a program without statements covers no bytes, at the start of the input
	private static final SourceSpan EMPTY_SOURCE = new SourceSpan(1, 1, 0, 0);

	private final String sourceDescription;

	/**
	 * @param sourceDescription name of the source, used in diagnostics
	 */
	public TreeBuilder(String sourceDescription) {
		this.sourceDescription = sourceDescription;
	}

	/**
	 * @param statements top-level statements, in source order
	 * @return the program spanning its first and last statements, or a
	 *         zero-length span at line 1, column 1 when there is no statement,
	 *         whatever comments and blank lines the input holds
	 */
	public Program program(List<SyntaxNode> statements) {
		SourceSpan span = statements.isEmpty() ?
				EMPTY_SOURCE : statements.get(0).getSpan().to(statements.get(statements.size() - 1).getSpan());
		return new Program(statements, span);
	}

	public Assignment assignment(Token name, SyntaxNode value) {
		return new Assignment(name.getText(), value, name.getSpan().to(value.getSpan()));
	}

	public Identifier identifier(Token name) {
		return new Identifier(name.getText(), name.getSpan());
	}

	public WildcardAccess wildcard(Token underscore, List<Token> fields) {
		List<String> path = new ArrayList<String>(fields.size());
		SourceSpan span = underscore.getSpan();
		for (Token field : fields) {
			path.add(field.getText());
			span = span.to(field.getSpan());
		}
		return new WildcardAccess(path, span);
	}

	public FieldAccess fieldAccess(SyntaxNode target, Token field) {
		return new FieldAccess(target, field.getText(), target.getSpan().to(field.getSpan()));
	}

	public NumberLiteral number(Token number) {
		return new NumberLiteral(number.getText(), number.getSpan());
	}

	public NumberLiteral negativeNumber(Token minus, Token number) {
		return new NumberLiteral("-" + number.getText(), minus.getSpan().to(number.getSpan()));
	}

	public StringLiteral string(Token string, List<StringLiteral.Segment> segments) {
		return new StringLiteral(segments, string.getSpan());
	}

	public BoolLiteral bool(Token literal) {
		return new BoolLiteral(literal.getType() == TokenType.TRUE, literal.getSpan());
	}

	public NilLiteral nil(Token literal) {
		return new NilLiteral(literal.getSpan());
	}

	public RecordLiteral.Field field(Token key, String name, SyntaxNode value) {
		return new RecordLiteral.Field(name, value, key.getSpan().to(value.getSpan()));
	}

	/**
	 * @throws SyntaxException if two fields have the same key
	 */
	public RecordLiteral record(Token open, List<RecordLiteral.Field> fields, Token close) {
		Set<String> keys = new HashSet<String>();
		for (RecordLiteral.Field field : fields) {
			if (!keys.add(field.getKey())) {
				throw syntaxException("Duplicate record key '" + field.getKey() + "'", field.getSpan());
			}
		}
		return new RecordLiteral(fields, open.getSpan().to(close.getSpan()));
	}

	public ListLiteral list(Token open, List<SyntaxNode> elements, Token close) {
		return new ListLiteral(elements, open.getSpan().to(close.getSpan()));
	}

	/**
	 * @throws SyntaxException if the parameter list is empty or repeats a name
	 */
	public FunctionDef function(Token open, List<Token> params, SyntaxNode body, Token close) {
		if (params.isEmpty()) {
			throw syntaxException("Function literal has an empty parameter list", open.getSpan());
		}
		List<String> names = new ArrayList<String>(params.size());
		for (Token param : params) {
			if (names.contains(param.getText())) {
				throw syntaxException("Duplicate parameter '" + param.getText() + "'", param.getSpan());
			}
			names.add(param.getText());
		}
		return new FunctionDef(names, body, open.getSpan().to(close.getSpan()));
	}

	public Application application(SyntaxNode callee, List<SyntaxNode> args) {
		SourceSpan span = callee.getSpan();
		if (!args.isEmpty()) {
			span = span.to(args.get(args.size() - 1).getSpan());
		}
		return new Application(callee, args, span);
	}

	/**
	 * Desugars {@code left op right} to an application of the operator identifier.
	 */
	public Application binary(Operator operator, Token symbol, SyntaxNode left, SyntaxNode right) {
		List<SyntaxNode> args = new ArrayList<SyntaxNode>(2);
		args.add(left);
		args.add(right);
		Identifier callee = new Identifier(operator.getSymbol(), true, symbol.getSpan());
		return new Application(callee, args, left.getSpan().to(right.getSpan()));
	}

	public Pipeline pipeline(SyntaxNode seed, List<Application> stages) {
		return new Pipeline(seed, stages, seed.getSpan().to(stages.get(stages.size() - 1).getSpan()));
	}

	public LetBinding.Binding binding(Token name, SyntaxNode value) {
		return new LetBinding.Binding(name.getText(), value, name.getSpan().to(value.getSpan()));
	}

	public LetBinding let(Token let, List<LetBinding.Binding> bindings, SyntaxNode body) {
		return new LetBinding(bindings, body, let.getSpan().to(body.getSpan()));
	}

	public IfExpr ifExpr(Token ifToken, List<IfExpr.Branch> branches, SyntaxNode elseExpr) {
		return new IfExpr(branches, elseExpr, ifToken.getSpan().to(elseExpr.getSpan()));
	}

	public MatchExpr match(Token match, SyntaxNode scrutinee, List<MatchClause> clauses) {
		return new MatchExpr(scrutinee, clauses, match.getSpan().to(last(clauses).getSpan()));
	}

	/**
	 * A clause block without {@code match}: the scrutinee is the implicit argument.
	 */
	public MatchExpr implicitMatch(List<MatchClause> clauses) {
		SourceSpan start = clauses.get(0).getSpan();
		WildcardAccess implicit = new WildcardAccess(new ArrayList<String>(), start);
		return new MatchExpr(implicit, clauses, start.to(last(clauses).getSpan()));
	}

	public MatchClause clause(Token bar, Pattern pattern, SyntaxNode guard, SyntaxNode result) {
		return new MatchClause(pattern, guard, result, bar.getSpan().to(result.getSpan()));
	}

	/**
	 * @throws SyntaxException if a field is constrained twice
	 */
	public RecordPattern recordPattern(Token open, List<RecordPattern.FieldPattern> fields, Token close) {
		Set<String> names = new HashSet<String>();
		for (RecordPattern.FieldPattern field : fields) {
			if (!names.add(field.getField())) {
				throw syntaxException("Duplicate field '" + field.getField() + "' in record pattern", field.getSpan());
			}
		}
		return new RecordPattern(fields, open.getSpan().to(close.getSpan()));
	}

	public CatchAllPattern catchAll(Token token) {
		CatchAllPattern.Spelling spelling = token.getType() == TokenType.OTHERWISE ?
				CatchAllPattern.Spelling.OTHERWISE : CatchAllPattern.Spelling.UNDERSCORE;
		return new CatchAllPattern(spelling, token.getSpan());
	}

	public LiteralPattern literalPattern(SyntaxNode literal) {
		return new LiteralPattern(literal, literal.getSpan());
	}

	public GuardPattern guardPattern(SyntaxNode condition) {
		return new GuardPattern(condition, condition.getSpan());
	}

	public TryCatch tryCatch(Token tryToken, SyntaxNode body, List<CatchClause> catches) {
		return new TryCatch(body, catches, tryToken.getSpan().to(last(catches).getSpan()));
	}

	public CatchClause catchClause(Token catchToken, Token errorTag, Token binding, SyntaxNode handler) {
		return new CatchClause(
				errorTag == null ? null : errorTag.getText(),
				binding == null ? null : binding.getText(),
				handler,
				catchToken.getSpan().to(handler.getSpan()));
	}

	public ErrorNode error(Diagnostic diagnostic) {
		return new ErrorNode(diagnostic, diagnostic.getSpan());
	}

	private static <T extends SyntaxNode> T last(List<T> nodes) {
		return nodes.get(nodes.size() - 1);
	}

	private SyntaxException syntaxException(String reason, SourceSpan span) {
		return new SyntaxException(new Diagnostic(DiagnosticKind.SYNTAX, sourceDescription, span, null, reason));
	}
}

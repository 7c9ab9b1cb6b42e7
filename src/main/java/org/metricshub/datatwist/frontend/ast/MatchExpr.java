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

import java.util.List;

/**
 * A pattern match. Clauses are tried in source order; the first one whose
 * pattern matches and whose guard holds wins.
 * <p>
 * A clause block written without the {@code match} keyword has the bare
 * {@code _} as scrutinee, i.e. it matches the implicit argument.
 */
public final class MatchExpr extends SyntaxNode {

	private final SyntaxNode scrutinee;
	private final List<MatchClause> clauses;

	public MatchExpr(SyntaxNode scrutinee, List<MatchClause> clauses, SourceSpan span) {
		super(span);
		this.scrutinee = required(scrutinee, "Match scrutinee");
		this.clauses = immutableList(clauses, "Match clauses");
		if (this.clauses.isEmpty()) {
			throw new IllegalArgumentException("A match requires at least one clause");
		}
	}

	public SyntaxNode getScrutinee() {
		return scrutinee;
	}

	public List<MatchClause> getClauses() {
		return clauses;
	}

	/**
	 * @return {@code true} if the scrutinee is the implicit argument {@code _}
	 */
	public boolean hasImplicitScrutinee() {
		return scrutinee instanceof WildcardAccess && ((WildcardAccess) scrutinee).isBare();
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.MATCH_EXPR;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitMatchExpr(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof MatchExpr)) {
			return false;
		}
		MatchExpr other = (MatchExpr) o;
		return scrutinee.equals(other.scrutinee) && clauses.equals(other.clauses);
	}

	@Override
	public int hashCode() {
		return 31 * scrutinee.hashCode() + clauses.hashCode();
	}

	@Override
	public String toString() {
		return "Match(" + scrutinee + ", " + clauses + ")";
	}
}

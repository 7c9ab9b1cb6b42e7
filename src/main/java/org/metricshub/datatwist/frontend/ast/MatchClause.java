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
 * {@code | pattern [when guard] -> result}
 */
public final class MatchClause extends SyntaxNode {

	private final Pattern pattern;
	private final SyntaxNode guard;
	private final SyntaxNode result;

	public MatchClause(Pattern pattern, SyntaxNode guard, SyntaxNode result, SourceSpan span) {
		super(span);
		this.pattern = required(pattern, "Clause pattern");
		this.guard = guard;
		this.result = required(result, "Clause result");
	}

	public Pattern getPattern() {
		return pattern;
	}

	/**
	 * @return the {@code when} condition, or {@code null}
	 */
	public SyntaxNode getGuard() {
		return guard;
	}

	public SyntaxNode getResult() {
		return result;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.MATCH_CLAUSE;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitMatchClause(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof MatchClause)) {
			return false;
		}
		MatchClause other = (MatchClause) o;
		return pattern.equals(other.pattern)
				&& (guard == null ? other.guard == null : guard.equals(other.guard))
				&& result.equals(other.result);
	}

	@Override
	public int hashCode() {
		int h = pattern.hashCode();
		h = 31 * h + (guard == null ? 0 : guard.hashCode());
		return 31 * h + result.hashCode();
	}

	@Override
	public String toString() {
		return "| " + pattern + (guard == null ? "" : " when " + guard) + " -> " + result;
	}
}

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
 * {@code try body catch ... -> handler}. Catch clauses are kept in source
 * order; selecting one is up to the evaluator.
 */
public final class TryCatch extends SyntaxNode {

	private final SyntaxNode body;
	private final List<CatchClause> catches;

	public TryCatch(SyntaxNode body, List<CatchClause> catches, SourceSpan span) {
		super(span);
		this.body = required(body, "Try body");
		this.catches = immutableList(catches, "Catch clauses");
		if (this.catches.isEmpty()) {
			throw new IllegalArgumentException("A try expression requires at least one catch clause");
		}
	}

	public SyntaxNode getBody() {
		return body;
	}

	public List<CatchClause> getCatches() {
		return catches;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.TRY_CATCH;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitTryCatch(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof TryCatch)) {
			return false;
		}
		TryCatch other = (TryCatch) o;
		return body.equals(other.body) && catches.equals(other.catches);
	}

	@Override
	public int hashCode() {
		return 31 * body.hashCode() + catches.hashCode();
	}

	@Override
	public String toString() {
		return "Try(" + body + ", " + catches + ")";
	}
}

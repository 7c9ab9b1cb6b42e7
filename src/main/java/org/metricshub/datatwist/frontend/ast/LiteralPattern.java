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
 * Matches a value equal to a number, string, boolean or nil literal.
 */
public final class LiteralPattern extends Pattern {

	private final SyntaxNode literal;

	public LiteralPattern(SyntaxNode literal, SourceSpan span) {
		super(span);
		this.literal = required(literal, "Literal");
	}

	public SyntaxNode getLiteral() {
		return literal;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.LITERAL_PATTERN;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitLiteralPattern(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof LiteralPattern && literal.equals(((LiteralPattern) o).literal);
	}

	@Override
	public int hashCode() {
		return literal.hashCode();
	}

	@Override
	public String toString() {
		return literal.toString();
	}
}

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
 * A name. Binary operators are represented as applications of a synthetic
 * identifier named after the operator symbol ({@code +}, {@code and}, ...).
 */
public final class Identifier extends SyntaxNode {

	private final String name;
	private final boolean operator;

	public Identifier(String name, SourceSpan span) {
		this(name, false, span);
	}

	public Identifier(String name, boolean operator, SourceSpan span) {
		super(span);
		this.name = required(name, "Identifier name");
		this.operator = operator;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return {@code true} for the synthetic callee of a binary operator
	 */
	public boolean isOperator() {
		return operator;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.IDENTIFIER;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitIdentifier(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Identifier)) {
			return false;
		}
		Identifier other = (Identifier) o;
		return name.equals(other.name) && operator == other.operator;
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 2 + (operator ? 1 : 0);
	}

	@Override
	public String toString() {
		return name;
	}
}

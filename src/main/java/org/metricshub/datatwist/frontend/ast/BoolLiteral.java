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
 * {@code true} or {@code false}.
 */
public final class BoolLiteral extends SyntaxNode {

	private final boolean value;

	public BoolLiteral(boolean value, SourceSpan span) {
		super(span);
		this.value = value;
	}

	public boolean getValue() {
		return value;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.BOOL_LITERAL;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitBoolLiteral(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof BoolLiteral && value == ((BoolLiteral) o).value;
	}

	@Override
	public int hashCode() {
		return value ? 1231 : 1237;
	}

	@Override
	public String toString() {
		return String.valueOf(value);
	}
}

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

import java.math.BigDecimal;

/**
 * A number, kept as written so that it prints back identically.
 */
public final class NumberLiteral extends SyntaxNode {

	private final String text;

	public NumberLiteral(String text, SourceSpan span) {
		super(span);
		this.text = required(text, "Number text");
	}

	public String getText() {
		return text;
	}

	public BigDecimal getValue() {
		return new BigDecimal(text);
	}

	public boolean isNegative() {
		return text.startsWith("-");
	}

	public boolean isInteger() {
		return text.indexOf('.') < 0;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.NUMBER_LITERAL;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitNumberLiteral(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof NumberLiteral && text.equals(((NumberLiteral) o).text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public String toString() {
		return text;
	}
}

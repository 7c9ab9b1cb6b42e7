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
 * A condition used as a pattern, such as {@code | _.age < 18 -> "minor"}:
 * the clause matches when the condition holds for the scrutinee.
 */
public final class GuardPattern extends Pattern {

	private final SyntaxNode condition;

	public GuardPattern(SyntaxNode condition, SourceSpan span) {
		super(span);
		this.condition = required(condition, "Condition");
	}

	public SyntaxNode getCondition() {
		return condition;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.GUARD_PATTERN;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitGuardPattern(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof GuardPattern && condition.equals(((GuardPattern) o).condition);
	}

	@Override
	public int hashCode() {
		return condition.hashCode();
	}

	@Override
	public String toString() {
		return condition.toString();
	}
}

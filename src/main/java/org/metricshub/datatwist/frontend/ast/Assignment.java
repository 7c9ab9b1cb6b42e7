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
 * Top-level {@code name = value} statement. Named functions are assignments
 * of a {@link FunctionDef}.
 */
public final class Assignment extends SyntaxNode {

	private final String name;
	private final SyntaxNode value;

	public Assignment(String name, SyntaxNode value, SourceSpan span) {
		super(span);
		this.name = required(name, "Assignment name");
		this.value = required(value, "Assignment value");
	}

	public String getName() {
		return name;
	}

	public SyntaxNode getValue() {
		return value;
	}

	/**
	 * @return {@code true} if this statement defines a named function
	 */
	public boolean isFunctionDefinition() {
		return value instanceof FunctionDef;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.ASSIGNMENT;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitAssignment(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Assignment)) {
			return false;
		}
		Assignment other = (Assignment) o;
		return name.equals(other.name) && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return 31 * name.hashCode() + value.hashCode();
	}

	@Override
	public String toString() {
		return "Assignment(" + name + ", " + value + ")";
	}
}

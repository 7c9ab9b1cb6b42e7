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
 * {@code let a = 1, b = a + 1 in body}. Bindings keep their order; each one
 * sees the previous ones.
 */
public final class LetBinding extends SyntaxNode {

	/**
	 * One {@code name = value} binding.
	 */
	public static final class Binding {

		private final String name;
		private final SyntaxNode value;
		private final SourceSpan span;

		public Binding(String name, SyntaxNode value, SourceSpan span) {
			this.name = required(name, "Binding name");
			this.value = required(value, "Binding value");
			this.span = required(span, "Binding span");
		}

		public String getName() {
			return name;
		}

		public SyntaxNode getValue() {
			return value;
		}

		public SourceSpan getSpan() {
			return span;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Binding)) {
				return false;
			}
			Binding other = (Binding) o;
			return name.equals(other.name) && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return 31 * name.hashCode() + value.hashCode();
		}

		@Override
		public String toString() {
			return name + " = " + value;
		}
	}

	private final List<Binding> bindings;
	private final SyntaxNode body;

	public LetBinding(List<Binding> bindings, SyntaxNode body, SourceSpan span) {
		super(span);
		this.bindings = immutableList(bindings, "Let bindings");
		if (this.bindings.isEmpty()) {
			throw new IllegalArgumentException("A let expression requires at least one binding");
		}
		this.body = required(body, "Let body");
	}

	public List<Binding> getBindings() {
		return bindings;
	}

	public SyntaxNode getBody() {
		return body;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.LET_BINDING;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitLetBinding(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof LetBinding)) {
			return false;
		}
		LetBinding other = (LetBinding) o;
		return bindings.equals(other.bindings) && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return 31 * bindings.hashCode() + body.hashCode();
	}

	@Override
	public String toString() {
		return "Let(" + bindings + " in " + body + ")";
	}
}

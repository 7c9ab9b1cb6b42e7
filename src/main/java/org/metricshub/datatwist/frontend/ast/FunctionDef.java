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
 * Anonymous function {@code [a b -> body]}. The parameter list is never empty.
 */
public final class FunctionDef extends SyntaxNode {

	private final List<String> params;
	private final SyntaxNode body;

	public FunctionDef(List<String> params, SyntaxNode body, SourceSpan span) {
		super(span);
		this.params = immutableList(params, "Function parameters");
		if (this.params.isEmpty()) {
			throw new IllegalArgumentException("A function requires at least one parameter");
		}
		this.body = required(body, "Function body");
	}

	public List<String> getParams() {
		return params;
	}

	public SyntaxNode getBody() {
		return body;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.FUNCTION_DEF;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitFunctionDef(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof FunctionDef)) {
			return false;
		}
		FunctionDef other = (FunctionDef) o;
		return params.equals(other.params) && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return 31 * params.hashCode() + body.hashCode();
	}

	@Override
	public String toString() {
		return "Function(" + params + " -> " + body + ")";
	}
}

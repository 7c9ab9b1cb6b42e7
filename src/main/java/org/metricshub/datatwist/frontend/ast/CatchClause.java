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
 * {@code catch [ErrorTag] [binding] -> handler}. At least one of the tag and
 * the binding is present.
 */
public final class CatchClause extends SyntaxNode {

	private final String errorTag;
	private final String binding;
	private final SyntaxNode handler;

	public CatchClause(String errorTag, String binding, SyntaxNode handler, SourceSpan span) {
		super(span);
		if (errorTag == null && binding == null) {
			throw new IllegalArgumentException("A catch clause requires an error tag or a binding");
		}
		this.errorTag = errorTag;
		this.binding = binding;
		this.handler = required(handler, "Catch handler");
	}

	/**
	 * @return the error tag, or {@code null} to catch any error
	 */
	public String getErrorTag() {
		return errorTag;
	}

	/**
	 * @return the name bound to the error, or {@code null}
	 */
	public String getBinding() {
		return binding;
	}

	public SyntaxNode getHandler() {
		return handler;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.CATCH_CLAUSE;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitCatchClause(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof CatchClause)) {
			return false;
		}
		CatchClause other = (CatchClause) o;
		return (errorTag == null ? other.errorTag == null : errorTag.equals(other.errorTag))
				&& (binding == null ? other.binding == null : binding.equals(other.binding))
				&& handler.equals(other.handler);
	}

	@Override
	public int hashCode() {
		int h = errorTag == null ? 0 : errorTag.hashCode();
		h = 31 * h + (binding == null ? 0 : binding.hashCode());
		return 31 * h + handler.hashCode();
	}

	@Override
	public String toString() {
		return "catch " + (errorTag == null ? "" : errorTag + " ") + (binding == null ? "" : binding + " ") + "-> " + handler;
	}
}

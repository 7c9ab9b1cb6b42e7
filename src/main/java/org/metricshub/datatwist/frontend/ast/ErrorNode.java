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
 * Failure marker spliced into a {@link Program} by a best-effort parse, in
 * place of the statement that could not be parsed.
 */
public final class ErrorNode extends SyntaxNode {

	private final Diagnostic diagnostic;

	public ErrorNode(Diagnostic diagnostic, SourceSpan span) {
		super(span);
		this.diagnostic = required(diagnostic, "Diagnostic");
	}

	public Diagnostic getDiagnostic() {
		return diagnostic;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.ERROR;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitError(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof ErrorNode && diagnostic.getReason().equals(((ErrorNode) o).diagnostic.getReason());
	}

	@Override
	public int hashCode() {
		return diagnostic.getReason().hashCode();
	}

	@Override
	public String toString() {
		return "Error(" + diagnostic.getReason() + ")";
	}
}

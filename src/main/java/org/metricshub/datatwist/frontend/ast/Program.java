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
 * Root of a parsed source: the ordered top-level statements.
 * <p>
 * The span runs from the first statement to the last one. A program without
 * statements has a span of length 0 at offset 0.
 */
public final class Program extends SyntaxNode {

	private final List<SyntaxNode> statements;

	public Program(List<? extends SyntaxNode> statements, SourceSpan span) {
		super(span);
		this.statements = immutableList(statements, "Program statements");
	}

	public List<SyntaxNode> getStatements() {
		return statements;
	}

	/**
	 * @return {@code true} if a best-effort parse spliced failure markers into this program
	 */
	public boolean hasErrors() {
		for (SyntaxNode statement : statements) {
			if (statement instanceof ErrorNode) {
				return true;
			}
		}
		return false;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.PROGRAM;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitProgram(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Program && statements.equals(((Program) o).statements);
	}

	@Override
	public int hashCode() {
		return statements.hashCode();
	}

	@Override
	public String toString() {
		return "Program" + statements;
	}
}

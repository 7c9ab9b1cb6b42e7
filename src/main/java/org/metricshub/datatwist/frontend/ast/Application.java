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
 * A callee applied to ordered arguments. Used for juxtaposed calls
 * ({@code f x y}), for binary operators (callee is an operator
 * {@link Identifier}) and for pipeline stages.
 */
public final class Application extends SyntaxNode {

	private final SyntaxNode callee;
	private final List<SyntaxNode> args;

	public Application(SyntaxNode callee, List<? extends SyntaxNode> args, SourceSpan span) {
		super(span);
		this.callee = required(callee, "Application callee");
		this.args = immutableList(args, "Application arguments");
	}

	public SyntaxNode getCallee() {
		return callee;
	}

	public List<SyntaxNode> getArgs() {
		return args;
	}

	/**
	 * @return {@code true} if this application is a desugared binary operator
	 */
	public boolean isBinaryOperator() {
		return callee instanceof Identifier && ((Identifier) callee).isOperator() && args.size() == 2;
	}

	/**
	 * @return the callee name when the callee is an identifier, {@code null} otherwise
	 */
	public String getCalleeName() {
		return callee instanceof Identifier ? ((Identifier) callee).getName() : null;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.APPLICATION;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitApplication(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Application)) {
			return false;
		}
		Application other = (Application) o;
		return callee.equals(other.callee) && args.equals(other.args);
	}

	@Override
	public int hashCode() {
		return 31 * callee.hashCode() + args.hashCode();
	}

	@Override
	public String toString() {
		return "Application(" + callee + ", " + args + ")";
	}
}

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
 * {@code if c1 then a else if c2 then b else c}: ordered condition branches
 * and a mandatory else expression.
 */
public final class IfExpr extends SyntaxNode {

	/**
	 * A {@code condition then result} pair.
	 */
	public static final class Branch {

		private final SyntaxNode condition;
		private final SyntaxNode result;

		public Branch(SyntaxNode condition, SyntaxNode result) {
			this.condition = required(condition, "Branch condition");
			this.result = required(result, "Branch result");
		}

		public SyntaxNode getCondition() {
			return condition;
		}

		public SyntaxNode getResult() {
			return result;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Branch)) {
				return false;
			}
			Branch other = (Branch) o;
			return condition.equals(other.condition) && result.equals(other.result);
		}

		@Override
		public int hashCode() {
			return 31 * condition.hashCode() + result.hashCode();
		}

		@Override
		public String toString() {
			return condition + " then " + result;
		}
	}

	private final List<Branch> branches;
	private final SyntaxNode elseExpr;

	public IfExpr(List<Branch> branches, SyntaxNode elseExpr, SourceSpan span) {
		super(span);
		this.branches = immutableList(branches, "If branches");
		if (this.branches.isEmpty()) {
			throw new IllegalArgumentException("An if expression requires at least one branch");
		}
		this.elseExpr = required(elseExpr, "Else expression");
	}

	public List<Branch> getBranches() {
		return branches;
	}

	public SyntaxNode getElseExpr() {
		return elseExpr;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.IF_EXPR;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitIfExpr(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof IfExpr)) {
			return false;
		}
		IfExpr other = (IfExpr) o;
		return branches.equals(other.branches) && elseExpr.equals(other.elseExpr);
	}

	@Override
	public int hashCode() {
		return 31 * branches.hashCode() + elseExpr.hashCode();
	}

	@Override
	public String toString() {
		return "If(" + branches + " else " + elseExpr + ")";
	}
}

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
 * {@code target.field} on any value other than the wildcard.
 */
public final class FieldAccess extends SyntaxNode {

	private final SyntaxNode target;
	private final String field;

	public FieldAccess(SyntaxNode target, String field, SourceSpan span) {
		super(span);
		this.target = required(target, "Field access target");
		this.field = required(field, "Field name");
	}

	public SyntaxNode getTarget() {
		return target;
	}

	public String getField() {
		return field;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.FIELD_ACCESS;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitFieldAccess(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof FieldAccess)) {
			return false;
		}
		FieldAccess other = (FieldAccess) o;
		return target.equals(other.target) && field.equals(other.field);
	}

	@Override
	public int hashCode() {
		return 31 * target.hashCode() + field.hashCode();
	}

	@Override
	public String toString() {
		return target + "." + field;
	}
}

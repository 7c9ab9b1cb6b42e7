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
 * The {@code _} and {@code _.a.b} accessors. An empty path is the bare
 * {@code _}, which in pipeline stage argument position marks where the piped
 * value goes.
 */
public final class WildcardAccess extends SyntaxNode {

	private final List<String> path;

	public WildcardAccess(List<String> path, SourceSpan span) {
		super(span);
		this.path = immutableList(path, "Wildcard path");
	}

	public List<String> getPath() {
		return path;
	}

	/**
	 * @return {@code true} for the bare {@code _}
	 */
	public boolean isBare() {
		return path.isEmpty();
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.WILDCARD_ACCESS;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitWildcardAccess(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof WildcardAccess && path.equals(((WildcardAccess) o).path);
	}

	@Override
	public int hashCode() {
		return path.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("_");
		for (String field : path) {
			sb.append('.').append(field);
		}
		return sb.toString();
	}
}

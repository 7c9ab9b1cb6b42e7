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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of the DataTwist syntax tree.
 * <p>
 * Nodes are immutable and exclusively owned by their parent. Every node
 * carries the {@link SourceSpan} it was built from. Structural equality
 * ({@link #equals(Object)} and {@link #hashCode()}) ignores spans, so that two
 * trees parsed from differently formatted sources compare equal when they have
 * the same shape.
 */
public abstract class SyntaxNode {

	private final SourceSpan span;

	protected SyntaxNode(SourceSpan span) {
		if (span == null) {
			throw new IllegalArgumentException("A syntax node requires a source span");
		}
		this.span = span;
	}

	/**
	 * @return where this node was found in the source
	 */
	public final SourceSpan getSpan() {
		return span;
	}

	/**
	 * @return the variant tag of this node
	 */
	public abstract NodeKind getKind();

	/**
	 * Double dispatch into the specified visitor.
	 *
	 * @param visitor the visitor
	 * @param <R> result type of the visitor
	 * @return what the visitor returned
	 */
	public abstract <R> R accept(SyntaxVisitor<R> visitor);

	/**
	 * Makes an unmodifiable copy of the specified list, refusing {@code null}
	 * elements.
	 *
	 * @param elements list to copy
	 * @param what name used in the error message
	 * @param <T> type of the elements
	 * @return unmodifiable copy
	 */
	protected static <T> List<T> immutableList(List<? extends T> elements, String what) {
		if (elements == null) {
			return Collections.emptyList();
		}
		List<T> copy = new ArrayList<T>(elements.size());
		for (T element : elements) {
			if (element == null) {
				throw new IllegalArgumentException(what + " must not contain null elements");
			}
			copy.add(element);
		}
		return Collections.unmodifiableList(copy);
	}

	protected static <T> T required(T value, String what) {
		if (value == null) {
			throw new IllegalArgumentException(what + " is required");
		}
		return value;
	}
}

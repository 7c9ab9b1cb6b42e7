package org.metricshub.datatwist;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.datatwist.frontend.ast.Diagnostic;
import org.metricshub.datatwist.frontend.ast.SyntaxNode;

/**
 * Outcome of a parse: the syntax tree, the diagnostics, or both when a
 * best-effort parse recovered from errors.
 */
public final class ParseResult {

	private final SyntaxNode tree;
	private final List<Diagnostic> diagnostics;

	/**
	 * @param tree the syntax tree, or {@code null} if the parse failed
	 * @param diagnostics the errors found, never {@code null}
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Syntax trees are immutable.")
	public ParseResult(SyntaxNode tree, List<Diagnostic> diagnostics) {
		if (tree == null && (diagnostics == null || diagnostics.isEmpty())) {
			throw new IllegalArgumentException("A parse result without a tree requires diagnostics");
		}
		this.tree = tree;
		this.diagnostics = diagnostics == null ?
				Collections.<Diagnostic>emptyList() : Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
	}

	/**
	 * @return the syntax tree, or {@code null} if the source could not be parsed
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Syntax trees are immutable.")
	public SyntaxNode getTree() {
		return tree;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	/**
	 * @return {@code true} if the source was parsed without any error
	 */
	public boolean isSuccess() {
		return diagnostics.isEmpty();
	}

	@Override
	public String toString() {
		if (isSuccess()) {
			return "ParseResult[" + tree.getKind() + "]";
		}
		return "ParseResult[" + diagnostics.size() + " error(s), first: " + diagnostics.get(0).format() + "]";
	}
}

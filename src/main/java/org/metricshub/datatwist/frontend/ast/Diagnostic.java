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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Set;
import org.metricshub.datatwist.frontend.TokenType;

/**
 * Structured description of a parse failure, anchored to the span of the
 * offending token.
 * <p>
 * The expected token kinds are the ones the parser checked at the failure
 * position, so that a caller can render "expected one of ..." without
 * re-deriving the grammar.
 */
public final class Diagnostic {

	private final DiagnosticKind kind;
	private final String sourceDescription;
	private final SourceSpan span;
	private final Set<TokenType> expected;
	private final String reason;

	public Diagnostic(
			DiagnosticKind kind,
			String sourceDescription,
			SourceSpan span,
			Set<TokenType> expected,
			String reason) {
		if (kind == null || span == null || reason == null) {
			throw new IllegalArgumentException("A diagnostic requires a kind, a span and a reason");
		}
		this.kind = kind;
		this.sourceDescription = sourceDescription;
		this.span = span;
		this.expected = expected == null || expected.isEmpty() ?
				Collections.<TokenType>emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(expected));
		this.reason = reason;
	}

	public DiagnosticKind getKind() {
		return kind;
	}

	/**
	 * @return description of the parsed source, as given by its {@code ScriptSource}
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	public SourceSpan getSpan() {
		return span;
	}

	public int getLine() {
		return span.getLine();
	}

	public int getColumn() {
		return span.getColumn();
	}

	/**
	 * @return token kinds that would have been accepted at the failure position, possibly empty
	 */
	public Set<TokenType> getExpected() {
		return expected;
	}

	public String getReason() {
		return reason;
	}

	/**
	 * Renders the diagnostic on one line:
	 * {@code source:line:column: reason (expected one of: ...)}.
	 *
	 * @return the human readable message
	 */
	public String format() {
		StringBuilder sb = new StringBuilder();
		if (sourceDescription != null) {
			sb.append(sourceDescription).append(':');
		}
		sb.append(span.getLine()).append(':').append(span.getColumn()).append(": ").append(reason);
		if (!expected.isEmpty()) {
			sb.append(expected.size() == 1 ? " (expected " : " (expected one of: ");
			Iterator<TokenType> it = expected.iterator();
			while (it.hasNext()) {
				sb.append(it.next().getDisplayName());
				if (it.hasNext()) {
					sb.append(", ");
				}
			}
			sb.append(')');
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return kind + " " + format();
	}
}

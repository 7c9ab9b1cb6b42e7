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
 * A double-quoted string, split into literal text and embedded
 * {@code {expression}} segments.
 */
public final class StringLiteral extends SyntaxNode {

	/**
	 * One piece of a string: either literal text or an embedded expression.
	 */
	public static final class Segment {

		private final String text;
		private final SyntaxNode expression;

		private Segment(String text, SyntaxNode expression) {
			this.text = text;
			this.expression = expression;
		}

		public static Segment literal(String text) {
			return new Segment(required(text, "Literal segment text"), null);
		}

		public static Segment embedded(SyntaxNode expression) {
			return new Segment(null, required(expression, "Embedded expression"));
		}

		public boolean isLiteral() {
			return expression == null;
		}

		/**
		 * @return the literal text, {@code null} for an embedded expression
		 */
		public String getText() {
			return text;
		}

		/**
		 * @return the embedded expression, {@code null} for literal text
		 */
		public SyntaxNode getExpression() {
			return expression;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Segment)) {
				return false;
			}
			Segment other = (Segment) o;
			return isLiteral() ? text.equals(other.text) : expression.equals(other.expression);
		}

		@Override
		public int hashCode() {
			return isLiteral() ? text.hashCode() : 31 * expression.hashCode();
		}

		@Override
		public String toString() {
			return isLiteral() ? text : "{" + expression + "}";
		}
	}

	private final List<Segment> segments;

	public StringLiteral(List<Segment> segments, SourceSpan span) {
		super(span);
		this.segments = immutableList(segments, "String segments");
	}

	public List<Segment> getSegments() {
		return segments;
	}

	/**
	 * @return {@code true} if at least one segment is an embedded expression
	 */
	public boolean isInterpolated() {
		for (Segment segment : segments) {
			if (!segment.isLiteral()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return the text of a non-interpolated string
	 * @throws IllegalStateException if the string embeds expressions
	 */
	public String getPlainText() {
		if (isInterpolated()) {
			throw new IllegalStateException("String embeds expressions");
		}
		StringBuilder sb = new StringBuilder();
		for (Segment segment : segments) {
			sb.append(segment.getText());
		}
		return sb.toString();
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.STRING_LITERAL;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitStringLiteral(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof StringLiteral && segments.equals(((StringLiteral) o).segments);
	}

	@Override
	public int hashCode() {
		return segments.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("\"");
		for (Segment segment : segments) {
			sb.append(segment);
		}
		return sb.append('"').toString();
	}
}

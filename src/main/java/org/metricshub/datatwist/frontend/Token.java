package org.metricshub.datatwist.frontend;

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
import org.metricshub.datatwist.frontend.ast.SourceSpan;

/**
 * A lexical token: kind, source text and location.
 * <p>
 * String tokens are split into segments: literal text (escapes already
 * resolved) and the tokens of each embedded {@code {expression}}.
 */
public final class Token {

	/**
	 * One part of a string token.
	 */
	public static final class Segment {

		private final String text;
		private final List<Token> tokens;
		private final SourceSpan span;

		private Segment(String text, List<Token> tokens, SourceSpan span) {
			this.text = text;
			this.tokens = tokens;
			this.span = span;
		}

		static Segment literal(String text, SourceSpan span) {
			return new Segment(text, null, span);
		}

		static Segment embedded(List<Token> tokens, SourceSpan span) {
			return new Segment(null, Collections.unmodifiableList(new ArrayList<Token>(tokens)), span);
		}

		public boolean isLiteral() {
			return tokens == null;
		}

		/**
		 * @return the unescaped text of a literal segment, {@code null} for an embedded one
		 */
		public String getText() {
			return text;
		}

		/**
		 * @return the tokens of an embedded expression, always ending with {@link TokenType#EOF}
		 */
		public List<Token> getTokens() {
			return tokens;
		}

		/**
		 * @return the span of the segment, braces included for an embedded one
		 */
		public SourceSpan getSpan() {
			return span;
		}
	}

	private final TokenType type;
	private final String text;
	private final SourceSpan span;
	private final List<Segment> segments;
	private final int index;

	Token(TokenType type, String text, SourceSpan span, int index) {
		this(type, text, span, index, null);
	}

	Token(TokenType type, String text, SourceSpan span, int index, List<Segment> segments) {
		this.type = type;
		this.text = text;
		this.span = span;
		this.index = index;
		this.segments = segments == null ? Collections.<Segment>emptyList() : Collections.unmodifiableList(segments);
	}

	public TokenType getType() {
		return type;
	}

	/**
	 * @return the source text of the token; for {@link TokenType#NEWLINE}, the
	 *         indentation prefix of the next line
	 */
	public String getText() {
		return text;
	}

	public SourceSpan getSpan() {
		return span;
	}

	/**
	 * @return segments of a {@link TokenType#STRING} token, empty for other kinds
	 */
	public List<Segment> getSegments() {
		return segments;
	}

	/**
	 * @return character index of the token in the scanned text
	 */
	int getIndex() {
		return index;
	}

	/**
	 * @param other the token that follows this one
	 * @return {@code true} if no character separates the two tokens
	 */
	boolean isAdjacentTo(Token other) {
		return span.getEndOffset() == other.span.getOffset();
	}

	@Override
	public String toString() {
		if (type == TokenType.NEWLINE) {
			return "NEWLINE[" + text.length() + "]@" + span;
		}
		return type + "(" + text + ")@" + span;
	}
}

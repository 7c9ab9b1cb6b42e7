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
import java.util.List;
import org.metricshub.datatwist.frontend.ast.Diagnostic;
import org.metricshub.datatwist.frontend.ast.DiagnosticKind;
import org.metricshub.datatwist.frontend.ast.ScanException;
import org.metricshub.datatwist.frontend.ast.SourceSpan;

/**
 * Hand-written lexer of DataTwist sources.
 * <p>
 * Tokens are produced lazily, on demand of the parser. The scanner strips
 * comments ({@code ;;} to the end of the line, and {@code (comment ...)}
 * blocks with balanced, arbitrarily nested parentheses), ignores carriage
 * returns, and reduces every line break to a single {@link TokenType#NEWLINE}
 * token carrying the indentation prefix of the next content line. Blank and
 * comment-only lines produce nothing.
 * <p>
 * String interpolations ({@code "Hello {name}"}) are tokenized by an embedded
 * scanner that stops at the {@code }} closing the interpolation.
 * <p>
 * Offsets are counted in UTF-8 bytes, columns in code points.
 */
public class Scanner implements TokenSource {

	private static final String BLOCK_COMMENT = "(comment";
	private static final String[] CONTINUATION_KEYWORDS = { "catch", "then", "else", "in" };

	/**
	 * Position in the scanned text.
	 */
	private static final class Mark {
		private final int index;
		private final int line;
		private final int column;
		private final int offset;

		private Mark(int index, int line, int column, int offset) {
			this.index = index;
			this.line = line;
			this.column = column;
			this.offset = offset;
		}
	}

	private final String source;
	private final String description;
	private final boolean embedded;

	private int pos;
	private int c;
	private int line = 1;
	private int column = 1;
	private int offset;

	private int braceDepth;
	private boolean atInputStart;
	private Mark start;
	private Mark failure;

	/**
	 * Creates a scanner of a whole source.
	 *
	 * @param source the text to scan
	 * @param description name of the source, used in diagnostics
	 */
	public Scanner(String source, String description) {
		this(source, description, false, 0, 1, 1, 0);
	}

	private Scanner(String source, String description, boolean embedded, int pos, int line, int column, int offset) {
		if (source == null) {
			throw new IllegalArgumentException("Source text is required");
		}
		this.source = source;
		this.description = description;
		this.embedded = embedded;
		this.atInputStart = !embedded;
		moveTo(new Mark(pos, line, column, offset));
	}

	/**
	 * Scans the whole specified text.
	 *
	 * @param source the text to scan
	 * @return all tokens, the last one being {@link TokenType#EOF}
	 * @throws ScanException on the first malformed token
	 */
	public static List<Token> tokenize(String source) {
		Scanner scanner = new Scanner(source, null);
		List<Token> tokens = new ArrayList<Token>();
		Token token;
		do {
			token = scanner.next();
			tokens.add(token);
		} while (token.getType() != TokenType.EOF);
		return tokens;
	}

	public String getDescription() {
		return description;
	}

	// CHARACTER LEVEL

	private void moveTo(Mark mark) {
		pos = mark.index;
		line = mark.line;
		column = mark.column;
		offset = mark.offset;
		c = pos < source.length() ? source.charAt(pos) : -1;
		skipCarriageReturns();
	}

	private void read() {
		if (c < 0) {
			return;
		}
		offset += utf8Length((char) c);
		if (c == '\n') {
			line++;
			column = 1;
		} else if (!Character.isLowSurrogate((char) c)) {
			column++;
		}
		pos++;
		c = pos < source.length() ? source.charAt(pos) : -1;
		skipCarriageReturns();
	}

	private void skipCarriageReturns() {
		// completely bypass \r's
		while (c == '\r') {
			pos++;
			offset++;
			c = pos < source.length() ? source.charAt(pos) : -1;
		}
	}

	private static int utf8Length(char ch) {
		if (ch < 0x80) {
			return 1;
		}
		if (ch < 0x800) {
			return 2;
		}
		if (Character.isHighSurrogate(ch)) {
			return 4;
		}
		if (Character.isLowSurrogate(ch)) {
			return 0;
		}
		return 3;
	}

	private int peekChar(int ahead) {
		int i = pos + ahead;
		return i < source.length() ? source.charAt(i) : -1;
	}

	private Mark mark() {
		return new Mark(pos, line, column, offset);
	}

	private SourceSpan spanFrom(Mark from) {
		return new SourceSpan(from.line, from.column, from.offset, offset - from.offset);
	}

	private static boolean isLetter(int ch) {
		return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
	}

	private static boolean isDigit(int ch) {
		return ch >= '0' && ch <= '9';
	}

	private static boolean isIdentifierPart(int ch) {
		return isLetter(ch) || isDigit(ch) || ch == '_' || ch == '-';
	}

	// TOKEN LEVEL

	/** {@inheritDoc} */
	@Override
	public Token next() {
		if (atInputStart) {
			atInputStart = false;
			String prefix = skipBlankLines();
			if (prefix == null) {
				return token(TokenType.EOF);
			}
			if (!prefix.isEmpty()) {
				throw scanException("Unexpected indentation at the start of the input", start);
			}
		}

		skipWhitespaceAndComments();
		start = mark();

		if (c < 0) {
			return token(TokenType.EOF);
		}
		if (c == '\n') {
			if (embedded) {
				throw scanException("Line break inside a string interpolation", start);
			}
			return lineBreak();
		}
		if (isLetter(c)) {
			return identifierOrKeyword();
		}
		if (isDigit(c)) {
			return number();
		}
		if (c == '"') {
			return string();
		}
		if (c == '_') {
			read();
			if (isIdentifierPart(c)) {
				throw scanException("Identifiers must start with a letter", start);
			}
			return token(TokenType.UNDERSCORE);
		}
		if (c == '-') {
			read();
			if (c == '>') {
				read();
				return token(TokenType.ARROW);
			}
			if (isLetter(c) || c == '-') {
				throw scanException("Identifiers must start with a letter", start);
			}
			return token(TokenType.MINUS);
		}
		if (c == '(') {
			read();
			return token(TokenType.LPAREN);
		}
		if (c == ')') {
			read();
			return token(TokenType.RPAREN);
		}
		if (c == '{') {
			read();
			if (embedded) {
				braceDepth++;
			}
			return token(TokenType.LBRACE);
		}
		if (c == '}') {
			if (embedded && braceDepth == 0) {
				// end of the interpolation, left for the enclosing string
				return token(TokenType.EOF);
			}
			read();
			if (embedded) {
				braceDepth--;
			}
			return token(TokenType.RBRACE);
		}
		if (c == '[') {
			read();
			return token(TokenType.LBRACKET);
		}
		if (c == ']') {
			read();
			return token(TokenType.RBRACKET);
		}
		if (c == ':') {
			read();
			return token(TokenType.COLON);
		}
		if (c == ',') {
			read();
			return token(TokenType.COMMA);
		}
		if (c == '.') {
			read();
			return token(TokenType.DOT);
		}
		if (c == '|') {
			read();
			return token(TokenType.PIPE);
		}
		if (c == '=') {
			read();
			return token(TokenType.EQUALS);
		}
		if (c == '!') {
			read();
			if (c == '=') {
				read();
				return token(TokenType.NOT_EQUALS);
			}
			throw scanException("Invalid character '!'", start);
		}
		if (c == '<') {
			read();
			if (c == '=') {
				read();
				return token(TokenType.LESS_EQUALS);
			}
			return token(TokenType.LESS);
		}
		if (c == '>') {
			read();
			if (c == '=') {
				read();
				return token(TokenType.GREATER_EQUALS);
			}
			return token(TokenType.GREATER);
		}
		if (c == '+') {
			read();
			return token(TokenType.PLUS);
		}
		if (c == '*') {
			read();
			return token(TokenType.STAR);
		}
		if (c == '/') {
			read();
			return token(TokenType.SLASH);
		}
		if (c == '%') {
			read();
			return token(TokenType.PERCENT);
		}

		String invalid = new String(Character.toChars(source.codePointAt(pos)));
		throw scanException("Invalid character '" + invalid + "'", start);
	}

	private Token token(TokenType type) {
		if (start == null) {
			start = mark();
		}
		return new Token(type, source.substring(start.index, pos), spanFrom(start), start.index);
	}

	private void skipWhitespaceAndComments() {
		while (true) {
			while (c == ' ' || c == '\t') {
				read();
			}
			if (c == ';') {
				if (peekChar(1) != ';') {
					throw scanException("Invalid character ';'", mark());
				}
				while (c >= 0 && c != '\n') {
					read();
				}
			} else if (isBlockCommentStart()) {
				Mark commentStart = mark();
				if (!skipBlockComment()) {
					throw scanException("Unterminated block comment", commentStart);
				}
			} else {
				return;
			}
		}
	}

	private boolean isBlockCommentStart() {
		if (c != '(' || !source.startsWith(BLOCK_COMMENT, pos)) {
			return false;
		}
		int after = peekChar(BLOCK_COMMENT.length());
		return after < 0 || after == ')' || Character.isWhitespace(after);
	}

	/**
	 * @return {@code false} if the input ends before the comment is closed
	 */
	private boolean skipBlockComment() {
		int depth = 0;
		do {
			if (c < 0) {
				return false;
			}
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
			}
			read();
		} while (depth > 0);
		return true;
	}

	/**
	 * Skips blank and comment-only lines. On return, {@link #start} is the
	 * beginning of the next content line.
	 *
	 * @return the indentation prefix of the next content line, {@code null} at end of input
	 */
	private String skipBlankLines() {
		while (true) {
			start = mark();
			while (c == ' ' || c == '\t') {
				read();
			}
			String prefix = source.substring(start.index, pos);
			skipWhitespaceAndComments();
			if (c == '\n') {
				read();
				continue;
			}
			if (c < 0) {
				return null;
			}
			return prefix;
		}
	}

	private Token lineBreak() {
		read();
		String prefix = skipBlankLines();
		if (prefix == null) {
			start = mark();
			return token(TokenType.EOF);
		}
		SourceSpan span = new SourceSpan(start.line, start.column, start.offset, prefix.length());
		return new Token(TokenType.NEWLINE, prefix, span, start.index);
	}

	private Token identifierOrKeyword() {
		while (isIdentifierPart(c)) {
			read();
		}
		if (c == '?' || (c == '!' && peekChar(1) != '=')) {
			read();
		}
		String word = source.substring(start.index, pos);
		TokenType keyword = TokenType.keyword(word);
		return token(keyword == null ? TokenType.IDENTIFIER : keyword);
	}

	private Token number() {
		while (isDigit(c)) {
			read();
		}
		if (c == '.' && isDigit(peekChar(1))) {
			read();
			while (isDigit(c)) {
				read();
			}
			if (c == '.' && isDigit(peekChar(1))) {
				while (c == '.' || isDigit(c)) {
					read();
				}
				throw scanException("Malformed number: " + source.substring(start.index, pos), start);
			}
		}
		if (isLetter(c) || c == '_') {
			while (isIdentifierPart(c)) {
				read();
			}
			throw scanException("Malformed number: " + source.substring(start.index, pos), start);
		}
		return token(TokenType.NUMBER);
	}

	private Token string() {
		Mark stringStart = start;
		read();
		List<Token.Segment> segments = new ArrayList<Token.Segment>();
		StringBuilder literal = new StringBuilder();
		Mark literalStart = mark();
		while (true) {
			if (c < 0 || c == '\n') {
				throw scanException("Unterminated string", stringStart);
			}
			if (c == '"') {
				if (literal.length() > 0) {
					segments.add(Token.Segment.literal(literal.toString(), spanFrom(literalStart)));
				}
				read();
				break;
			}
			if (c == '\\') {
				Mark escapeStart = mark();
				read();
				switch (c) {
				case '"':
				case '\\':
				case '{':
				case '}':
					literal.append((char) c);
					break;
				case 'n':
					literal.append('\n');
					break;
				case 't':
					literal.append('\t');
					break;
				case 'r':
					literal.append('\r');
					break;
				default:
					throw scanException("Invalid escape sequence in string", escapeStart);
				}
				read();
			} else if (c == '{') {
				if (literal.length() > 0) {
					segments.add(Token.Segment.literal(literal.toString(), spanFrom(literalStart)));
					literal.setLength(0);
				}
				segments.add(interpolation());
				literalStart = mark();
			} else {
				literal.append((char) c);
				read();
			}
		}
		start = stringStart;
		return new Token(TokenType.STRING, source.substring(start.index, pos), spanFrom(start), start.index, segments);
	}

	private Token.Segment interpolation() {
		Mark open = mark();
		read();
		Scanner inner = new Scanner(source, description, true, pos, line, column, offset);
		List<Token> tokens = new ArrayList<Token>();
		Token token;
		do {
			token = inner.next();
			tokens.add(token);
		} while (token.getType() != TokenType.EOF);
		if (inner.c != '}') {
			throw scanException("Unterminated string interpolation", open);
		}
		moveTo(inner.mark());
		read();
		return Token.Segment.embedded(tokens, spanFrom(open));
	}

	private ScanException scanException(String reason, Mark at) {
		failure = at;
		int length = Math.max(1, offset - at.offset);
		SourceSpan span = new SourceSpan(at.line, at.column, at.offset, length);
		return new ScanException(new Diagnostic(DiagnosticKind.SCAN, description, span, null, reason));
	}

	// RECOVERY

	/**
	 * Moves to the next line that can start a new statement: a content line at
	 * column 1 that does not start with a closer, a clause bar or one of the
	 * keywords that continue a construct ({@code catch}, {@code then},
	 * {@code else}, {@code in}).
	 * <p>
	 * When the specified token is a line break, the line it introduces is
	 * itself a candidate.
	 *
	 * @param from token where parsing failed
	 * @return {@code false} if the end of input was reached
	 */
	boolean resyncAfter(Token from) {
		SourceSpan span = from.getSpan();
		Mark mark = new Mark(from.getIndex(), span.getLine(), span.getColumn(), span.getOffset());
		return resyncFrom(mark, from.getType() == TokenType.NEWLINE);
	}

	/**
	 * Same as {@link #resyncAfter(Token)}, starting from where the last scan
	 * error was detected, or from the current position.
	 *
	 * @return {@code false} if the end of input was reached
	 */
	boolean resyncAfterFailure() {
		return resyncFrom(failure != null ? failure : mark(), false);
	}

	/**
	 * @return {@code true} if this scanner detected an error since the last resynchronization
	 */
	boolean hasFailure() {
		return failure != null;
	}

	private boolean resyncFrom(Mark from, boolean atLineStart) {
		moveTo(from);
		braceDepth = 0;
		failure = null;
		atInputStart = false;
		boolean candidate = atLineStart;
		while (true) {
			if (!candidate) {
				while (c >= 0 && c != '\n') {
					read();
				}
				if (c < 0) {
					return false;
				}
				read();
			}
			candidate = false;
			if (c < 0) {
				return false;
			}
			if (c == ' ' || c == '\t' || c == '\n' || c == ')' || c == ']' || c == '}' || c == '|' || c == ';') {
				continue;
			}
			if (startsWithContinuationKeyword()) {
				continue;
			}
			if (isBlockCommentStart()) {
				if (!skipBlockComment()) {
					return false;
				}
				continue;
			}
			start = mark();
			return true;
		}
	}

	private boolean startsWithContinuationKeyword() {
		for (String keyword : CONTINUATION_KEYWORDS) {
			if (source.startsWith(keyword, pos)) {
				int after = peekChar(keyword.length());
				if (!isIdentifierPart(after) && after != '?' && after != '!') {
					return true;
				}
			}
		}
		return false;
	}
}

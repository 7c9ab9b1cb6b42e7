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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Kinds of tokens produced by the {@link Scanner}.
 * <p>
 * Comments never produce tokens. Line breaks produce a single
 * {@link #NEWLINE} token whose text is the indentation prefix of the next
 * content line; blank lines and comment-only lines are skipped entirely.
 */
public enum TokenType {
	IDENTIFIER("identifier"),
	NUMBER("number"),
	STRING("string"),

	TRUE("'true'"),
	FALSE("'false'"),
	NIL("'nil'"),
	LET("'let'"),
	IN("'in'"),
	IF("'if'"),
	THEN("'then'"),
	ELSE("'else'"),
	MATCH("'match'"),
	WHEN("'when'"),
	OTHERWISE("'otherwise'"),
	TRY("'try'"),
	CATCH("'catch'"),
	AND("'and'"),
	OR("'or'"),

	LPAREN("'('"),
	RPAREN("')'"),
	LBRACE("'{'"),
	RBRACE("'}'"),
	LBRACKET("'['"),
	RBRACKET("']'"),
	COLON("':'"),
	COMMA("','"),
	DOT("'.'"),
	ARROW("'->'"),
	PIPE("'|'"),
	UNDERSCORE("'_'"),

	EQUALS("'='"),
	NOT_EQUALS("'!='"),
	LESS("'<'"),
	LESS_EQUALS("'<='"),
	GREATER("'>'"),
	GREATER_EQUALS("'>='"),
	PLUS("'+'"),
	MINUS("'-'"),
	STAR("'*'"),
	SLASH("'/'"),
	PERCENT("'%'"),

	NEWLINE("line break"),
	EOF("end of input");

	/**
	 * Reserved words and their token kinds.
	 */
	private static final Map<String, TokenType> KEYWORDS;

	static {
		Map<String, TokenType> keywords = new HashMap<String, TokenType>();
		keywords.put("true", TRUE);
		keywords.put("false", FALSE);
		keywords.put("nil", NIL);
		keywords.put("let", LET);
		keywords.put("in", IN);
		keywords.put("if", IF);
		keywords.put("then", THEN);
		keywords.put("else", ELSE);
		keywords.put("match", MATCH);
		keywords.put("when", WHEN);
		keywords.put("otherwise", OTHERWISE);
		keywords.put("try", TRY);
		keywords.put("catch", CATCH);
		keywords.put("and", AND);
		keywords.put("or", OR);
		KEYWORDS = Collections.unmodifiableMap(keywords);
	}

	private final String displayName;

	TokenType(String displayName) {
		this.displayName = displayName;
	}

	/**
	 * @return how this kind of token is named in error messages
	 */
	public String getDisplayName() {
		return displayName;
	}

	/**
	 * @param word an identifier-shaped word
	 * @return the keyword token kind, or {@code null} if the word is not reserved
	 */
	public static TokenType keyword(String word) {
		return KEYWORDS.get(word);
	}

	/**
	 * @param word an identifier-shaped word
	 * @return {@code true} if the word is reserved
	 */
	public static boolean isKeyword(String word) {
		return KEYWORDS.containsKey(word);
	}
}

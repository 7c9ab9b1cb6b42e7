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

import java.util.EnumMap;
import java.util.Map;

/**
 * Binary operators, with their precedence. All of them are left
 * associative; a higher precedence binds tighter.
 */
public enum Operator {
	OR(TokenType.OR, "or", 1),
	AND(TokenType.AND, "and", 2),
	EQUALS(TokenType.EQUALS, "=", 3),
	NOT_EQUALS(TokenType.NOT_EQUALS, "!=", 3),
	LESS(TokenType.LESS, "<", 3),
	LESS_EQUALS(TokenType.LESS_EQUALS, "<=", 3),
	GREATER(TokenType.GREATER, ">", 3),
	GREATER_EQUALS(TokenType.GREATER_EQUALS, ">=", 3),
	PLUS(TokenType.PLUS, "+", 4),
	MINUS(TokenType.MINUS, "-", 4),
	TIMES(TokenType.STAR, "*", 5),
	DIVIDE(TokenType.SLASH, "/", 5),
	MODULO(TokenType.PERCENT, "%", 5);

	/** Precedence of the loosest operator */
	public static final int LOWEST = 1;

	/** Precedence of the tightest operator */
	public static final int HIGHEST = 5;

	private static final Map<TokenType, Operator> BY_TOKEN = new EnumMap<TokenType, Operator>(TokenType.class);

	static {
		for (Operator operator : values()) {
			BY_TOKEN.put(operator.tokenType, operator);
		}
	}

	private final TokenType tokenType;
	private final String symbol;
	private final int precedence;

	Operator(TokenType tokenType, String symbol, int precedence) {
		this.tokenType = tokenType;
		this.symbol = symbol;
		this.precedence = precedence;
	}

	public TokenType getTokenType() {
		return tokenType;
	}

	/**
	 * @return the name of the synthetic identifier the operator desugars to
	 */
	public String getSymbol() {
		return symbol;
	}

	public int getPrecedence() {
		return precedence;
	}

	/**
	 * @param type a token kind
	 * @return the operator written with this token, or {@code null}
	 */
	public static Operator of(TokenType type) {
		return BY_TOKEN.get(type);
	}

	/**
	 * @param symbol name of an operator identifier, like {@code "+"} or {@code "and"}
	 * @return the operator, or {@code null}
	 */
	public static Operator bySymbol(String symbol) {
		for (Operator operator : values()) {
			if (operator.symbol.equals(symbol)) {
				return operator;
			}
		}
		return null;
	}
}

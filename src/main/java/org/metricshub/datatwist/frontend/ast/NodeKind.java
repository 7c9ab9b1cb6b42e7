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
 * Tag of every syntax tree variant.
 */
public enum NodeKind {
	PROGRAM,
	ASSIGNMENT,
	IDENTIFIER,
	WILDCARD_ACCESS,
	FIELD_ACCESS,
	NUMBER_LITERAL,
	STRING_LITERAL,
	BOOL_LITERAL,
	NIL_LITERAL,
	RECORD_LITERAL,
	LIST_LITERAL,
	FUNCTION_DEF,
	APPLICATION,
	PIPELINE,
	LET_BINDING,
	IF_EXPR,
	MATCH_EXPR,
	MATCH_CLAUSE,
	RECORD_PATTERN,
	CATCH_ALL_PATTERN,
	LITERAL_PATTERN,
	GUARD_PATTERN,
	TRY_CATCH,
	CATCH_CLAUSE,
	ERROR
}

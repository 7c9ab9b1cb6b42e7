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

/**
 * Starting points of the grammar. A whole program is parsed with
 * {@link #PROGRAM}; the other rules parse one isolated fragment, which must
 * make up the entire input.
 */
public enum GrammarRule {
	/** Statements separated by line breaks, producing a {@code Program} */
	PROGRAM,
	/** One assignment or expression */
	STATEMENT,
	/** One expression, pipelines included */
	EXPRESSION,
	/** An expression followed by at least one pipeline stage */
	PIPELINE,
	/** A {@code match} expression or a bare clause block */
	MATCH,
	/** A {@code try ... catch} expression */
	TRY_CATCH,
	/** A function literal, {@code [params -> body]} */
	FUNCTION,
	/** A record literal */
	RECORD,
	/** A list literal */
	LIST,
	/** The pattern of a match clause */
	PATTERN
}

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
 * An entry of the indentation stack: the exact whitespace prefix that opened
 * a block level, and the line where it first appeared.
 */
public final class IndentFrame {

	private final String prefix;
	private final int line;

	IndentFrame(String prefix, int line) {
		this.prefix = prefix;
		this.line = line;
	}

	/**
	 * @return the whitespace prefix, only spaces or only tabs
	 */
	public String getPrefix() {
		return prefix;
	}

	/**
	 * @return the line that opened this level, 0 for the outermost level
	 */
	public int getLine() {
		return line;
	}

	@Override
	public String toString() {
		return "IndentFrame[" + prefix.replace("\t", "\\t").replace(" ", "·") + "]@" + line;
	}
}

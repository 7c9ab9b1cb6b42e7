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
 * Location of a token or a node in the source text.
 * <p>
 * Lines and columns start at 1. The offset and the length are expressed in
 * UTF-8 bytes, so that tooling working on the raw input buffer can use them
 * directly.
 */
public final class SourceSpan {

	private final int line;
	private final int column;
	private final int offset;
	private final int length;

	/**
	 * @param line 1-based line number
	 * @param column 1-based column number
	 * @param offset 0-based UTF-8 byte offset
	 * @param length UTF-8 byte length
	 */
	public SourceSpan(int line, int column, int offset, int length) {
		this.line = line;
		this.column = column;
		this.offset = offset;
		this.length = length;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public int getOffset() {
		return offset;
	}

	public int getLength() {
		return length;
	}

	/**
	 * @return byte offset right after the last byte covered by this span
	 */
	public int getEndOffset() {
		return offset + length;
	}

	/**
	 * Creates the span that starts with this span and ends with the specified one.
	 *
	 * @param end last span covered
	 * @return a span covering both spans and everything in between
	 */
	public SourceSpan to(SourceSpan end) {
		if (end == null || end.getEndOffset() <= offset) {
			return this;
		}
		return new SourceSpan(line, column, offset, end.getEndOffset() - offset);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SourceSpan)) {
			return false;
		}
		SourceSpan other = (SourceSpan) o;
		return line == other.line && column == other.column && offset == other.offset && length == other.length;
	}

	@Override
	public int hashCode() {
		int result = line;
		result = 31 * result + column;
		result = 31 * result + offset;
		result = 31 * result + length;
		return result;
	}

	@Override
	public String toString() {
		return line + ":" + column;
	}
}

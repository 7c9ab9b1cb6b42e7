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
 * The catch-all pattern. {@code _} and {@code otherwise} are two spellings of
 * the same pattern; the spelling is kept so the source prints back as written.
 */
public final class CatchAllPattern extends Pattern {

	public enum Spelling {
		UNDERSCORE("_"),
		OTHERWISE("otherwise");

		private final String text;

		Spelling(String text) {
			this.text = text;
		}

		public String getText() {
			return text;
		}
	}

	private final Spelling spelling;

	public CatchAllPattern(Spelling spelling, SourceSpan span) {
		super(span);
		this.spelling = required(spelling, "Spelling");
	}

	public Spelling getSpelling() {
		return spelling;
	}

	@Override
	public boolean isCatchAll() {
		return true;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.CATCH_ALL_PATTERN;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitCatchAllPattern(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof CatchAllPattern && spelling == ((CatchAllPattern) o).spelling;
	}

	@Override
	public int hashCode() {
		return spelling.hashCode();
	}

	@Override
	public String toString() {
		return spelling.getText();
	}
}

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
 * Unchecked exception thrown when a DataTwist source cannot be parsed. It
 * carries the {@link Diagnostic} describing the failure.
 */
public class ParseException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient Diagnostic diagnostic;

	public ParseException(Diagnostic diagnostic) {
		super(diagnostic.format());
		this.diagnostic = diagnostic;
	}

	public Diagnostic getDiagnostic() {
		return diagnostic;
	}

	/**
	 * @return the line number of the offending token
	 */
	public int getLineNumber() {
		return diagnostic.getLine();
	}

	/**
	 * @return the column number of the offending token
	 */
	public int getColumn() {
		return diagnostic.getColumn();
	}
}

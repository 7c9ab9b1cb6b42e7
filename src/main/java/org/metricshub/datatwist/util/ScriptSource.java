package org.metricshub.datatwist.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

/**
 * One DataTwist source: a description, used in diagnostics, and a reader
 * serving the source text.
 */
public class ScriptSource {

	/** Description of sources given directly as a string */
	public static final String DESCRIPTION_INLINE_SCRIPT = "<inline-script>";

	private final String description;
	private final Reader reader;

	/**
	 * @param description name of the source, like a file path
	 * @param reader serves the source text
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "The caller's reader is read as is; no copy possible.")
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * @param text the source text
	 * @return a source with the {@link #DESCRIPTION_INLINE_SCRIPT} description
	 */
	public static ScriptSource of(String text) {
		return new ScriptSource(DESCRIPTION_INLINE_SCRIPT, new StringReader(text));
	}

	/**
	 * @param description name of the source
	 * @param input UTF-8 encoded source text
	 * @return a source reading the stream
	 */
	public static ScriptSource of(String description, InputStream input) {
		return new ScriptSource(description, new InputStreamReader(input, StandardCharsets.UTF_8));
	}

	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the source text.
	 *
	 * @return The reader which contains the source text.
	 * @throws IOException if the source cannot be opened
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The reader is handed out to be consumed.")
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole source text and closes the reader.
	 *
	 * @return the source text
	 * @throws IOException if the source cannot be read
	 */
	public String readFully() throws IOException {
		StringBuilder text = new StringBuilder();
		try (Reader r = getReader()) {
			char[] buffer = new char[8192];
			int count;
			while ((count = r.read(buffer)) >= 0) {
				text.append(buffer, 0, count);
			}
		}
		return text.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}

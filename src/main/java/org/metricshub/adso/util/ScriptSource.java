package org.metricshub.adso.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Adso
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Represents one Adso program source.
 * This is usually either a string handed over by a Java caller,
 * or a source file given as the positional argument of the command line.
 */
public class ScriptSource {

	/** Constant <code>DESCRIPTION_INLINE_SCRIPT="&lt;inline-script&gt;"</code> */
	public static final String DESCRIPTION_INLINE_SCRIPT = "<inline-script>";

	private final String description;
	private final Reader reader;

	/**
	 * Creates a source from an already opened reader.
	 *
	 * @param description name of the source, used in diagnostics
	 * @param reader reader serving the program text
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * Creates a source from program text held in memory.
	 *
	 * @param text the program text
	 * @return a source reading the specified text
	 */
	public static ScriptSource of(String text) {
		return new ScriptSource(DESCRIPTION_INLINE_SCRIPT, new StringReader(text));
	}

	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the program text.
	 *
	 * @return The reader which contains the program text.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole source into a character buffer, without the leading and
	 * trailing whitespace.
	 *
	 * @return the program text
	 * @throws IOException when the source cannot be read
	 */
	public String readText() throws IOException {
		StringBuilder text = new StringBuilder();
		char[] buffer = new char[4096];
		try (Reader in = getReader()) {
			int count;
			while ((count = in.read(buffer)) >= 0) {
				text.append(buffer, 0, count);
			}
		}
		return text.toString().trim();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}

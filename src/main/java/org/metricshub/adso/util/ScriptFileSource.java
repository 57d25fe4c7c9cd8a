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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Represents one Adso source file.
 */
public class ScriptFileSource extends ScriptSource {

	private final String filePath;

	/**
	 * <p>
	 * Constructor for ScriptFileSource.
	 * </p>
	 *
	 * @param filePath path of the source file, read as UTF-8
	 */
	public ScriptFileSource(String filePath) {
		super(filePath, null);
		this.filePath = filePath;
	}

	public String getFilePath() {
		return filePath;
	}

	/**
	 * Opens a new reader on the file each time it is called.
	 *
	 * @return a reader on the file contents
	 * @throws IOException if the file cannot be opened
	 */
	@Override
	public Reader getReader() throws IOException {
		return Files.newBufferedReader(Paths.get(filePath), StandardCharsets.UTF_8);
	}
}

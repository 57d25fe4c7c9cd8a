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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a single Adso invocation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Adso programmatically, from within Java code.
 */
public class AdsoSettings {

	/** Default maximum number of nested function activations. */
	public static final int DEFAULT_MAX_CALL_DEPTH = 1000;

	/** Default name of the function the program starts with. */
	public static final String DEFAULT_ENTRY_POINT = "main";

	/**
	 * Output stream used by the <code>print</code> built-in;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Maximum number of nested function activations before the
	 * evaluation is aborted.
	 */
	private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;

	/**
	 * Name of the zero-argument function invoked to start the program.
	 */
	private String entryPoint = DEFAULT_ENTRY_POINT;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("maxCallDepth = ").append(getMaxCallDepth()).append(newLine);
		desc.append("entryPoint = ").append(getEntryPoint()).append(newLine);

		return desc.toString();
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	public int getMaxCallDepth() {
		return maxCallDepth;
	}

	/**
	 * @param maxCallDepth maximum number of nested activations, at least 1
	 */
	public void setMaxCallDepth(int maxCallDepth) {
		if (maxCallDepth < 1) {
			throw new IllegalArgumentException("Maximum call depth must be positive: " + maxCallDepth);
		}
		this.maxCallDepth = maxCallDepth;
	}

	public String getEntryPoint() {
		return entryPoint;
	}

	public void setEntryPoint(String entryPoint) {
		this.entryPoint = entryPoint;
	}
}

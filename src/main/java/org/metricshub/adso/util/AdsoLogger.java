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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the SLF4J loggers of the lexer, parser and evaluator.
 * <p>
 * SLF4J reports its own binding (or the lack of one) on first use; a
 * program that only prints through <code>print</code> must not see that
 * noise on its console, so the internal verbosity is lowered to warnings
 * before any logger is created.
 */
public final class AdsoLogger {

	/** System property read by SLF4J for its own diagnostics */
	public static final String SLF4J_VERBOSITY_PROPERTY = "slf4j.internal.verbosity";

	static {
		if (System.getProperty(SLF4J_VERBOSITY_PROPERTY) == null) {
			System.setProperty(SLF4J_VERBOSITY_PROPERTY, "WARN");
		}
	}

	private AdsoLogger() {}

	/**
	 * @param clazz class of the interpreter component that logs
	 * @return the SLF4J logger of this component
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}
}

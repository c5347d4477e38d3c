package org.metricshub.justsh.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * JustSh
 * ჻჻჻჻჻჻
 * Copyright (C) 2024 - 2025 MetricsHub
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

import java.time.Clock;

/**
 * Settings used while compiling a justfile into a shell script.
 */
public interface CompileSettings {

	/**
	 * @param defaultFileName default file name to use
	 * @return the output file name
	 */
	String getOutputFilename(String defaultFileName);

	/**
	 * @return {@code true} to log parser and analysis details
	 */
	boolean isVerbose();

	/**
	 * @return {@code true} to dump the syntax tree instead of generating a script
	 */
	boolean isDumpSyntaxTree();

	/**
	 * Clock used to stamp the generation date into the script banner.
	 *
	 * @return the clock to read
	 */
	Clock getClock();

	/**
	 * @return the version written into the generated script
	 */
	String getToolVersion();
}

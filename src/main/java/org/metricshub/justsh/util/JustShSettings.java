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
 * A simple container for the parameters of a single justfile compilation.
 * <p>
 * The defaults write <code>just.sh</code>, stamp the banner with the current
 * date of the system clock and report the version of this build.
 */
public class JustShSettings implements CompileSettings {

	/** Output file name used when none is configured. */
	public static final String DEFAULT_OUTPUT_FILENAME = "just.sh";

	/**
	 * Where the generated script is written; {@code null} means the default.
	 */
	private String outputFilename = null;

	/**
	 * Whether to log parser and analysis details.
	 */
	private boolean verbose = false;

	/**
	 * Whether to print the parsed items instead of compiling.
	 */
	private boolean dumpSyntaxTree = false;

	private Clock clock = Clock.systemDefaultZone();

	private String toolVersion = JustShVersion.get();

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

		desc.append("outputFilename = ").append(getOutputFilename(DEFAULT_OUTPUT_FILENAME)).append(newLine);
		desc.append("verbose = ").append(isVerbose()).append(newLine);
		desc.append("dumpSyntaxTree = ").append(isDumpSyntaxTree()).append(newLine);
		desc.append("toolVersion = ").append(getToolVersion()).append(newLine);

		return desc.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String getOutputFilename(String defaultFileName) {
		return outputFilename == null ? defaultFileName : outputFilename;
	}

	/**
	 * @param outputFilename where the generated script is written,
	 *        <code>-</code> for the standard output
	 */
	public void setOutputFilename(String outputFilename) {
		this.outputFilename = outputFilename;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isVerbose() {
		return verbose;
	}

	/**
	 * @param verbose whether to log parser and analysis details
	 */
	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	/**
	 * @param dumpSyntaxTree whether to print the parsed items instead of compiling
	 */
	public void setDumpSyntaxTree(boolean dumpSyntaxTree) {
		this.dumpSyntaxTree = dumpSyntaxTree;
	}

	/** {@inheritDoc} */
	@Override
	public Clock getClock() {
		return clock;
	}

	/**
	 * @param clock clock used to date the generated script
	 */
	public void setClock(Clock clock) {
		this.clock = clock;
	}

	/** {@inheritDoc} */
	@Override
	public String getToolVersion() {
		return toolVersion;
	}

	/**
	 * @param toolVersion version written into the generated script
	 */
	public void setToolVersion(String toolVersion) {
		this.toolVersion = toolVersion;
	}
}

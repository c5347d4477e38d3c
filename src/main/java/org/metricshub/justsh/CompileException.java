package org.metricshub.justsh;

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

/**
 * Raised when a justfile cannot be compiled. No script is produced once
 * one of these has been thrown.
 */
public class CompileException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final int lineNumber;
	private final int column;

	/**
	 * <p>
	 * Constructor for CompileException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public CompileException(String msg) {
		this(msg, null, -1, -1);
	}

	/**
	 * <p>
	 * Constructor for CompileException.
	 * </p>
	 *
	 * @param msg description of the problem
	 * @param sourceDescription the justfile being compiled, may be {@code null}
	 * @param lineNumber 1-based line, or {@code -1} when unknown
	 * @param column 1-based column, or {@code -1} when unknown
	 */
	public CompileException(String msg, String sourceDescription, int lineNumber, int column) {
		super(msg);
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
		this.column = column;
	}

	/**
	 * @return the description of the offending source, or {@code null}
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the offending column or {@code -1}
	 */
	public int getColumn() {
		return column;
	}
}

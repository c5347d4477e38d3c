package org.metricshub.justsh.frontend.ast;

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

import org.metricshub.justsh.CompileException;

/**
 * A token of the justfile could not be read, for instance a string or a
 * backtick that is never closed.
 */
public class LexerException extends CompileException {

	private static final long serialVersionUID = 1L;

	/**
	 * <p>
	 * Constructor for LexerException.
	 * </p>
	 *
	 * @param msg description of the problem
	 * @param sourceDescription the justfile being read
	 * @param lineNumber 1-based line of the offending token
	 * @param column 1-based column of the offending token
	 */
	public LexerException(String msg, String sourceDescription, int lineNumber, int column) {
		super(msg, sourceDescription, lineNumber, column);
	}
}

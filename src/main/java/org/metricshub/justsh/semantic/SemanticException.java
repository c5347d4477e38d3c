package org.metricshub.justsh.semantic;

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
 * The justfile parses but cannot be compiled: duplicate or unsupported
 * settings, duplicate recipes, unknown built-in functions and the like.
 */
public class SemanticException extends CompileException {

	private static final long serialVersionUID = 1L;

	/**
	 * <p>
	 * Constructor for SemanticException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public SemanticException(String msg) {
		super(msg);
	}

	/**
	 * <p>
	 * Constructor for SemanticException.
	 * </p>
	 *
	 * @param lineNumber 1-based line of the offending item, or {@code -1}
	 * @param msg a {@link java.lang.String} object
	 */
	public SemanticException(int lineNumber, String msg) {
		super(msg, null, lineNumber, -1);
	}
}

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
 * Carries an exit code from the command line interface up to
 * {@link Cli#main(String[])}.
 */
public class ExitException extends Exception {

	private static final long serialVersionUID = 1L;

	/** Exit code for invalid command line arguments. */
	public static final int EXIT_CODE_USAGE = 2;

	private final int code;

	/**
	 * <p>
	 * Constructor for ExitException.
	 * </p>
	 *
	 * @param code the process exit code
	 * @param msg a {@link java.lang.String} object
	 */
	public ExitException(int code, String msg) {
		super(msg);
		this.code = code;
	}

	/**
	 * @return the process exit code
	 */
	public int getCode() {
		return code;
	}
}

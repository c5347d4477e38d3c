package org.metricshub.justsh.builtin;

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
 * A function of the justfile expression language, implemented by a POSIX
 * shell function that the generated script embeds verbatim.
 * <p>
 * Calls are rendered as <code>"$(name arg1 arg2)"</code>, so the shell
 * function must print its result on standard output and exit non-zero on
 * failure.
 */
public final class BuiltinFunction {

	private final String name;
	private final String snippet;
	private final int mandatoryParameterCount;
	private final boolean varArgs;

	BuiltinFunction(String name, String snippet, int mandatoryParameterCount, boolean varArgs) {
		this.name = name;
		this.snippet = snippet;
		this.mandatoryParameterCount = mandatoryParameterCount;
		this.varArgs = varArgs;
	}

	/**
	 * Returns the name the function is called by, in justfiles and in the
	 * generated script alike.
	 *
	 * @return the function name
	 */
	public String getName() {
		return name;
	}

	/**
	 * Returns the shell source defining the function (and the private helpers
	 * it needs), ending with a newline.
	 *
	 * @return shell source
	 */
	public String getSnippet() {
		return snippet;
	}

	/**
	 * Returns the minimum number of arguments required to call the function.
	 *
	 * @return required argument count before considering extra arguments
	 */
	public int getArity() {
		return mandatoryParameterCount;
	}

	/**
	 * Indicates whether the function accepts more than {@link #getArity()}
	 * arguments.
	 *
	 * @return {@code true} when extra arguments are accepted
	 */
	public boolean isVarArgs() {
		return varArgs;
	}

	/**
	 * Ensures that a call passes an acceptable number of arguments.
	 *
	 * @param argCount number of arguments of the call
	 * @throws IllegalArgumentException when the count is not accepted
	 */
	public void verifyArgCount(int argCount) {
		if (!varArgs) {
			if (argCount != mandatoryParameterCount) {
				throw new IllegalArgumentException(
						"Function '" + name + "' expects " + mandatoryParameterCount
								+ " argument(s), not " + argCount);
			}
			return;
		}
		if (argCount < mandatoryParameterCount) {
			throw new IllegalArgumentException(
					"Function '" + name + "' expects at least " + mandatoryParameterCount
							+ " argument(s), not " + argCount);
		}
	}

	@Override
	public String toString() {
		return name + "/" + mandatoryParameterCount + (varArgs ? "+" : "");
	}
}

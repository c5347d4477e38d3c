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

import org.metricshub.justsh.builtin.BuiltinFunction;
import org.metricshub.justsh.frontend.ast.Conditional;

/**
 * A shell function the generated script must define before its variables:
 * either a fixed snippet (a built-in or an internal helper) or the function
 * evaluating one conditional expression.
 */
public final class ShellFunction {

	private final String name;
	private final String snippet;
	private final Conditional conditional;

	private ShellFunction(String name, String snippet, Conditional conditional) {
		this.name = name;
		this.snippet = snippet;
		this.conditional = conditional;
	}

	/**
	 * @param function a built-in of the catalog
	 * @return the function defined by its snippet
	 */
	public static ShellFunction builtin(BuiltinFunction function) {
		return new ShellFunction(function.getName(), function.getSnippet(), null);
	}

	/**
	 * @param name name of the internal helper
	 * @param snippet its shell source
	 * @return the helper
	 */
	public static ShellFunction internal(String name, String snippet) {
		return new ShellFunction(name, snippet, null);
	}

	/**
	 * @param name name synthesized for the conditional
	 * @param conditional the expression the function evaluates
	 * @return the function, whose source is rendered by the code generator
	 */
	public static ShellFunction conditional(String name, Conditional conditional) {
		return new ShellFunction(name, null, conditional);
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the fixed shell source, or {@code null} for a conditional
	 */
	public String getSnippet() {
		return snippet;
	}

	/**
	 * @return the conditional to render, or {@code null} for a fixed snippet
	 */
	public Conditional getConditional() {
		return conditional;
	}

	public boolean isConditional() {
		return conditional != null;
	}

	@Override
	public String toString() {
		return name + "()";
	}
}

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

/**
 * The trailing parameter of a recipe that takes all remaining arguments.
 */
public final class Variadic extends AstNode {

	/**
	 * How many arguments the variadic parameter requires.
	 */
	public enum Kind {
		/** <code>*name</code>: zero or more. */
		STAR('*'),
		/** <code>+name</code>: one or more. */
		PLUS('+');

		private final char symbol;

		Kind(char symbol) {
			this.symbol = symbol;
		}

		public char getSymbol() {
			return symbol;
		}
	}

	private final Kind kind;
	private final Parameter parameter;

	public Variadic(Kind kind, Parameter parameter) {
		this.kind = kind;
		this.parameter = parameter;
	}

	public Kind getKind() {
		return kind;
	}

	public Parameter getParameter() {
		return parameter;
	}

	@Override
	public String toString() {
		return "Variadic(" + kind.getSymbol() + parameter + ")";
	}
}

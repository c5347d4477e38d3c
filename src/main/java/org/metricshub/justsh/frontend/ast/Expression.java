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
 * A value of the justfile expression language. The set of subclasses is
 * closed; callers dispatch on it with an {@link ExpressionVisitor}.
 * <p>
 * {@link #toString()} is a canonical structural rendering: two expressions
 * print the same iff they have the same shape and content.
 */
public abstract class Expression extends AstNode {

	Expression() {}

	/**
	 * Dispatches to the visitor method matching this expression.
	 *
	 * @param visitor visitor to call
	 * @param <T> result type of the visitor
	 * @return what the visitor returned
	 */
	public abstract <T> T accept(ExpressionVisitor<T> visitor);

	/**
	 * @return the value of this expression when it is a string literal,
	 *         {@code null} when it is only known at run time
	 */
	public String literalValue() {
		return null;
	}

	static String canonicalString(String value) {
		StringBuilder sb = new StringBuilder(value.length() + 2);
		sb.append('"');
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c == '"' || c == '\\') {
				sb.append('\\');
			}
			sb.append(c);
		}
		return sb.append('"').toString();
	}
}

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
 * Part of a recipe line: either literal text or an
 * <code>{{ expression }}</code> interpolation.
 */
public final class Fragment {

	private final String text;
	private final Expression expression;

	private Fragment(String text, Expression expression) {
		this.text = text;
		this.expression = expression;
	}

	/**
	 * @param text literal text, with <code>{{{{</code> already decoded
	 * @return a text fragment
	 */
	public static Fragment text(String text) {
		return new Fragment(text, null);
	}

	/**
	 * @param expression the interpolated expression
	 * @return an interpolation fragment
	 */
	public static Fragment interpolation(Expression expression) {
		return new Fragment(null, expression);
	}

	public boolean isInterpolation() {
		return expression != null;
	}

	/**
	 * @return the literal text, or {@code null} for an interpolation
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the interpolated expression, or {@code null} for literal text
	 */
	public Expression getExpression() {
		return expression;
	}

	@Override
	public String toString() {
		return isInterpolation() ? "Interpolation(" + expression + ")" : Expression.canonicalString(text);
	}
}

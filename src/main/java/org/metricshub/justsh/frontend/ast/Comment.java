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
 * A top-level comment. The one right above a recipe documents it.
 */
public final class Comment extends Declaration {

	private final String text;

	/**
	 * @param text comment text, without the <code>#</code> and the spaces after it
	 */
	public Comment(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T> T accept(DeclarationVisitor<T> visitor) {
		return visitor.visitComment(this);
	}

	@Override
	public String toString() {
		return "Comment(" + Expression.canonicalString(text) + ")";
	}
}

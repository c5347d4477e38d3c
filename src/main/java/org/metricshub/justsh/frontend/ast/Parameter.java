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
 * A recipe parameter, optionally exported to the environment of the body
 * (<code>$name</code>) and optionally defaulted (<code>name=value</code>).
 */
public final class Parameter extends AstNode {

	private final boolean exported;
	private final String name;
	private final Expression defaultValue;

	public Parameter(boolean exported, String name, Expression defaultValue) {
		this.exported = exported;
		this.name = name;
		this.defaultValue = defaultValue;
	}

	public boolean isExported() {
		return exported;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the default value, or {@code null} when the parameter is required
	 */
	public Expression getDefaultValue() {
		return defaultValue;
	}

	public boolean hasDefault() {
		return defaultValue != null;
	}

	@Override
	public String toString() {
		return "Parameter(" + (exported ? "$" : "") + name + (defaultValue == null ? "" : "=" + defaultValue) + ")";
	}
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.justsh.frontend.ast.Parameter;
import org.metricshub.justsh.frontend.ast.Recipe;
import org.metricshub.justsh.frontend.ast.Variadic;

/**
 * The parameters of a recipe as the command line sees them: what the
 * listing prints, and how many arguments the main loop hands to the recipe.
 */
public final class Signature {

	private final List<Parameter> parameters;
	private final Variadic variadic;

	public Signature(List<Parameter> parameters, Variadic variadic) {
		this.parameters = Collections.unmodifiableList(new ArrayList<Parameter>(parameters));
		this.variadic = variadic;
	}

	/**
	 * @param recipe a recipe
	 * @return its signature
	 */
	public static Signature of(Recipe recipe) {
		return new Signature(recipe.getParameters(), recipe.getVariadic());
	}

	public List<Parameter> getParameters() {
		return parameters;
	}

	/**
	 * @return the variadic parameter, or {@code null}
	 */
	public Variadic getVariadic() {
		return variadic;
	}

	public boolean isEmpty() {
		return parameters.isEmpty() && variadic == null;
	}

	/**
	 * @return the number of parameters, the variadic one included
	 */
	public int size() {
		return parameters.size() + (variadic == null ? 0 : 1);
	}

	/**
	 * @return the fewest arguments the recipe can be called with
	 */
	public int getRequiredCount() {
		int count = 0;
		for (Parameter parameter : parameters) {
			if (!parameter.hasDefault()) {
				count++;
			}
		}
		if (variadic != null && variadic.getKind() == Variadic.Kind.PLUS && !variadic.getParameter().hasDefault()) {
			count++;
		}
		return count;
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof Signature && toString().equals(other.toString());
	}

	@Override
	public int hashCode() {
		return toString().hashCode();
	}

	@Override
	public String toString() {
		return "Signature(" + parameters + (variadic == null ? "" : ", " + variadic) + ")";
	}
}

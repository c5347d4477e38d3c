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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named task: parameters, dependencies and a body of shell lines.
 */
public final class Recipe extends Declaration {

	/** First-line marker of a body run as a script by its own interpreter. */
	public static final String SHEBANG = "#!";

	private final boolean echo;
	private final String name;
	private final List<Parameter> parameters;
	private final Variadic variadic;
	private final List<Dependency> beforeDependencies;
	private final List<Dependency> afterDependencies;
	private final List<RecipeLine> body;

	/**
	 * <p>
	 * Constructor for Recipe.
	 * </p>
	 *
	 * @param echo {@code false} when the recipe name is prefixed with <code>@</code>
	 * @param name recipe name
	 * @param parameters fixed parameters, in order
	 * @param variadic trailing variadic parameter, or {@code null}
	 * @param beforeDependencies recipes run before the body
	 * @param afterDependencies recipes run after the body
	 * @param body lines of the body
	 */
	public Recipe(
			boolean echo,
			String name,
			List<Parameter> parameters,
			Variadic variadic,
			List<Dependency> beforeDependencies,
			List<Dependency> afterDependencies,
			List<RecipeLine> body) {
		this.echo = echo;
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<Parameter>(parameters));
		this.variadic = variadic;
		this.beforeDependencies = Collections.unmodifiableList(new ArrayList<Dependency>(beforeDependencies));
		this.afterDependencies = Collections.unmodifiableList(new ArrayList<Dependency>(afterDependencies));
		this.body = Collections.unmodifiableList(new ArrayList<RecipeLine>(body));
	}

	public boolean isEcho() {
		return echo;
	}

	public String getName() {
		return name;
	}

	public List<Parameter> getParameters() {
		return parameters;
	}

	/**
	 * @return the trailing variadic parameter, or {@code null}
	 */
	public Variadic getVariadic() {
		return variadic;
	}

	public List<Dependency> getBeforeDependencies() {
		return beforeDependencies;
	}

	public List<Dependency> getAfterDependencies() {
		return afterDependencies;
	}

	public List<RecipeLine> getBody() {
		return body;
	}

	/**
	 * @return the number of fixed parameters before the first defaulted one
	 */
	public int getRequiredParameterCount() {
		for (int i = 0; i < parameters.size(); i++) {
			if (parameters.get(i).hasDefault()) {
				return i;
			}
		}
		return parameters.size();
	}

	/**
	 * @return the number of fixed parameters from the first defaulted one on
	 */
	public int getDefaultedParameterCount() {
		return parameters.size() - getRequiredParameterCount();
	}

	/**
	 * @return the fewest arguments an invocation must supply
	 */
	public int getMinimumArgumentCount() {
		int min = getRequiredParameterCount();
		if (variadic != null && variadic.getKind() == Variadic.Kind.PLUS && !variadic.getParameter().hasDefault()) {
			min++;
		}
		return min;
	}

	/**
	 * @return {@code true} when the body is written to a file and run by the
	 *         interpreter named on its first line
	 */
	public boolean isShebang() {
		return !body.isEmpty() && body.get(0).startsWithText(SHEBANG);
	}

	@Override
	public <T> T accept(DeclarationVisitor<T> visitor) {
		return visitor.visitRecipe(this);
	}

	@Override
	protected String describe() {
		return "Recipe(" + (echo ? "" : "@") + name + ")";
	}

	@Override
	protected List<? extends AstNode> children() {
		List<AstNode> children = new ArrayList<AstNode>(parameters);
		if (variadic != null) {
			children.add(variadic);
		}
		children.addAll(beforeDependencies);
		children.addAll(afterDependencies);
		children.addAll(body);
		return children;
	}

	@Override
	public String toString() {
		return "Recipe(" + (echo ? "" : "@") + name + ", " + parameters + ", " + variadic + ", "
				+ beforeDependencies + ", " + afterDependencies + ", " + body + ")";
	}
}

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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.justsh.frontend.ast.Expression;
import org.metricshub.justsh.frontend.ast.Item;

/**
 * Everything the code generator needs to know about a justfile besides its
 * items. Built once by {@link SemanticAnalyzer}; never modified afterwards.
 */
public final class JustfileAnalysis {

	private final List<Item> items;
	private final Settings settings;
	private final Map<String, Expression> variables;
	private final List<String> exports;
	private final Map<String, ShellFunction> functions;
	private final Set<String> privateNames;
	private final List<String> recipes;
	private final Map<String, Map<Platform, String>> platformVariants;
	private final Map<String, String> docstrings;
	private final Map<String, Signature> signatures;
	private final Map<String, List<String>> aliases;
	private final List<String> uniqueRecipes;
	private final List<String> uniqueTargets;
	private final List<String> sortedUniqueTargets;

	JustfileAnalysis(Builder builder) {
		this.items = Collections.unmodifiableList(new ArrayList<Item>(builder.items));
		this.settings = builder.settings;
		this.variables = Collections.unmodifiableMap(new LinkedHashMap<String, Expression>(builder.variables));
		this.exports = Collections.unmodifiableList(new ArrayList<String>(builder.exports));
		this.functions = Collections.unmodifiableMap(new LinkedHashMap<String, ShellFunction>(builder.functions));
		this.privateNames = Collections.unmodifiableSet(new LinkedHashSet<String>(builder.privateNames));
		this.recipes = Collections.unmodifiableList(new ArrayList<String>(builder.recipes));
		Map<String, Map<Platform, String>> variants = new LinkedHashMap<String, Map<Platform, String>>();
		for (Map.Entry<String, Map<Platform, String>> entry : builder.platformVariants.entrySet()) {
			variants.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<Platform, String>(entry.getValue())));
		}
		this.platformVariants = Collections.unmodifiableMap(variants);
		this.docstrings = Collections.unmodifiableMap(new LinkedHashMap<String, String>(builder.docstrings));
		this.signatures = Collections.unmodifiableMap(new LinkedHashMap<String, Signature>(builder.signatures));
		Map<String, List<String>> aliasLists = new LinkedHashMap<String, List<String>>();
		for (Map.Entry<String, List<String>> entry : builder.aliases.entrySet()) {
			aliasLists.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<String>(entry.getValue())));
		}
		this.aliases = Collections.unmodifiableMap(aliasLists);
		this.uniqueRecipes = Collections.unmodifiableList(new ArrayList<String>(builder.uniqueRecipes));
		this.uniqueTargets = Collections.unmodifiableList(new ArrayList<String>(builder.uniqueTargets));
		this.sortedUniqueTargets = Collections.unmodifiableList(new ArrayList<String>(builder.sortedUniqueTargets));
	}

	/**
	 * @return the analyzed items, in source order
	 */
	public List<Item> getItems() {
		return items;
	}

	public Settings getSettings() {
		return settings;
	}

	/**
	 * @return variable name to value, in order of first declaration; a
	 *         variable declared twice has its last value
	 */
	public Map<String, Expression> getVariables() {
		return variables;
	}

	/**
	 * @return names of the variables declared with <code>export</code>
	 */
	public List<String> getExports() {
		return exports;
	}

	/**
	 * @return the shell functions the script defines before anything else,
	 *         keyed by name, in the order they were first needed
	 */
	public Map<String, ShellFunction> getFunctions() {
		return functions;
	}

	/**
	 * @return names of the private recipes and aliases
	 */
	public Set<String> getPrivateNames() {
		return privateNames;
	}

	public boolean isPrivate(String name) {
		return privateNames.contains(name);
	}

	/**
	 * @return recipe names in source order, repeated for each variant
	 */
	public List<String> getRecipes() {
		return recipes;
	}

	/**
	 * @return for each recipe with platform variants, the variant name to
	 *         call on each platform
	 */
	public Map<String, Map<Platform, String>> getPlatformVariants() {
		return platformVariants;
	}

	/**
	 * @return description of each recipe and alias that has one
	 */
	public Map<String, String> getDocstrings() {
		return docstrings;
	}

	/**
	 * @return the parameters of each recipe and alias
	 */
	public Map<String, Signature> getSignatures() {
		return signatures;
	}

	/**
	 * @param name a recipe or alias name
	 * @return its signature, never {@code null}
	 */
	public Signature getSignature(String name) {
		Signature signature = signatures.get(name);
		return signature == null ? new Signature(Collections.emptyList(), null) : signature;
	}

	/**
	 * @return the aliases of each recipe, in source order
	 */
	public Map<String, List<String>> getAliases() {
		return aliases;
	}

	/**
	 * @return public recipe names, once each, in source order
	 */
	public List<String> getUniqueRecipes() {
		return uniqueRecipes;
	}

	/**
	 * @return every invocable name once, each recipe followed by its aliases
	 */
	public List<String> getUniqueTargets() {
		return uniqueTargets;
	}

	/**
	 * @return public invocable names once each, sorted by recipe, each recipe
	 *         followed by its aliases
	 */
	public List<String> getSortedUniqueTargets() {
		return sortedUniqueTargets;
	}

	@Override
	public String toString() {
		return "JustfileAnalysis(settings " + settings + ", variables " + variables.keySet() + ", functions "
				+ functions.keySet() + ", targets " + uniqueTargets + ")";
	}

	/**
	 * Collects the results of the analysis passes.
	 */
	static final class Builder {
		List<Item> items;
		Settings settings;
		Map<String, Expression> variables;
		List<String> exports;
		Map<String, ShellFunction> functions;
		Set<String> privateNames;
		List<String> recipes;
		Map<String, Map<Platform, String>> platformVariants;
		Map<String, String> docstrings;
		Map<String, Signature> signatures;
		Map<String, List<String>> aliases;
		List<String> uniqueRecipes;
		List<String> uniqueTargets;
		List<String> sortedUniqueTargets;

		JustfileAnalysis build() {
			return new JustfileAnalysis(this);
		}
	}
}

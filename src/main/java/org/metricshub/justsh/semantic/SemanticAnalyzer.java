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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.justsh.backend.ExpressionEvaluator;
import org.metricshub.justsh.builtin.BuiltinCatalog;
import org.metricshub.justsh.builtin.BuiltinFunction;
import org.metricshub.justsh.frontend.ast.Alias;
import org.metricshub.justsh.frontend.ast.Assignment;
import org.metricshub.justsh.frontend.ast.Backtick;
import org.metricshub.justsh.frontend.ast.Comment;
import org.metricshub.justsh.frontend.ast.Conditional;
import org.metricshub.justsh.frontend.ast.DeclarationVisitor;
import org.metricshub.justsh.frontend.ast.Dependency;
import org.metricshub.justsh.frontend.ast.Div;
import org.metricshub.justsh.frontend.ast.Export;
import org.metricshub.justsh.frontend.ast.Expression;
import org.metricshub.justsh.frontend.ast.ExpressionVisitor;
import org.metricshub.justsh.frontend.ast.Fragment;
import org.metricshub.justsh.frontend.ast.FunctionCall;
import org.metricshub.justsh.frontend.ast.Item;
import org.metricshub.justsh.frontend.ast.Parameter;
import org.metricshub.justsh.frontend.ast.Recipe;
import org.metricshub.justsh.frontend.ast.RecipeLine;
import org.metricshub.justsh.frontend.ast.Setting;
import org.metricshub.justsh.frontend.ast.StringLiteral;
import org.metricshub.justsh.frontend.ast.Sum;
import org.metricshub.justsh.frontend.ast.Variable;
import org.metricshub.justsh.frontend.ast.Variadic;
import org.metricshub.justsh.util.JustShLogger;
import org.slf4j.Logger;

/**
 * Checks a parsed justfile and computes what the code generator needs.
 * <p>
 * The analysis is a fixed sequence of passes. Each pass is a method that
 * reads the items, and possibly the results of earlier passes, and returns
 * a new value; none of them modifies its arguments. {@link #analyze(List)}
 * runs them in order:
 * <ol>
 * <li>{@link #checkRecipeShapes(List)}
 * <li>{@link #collectSettings(List)}
 * <li>{@link #collectVariables(List)} and {@link #collectExports(List)}
 * <li>{@link #collectFunctions(List)}
 * <li>{@link #collectPrivateNames(List)}
 * <li>{@link #collectRecipes(List, Settings)}
 * <li>{@link #collectPlatformVariants(List)}
 * <li>{@link #collectDocstrings(List)}
 * <li>{@link #collectSignatures(List)}
 * <li>{@link #collectAliases(List)} and {@link #inheritSignatures(List, Map)}
 * <li>{@link #uniqueRecipes(List, Set)}, {@link #uniqueTargets(List, Map)}
 * and {@link #sortedUniqueTargets(List, Map, Set)}
 * </ol>
 */
public class SemanticAnalyzer {

	private static final Logger LOG = JustShLogger.getLogger(SemanticAnalyzer.class);

	private static final Set<String> BOOLEAN_SETTINGS = new HashSet<String>(
			Arrays
					.asList(
							Settings.ALLOW_DUPLICATE_RECIPES,
							Settings.DOTENV_LOAD,
							Settings.EXPORT,
							Settings.FALLBACK,
							Settings.IGNORE_COMMENTS,
							Settings.POSITIONAL_ARGUMENTS));

	private final ExpressionEvaluator evaluator;

	/**
	 * <p>
	 * Constructor for SemanticAnalyzer.
	 * </p>
	 *
	 * @param evaluator evaluator of the compilation in progress, which names
	 *        the functions synthesized for conditionals
	 */
	public SemanticAnalyzer(ExpressionEvaluator evaluator) {
		this.evaluator = evaluator;
	}

	/**
	 * Runs every pass.
	 *
	 * @param items parsed justfile
	 * @return the result of the analysis
	 * @throws SemanticException when the justfile cannot be compiled
	 */
	public JustfileAnalysis analyze(List<Item> items) {
		checkRecipeShapes(items);
		JustfileAnalysis.Builder builder = new JustfileAnalysis.Builder();
		builder.items = items;
		builder.settings = collectSettings(items);
		builder.variables = collectVariables(items);
		builder.exports = collectExports(items);
		builder.functions = collectFunctions(items);
		builder.privateNames = collectPrivateNames(items);
		builder.recipes = collectRecipes(items, builder.settings);
		builder.platformVariants = collectPlatformVariants(items);
		builder.docstrings = collectDocstrings(items);
		builder.aliases = collectAliases(items);
		builder.signatures = inheritSignatures(items, collectSignatures(items));
		builder.uniqueRecipes = uniqueRecipes(builder.recipes, builder.privateNames);
		builder.uniqueTargets = uniqueTargets(builder.recipes, builder.aliases);
		builder.sortedUniqueTargets = sortedUniqueTargets(builder.recipes, builder.aliases, builder.privateNames);
		JustfileAnalysis analysis = builder.build();
		LOG.debug("Analysis: {}", analysis);
		return analysis;
	}

	/**
	 * A variadic parameter that follows defaulted parameters must have a
	 * default too.
	 *
	 * @param items parsed justfile
	 * @throws SemanticException for the first recipe breaking the rule
	 */
	public void checkRecipeShapes(List<Item> items) {
		for (Item item : items) {
			Recipe recipe = item.asRecipe();
			if (recipe == null) {
				continue;
			}
			Variadic variadic = recipe.getVariadic();
			if (variadic != null && !variadic.getParameter().hasDefault() && recipe.getDefaultedParameterCount() > 0) {
				throw new SemanticException(
						item.getLineNumber(),
						"Variadic following parameters with default values must have default values in \""
								+ recipe.getName() + "\"");
			}
		}
	}

	/**
	 * @param items parsed justfile
	 * @return the settings, validated
	 * @throws SemanticException for a setting given twice, unknown,
	 *         unsupported or with a value of the wrong shape
	 */
	public Settings collectSettings(List<Item> items) {
		Map<String, Setting> values = new LinkedHashMap<String, Setting>();
		for (Item item : items) {
			Setting setting = item.asSetting();
			if (setting == null) {
				continue;
			}
			String name = setting.getName();
			if (values.containsKey(name)) {
				throw new SemanticException(item.getLineNumber(), "Setting " + name + " has already been set");
			}
			checkSetting(item.getLineNumber(), setting);
			values.put(name, setting);
		}
		return new Settings(values);
	}

	private static void checkSetting(int lineNumber, Setting setting) {
		String name = setting.getName();
		if (Settings.WINDOWS_SHELL.equals(name) || Settings.WINDOWS_POWERSHELL.equals(name)) {
			throw new SemanticException(lineNumber, "Setting " + name + " is not supported: Windows shells cannot be targeted");
		}
		if (BOOLEAN_SETTINGS.contains(name)) {
			if (setting.getKind() != Setting.Kind.BOOLEAN) {
				throw new SemanticException(lineNumber, "Setting " + name + " expects true or false");
			}
		} else if (Settings.TEMPDIR.equals(name)) {
			if (setting.getKind() != Setting.Kind.STRING) {
				throw new SemanticException(lineNumber, "Setting " + name + " expects a string");
			}
		} else if (Settings.SHELL.equals(name)) {
			if (setting.getKind() != Setting.Kind.LIST) {
				throw new SemanticException(lineNumber, "Setting " + name + " expects a list of strings");
			}
			if (setting.getListValue().size() < 2) {
				throw new SemanticException(lineNumber, "`shell` setting must have at least two elements.");
			}
		} else {
			throw new SemanticException(lineNumber, "Unknown setting " + name);
		}
	}

	/**
	 * @param items parsed justfile
	 * @return every variable, exported or not; a variable assigned twice
	 *         keeps its first position and its last value
	 */
	public Map<String, Expression> collectVariables(List<Item> items) {
		final Map<String, Expression> variables = new LinkedHashMap<String, Expression>();
		DeclarationVisitor<Void> collector = new DeclarationVisitor.Default<Void>() {
			@Override
			public Void visitAssignment(Assignment assignment) {
				variables.put(assignment.getName(), assignment.getValue());
				return null;
			}

			@Override
			public Void visitExport(Export export) {
				return visitAssignment(export.getAssignment());
			}
		};
		for (Item item : items) {
			item.getDeclaration().accept(collector);
		}
		return variables;
	}

	/**
	 * @param items parsed justfile
	 * @return names of the exported variables, once each
	 */
	public List<String> collectExports(List<Item> items) {
		final Set<String> exports = new LinkedHashSet<String>();
		DeclarationVisitor<Void> collector = new DeclarationVisitor.Default<Void>() {
			@Override
			public Void visitExport(Export export) {
				exports.add(export.getAssignment().getName());
				return null;
			}
		};
		for (Item item : items) {
			item.getDeclaration().accept(collector);
		}
		return new ArrayList<String>(exports);
	}

	/**
	 * Finds the shell functions the script needs: the built-ins called
	 * anywhere, one function per distinct conditional, the platform
	 * detection built-ins and the internal helpers.
	 *
	 * @param items parsed justfile
	 * @return the functions, keyed by shell name, in the order they are needed
	 * @throws SemanticException for an unknown built-in or a call with the
	 *         wrong number of arguments
	 */
	public Map<String, ShellFunction> collectFunctions(List<Item> items) {
		Map<String, ShellFunction> functions = new LinkedHashMap<String, ShellFunction>();
		for (Item item : items) {
			Set<Platform> platforms = Platform.of(item.getAttributes());
			if (platforms.contains(Platform.LINUX) || platforms.contains(Platform.MACOS) || platforms.contains(Platform.WINDOWS)) {
				addBuiltin(functions, BuiltinCatalog.OS);
			} else if (platforms.contains(Platform.UNIX)) {
				addBuiltin(functions, BuiltinCatalog.OS_FAMILY);
			}
		}
		for (Item item : items) {
			item.getDeclaration().accept(new FunctionCollector(functions, item.getLineNumber()));
		}
		return functions;
	}

	private static void addBuiltin(Map<String, ShellFunction> functions, String name) {
		if (!functions.containsKey(name)) {
			functions.put(name, ShellFunction.builtin(BuiltinCatalog.get(name)));
		}
	}

	/**
	 * @param items parsed justfile
	 * @return names of recipes and aliases marked <code>[private]</code> or
	 *         starting with an underscore
	 */
	public Set<String> collectPrivateNames(List<Item> items) {
		Set<String> names = new LinkedHashSet<String>();
		for (Item item : items) {
			String name = recipeOrAliasName(item);
			if (name != null && (item.hasAttribute(Item.ATTRIBUTE_PRIVATE) || name.startsWith("_"))) {
				names.add(name);
			}
		}
		return names;
	}

	private static String recipeOrAliasName(Item item) {
		Recipe recipe = item.asRecipe();
		if (recipe != null) {
			return recipe.getName();
		}
		Alias alias = item.asAlias();
		return alias == null ? null : alias.getName();
	}

	/**
	 * @param items parsed justfile
	 * @param settings result of {@link #collectSettings(List)}
	 * @return recipe names in source order
	 * @throws SemanticException for a recipe declared twice without a
	 *         platform attribute, unless duplicates are allowed
	 */
	public List<String> collectRecipes(List<Item> items, Settings settings) {
		List<String> recipes = new ArrayList<String>();
		for (Item item : items) {
			Recipe recipe = item.asRecipe();
			if (recipe == null) {
				continue;
			}
			if (recipes.contains(recipe.getName())
					&& !settings.isAllowDuplicateRecipes()
					&& Platform.of(item.getAttributes()).isEmpty()) {
				throw new SemanticException(
						item.getLineNumber(),
						"Recipe `" + recipe.getName() + "` is declared more than once");
			}
			recipes.add(recipe.getName());
		}
		return recipes;
	}

	/**
	 * @param items parsed justfile
	 * @return for each recipe with platform attributes, the variant to run
	 *         on each platform
	 */
	public Map<String, Map<Platform, String>> collectPlatformVariants(List<Item> items) {
		Map<String, Map<Platform, String>> variants = new LinkedHashMap<String, Map<Platform, String>>();
		for (Item item : items) {
			Recipe recipe = item.asRecipe();
			if (recipe == null) {
				continue;
			}
			Set<Platform> platforms = Platform.of(item.getAttributes());
			if (platforms.isEmpty()) {
				continue;
			}
			Map<Platform, String> table = variants.get(recipe.getName());
			if (table == null) {
				table = new LinkedHashMap<Platform, String>();
				variants.put(recipe.getName(), table);
			}
			String variant = Platform.variantName(recipe.getName(), platforms);
			for (Platform platform : platforms) {
				table.put(platform, variant);
			}
		}
		return variants;
	}

	/**
	 * A public recipe is documented by the comment right above it. An alias
	 * is documented as such.
	 *
	 * @param items parsed justfile
	 * @return description of each documented recipe and alias
	 */
	public Map<String, String> collectDocstrings(List<Item> items) {
		Map<String, String> docstrings = new LinkedHashMap<String, String>();
		for (int i = 0; i < items.size(); i++) {
			Item item = items.get(i);
			Recipe recipe = item.asRecipe();
			if (recipe != null) {
				if (item.hasAttribute(Item.ATTRIBUTE_PRIVATE) || recipe.getName().startsWith("_") || i == 0) {
					continue;
				}
				Comment previous = items.get(i - 1).asComment();
				if (previous != null) {
					docstrings.put(recipe.getName(), previous.getText());
				}
				continue;
			}
			Alias alias = item.asAlias();
			if (alias != null) {
				docstrings.put(alias.getName(), "alias for `" + alias.getTarget() + "`");
			}
		}
		return docstrings;
	}

	/**
	 * The last declaration of a recipe gives its signature. A different
	 * signature on an earlier declaration is reported as a warning.
	 *
	 * @param items parsed justfile
	 * @return the signature of each recipe
	 */
	public Map<String, Signature> collectSignatures(List<Item> items) {
		Map<String, Signature> signatures = new LinkedHashMap<String, Signature>();
		for (Item item : items) {
			Recipe recipe = item.asRecipe();
			if (recipe == null) {
				continue;
			}
			Signature signature = Signature.of(recipe);
			Signature previous = signatures.put(recipe.getName(), signature);
			if (previous != null && !previous.equals(signature)) {
				LOG.warn(
						"Recipe {} has different parameters than other versions of the same recipe. "
								+ "Only the parameters for the last version of the recipe in the file will be listed.",
						recipe.getName());
			}
		}
		return signatures;
	}

	/**
	 * @param items parsed justfile
	 * @return the aliases of each aliased recipe, in source order
	 */
	public Map<String, List<String>> collectAliases(List<Item> items) {
		Map<String, List<String>> aliases = new LinkedHashMap<String, List<String>>();
		for (Item item : items) {
			Alias alias = item.asAlias();
			if (alias == null) {
				continue;
			}
			List<String> names = aliases.get(alias.getTarget());
			if (names == null) {
				names = new ArrayList<String>();
				aliases.put(alias.getTarget(), names);
			}
			names.add(alias.getName());
		}
		return aliases;
	}

	/**
	 * @param items parsed justfile
	 * @param signatures result of {@link #collectSignatures(List)}
	 * @return the signatures, plus the one of each alias of a known recipe
	 */
	public Map<String, Signature> inheritSignatures(List<Item> items, Map<String, Signature> signatures) {
		Map<String, Signature> result = new LinkedHashMap<String, Signature>(signatures);
		for (Item item : items) {
			Alias alias = item.asAlias();
			if (alias != null && result.containsKey(alias.getTarget())) {
				result.put(alias.getName(), result.get(alias.getTarget()));
			}
		}
		return result;
	}

	/**
	 * @param recipes result of {@link #collectRecipes(List, Settings)}
	 * @param privateNames result of {@link #collectPrivateNames(List)}
	 * @return public recipe names, once each, in source order
	 */
	public List<String> uniqueRecipes(List<String> recipes, Set<String> privateNames) {
		Set<String> unique = new LinkedHashSet<String>();
		for (String recipe : recipes) {
			if (!privateNames.contains(recipe)) {
				unique.add(recipe);
			}
		}
		return new ArrayList<String>(unique);
	}

	/**
	 * @param recipes result of {@link #collectRecipes(List, Settings)}
	 * @param aliases result of {@link #collectAliases(List)}
	 * @return every name the script answers to, once each, in source order,
	 *         each recipe followed by its aliases in alphabetical order
	 */
	public List<String> uniqueTargets(List<String> recipes, Map<String, List<String>> aliases) {
		Set<String> seen = new LinkedHashSet<String>();
		for (String recipe : recipes) {
			if (seen.add(recipe)) {
				for (String alias : sortedAliases(aliases, recipe)) {
					seen.add(alias);
				}
			}
		}
		return new ArrayList<String>(seen);
	}

	/**
	 * @param recipes result of {@link #collectRecipes(List, Settings)}
	 * @param aliases result of {@link #collectAliases(List)}
	 * @param privateNames result of {@link #collectPrivateNames(List)}
	 * @return public names, once each, recipes in alphabetical order, each
	 *         followed by its aliases in alphabetical order
	 */
	public List<String> sortedUniqueTargets(List<String> recipes, Map<String, List<String>> aliases, Set<String> privateNames) {
		List<String> sorted = new ArrayList<String>(recipes);
		Collections.sort(sorted);
		Set<String> seen = new HashSet<String>();
		List<String> targets = new ArrayList<String>();
		for (String recipe : sorted) {
			if (!seen.add(recipe)) {
				continue;
			}
			if (!privateNames.contains(recipe)) {
				targets.add(recipe);
			}
			for (String alias : sortedAliases(aliases, recipe)) {
				if (!privateNames.contains(alias) && seen.add(alias)) {
					targets.add(alias);
				}
			}
		}
		return targets;
	}

	private static List<String> sortedAliases(Map<String, List<String>> aliases, String recipe) {
		List<String> names = aliases.get(recipe);
		if (names == null) {
			return Collections.emptyList();
		}
		List<String> sorted = new ArrayList<String>(names);
		Collections.sort(sorted);
		return sorted;
	}

	/**
	 * Walks every expression reachable from a declaration and records the
	 * shell functions it needs.
	 */
	private final class FunctionCollector extends DeclarationVisitor.Default<Void> implements ExpressionVisitor<Void> {

		private final Map<String, ShellFunction> functions;
		private final int lineNumber;

		FunctionCollector(Map<String, ShellFunction> functions, int lineNumber) {
			this.functions = functions;
			this.lineNumber = lineNumber;
		}

		private void walk(Expression expression) {
			if (expression != null) {
				expression.accept(this);
			}
		}

		@Override
		public Void visitRecipe(Recipe recipe) {
			for (Parameter parameter : recipe.getParameters()) {
				walk(parameter.getDefaultValue());
			}
			if (recipe.getVariadic() != null) {
				walk(recipe.getVariadic().getParameter().getDefaultValue());
			}
			List<Dependency> dependencies = new ArrayList<Dependency>(recipe.getBeforeDependencies());
			dependencies.addAll(recipe.getAfterDependencies());
			for (Dependency dependency : dependencies) {
				for (Expression argument : dependency.getArguments()) {
					walk(argument);
				}
			}
			for (RecipeLine line : recipe.getBody()) {
				for (Fragment fragment : line.getFragments()) {
					walk(fragment.getExpression());
				}
			}
			return null;
		}

		@Override
		public Void visitAssignment(Assignment assignment) {
			walk(assignment.getValue());
			return null;
		}

		@Override
		public Void visitExport(Export export) {
			return visitAssignment(export.getAssignment());
		}

		@Override
		public Void visitString(StringLiteral string) {
			return null;
		}

		@Override
		public Void visitVariable(Variable variable) {
			return null;
		}

		@Override
		public Void visitSum(Sum sum) {
			walk(sum.getLeft());
			walk(sum.getRight());
			return null;
		}

		@Override
		public Void visitDiv(Div div) {
			walk(div.getLeft());
			walk(div.getRight());
			if (div.getLeft().literalValue() == null && !functions.containsKey(BuiltinCatalog.PATH_PREFIX)) {
				functions.put(
						BuiltinCatalog.PATH_PREFIX,
						ShellFunction.internal(BuiltinCatalog.PATH_PREFIX, BuiltinCatalog.internalSnippet(BuiltinCatalog.PATH_PREFIX)));
			}
			return null;
		}

		@Override
		public Void visitBacktick(Backtick backtick) {
			if (!functions.containsKey(BuiltinCatalog.BACKTICK_ERROR)) {
				functions.put(
						BuiltinCatalog.BACKTICK_ERROR,
						ShellFunction.internal(BuiltinCatalog.BACKTICK_ERROR, BuiltinCatalog.internalSnippet(BuiltinCatalog.BACKTICK_ERROR)));
			}
			return null;
		}

		@Override
		public Void visitConditional(Conditional conditional) {
			walk(conditional.getCondition().getLeft());
			walk(conditional.getCondition().getRight());
			walk(conditional.getThenValue());
			walk(conditional.getElseValue());
			String name = evaluator.conditionalName(conditional);
			if (!functions.containsKey(name)) {
				functions.put(name, ShellFunction.conditional(name, conditional));
			}
			return null;
		}

		@Override
		public Void visitFunctionCall(FunctionCall call) {
			BuiltinFunction function = BuiltinCatalog.get(call.getName());
			if (function == null) {
				throw new SemanticException(lineNumber, "Call to unknown function `" + call.getName() + "`");
			}
			try {
				function.verifyArgCount(call.getArguments().size());
			} catch (IllegalArgumentException e) {
				throw new SemanticException(lineNumber, e.getMessage());
			}
			addBuiltin(functions, function.getName());
			for (Expression argument : call.getArguments()) {
				walk(argument);
			}
			return null;
		}
	}
}

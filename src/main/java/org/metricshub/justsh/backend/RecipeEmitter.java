package org.metricshub.justsh.backend;

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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.justsh.frontend.ast.Alias;
import org.metricshub.justsh.frontend.ast.Comment;
import org.metricshub.justsh.frontend.ast.DeclarationVisitor;
import org.metricshub.justsh.frontend.ast.Dependency;
import org.metricshub.justsh.frontend.ast.Expression;
import org.metricshub.justsh.frontend.ast.Fragment;
import org.metricshub.justsh.frontend.ast.Item;
import org.metricshub.justsh.frontend.ast.Parameter;
import org.metricshub.justsh.frontend.ast.Recipe;
import org.metricshub.justsh.frontend.ast.RecipeLine;
import org.metricshub.justsh.frontend.ast.Variadic;
import org.metricshub.justsh.semantic.JustfileAnalysis;
import org.metricshub.justsh.semantic.Platform;
import org.metricshub.justsh.semantic.Settings;
import org.metricshub.justsh.util.JustShLogger;
import org.slf4j.Logger;

/**
 * Renders the "Recipes" section of the generated script: one function per
 * recipe or platform variant, the source comments found between them, one
 * wrapper per alias and one dispatcher per group of platform variants.
 * <p>
 * A recipe function runs at most once per script invocation unless its
 * <code>FORCE_</code> flag is set. It checks and binds its arguments, runs
 * its before-dependencies, changes to the invocation directory, runs its
 * body, changes back and finally runs its after-dependencies.
 */
class RecipeEmitter {

	private static final Logger LOG = JustShLogger.getLogger(RecipeEmitter.class);

	private static final String JUST_COMMAND = "just ";

	private final JustfileAnalysis analysis;
	private final ExpressionEvaluator evaluator;
	private final NameSanitizer names;
	private final Settings settings;

	RecipeEmitter(JustfileAnalysis analysis, ExpressionEvaluator evaluator) {
		this.analysis = analysis;
		this.evaluator = evaluator;
		this.names = evaluator.getSanitizer();
		this.settings = analysis.getSettings();
	}

	/**
	 * @return the section, starting with its header comment
	 */
	String emit() {
		final List<String> blocks = new ArrayList<String>();
		for (final Item item : analysis.getItems()) {
			String block = item.getDeclaration().accept(new DeclarationVisitor.Default<String>() {
				@Override
				public String visitRecipe(Recipe recipe) {
					return recipe(recipe, item);
				}

				@Override
				public String visitAlias(Alias alias) {
					return alias(alias);
				}

				@Override
				public String visitComment(Comment comment) {
					LOG
							.warn(
									"Comments may be in unexpected places in the generated script. "
											+ "They are placed relative to recipes, not variable assignments or settings, "
											+ "which may be moved around.");
					return "# " + comment.getText();
				}
			});
			if (block != null) {
				blocks.add(block);
			}
		}
		for (Map.Entry<String, Map<Platform, String>> entry : analysis.getPlatformVariants().entrySet()) {
			blocks.add(dispatcher(entry.getKey(), entry.getValue()));
		}
		return "\n" + ShellQuoting.headerComment("Recipes") + "\n\n" + join(blocks, "\n\n");
	}

	/**
	 * Renders a parameter the way usage messages and listings show it, as
	 * a sequence of quoted shell words with color codes.
	 *
	 * @param parameter the parameter
	 * @param variadic its variadic wrapper, or {@code null}
	 * @return shell text printing the parameter
	 */
	static String displayParameter(Parameter parameter, Variadic variadic) {
		StringBuilder sb = new StringBuilder();
		if (variadic != null) {
			sb.append("\"${PINK}\"").append(ShellQuoting.singleQuote(String.valueOf(variadic.getKind().getSymbol()))).append("\"${NOCOLOR}\"");
		}
		if (parameter.isExported()) {
			sb.append("'$'");
		}
		sb.append("\"${CYAN}\"").append(ShellQuoting.singleQuote(parameter.getName())).append("\"${NOCOLOR}\"");
		if (parameter.hasDefault()) {
			sb
					.append("'='\"${GREEN}\"")
					.append(ShellQuoting.singleQuote(ExpressionPrinter.print(parameter.getDefaultValue())))
					.append("\"${NOCOLOR}\"");
		}
		return sb.toString();
	}

	/**
	 * @param parameters fixed parameters
	 * @param variadic trailing variadic parameter, or {@code null}
	 * @return the display of every parameter, in order
	 */
	static List<String> displayParameters(List<Parameter> parameters, Variadic variadic) {
		List<String> display = new ArrayList<String>();
		for (Parameter parameter : parameters) {
			display.add(displayParameter(parameter, null));
		}
		if (variadic != null) {
			display.add(displayParameter(variadic.getParameter(), variadic));
		}
		return display;
	}

	private String recipe(Recipe recipe, Item item) {
		Set<Platform> platforms = Platform.of(item.getAttributes());
		String functionName = names.function(Platform.variantName(recipe.getName(), platforms));
		boolean noCd = item.hasAttribute(Item.ATTRIBUTE_NO_CD);
		boolean noExitMessage = item.hasAttribute(Item.ATTRIBUTE_NO_EXIT_MESSAGE);

		StringBuilder sb = new StringBuilder();
		sb.append(functionName).append("() {\n");
		sb.append("  # Recipe setup and pre-recipe dependencies\n");
		sb.append(preamble(recipe, functionName));
		if (!noCd) {
			sb.append("\n\n  OLD_WD=\"$(pwd)\"\n  cd \"${INVOCATION_DIRECTORY}\"");
		}
		sb.append("\n\n  # Recipe body\n");
		if (recipe.isShebang()) {
			sb.append(tempfileBody(recipe, noExitMessage));
		} else {
			sb.append(regularBody(recipe, noCd, noExitMessage));
		}
		sb.append("\n\n  # Post-recipe dependencies and teardown\n");
		sb.append(epilogue(recipe, functionName, noCd));
		sb.append("\n}");
		return sb.toString();
	}

	private String preamble(Recipe recipe, String functionName) {
		StringBuilder sb = new StringBuilder();
		sb.append("  test -z \"${").append(names.hasRun(recipe.getName())).append(":-}\" \\\n");
		sb.append("    || test \"${").append(names.force(recipe.getName())).append(":-}\" = \"true\" \\\n");
		sb.append("    || return 0");
		if (!recipe.getParameters().isEmpty() || recipe.getVariadic() != null) {
			sb
					.append("\n\n")
					.append(minimumArguments(recipe))
					.append(saveParameterVariables(recipe, functionName))
					.append(parameterAssignments(recipe));
		}
		if (!recipe.getBeforeDependencies().isEmpty()) {
			List<String> dependencies = new ArrayList<String>();
			for (Dependency dependency : recipe.getBeforeDependencies()) {
				dependencies.add(beforeDependency(recipe, dependency));
			}
			sb.append("\n\n").append(join(dependencies, "\n"));
		}
		return sb.toString();
	}

	private String minimumArguments(Recipe recipe) {
		int minimum = recipe.getMinimumArgumentCount();
		if (minimum == 0) {
			return "";
		}
		String atLeast = recipe.getVariadic() != null || recipe.getDefaultedParameterCount() > 0 ? "at least " : "";
		List<String> display = displayParameters(recipe.getParameters(), recipe.getVariadic());
		StringBuilder sb = new StringBuilder();
		sb.append("  if [ \"${#}\" -lt ").append(minimum).append(" ]; then\n");
		sb.append("    (\n");
		sb
				.append("      echo_error ")
				.append(ShellQuoting.singleQuote("Recipe `" + recipe.getName() + "`"))
				.append("\" got ${#} arguments but takes ")
				.append(atLeast)
				.append(minimum)
				.append("\"\n");
		sb.append("      echo \"${BOLD}usage:${NOCOLOR}\"\n");
		sb
				.append("      echo \"    ${0} \"")
				.append(ShellQuoting.singleQuote(recipe.getName() + " "))
				.append(join(display, "' '"))
				.append('\n');
		sb.append("    ) >&2\n");
		sb.append("    exit 1\n");
		sb.append("  fi\n");
		return sb.toString();
	}

	/**
	 * Parameters share the variable namespace, so the caller's values are
	 * saved on entry and put back by {@link #restoreParameterVariables}.
	 */
	private String saveParameterVariables(Recipe recipe, String functionName) {
		StringBuilder sb = new StringBuilder();
		List<String> variables = parameterVariables(recipe);
		for (int i = 0; i < variables.size(); i++) {
			sb
					.append("  ")
					.append(savedVariable(functionName, i))
					.append("=\"${")
					.append(variables.get(i))
					.append(":-}\"\n");
		}
		return sb.toString();
	}

	private String restoreParameterVariables(Recipe recipe, String functionName) {
		StringBuilder sb = new StringBuilder();
		List<String> variables = parameterVariables(recipe);
		for (int i = 0; i < variables.size(); i++) {
			sb
					.append("  ")
					.append(variables.get(i))
					.append("=\"${")
					.append(savedVariable(functionName, i))
					.append("}\"\n");
		}
		return sb.toString();
	}

	private List<String> parameterVariables(Recipe recipe) {
		List<String> variables = new ArrayList<String>();
		for (Parameter parameter : recipe.getParameters()) {
			variables.add(names.variable(parameter.getName()));
		}
		if (recipe.getVariadic() != null) {
			variables.add(names.variable(recipe.getVariadic().getParameter().getName()));
		}
		return variables;
	}

	private static String savedVariable(String functionName, int index) {
		return "SAVED_" + functionName + "_" + (index + 1);
	}

	private String parameterAssignments(Recipe recipe) {
		List<String> lines = new ArrayList<String>();
		List<Parameter> parameters = recipe.getParameters();
		for (int i = 0; i < parameters.size(); i++) {
			Parameter parameter = parameters.get(i);
			String variable = names.variable(parameter.getName());
			lines.add("  " + variable + "=\"${" + (i + 1) + ":-}\"");
			if (parameter.hasDefault()) {
				lines
						.add(
								"  if [ \"${#}\" -lt " + (i + 1) + " ]; then\n"
										+ "    " + variable + "=" + evaluator.evaluate(parameter.getDefaultValue()) + "\n"
										+ "  fi");
			}
		}
		Variadic variadic = recipe.getVariadic();
		if (variadic != null) {
			Parameter parameter = variadic.getParameter();
			if (!parameters.isEmpty()) {
				lines
						.add(
								"  if [ \"${#}\" -ge " + parameters.size() + " ]; then\n"
										+ "    shift " + parameters.size() + "\n"
										+ "  elif [ \"${#}\" -gt 0 ]; then\n"
										+ "    shift \"${#}\"\n"
										+ "  fi");
			}
			if (parameter.hasDefault()) {
				lines
						.add(
								"  if [ \"${#}\" -lt 1 ]; then\n"
										+ "    set -- " + evaluator.evaluate(parameter.getDefaultValue()) + "\n"
										+ "  fi");
			}
			lines.add("  " + names.variable(parameter.getName()) + "=\"${*:-}\"");
		}
		return join(lines, "\n");
	}

	private String dependencyCall(Dependency dependency) {
		StringBuilder sb = new StringBuilder(names.function(dependency.getName()));
		for (Expression argument : dependency.getArguments()) {
			sb.append(' ').append(evaluator.evaluate(argument));
		}
		return sb.toString();
	}

	private String beforeDependency(Recipe recipe, Dependency dependency) {
		String forceRecipe = names.force(recipe.getName());
		String forceDependency = names.force(dependency.getName());
		return "  if [ \"${" + forceRecipe + ":-}\" = \"true\" ]; then\n"
				+ "    " + forceDependency + "=\"true\"\n"
				+ "  fi\n"
				+ "  " + dependencyCall(dependency) + "\n"
				+ "  if [ \"${" + forceRecipe + ":-}\" = \"true\" ]; then\n"
				+ "    " + forceDependency + "=\n"
				+ "  fi";
	}

	private String epilogue(Recipe recipe, String functionName, boolean noCd) {
		StringBuilder sb = new StringBuilder();
		if (!noCd) {
			sb.append("  cd \"${OLD_WD}\"\n");
		}
		sb.append(restoreParameterVariables(recipe, functionName));
		if (!recipe.getAfterDependencies().isEmpty()) {
			Set<String> seen = new HashSet<String>();
			List<String> lines = new ArrayList<String>();
			for (Dependency dependency : recipe.getAfterDependencies()) {
				if (seen.add(dependency.getName())) {
					String force = names.force(dependency.getName());
					lines.add("  " + force + "=\"true\"");
					lines.add("  " + dependencyCall(dependency));
					lines.add("  " + force + "=");
				}
			}
			sb.append('\n').append(join(lines, "\n")).append("\n\n");
		}
		sb.append("  if [ -z \"${").append(names.force(recipe.getName())).append(":-}\" ]; then\n");
		sb.append("    ").append(names.hasRun(recipe.getName())).append("=\"true\"\n");
		sb.append("  fi");
		return sb.toString();
	}

	private String interpolation(Recipe recipe, Fragment fragment, int index) {
		return "  INTERP_" + index + "=" + evaluator.evaluate(fragment.getExpression())
				+ " || recipe_error " + ShellQuoting.singleQuote(recipe.getName()) + " \"${LINENO:-}\"";
	}

	private static String interpolationReference(int index) {
		return ShellQuoting.doubleQuote("${INTERP_" + index + "}");
	}

	private String tempfileBody(Recipe recipe, boolean noExitMessage) {
		List<String> lines = new ArrayList<String>();
		lines.add("  TEMPFILE=\"$(mktemp)\"");
		lines.add("  touch \"${TEMPFILE}\"");
		lines.add("  chmod +x \"${TEMPFILE}\"");

		StringBuilder script = new StringBuilder();
		StringBuilder text = new StringBuilder();
		int index = 1;
		List<RecipeLine> body = recipe.getBody();
		for (int i = 0; i < body.size(); i++) {
			if (i > 0) {
				text.append('\n');
			}
			for (Fragment fragment : body.get(i).getFragments()) {
				if (fragment.isInterpolation()) {
					lines.add(interpolation(recipe, fragment, index));
					if (text.length() > 0) {
						script.append(ShellQuoting.singleQuote(text.toString()));
						text.setLength(0);
					}
					script.append(interpolationReference(index));
					index++;
				} else {
					text.append(fragment.getText());
				}
			}
		}
		if (text.length() > 0) {
			script.append(ShellQuoting.singleQuote(text.toString()));
		}
		lines.add("  echo " + script + " > \"${TEMPFILE}\"");
		if (!recipe.isEcho()) {
			lines.add("  cat \"${TEMPFILE}\" >&2");
		}
		String command = "  env " + exports(recipe) + "\"${TEMPFILE}\"" + positionalArguments(recipe, false);
		if (noExitMessage) {
			lines.add(command);
		} else {
			lines.add(command + " \\");
			lines.add("    || recipe_error " + ShellQuoting.doubleQuote(recipe.getName()));
		}
		lines.add("  rm \"${TEMPFILE}\"");
		return join(lines, "\n");
	}

	private String regularBody(Recipe recipe, boolean noCd, boolean noExitMessage) {
		List<String> lines = new ArrayList<String>();
		int index = 1;
		for (RecipeLine line : recipe.getBody()) {
			if (settings.isIgnoreComments() && line.startsWithText("#")) {
				continue;
			}
			StringBuilder command = new StringBuilder();
			List<Fragment> fragments = line.getFragments();
			for (int i = 0; i < fragments.size(); i++) {
				Fragment fragment = fragments.get(i);
				if (fragment.isInterpolation()) {
					lines.add(interpolation(recipe, fragment, index));
					command.append(interpolationReference(index));
					index++;
					continue;
				}
				String text = fragment.getText();
				if (i == 0 && !settings.isSet(Settings.SHELL) && text.startsWith(JUST_COMMAND)) {
					command.append(noCd ? "\"${0}\"" : "\"./$(basename \"${0}\")\"");
					text = text.substring(JUST_COMMAND.length() - 1);
				}
				command.append(evaluator.evaluate(text));
			}
			if (recipe.isEcho() ^ line.isEchoToggled()) {
				lines.add("  echo_recipe_line " + command);
			}
			lines.add("  env " + exports(recipe) + "\"${DEFAULT_SHELL}\" ${DEFAULT_SHELL_ARGS} \\");
			String invocation = "    " + command + positionalArguments(recipe, true);
			if (line.isErrorIgnored()) {
				lines.add(invocation + " \\");
				lines.add("    || true");
			} else if (noExitMessage) {
				lines.add(invocation);
			} else {
				lines.add(invocation + " \\");
				lines.add("    || recipe_error " + ShellQuoting.doubleQuote(recipe.getName()) + " \"${LINENO:-}\"");
			}
		}
		return join(lines, "\n");
	}

	/**
	 * @return <code>NAME=value</code> words for <code>env</code>, each on its
	 *         own continued line, or an empty string
	 */
	private String exports(Recipe recipe) {
		List<String> exported = new ArrayList<String>(analysis.getExports());
		if (settings.isExport()) {
			exported.addAll(analysis.getVariables().keySet());
		}
		for (Parameter parameter : recipe.getParameters()) {
			if (parameter.isExported() || settings.isExport()) {
				exported.add(parameter.getName());
			}
		}
		Variadic variadic = recipe.getVariadic();
		if (variadic != null && (variadic.getParameter().isExported() || settings.isExport())) {
			exported.add(variadic.getParameter().getName());
		}
		if (exported.isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder("\\\n");
		for (String name : exported) {
			sb
					.append("    \"")
					.append(names.plain(name))
					.append("=${")
					.append(names.variable(name))
					.append("}\" \\\n");
		}
		return sb.append("    ").toString();
	}

	private String positionalArguments(Recipe recipe, boolean withRecipeName) {
		if (!settings.isPositionalArguments()) {
			return "";
		}
		StringBuilder sb = new StringBuilder();
		if (withRecipeName) {
			sb.append(' ').append(ShellQuoting.singleQuote(recipe.getName()));
		}
		for (Parameter parameter : recipe.getParameters()) {
			sb.append(" \"${").append(names.variable(parameter.getName())).append("}\"");
		}
		if (recipe.getVariadic() != null) {
			sb.append(" \"${@}\"");
		}
		return sb.toString();
	}

	private String alias(Alias alias) {
		return names.function(alias.getName()) + "() {\n"
				+ "  " + names.function(alias.getTarget()) + " \"$@\"\n"
				+ "}";
	}

	private String dispatcher(String recipeName, Map<Platform, String> variants) {
		StringBuilder sb = new StringBuilder();
		sb.append(names.function(recipeName)).append("() {\n");
		boolean first = true;
		for (Map.Entry<Platform, String> variant : variants.entrySet()) {
			Platform platform = variant.getKey();
			sb
					.append(first ? "  if" : "  elif")
					.append(" [ \"$(")
					.append(platform.getDetectionFunction())
					.append(")\" = ")
					.append(ShellQuoting.singleQuote(platform.getAttribute()))
					.append(" ]; then\n");
			sb.append("    ").append(names.function(variant.getValue())).append(" \"$@\"\n");
			first = false;
		}
		sb.append("  else\n");
		sb.append("    echo_error \"Justfile does not contain recipe \"").append(ShellQuoting.singleQuote("`" + recipeName + "`.")).append('\n');
		sb.append("    exit 1\n");
		sb.append("  fi\n");
		sb.append('}');
		return sb.toString();
	}

	static String join(List<String> parts, String separator) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < parts.size(); i++) {
			if (i > 0) {
				sb.append(separator);
			}
			sb.append(parts.get(i));
		}
		return sb.toString();
	}
}

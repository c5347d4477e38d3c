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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.metricshub.justsh.frontend.ast.Expression;
import org.metricshub.justsh.semantic.JustfileAnalysis;
import org.metricshub.justsh.semantic.Settings;
import org.metricshub.justsh.semantic.ShellFunction;
import org.metricshub.justsh.semantic.Signature;
import org.metricshub.justsh.util.CompileSettings;
import org.metricshub.justsh.util.JustShLogger;
import org.slf4j.Logger;

/**
 * Writes the POSIX shell script implementing an analyzed justfile.
 * <p>
 * The script is laid out in sections, each under a boxed header comment:
 * <ol>
 * <li>the shell functions called by expressions;
 * <li>the variables, in a function evaluating them once on demand;
 * <li>the recipes (see {@link RecipeEmitter});
 * <li>helpers for messages, listings, <code>--dump</code>,
 * <code>--evaluate</code> and <code>--choose</code>;
 * <li>the command line loop (see {@link EntrypointEmitter}).
 * </ol>
 * A banner naming the tool, its version and the generation date opens and
 * closes the script.
 */
public class ScriptGenerator {

	private static final Logger LOG = JustShLogger.getLogger(ScriptGenerator.class);

	private static final String RESOURCE_DIRECTORY = "/org/metricshub/justsh/backend/";

	private static final String DEFAULT_SHELL = "sh";
	private static final String DEFAULT_SHELL_ARGS = "-cu";

	private static final String[][] COLORS = {
			{ "NOCOLOR", "\\033[m" },
			{ "BOLD", "\\033[1m" },
			{ "RED", "\\033[1m\\033[31m" },
			{ "YELLOW", "\\033[33m" },
			{ "CYAN", "\\033[36m" },
			{ "GREEN", "\\033[32m" },
			{ "PINK", "\\033[35m" },
			{ "BLUE", "\\033[34m" } };

	private final ExpressionEvaluator evaluator;
	private final CompileSettings settings;

	/**
	 * <p>
	 * Constructor for ScriptGenerator.
	 * </p>
	 *
	 * @param evaluator evaluator of the compilation, shared with the analyzer
	 * @param settings supplies the banner date and the tool version
	 */
	public ScriptGenerator(ExpressionEvaluator evaluator, CompileSettings settings) {
		this.evaluator = evaluator;
		this.settings = settings;
	}

	/**
	 * @param analysis the analyzed justfile
	 * @param justfile exact text of the justfile, printed back by <code>--dump</code>
	 * @param scriptName file name of the generated script
	 * @return the complete script
	 */
	public String generate(JustfileAnalysis analysis, String justfile, String scriptName) {
		LOG.debug("Generating {} for {} recipes", scriptName, analysis.getRecipes().size());
		String banner = banner(scriptName);
		StringBuilder sb = new StringBuilder();
		sb.append("#!/bin/sh\n\n");
		sb.append(banner).append("\n\n");
		sb.append("set -eu\n");
		sb.append("if (set -o pipefail) 2> /dev/null; then set -o pipefail; fi");
		sb.append(functions(analysis)).append("\n\n");
		sb.append(variables(analysis)).append("\n\n");
		sb.append(new RecipeEmitter(analysis, evaluator).emit()).append("\n\n");
		sb.append(helpers(analysis, justfile, scriptName)).append("\n\n");
		sb.append(new EntrypointEmitter(analysis, evaluator.getSanitizer(), settings.getToolVersion()).emit());
		sb.append("\n\n\n").append(banner).append("\n\n");
		return sb.toString();
	}

	private String banner(String scriptName) {
		String date = LocalDate.now(settings.getClock()).format(DateTimeFormatter.ISO_LOCAL_DATE);
		return ShellQuoting
				.headerComment(
						"\nThis script was auto-generated from a Justfile by justsh.\n\n"
								+ "Generated on " + date + " with justsh version " + settings.getToolVersion() + ".\n\n"
								+ "Run `./" + scriptName + " --dump` to recover the original Justfile.\n\n");
	}

	private String functions(JustfileAnalysis analysis) {
		if (analysis.getFunctions().isEmpty()) {
			return "";
		}
		List<String> snippets = new ArrayList<String>();
		for (ShellFunction function : analysis.getFunctions().values()) {
			if (function.isConditional()) {
				snippets.add(evaluator.conditionalFunction(function.getName(), function.getConditional()));
			} else {
				snippets.add(function.getSnippet());
			}
		}
		return "\n\n" + ShellQuoting.headerComment("Internal functions") + "\n\n" + RecipeEmitter.join(snippets, "\n");
	}

	private String variables(JustfileAnalysis analysis) {
		Settings justfileSettings = analysis.getSettings();
		StringBuilder sb = new StringBuilder();
		sb.append(ShellQuoting.headerComment("Variables")).append('\n');
		if (justfileSettings.isDotenvLoad()) {
			sb.append('\n');
			sb.append("# Source a `.env` file\n");
			sb.append("TEMP_DOTENV=\"$(mktemp)\"\n");
			sb.append("sed 's/^/export /g' ./.env > \"${TEMP_DOTENV}\"\n");
			sb.append(". \"${TEMP_DOTENV}\"\n");
			sb.append("rm \"${TEMP_DOTENV}\"\n");
		}
		sb.append('\n');
		sb.append("# User-overwritable variables (via CLI)\n");
		if (justfileSettings.getTempdir() != null) {
			sb.append("TMPDIR=").append(ShellQuoting.singleQuote(justfileSettings.getTempdir())).append('\n');
			sb.append("export TMPDIR\n");
		}
		String shell = DEFAULT_SHELL;
		String shellArgs = DEFAULT_SHELL_ARGS;
		List<String> shellSetting = justfileSettings.getShell();
		if (shellSetting != null) {
			shell = shellSetting.get(0);
			shellArgs = RecipeEmitter.join(shellSetting.subList(1, shellSetting.size()), " ");
		}
		sb.append("INVOCATION_DIRECTORY=\"$(pwd)\"\n");
		sb.append("DEFAULT_SHELL=").append(ShellQuoting.singleQuote(shell)).append('\n');
		sb.append("DEFAULT_SHELL_ARGS=").append(ShellQuoting.singleQuote(shellArgs)).append('\n');
		sb.append("LIST_HEADING='Available recipes:\n'\n");
		sb.append("LIST_PREFIX='    '\n");
		sb.append("CHOOSER='fzf'\n");
		sb.append("SORTED='true'\n");
		sb.append('\n');
		sb.append("# Display colors\n");
		sb.append("SHOW_COLOR='false'\n");
		sb.append("if [ -t 1 ]; then SHOW_COLOR='true'; fi\n");
		for (String[] color : COLORS) {
			sb
					.append(color[0])
					.append("=\"$(test \"${SHOW_COLOR}\" = 'true' && printf \"")
					.append(color[1])
					.append("\" || echo)\"\n");
		}
		sb.append("TICK=\"$(printf '%s' '`')\"\n");
		sb.append("DOLLAR=\"$(printf '%s' '$')\"\n");
		sb.append('\n');
		sb.append(assignVariables(analysis));
		return sb.toString();
	}

	private String assignVariables(JustfileAnalysis analysis) {
		NameSanitizer names = evaluator.getSanitizer();
		List<String> assignments = new ArrayList<String>();
		for (Map.Entry<String, Expression> variable : analysis.getVariables().entrySet()) {
			String name = variable.getKey();
			assignments
					.add(
							"  if [ -z \"${" + names.override(name) + ":-}\" ]; then\n"
									+ "    " + names.variable(name) + "=" + evaluator.evaluate(variable.getValue())
									+ " || exit \"${?}\"\n"
									+ "  fi");
		}
		if (assignments.isEmpty()) {
			assignments.add("  # No user-declared variables");
		}
		return "assign_variables() {\n"
				+ "  test -z \"${HAS_RUN_assign_variables:-}\" || return 0\n\n"
				+ RecipeEmitter.join(assignments, "\n") + "\n\n"
				+ "  HAS_RUN_assign_variables=\"true\"\n"
				+ "}";
	}

	private String helpers(JustfileAnalysis analysis, String justfile, String scriptName) {
		List<String> blocks = new ArrayList<String>();
		blocks.add(loadResource("helpers.sh"));
		blocks.add(setVar(analysis));
		blocks.add(summarize(analysis));
		blocks.add(loadResource("usage.sh").replace("@SCRIPT@", scriptName).replace("@VERSION@", settings.getToolVersion()));
		blocks.add(list(analysis));
		blocks.add(dump(justfile));
		blocks.add(evaluate(analysis));
		blocks.add(choose(analysis));
		StringBuilder sb = new StringBuilder();
		sb.append('\n').append(ShellQuoting.headerComment("Helper functions")).append("\n\n");
		for (int i = 0; i < blocks.size(); i++) {
			String block = blocks.get(i);
			if (block.endsWith("\n")) {
				block = block.substring(0, block.length() - 1);
			}
			if (i > 0) {
				sb.append("\n\n");
			}
			sb.append(block);
		}
		return sb.toString();
	}

	private String setVar(JustfileAnalysis analysis) {
		NameSanitizer names = evaluator.getSanitizer();
		StringBuilder sb = new StringBuilder();
		sb.append("set_var() {\n");
		sb.append("  case \"${1}\" in\n");
		for (String name : analysis.getVariables().keySet()) {
			sb.append("  ").append(ShellQuoting.singleQuote(name)).append(")\n");
			sb.append("    ").append(names.variable(name)).append("=\"${2}\"\n");
			sb.append("    ").append(names.override(name)).append("=\"true\"\n");
			sb.append("    ;;\n");
		}
		sb.append("  *)\n");
		sb.append("    echo_error 'Variable `'\"${1}\"'` overridden on the command line but not present in justfile'\n");
		sb.append("    exit 1\n");
		sb.append("    ;;\n");
		sb.append("  esac\n");
		sb.append('}');
		return sb.toString();
	}

	private static String summarize(JustfileAnalysis analysis) {
		List<String> recipes = analysis.getUniqueRecipes();
		String summary;
		if (recipes.isEmpty()) {
			summary = "  echo 'Justfile contains no recipes.' >&2\n";
		} else {
			List<String> sorted = new ArrayList<String>(recipes);
			Collections.sort(sorted);
			summary = "  if [ \"${SORTED}\" = \"true\" ]; then\n"
					+ "    printf \"%s \" " + RecipeEmitter.join(sorted, " ") + "\n"
					+ "  else\n"
					+ "    printf \"%s \" " + RecipeEmitter.join(recipes, " ") + "\n"
					+ "  fi\n"
					+ "  echo\n";
		}
		return "summarizefn() {\n"
				+ "  while [ \"$#\" -gt 0 ]; do\n"
				+ "    case \"${1}\" in\n"
				+ "    -u|--unsorted)\n"
				+ "      SORTED=\"false\"\n"
				+ "      ;;\n"
				+ "    esac\n"
				+ "    shift\n"
				+ "  done\n\n"
				+ summary
				+ "}";
	}

	private static String listEntry(JustfileAnalysis analysis, String target) {
		StringBuilder sb = new StringBuilder();
		sb.append("echo \"${LIST_PREFIX}\"").append(ShellQuoting.singleQuote(target));
		Signature signature = analysis.getSignature(target);
		if (!signature.isEmpty()) {
			sb
					.append("' '")
					.append(
							RecipeEmitter
									.join(RecipeEmitter.displayParameters(signature.getParameters(), signature.getVariadic()), "' '"));
		}
		sb.append("\"${BLUE}\"");
		String docstring = analysis.getDocstrings().get(target);
		if (docstring != null && !docstring.isEmpty()) {
			sb.append(ShellQuoting.singleQuote(" # " + docstring));
		}
		sb.append("\"${NOCOLOR}\"");
		return sb.toString();
	}

	private static String listEntries(JustfileAnalysis analysis, List<String> targets) {
		List<String> entries = new ArrayList<String>();
		for (String target : targets) {
			if (!analysis.isPrivate(target)) {
				entries.add(listEntry(analysis, target));
			}
		}
		return entries.isEmpty() ? "true" : RecipeEmitter.join(entries, "\n    ");
	}

	private static String list(JustfileAnalysis analysis) {
		return "listfn() {\n"
				+ "  while [ \"$#\" -gt 0 ]; do\n"
				+ "    case \"${1}\" in\n"
				+ "    --list-heading)\n"
				+ "      shift\n"
				+ "      LIST_HEADING=\"${1}\"\n"
				+ "      ;;\n"
				+ "\n"
				+ "    --list-prefix)\n"
				+ "      shift\n"
				+ "      LIST_PREFIX=\"${1}\"\n"
				+ "      ;;\n"
				+ "\n"
				+ "    -u|--unsorted)\n"
				+ "      SORTED=\"false\"\n"
				+ "      ;;\n"
				+ "    esac\n"
				+ "    shift\n"
				+ "  done\n"
				+ "\n"
				+ "  printf \"%s\" \"${LIST_HEADING}\"\n"
				+ "  if [ \"${SORTED}\" = \"true\" ]; then\n"
				+ "    " + listEntries(analysis, analysis.getSortedUniqueTargets()) + "\n"
				+ "  else\n"
				+ "    " + listEntries(analysis, analysis.getUniqueTargets()) + "\n"
				+ "  fi\n"
				+ "}";
	}

	/**
	 * Prints the justfile back byte for byte. The here-document delimiter
	 * is derived from the content so that the text cannot contain it.
	 */
	private static String dump(String justfile) {
		String delimiter = ShellQuoting.sha256Hex(justfile).substring(0, 16);
		if (justfile.endsWith("\n")) {
			return "dumpfn() {\n"
					+ "  cat <<\"" + delimiter + "\"\n"
					+ justfile
					+ delimiter + "\n"
					+ "}";
		}
		// the last line goes out without its newline
		return "dumpfn() {\n"
				+ "  cat <<\"" + delimiter + "\" | awk 'NR > 1 { print previous } { previous = $0 } END { printf \"%s\", previous }'\n"
				+ justfile + "\n"
				+ delimiter + "\n"
				+ "}";
	}

	private String evaluate(JustfileAnalysis analysis) {
		NameSanitizer names = evaluator.getSanitizer();
		Map<String, Expression> variables = analysis.getVariables();
		String all;
		String cases;
		if (variables.isEmpty()) {
			all = "true";
			cases = "# No user-declared variables";
		} else {
			int width = 0;
			for (String name : variables.keySet()) {
				width = Math.max(width, name.length());
			}
			List<String> sorted = new ArrayList<String>(variables.keySet());
			Collections.sort(sorted);
			List<String> lines = new ArrayList<String>();
			for (String name : sorted) {
				StringBuilder line = new StringBuilder("echo '").append(name);
				for (int i = name.length(); i <= width; i++) {
					line.append(' ');
				}
				line.append(":= \"'\"${").append(names.variable(name)).append("}\"'\"'");
				lines.add(line.toString());
			}
			all = RecipeEmitter.join(lines, "\n    ");
			List<String> matches = new ArrayList<String>();
			for (String name : variables.keySet()) {
				matches
						.add(
								ShellQuoting.singleQuote(name) + ")\n"
										+ "      printf \"%s\" \"${" + names.variable(name) + "}\"\n"
										+ "      ;;");
			}
			cases = RecipeEmitter.join(matches, "\n    ");
		}
		return "evaluatefn() {\n"
				+ "  assign_variables || exit \"${?}\"\n"
				+ "  if [ \"${#}\" = \"0\" ]; then\n"
				+ "    " + all + "\n"
				+ "  else\n"
				+ "    case \"${1}\" in\n"
				+ "    " + cases + "\n"
				+ "    *)\n"
				+ "      echo_error 'Justfile does not contain variable `'\"${1}\"'`.'\n"
				+ "      exit 1\n"
				+ "      ;;\n"
				+ "    esac\n"
				+ "  fi\n"
				+ "}";
	}

	private static String choose(JustfileAnalysis analysis) {
		StringBuilder targets = new StringBuilder();
		for (String target : analysis.getUniqueTargets()) {
			if (!analysis.isPrivate(target)) {
				targets.append(' ').append(ShellQuoting.singleQuote(target));
			}
		}
		return "choosefn() {\n"
				+ "  echo" + targets + " \\\n"
				+ "    | \"${DEFAULT_SHELL}\" ${DEFAULT_SHELL_ARGS} \"${CHOOSER}\"\n"
				+ "}";
	}

	static String loadResource(String name) {
		String resource = RESOURCE_DIRECTORY + name;
		try (InputStream in = ScriptGenerator.class.getResourceAsStream(resource)) {
			if (in == null) {
				throw new IllegalStateException("Missing script resource " + resource);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read script resource " + resource, e);
		}
	}
}

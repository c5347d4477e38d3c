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
import java.util.List;
import org.metricshub.justsh.semantic.JustfileAnalysis;
import org.metricshub.justsh.semantic.Signature;

/**
 * Renders the "Main entrypoint" section: the loop reading the command line
 * of the generated script, and the call of the default recipe when the
 * command line names none.
 */
class EntrypointEmitter {

	private static final String INIT_JUSTFILE = "default:\n    echo 'Hello, world!'\n";

	private final JustfileAnalysis analysis;
	private final NameSanitizer names;
	private final String toolVersion;

	EntrypointEmitter(JustfileAnalysis analysis, NameSanitizer names, String toolVersion) {
		this.analysis = analysis;
		this.names = names;
		this.toolVersion = toolVersion;
	}

	String emit() {
		List<String> cases = new ArrayList<String>();
		for (String target : analysis.getUniqueTargets()) {
			cases.add(targetCase(target));
		}
		StringBuilder sb = new StringBuilder();
		sb.append('\n').append(ShellQuoting.headerComment("Main entrypoint")).append("\n\n");
		sb.append("RUN_DEFAULT='true'\n");
		sb.append("while [ \"${#}\" -gt 0 ]; do\n");
		sb.append("  case \"${1}\" in\n");
		sb.append("\n");
		sb.append("  # User-defined recipes\n");
		if (!cases.isEmpty()) {
			sb.append("  ").append(RecipeEmitter.join(cases, "\n\n  ")).append("\n");
		}
		sb.append("\n");
		sb.append("  # Built-in flags\n");
		sb.append(builtinFlags());
		sb.append("  esac\n");
		sb.append("done\n");
		sb.append("\n");
		sb.append("if [ \"${RUN_DEFAULT}\" = \"true\" ]; then\n");
		sb.append(defaultCall());
		sb.append("fi");
		return sb.toString();
	}

	private String targetCase(String target) {
		Signature signature = analysis.getSignature(target);
		StringBuilder sb = new StringBuilder();
		sb.append(target).append(")\n");
		sb.append("    shift\n");
		sb.append("    assign_variables || exit \"${?}\"\n");
		sb.append("    ").append(names.function(target)).append(" \"$@\"\n");
		sb.append("    RUN_DEFAULT='false'\n");
		if (signature.getVariadic() != null) {
			sb.append("    break\n");
		} else if (!signature.isEmpty()) {
			int count = signature.size();
			sb.append("    if [ \"${#}\" -ge \"").append(count).append("\" ]; then\n");
			sb.append("      shift ").append(count).append('\n');
			sb.append("    elif [ \"${#}\" -gt 0 ]; then\n");
			sb.append("      shift \"${#}\"\n");
			sb.append("    fi\n");
		}
		sb.append("    ;;");
		return sb.toString();
	}

	private String defaultCall() {
		if (analysis.getRecipes().isEmpty()) {
			return "  assign_variables || exit \"${?}\"\n  exit 1\n";
		}
		String recipe = analysis.getRecipes().get(0);
		int required = analysis.getSignature(recipe).getRequiredCount();
		StringBuilder sb = new StringBuilder();
		if (required > 0) {
			sb.append("  if [ \"${#}\" -lt \"").append(required).append("\" ]; then\n");
			sb
					.append("    echo_error ")
					.append(
							ShellQuoting
									.singleQuote(
											"Recipe `" + recipe + "` cannot be used as default recipe since it requires at least "
													+ required + " argument" + (required == 1 ? "" : "s") + "."))
					.append('\n');
			sb.append("    exit 1\n");
			sb.append("  fi\n");
		}
		sb.append("  assign_variables || exit \"${?}\"\n");
		sb.append("  ").append(names.function(recipe)).append(" \"$@\"\n");
		return sb.toString();
	}

	private String builtinFlags() {
		StringBuilder sb = new StringBuilder();
		flag(sb, "-l|--list", "shift", "listfn \"$@\"", "RUN_DEFAULT=\"false\"", "break");
		flag(sb, "--summary", "shift", "summarizefn \"$@\"", "RUN_DEFAULT=\"false\"", "break");
		flag(sb, "--list-heading", "shift", "LIST_HEADING=\"${1}\"", "shift");
		flag(sb, "--list-prefix", "shift", "LIST_PREFIX=\"${1}\"", "shift");
		flag(sb, "-u|--unsorted", "SORTED=\"false\"", "shift");
		flag(sb, "--shell", "shift", "DEFAULT_SHELL=\"${1}\"", "shift");
		flag(sb, "--shell-arg", "shift", "DEFAULT_SHELL_ARGS=\"${1}\"", "shift");
		flag(
				sb,
				"-V|--version",
				"shift",
				"echo " + ShellQuoting.singleQuote("justsh " + toolVersion),
				"RUN_DEFAULT=\"false\"",
				"break");
		flag(sb, "-h|--help", "shift", "usage", "RUN_DEFAULT=\"false\"", "break");
		flag(
				sb,
				"--choose",
				"shift",
				"assign_variables || exit \"${?}\"",
				"TARGET=\"$(choosefn)\"",
				"env \"${0}\" \"${TARGET}\" \"$@\"",
				"RUN_DEFAULT=\"false\"",
				"break");
		flag(sb, "--chooser", "shift", "CHOOSER=\"${1}\"", "shift");
		flag(
				sb,
				"*=*",
				"NAME=\"${1%%=*}\"",
				"VALUE=\"${1#*=}\"",
				"shift",
				"set_var \"${NAME}\" \"${VALUE}\"");
		flag(
				sb,
				"--set",
				"shift",
				"NAME=\"${1}\"",
				"shift",
				"VALUE=\"${1}\"",
				"shift",
				"set_var \"${NAME}\" \"${VALUE}\"");
		flag(sb, "--dump", "RUN_DEFAULT=\"false\"", "dumpfn \"$@\"", "break");
		flag(sb, "--evaluate", "shift", "RUN_DEFAULT=\"false\"", "evaluatefn \"$@\"", "break");
		flag(
				sb,
				"--init",
				"shift",
				"RUN_DEFAULT=\"false\"",
				"if [ -f \"justfile\" ]; then",
				"  echo_error \"Justfile \"'`'\"$(realpath \"justfile\")\"'`'\" already exists\"",
				"  exit 1",
				"fi",
				"printf '%s' " + ShellQuoting.singleQuote(INIT_JUSTFILE) + " > \"justfile\"",
				"echo 'Wrote justfile to `'\"$(realpath \"justfile\")\"'`'",
				"break");
		flag(
				sb,
				"-*",
				"echo_error \"Found argument '${NOCOLOR}${YELLOW}${1}${NOCOLOR}${BOLD}' that wasn't expected, "
						+ "or isn't valid in this context\"",
				"echo >&2",
				"err_usage",
				"exit 1");
		flag(
				sb,
				"*",
				"assign_variables || exit \"${?}\"",
				"echo_error 'Justfile does not contain recipe `'\"${1}\"'`.'",
				"exit 1");
		return sb.toString();
	}

	private static void flag(StringBuilder sb, String pattern, String... commands) {
		sb.append("  ").append(pattern).append(")\n");
		for (String command : commands) {
			sb.append("    ").append(command).append('\n');
		}
		sb.append("    ;;\n\n");
	}
}

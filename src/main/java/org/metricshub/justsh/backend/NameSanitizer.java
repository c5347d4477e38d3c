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

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps justfile identifiers to shell identifiers.
 * <p>
 * Every character other than an ASCII letter, digit or underscore becomes
 * an underscore. When two different source names end up the same way (for
 * instance <code>some-name</code> and <code>some_name</code>), the name seen
 * last gets a numeric suffix, starting at <code>_2</code>. Answers are
 * remembered, so asking twice for the same name gives the same identifier.
 * <p>
 * One instance covers one compilation.
 */
public class NameSanitizer {

	/** Prefix of variables and parameters. */
	public static final String VARIABLE_PREFIX = "VAR_";

	/** Prefix of recipe, variant, dispatcher and alias functions. */
	public static final String FUNCTION_PREFIX = "FUN_";

	/** Prefix of the flag set once a recipe has run. */
	public static final String HAS_RUN_PREFIX = "HAS_RUN_";

	/** Prefix of the flag forcing a recipe to run again. */
	public static final String FORCE_PREFIX = "FORCE_";

	/** Prefix of the flag set when a variable was given on the command line. */
	public static final String OVERRIDE_PREFIX = "OVERRIDE_";

	private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9_]");

	private final Map<String, String> bySource = new HashMap<String, String>();
	private final Map<String, String> byIdentifier = new HashMap<String, String>();

	/**
	 * @param prefix role prefix, possibly empty
	 * @param name identifier from the justfile
	 * @return a shell identifier unique to <code>prefix + name</code>
	 */
	public String sanitize(String prefix, String name) {
		String source = prefix + name;
		String known = bySource.get(source);
		if (known != null) {
			return known;
		}
		String base = DISALLOWED.matcher(source).replaceAll("_");
		String candidate = base;
		int suffix = 2;
		while (byIdentifier.containsKey(candidate)) {
			candidate = base + "_" + suffix;
			suffix++;
		}
		bySource.put(source, candidate);
		byIdentifier.put(candidate, source);
		return candidate;
	}

	/**
	 * @param name a name used as is, such as an exported environment variable
	 * @return its shell identifier
	 */
	public String plain(String name) {
		return sanitize("", name);
	}

	/**
	 * @param name a variable or parameter name
	 * @return the shell variable holding its value
	 */
	public String variable(String name) {
		return sanitize(VARIABLE_PREFIX, name);
	}

	/**
	 * @param name a variable name
	 * @return the shell flag set when the variable is overridden on the command line
	 */
	public String override(String name) {
		return OVERRIDE_PREFIX + variable(name);
	}

	/**
	 * @param name a recipe, variant or alias name
	 * @return the shell function running it
	 */
	public String function(String name) {
		return sanitize(FUNCTION_PREFIX, name);
	}

	/**
	 * @param name a recipe name
	 * @return the shell flag set once it has run
	 */
	public String hasRun(String name) {
		return sanitize(HAS_RUN_PREFIX, name);
	}

	/**
	 * @param name a recipe name
	 * @return the shell flag forcing it to run again
	 */
	public String force(String name) {
		return sanitize(FORCE_PREFIX, name);
	}
}

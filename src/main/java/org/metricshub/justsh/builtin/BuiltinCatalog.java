package org.metricshub.justsh.builtin;

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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The closed set of built-in functions a justfile may call.
 * <p>
 * Each function is a row of a fixed table: its name, its arity and the
 * shell snippet implementing it, read from the classpath resource
 * <code>org/metricshub/justsh/builtin/&lt;name&gt;.sh</code>. The catalog also
 * serves the internal snippets generated scripts rely on.
 */
public final class BuiltinCatalog {

	/** Internal helper reporting a failed backtick command. */
	public static final String BACKTICK_ERROR = "backtick_error";

	/** Internal helper appending a <code>/</code> to a path that lacks one. */
	public static final String PATH_PREFIX = "path_prefix";

	/** Built-in printing the current operating system. */
	public static final String OS = "os";

	/** Built-in printing the current operating system family. */
	public static final String OS_FAMILY = "os_family";

	private static final String RESOURCE_DIRECTORY = "/org/metricshub/justsh/builtin/";

	private static final Map<String, BuiltinFunction> FUNCTIONS;

	static {
		Map<String, BuiltinFunction> functions = new LinkedHashMap<String, BuiltinFunction>();
		// name, arity, accepts more
		register(functions, OS, 0, false);
		register(functions, OS_FAMILY, 0, false);
		register(functions, "arch", 0, false);
		register(functions, "uuid", 0, false);
		register(functions, "invocation_directory", 0, false);
		register(functions, "invocation_directory_native", 0, false);
		register(functions, "just_executable", 0, false);
		register(functions, "justfile", 0, false);
		register(functions, "justfile_directory", 0, false);
		register(functions, "env_var", 1, false);
		register(functions, "sha256", 1, false);
		register(functions, "sha256_file", 1, false);
		register(functions, "error", 1, false);
		register(functions, "path_exists", 1, false);
		register(functions, "quote", 1, false);
		register(functions, "uppercase", 1, false);
		register(functions, "lowercase", 1, false);
		register(functions, "env_var_or_default", 2, false);
		register(functions, "join", 2, true);
		FUNCTIONS = Collections.unmodifiableMap(functions);
	}

	private BuiltinCatalog() {}

	private static void register(Map<String, BuiltinFunction> functions, String name, int arity, boolean varArgs) {
		functions.put(name, new BuiltinFunction(name, loadSnippet(name), arity, varArgs));
	}

	/**
	 * Looks up a built-in function.
	 *
	 * @param name function name as written in the justfile
	 * @return the function, or {@code null} if there is no such built-in
	 */
	public static BuiltinFunction get(String name) {
		return FUNCTIONS.get(name);
	}

	/**
	 * Returns every built-in function, in catalog order.
	 *
	 * @return immutable view of the catalog
	 */
	public static Map<String, BuiltinFunction> listFunctions() {
		return FUNCTIONS;
	}

	/**
	 * Returns the source of an internal helper used by generated code, such
	 * as {@link #BACKTICK_ERROR} or {@link #PATH_PREFIX}.
	 *
	 * @param name helper name
	 * @return shell source of the helper, ending with a newline
	 */
	public static String internalSnippet(String name) {
		return loadSnippet(name);
	}

	static String loadSnippet(String name) {
		String resource = RESOURCE_DIRECTORY + name + ".sh";
		try (InputStream in = BuiltinCatalog.class.getResourceAsStream(resource)) {
			if (in == null) {
				throw new IllegalStateException("Missing shell snippet " + resource);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read shell snippet " + resource, e);
		}
	}
}

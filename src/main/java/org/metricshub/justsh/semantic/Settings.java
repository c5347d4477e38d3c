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
import java.util.List;
import java.util.Map;
import org.metricshub.justsh.frontend.ast.Setting;

/**
 * The validated <code>set</code> statements of a justfile. Settings that are
 * not present read as {@code false} or {@code null}.
 */
public final class Settings {

	public static final String ALLOW_DUPLICATE_RECIPES = "allow-duplicate-recipes";
	public static final String DOTENV_LOAD = "dotenv-load";
	public static final String EXPORT = "export";
	public static final String FALLBACK = "fallback";
	public static final String IGNORE_COMMENTS = "ignore-comments";
	public static final String POSITIONAL_ARGUMENTS = "positional-arguments";
	public static final String TEMPDIR = "tempdir";
	public static final String SHELL = "shell";
	public static final String WINDOWS_SHELL = "windows-shell";
	public static final String WINDOWS_POWERSHELL = "windows-powershell";

	private final Map<String, Setting> values;

	Settings(Map<String, Setting> values) {
		this.values = Collections.unmodifiableMap(new LinkedHashMap<String, Setting>(values));
	}

	/**
	 * @return every setting, keyed by name, in source order
	 */
	public Map<String, Setting> asMap() {
		return values;
	}

	public boolean isSet(String name) {
		return values.containsKey(name);
	}

	private boolean flag(String name) {
		Setting setting = values.get(name);
		return setting != null && setting.getBooleanValue();
	}

	public boolean isAllowDuplicateRecipes() {
		return flag(ALLOW_DUPLICATE_RECIPES);
	}

	public boolean isDotenvLoad() {
		return flag(DOTENV_LOAD);
	}

	/**
	 * @return whether every variable and parameter is exported to recipes
	 */
	public boolean isExport() {
		return flag(EXPORT);
	}

	public boolean isIgnoreComments() {
		return flag(IGNORE_COMMENTS);
	}

	public boolean isPositionalArguments() {
		return flag(POSITIONAL_ARGUMENTS);
	}

	/**
	 * @return the directory temporary files are created in, or {@code null}
	 */
	public String getTempdir() {
		Setting setting = values.get(TEMPDIR);
		return setting == null ? null : setting.getStringValue();
	}

	/**
	 * @return the shell command and its arguments, or {@code null} for the
	 *         default <code>sh -cu</code>
	 */
	public List<String> getShell() {
		Setting setting = values.get(SHELL);
		return setting == null ? null : new ArrayList<String>(setting.getListValue());
	}

	@Override
	public String toString() {
		return values.values().toString();
	}
}

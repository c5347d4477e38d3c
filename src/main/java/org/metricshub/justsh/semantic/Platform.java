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

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import org.metricshub.justsh.builtin.BuiltinCatalog;

/**
 * Operating system a recipe variant can be restricted to with an attribute.
 * Constants are declared in the order their attribute names sort.
 */
public enum Platform {
	LINUX("linux"),
	MACOS("macos"),
	UNIX("unix"),
	WINDOWS("windows");

	private final String attribute;

	Platform(String attribute) {
		this.attribute = attribute;
	}

	/**
	 * @return the attribute name, which is also what the <code>os</code> or
	 *         <code>os_family</code> built-in prints on that platform
	 */
	public String getAttribute() {
		return attribute;
	}

	/**
	 * @return the built-in the generated script calls to detect this platform
	 */
	public String getDetectionFunction() {
		return this == UNIX ? BuiltinCatalog.OS_FAMILY : BuiltinCatalog.OS;
	}

	/**
	 * @param attribute an attribute name
	 * @return the matching platform, or {@code null} for other attributes
	 */
	public static Platform fromAttribute(String attribute) {
		for (Platform platform : values()) {
			if (platform.attribute.equals(attribute)) {
				return platform;
			}
		}
		return null;
	}

	/**
	 * @param attributes attribute names of an item
	 * @return the platforms among them, in attribute-name order
	 */
	public static Set<Platform> of(Collection<String> attributes) {
		Set<Platform> platforms = EnumSet.noneOf(Platform.class);
		for (String attribute : attributes) {
			Platform platform = fromAttribute(attribute);
			if (platform != null) {
				platforms.add(platform);
			}
		}
		return platforms;
	}

	/**
	 * Names the variant of a recipe restricted to some platforms:
	 * <code>build</code> for <code>[linux, macos]</code> is
	 * <code>build_linux_macos</code>.
	 *
	 * @param recipeName name of the recipe
	 * @param platforms platforms of the variant; empty for a plain recipe
	 * @return the variant name, or <code>recipeName</code> when there are no platforms
	 */
	public static String variantName(String recipeName, Set<Platform> platforms) {
		StringBuilder name = new StringBuilder(recipeName);
		for (Platform platform : platforms) {
			name.append('_').append(platform.attribute);
		}
		return name.toString();
	}
}

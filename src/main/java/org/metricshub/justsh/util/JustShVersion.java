package org.metricshub.justsh.util;

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
import java.util.Properties;

/**
 * Version of this compiler, as stamped by the build into
 * <code>justsh-version.properties</code>.
 */
public final class JustShVersion {

	/** Value reported when the build did not provide a version. */
	public static final String UNKNOWN = "unknown";

	private static final String RESOURCE = "/justsh-version.properties";

	private static final String VERSION = load();

	private JustShVersion() {}

	/**
	 * @return the compiler version, or {@link #UNKNOWN}
	 */
	public static String get() {
		return VERSION;
	}

	private static String load() {
		try (InputStream in = JustShVersion.class.getResourceAsStream(RESOURCE)) {
			if (in == null) {
				return UNKNOWN;
			}
			Properties properties = new Properties();
			properties.load(in);
			String version = properties.getProperty("version");
			// an unfiltered resource still holds the raw placeholder
			if (version == null || version.isEmpty() || version.startsWith("${")) {
				return UNKNOWN;
			}
			return version;
		} catch (IOException e) {
			JustShLogger.getLogger(JustShVersion.class).warn("Unable to read {}: {}", RESOURCE, e.getMessage());
			return UNKNOWN;
		}
	}
}
